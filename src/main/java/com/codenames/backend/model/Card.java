package com.codenames.backend.model;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class Card {
    private final String word;
    private final CardType type;
    private boolean revealed;

    public Card(String word, CardType type) {
        this.word = word;
        this.type = type;
    }

    /** Revealing is one-way; there is no way back to hidden. */
    void reveal() {
        this.revealed = true;
    }

    public boolean matches(String candidate) {
        return candidate != null && word.equalsIgnoreCase(candidate.trim());
    }
}
