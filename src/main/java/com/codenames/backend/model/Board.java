package com.codenames.backend.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered card grid. Generated boards are 5x5 with a 9/8/7/1 split; fixture boards may be any size
 * as long as every word is unique.
 */
public class Board {

    public static final int SIZE = 25;
    public static final int STARTING_TEAM_CARDS = 9;
    public static final int SECOND_TEAM_CARDS = 8;
    public static final int NEUTRAL_CARDS = 7;
    public static final int ASSASSIN_CARDS = 1;

    private final List<Card> cards;

    public Board(List<Card> cards) {
        if (cards == null || cards.isEmpty()) {
            throw new IllegalArgumentException("Board needs at least one card");
        }
        Set<String> seen = new HashSet<>();
        for (Card card : cards) {
            if (!seen.add(card.getWord().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate board word: " + card.getWord());
            }
        }
        this.cards = Collections.unmodifiableList(new ArrayList<>(cards));
    }

    public List<Card> getCards() {
        return cards;
    }

    public int size() {
        return cards.size();
    }

    public Optional<Card> find(String word) {
        return cards.stream().filter(c -> c.matches(word)).findFirst();
    }

    public boolean contains(String word) {
        return find(word).isPresent();
    }

    /**
     * Reveals the unrevealed card matching {@code word}.
     *
     * @return the revealed card, or empty if no unrevealed card matches
     */
    public Optional<Card> reveal(String word) {
        Optional<Card> card = find(word).filter(c -> !c.isRevealed());
        card.ifPresent(Card::reveal);
        return card;
    }

    public int count(CardType type) {
        return (int) cards.stream().filter(c -> c.getType() == type).count();
    }

    public int countUnrevealed(CardType type) {
        return (int) cards.stream().filter(c -> c.getType() == type && !c.isRevealed()).count();
    }

    public List<String> unrevealedWords() {
        return cards.stream()
                .filter(c -> !c.isRevealed())
                .map(Card::getWord)
                .collect(Collectors.toList());
    }

    public boolean isStandardLayout() {
        if (cards.size() != SIZE || count(CardType.ASSASSIN) != ASSASSIN_CARDS
                || count(CardType.NEUTRAL) != NEUTRAL_CARDS) {
            return false;
        }
        int red = count(CardType.RED);
        int blue = count(CardType.BLUE);
        return Math.max(red, blue) == STARTING_TEAM_CARDS && Math.min(red, blue) == SECOND_TEAM_CARDS;
    }
}
