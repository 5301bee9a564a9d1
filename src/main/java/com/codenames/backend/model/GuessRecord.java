package com.codenames.backend.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class GuessRecord {
    Team team;
    String word;
    CardType revealedType;
    boolean correct;
}
