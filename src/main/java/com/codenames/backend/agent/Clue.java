package com.codenames.backend.agent;

import lombok.Value;

/**
 * What operatives are told about a clue: the word and how many cards it points at, never the targets.
 */
@Value
public class Clue {
    String word;
    int count;
}
