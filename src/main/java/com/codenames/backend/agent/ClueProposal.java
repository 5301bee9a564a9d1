package com.codenames.backend.agent;

import lombok.Value;

import java.util.List;

@Value
public class ClueProposal {
    String word;
    List<String> targetWords;

    public ClueProposal(String word, List<String> targetWords) {
        this.word = word;
        this.targetWords = targetWords == null ? List.of() : List.copyOf(targetWords);
    }
}
