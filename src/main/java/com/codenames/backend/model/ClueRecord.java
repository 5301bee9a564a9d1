package com.codenames.backend.model;

import lombok.Value;

import java.util.List;

@Value
public class ClueRecord {
    Team team;
    String word;
    List<String> targetWords;

    public ClueRecord(Team team, String word, List<String> targetWords) {
        this.team = team;
        this.word = word;
        this.targetWords = List.copyOf(targetWords);
    }

    public int getTargetCount() {
        return targetWords.size();
    }
}
