package com.codenames.backend.debate;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class DebateResult {
    String finalDecision;
    Map<String, Integer> voteCounts;
    List<TranscriptEntry> transcript;
    List<TranscriptEntry> reasoningExcerpt;
    List<String> options;

    public boolean isEndTurn() {
        return DebateManager.END.equals(finalDecision);
    }
}
