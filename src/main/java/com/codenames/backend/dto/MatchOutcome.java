package com.codenames.backend.dto;

import com.codenames.backend.model.Team;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class MatchOutcome {
    private String gameId;
    private long seed;
    private Team winner;
    private String winReason;
    private int turnsPlayed;
    private int cluesGiven;
    private int guessesMade;
}
