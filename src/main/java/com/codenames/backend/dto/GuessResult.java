package com.codenames.backend.dto;

import com.codenames.backend.model.CardType;
import com.codenames.backend.model.Team;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GuessResult {
    private boolean success;
    private CardType cardType;
    private boolean gameOver;
    private Team winner;
    private boolean endTurn;
    private String error;

    public static GuessResult failure(String error) {
        return new GuessResult(false, null, false, null, false, error);
    }

    public static GuessResult revealed(CardType cardType, boolean endTurn, Team winner) {
        return new GuessResult(true, cardType, winner != null, winner, endTurn, null);
    }
}
