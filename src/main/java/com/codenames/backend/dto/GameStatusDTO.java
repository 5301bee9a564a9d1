package com.codenames.backend.dto;

import com.codenames.backend.model.GamePhase;
import com.codenames.backend.model.Player;
import com.codenames.backend.model.Team;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class GameStatusDTO {
    private String gameId;
    private List<Player> players;
    private GamePhase phase;
    private Team currentTeam;
    private Team winner;
    private int turnCount;
    private Map<Team, Integer> remaining;
    private String message;
}
