package com.codenames.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class MatchRequestDTO {
    private int teamASize = 2;
    private int teamBSize = 2;
    private Long seed;
    private Integer maxTurns;
    private Integer debateRounds;
}
