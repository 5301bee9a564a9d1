package com.codenames.backend.dto;

import com.codenames.backend.model.Team;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class CreateGameResponseDTO {
    private String gameId;
    private Team startingTeam;
    private long seed;
}
