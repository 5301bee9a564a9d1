package com.codenames.backend.dto;

import com.codenames.backend.model.Role;
import com.codenames.backend.model.Team;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class JoinGameDTO {
    private String playerName;
    private Team team;
    private Role role;
    private boolean ai;
}
