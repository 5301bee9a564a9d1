package com.codenames.backend.dto;

import com.codenames.backend.model.Player;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class JoinResponseDTO {
    private Player player;
    private GameStatusDTO game;
}
