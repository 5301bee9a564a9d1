package com.codenames.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ClueDTO {
    private String playerId;
    private String word;
    private List<String> targetWords = new ArrayList<>();
}
