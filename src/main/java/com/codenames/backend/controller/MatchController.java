package com.codenames.backend.controller;

import com.codenames.backend.dto.MatchOutcome;
import com.codenames.backend.dto.MatchRequestDTO;
import com.codenames.backend.service.MatchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs an agent-vs-agent match to completion. Blocks for the length of the game.
 */
@RestController
@RequestMapping("/api/matches")
@RequiredArgsConstructor
public class MatchController {

    private final MatchService matchService;

    @PostMapping
    public ResponseEntity<MatchOutcome> runMatch(@RequestBody(required = false) MatchRequestDTO request) {
        return ResponseEntity.ok(matchService.runMatch(request != null ? request : new MatchRequestDTO()));
    }
}
