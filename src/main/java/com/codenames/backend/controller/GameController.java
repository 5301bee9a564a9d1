package com.codenames.backend.controller;

import com.codenames.backend.dto.ClueDTO;
import com.codenames.backend.dto.CreateGameDTO;
import com.codenames.backend.dto.CreateGameResponseDTO;
import com.codenames.backend.dto.EndTurnDTO;
import com.codenames.backend.dto.GameStatusDTO;
import com.codenames.backend.dto.GuessDTO;
import com.codenames.backend.dto.GuessResult;
import com.codenames.backend.dto.JoinGameDTO;
import com.codenames.backend.dto.JoinResponseDTO;
import com.codenames.backend.dto.PlayerViewDTO;
import com.codenames.backend.service.GameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameController {

    private final GameService gameService;

    @PostMapping
    public ResponseEntity<CreateGameResponseDTO> createGame(@RequestBody(required = false) CreateGameDTO request) {
        return ResponseEntity.ok(gameService.createGame(request != null ? request : new CreateGameDTO()));
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<GameStatusDTO> getGame(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getStatus(gameId));
    }

    @PostMapping("/{gameId}/join")
    public ResponseEntity<JoinResponseDTO> join(@PathVariable String gameId, @RequestBody JoinGameDTO request) {
        return ResponseEntity.ok(gameService.join(gameId, request));
    }

    @GetMapping("/{gameId}/view")
    public ResponseEntity<PlayerViewDTO> view(@PathVariable String gameId, @RequestParam String playerId) {
        return ResponseEntity.ok(gameService.viewFor(gameId, playerId));
    }

    @PostMapping("/{gameId}/clue")
    public ResponseEntity<GameStatusDTO> giveClue(@PathVariable String gameId, @RequestBody ClueDTO clue) {
        gameService.giveClue(gameId, clue);
        return ResponseEntity.ok(gameService.getStatus(gameId));
    }

    @PostMapping("/{gameId}/guess")
    public ResponseEntity<GuessResult> guess(@PathVariable String gameId, @RequestBody GuessDTO guess) {
        GuessResult result = gameService.guess(gameId, guess);
        return result.isSuccess() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }

    @PostMapping("/{gameId}/end-turn")
    public ResponseEntity<GameStatusDTO> endTurn(@PathVariable String gameId, @RequestBody EndTurnDTO request) {
        gameService.endTurn(gameId, request);
        return ResponseEntity.ok(gameService.getStatus(gameId));
    }

    @MessageMapping("/game/{gameId}/clue")
    public void clue(@DestinationVariable String gameId, @Payload ClueDTO clue) {
        try {
            gameService.giveClue(gameId, clue);
        } catch (RuntimeException e) {
            log.debug("Game {}: clue from {} refused: {}", gameId, clue.getPlayerId(), e.getMessage());
            gameService.sendError(clue.getPlayerId(), "CLUE_REJECTED", e.getMessage());
        }
    }

    @MessageMapping("/game/{gameId}/guess")
    public void guessMessage(@DestinationVariable String gameId, @Payload GuessDTO guess) {
        try {
            GuessResult result = gameService.guess(gameId, guess);
            if (!result.isSuccess()) {
                gameService.sendError(guess.getPlayerId(), "GUESS_REJECTED", result.getError());
            }
        } catch (RuntimeException e) {
            log.debug("Game {}: guess from {} refused: {}", gameId, guess.getPlayerId(), e.getMessage());
            gameService.sendError(guess.getPlayerId(), "GUESS_REJECTED", e.getMessage());
        }
    }

    @MessageMapping("/game/{gameId}/end-turn")
    public void endTurnMessage(@DestinationVariable String gameId, @Payload EndTurnDTO request) {
        try {
            gameService.endTurn(gameId, request);
        } catch (RuntimeException e) {
            log.debug("Game {}: end turn from {} refused: {}", gameId, request.getPlayerId(), e.getMessage());
            gameService.sendError(request.getPlayerId(), "END_TURN_REJECTED", e.getMessage());
        }
    }
}
