package com.codenames.backend.service;

import com.codenames.backend.dto.ClueDTO;
import com.codenames.backend.dto.CreateGameDTO;
import com.codenames.backend.dto.CreateGameResponseDTO;
import com.codenames.backend.dto.EndTurnDTO;
import com.codenames.backend.dto.ErrorResponseDTO;
import com.codenames.backend.dto.GameStatusDTO;
import com.codenames.backend.dto.GuessDTO;
import com.codenames.backend.dto.GuessResult;
import com.codenames.backend.dto.JoinGameDTO;
import com.codenames.backend.dto.JoinResponseDTO;
import com.codenames.backend.dto.PlayerViewDTO;
import com.codenames.backend.exception.ActionNotAllowedException;
import com.codenames.backend.exception.GameNotFoundException;
import com.codenames.backend.model.GameState;
import com.codenames.backend.model.GameView;
import com.codenames.backend.model.Player;
import com.codenames.backend.model.Role;
import com.codenames.backend.model.Table;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;

/**
 * Seats people at games, checks that each action comes from the right role, and pushes every
 * player their own view after each change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private final GameEngine gameEngine;
    private final TableService tableService;
    private final SimpMessagingTemplate messagingTemplate;

    public CreateGameResponseDTO createGame(CreateGameDTO request) {
        String gameId = gameEngine.createGame(request.getTeamASize(), request.getTeamBSize(), request.getSeed());
        tableService.openTable(gameId);
        GameState game = requireGame(gameId);
        return new CreateGameResponseDTO(gameId, game.getCurrentTeam(), game.getRandomSeed());
    }

    public GameStatusDTO getStatus(String gameId) {
        return status(requireGame(gameId), tableService.getTable(gameId), null);
    }

    public JoinResponseDTO join(String gameId, JoinGameDTO request) {
        requireGame(gameId);
        Player player = tableService.join(gameId, request);
        broadcastGameUpdate(gameId, player.getName() + " joined.");
        return new JoinResponseDTO(player, getStatus(gameId));
    }

    public void giveClue(String gameId, ClueDTO clue) {
        Player player = tableService.getPlayer(gameId, clue.getPlayerId());
        if (player.getRole() != Role.SPYMASTER) {
            throw new ActionNotAllowedException("Only spymasters can give clues");
        }
        gameEngine.processClue(gameId, clue.getWord(), clue.getTargetWords(), player.getTeam());
        int count = clue.getTargetWords() == null ? 0 : clue.getTargetWords().size();
        broadcastGameUpdate(gameId, player.getTeam() + " clue: " + clue.getWord().trim() + " " + count);
    }

    public GuessResult guess(String gameId, GuessDTO guess) {
        Player player = tableService.getPlayer(gameId, guess.getPlayerId());
        if (player.getRole() != Role.OPERATIVE) {
            throw new ActionNotAllowedException("Only operatives can make guesses");
        }
        GuessResult result = gameEngine.processGuess(gameId, guess.getWord(), player.getTeam());
        if (result.isSuccess()) {
            String message = player.getName() + " revealed " + guess.getWord().trim() + " (" + result.getCardType() + ")";
            if (result.isGameOver()) {
                message += ". " + result.getWinner() + " wins!";
            }
            broadcastGameUpdate(gameId, message);
        }
        return result;
    }

    public void endTurn(String gameId, EndTurnDTO request) {
        Player player = tableService.getPlayer(gameId, request.getPlayerId());
        if (!gameEngine.endTurn(gameId, player.getTeam())) {
            throw new ActionNotAllowedException("Cannot end turn: not " + player.getTeam() + "'s turn or game over");
        }
        broadcastGameUpdate(gameId, player.getTeam() + " ended their turn.");
    }

    public PlayerViewDTO viewFor(String gameId, String playerId) {
        Player player = tableService.getPlayer(gameId, playerId);
        return new PlayerViewDTO(player.getId(), player.getTeam(), player.getRole(), view(gameId, player), null);
    }

    public void broadcastGameUpdate(String gameId, String message) {
        GameState game = requireGame(gameId);
        Table table = tableService.getTable(gameId);

        for (Player p : table.getPlayers()) {
            PlayerViewDTO dto = new PlayerViewDTO(p.getId(), p.getTeam(), p.getRole(), view(gameId, p), message);
            messagingTemplate.convertAndSendToUser(p.getId(), "/queue/game", dto);
        }
        messagingTemplate.convertAndSend("/topic/game/" + gameId, status(game, table, message));
    }

    public void sendError(String playerId, String code, String message) {
        if (playerId == null) {
            log.debug("Dropping error for anonymous sender: {}", message);
            return;
        }
        messagingTemplate.convertAndSendToUser(playerId, "/queue/errors", new ErrorResponseDTO(code, message));
    }

    private GameView view(String gameId, Player player) {
        return (player.getRole() == Role.SPYMASTER
                ? gameEngine.spymasterView(gameId)
                : gameEngine.operativeView(gameId))
                .orElseThrow(() -> new GameNotFoundException(gameId));
    }

    private GameState requireGame(String gameId) {
        return gameEngine.getGame(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
    }

    private static GameStatusDTO status(GameState game, Table table, String message) {
        synchronized (game) {
            return new GameStatusDTO(
                    game.getId(),
                    List.copyOf(table.getPlayers()),
                    game.getPhase(),
                    game.getCurrentTeam(),
                    game.getWinner(),
                    game.getTurnCount(),
                    new EnumMap<>(game.getRemaining()),
                    message);
        }
    }
}
