package com.codenames.backend.service;

import com.codenames.backend.dto.ClueRejection;
import com.codenames.backend.dto.ClueValidation;
import com.codenames.backend.dto.GuessResult;
import com.codenames.backend.exception.ConfigurationException;
import com.codenames.backend.exception.GameNotFoundException;
import com.codenames.backend.exception.InvalidClueException;
import com.codenames.backend.model.Board;
import com.codenames.backend.model.Card;
import com.codenames.backend.model.CardType;
import com.codenames.backend.model.ClueRecord;
import com.codenames.backend.model.GameState;
import com.codenames.backend.model.GameView;
import com.codenames.backend.model.GuessRecord;
import com.codenames.backend.model.Team;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Referee for every game in the process. Mutating calls for one game are serialized on that game's
 * {@link GameState} monitor; different games never contend.
 *
 * <p>The engine only reacts to submitted guesses. How many guesses a team may take per clue
 * (target count plus one) is left to the caller.
 */
@Slf4j
@Service
public class GameEngine {

    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private final Map<String, GameState> games = new ConcurrentHashMap<>();
    private final BoardGenerator boardGenerator;

    public GameEngine(BoardGenerator boardGenerator) {
        this.boardGenerator = boardGenerator;
    }

    public String createGame(int teamASize, int teamBSize) {
        return createGame(teamASize, teamBSize, null);
    }

    /**
     * Deals a fresh board and registers the game.
     *
     * @param teamASize operatives on the red team
     * @param teamBSize operatives on the blue team
     * @param seed      board seed; the current time is used when {@code null}
     * @return the new game id
     * @throws ConfigurationException if a team size is not positive or the word corpus is too small
     */
    public String createGame(int teamASize, int teamBSize, Long seed) {
        if (teamASize <= 0 || teamBSize <= 0) {
            throw new ConfigurationException("Team sizes must be positive, got "
                    + teamASize + " and " + teamBSize);
        }
        long effectiveSeed = seed != null ? seed : System.nanoTime();
        BoardGenerator.Deal deal = boardGenerator.deal(new Random(effectiveSeed));

        GameState state = new GameState(UUID.randomUUID().toString(), deal.getBoard(),
                deal.getStartingTeam(), effectiveSeed, teamASize, teamBSize);
        register(state);
        log.info("Created game {} (seed={}, starting team {})", state.getId(), effectiveSeed, state.getCurrentTeam());
        return state.getId();
    }

    /**
     * Adds an already built game, e.g. one with a custom board.
     *
     * @throws IllegalStateException if the id is already taken
     */
    public void register(GameState state) {
        if (games.putIfAbsent(state.getId(), state) != null) {
            throw new IllegalStateException("Game id already registered: " + state.getId());
        }
    }

    public Optional<GameState> getGame(String gameId) {
        return gameId == null ? Optional.empty() : Optional.ofNullable(games.get(gameId));
    }

    public boolean removeGame(String gameId) {
        return gameId != null && games.remove(gameId) != null;
    }

    public Optional<GameView> spymasterView(String gameId) {
        return getGame(gameId).map(game -> {
            synchronized (game) {
                return GameView.spymaster(game);
            }
        });
    }

    public Optional<GameView> operativeView(String gameId) {
        return getGame(gameId).map(game -> {
            synchronized (game) {
                return GameView.operative(game);
            }
        });
    }

    /**
     * Checks a clue without touching the game.
     */
    public ClueValidation validateClue(GameState game, String word, List<String> targetWords, Team team) {
        if (game == null || team == null) {
            return ClueValidation.rejected(ClueRejection.MALFORMED, "Game and team are required");
        }
        if (word == null || word.isBlank()) {
            return ClueValidation.rejected(ClueRejection.MALFORMED, "Clue word is required");
        }
        if (targetWords == null) {
            return ClueValidation.rejected(ClueRejection.MALFORMED, "Target words are required");
        }
        for (String target : targetWords) {
            if (target == null || target.isBlank()) {
                return ClueValidation.rejected(ClueRejection.MALFORMED, "Target words must not be blank");
            }
        }
        if (game.getCurrentTeam() != team) {
            return ClueValidation.rejected(ClueRejection.NOT_YOUR_TURN, "It is not " + team + "'s turn");
        }
        if (game.isGameOver()) {
            return ClueValidation.rejected(ClueRejection.GAME_OVER, "Game is already over");
        }

        String clue = word.trim();
        if (WHITESPACE.matcher(clue).find()) {
            return ClueValidation.rejected(ClueRejection.MULTI_WORD, "Clue must be a single word: " + clue);
        }
        Board board = game.getBoard();
        if (board.contains(clue)) {
            return ClueValidation.rejected(ClueRejection.MATCHES_BOARD_WORD, "Clue is a board word: " + clue);
        }
        for (String target : targetWords) {
            if (!board.contains(target)) {
                return ClueValidation.rejected(ClueRejection.UNKNOWN_TARGET, "Target not on board: " + target);
            }
        }
        Set<String> seen = new HashSet<>();
        for (String target : targetWords) {
            if (!seen.add(target.trim().toLowerCase(Locale.ROOT))) {
                return ClueValidation.rejected(ClueRejection.DUPLICATE_TARGET, "Duplicate target: " + target);
            }
        }
        return ClueValidation.ok();
    }

    /**
     * Records a spymaster's clue. Nothing is revealed.
     *
     * @throws GameNotFoundException if the game is unknown
     * @throws InvalidClueException  if the clue fails validation
     */
    public boolean processClue(String gameId, String word, List<String> targetWords, Team team) {
        GameState game = getGame(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
        synchronized (game) {
            ClueValidation validation = validateClue(game, word, targetWords, team);
            if (!validation.isValid()) {
                log.debug("Rejected clue '{}' in game {}: {}", word, gameId, validation.getReason());
                throw new InvalidClueException(validation.getRejection(), validation.getReason());
            }

            List<String> targets = targetWords.stream()
                    .map(t -> game.getBoard().find(t).map(Card::getWord).orElse(t))
                    .collect(Collectors.toList());
            game.recordClue(new ClueRecord(team, word.trim(), targets));
            log.info("Game {}: {} clue '{}' for {}", gameId, team, word.trim(), targets.size());
            return true;
        }
    }

    /**
     * Reveals the card matching {@code word} for {@code team} and applies the turn and win rules.
     * Every refusal comes back as {@code success=false} with the game left untouched.
     */
    public GuessResult processGuess(String gameId, String word, Team team) {
        GameState game = games.get(gameId == null ? "" : gameId);
        if (game == null) {
            return GuessResult.failure("Game not found");
        }
        synchronized (game) {
            if (game.isGameOver()) {
                return GuessResult.failure("Game is already over");
            }
            if (team == null || game.getCurrentTeam() != team) {
                return GuessResult.failure("Not your team's turn");
            }
            if (word == null || word.isBlank()) {
                return GuessResult.failure("Guess word is required");
            }
            Optional<Card> match = game.getBoard().find(word);
            if (match.isEmpty()) {
                log.debug("Game {}: guess '{}' is not on the board", gameId, word);
                return GuessResult.failure("Card '" + word.trim() + "' does not exist on the board");
            }
            if (match.get().isRevealed()) {
                log.debug("Game {}: guess '{}' already revealed", gameId, word);
                return GuessResult.failure("Card '" + match.get().getWord() + "' has already been revealed");
            }

            Card card = game.getBoard().reveal(word).orElseThrow();
            return applyReveal(game, card, team);
        }
    }

    private GuessResult applyReveal(GameState game, Card card, Team team) {
        CardType type = card.getType();
        Team winner = null;
        boolean endTurn = true;

        if (type == CardType.ASSASSIN) {
            winner = team.opponent();
        } else if (type.belongsTo(team)) {
            if (game.decrementRemaining(team) == 0) {
                winner = team;
            } else {
                endTurn = false;
            }
        } else if (type.team() != null) {
            Team owner = type.team();
            if (game.decrementRemaining(owner) == 0) {
                winner = owner;
            }
        }

        game.recordGuess(new GuessRecord(team, card.getWord(), type, type.belongsTo(team)));
        log.info("Game {}: {} guessed '{}' -> {}", game.getId(), team, card.getWord(), type);

        if (winner != null) {
            game.declareWinner(winner);
            log.info("Game {} won by {}", game.getId(), winner);
        } else if (endTurn) {
            game.passTurn();
        }
        return GuessResult.revealed(type, endTurn, winner);
    }

    /**
     * Hands the turn to the other team.
     *
     * @return {@code false} if the game is unknown, finished, or it is not {@code team}'s turn
     */
    public boolean endTurn(String gameId, Team team) {
        Optional<GameState> found = getGame(gameId);
        if (found.isEmpty()) {
            return false;
        }
        GameState game = found.get();
        synchronized (game) {
            if (game.isGameOver() || team == null || game.getCurrentTeam() != team) {
                return false;
            }
            game.passTurn();
            log.info("Game {}: {} ended their turn", gameId, team);
            return true;
        }
    }
}
