package com.codenames.backend.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable record of one game. Mutators are only called by the engine while it holds this object's monitor.
 */
@Getter
public class GameState {
    private final String id;
    private final Board board;
    private final long randomSeed;
    private final Map<Team, Integer> teamSizes = new EnumMap<>(Team.class);
    private final Map<Team, Integer> remaining = new EnumMap<>(Team.class);
    private final List<ClueRecord> clueHistory = new ArrayList<>();
    private final List<GuessRecord> guessHistory = new ArrayList<>();

    private Team currentTeam;
    private Team winner;
    private int turnCount;
    private GamePhase phase = GamePhase.AWAITING_CLUE;
    private ClueRecord activeClue;

    public GameState(String id, Board board, Team startingTeam, long randomSeed, int redTeamSize, int blueTeamSize) {
        this.id = id;
        this.board = board;
        this.currentTeam = startingTeam;
        this.randomSeed = randomSeed;
        this.teamSizes.put(Team.RED, redTeamSize);
        this.teamSizes.put(Team.BLUE, blueTeamSize);
        this.remaining.put(Team.RED, board.countUnrevealed(CardType.RED));
        this.remaining.put(Team.BLUE, board.countUnrevealed(CardType.BLUE));
    }

    public int getRemaining(Team team) {
        return remaining.get(team);
    }

    public Map<Team, Integer> getRemaining() {
        return Collections.unmodifiableMap(remaining);
    }

    public Map<Team, Integer> getTeamSizes() {
        return Collections.unmodifiableMap(teamSizes);
    }

    public List<ClueRecord> getClueHistory() {
        return Collections.unmodifiableList(clueHistory);
    }

    public List<GuessRecord> getGuessHistory() {
        return Collections.unmodifiableList(guessHistory);
    }

    public boolean isGameOver() {
        return winner != null;
    }

    public void recordClue(ClueRecord clue) {
        clueHistory.add(clue);
        activeClue = clue;
        phase = GamePhase.AWAITING_GUESS;
    }

    public void recordGuess(GuessRecord guess) {
        guessHistory.add(guess);
    }

    /**
     * @return the count left for {@code team} after the decrement
     */
    public int decrementRemaining(Team team) {
        int left = remaining.get(team) - 1;
        remaining.put(team, left);
        return left;
    }

    public void declareWinner(Team team) {
        if (winner != null) {
            throw new IllegalStateException("Winner already decided for game " + id);
        }
        winner = team;
        activeClue = null;
        phase = GamePhase.GAME_OVER;
    }

    public void passTurn() {
        turnCount++;
        currentTeam = currentTeam.opponent();
        activeClue = null;
        phase = GamePhase.AWAITING_CLUE;
    }
}
