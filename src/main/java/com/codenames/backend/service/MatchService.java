package com.codenames.backend.service;

import com.codenames.backend.agent.AgentFactory;
import com.codenames.backend.agent.Clue;
import com.codenames.backend.agent.ClueProposal;
import com.codenames.backend.agent.OperativeAgent;
import com.codenames.backend.agent.SpymasterAgent;
import com.codenames.backend.config.CodenamesProperties;
import com.codenames.backend.debate.DebateManager;
import com.codenames.backend.debate.DebateResult;
import com.codenames.backend.dto.GuessResult;
import com.codenames.backend.dto.MatchOutcome;
import com.codenames.backend.dto.MatchRequestDTO;
import com.codenames.backend.exception.GameNotFoundException;
import com.codenames.backend.exception.InvalidClueException;
import com.codenames.backend.model.CardType;
import com.codenames.backend.model.GameState;
import com.codenames.backend.model.GameView;
import com.codenames.backend.model.GuessRecord;
import com.codenames.backend.model.Team;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;

/**
 * Plays a whole game between two agent teams. Spymasters give clues, each team's operatives debate
 * every guess, and the engine referees.
 */
@Slf4j
@Service
public class MatchService {

    private final GameEngine gameEngine;
    private final AgentFactory agentFactory;
    private final CodenamesProperties properties;
    private final ExecutorService debateExecutor;

    public MatchService(GameEngine gameEngine, AgentFactory agentFactory, CodenamesProperties properties,
                        @Qualifier("debateExecutor") ExecutorService debateExecutor) {
        this.gameEngine = gameEngine;
        this.agentFactory = agentFactory;
        this.properties = properties;
        this.debateExecutor = debateExecutor;
    }

    public MatchOutcome runMatch(MatchRequestDTO request) {
        long seed = request.getSeed() != null ? request.getSeed() : System.nanoTime();
        int maxTurns = request.getMaxTurns() != null ? request.getMaxTurns() : properties.getMatch().getMaxTurns();
        int rounds = request.getDebateRounds() != null
                ? request.getDebateRounds()
                : properties.getDebate().getRounds();

        Random matchRandom = new Random(seed);
        DebateManager debate = properties.getDebate().isParallelProposals()
                ? new DebateManager(rounds, new Random(matchRandom.nextLong()), debateExecutor)
                : new DebateManager(rounds, new Random(matchRandom.nextLong()));

        String gameId = gameEngine.createGame(request.getTeamASize(), request.getTeamBSize(), seed);
        try {
            Map<Team, SpymasterAgent> spymasters = new EnumMap<>(Team.class);
            Map<Team, List<OperativeAgent>> operatives = new EnumMap<>(Team.class);
            for (Team team : Team.values()) {
                int size = team == Team.RED ? request.getTeamASize() : request.getTeamBSize();
                spymasters.put(team, agentFactory.spymaster(team, matchRandom.nextLong()));
                operatives.put(team, agentFactory.operatives(team, size, matchRandom.nextLong()));
            }

            GameState game = gameEngine.getGame(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
            log.info("Match {} started (seed={}, {} vs {} operatives, {} debate rounds)",
                    gameId, seed, request.getTeamASize(), request.getTeamBSize(), debate.getRounds());

            int turns = 0;
            int clues = 0;
            int guesses = 0;
            while (!game.isGameOver() && turns < maxTurns) {
                Team team = game.getCurrentTeam();
                turns++;

                Clue clue = requestClue(gameId, team, spymasters.get(team));
                if (clue == null) {
                    log.warn("Match {}: {} gave no valid clue, passing the turn", gameId, team);
                    gameEngine.endTurn(gameId, team);
                    continue;
                }
                clues++;
                guesses += playGuesses(gameId, team, clue, operatives.get(team), debate);
            }

            Team winner = game.getWinner();
            String reason = winReason(game, maxTurns);
            log.info("Match {} finished after {} turns: {}", gameId, turns, reason);
            return new MatchOutcome(gameId, seed, winner, reason, turns, clues, guesses);
        } finally {
            gameEngine.removeGame(gameId);
        }
    }

    private Clue requestClue(String gameId, Team team, SpymasterAgent spymaster) {
        int attempts = Math.max(1, properties.getMatch().getClueRetries());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            GameView view = gameEngine.spymasterView(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
            ClueProposal proposal = spymaster.generateClue(view);
            try {
                gameEngine.processClue(gameId, proposal.getWord(), proposal.getTargetWords(), team);
                return new Clue(proposal.getWord().trim(), proposal.getTargetWords().size());
            } catch (InvalidClueException e) {
                log.debug("Match {}: clue '{}' from {} rejected on attempt {}: {}",
                        gameId, proposal.getWord(), spymaster.getId(), attempt, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Runs debates until the team stops, misses, wins or uses up its count plus one guesses.
     *
     * @return the number of guesses submitted
     */
    private int playGuesses(String gameId, Team team, Clue clue, List<OperativeAgent> roster, DebateManager debate) {
        int cap = clue.getCount() + 1;
        int correct = 0;
        int submitted = 0;

        while (submitted < cap) {
            GameView view = gameEngine.operativeView(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
            List<GuessRecord> history = view.getGuessHistory();
            DebateResult result = debate.runDebate(roster, view, clue, correct, history);
            if (result.isEndTurn()) {
                log.info("Match {}: {} chose to end the turn", gameId, team);
                gameEngine.endTurn(gameId, team);
                return submitted;
            }

            GuessResult guess = gameEngine.processGuess(gameId, result.getFinalDecision(), team);
            submitted++;
            if (!guess.isSuccess()) {
                log.warn("Match {}: {} guess '{}' refused: {}", gameId, team, result.getFinalDecision(),
                        guess.getError());
                continue;
            }
            if (guess.isGameOver() || guess.isEndTurn()) {
                return submitted;
            }
            correct++;
        }

        gameEngine.endTurn(gameId, team);
        return submitted;
    }

    private static String winReason(GameState game, int maxTurns) {
        synchronized (game) {
            Team winner = game.getWinner();
            if (winner == null) {
                return "Turn limit reached (" + maxTurns + " turns)";
            }
            List<GuessRecord> guesses = game.getGuessHistory();
            GuessRecord last = guesses.isEmpty() ? null : guesses.get(guesses.size() - 1);
            if (last != null && last.getRevealedType() == CardType.ASSASSIN) {
                return last.getTeam() + " revealed the assassin";
            }
            return winner + " won by uncovering all their cards";
        }
    }
}
