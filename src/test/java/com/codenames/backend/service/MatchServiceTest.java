package com.codenames.backend.service;

import com.codenames.backend.agent.AgentFactory;
import com.codenames.backend.agent.Clue;
import com.codenames.backend.agent.ClueProposal;
import com.codenames.backend.agent.GuessProposal;
import com.codenames.backend.agent.OperativeAgent;
import com.codenames.backend.agent.SpymasterAgent;
import com.codenames.backend.config.CodenamesProperties;
import com.codenames.backend.debate.DebateManager;
import com.codenames.backend.debate.TranscriptEntry;
import com.codenames.backend.dto.MatchOutcome;
import com.codenames.backend.dto.MatchRequestDTO;
import com.codenames.backend.model.GameView;
import com.codenames.backend.model.GuessRecord;
import com.codenames.backend.model.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MatchServiceTest {

    @Mock
    private AgentFactory agentFactory;

    private GameEngine engine;
    private MatchService matchService;

    @BeforeEach
    void setUp() {
        engine = spy(new GameEngine(new BoardGenerator(GameEngineTest.corpus(40))));
        CodenamesProperties properties = new CodenamesProperties();
        properties.getDebate().setParallelProposals(false);
        matchService = new MatchService(engine, agentFactory, properties, null);
    }

    /** Points at one of its own unrevealed cards each turn. */
    private class OneWordSpymaster implements SpymasterAgent {
        private final Team team;

        OneWordSpymaster(Team team) {
            this.team = team;
        }

        @Override
        public String getId() {
            return team + " Spymaster";
        }

        @Override
        public ClueProposal generateClue(GameView view) {
            return new ClueProposal("zzclue", List.of(view.unrevealedWordsOf(team.cardType()).get(0)));
        }
    }

    /** Peeks at the key card, so it only ever proposes its own team's words. */
    private class KeyCardOperative implements OperativeAgent {
        private final Team team;

        KeyCardOperative(Team team) {
            this.team = team;
        }

        @Override
        public String getId() {
            return team + " Operative";
        }

        @Override
        public GuessProposal generateGuess(GameView view, Clue clue, int correctSoFar, List<GuessRecord> history) {
            GameView key = engine.spymasterView(view.getGameId()).orElseThrow();
            return new GuessProposal(key.unrevealedWordsOf(team.cardType()).get(0), "it is ours");
        }

        @Override
        public String debateContribution(List<TranscriptEntry> transcript, GameView view, Clue clue) {
            return "";
        }

        @Override
        public String finalVote(List<TranscriptEntry> transcript, List<String> options, GameView view, Clue clue) {
            return options.stream().filter(o -> !DebateManager.END.equals(o)).findFirst().orElse(DebateManager.END);
        }
    }

    private void seatPerfectTeams() {
        for (Team team : Team.values()) {
            when(agentFactory.spymaster(eq(team), anyLong())).thenReturn(new OneWordSpymaster(team));
            when(agentFactory.operatives(eq(team), eq(1), anyLong())).thenReturn(List.of(new KeyCardOperative(team)));
        }
    }

    @Test
    void testGuessCapIsClueCountPlusOne() {
        seatPerfectTeams();

        MatchOutcome outcome = matchService.runMatch(new MatchRequestDTO(1, 1, 8L, 20, 1));

        Team starter = new BoardGenerator(GameEngineTest.corpus(40)).deal(new Random(8L)).getStartingTeam();
        // two correct guesses per one-word clue: the second team reaches 8 before the first reaches 9
        assertEquals(starter.opponent(), outcome.getWinner());
        assertEquals(8, outcome.getTurnsPlayed());
        assertEquals(8, outcome.getCluesGiven());
        assertEquals(16, outcome.getGuessesMade());
        assertTrue(outcome.getWinReason().contains("uncovering all their cards"));
        // every turn but the winning one ends after its second correct guess
        verify(engine, times(7)).endTurn(anyString(), any());
    }

    @Test
    void testSameSeedSameOutcome() {
        seatPerfectTeams();

        MatchOutcome first = matchService.runMatch(new MatchRequestDTO(1, 1, 21L, 20, 1));
        MatchOutcome second = matchService.runMatch(new MatchRequestDTO(1, 1, 21L, 20, 1));

        assertEquals(first.getWinner(), second.getWinner());
        assertEquals(first.getTurnsPlayed(), second.getTurnsPlayed());
        assertEquals(21L, second.getSeed());
    }

    @Test
    void testTurnLimit() {
        OperativeAgent cautious = mock(OperativeAgent.class);
        when(cautious.getId()).thenReturn("Cautious");
        when(cautious.generateGuess(any(), any(), anyInt(), anyList())).thenReturn(new GuessProposal("end", "too risky"));
        when(cautious.finalVote(anyList(), anyList(), any(), any())).thenReturn("end");
        for (Team team : Team.values()) {
            when(agentFactory.spymaster(eq(team), anyLong())).thenReturn(new OneWordSpymaster(team));
            when(agentFactory.operatives(eq(team), eq(1), anyLong())).thenReturn(List.of(cautious));
        }

        MatchOutcome outcome = matchService.runMatch(new MatchRequestDTO(1, 1, 3L, 4, 1));

        assertNull(outcome.getWinner());
        assertEquals(4, outcome.getTurnsPlayed());
        assertEquals(4, outcome.getCluesGiven());
        assertEquals(0, outcome.getGuessesMade());
        assertTrue(outcome.getWinReason().startsWith("Turn limit reached"));
    }

    @Test
    void testInvalidCluesAreRetriedThenTurnPasses() {
        SpymasterAgent stubborn = mock(SpymasterAgent.class);
        when(stubborn.getId()).thenReturn("Stubborn");
        when(stubborn.generateClue(any())).thenAnswer(inv -> {
            GameView view = inv.getArgument(0);
            return new ClueProposal(view.getCards().get(0).getWord(), List.of());
        });
        for (Team team : Team.values()) {
            when(agentFactory.spymaster(eq(team), anyLong())).thenReturn(stubborn);
            when(agentFactory.operatives(eq(team), eq(1), anyLong())).thenReturn(List.of(new KeyCardOperative(team)));
        }

        MatchOutcome outcome = matchService.runMatch(new MatchRequestDTO(1, 1, 5L, 2, 1));

        verify(stubborn, times(6)).generateClue(any());
        assertEquals(0, outcome.getCluesGiven());
        assertEquals(2, outcome.getTurnsPlayed());
        verify(engine, times(2)).endTurn(anyString(), any());
    }

    @Test
    void testFinishedMatchLeavesRegistry() {
        seatPerfectTeams();

        MatchOutcome outcome = matchService.runMatch(new MatchRequestDTO(1, 1, 8L, 20, 1));

        assertNotNull(outcome.getWinner());
        assertTrue(engine.getGame(outcome.getGameId()).isEmpty());
        verify(engine).removeGame(outcome.getGameId());
    }

    @Test
    void testRejectedDebateRoundsCreateNoGame() {
        MatchRequestDTO request = new MatchRequestDTO(2, 2, 1L, 5, 0);

        assertThrows(IllegalArgumentException.class, () -> matchService.runMatch(request));

        verify(engine, never()).createGame(anyInt(), anyInt(), any());
        verifyNoInteractions(agentFactory);
    }

    @Test
    void testGameIsRemovedWhenAgentSetupFails() {
        when(agentFactory.spymaster(eq(Team.RED), anyLong())).thenThrow(new IllegalStateException("no model"));

        assertThrows(IllegalStateException.class,
                () -> matchService.runMatch(new MatchRequestDTO(1, 1, 4L, 5, 1)));

        ArgumentCaptor<String> id = ArgumentCaptor.forClass(String.class);
        verify(engine).removeGame(id.capture());
        assertTrue(engine.getGame(id.getValue()).isEmpty());
    }
}
