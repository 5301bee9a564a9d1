package com.codenames.backend.service;

import com.codenames.backend.dto.GuessResult;
import com.codenames.backend.exception.ConfigurationException;
import com.codenames.backend.exception.GameNotFoundException;
import com.codenames.backend.model.Board;
import com.codenames.backend.model.Card;
import com.codenames.backend.model.CardType;
import com.codenames.backend.model.GamePhase;
import com.codenames.backend.model.GameState;
import com.codenames.backend.model.GameView;
import com.codenames.backend.model.Team;
import com.codenames.backend.model.WordCorpus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class GameEngineTest {

    private GameEngine engine;
    private GameState game;

    @BeforeEach
    void setUp() {
        engine = new GameEngine(new BoardGenerator(corpus(30)));
        game = fixture("FIXTURE");
        engine.register(game);
    }

    static WordCorpus corpus(int size) {
        return WordCorpus.of(IntStream.range(0, size).mapToObj(i -> "word" + i).collect(Collectors.toList()));
    }

    /** RedA, RedB, Blue, Neutral, Assassin with RED to move. */
    static GameState fixture(String id) {
        Board board = new Board(List.of(
                new Card("RedA", CardType.RED),
                new Card("RedB", CardType.RED),
                new Card("Blue", CardType.BLUE),
                new Card("Neutral", CardType.NEUTRAL),
                new Card("Assassin", CardType.ASSASSIN)));
        return new GameState(id, board, Team.RED, 7L, 2, 2);
    }

    @Test
    void testSameSeedDealsSameBoard() {
        String first = engine.createGame(2, 2, 42L);
        String second = engine.createGame(3, 1, 42L);

        assertNotEquals(first, second);
        GameState a = engine.getGame(first).orElseThrow();
        GameState b = engine.getGame(second).orElseThrow();
        assertEquals(a.getCurrentTeam(), b.getCurrentTeam());
        assertEquals(describe(a), describe(b));
        assertEquals(42L, a.getRandomSeed());
        assertEquals(Map.of(Team.RED, 3, Team.BLUE, 1), b.getTeamSizes());
    }

    @Test
    void testCreatedBoardHasStandardLayout() {
        GameState created = engine.getGame(engine.createGame(2, 2, 5L)).orElseThrow();

        assertEquals(25, created.getBoard().size());
        assertTrue(created.getBoard().isStandardLayout());
        assertEquals(9, created.getRemaining(created.getCurrentTeam()));
        assertEquals(8, created.getRemaining(created.getCurrentTeam().opponent()));
        assertEquals(GamePhase.AWAITING_CLUE, created.getPhase());
        assertEquals(0, created.getTurnCount());
        assertNull(created.getWinner());
        assertTrue(created.getBoard().getCards().stream().noneMatch(Card::isRevealed));
    }

    @Test
    void testTooFewWordsIsConfigurationError() {
        GameEngine small = new GameEngine(new BoardGenerator(corpus(24)));

        assertThrows(ConfigurationException.class, () -> small.createGame(2, 2, 1L));
    }

    @Test
    void testNonPositiveTeamSizeIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> engine.createGame(0, 2, 1L));
        assertThrows(ConfigurationException.class, () -> engine.createGame(2, -1, 1L));
    }

    @Test
    void testDuplicateRegistrationRejected() {
        assertThrows(IllegalStateException.class, () -> engine.register(fixture("FIXTURE")));
    }

    @Test
    void testOwnCardKeepsTurn() {
        GuessResult result = engine.processGuess("FIXTURE", "reda", Team.RED);

        assertTrue(result.isSuccess());
        assertEquals(CardType.RED, result.getCardType());
        assertFalse(result.isEndTurn());
        assertFalse(result.isGameOver());
        assertEquals(Team.RED, game.getCurrentTeam());
        assertEquals(1, game.getRemaining(Team.RED));
        assertEquals(1, game.getGuessHistory().size());
        assertTrue(game.getGuessHistory().get(0).isCorrect());
    }

    @Test
    void testNeutralCardPassesTurn() {
        GuessResult result = engine.processGuess("FIXTURE", "Neutral", Team.RED);

        assertTrue(result.isSuccess());
        assertTrue(result.isEndTurn());
        assertFalse(result.isGameOver());
        assertEquals(Team.BLUE, game.getCurrentTeam());
        assertEquals(1, game.getTurnCount());
        assertEquals(GamePhase.AWAITING_CLUE, game.getPhase());
    }

    @Test
    void testAssassinLosesImmediately() {
        GuessResult result = engine.processGuess("FIXTURE", "Assassin", Team.RED);

        assertTrue(result.isSuccess());
        assertTrue(result.isGameOver());
        assertEquals(Team.BLUE, result.getWinner());
        assertEquals(Team.BLUE, game.getWinner());
        assertEquals(GamePhase.GAME_OVER, game.getPhase());
        assertEquals(Team.RED, game.getCurrentTeam());
    }

    @Test
    void testRevealingAllOwnCardsWins() {
        engine.processGuess("FIXTURE", "RedA", Team.RED);
        GuessResult result = engine.processGuess("FIXTURE", "RedB", Team.RED);

        assertTrue(result.isGameOver());
        assertTrue(result.isEndTurn());
        assertEquals(Team.RED, result.getWinner());
        assertEquals(0, game.getRemaining(Team.RED));
        assertEquals(Team.RED, game.getCurrentTeam());
        assertEquals(0, game.getTurnCount());
    }

    @Test
    void testRevealingOpponentsLastCardHandsThemTheWin() {
        GuessResult result = engine.processGuess("FIXTURE", "Blue", Team.RED);

        assertTrue(result.isGameOver());
        assertEquals(Team.BLUE, result.getWinner());
        assertFalse(game.getGuessHistory().get(0).isCorrect());
    }

    @Test
    void testRefusedGuessesLeaveStateUntouched() {
        assertFalse(engine.processGuess("FIXTURE", "RedA", Team.BLUE).isSuccess());
        assertFalse(engine.processGuess("FIXTURE", "Banana", Team.RED).isSuccess());
        assertFalse(engine.processGuess("FIXTURE", "  ", Team.RED).isSuccess());
        assertFalse(engine.processGuess("MISSING", "RedA", Team.RED).isSuccess());

        assertTrue(game.getGuessHistory().isEmpty());
        assertEquals(2, game.getRemaining(Team.RED));
        assertEquals(Team.RED, game.getCurrentTeam());
    }

    @Test
    void testRepeatedGuessIsRefused() {
        engine.processGuess("FIXTURE", "RedA", Team.RED);
        GuessResult again = engine.processGuess("FIXTURE", "REDA", Team.RED);

        assertFalse(again.isSuccess());
        assertTrue(again.getError().contains("already been revealed"));
        assertEquals(1, game.getGuessHistory().size());
        assertEquals(1, game.getRemaining(Team.RED));
    }

    @Test
    void testNoGuessesAfterGameOver() {
        engine.processGuess("FIXTURE", "Assassin", Team.RED);
        GuessResult result = engine.processGuess("FIXTURE", "RedA", Team.RED);

        assertFalse(result.isSuccess());
        assertEquals(1, game.getGuessHistory().size());
        assertFalse(engine.endTurn("FIXTURE", Team.RED));
    }

    @Test
    void testEndTurnOnlyForCurrentTeam() {
        assertFalse(engine.endTurn("FIXTURE", Team.BLUE));
        assertTrue(engine.endTurn("FIXTURE", Team.RED));
        assertEquals(Team.BLUE, game.getCurrentTeam());
        assertEquals(1, game.getTurnCount());
        assertTrue(engine.endTurn("FIXTURE", Team.BLUE));
        assertEquals(Team.RED, game.getCurrentTeam());
        assertFalse(engine.endTurn("MISSING", Team.RED));
    }

    @Test
    void testClueRecordedWithBoardSpelling() {
        assertTrue(engine.processClue("FIXTURE", " fruit ", List.of("reda", "REDB"), Team.RED));

        assertEquals(GamePhase.AWAITING_GUESS, game.getPhase());
        assertEquals("fruit", game.getActiveClue().getWord());
        assertEquals(List.of("RedA", "RedB"), game.getActiveClue().getTargetWords());
        assertEquals(2, game.getActiveClue().getTargetCount());
        assertTrue(game.getGuessHistory().isEmpty());
        assertFalse(game.getBoard().find("RedA").orElseThrow().isRevealed());
    }

    @Test
    void testClueForUnknownGame() {
        assertThrows(GameNotFoundException.class,
                () -> engine.processClue("MISSING", "fruit", List.of(), Team.RED));
    }

    @Test
    void testOperativeViewHidesUnrevealedTypes() {
        engine.processGuess("FIXTURE", "Neutral", Team.RED);

        GameView operative = engine.operativeView("FIXTURE").orElseThrow();
        GameView spymaster = engine.spymasterView("FIXTURE").orElseThrow();

        assertFalse(operative.isSpymaster());
        for (GameView.CardView card : operative.getCards()) {
            assertEquals(card.isRevealed(), card.getType() != null, card.getWord());
        }
        assertTrue(spymaster.getCards().stream().allMatch(c -> c.getType() != null));
        assertEquals(List.of("RedA", "RedB", "Blue", "Assassin"), operative.unrevealedWords());
        assertTrue(engine.operativeView("MISSING").isEmpty());
    }

    @Test
    void testViewIsASnapshot() {
        GameView before = engine.operativeView("FIXTURE").orElseThrow();
        engine.processGuess("FIXTURE", "RedA", Team.RED);

        assertEquals(5, before.unrevealedWords().size());
        assertEquals(2, before.getRemaining().get(Team.RED));
        assertTrue(before.getGuessHistory().isEmpty());
    }

    @Test
    void testRemoveGame() {
        assertTrue(engine.removeGame("FIXTURE"));
        assertTrue(engine.getGame("FIXTURE").isEmpty());
        assertFalse(engine.removeGame("FIXTURE"));
    }

    private static List<String> describe(GameState state) {
        List<String> cards = new ArrayList<>();
        for (Card card : state.getBoard().getCards()) {
            cards.add(card.getWord() + ":" + card.getType());
        }
        return cards;
    }
}
