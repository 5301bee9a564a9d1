package com.codenames.backend.model;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only snapshot of a game as one role sees it. Built fresh on every call and never backed by the live board,
 * so revealing a card later does not change a view that was already handed out.
 */
@Value
public class GameView {
    String gameId;
    boolean spymaster;
    List<CardView> cards;
    Map<Team, Integer> remaining;
    Team currentTeam;
    Team winner;
    int turnCount;
    GamePhase phase;
    List<ClueRecord> clueHistory;
    List<GuessRecord> guessHistory;

    @Value
    public static class CardView {
        String word;
        CardType type;
        boolean revealed;
    }

    public static GameView spymaster(GameState state) {
        return of(state, true);
    }

    public static GameView operative(GameState state) {
        return of(state, false);
    }

    private static GameView of(GameState state, boolean spymaster) {
        List<CardView> cards = state.getBoard().getCards().stream()
                .map(c -> new CardView(c.getWord(),
                        spymaster || c.isRevealed() ? c.getType() : null,
                        c.isRevealed()))
                .collect(Collectors.toUnmodifiableList());
        return new GameView(
                state.getId(),
                spymaster,
                cards,
                Map.copyOf(state.getRemaining()),
                state.getCurrentTeam(),
                state.getWinner(),
                state.getTurnCount(),
                state.getPhase(),
                List.copyOf(state.getClueHistory()),
                List.copyOf(state.getGuessHistory()));
    }

    public List<String> unrevealedWords() {
        return cards.stream().filter(c -> !c.isRevealed()).map(CardView::getWord).collect(Collectors.toList());
    }

    public List<String> unrevealedWordsOf(CardType type) {
        return cards.stream()
                .filter(c -> !c.isRevealed() && c.getType() == type)
                .map(CardView::getWord)
                .collect(Collectors.toList());
    }

    public List<CardView> revealedCards() {
        return cards.stream().filter(CardView::isRevealed).collect(Collectors.toList());
    }
}
