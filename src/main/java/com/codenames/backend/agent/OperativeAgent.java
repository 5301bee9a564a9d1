package com.codenames.backend.agent;

import com.codenames.backend.debate.TranscriptEntry;
import com.codenames.backend.model.GameView;
import com.codenames.backend.model.GuessRecord;

import java.util.List;

/**
 * A team member who guesses. All views handed in are operative snapshots: unrevealed cards carry no type.
 */
public interface OperativeAgent {

    String getId();

    /**
     * Independent first proposal for the current clue.
     *
     * @return a board word, or {@code "end"} to stop guessing
     */
    GuessProposal generateGuess(GameView operativeView, Clue clue, int correctSoFar, List<GuessRecord> history);

    String debateContribution(List<TranscriptEntry> transcript, GameView operativeView, Clue clue);

    /**
     * @return one of {@code options}
     */
    String finalVote(List<TranscriptEntry> transcript, List<String> options, GameView operativeView, Clue clue);
}
