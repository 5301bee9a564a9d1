package com.codenames.backend.agent.llm;

import com.codenames.backend.agent.AgentCallGuard;
import com.codenames.backend.agent.Clue;
import com.codenames.backend.agent.GuessProposal;
import com.codenames.backend.agent.OperativeAgent;
import com.codenames.backend.debate.DebateManager;
import com.codenames.backend.debate.TranscriptEntry;
import com.codenames.backend.model.GameView;
import com.codenames.backend.model.GuessRecord;
import com.codenames.backend.model.Team;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

@Slf4j
public class LlmOperativeAgent implements OperativeAgent {

    private final String id;
    private final Team team;
    private final LanguageModelClient client;
    private final AgentCallGuard guard;
    private final ResponseParser parser;
    private final Random random;

    public LlmOperativeAgent(String id, Team team, LanguageModelClient client, AgentCallGuard guard,
                             ResponseParser parser, Random random) {
        this.id = id;
        this.team = team;
        this.client = client;
        this.guard = guard;
        this.parser = parser;
        this.random = random;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public GuessProposal generateGuess(GameView view, Clue clue, int correctSoFar, List<GuessRecord> history) {
        List<String> unrevealed = view.unrevealedWords();
        String prompt = "You are the " + team + " team Operative in a game of Codenames.\n\n"
                + "The Spymaster gave the clue: \"" + clue.getWord() + "\" for " + clue.getCount() + " words.\n"
                + "So far, your team has made " + correctSoFar + " correct guesses for this clue.\n\n"
                + "The unrevealed words on the board are: " + String.join(", ", unrevealed) + "\n"
                + "Previously revealed words: " + revealed(view) + "\n"
                + previousGuesses(history) + "\n"
                + "Analyze how the clue relates to the unrevealed words, explain your reasoning, then decide.\n\n"
                + "Respond in this format:\n"
                + "REASONING: [your analysis]\n"
                + "DECISION: [ONE word from the board OR \"END\" to end your turn]\n";

        String raw = guard.call(id + " guess",
                () -> client.complete("You are a Codenames Operative AI. Explain your reasoning clearly.", prompt),
                () -> "");
        ParseResult<ParsedGuess> parsed = parser.parseGuess(raw, unrevealed);
        if (parsed.isParsed()) {
            return new GuessProposal(parsed.getValue().getDecision(), parsed.getValue().getReasoning());
        }
        log.warn("{} could not use model reply ({}), guessing at random", id, parsed.getReason());
        if (unrevealed.isEmpty()) {
            return new GuessProposal(DebateManager.END, "Nothing left to guess");
        }
        return new GuessProposal(unrevealed.get(random.nextInt(unrevealed.size())), "Random fallback guess");
    }

    @Override
    public String debateContribution(List<TranscriptEntry> transcript, GameView view, Clue clue) {
        String prompt = "You are " + id + ", a " + team + " team Operative in a game of Codenames "
                + "participating in a team debate.\n\n"
                + "The Spymaster gave the clue: \"" + clue.getWord() + "\" for " + clue.getCount() + " words.\n\n"
                + "The unrevealed words on the board are: " + String.join(", ", view.unrevealedWords()) + "\n\n"
                + "DEBATE HISTORY:\n" + formatTranscript(transcript) + "\n"
                + "Contribute to the debate: argue for a word, raise concerns about other suggestions, agree with "
                + "a teammate, or suggest ending the turn if that is safest. Don't just repeat what others said.\n";

        return guard.call(id + " debate",
                () -> client.complete("You are " + id + ", a debating Codenames Operative. Be insightful but concise.",
                        prompt),
                () -> "");
    }

    @Override
    public String finalVote(List<TranscriptEntry> transcript, List<String> options, GameView view, Clue clue) {
        String prompt = "You are " + id + ", a " + team + " team Operative in a game of Codenames.\n\n"
                + "After a team debate about the clue \"" + clue.getWord() + "\" for " + clue.getCount()
                + " words, cast your final vote.\n\n"
                + "The unrevealed words on the board are: " + String.join(", ", view.unrevealedWords()) + "\n\n"
                + "DEBATE SUMMARY:\n" + formatTranscript(transcript) + "\n"
                + "VOTING OPTIONS:\n"
                + options.stream().map(o -> "- " + o).collect(Collectors.joining("\n")) + "\n\n"
                + "Respond with EXACTLY one of the options listed above, nothing more.\n";

        String raw = guard.call(id + " vote",
                () -> client.complete("You are " + id + ", voting on a Codenames guess. Be decisive.", prompt),
                () -> "");
        return parser.matchVote(raw, options).orElseGet(() -> {
            log.warn("{} vote '{}' matches no option, voting to end", id, raw);
            return DebateManager.END;
        });
    }

    private static String formatTranscript(List<TranscriptEntry> transcript) {
        return transcript.stream()
                .map(e -> e.getAgentId() + ": " + e.getMessage())
                .collect(Collectors.joining("\n\n"));
    }

    private static String revealed(GameView view) {
        return view.revealedCards().stream()
                .map(c -> c.getWord() + " (" + c.getType() + ")")
                .collect(Collectors.joining(", "));
    }

    private static String previousGuesses(List<GuessRecord> history) {
        if (history == null || history.isEmpty()) {
            return "";
        }
        return "Previous guesses:\n" + history.stream()
                .map(g -> "- " + g.getWord() + " (" + g.getRevealedType() + ") " + (g.isCorrect() ? "correct" : "wrong"))
                .collect(Collectors.joining("\n")) + "\n";
    }
}
