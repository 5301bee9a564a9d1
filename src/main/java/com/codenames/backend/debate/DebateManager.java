package com.codenames.backend.debate;

import com.codenames.backend.agent.Clue;
import com.codenames.backend.agent.GuessProposal;
import com.codenames.backend.agent.OperativeAgent;
import com.codenames.backend.model.GameView;
import com.codenames.backend.model.GuessRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Resolves one team decision from several operatives: a proposal round, {@code rounds - 1} discussion
 * rounds in roster order, then a vote restricted to the options raised plus {@code "end"}.
 *
 * <p>The only intended nondeterminism is the tie-break, drawn from the {@link Random} given at
 * construction. Agent failures never escape; they degrade to a random unrevealed word, an empty
 * message or an {@code "end"} vote. The manager never touches the engine; callers apply the decision.
 */
@Slf4j
public class DebateManager {

    public static final String END = "end";

    private final int rounds;
    private final Random random;
    private final ExecutorService proposalExecutor;
    private final PreferenceExtractor extractor = new PreferenceExtractor();

    public DebateManager(int rounds, Random random) {
        this(rounds, random, null);
    }

    /**
     * @param proposalExecutor pool for the independent first-round proposals; {@code null} runs them in order
     */
    public DebateManager(int rounds, Random random, ExecutorService proposalExecutor) {
        if (rounds < 1) {
            throw new IllegalArgumentException("Debate needs at least one round, got " + rounds);
        }
        this.rounds = rounds;
        this.random = random;
        this.proposalExecutor = proposalExecutor;
    }

    public int getRounds() {
        return rounds;
    }

    public DebateResult runDebate(List<? extends OperativeAgent> agents, GameView view, Clue clue,
                                  int correctSoFar, List<GuessRecord> history) {
        List<TranscriptEntry> transcript = new ArrayList<>();
        if (agents == null || agents.isEmpty()) {
            log.warn("Debate on '{}' has no operatives, ending turn", clue.getWord());
            return new DebateResult(END, Map.of(), List.of(), List.of(), List.of(END));
        }

        List<GuessProposal> proposals = collectProposals(agents, view, clue, correctSoFar, history);
        for (int i = 0; i < agents.size(); i++) {
            GuessProposal proposal = proposals.get(i);
            String message = "I suggest we guess '" + proposal.getWord() + "'.\nMy reasoning: "
                    + proposal.getReasoning();
            transcript.add(new TranscriptEntry(1, agents.get(i).getId(), message,
                    normalizeProposal(proposal.getWord(), view)));
        }

        for (int round = 2; round <= rounds; round++) {
            for (OperativeAgent agent : agents) {
                String message = contribution(agent, List.copyOf(transcript), view, clue);
                String preference = extractor.extract(message, view).orElse(null);
                transcript.add(new TranscriptEntry(round, agent.getId(), message, preference));
            }
        }

        List<String> options = votingOptions(transcript);
        Map<String, Integer> voteCounts = new TreeMap<>();
        List<TranscriptEntry> finalTranscript = Collections.unmodifiableList(transcript);
        for (OperativeAgent agent : agents) {
            String vote = matchOption(vote(agent, finalTranscript, options, view, clue), options);
            voteCounts.merge(vote, 1, Integer::sum);
            log.debug("{} votes for {}", agent.getId(), vote);
        }

        String decision = pickWinner(options, voteCounts);
        List<TranscriptEntry> excerpt = transcript.stream()
                .filter(e -> decision.equals(e.getPreference()))
                .limit(2)
                .collect(Collectors.toList());

        log.info("Debate on '{}' {} decided '{}' with votes {}", clue.getWord(), clue.getCount(), decision, voteCounts);
        return new DebateResult(decision, Collections.unmodifiableMap(voteCounts), List.copyOf(transcript),
                excerpt, options);
    }

    private List<GuessProposal> collectProposals(List<? extends OperativeAgent> agents, GameView view, Clue clue,
                                                 int correctSoFar, List<GuessRecord> history) {
        List<GuessRecord> historyCopy = history == null ? List.of() : List.copyOf(history);
        List<GuessProposal> proposals = new ArrayList<>(agents.size());

        if (proposalExecutor == null) {
            for (OperativeAgent agent : agents) {
                GuessProposal proposal;
                try {
                    proposal = agent.generateGuess(view, clue, correctSoFar, historyCopy);
                } catch (RuntimeException e) {
                    log.warn("{} failed to propose: {}", agent.getId(), e.toString());
                    proposal = null;
                }
                proposals.add(proposal != null ? proposal : fallbackProposal(view));
            }
            return proposals;
        }

        List<Future<GuessProposal>> futures = new ArrayList<>(agents.size());
        for (OperativeAgent agent : agents) {
            Callable<GuessProposal> task = () -> agent.generateGuess(view, clue, correctSoFar, historyCopy);
            try {
                futures.add(proposalExecutor.submit(task));
            } catch (RejectedExecutionException e) {
                log.warn("Proposal pool rejected {}", agent.getId());
                futures.add(null);
            }
        }
        for (int i = 0; i < agents.size(); i++) {
            GuessProposal proposal = null;
            Future<GuessProposal> future = futures.get(i);
            if (future != null) {
                try {
                    proposal = future.get();
                } catch (ExecutionException e) {
                    log.warn("{} failed to propose: {}", agents.get(i).getId(), String.valueOf(e.getCause()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted waiting for {}", agents.get(i).getId());
                }
            }
            proposals.add(proposal != null ? proposal : fallbackProposal(view));
        }
        return proposals;
    }

    private GuessProposal fallbackProposal(GameView view) {
        List<String> unrevealed = view.unrevealedWords();
        if (unrevealed.isEmpty()) {
            return new GuessProposal(END, "No proposal available");
        }
        return new GuessProposal(unrevealed.get(random.nextInt(unrevealed.size())), "No proposal available");
    }

    private String contribution(OperativeAgent agent, List<TranscriptEntry> transcript, GameView view, Clue clue) {
        try {
            String message = agent.debateContribution(transcript, view, clue);
            return message == null ? "" : message;
        } catch (RuntimeException e) {
            log.warn("{} failed to contribute: {}", agent.getId(), e.toString());
            return "";
        }
    }

    private String vote(OperativeAgent agent, List<TranscriptEntry> transcript, List<String> options,
                        GameView view, Clue clue) {
        try {
            return agent.finalVote(transcript, options, view, clue);
        } catch (RuntimeException e) {
            log.warn("{} failed to vote: {}", agent.getId(), e.toString());
            return END;
        }
    }

    private String normalizeProposal(String guess, GameView view) {
        if (guess == null || guess.isBlank()) {
            return null;
        }
        String normalized = guess.trim().toLowerCase(Locale.ROOT);
        if (END.equals(normalized)) {
            return END;
        }
        return view.unrevealedWords().stream()
                .map(w -> w.toLowerCase(Locale.ROOT))
                .filter(normalized::equals)
                .findFirst()
                .orElse(null);
    }

    private static List<String> votingOptions(List<TranscriptEntry> transcript) {
        TreeSet<String> options = new TreeSet<>();
        for (TranscriptEntry entry : transcript) {
            entry.preference().ifPresent(options::add);
        }
        options.add(END);
        return List.copyOf(options);
    }

    private static String matchOption(String vote, List<String> options) {
        if (vote == null) {
            return END;
        }
        String normalized = vote.trim();
        return options.stream()
                .filter(o -> o.equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(END);
    }

    private String pickWinner(List<String> options, Map<String, Integer> voteCounts) {
        int top = voteCounts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<String> tied = options.stream()
                .filter(o -> voteCounts.getOrDefault(o, 0) == top)
                .collect(Collectors.toList());
        if (tied.size() == 1) {
            return tied.get(0);
        }
        String chosen = tied.get(random.nextInt(tied.size()));
        log.info("Tie between {}, randomly chose '{}'", tied, chosen);
        return chosen;
    }
}
