package com.codenames.backend.agent.llm;

import com.codenames.backend.agent.AgentCallGuard;
import com.codenames.backend.agent.ClueProposal;
import com.codenames.backend.agent.SpymasterAgent;
import com.codenames.backend.model.CardType;
import com.codenames.backend.model.GameView;
import com.codenames.backend.model.Team;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class LlmSpymasterAgent implements SpymasterAgent {

    private static final String SYSTEM_PROMPT = "You are a Codenames Spymaster AI focused on efficiency.";

    /** Clue words tried, in order, when the model gives nothing usable. */
    static final List<String> FALLBACK_CLUES = List.of("hint", "idea", "notion", "thought", "clue", "sign", "token");

    private final String id;
    private final Team team;
    private final LanguageModelClient client;
    private final AgentCallGuard guard;
    private final ResponseParser parser;
    private final Random random;

    public LlmSpymasterAgent(String id, Team team, LanguageModelClient client, AgentCallGuard guard,
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
    public ClueProposal generateClue(GameView spymasterView) {
        List<String> ownWords = spymasterView.unrevealedWordsOf(team.cardType());
        String prompt = buildPrompt(spymasterView, ownWords);

        String raw = guard.call(id + " clue", () -> client.complete(SYSTEM_PROMPT, prompt), () -> "");
        ParseResult<ParsedClue> parsed = parser.parseClue(raw, ownWords);
        if (parsed.isParsed()) {
            ParsedClue clue = parsed.getValue();
            log.debug("{} proposes clue '{}' for {}", id, clue.getWord(), clue.getTargets());
            return new ClueProposal(clue.getWord(), clue.getTargets());
        }
        log.warn("{} could not use model reply ({}), falling back", id, parsed.getReason());
        return fallbackClue(spymasterView, ownWords);
    }

    ClueProposal fallbackClue(GameView view, List<String> ownWords) {
        Set<String> boardWords = view.getCards().stream()
                .map(c -> c.getWord().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        String word = FALLBACK_CLUES.stream()
                .filter(w -> !boardWords.contains(w))
                .findFirst()
                .orElse("pass" + random.nextInt(1000));
        List<String> targets = ownWords.isEmpty()
                ? List.of()
                : List.of(ownWords.get(random.nextInt(ownWords.size())));
        return new ClueProposal(word, targets);
    }

    private String buildPrompt(GameView view, List<String> ownWords) {
        List<String> opponentWords = view.unrevealedWordsOf(team.opponent().cardType());
        List<String> neutralWords = view.unrevealedWordsOf(CardType.NEUTRAL);
        List<String> assassin = view.unrevealedWordsOf(CardType.ASSASSIN);

        return "You are the " + team + " Spymaster in a game of Codenames. Give a one-word clue and the board "
                + "words it points to.\n\n"
                + "Your team's words to guess: " + String.join(", ", ownWords) + "\n"
                + "Opponent's words (to avoid): " + String.join(", ", opponentWords) + "\n"
                + "Neutral words (to avoid): " + String.join(", ", neutralWords) + "\n"
                + "Assassin word (must avoid at all costs): " + String.join(", ", assassin) + "\n\n"
                + "Your team has " + ownWords.size() + " words remaining, the opponent has "
                + opponentWords.size() + ".\n"
                + "Connect as many of your words as you safely can. The clue must be a single word and must not "
                + "be a word on the board.\n\n"
                + "You MUST respond in EXACTLY this format:\n"
                + "CLUE: [your_clue_word]\n"
                + "NUMBER: [number_of_words]\n"
                + "TARGETS: [word1], [word2], etc.\n";
    }
}
