package com.codenames.backend.agent.llm;

import com.codenames.backend.debate.DebateManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model replies into typed values. Nothing past this class ever sees model text.
 *
 * <p>Clue replies follow {@code CLUE: / NUMBER: / TARGETS:} lines, or a JSON object with {@code clue} and
 * {@code selected_words}. Guess replies follow {@code REASONING: / DECISION:}.
 */
public class ResponseParser {

    private static final Pattern CLUE = Pattern.compile("CLUE:\\s*\\[?([\\w\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("NUMBER:\\s*\\[?(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TARGETS = Pattern.compile("TARGETS:\\s*(.*?)(?:\\n|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern REASONING = Pattern.compile("REASONING:\\s*(.*?)(?:DECISION:|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern DECISION = Pattern.compile("DECISION:\\s*(.*?)(?:\\n|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_WORD = Pattern.compile("\\bend\\b");
    private static final String EDGE_NOISE = "^[\\s\\[\\]\"'*`]+|[\\s\\[\\]\"'*`.,!]+$";

    private final ObjectMapper objectMapper;

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param ownWords the spymaster's unrevealed team words; targets outside this list are dropped
     */
    public ParseResult<ParsedClue> parseClue(String raw, List<String> ownWords) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.failure(raw, "empty response");
        }
        String text = raw.trim();
        if (text.startsWith("{")) {
            return parseJsonClue(raw, text, ownWords);
        }

        Matcher clue = CLUE.matcher(text);
        if (!clue.find()) {
            return ParseResult.failure(raw, "no CLUE line");
        }
        Matcher number = NUMBER.matcher(text);
        Integer count = number.find() ? statedCount(number.group(1)) : null;

        List<String> rawTargets = new ArrayList<>();
        Matcher targets = TARGETS.matcher(text);
        if (targets.find()) {
            rawTargets.addAll(Arrays.asList(targets.group(1).split(",")));
        }
        return finishClue(raw, clue.group(1), count, rawTargets, ownWords);
    }

    private ParseResult<ParsedClue> parseJsonClue(String raw, String text, List<String> ownWords) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return ParseResult.failure(raw, "malformed JSON: " + e.getOriginalMessage());
        }
        String word = node.path("clue").asText("");
        if (word.isBlank()) {
            return ParseResult.failure(raw, "JSON has no clue");
        }
        JsonNode targetNode = node.has("selected_words") ? node.get("selected_words") : node.path("targets");
        List<String> rawTargets = new ArrayList<>();
        targetNode.forEach(t -> rawTargets.add(t.asText()));
        Integer count = node.path("number").isInt() ? node.get("number").asInt() : null;
        return finishClue(raw, word.trim(), count, rawTargets, ownWords);
    }

    private static Integer statedCount(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            // too large for an int; the target list gives the count
            return null;
        }
    }

    private ParseResult<ParsedClue> finishClue(String raw, String word, Integer count, List<String> rawTargets,
                                               List<String> ownWords) {
        Set<String> matched = new LinkedHashSet<>();
        for (String candidate : rawTargets) {
            String cleaned = clean(candidate);
            ownWords.stream()
                    .filter(w -> w.equalsIgnoreCase(cleaned))
                    .findFirst()
                    .ifPresent(matched::add);
        }
        if (matched.isEmpty()) {
            return ParseResult.failure(raw, "no target among the team's words");
        }
        int stated = count != null ? count : matched.size();
        return ParseResult.parsed(new ParsedClue(word, stated, List.copyOf(matched)));
    }

    /**
     * @param unrevealed words still hidden on the board
     * @return a lower-case board word or {@code "end"} as the decision
     */
    public ParseResult<ParsedGuess> parseGuess(String raw, List<String> unrevealed) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.failure(raw, "empty response");
        }
        String text = raw.trim();

        Matcher reasoningMatch = REASONING.matcher(text);
        String reasoning = reasoningMatch.find() ? reasoningMatch.group(1).trim() : text;

        String decision = null;
        Matcher decisionMatch = DECISION.matcher(text);
        if (decisionMatch.find()) {
            decision = resolveDecision(decisionMatch.group(1), unrevealed);
        }
        if (decision == null) {
            String[] lines = text.split("\\n");
            for (int i = lines.length - 1; i >= Math.max(0, lines.length - 3) && decision == null; i--) {
                decision = resolveDecision(lines[i], unrevealed);
            }
        }
        if (decision == null) {
            return ParseResult.failure(raw, "no board word or END in the decision");
        }
        return ParseResult.parsed(new ParsedGuess(decision, reasoning));
    }

    private String resolveDecision(String candidate, List<String> unrevealed) {
        String cleaned = clean(candidate).toLowerCase(Locale.ROOT);
        if (cleaned.isEmpty()) {
            return null;
        }
        for (String word : unrevealed) {
            if (word.equalsIgnoreCase(cleaned)) {
                return word.toLowerCase(Locale.ROOT);
            }
        }
        if (END_WORD.matcher(cleaned).find()) {
            return DebateManager.END;
        }
        return firstMentioned(cleaned, unrevealed).map(w -> w.toLowerCase(Locale.ROOT)).orElse(null);
    }

    /**
     * Maps a free-text vote onto one of the offered options.
     */
    public Optional<String> matchVote(String raw, List<String> options) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String cleaned = clean(raw);
        for (String option : options) {
            if (option.equalsIgnoreCase(cleaned)) {
                return Optional.of(option);
            }
        }
        return firstMentioned(cleaned.toLowerCase(Locale.ROOT), options);
    }

    /**
     * The candidate whose whole-word mention comes earliest in {@code text}.
     */
    private static Optional<String> firstMentioned(String text, List<String> candidates) {
        String lower = text.toLowerCase(Locale.ROOT);
        String best = null;
        int bestIndex = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            Matcher m = Pattern.compile("\\b" + Pattern.quote(candidate.toLowerCase(Locale.ROOT)) + "\\b")
                    .matcher(lower);
            if (m.find() && m.start() < bestIndex) {
                best = candidate;
                bestIndex = m.start();
            }
        }
        return Optional.ofNullable(best);
    }

    private static String clean(String value) {
        return value == null ? "" : value.replaceAll(EDGE_NOISE, "");
    }
}
