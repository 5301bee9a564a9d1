package com.codenames.backend.debate;

import com.codenames.backend.model.GameView;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Best-effort read of which option a free-form debate message argues for.
 * Priority: an end-turn phrase, then a quoted board word, then the first board word mentioned.
 */
public class PreferenceExtractor {

    private static final List<String> END_PHRASES = List.of(
            "end turn", "end the turn", "end our turn", "ending the turn", "ending our turn");

    // straight and curly quotes
    private static final Pattern QUOTED = Pattern.compile(
            "['‘’]([^'‘’]*)['‘’]|[\"“”]([^\"“”]*)[\"“”]");

    public Optional<String> extract(String message, GameView view) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        String text = message.toLowerCase(Locale.ROOT);

        for (String phrase : END_PHRASES) {
            if (text.contains(phrase)) {
                return Optional.of(DebateManager.END);
            }
        }

        List<String> unrevealed = view.unrevealedWords().stream()
                .map(w -> w.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());

        Matcher quoted = QUOTED.matcher(text);
        while (quoted.find()) {
            for (int group = 1; group <= 2; group++) {
                String candidate = quoted.group(group);
                if (candidate != null && unrevealed.contains(candidate.trim())) {
                    return Optional.of(candidate.trim());
                }
            }
        }

        for (String word : unrevealed) {
            if (Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find()) {
                return Optional.of(word);
            }
        }
        return Optional.empty();
    }
}
