package com.codenames.backend.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Distinct board words. Entries are trimmed, blanks dropped and case-insensitive duplicates collapsed,
 * keeping the first spelling seen.
 */
public class WordCorpus {

    private final List<String> words;

    private WordCorpus(List<String> words) {
        this.words = Collections.unmodifiableList(words);
    }

    public static WordCorpus of(Collection<String> raw) {
        Map<String, String> distinct = new LinkedHashMap<>();
        if (raw != null) {
            for (String entry : raw) {
                if (entry == null || entry.isBlank()) {
                    continue;
                }
                String word = entry.trim();
                distinct.putIfAbsent(word.toLowerCase(Locale.ROOT), word);
            }
        }
        return new WordCorpus(new ArrayList<>(distinct.values()));
    }

    public List<String> getWords() {
        return words;
    }

    public int size() {
        return words.size();
    }
}
