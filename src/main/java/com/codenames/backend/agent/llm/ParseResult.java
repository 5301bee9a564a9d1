package com.codenames.backend.agent.llm;

import java.util.function.Supplier;

/**
 * Outcome of reading model text: either a value or the raw text with the reason it was refused.
 */
public abstract class ParseResult<T> {

    private ParseResult() {
    }

    public static <T> ParseResult<T> parsed(T value) {
        return new Parsed<>(value);
    }

    public static <T> ParseResult<T> failure(String raw, String reason) {
        return new Failure<>(raw, reason);
    }

    public abstract boolean isParsed();

    public abstract T getValue();

    /**
     * @return why parsing failed, or {@code null} for a parsed result
     */
    public abstract String getReason();

    public T orElseGet(Supplier<T> fallback) {
        return isParsed() ? getValue() : fallback.get();
    }

    public static final class Parsed<T> extends ParseResult<T> {
        private final T value;

        private Parsed(T value) {
            this.value = value;
        }

        @Override
        public boolean isParsed() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public String getReason() {
            return null;
        }

        @Override
        public String toString() {
            return "Parsed{" + value + "}";
        }
    }

    public static final class Failure<T> extends ParseResult<T> {
        private final String raw;
        private final String reason;

        private Failure(String raw, String reason) {
            this.raw = raw;
            this.reason = reason;
        }

        @Override
        public boolean isParsed() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("No value, parse failed: " + reason);
        }

        public String getRaw() {
            return raw;
        }

        @Override
        public String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return "ParseFailure{" + reason + "}";
        }
    }
}
