package com.codenames.backend.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser(new ObjectMapper());
    private final List<String> ownWords = List.of("Sun", "Moon", "Star");
    private final List<String> board = List.of("Sun", "Moon", "Star", "Tree");

    @Test
    void testClueLines() {
        ParseResult<ParsedClue> result = parser.parseClue("CLUE: orbit\nNUMBER: 2\nTARGETS: [sun], moon, tree", ownWords);

        assertTrue(result.isParsed());
        assertEquals("orbit", result.getValue().getWord());
        assertEquals(2, result.getValue().getCount());
        assertEquals(List.of("Sun", "Moon"), result.getValue().getTargets());
    }

    @Test
    void testOverflowingNumberFallsBackToTargetCount() {
        ParseResult<ParsedClue> result = assertDoesNotThrow(
                () -> parser.parseClue("CLUE: orbit\nNUMBER: 99999999999\nTARGETS: sun", List.of("sun")));

        assertTrue(result.isParsed());
        assertEquals("orbit", result.getValue().getWord());
        assertEquals(1, result.getValue().getCount());
        assertEquals(List.of("sun"), result.getValue().getTargets());
    }

    @Test
    void testClueJson() {
        ParseResult<ParsedClue> result = parser.parseClue(
                "{\"clue\": \"sky\", \"selected_words\": [\"STAR\", \"moon\"], \"number\": 2}", ownWords);

        assertTrue(result.isParsed());
        assertEquals("sky", result.getValue().getWord());
        assertEquals(List.of("Star", "Moon"), result.getValue().getTargets());
    }

    @Test
    void testClueFailures() {
        assertEquals("empty response", parser.parseClue("  ", ownWords).getReason());
        assertEquals("no CLUE line", parser.parseClue("I think orbit works", ownWords).getReason());
        assertTrue(parser.parseClue("{\"clue\": ", ownWords).getReason().startsWith("malformed JSON"));
        assertEquals("JSON has no clue", parser.parseClue("{\"number\": 1}", ownWords).getReason());
        assertEquals("no target among the team's words",
                parser.parseClue("CLUE: bark\nNUMBER: 1\nTARGETS: tree", ownWords).getReason());
        assertThrows(IllegalStateException.class, () -> parser.parseClue("", ownWords).getValue());

        ParseResult<ParsedClue> refused = parser.parseClue("I think orbit works", ownWords);
        assertInstanceOf(ParseResult.Failure.class, refused);
        assertEquals("I think orbit works", ((ParseResult.Failure<ParsedClue>) refused).getRaw());
    }

    @Test
    void testGuessDecision() {
        ParseResult<ParsedGuess> result = parser.parseGuess("REASONING: bright and hot\nDECISION: Sun", board);

        assertTrue(result.isParsed());
        assertEquals("sun", result.getValue().getDecision());
        assertEquals("bright and hot", result.getValue().getReasoning());
    }

    @Test
    void testGuessEnd() {
        assertEquals("end", parser.parseGuess("REASONING: too risky\nDECISION: END", board).getValue().getDecision());
    }

    @Test
    void testGuessFromTrailingLines() {
        ParseResult<ParsedGuess> result = parser.parseGuess("Thinking about it.\nI'll go with moon.", board);

        assertEquals("moon", result.getValue().getDecision());
    }

    @Test
    void testGuessFailure() {
        ParseResult<ParsedGuess> result = parser.parseGuess("I have no idea", board);

        assertFalse(result.isParsed());
        assertEquals("no board word or END in the decision", result.getReason());
        assertEquals("end", result.orElseGet(() -> new ParsedGuess("end", "fallback")).getDecision());
    }

    @Test
    void testMatchVote() {
        List<String> options = List.of("end", "moon", "sun");

        assertEquals(Optional.of("moon"), parser.matchVote("Moon.", options));
        assertEquals(Optional.of("sun"), parser.matchVote("I vote for sun, then moon", options));
        assertEquals(Optional.empty(), parser.matchVote("banana", options));
        assertEquals(Optional.empty(), parser.matchVote(null, options));
    }
}
