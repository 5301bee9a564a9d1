package com.codenames.backend.agent.llm;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class ParsedGuess {
    String decision;
    String reasoning;
}
