package com.codenames.backend.agent.llm;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor
public class ParsedClue {
    String word;
    int count;
    List<String> targets;
}
