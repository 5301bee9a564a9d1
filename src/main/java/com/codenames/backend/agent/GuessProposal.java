package com.codenames.backend.agent;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class GuessProposal {
    String word;
    String reasoning;
}
