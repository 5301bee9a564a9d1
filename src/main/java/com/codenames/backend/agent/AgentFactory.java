package com.codenames.backend.agent;

import com.codenames.backend.agent.llm.LanguageModelClient;
import com.codenames.backend.agent.llm.LlmOperativeAgent;
import com.codenames.backend.agent.llm.LlmSpymasterAgent;
import com.codenames.backend.agent.llm.ResponseParser;
import com.codenames.backend.model.Team;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds model-backed rosters. Each agent gets its own fallback {@link Random} derived from the seed.
 */
@Component
@RequiredArgsConstructor
public class AgentFactory {

    private final LanguageModelClient languageModelClient;
    private final AgentCallGuard agentCallGuard;
    private final ResponseParser responseParser;

    public SpymasterAgent spymaster(Team team, long seed) {
        return new LlmSpymasterAgent(team + " Spymaster", team, languageModelClient, agentCallGuard,
                responseParser, new Random(seed));
    }

    public List<OperativeAgent> operatives(Team team, int count, long seed) {
        List<OperativeAgent> operatives = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            operatives.add(new LlmOperativeAgent(team + " Operative " + i, team, languageModelClient,
                    agentCallGuard, responseParser, new Random(seed + i)));
        }
        return operatives;
    }
}
