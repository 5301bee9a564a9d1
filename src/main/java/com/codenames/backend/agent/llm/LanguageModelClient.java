package com.codenames.backend.agent.llm;

public interface LanguageModelClient {

    /**
     * One chat completion.
     *
     * @throws LanguageModelException if the model cannot be reached or answers with something unusable
     */
    String complete(String systemPrompt, String userPrompt);
}
