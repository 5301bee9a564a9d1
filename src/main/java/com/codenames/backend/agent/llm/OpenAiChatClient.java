package com.codenames.backend.agent.llm;

import com.codenames.backend.config.CodenamesProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Client for an OpenAI-compatible {@code /chat/completions} endpoint.
 */
@Slf4j
public class OpenAiChatClient implements LanguageModelClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CodenamesProperties.Llm settings;

    public OpenAiChatClient(RestTemplate restTemplate, ObjectMapper objectMapper, CodenamesProperties.Llm settings) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new LanguageModelException("No API key configured for " + settings.getBaseUrl());
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(settings.getApiKey());

        Map<String, Object> body = Map.of(
                "model", settings.getModel(),
                "temperature", settings.getTemperature(),
                "max_tokens", settings.getMaxTokens(),
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)));

        String response;
        try {
            response = restTemplate.postForObject(settings.getBaseUrl() + "/chat/completions",
                    new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            throw new LanguageModelException("Chat completion request failed", e);
        }
        return extractContent(response);
    }

    String extractContent(String response) {
        if (response == null || response.isBlank()) {
            throw new LanguageModelException("Empty chat completion response");
        }
        try {
            JsonNode content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new LanguageModelException("Chat completion response has no message content");
            }
            return content.asText().trim();
        } catch (JsonProcessingException e) {
            throw new LanguageModelException("Malformed chat completion response", e);
        }
    }
}
