package com.codenames.backend.config;

import com.codenames.backend.agent.AgentCallGuard;
import com.codenames.backend.agent.llm.LanguageModelClient;
import com.codenames.backend.agent.llm.OpenAiChatClient;
import com.codenames.backend.agent.llm.ResponseParser;
import com.codenames.backend.exception.ConfigurationException;
import com.codenames.backend.model.WordCorpus;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

@Slf4j
@Configuration
public class CodenamesConfig {

    @Bean
    public WordCorpus wordCorpus(CodenamesProperties properties) {
        Resource resource = new ClassPathResource(properties.getWordList());
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            List<String> lines = reader.lines()
                    .filter(line -> !line.startsWith("#"))
                    .collect(Collectors.toList());
            WordCorpus corpus = WordCorpus.of(lines);
            log.info("Loaded {} board words from {}", corpus.size(), properties.getWordList());
            return corpus;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read word list " + properties.getWordList(), e);
        }
    }

    /** Runs guarded model calls. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor(CodenamesProperties properties) {
        return Executors.newFixedThreadPool(properties.getAgent().getPoolSize());
    }

    /** Runs first-round debate proposals; kept apart from the agent pool so proposals never wait on themselves. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService debateExecutor(CodenamesProperties properties) {
        return Executors.newFixedThreadPool(properties.getAgent().getPoolSize());
    }

    @Bean
    public AgentCallGuard agentCallGuard(@Qualifier("agentExecutor") ExecutorService agentExecutor, CodenamesProperties properties) {
        return new AgentCallGuard(agentExecutor, properties.getAgent().getTimeout());
    }

    @Bean
    public ResponseParser responseParser(ObjectMapper objectMapper) {
        return new ResponseParser(objectMapper);
    }

    @Bean
    public LanguageModelClient languageModelClient(RestTemplateBuilder builder, ObjectMapper objectMapper,
                                                   CodenamesProperties properties) {
        CodenamesProperties.Llm llm = properties.getLlm();
        RestTemplate restTemplate = builder
                .setConnectTimeout(llm.getConnectTimeout())
                .setReadTimeout(llm.getReadTimeout())
                .build();
        return new OpenAiChatClient(restTemplate, objectMapper, llm);
    }
}
