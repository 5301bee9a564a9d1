package com.codenames.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "codenames")
public class CodenamesProperties {

    /** Classpath resource with one board word per line. */
    private String wordList = "words.txt";

    private Match match = new Match();
    private Debate debate = new Debate();
    private Agent agent = new Agent();
    private Llm llm = new Llm();

    @Data
    public static class Match {
        /** Turn limit for automated matches. */
        private int maxTurns = 20;
        /** Times a spymaster is asked again after an invalid clue. */
        private int clueRetries = 3;
    }

    @Data
    public static class Debate {
        private int rounds = 2;
        private boolean parallelProposals = true;
    }

    @Data
    public static class Agent {
        private Duration timeout = Duration.ofSeconds(30);
        private int poolSize = 8;
    }

    @Data
    public static class Llm {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o";
        private double temperature = 0.7;
        private int maxTokens = 500;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(60);
    }
}
