package com.mouse.odds.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw binding of the {@code ingestion.*} tree. Turned into immutable {@link SourceConfig}s by
 * {@link SourceConfigFactory}; nothing else reads it directly except the odds options.
 */
@Data
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    private Map<String, Source> sources = new LinkedHashMap<>();

    private Odds odds = new Odds();

    @Data
    public static class Source {
        private String name;
        private String description;
        private String baseUrl;
        private String apiKey;
        private Map<String, String> endpoints = new LinkedHashMap<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private RateLimit rateLimit = new RateLimit();
        private Retry retry = new Retry();
        private CircuitBreaker circuitBreaker = new CircuitBreaker();
        private Duration requestTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class RateLimit {
        private int requestsPerMinute;
        private int requestsPerHour;
    }

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private double backoffMultiplier = 2.0;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofMinutes(1);
    }

    // ==================== ODDS FEED ====================

    @Data
    public static class Odds {
        private boolean enabled = true;
        private String sourceId = "the-odds-api";
        private String sportKey = "mma_mixed_martial_arts";
        private List<String> regions = new ArrayList<>(List.of("us", "us2", "uk", "au", "eu"));
        private List<String> markets = new ArrayList<>(List.of("h2h", "fight_result_method", "fight_result_round"));
        private String oddsFormat = "american";
        private Duration syncInterval = Duration.ofMinutes(5);
        private Duration initialDelay = Duration.ofSeconds(10);
        private Bookmakers bookmakers = new Bookmakers();
    }

    @Data
    public static class Bookmakers {
        private List<String> include = new ArrayList<>();
        private List<String> exclude = new ArrayList<>();
        private List<String> priority = new ArrayList<>();
    }
}
