package com.mouse.odds.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SourceConfigFactory {

    private final IngestionProperties properties;

    /**
     * Builds and validates every configured source. A single invalid source aborts startup.
     */
    public List<SourceConfig> createAll() {
        List<SourceConfig> configs = new ArrayList<>();
        List<String> problems = new ArrayList<>();

        for (Map.Entry<String, IngestionProperties.Source> entry : properties.getSources().entrySet()) {
            SourceConfig config = toSourceConfig(entry.getKey(), entry.getValue());
            List<String> errors = validate(config);
            if (errors.isEmpty()) {
                configs.add(config);
                log.info("Source loaded: {} ({}) | {} rpm / {} rph | retries={} x{} max {}ms | apiKey={}",
                        config.getSourceId(), config.getName(),
                        config.getRequestsPerMinute(), config.getRequestsPerHour(),
                        config.getMaxRetries(), config.getBackoffMultiplier(), config.getMaxBackoffMs(),
                        config.hasApiKey() ? "set" : "none");
            } else {
                errors.forEach(e -> problems.add(entry.getKey() + ": " + e));
            }
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid source configuration: " + String.join("; ", problems));
        }
        return configs;
    }

    public static List<String> validate(SourceConfig config) {
        List<String> errors = new ArrayList<>();

        if (isBlank(config.getName())) errors.add("Name is required");
        if (isBlank(config.getBaseUrl())) errors.add("Base URL is required");

        if (config.getRequestsPerMinute() <= 0) errors.add("Requests per minute must be positive");
        if (config.getRequestsPerHour() <= 0) errors.add("Requests per hour must be positive");

        if (config.getMaxRetries() < 0) errors.add("Max retries cannot be negative");
        if (config.getBackoffMultiplier() <= 0) errors.add("Backoff multiplier must be positive");
        if (config.getMaxBackoffMs() <= 0) errors.add("Max backoff time must be positive");

        if (config.getFailureThreshold() <= 0) errors.add("Failure threshold must be positive");
        if (config.getRequestTimeoutMs() <= 0) errors.add("Request timeout must be positive");

        return errors;
    }

    static SourceConfig toSourceConfig(String sourceId, IngestionProperties.Source source) {
        return SourceConfig.builder()
                .sourceId(sourceId)
                .name(source.getName())
                .description(source.getDescription())
                .baseUrl(source.getBaseUrl())
                .endpoints(source.getEndpoints())
                .headers(source.getHeaders())
                .apiKey(isBlank(source.getApiKey()) ? null : source.getApiKey().trim())
                .requestsPerMinute(source.getRateLimit().getRequestsPerMinute())
                .requestsPerHour(source.getRateLimit().getRequestsPerHour())
                .maxRetries(source.getRetry().getMaxRetries())
                .backoffMultiplier(source.getRetry().getBackoffMultiplier())
                .baseDelayMs(source.getRetry().getBaseDelay().toMillis())
                .maxBackoffMs(source.getRetry().getMaxBackoff().toMillis())
                .failureThreshold(source.getCircuitBreaker().getFailureThreshold())
                .resetTimeoutMs(source.getCircuitBreaker().getResetTimeout().toMillis())
                .requestTimeoutMs(source.getRequestTimeout().toMillis())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
