package com.mouse.odds.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Immutable settings of one upstream source, resolved once at startup.
 */
@Value
@Builder(toBuilder = true)
public class SourceConfig {
    String sourceId;
    String name;
    String description;
    String baseUrl;
    @Singular
    Map<String, String> endpoints;   // name -> path template with {param} placeholders
    @Singular
    Map<String, String> headers;
    String apiKey;

    int requestsPerMinute;
    int requestsPerHour;

    int maxRetries;
    double backoffMultiplier;
    long maxBackoffMs;
    @Builder.Default
    long baseDelayMs = 1000;

    @Builder.Default
    int failureThreshold = 5;
    @Builder.Default
    long resetTimeoutMs = 60_000;

    @Builder.Default
    long requestTimeoutMs = 30_000;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Resolves a named endpoint against the base URL, substituting URL-encoded path parameters.
     *
     * @throws IllegalArgumentException if the endpoint is unknown or a placeholder stays unresolved
     */
    public String endpointUrl(String endpoint, Map<String, String> pathParams) {
        String template = endpoints.get(endpoint);
        if (template == null) {
            throw new IllegalArgumentException(
                    String.format("Endpoint '%s' not found for source '%s'", endpoint, sourceId));
        }

        String path = template;
        if (pathParams != null) {
            for (Map.Entry<String, String> param : pathParams.entrySet()) {
                path = path.replace("{" + param.getKey() + "}",
                        URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
            }
        }

        if (path.contains("{")) {
            throw new IllegalArgumentException(
                    String.format("Unresolved path parameter in '%s' for endpoint '%s' of source '%s'", path, endpoint, sourceId));
        }
        return baseUrl + path;
    }
}
