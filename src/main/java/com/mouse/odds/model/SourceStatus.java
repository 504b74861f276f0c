package com.mouse.odds.model;

import com.mouse.odds.enums.CircuitState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SourceStatus {
    String sourceId;
    CircuitState circuitState;
    int failureCount;
    Instant lastFailureTime;
    RateLimiterSnapshot rateLimiter;
}
