package com.mouse.odds.exception;

import lombok.Getter;

/**
 * Thrown without touching the network when a source's circuit breaker rejects a call.
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String sourceId;
    private final long retryAfterMs;

    public CircuitOpenException(String sourceId, long retryAfterMs) {
        super(String.format("Circuit breaker is OPEN. Service unavailable for %s (retry in %dms)", sourceId, retryAfterMs));
        this.sourceId = sourceId;
        this.retryAfterMs = retryAfterMs;
    }
}
