package com.mouse.odds.events;

public record RetryAttempt(String sourceId, int attempt, int maxRetries, long backoffMs, String error) implements SignalEvent {

    @Override
    public String name() {
        return "retryAttempt";
    }
}
