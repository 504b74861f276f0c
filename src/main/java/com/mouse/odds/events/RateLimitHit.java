package com.mouse.odds.events;

import com.mouse.odds.enums.RateLimitWindow;

public record RateLimitHit(String sourceId, RateLimitWindow type, long waitTimeMs) implements SignalEvent {

    @Override
    public String name() {
        return "rateLimitHit";
    }
}
