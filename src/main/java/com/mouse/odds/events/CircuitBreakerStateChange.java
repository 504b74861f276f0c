package com.mouse.odds.events;

import com.mouse.odds.enums.CircuitState;

public record CircuitBreakerStateChange(String sourceId, CircuitState state) implements SignalEvent {

    @Override
    public String name() {
        return "circuitBreakerStateChange";
    }
}
