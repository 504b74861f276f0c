package com.mouse.odds.events;

public record CircuitBreakerReset(String sourceId) implements SignalEvent {

    @Override
    public String name() {
        return "circuitBreakerReset";
    }
}
