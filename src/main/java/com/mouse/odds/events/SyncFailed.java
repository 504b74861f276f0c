package com.mouse.odds.events;

public record SyncFailed(String sourceId, String error) implements SignalEvent {

    @Override
    public String name() {
        return "syncError";
    }
}
