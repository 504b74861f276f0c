package com.mouse.odds.events;

import com.mouse.odds.model.IngestionResult;

public record SyncCompleted(IngestionResult result) implements SignalEvent {

    @Override
    public String name() {
        return "syncComplete";
    }
}
