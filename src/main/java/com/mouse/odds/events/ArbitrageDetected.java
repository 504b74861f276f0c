package com.mouse.odds.events;

import java.math.BigDecimal;
import java.util.List;

public record ArbitrageDetected(String fightId, List<String> bookmakers, BigDecimal profit) implements SignalEvent {

    @Override
    public String name() {
        return "arbitrageDetected";
    }
}
