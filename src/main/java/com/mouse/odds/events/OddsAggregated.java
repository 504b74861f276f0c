package com.mouse.odds.events;

import java.math.BigDecimal;

public record OddsAggregated(String fightId, int bookmakers, BigDecimal fighter1Probability,
                             BigDecimal fighter2Probability, BigDecimal confidence) implements SignalEvent {

    @Override
    public String name() {
        return "oddsAggregated";
    }
}
