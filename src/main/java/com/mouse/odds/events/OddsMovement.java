package com.mouse.odds.events;

import com.mouse.odds.enums.MovementType;

import java.math.BigDecimal;

public record OddsMovement(String fightId, String bookmaker, MovementType movementType,
                           BigDecimal percentageChange) implements SignalEvent {

    @Override
    public String name() {
        return "oddsMovement";
    }
}
