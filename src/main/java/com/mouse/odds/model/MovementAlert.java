package com.mouse.odds.model;

import com.mouse.odds.enums.MovementType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class MovementAlert {
    String fightId;
    String bookmaker;
    MovementType movementType;
    OddsSnapshot oldOdds;
    OddsSnapshot newOdds;
    BigDecimal fighter1Change;   // percent
    BigDecimal fighter2Change;   // percent
    BigDecimal percentageChange; // max magnitude of the two
    Instant timestamp;
}
