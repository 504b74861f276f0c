package com.mouse.odds.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Prices of one bookmaker for one fight at capture time. Later snapshots for the same
 * (fight, bookmaker) supersede this one; nothing mutates it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OddsSnapshot {
    String fightId;
    String bookmaker;
    Instant timestamp;
    MoneylineOdds moneyline;
    MethodOdds method;
    RoundOdds rounds;

    public String key() {
        return fightId + "_" + bookmaker;
    }
}
