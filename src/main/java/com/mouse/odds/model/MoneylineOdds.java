package com.mouse.odds.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Head-to-head prices in American odds. Zero means the side was not quoted.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MoneylineOdds {
    BigDecimal fighter1;
    BigDecimal fighter2;

    public static MoneylineOdds of(BigDecimal fighter1, BigDecimal fighter2) {
        return new MoneylineOdds(fighter1, fighter2);
    }

    public boolean hasBothSides() {
        return isQuoted(fighter1) && isQuoted(fighter2);
    }

    private static boolean isQuoted(BigDecimal price) {
        return price != null && price.signum() != 0;
    }
}
