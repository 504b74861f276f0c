package com.mouse.odds.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Round-betting prices. Rounds 4 and 5 stay null for three-round fights.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RoundOdds {
    BigDecimal round1;
    BigDecimal round2;
    BigDecimal round3;
    BigDecimal round4;
    BigDecimal round5;

    public static RoundOdds unknown() {
        return new RoundOdds(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null, null);
    }
}
