package com.mouse.odds.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class MethodOdds {
    BigDecimal koTko;
    BigDecimal submission;
    BigDecimal decision;

    public static MethodOdds unknown() {
        return new MethodOdds(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
