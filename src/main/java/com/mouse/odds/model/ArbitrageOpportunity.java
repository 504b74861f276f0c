package com.mouse.odds.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Best fighter1 and fighter2 prices across bookmakers whose implied probabilities sum below one.
 * Stakes are for the configured reference total and pay out equally on either result.
 */
@Value
@Builder(toBuilder = true)
public class ArbitrageOpportunity {
    String fightId;
    @Singular
    List<String> bookmakers;
    BigDecimal fighter1Odds;
    BigDecimal fighter2Odds;
    BigDecimal totalImpliedProbability;
    BigDecimal profitPercentage;
    BigDecimal totalStake;
    @Singular
    Map<String, BigDecimal> stakes;
    Instant detectedAt;
    Instant expiresAt;
}
