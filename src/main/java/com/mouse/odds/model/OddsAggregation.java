package com.mouse.odds.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cross-bookmaker view of one fight from a single sync: best price per side, consensus
 * probabilities and how far the books disagree.
 */
@Value
@Builder(toBuilder = true)
public class OddsAggregation {
    String fightId;
    String eventId;
    String fighter1;
    String fighter2;
    String commenceTime;
    @Singular
    List<String> bookmakers;
    BestPrice bestFighter1;
    BestPrice bestFighter2;
    Consensus consensus;
    @Singular("marketAvailable")
    List<String> marketsAvailable;
    BigDecimal averageSpread;    // American-odds points, mean of both sides
    ArbitrageOpportunity arbitrage;

    public int getBookmakerCount() {
        return bookmakers.size();
    }

    @Value
    @Builder
    public static class BestPrice {
        String bookmaker;
        BigDecimal odds;
    }

    @Value
    @Builder
    public static class Consensus {
        BigDecimal fighter1Probability;
        BigDecimal fighter2Probability;
        BigDecimal confidence;
    }
}
