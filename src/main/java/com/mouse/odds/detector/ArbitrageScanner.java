package com.mouse.odds.detector;

import com.mouse.odds.config.DetectionConfig;
import com.mouse.odds.events.ArbitrageDetected;
import com.mouse.odds.interfaces.OddsSink;
import com.mouse.odds.interfaces.SignalPublisher;
import com.mouse.odds.model.ArbitrageOpportunity;
import com.mouse.odds.model.OddsSnapshot;
import com.mouse.odds.utils.OddsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Looks for a two-way arbitrage on one fight: the best fighter1 price and the best fighter2 price,
 * taken from different bookmakers, whose implied probabilities sum below one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArbitrageScanner {

    private final DetectionConfig detectionConfig;
    private final OddsSink oddsSink;
    private final SignalPublisher signalPublisher;
    private final Clock clock;

    /**
     * @param fightSnapshots snapshots of a single fight, any number of bookmakers
     * @throws IllegalArgumentException if the snapshots belong to more than one fight
     */
    public Optional<ArbitrageOpportunity> scan(List<OddsSnapshot> fightSnapshots) {
        if (fightSnapshots == null || fightSnapshots.isEmpty()) {
            return Optional.empty();
        }

        String fightId = fightSnapshots.get(0).getFightId();
        for (OddsSnapshot snapshot : fightSnapshots) {
            if (!Objects.equals(fightId, snapshot.getFightId())) {
                throw new IllegalArgumentException(String.format(
                        "Arbitrage scan needs snapshots of one fight, got %s and %s", fightId, snapshot.getFightId()));
            }
        }

        Collection<OddsSnapshot> quotes = latestPerBookmaker(fightSnapshots);
        if (quotes.size() < 2) {
            return Optional.empty();
        }

        BestPrices best = bestPrices(quotes);
        OddsSnapshot bestFighter1 = best.fighter1();
        OddsSnapshot bestFighter2 = best.fighter2();
        if (bestFighter1.getBookmaker().equals(bestFighter2.getBookmaker())) {
            return Optional.empty();
        }

        BigDecimal fighter1Odds = best.fighter1Odds();
        BigDecimal fighter2Odds = best.fighter2Odds();
        BigDecimal p1 = OddsCalculator.impliedProbability(fighter1Odds);
        BigDecimal p2 = OddsCalculator.impliedProbability(fighter2Odds);
        BigDecimal total = p1.add(p2);

        if (total.compareTo(BigDecimal.ONE) >= 0) {
            return Optional.empty();
        }

        BigDecimal profit = OddsCalculator.profitPercentage(total);
        if (profit.compareTo(detectionConfig.getMinArbitrageProfit()) < 0) {
            log.debug("ARB BELOW MIN | fightId={} profit={}% min={}%", fightId, profit, detectionConfig.getMinArbitrageProfit());
            return Optional.empty();
        }

        BigDecimal stake = detectionConfig.getReferenceStake();
        Instant now = clock.instant();

        ArbitrageOpportunity opportunity = ArbitrageOpportunity.builder()
                .fightId(fightId)
                .bookmaker(bestFighter1.getBookmaker())
                .bookmaker(bestFighter2.getBookmaker())
                .fighter1Odds(fighter1Odds)
                .fighter2Odds(fighter2Odds)
                .totalImpliedProbability(total)
                .profitPercentage(profit)
                .totalStake(stake)
                .stake(bestFighter1.getBookmaker(), OddsCalculator.stakeFor(p1, total, stake))
                .stake(bestFighter2.getBookmaker(), OddsCalculator.stakeFor(p2, total, stake))
                .detectedAt(now)
                .expiresAt(now.plus(detectionConfig.getArbitrageTtl()))
                .build();

        log.info("ARB DETECTED | fightId={} f1={}@{} f2={}@{} profit={}% stakes={}",
                fightId, bestFighter1.getBookmaker(), fighter1Odds, bestFighter2.getBookmaker(), fighter2Odds,
                profit, opportunity.getStakes());
        oddsSink.writeArbitrageOpportunity(opportunity);
        signalPublisher.publish(new ArbitrageDetected(fightId, opportunity.getBookmakers(), profit));
        return Optional.of(opportunity);
    }

    private static Collection<OddsSnapshot> latestPerBookmaker(List<OddsSnapshot> snapshots) {
        Map<String, OddsSnapshot> latest = new LinkedHashMap<>();
        for (OddsSnapshot snapshot : snapshots) {
            if (snapshot.getMoneyline() == null || !snapshot.getMoneyline().hasBothSides()) {
                continue;
            }
            latest.merge(snapshot.getBookmaker(), snapshot, (current, candidate) -> isNewer(candidate, current) ? candidate : current);
        }
        return new ArrayList<>(latest.values());
    }

    private static boolean isNewer(OddsSnapshot candidate, OddsSnapshot current) {
        if (candidate.getTimestamp() == null) return false;
        if (current.getTimestamp() == null) return true;
        return !candidate.getTimestamp().isBefore(current.getTimestamp());
    }

    /**
     * Quote carrying the best fighter1 price and quote carrying the best fighter2 price. A higher
     * American price always pays more. Among tied quotes a pair from two different bookmakers wins,
     * otherwise the first quote seen.
     *
     * @param quotes non-empty, both sides quoted
     */
    public static BestPrices bestPrices(Collection<OddsSnapshot> quotes) {
        List<OddsSnapshot> fighter1 = topQuotes(quotes, s -> s.getMoneyline().getFighter1());
        List<OddsSnapshot> fighter2 = topQuotes(quotes, s -> s.getMoneyline().getFighter2());

        for (OddsSnapshot candidate1 : fighter1) {
            for (OddsSnapshot candidate2 : fighter2) {
                if (!candidate1.getBookmaker().equals(candidate2.getBookmaker())) {
                    return new BestPrices(candidate1, candidate2);
                }
            }
        }
        return new BestPrices(fighter1.get(0), fighter2.get(0));
    }

    public record BestPrices(OddsSnapshot fighter1, OddsSnapshot fighter2) {

        public BigDecimal fighter1Odds() {
            return fighter1.getMoneyline().getFighter1();
        }

        public BigDecimal fighter2Odds() {
            return fighter2.getMoneyline().getFighter2();
        }
    }

    private static List<OddsSnapshot> topQuotes(Collection<OddsSnapshot> quotes, Function<OddsSnapshot, BigDecimal> price) {
        List<OddsSnapshot> top = new ArrayList<>();
        BigDecimal bestPrice = null;
        for (OddsSnapshot quote : quotes) {
            int cmp = bestPrice == null ? 1 : price.apply(quote).compareTo(bestPrice);
            if (cmp > 0) {
                top.clear();
                bestPrice = price.apply(quote);
            }
            if (cmp >= 0) {
                top.add(quote);
            }
        }
        return top;
    }
}
