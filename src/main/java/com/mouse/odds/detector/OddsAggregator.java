package com.mouse.odds.detector;

import com.mouse.odds.converter.OddsApiNormalizer;
import com.mouse.odds.events.OddsAggregated;
import com.mouse.odds.interfaces.SignalPublisher;
import com.mouse.odds.model.OddsAggregation;
import com.mouse.odds.model.OddsSnapshot;
import com.mouse.odds.model.oddsapi.OddsApiBookmaker;
import com.mouse.odds.model.oddsapi.OddsApiEvent;
import com.mouse.odds.model.oddsapi.OddsApiMarket;
import com.mouse.odds.utils.OddsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Summarises the snapshots one event produced in a sync: best price per side, consensus implied
 * probabilities with a confidence score, and the average price spread between bookmakers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OddsAggregator {

    private static final int PROBABILITY_SCALE = 6;

    private final SignalPublisher signalPublisher;

    /**
     * @param event     the (bookmaker-filtered) event the snapshots were normalized from
     * @param snapshots snapshots of that event, one per bookmaker
     * @return empty when no bookmaker quoted both sides
     */
    public Optional<OddsAggregation> aggregate(OddsApiEvent event, List<OddsSnapshot> snapshots) {
        List<OddsSnapshot> quotes = snapshots.stream()
                .filter(s -> s.getMoneyline() != null && s.getMoneyline().hasBothSides())
                .collect(Collectors.toList());
        if (quotes.isEmpty()) {
            return Optional.empty();
        }

        ArbitrageScanner.BestPrices best = ArbitrageScanner.bestPrices(quotes);
        List<BigDecimal> fighter1Probabilities = probabilities(quotes, s -> s.getMoneyline().getFighter1());
        List<BigDecimal> fighter2Probabilities = probabilities(quotes, s -> s.getMoneyline().getFighter2());

        OddsAggregation.Consensus consensus = OddsAggregation.Consensus.builder()
                .fighter1Probability(scaled(OddsCalculator.mean(fighter1Probabilities)))
                .fighter2Probability(scaled(OddsCalculator.mean(fighter2Probabilities)))
                .confidence(OddsCalculator.consensusConfidence(OddsCalculator.standardDeviation(fighter1Probabilities)))
                .build();

        Set<String> names = quotes.stream().map(OddsSnapshot::getBookmaker).collect(Collectors.toSet());

        OddsAggregation aggregation = OddsAggregation.builder()
                .fightId(quotes.get(0).getFightId())
                .eventId(event.getId())
                .fighter1(event.getHomeTeam())
                .fighter2(event.getAwayTeam())
                .commenceTime(event.getCommenceTime())
                .bookmakers(quotes.stream().map(OddsSnapshot::getBookmaker).collect(Collectors.toList()))
                .bestFighter1(OddsAggregation.BestPrice.builder()
                        .bookmaker(best.fighter1().getBookmaker())
                        .odds(best.fighter1Odds())
                        .build())
                .bestFighter2(OddsAggregation.BestPrice.builder()
                        .bookmaker(best.fighter2().getBookmaker())
                        .odds(best.fighter2Odds())
                        .build())
                .consensus(consensus)
                .marketsAvailable(marketsOffered(event, names))
                .averageSpread(averageSpread(quotes))
                .build();

        log.info("ODDS AGGREGATED | fightId={} books={} best1={}@{} best2={}@{} consensus={}/{} confidence={} spread={}",
                aggregation.getFightId(), aggregation.getBookmakerCount(),
                best.fighter1().getBookmaker(), best.fighter1Odds(), best.fighter2().getBookmaker(), best.fighter2Odds(),
                consensus.getFighter1Probability(), consensus.getFighter2Probability(), consensus.getConfidence(),
                aggregation.getAverageSpread());
        signalPublisher.publish(new OddsAggregated(aggregation.getFightId(), aggregation.getBookmakerCount(),
                consensus.getFighter1Probability(), consensus.getFighter2Probability(), consensus.getConfidence()));
        return Optional.of(aggregation);
    }

    /**
     * Mean of the fighter1 and fighter2 spreads (best minus worst price). Zero with a single bookmaker.
     */
    static BigDecimal averageSpread(List<OddsSnapshot> quotes) {
        if (quotes.size() < 2) {
            return BigDecimal.ZERO;
        }
        BigDecimal fighter1Spread = spread(quotes, s -> s.getMoneyline().getFighter1());
        BigDecimal fighter2Spread = spread(quotes, s -> s.getMoneyline().getFighter2());
        return fighter1Spread.add(fighter2Spread).divide(BigDecimal.valueOf(2), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal spread(List<OddsSnapshot> quotes, Function<OddsSnapshot, BigDecimal> price) {
        BigDecimal max = quotes.stream().map(price).max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO);
        BigDecimal min = quotes.stream().map(price).min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO);
        return max.subtract(min);
    }

    private static List<BigDecimal> probabilities(List<OddsSnapshot> quotes, Function<OddsSnapshot, BigDecimal> price) {
        return quotes.stream().map(price).map(OddsCalculator::impliedProbability).collect(Collectors.toList());
    }

    private static Set<String> marketsOffered(OddsApiEvent event, Set<String> bookmakerNames) {
        Set<String> markets = new TreeSet<>();
        if (event.getBookmakers() == null) {
            return markets;
        }
        for (OddsApiBookmaker bookmaker : event.getBookmakers()) {
            if (bookmaker == null || bookmaker.getMarkets() == null
                    || !bookmakerNames.contains(OddsApiNormalizer.bookmakerName(bookmaker.getKey()))) {
                continue;
            }
            bookmaker.getMarkets().stream()
                    .filter(m -> m != null && m.getKey() != null)
                    .map(OddsApiMarket::getKey)
                    .forEach(markets::add);
        }
        return markets;
    }

    private static BigDecimal scaled(BigDecimal probability) {
        return probability.setScale(PROBABILITY_SCALE, RoundingMode.HALF_UP);
    }
}
