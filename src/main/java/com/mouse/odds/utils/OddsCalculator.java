package com.mouse.odds.utils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * American-odds arithmetic used by the movement detector, the arbitrage scanner and the aggregator.
 */
public final class OddsCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    // High precision for intermediate values; results are scaled where they leave this class.
    private static final MathContext MC = new MathContext(34, RoundingMode.HALF_EVEN);
    private static final int RESULT_SCALE = 4;
    private static final BigDecimal CONFIDENCE_SPREAD_FACTOR = BigDecimal.valueOf(4);
    private static final BigDecimal MIN_CONFIDENCE = new BigDecimal("0.1");

    private OddsCalculator() {
    }

    /**
     * Implied probability of American odds.
     * Positive: {@code 100 / (odds + 100)}. Negative: {@code |odds| / (|odds| + 100)}.
     *
     * @throws IllegalArgumentException for zero or null odds
     */
    public static BigDecimal impliedProbability(BigDecimal americanOdds) {
        if (americanOdds == null || americanOdds.signum() == 0) {
            throw new IllegalArgumentException("American odds must be non-zero, got " + americanOdds);
        }
        if (americanOdds.signum() > 0) {
            return HUNDRED.divide(americanOdds.add(HUNDRED), MC);
        }
        BigDecimal abs = americanOdds.abs();
        return abs.divide(abs.add(HUNDRED), MC);
    }

    /**
     * {@code (new - old) / |old| * 100}. Zero when there is no usable old price.
     */
    public static BigDecimal percentageChange(BigDecimal oldOdds, BigDecimal newOdds) {
        if (oldOdds == null || newOdds == null || oldOdds.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return newOdds.subtract(oldOdds)
                .divide(oldOdds.abs(), MC)
                .multiply(HUNDRED, MC)
                .setScale(RESULT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Guaranteed return in percent for a total implied probability below one: {@code (1/sum - 1) * 100}.
     * Zero or negative means no arbitrage.
     */
    public static BigDecimal profitPercentage(BigDecimal totalImpliedProbability) {
        if (totalImpliedProbability == null || totalImpliedProbability.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.ONE.divide(totalImpliedProbability, MC)
                .subtract(BigDecimal.ONE)
                .multiply(HUNDRED, MC)
                .setScale(RESULT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Share of {@code totalStake} for one leg so every leg pays out the same: {@code S * p / sum}.
     */
    public static BigDecimal stakeFor(BigDecimal legProbability, BigDecimal totalImpliedProbability,
                                      BigDecimal totalStake) {
        return totalStake.multiply(legProbability, MC)
                .divide(totalImpliedProbability, MC)
                .setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Arithmetic mean, unscaled. Zero for an empty list.
     */
    public static BigDecimal mean(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), MC);
    }

    /**
     * Population standard deviation, unscaled. Zero for fewer than two values.
     */
    public static BigDecimal standardDeviation(List<BigDecimal> values) {
        if (values.size() < 2) {
            return BigDecimal.ZERO;
        }
        BigDecimal mean = mean(values);
        BigDecimal squares = values.stream()
                .map(v -> v.subtract(mean).pow(2, MC))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return squares.divide(BigDecimal.valueOf(values.size()), MC).sqrt(MC);
    }

    /**
     * {@code 1 - 4 * stdDev} of the bookmakers' implied probabilities, clamped to {@code [0.1, 1.0]}.
     */
    public static BigDecimal consensusConfidence(BigDecimal probabilityStdDev) {
        BigDecimal confidence = BigDecimal.ONE.subtract(probabilityStdDev.multiply(CONFIDENCE_SPREAD_FACTOR, MC));
        return confidence.max(MIN_CONFIDENCE).min(BigDecimal.ONE).setScale(RESULT_SCALE, RoundingMode.HALF_UP);
    }
}
