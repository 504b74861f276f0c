package com.mouse.odds.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Component
@Setter
@Getter
public class DetectionConfig {

    // ==================== MOVEMENT ====================

    @Value("${detection.movement.min-percentage-change:5}")
    private BigDecimal minPercentageChange = BigDecimal.valueOf(5);

    @Value("${detection.movement.steam-percentage:10}")
    private BigDecimal steamPercentage = BigDecimal.TEN;

    @Value("${detection.movement.max-keys:10000}")
    private int maxTrackedKeys = 10_000;

    @Value("${detection.movement.baseline-ttl:PT24H}")
    private Duration baselineTtl = Duration.ofHours(24);

    // ==================== ARBITRAGE ====================

    @Value("${detection.arbitrage.enabled:true}")
    private boolean arbitrageEnabled = true;

    @Value("${detection.arbitrage.min-profit:2}")
    private BigDecimal minArbitrageProfit = BigDecimal.valueOf(2);

    @Value("${detection.arbitrage.reference-stake:1000}")
    private BigDecimal referenceStake = BigDecimal.valueOf(1000);

    @Value("${detection.arbitrage.ttl:PT15M}")
    private Duration arbitrageTtl = Duration.ofMinutes(15);
}
