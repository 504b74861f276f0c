package com.mouse.odds.entity;

import com.mouse.odds.converter.StakesConverter;
import com.mouse.odds.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "arbitrage_opportunities", indexes = {
        @Index(name = "idx_arb_fight_detected", columnList = "fight_id, detected_at"),
        @Index(name = "idx_arb_expires", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ArbitrageOpportunityRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE)
    private Long id;

    @Column(name = "fight_id", nullable = false, length = 256)
    private String fightId;

    @Convert(converter = StringListConverter.class)
    @Column(length = 256)
    private List<String> bookmakers;

    @Column(precision = 12, scale = 4)
    private BigDecimal fighter1Odds;
    @Column(precision = 12, scale = 4)
    private BigDecimal fighter2Odds;

    @Column(precision = 20, scale = 10)
    private BigDecimal totalImpliedProbability;

    @Column(precision = 12, scale = 4)
    private BigDecimal profitPercentage;

    @Column(precision = 14, scale = 2)
    private BigDecimal totalStake;

    @Convert(converter = StakesConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, BigDecimal> stakes;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;
}
