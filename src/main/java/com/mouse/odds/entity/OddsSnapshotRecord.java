package com.mouse.odds.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One stored snapshot. Append-only: a newer capture of the same fight and bookmaker is a new row.
 */
@Entity
@Table(name = "odds_snapshots", indexes = {
        @Index(name = "idx_snapshot_fight_book_captured", columnList = "fight_id, bookmaker, captured_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class OddsSnapshotRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE)
    private Long id;

    @Column(name = "fight_id", nullable = false, length = 256)
    private String fightId;

    @Column(nullable = false, length = 64)
    private String bookmaker;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    // Moneyline
    @Column(precision = 12, scale = 4)
    private BigDecimal fighter1Odds;
    @Column(precision = 12, scale = 4)
    private BigDecimal fighter2Odds;

    // Method of victory
    @Column(precision = 12, scale = 4)
    private BigDecimal koTkoOdds;
    @Column(precision = 12, scale = 4)
    private BigDecimal submissionOdds;
    @Column(precision = 12, scale = 4)
    private BigDecimal decisionOdds;

    // Round betting, 4 and 5 only for five-round fights
    @Column(precision = 12, scale = 4)
    private BigDecimal round1Odds;
    @Column(precision = 12, scale = 4)
    private BigDecimal round2Odds;
    @Column(precision = 12, scale = 4)
    private BigDecimal round3Odds;
    @Column(precision = 12, scale = 4)
    private BigDecimal round4Odds;
    @Column(precision = 12, scale = 4)
    private BigDecimal round5Odds;
}
