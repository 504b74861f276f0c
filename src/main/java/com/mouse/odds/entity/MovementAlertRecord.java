package com.mouse.odds.entity;

import com.mouse.odds.enums.MovementType;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "movement_alerts", indexes = {
        @Index(name = "idx_movement_fight_detected", columnList = "fight_id, detected_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MovementAlertRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE)
    private Long id;

    @Column(name = "fight_id", nullable = false, length = 256)
    private String fightId;

    @Column(nullable = false, length = 64)
    private String bookmaker;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private MovementType movementType;

    @Column(precision = 12, scale = 4)
    private BigDecimal oldFighter1Odds;
    @Column(precision = 12, scale = 4)
    private BigDecimal oldFighter2Odds;
    @Column(precision = 12, scale = 4)
    private BigDecimal newFighter1Odds;
    @Column(precision = 12, scale = 4)
    private BigDecimal newFighter2Odds;

    @Column(precision = 12, scale = 4)
    private BigDecimal fighter1Change;
    @Column(precision = 12, scale = 4)
    private BigDecimal fighter2Change;
    @Column(precision = 12, scale = 4)
    private BigDecimal percentageChange;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;
}
