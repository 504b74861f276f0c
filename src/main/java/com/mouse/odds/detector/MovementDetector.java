package com.mouse.odds.detector;

import com.mouse.odds.config.DetectionConfig;
import com.mouse.odds.enums.MovementType;
import com.mouse.odds.events.OddsMovement;
import com.mouse.odds.interfaces.OddsSink;
import com.mouse.odds.interfaces.SignalPublisher;
import com.mouse.odds.model.MoneylineOdds;
import com.mouse.odds.model.MovementAlert;
import com.mouse.odds.model.OddsSnapshot;
import com.mouse.odds.utils.OddsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Compares each snapshot with the last one seen for the same (fight, bookmaker) and raises an alert
 * when the moneyline moved by at least the configured percentage.
 * <p>
 * The compare-and-replace of a baseline is a single {@code compute} on the key, so two snapshots of
 * the same key never both compare against the same baseline. Baselines expire after the configured TTL
 * and the store is capped, oldest first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MovementDetector {

    private final DetectionConfig detectionConfig;
    private final OddsSink oddsSink;
    private final SignalPublisher signalPublisher;
    private final Clock clock;

    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();

    private record Baseline(OddsSnapshot snapshot, long storedAtMs) {
    }

    /**
     * Records {@code snapshot} as the new baseline for its key and returns the alert raised against
     * the previous baseline, if any.
     */
    public Optional<MovementAlert> onSnapshot(OddsSnapshot snapshot) {
        if (snapshot == null || snapshot.getFightId() == null || snapshot.getBookmaker() == null) {
            log.warn("Ignoring snapshot without fightId/bookmaker: {}", snapshot);
            return Optional.empty();
        }

        AtomicReference<MovementAlert> raised = new AtomicReference<>();
        long now = clock.millis();

        baselines.compute(snapshot.key(), (key, previous) -> {
            if (previous != null) {
                compare(previous.snapshot(), snapshot).ifPresent(raised::set);
            }
            return new Baseline(snapshot, now);
        });
        enforceCapacity(snapshot.key());

        MovementAlert alert = raised.get();
        if (alert == null) {
            return Optional.empty();
        }

        log.info("ODDS MOVEMENT | fightId={} bookmaker={} type={} change={}% f1={}% f2={}%",
                alert.getFightId(), alert.getBookmaker(), alert.getMovementType(),
                alert.getPercentageChange(), alert.getFighter1Change(), alert.getFighter2Change());
        oddsSink.writeMovementAlert(alert);
        signalPublisher.publish(new OddsMovement(alert.getFightId(), alert.getBookmaker(),
                alert.getMovementType(), alert.getPercentageChange()));
        return Optional.of(alert);
    }

    /**
     * Pure comparison of two snapshots of the same key. Empty when the move is below the alert threshold.
     */
    public Optional<MovementAlert> compare(OddsSnapshot oldSnapshot, OddsSnapshot newSnapshot) {
        MoneylineOdds oldLine = oldSnapshot.getMoneyline();
        MoneylineOdds newLine = newSnapshot.getMoneyline();
        if (oldLine == null || newLine == null || !oldLine.hasBothSides() || !newLine.hasBothSides()) {
            return Optional.empty();
        }

        BigDecimal fighter1Change = OddsCalculator.percentageChange(oldLine.getFighter1(), newLine.getFighter1());
        BigDecimal fighter2Change = OddsCalculator.percentageChange(oldLine.getFighter2(), newLine.getFighter2());

        MovementType type = classify(fighter1Change, fighter2Change,
                detectionConfig.getMinPercentageChange(), detectionConfig.getSteamPercentage());
        if (!type.isAlertable()) {
            return Optional.empty();
        }

        return Optional.of(MovementAlert.builder()
                .fightId(newSnapshot.getFightId())
                .bookmaker(newSnapshot.getBookmaker())
                .movementType(type)
                .oldOdds(oldSnapshot)
                .newOdds(newSnapshot)
                .fighter1Change(fighter1Change)
                .fighter2Change(fighter2Change)
                .percentageChange(fighter1Change.abs().max(fighter2Change.abs()))
                .timestamp(newSnapshot.getTimestamp())
                .build());
    }

    /**
     * A zero change on one side counts as neither direction, so it can only be SIGNIFICANT.
     */
    public static MovementType classify(BigDecimal fighter1Change, BigDecimal fighter2Change,
                                        BigDecimal minPercentageChange, BigDecimal steamPercentage) {
        BigDecimal maxChange = fighter1Change.abs().max(fighter2Change.abs());
        if (maxChange.compareTo(minPercentageChange) < 0) {
            return MovementType.MINOR;
        }

        int direction1 = fighter1Change.signum();
        int direction2 = fighter2Change.signum();

        if (direction1 != 0 && direction1 == direction2 && maxChange.compareTo(steamPercentage) >= 0) {
            return MovementType.STEAM;
        }
        if (direction1 != 0 && direction2 != 0 && direction1 != direction2) {
            return MovementType.REVERSE;
        }
        return MovementType.SIGNIFICANT;
    }

    @Scheduled(fixedDelayString = "${detection.movement.sweep-interval:PT10M}")
    public void evictExpiredBaselines() {
        long cutoff = clock.millis() - detectionConfig.getBaselineTtl().toMillis();
        int before = baselines.size();
        baselines.values().removeIf(b -> b.storedAtMs() < cutoff);
        int removed = before - baselines.size();
        if (removed > 0) {
            log.info("Evicted {} expired baseline(s), {} tracked", removed, getTrackedKeys());
        }
    }

    public int getTrackedKeys() {
        return baselines.size();
    }

    private void enforceCapacity(String keepKey) {
        int maxKeys = detectionConfig.getMaxTrackedKeys();
        while (baselines.size() > maxKeys) {
            Optional<Map.Entry<String, Baseline>> oldest = baselines.entrySet().stream()
                    .filter(e -> !e.getKey().equals(keepKey))
                    .min(Comparator.comparingLong(e -> e.getValue().storedAtMs()));
            if (oldest.isEmpty()) {
                return;
            }
            baselines.remove(oldest.get().getKey(), oldest.get().getValue());
            log.debug("Baseline store full ({}), evicted {}", maxKeys, oldest.get().getKey());
        }
    }
}
