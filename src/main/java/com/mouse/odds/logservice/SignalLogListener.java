package com.mouse.odds.logservice;

import com.mouse.odds.events.*;
import com.mouse.odds.interfaces.SignalListener;
import com.mouse.odds.model.IngestionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes one structured line per signal and keeps a running count per signal name.
 */
@Slf4j
@Component
public class SignalLogListener implements SignalListener {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public void onSignal(SignalEvent event) {
        counters.computeIfAbsent(event.name(), k -> new AtomicLong()).incrementAndGet();

        if (event instanceof RateLimitHit hit) {
            log.warn("RATE LIMIT | source={} window={} waitMs={}", hit.sourceId(), hit.type().getLabel(), hit.waitTimeMs());
        } else if (event instanceof CircuitBreakerStateChange change) {
            log.warn("CIRCUIT | source={} state={}", change.sourceId(), change.state());
        } else if (event instanceof CircuitBreakerReset reset) {
            log.info("CIRCUIT RESET | source={}", reset.sourceId());
        } else if (event instanceof RetryAttempt retry) {
            log.info("RETRY | source={} attempt={}/{} backoffMs={} error={}",
                    retry.sourceId(), retry.attempt(), retry.maxRetries(), retry.backoffMs(), retry.error());
        } else if (event instanceof OddsMovement movement) {
            log.info("MOVEMENT | fightId={} bookmaker={} type={} change={}%",
                    movement.fightId(), movement.bookmaker(), movement.movementType(), movement.percentageChange());
        } else if (event instanceof ArbitrageDetected arb) {
            log.info("ARBITRAGE | fightId={} bookmakers={} profit={}%", arb.fightId(), arb.bookmakers(), arb.profit());
        } else if (event instanceof OddsAggregated aggregated) {
            log.info("AGGREGATED | fightId={} bookmakers={} consensus={}/{} confidence={}", aggregated.fightId(),
                    aggregated.bookmakers(), aggregated.fighter1Probability(), aggregated.fighter2Probability(),
                    aggregated.confidence());
        } else if (event instanceof SyncCompleted completed) {
            IngestionResult result = completed.result();
            log.info("SYNC OK | source={} processed={} skipped={} findings={} movements={} arbs={} took={}ms next={}",
                    result.getSourceId(), result.getRecordsProcessed(), result.getRecordsSkipped(),
                    result.getFindings().size(), result.getMovementAlerts(), result.getArbitrageOpportunities(),
                    result.getProcessingTimeMs(), result.getNextSyncTime());
        } else if (event instanceof SyncFailed failed) {
            log.error("SYNC FAILED | source={} error={}", failed.sourceId(), failed.error());
        } else {
            log.debug("SIGNAL | {}", event.name());
        }
    }

    public long count(String signalName) {
        AtomicLong counter = counters.get(signalName);
        return counter == null ? 0 : counter.get();
    }

    public Map<String, Long> counts() {
        Map<String, Long> snapshot = new TreeMap<>();
        counters.forEach((name, counter) -> snapshot.put(name, counter.get()));
        return snapshot;
    }
}
