package com.mouse.odds.tasks;

import com.mouse.odds.config.IngestionProperties;
import com.mouse.odds.model.IngestionResult;
import com.mouse.odds.service.OddsIngestionService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic odds sync. At most one sync is in flight; a tick that finds one still running is skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OddsPollingTask {

    private final OddsIngestionService oddsIngestionService;
    private final IngestionProperties properties;

    private final AtomicReference<CompletableFuture<IngestionResult>> inFlight = new AtomicReference<>();

    @Scheduled(initialDelayString = "${ingestion.odds.initial-delay:PT10S}",
            fixedDelayString = "${ingestion.odds.sync-interval:PT5M}")
    public void poll() {
        if (!properties.getOdds().isEnabled()) {
            log.debug("Odds polling disabled");
            return;
        }

        CompletableFuture<IngestionResult> current = inFlight.get();
        if (current != null && !current.isDone()) {
            log.info("Previous odds sync still running, skipping this tick");
            return;
        }

        CompletableFuture<IngestionResult> next;
        try {
            next = oddsIngestionService.syncOddsAsync();
        } catch (RuntimeException e) {
            log.error("Could not start odds sync: {}", e.getMessage(), e);
            return;
        }
        inFlight.set(next);

        next.whenComplete((result, error) -> {
            if (error != null) {
                // Details already logged and published by the ingestion service
                log.debug("Odds sync ended with error: {}", error.getMessage());
            }
        });
    }

    public boolean isSyncInFlight() {
        CompletableFuture<IngestionResult> current = inFlight.get();
        return current != null && !current.isDone();
    }

    @PreDestroy
    public void shutdown() {
        CompletableFuture<IngestionResult> current = inFlight.getAndSet(null);
        if (current != null && !current.isDone()) {
            current.cancel(true);
            log.info("Cancelled in-flight odds sync");
        }
    }
}
