package com.mouse.odds.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.odds.config.DetectionConfig;
import com.mouse.odds.config.IngestionProperties;
import com.mouse.odds.converter.OddsApiNormalizer;
import com.mouse.odds.detector.ArbitrageScanner;
import com.mouse.odds.detector.MovementDetector;
import com.mouse.odds.detector.OddsAggregator;
import com.mouse.odds.events.SyncCompleted;
import com.mouse.odds.events.SyncFailed;
import com.mouse.odds.exception.IngestionException;
import com.mouse.odds.interfaces.OddsSink;
import com.mouse.odds.interfaces.SignalPublisher;
import com.mouse.odds.model.ApiResponse;
import com.mouse.odds.model.ArbitrageOpportunity;
import com.mouse.odds.model.IngestionResult;
import com.mouse.odds.model.OddsAggregation;
import com.mouse.odds.model.OddsSnapshot;
import com.mouse.odds.model.ValidationFinding;
import com.mouse.odds.model.oddsapi.OddsApiEvent;
import com.mouse.odds.model.oddsapi.OddsApiUsage;
import com.mouse.odds.resilience.RequestPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * One sync run against the odds source: fetch, validate, filter bookmakers, normalize, store,
 * then feed the movement detector, the arbitrage scanner and the cross-bookmaker aggregator.
 * <p>
 * A bad event is skipped with a finding; only a failed fetch or an unreadable body fails the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OddsIngestionService {

    static final String ODDS_ENDPOINT = "odds";
    static final String EVENT_ODDS_ENDPOINT = "eventOdds";
    static final String USAGE_ENDPOINT = "usage";
    static final String REMAINING_HEADER = "x-requests-remaining";

    private final SourcePipelineRegistry pipelineRegistry;
    private final IngestionProperties properties;
    private final DetectionConfig detectionConfig;
    private final OddsApiValidator validator;
    private final BookmakerFilter bookmakerFilter;
    private final OddsApiNormalizer normalizer;
    private final OddsSink oddsSink;
    private final MovementDetector movementDetector;
    private final ArbitrageScanner arbitrageScanner;
    private final OddsAggregator oddsAggregator;
    private final SignalPublisher signalPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Syncs all upcoming fights on the calling thread.
     *
     * @throws IngestionException when the fetch fails for good or the body cannot be read
     */
    public IngestionResult syncOdds() {
        return syncBlocking(ODDS_ENDPOINT, sportParams());
    }

    /**
     * Syncs a single event through the {@code eventOdds} endpoint. The result carries that event's
     * cross-bookmaker aggregation.
     */
    public IngestionResult syncEventOdds(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId is required");
        }
        Map<String, String> pathParams = sportParams();
        pathParams.put("eventId", eventId);
        return syncBlocking(EVENT_ODDS_ENDPOINT, pathParams);
    }

    /**
     * Same as {@link #syncOdds()} on the source's pipeline worker. Cancelling the returned future
     * cancels the in-flight request and any pending retries.
     */
    public CompletableFuture<IngestionResult> syncOddsAsync() {
        long startMs = clock.millis();
        RequestPipeline pipeline = pipeline();

        CompletableFuture<ApiResponse> call = pipeline.executeAsync(ODDS_ENDPOINT, sportParams(), requestParams());
        CompletableFuture<IngestionResult> result = call.handle((response, error) -> {
            if (error != null) {
                throw fail(unwrap(error));
            }
            return process(response, startMs);
        });
        result.whenComplete((r, e) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        return result;
    }

    /**
     * Remaining and used request credits of the odds source.
     */
    public OddsApiUsage getUsageStats() {
        try {
            return pipeline().executeForJson(USAGE_ENDPOINT, sportParams(), Map.of(), OddsApiUsage.class);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionException("Interrupted while fetching usage stats", e);
        } catch (IOException | RuntimeException e) {
            throw new IngestionException("Failed to get usage stats: " + e.getMessage(), e);
        }
    }

    /**
     * Query parameters of the odds endpoints: regions, markets, odds format, ISO dates and the
     * bookmaker include list when one is configured.
     */
    public Map<String, String> requestParams() {
        IngestionProperties.Odds odds = properties.getOdds();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("regions", String.join(",", odds.getRegions()));
        params.put("markets", String.join(",", odds.getMarkets()));
        params.put("oddsFormat", odds.getOddsFormat());
        params.put("dateFormat", "iso");

        String include = bookmakerFilter.includeParam();
        if (include != null) {
            params.put("bookmakers", include);
        }
        return params;
    }

    private IngestionResult syncBlocking(String endpoint, Map<String, String> pathParams) {
        long startMs = clock.millis();
        ApiResponse response;
        try {
            response = pipeline().execute(endpoint, pathParams, requestParams());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail(e);
        } catch (IOException | RuntimeException e) {
            throw fail(e);
        }
        return process(response, startMs);
    }

    IngestionResult process(ApiResponse response, long startMs) {
        String sourceId = sourceId();
        List<OddsApiEvent> events = parseEvents(response.getBody());

        String remaining = response.header(REMAINING_HEADER);
        if (remaining != null) {
            log.info("{} quota remaining: {}", sourceId, remaining);
        }

        Instant capturedAt = clock.instant();
        List<ValidationFinding> findings = new ArrayList<>();
        int processed = 0;
        int skipped = 0;
        int alerts = 0;
        int arbitrages = 0;
        List<OddsAggregation> aggregations = new ArrayList<>();

        for (int i = 0; i < events.size(); i++) {
            OddsApiEvent event = events.get(i);
            String prefix = "[" + i + "].";

            List<ValidationFinding> eventFindings = validator.validate(event);
            eventFindings.forEach(f -> findings.add(f.withFieldPrefix(prefix)));
            if (OddsApiValidator.hasErrors(eventFindings)) {
                log.warn("Skipping invalid event {} ({} finding(s))", event == null ? null : event.getId(), eventFindings.size());
                skipped++;
                continue;
            }

            try {
                OddsApiEvent filtered = bookmakerFilter.apply(event);
                List<OddsSnapshot> snapshots = normalizer.normalize(filtered, capturedAt);

                for (OddsSnapshot snapshot : snapshots) {
                    oddsSink.writeOddsSnapshot(snapshot);
                    if (movementDetector.onSnapshot(snapshot).isPresent()) {
                        alerts++;
                    }
                    processed++;
                }

                Optional<ArbitrageOpportunity> arbitrage = detectionConfig.isArbitrageEnabled() && snapshots.size() > 1
                        ? arbitrageScanner.scan(snapshots)
                        : Optional.empty();
                if (arbitrage.isPresent()) {
                    arbitrages++;
                }
                oddsAggregator.aggregate(filtered, snapshots)
                        .map(a -> a.toBuilder().arbitrage(arbitrage.orElse(null)).build())
                        .ifPresent(aggregations::add);
                log.debug("Processed event {} | bookmakers={} snapshots={}",
                        event.getId(), event.getBookmakers() == null ? 0 : event.getBookmakers().size(), snapshots.size());
            } catch (RuntimeException e) {
                log.error("Failed to process odds for event {}", event.getId(), e);
                findings.add(ValidationFinding.error(prefix + "odds_processing",
                        "Failed to process odds for event " + event.getId() + ": " + e.getMessage(), event.getId()));
                skipped++;
            }
        }

        IngestionResult result = IngestionResult.builder()
                .sourceId(sourceId)
                .recordsProcessed(processed)
                .recordsSkipped(skipped)
                .findings(findings)
                .movementAlerts(alerts)
                .arbitrageOpportunities(arbitrages)
                .aggregations(aggregations)
                .nextSyncTime(clock.instant().plus(properties.getOdds().getSyncInterval()))
                .processingTimeMs(clock.millis() - startMs)
                .build();

        signalPublisher.publish(new SyncCompleted(result));
        return result;
    }

    List<OddsApiEvent> parseEvents(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root.isArray()) {
                return objectMapper.convertValue(root,
                        objectMapper.getTypeFactory().constructCollectionType(List.class, OddsApiEvent.class));
            }
            // eventOdds answers with a single object
            return List.of(objectMapper.treeToValue(root, OddsApiEvent.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw fail(new IngestionException("Malformed odds payload from " + sourceId() + ": " + e.getMessage(), e));
        }
    }

    private IngestionException fail(Throwable cause) {
        String sourceId = sourceId();
        log.error("Odds sync failed for {}: {}", sourceId, cause.getMessage());
        signalPublisher.publish(new SyncFailed(sourceId, cause.getMessage()));
        if (cause instanceof IngestionException ingestion) {
            return ingestion;
        }
        return new IngestionException("Failed to sync odds from " + sourceId + ": " + cause.getMessage(), cause);
    }

    private RequestPipeline pipeline() {
        return pipelineRegistry.pipeline(sourceId());
    }

    private String sourceId() {
        return properties.getOdds().getSourceId();
    }

    private Map<String, String> sportParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("sport", properties.getOdds().getSportKey());
        return params;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
