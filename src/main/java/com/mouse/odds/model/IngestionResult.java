package com.mouse.odds.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one sync run. Findings travel with the result so a batch can partially succeed.
 */
@Value
@Builder(toBuilder = true)
public class IngestionResult {
    String sourceId;
    int recordsProcessed;
    int recordsSkipped;
    @Singular
    List<ValidationFinding> findings;
    int movementAlerts;
    int arbitrageOpportunities;
    @Singular
    List<OddsAggregation> aggregations;
    Instant nextSyncTime;
    long processingTimeMs;

    public boolean hasErrors() {
        return findings.stream().anyMatch(ValidationFinding::isError);
    }
}
