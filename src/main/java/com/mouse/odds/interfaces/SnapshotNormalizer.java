package com.mouse.odds.interfaces;

import com.mouse.odds.model.OddsSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Maps one provider payload to canonical snapshots, one per bookmaker that carries a usable moneyline.
 *
 * @param <T> provider payload type
 */
public interface SnapshotNormalizer<T> {

    List<OddsSnapshot> normalize(T payload, Instant capturedAt);
}
