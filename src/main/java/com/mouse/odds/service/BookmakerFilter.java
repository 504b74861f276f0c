package com.mouse.odds.service;

import com.mouse.odds.config.IngestionProperties;
import com.mouse.odds.model.oddsapi.OddsApiBookmaker;
import com.mouse.odds.model.oddsapi.OddsApiEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Applies {@code ingestion.odds.bookmakers}: include list (when set), then exclude list, then moves
 * priority bookmakers to the front in priority order. Keys compare case-insensitively.
 */
@Service
@RequiredArgsConstructor
public class BookmakerFilter {

    private final IngestionProperties properties;

    public OddsApiEvent apply(OddsApiEvent event) {
        if (event == null || event.getBookmakers() == null) {
            return event;
        }
        return event.toBuilder()
                .bookmakers(filter(event.getBookmakers()))
                .build();
    }

    public List<OddsApiBookmaker> filter(List<OddsApiBookmaker> bookmakers) {
        IngestionProperties.Bookmakers rules = properties.getOdds().getBookmakers();
        List<String> include = lower(rules.getInclude());
        List<String> exclude = lower(rules.getExclude());
        List<String> priority = lower(rules.getPriority());

        List<OddsApiBookmaker> kept = new ArrayList<>();
        for (OddsApiBookmaker bookmaker : bookmakers) {
            String key = bookmaker == null || bookmaker.getKey() == null ? null : bookmaker.getKey().toLowerCase(Locale.ROOT);
            if (key == null) {
                continue;
            }
            if (!include.isEmpty() && !include.contains(key)) {
                continue;
            }
            if (exclude.contains(key)) {
                continue;
            }
            kept.add(bookmaker);
        }

        if (!priority.isEmpty()) {
            // Stable sort: priority books first in configured order, the rest keep feed order
            kept.sort(Comparator.comparingInt(b -> rank(priority, b.getKey().toLowerCase(Locale.ROOT))));
        }
        return kept;
    }

    /**
     * Comma-joined include list for the {@code bookmakers} request parameter, null when unrestricted.
     */
    public String includeParam() {
        List<String> include = properties.getOdds().getBookmakers().getInclude();
        return include == null || include.isEmpty() ? null : String.join(",", include);
    }

    private static int rank(List<String> priority, String key) {
        int index = priority.indexOf(key);
        return index < 0 ? priority.size() : index;
    }

    private static List<String> lower(List<String> keys) {
        if (keys == null) {
            return List.of();
        }
        return keys.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }
}
