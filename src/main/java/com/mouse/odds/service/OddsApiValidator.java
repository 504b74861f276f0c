package com.mouse.odds.service;

import com.mouse.odds.config.IngestionProperties;
import com.mouse.odds.model.ValidationFinding;
import com.mouse.odds.model.oddsapi.OddsApiBookmaker;
import com.mouse.odds.model.oddsapi.OddsApiEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural checks on a raw Odds API event before it is normalized. An event with any ERROR
 * finding is skipped; warnings travel with the sync result only.
 */
@Service
@RequiredArgsConstructor
public class OddsApiValidator {

    private final IngestionProperties properties;

    public List<ValidationFinding> validate(OddsApiEvent event) {
        List<ValidationFinding> findings = new ArrayList<>();
        if (event == null) {
            findings.add(ValidationFinding.error("event", "Event is required", null));
            return findings;
        }

        if (isBlank(event.getId())) {
            findings.add(ValidationFinding.error("id", "Event ID is required", event.getId()));
        }

        String expectedSportKey = properties.getOdds().getSportKey();
        if (!expectedSportKey.equals(event.getSportKey())) {
            findings.add(ValidationFinding.warning("sport_key",
                    "Invalid sport key, expected " + expectedSportKey, event.getSportKey()));
        }

        if (isBlank(event.getCommenceTime())) {
            findings.add(ValidationFinding.error("commence_time", "Event commence time is required", event.getCommenceTime()));
        } else if (!isIsoTimestamp(event.getCommenceTime())) {
            findings.add(ValidationFinding.error("commence_time", "Invalid commence time format", event.getCommenceTime()));
        }

        if (isBlank(event.getHomeTeam()) || isBlank(event.getAwayTeam())) {
            Map<String, String> teams = new LinkedHashMap<>();
            teams.put("home", event.getHomeTeam());
            teams.put("away", event.getAwayTeam());
            findings.add(ValidationFinding.error("teams", "Both home and away teams are required", teams));
        }

        List<OddsApiBookmaker> bookmakers = event.getBookmakers();
        if (bookmakers != null) {
            for (int i = 0; i < bookmakers.size(); i++) {
                OddsApiBookmaker bookmaker = bookmakers.get(i);
                String field = "bookmakers[" + i + "]";
                if (bookmaker == null || isBlank(bookmaker.getKey()) || isBlank(bookmaker.getTitle())) {
                    findings.add(ValidationFinding.error(field, "Bookmaker key and title are required", bookmaker));
                    continue;
                }
                if (bookmaker.getMarkets() == null || bookmaker.getMarkets().isEmpty()) {
                    findings.add(ValidationFinding.warning(field + ".markets",
                            "Bookmaker must have at least one market", bookmaker.getMarkets()));
                }
            }
        }
        return findings;
    }

    public static boolean hasErrors(List<ValidationFinding> findings) {
        return findings.stream().anyMatch(ValidationFinding::isError);
    }

    private static boolean isIsoTimestamp(String value) {
        try {
            OffsetDateTime.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
