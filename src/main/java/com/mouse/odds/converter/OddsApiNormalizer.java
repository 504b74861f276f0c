package com.mouse.odds.converter;

import com.mouse.odds.interfaces.SnapshotNormalizer;
import com.mouse.odds.model.MethodOdds;
import com.mouse.odds.model.MoneylineOdds;
import com.mouse.odds.model.OddsSnapshot;
import com.mouse.odds.model.RoundOdds;
import com.mouse.odds.model.oddsapi.OddsApiBookmaker;
import com.mouse.odds.model.oddsapi.OddsApiEvent;
import com.mouse.odds.model.oddsapi.OddsApiMarket;
import com.mouse.odds.model.oddsapi.OddsApiOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Turns one Odds API event into one {@link OddsSnapshot} per bookmaker whose head-to-head market prices
 * both fighters by name.
 * Missing method or round prices become {@code 0}; rounds 4 and 5 stay null when not offered.
 */
@Slf4j
@Component
public class OddsApiNormalizer implements SnapshotNormalizer<OddsApiEvent> {

    static final String FIGHT_ID_PREFIX = "odds_api_";
    static final String UNDATED = "undated";

    private static final Map<String, String> BOOKMAKER_NAMES = Map.ofEntries(
            Map.entry("draftkings", "DraftKings"),
            Map.entry("fanduel", "FanDuel"),
            Map.entry("betmgm", "BetMGM"),
            Map.entry("caesars", "Caesars"),
            Map.entry("pointsbet", "PointsBet"),
            Map.entry("betrivers", "BetRivers"),
            Map.entry("unibet", "Unibet"),
            Map.entry("williamhill_us", "William Hill"),
            Map.entry("bovada", "Bovada"),
            Map.entry("mybookie", "MyBookie"),
            Map.entry("hardrockbet", "Hard Rock Bet"),
            Map.entry("espnbet", "ESPN BET"),
            Map.entry("betway", "Betway"),
            Map.entry("wynnbet", "WynnBET"),
            Map.entry("barstool", "Barstool Sportsbook"),
            Map.entry("superbook", "SuperBook"),
            Map.entry("twinspires", "TwinSpires"),
            Map.entry("foxbet", "FOX Bet"),
            Map.entry("tipico", "Tipico"),
            Map.entry("betfred", "Betfred")
    );

    @Override
    public List<OddsSnapshot> normalize(OddsApiEvent event, Instant capturedAt) {
        if (event == null || event.getBookmakers() == null || event.getBookmakers().isEmpty()) {
            return Collections.emptyList();
        }

        String fightId = fightId(event);
        List<OddsSnapshot> snapshots = new ArrayList<>();

        for (OddsApiBookmaker bookmaker : event.getBookmakers()) {
            try {
                toSnapshot(event, fightId, bookmaker, capturedAt).ifPresent(snapshots::add);
            } catch (Exception e) {
                log.warn("Skipping bookmaker {} for event {}: {}",
                        bookmaker == null ? null : bookmaker.getKey(), event.getId(), e.getMessage());
            }
        }
        return snapshots;
    }

    Optional<OddsSnapshot> toSnapshot(OddsApiEvent event, String fightId, OddsApiBookmaker bookmaker, Instant capturedAt) {
        Optional<OddsApiMarket> h2h = bookmaker.market(OddsApiMarket.H2H);
        if (h2h.isEmpty() || h2h.get().getOutcomes() == null || h2h.get().getOutcomes().size() != 2) {
            log.debug("No two-way h2h market from {} for event {}", bookmaker.getKey(), event.getId());
            return Optional.empty();
        }

        List<OddsApiOutcome> h2hOutcomes = h2h.get().getOutcomes();
        Optional<BigDecimal> fighter1 = findPrice(h2hOutcomes, o -> sameName(o.getName(), event.getHomeTeam()));
        Optional<BigDecimal> fighter2 = findPrice(h2hOutcomes, o -> sameName(o.getName(), event.getAwayTeam()));
        if (fighter1.isEmpty() || fighter2.isEmpty()) {
            log.debug("h2h outcomes from {} do not name both fighters of event {}", bookmaker.getKey(), event.getId());
            return Optional.empty();
        }
        MoneylineOdds moneyline = MoneylineOdds.of(fighter1.get(), fighter2.get());

        return Optional.of(OddsSnapshot.builder()
                .fightId(fightId)
                .bookmaker(bookmakerName(bookmaker.getKey()))
                .timestamp(capturedAt)
                .moneyline(moneyline)
                .method(methodOdds(bookmaker.market(OddsApiMarket.METHOD)))
                .rounds(roundOdds(bookmaker.market(OddsApiMarket.ROUND)))
                .build());
    }

    static MethodOdds methodOdds(Optional<OddsApiMarket> market) {
        List<OddsApiOutcome> outcomes = market.map(OddsApiMarket::getOutcomes).orElse(null);
        if (outcomes == null) {
            return MethodOdds.unknown();
        }
        return MethodOdds.builder()
                .koTko(price(outcomes, nameContains("ko", "knockout")))
                .submission(price(outcomes, nameContains("submission")))
                .decision(price(outcomes, nameContains("decision")))
                .build();
    }

    static RoundOdds roundOdds(Optional<OddsApiMarket> market) {
        List<OddsApiOutcome> outcomes = market.map(OddsApiMarket::getOutcomes).orElse(null);
        if (outcomes == null) {
            return RoundOdds.unknown();
        }
        return RoundOdds.builder()
                .round1(price(outcomes, roundName(1, "1st")))
                .round2(price(outcomes, roundName(2, "2nd")))
                .round3(price(outcomes, roundName(3, "3rd")))
                .round4(findPrice(outcomes, roundName(4, "4th")).orElse(null))
                .round5(findPrice(outcomes, roundName(5, "5th")).orElse(null))
                .build();
    }

    /**
     * {@code odds_api_<names sorted, joined by _vs_>_<yyyy-MM-dd>}, everything outside {@code [A-Za-z0-9_]}
     * replaced by {@code _}. Stable for the same pair and day regardless of home/away order.
     */
    public static String fightId(OddsApiEvent event) {
        String fighters = Stream.of(nullToEmpty(event.getHomeTeam()), nullToEmpty(event.getAwayTeam()))
                .sorted()
                .reduce((a, b) -> a + "_vs_" + b)
                .orElse("");
        return (FIGHT_ID_PREFIX + fighters + "_" + commenceDate(event.getCommenceTime()))
                .replaceAll("[^a-zA-Z0-9_]", "_");
    }

    public static String bookmakerName(String key) {
        if (key == null) {
            return null;
        }
        return BOOKMAKER_NAMES.getOrDefault(key, key);
    }

    private static String commenceDate(String commenceTime) {
        if (commenceTime == null || commenceTime.isBlank()) {
            return UNDATED;
        }
        try {
            return OffsetDateTime.parse(commenceTime).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate().toString();
        } catch (DateTimeParseException e) {
            return UNDATED;
        }
    }

    private static BigDecimal price(List<OddsApiOutcome> outcomes, Predicate<OddsApiOutcome> match) {
        return findPrice(outcomes, match).orElse(BigDecimal.ZERO);
    }

    private static Optional<BigDecimal> findPrice(List<OddsApiOutcome> outcomes, Predicate<OddsApiOutcome> match) {
        return outcomes.stream()
                .filter(o -> o != null && o.getName() != null && o.getPrice() != null)
                .filter(match)
                .map(OddsApiOutcome::getPrice)
                .findFirst();
    }

    private static boolean sameName(String outcomeName, String fighter) {
        return fighter != null && outcomeName.trim().equalsIgnoreCase(fighter.trim());
    }

    private static Predicate<OddsApiOutcome> nameContains(String... fragments) {
        return o -> {
            String name = o.getName().toLowerCase(Locale.ROOT);
            for (String fragment : fragments) {
                if (name.contains(fragment)) {
                    return true;
                }
            }
            return false;
        };
    }

    private static Predicate<OddsApiOutcome> roundName(int round, String ordinal) {
        String label = "round " + round;
        return o -> {
            String name = o.getName().toLowerCase(Locale.ROOT);
            return name.contains(label) || name.contains(ordinal);
        };
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
