package com.mouse.odds.detector;

import com.mouse.odds.config.DetectionConfig;
import com.mouse.odds.enums.MovementType;
import com.mouse.odds.events.OddsMovement;
import com.mouse.odds.interfaces.OddsSink;
import com.mouse.odds.model.MethodOdds;
import com.mouse.odds.model.MoneylineOdds;
import com.mouse.odds.model.MovementAlert;
import com.mouse.odds.model.OddsSnapshot;
import com.mouse.odds.model.RoundOdds;
import com.mouse.odds.support.MutableClock;
import com.mouse.odds.support.RecordingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MovementDetectorTest {

    private static final String FIGHT = "odds_api_Jon_Jones_vs_Stipe_Miocic_2024_07_06";

    @Mock
    private OddsSink oddsSink;

    private DetectionConfig config;
    private MutableClock clock;
    private RecordingPublisher publisher;
    private MovementDetector detector;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        clock = MutableClock.at("2024-07-01T18:00:00Z");
        publisher = new RecordingPublisher();
        detector = new MovementDetector(config, oddsSink, publisher, clock);
    }

    private OddsSnapshot snapshot(String bookmaker, String fighter1, String fighter2) {
        return OddsSnapshot.builder()
                .fightId(FIGHT)
                .bookmaker(bookmaker)
                .timestamp(clock.instant())
                .moneyline(MoneylineOdds.of(new BigDecimal(fighter1), new BigDecimal(fighter2)))
                .method(MethodOdds.unknown())
                .rounds(RoundOdds.unknown())
                .build();
    }

    private Optional<MovementAlert> move(String from1, String from2, String to1, String to2) {
        detector.onSnapshot(snapshot("DraftKings", from1, from2));
        clock.advance(Duration.ofMinutes(5));
        return detector.onSnapshot(snapshot("DraftKings", to1, to2));
    }

    @Nested
    @DisplayName("onSnapshot")
    class OnSnapshot {

        @Test
        void firstSnapshot_onlyStoresBaseline() {
            assertThat(detector.onSnapshot(snapshot("DraftKings", "-150", "130"))).isEmpty();

            assertThat(detector.getTrackedKeys()).isEqualTo(1);
            verify(oddsSink, never()).writeMovementAlert(any());
        }

        @Test
        void identicalSnapshotTwice_raisesNothing() {
            OddsSnapshot snapshot = snapshot("DraftKings", "-150", "130");
            detector.onSnapshot(snapshot);

            assertThat(detector.onSnapshot(snapshot)).isEmpty();
            assertThat(detector.getTrackedKeys()).isEqualTo(1);
            verify(oddsSink, never()).writeMovementAlert(any());
            assertThat(publisher.getEvents()).isEmpty();
        }

        @Test
        void sameDirectionAboveSteam_isSteam() {
            MovementAlert alert = move("-150", "130", "-180", "110").orElseThrow();

            assertThat(alert.getMovementType()).isEqualTo(MovementType.STEAM);
            assertThat(alert.getFighter1Change()).isEqualByComparingTo("-20");
            assertThat(alert.getFighter2Change()).isEqualByComparingTo("-15.3846");
            assertThat(alert.getPercentageChange()).isEqualByComparingTo("20");
            assertThat(alert.getOldOdds().getMoneyline().getFighter1()).isEqualByComparingTo("-150");
            assertThat(alert.getNewOdds().getMoneyline().getFighter1()).isEqualByComparingTo("-180");
            assertThat(alert.getTimestamp()).isEqualTo(alert.getNewOdds().getTimestamp());
        }

        @Test
        void alertTimestamp_isNewerSnapshotCaptureTime() {
            detector.onSnapshot(snapshot("DraftKings", "-150", "130"));
            clock.advance(Duration.ofMinutes(5));
            OddsSnapshot newer = snapshot("DraftKings", "-180", "110");
            Instant capturedAt = newer.getTimestamp();
            clock.advance(Duration.ofHours(2));

            MovementAlert alert = detector.onSnapshot(newer).orElseThrow();

            assertThat(alert.getTimestamp()).isEqualTo(capturedAt).isNotEqualTo(clock.instant());
        }

        @Test
        void oppositeDirections_isReverse() {
            MovementAlert alert = move("-150", "130", "-180", "150").orElseThrow();

            assertThat(alert.getMovementType()).isEqualTo(MovementType.REVERSE);
            assertThat(alert.getFighter2Change()).isEqualByComparingTo("15.3846");
        }

        @Test
        void oneSideUnchanged_isSignificant() {
            MovementAlert alert = move("-200", "170", "-220", "170").orElseThrow();

            assertThat(alert.getMovementType()).isEqualTo(MovementType.SIGNIFICANT);
            assertThat(alert.getFighter2Change()).isEqualByComparingTo("0");
        }

        @Test
        void smallMove_raisesNothingButReplacesBaseline() {
            assertThat(move("-200", "170", "-205", "172")).isEmpty();

            // -205 -> -215 is 4.88%; against the first baseline -200 it would have been 7.5%
            assertThat(detector.onSnapshot(snapshot("DraftKings", "-215", "172"))).isEmpty();
            assertThat(publisher.getEvents()).isEmpty();
        }

        @Test
        void alert_isWrittenAndPublished() {
            MovementAlert alert = move("-150", "130", "-180", "110").orElseThrow();

            verify(oddsSink).writeMovementAlert(alert);
            assertThat(publisher.ofType(OddsMovement.class)).singleElement().satisfies(e -> {
                assertThat(e.fightId()).isEqualTo(FIGHT);
                assertThat(e.bookmaker()).isEqualTo("DraftKings");
                assertThat(e.movementType()).isEqualTo(MovementType.STEAM);
                assertThat(e.percentageChange()).isEqualByComparingTo("20");
            });
        }

        @Test
        void comparesAgainstLatestBaselineOnly() {
            detector.onSnapshot(snapshot("DraftKings", "-150", "130"));
            detector.onSnapshot(snapshot("DraftKings", "-156", "128"));

            // -156 -> -160 is 2.56%; against -150 it would have been 6.67%
            assertThat(detector.onSnapshot(snapshot("DraftKings", "-160", "127"))).isEmpty();
        }

        @Test
        void bookmakersAreTrackedSeparately() {
            detector.onSnapshot(snapshot("DraftKings", "-150", "130"));

            assertThat(detector.onSnapshot(snapshot("FanDuel", "-300", "250"))).isEmpty();
            assertThat(detector.getTrackedKeys()).isEqualTo(2);
        }

        @Test
        void zeroOldPrice_countsAsNoChange() {
            assertThat(move("0", "130", "-180", "131")).isEmpty();
        }

        @Test
        void oneSidedMoneyline_isNeverCompared() {
            // -> 0 on fighter2 would otherwise read as a 100% move
            assertThat(move("-150", "130", "-150", "0")).isEmpty();
            assertThat(move("-150", "0", "-180", "110")).isEmpty();
            verify(oddsSink, never()).writeMovementAlert(any());
        }

        @Test
        void compare_oneSidedSnapshot_isEmpty() {
            OddsSnapshot quoted = snapshot("DraftKings", "-150", "130");
            OddsSnapshot oneSided = snapshot("DraftKings", "-150", "0");

            assertThat(detector.compare(quoted, oneSided)).isEmpty();
            assertThat(detector.compare(oneSided, quoted)).isEmpty();
        }

        @Test
        void missingKey_isIgnored() {
            OddsSnapshot noFight = snapshot("DraftKings", "-150", "130").toBuilder().fightId(null).build();

            assertThat(detector.onSnapshot(noFight)).isEmpty();
            assertThat(detector.onSnapshot(null)).isEmpty();
            assertThat(detector.getTrackedKeys()).isZero();
        }
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @ParameterizedTest(name = "{0}% / {1}% -> {2}")
        @CsvSource({
                "5, 0, SIGNIFICANT",
                "4.9999, -4.9999, MINOR",
                "-5, 5, REVERSE",
                "10, 10, STEAM",
                "-10, -1, STEAM",
                "9.9999, 9.9999, SIGNIFICANT",
                "0, 0, MINOR",
                "0, -12, SIGNIFICANT"
        })
        void classify_thresholdsAreInclusive(String change1, String change2, MovementType expected) {
            assertThat(MovementDetector.classify(new BigDecimal(change1), new BigDecimal(change2),
                    BigDecimal.valueOf(5), BigDecimal.TEN)).isEqualTo(expected);
        }

        @Test
        void exactlyFivePercent_alerts() {
            assertThat(move("-200", "170", "-190", "170")).isPresent();
        }
    }

    @Nested
    @DisplayName("baseline store")
    class BaselineStore {

        @Test
        void evictExpiredBaselines_dropsOlderThanTtl() {
            config.setBaselineTtl(Duration.ofHours(1));
            detector.onSnapshot(snapshot("DraftKings", "-150", "130"));
            clock.advance(Duration.ofMinutes(45));
            detector.onSnapshot(snapshot("FanDuel", "-150", "130"));
            clock.advance(Duration.ofMinutes(30));

            detector.evictExpiredBaselines();

            assertThat(detector.getTrackedKeys()).isEqualTo(1);
            assertThat(detector.onSnapshot(snapshot("FanDuel", "-180", "110"))).isPresent();
        }

        @Test
        void expiredBaseline_isNotComparedAgainst() {
            config.setBaselineTtl(Duration.ofHours(1));
            detector.onSnapshot(snapshot("DraftKings", "-150", "130"));
            clock.advance(Duration.ofHours(2));
            detector.evictExpiredBaselines();

            assertThat(detector.onSnapshot(snapshot("DraftKings", "-300", "250"))).isEmpty();
        }

        @Test
        void capacity_evictsOldestAndKeepsNewest() {
            config.setMaxTrackedKeys(2);
            detector.onSnapshot(snapshot("DraftKings", "-150", "130"));
            clock.advanceMillis(1);
            detector.onSnapshot(snapshot("FanDuel", "-150", "130"));
            clock.advanceMillis(1);
            detector.onSnapshot(snapshot("BetMGM", "-150", "130"));

            assertThat(detector.getTrackedKeys()).isEqualTo(2);
            assertThat(detector.onSnapshot(snapshot("BetMGM", "-180", "110"))).isPresent();
            assertThat(detector.onSnapshot(snapshot("DraftKings", "-180", "110"))).isEmpty();
        }

        @Test
        void capacity_neverEvictsJustInsertedKeyUnderFrozenClock() {
            config.setMaxTrackedKeys(1);
            detector.onSnapshot(snapshot("DraftKings", "-150", "130"));
            detector.onSnapshot(snapshot("FanDuel", "-150", "130"));

            assertThat(detector.getTrackedKeys()).isEqualTo(1);
            assertThat(detector.onSnapshot(snapshot("FanDuel", "-180", "110"))).isPresent();
        }
    }
}
