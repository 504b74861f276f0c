package com.mouse.odds.resilience;

import com.mouse.odds.enums.RateLimitWindow;
import com.mouse.odds.events.RateLimitHit;
import com.mouse.odds.model.RateLimiterSnapshot;
import com.mouse.odds.support.FakeSleeper;
import com.mouse.odds.support.MutableClock;
import com.mouse.odds.support.RecordingPublisher;
import com.mouse.odds.support.TestSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private MutableClock clock;
    private FakeSleeper sleeper;
    private RecordingPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-01T12:00:00Z");
        sleeper = new FakeSleeper(clock);
        publisher = new RecordingPublisher();
    }

    private RateLimiter limiter(int perMinute, int perHour) {
        return new RateLimiter(TestSources.oddsApi()
                .requestsPerMinute(perMinute)
                .requestsPerHour(perHour)
                .build(), clock, sleeper, publisher);
    }

    @Nested
    @DisplayName("minute window")
    class MinuteWindow {

        @Test
        @DisplayName("acquire_underQuota_neverWaits")
        void acquire_underQuota_neverWaits() throws InterruptedException {
            RateLimiter limiter = limiter(3, 100);

            limiter.acquire();
            limiter.acquire();
            limiter.acquire();

            assertThat(sleeper.getSleeps()).isEmpty();
            assertThat(publisher.getEvents()).isEmpty();
        }

        @Test
        @DisplayName("acquire_quotaExhausted_waitsUntilOldestCallLeavesWindow")
        void acquire_quotaExhausted_waitsUntilOldestCallLeavesWindow() throws InterruptedException {
            RateLimiter limiter = limiter(3, 100);
            limiter.acquire();
            clock.advance(Duration.ofSeconds(10));
            limiter.acquire();
            limiter.acquire();

            limiter.acquire();

            assertThat(sleeper.getSleeps()).containsExactly(50_000L);
            List<RateLimitHit> hits = publisher.ofType(RateLimitHit.class);
            assertThat(hits).hasSize(1);
            assertThat(hits.get(0).type()).isEqualTo(RateLimitWindow.MINUTE);
            assertThat(hits.get(0).waitTimeMs()).isEqualTo(50_000L);
            assertThat(hits.get(0).sourceId()).isEqualTo("the-odds-api");
        }

        @Test
        @DisplayName("acquire_anySixtySecondSpan_neverHoldsMoreThanQuota")
        void acquire_anySixtySecondSpan_neverHoldsMoreThanQuota() throws InterruptedException {
            RateLimiter limiter = limiter(3, 1000);
            long start = clock.millis();
            long[] dispatched = new long[10];

            for (int i = 0; i < dispatched.length; i++) {
                limiter.acquire();
                dispatched[i] = clock.millis() - start;
                clock.advanceMillis(7_000);
            }

            for (int i = 0; i + 3 < dispatched.length; i++) {
                // the 4th call after any call must be at least a full window later
                assertThat(dispatched[i + 3] - dispatched[i]).isGreaterThanOrEqualTo(60_000L);
            }
        }

        @Test
        @DisplayName("acquire_rollingWindow_doesNotResetOnMinuteBoundary")
        void acquire_rollingWindow_doesNotResetOnMinuteBoundary() throws InterruptedException {
            RateLimiter limiter = limiter(2, 1000);
            clock.advance(Duration.ofSeconds(59));   // 12:00:59
            limiter.acquire();
            limiter.acquire();
            clock.advance(Duration.ofSeconds(2));    // 12:01:01, a new calendar minute

            limiter.acquire();

            assertThat(sleeper.getSleeps()).containsExactly(58_000L);
        }
    }

    @Nested
    @DisplayName("hour window")
    class HourWindow {

        @Test
        @DisplayName("acquire_hourQuotaExhausted_reportsHourWindow")
        void acquire_hourQuotaExhausted_reportsHourWindow() throws InterruptedException {
            RateLimiter limiter = limiter(100, 3);
            limiter.acquire();
            clock.advance(Duration.ofMinutes(1));
            limiter.acquire();
            clock.advance(Duration.ofMinutes(1));
            limiter.acquire();

            limiter.acquire();

            assertThat(sleeper.getSleeps()).containsExactly(Duration.ofMinutes(58).toMillis());
            assertThat(publisher.ofType(RateLimitHit.class))
                    .extracting(RateLimitHit::type)
                    .containsExactly(RateLimitWindow.HOUR);
        }
    }

    @Test
    @DisplayName("snapshot_countsCallsStillInsideEachWindow")
    void snapshot_countsCallsStillInsideEachWindow() throws InterruptedException {
        RateLimiter limiter = limiter(10, 100);
        Instant first = clock.instant();
        limiter.acquire();
        clock.advance(Duration.ofSeconds(30));
        limiter.acquire();
        clock.advance(Duration.ofSeconds(45));

        RateLimiterSnapshot snapshot = limiter.snapshot();

        assertThat(snapshot.getRequestsThisMinute()).isEqualTo(1);
        assertThat(snapshot.getRequestsThisHour()).isEqualTo(2);
        assertThat(snapshot.getRequestsPerMinute()).isEqualTo(10);
        assertThat(snapshot.getRequestsPerHour()).isEqualTo(100);
        assertThat(snapshot.getHourWindowStart()).isEqualTo(first);
        assertThat(snapshot.getMinuteWindowStart()).isEqualTo(first.plusSeconds(30));
    }

    @Test
    @DisplayName("acquire_interruptedWhileWaiting_propagatesWithoutReserving")
    void acquire_interruptedWhileWaiting_propagatesWithoutReserving() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(TestSources.oddsApi().requestsPerMinute(1).build(), clock,
                millis -> {
                    throw new InterruptedException("stop");
                }, publisher);
        limiter.acquire();

        assertThatThrownBy(limiter::acquire).isInstanceOf(InterruptedException.class);
        assertThat(limiter.snapshot().getRequestsThisMinute()).isEqualTo(1);
    }
}
