package com.mouse.odds.resilience;

import com.mouse.odds.config.SourceConfig;
import com.mouse.odds.enums.RateLimitWindow;
import com.mouse.odds.events.RateLimitHit;
import com.mouse.odds.interfaces.SignalPublisher;
import com.mouse.odds.model.RateLimiterSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-source throttle over a rolling minute and a rolling hour. Callers are delayed, never rejected.
 * <p>
 * Each window keeps the dispatch times it still counts, so no 60s (or 3600s) span ever holds more
 * calls than the quota. Check-and-reserve happens under the instance lock; waiting happens outside it.
 */
@Slf4j
public class RateLimiter {

    private final String sourceId;
    private final int requestsPerMinute;
    private final int requestsPerHour;
    private final Clock clock;
    private final Sleeper sleeper;
    private final SignalPublisher publisher;

    private final Deque<Long> minuteWindow = new ArrayDeque<>();
    private final Deque<Long> hourWindow = new ArrayDeque<>();

    public RateLimiter(SourceConfig config, Clock clock, Sleeper sleeper, SignalPublisher publisher) {
        this.sourceId = config.getSourceId();
        this.requestsPerMinute = config.getRequestsPerMinute();
        this.requestsPerHour = config.getRequestsPerHour();
        this.clock = clock;
        this.sleeper = sleeper;
        this.publisher = publisher;
    }

    /**
     * Blocks until both windows have room, then reserves one slot in each.
     */
    public void acquire() throws InterruptedException {
        while (true) {
            RateLimitWindow fullWindow;
            long waitMs;

            synchronized (this) {
                long now = clock.millis();
                evictExpired(now);

                if (minuteWindow.size() >= requestsPerMinute) {
                    fullWindow = RateLimitWindow.MINUTE;
                    waitMs = RateLimitWindow.MINUTE.getLengthMs() - (now - minuteWindow.peekFirst());
                } else if (hourWindow.size() >= requestsPerHour) {
                    fullWindow = RateLimitWindow.HOUR;
                    waitMs = RateLimitWindow.HOUR.getLengthMs() - (now - hourWindow.peekFirst());
                } else {
                    minuteWindow.addLast(now);
                    hourWindow.addLast(now);
                    return;
                }
            }

            log.warn("Rate limit hit | source={} window={} wait={}ms", sourceId, fullWindow.getLabel(), waitMs);
            publisher.publish(new RateLimitHit(sourceId, fullWindow, waitMs));
            sleeper.sleep(waitMs);
        }
    }

    public synchronized RateLimiterSnapshot snapshot() {
        evictExpired(clock.millis());
        return RateLimiterSnapshot.builder()
                .requestsThisMinute(minuteWindow.size())
                .requestsThisHour(hourWindow.size())
                .requestsPerMinute(requestsPerMinute)
                .requestsPerHour(requestsPerHour)
                .minuteWindowStart(toInstant(minuteWindow.peekFirst()))
                .hourWindowStart(toInstant(hourWindow.peekFirst()))
                .build();
    }

    private void evictExpired(long now) {
        while (!minuteWindow.isEmpty() && now - minuteWindow.peekFirst() >= RateLimitWindow.MINUTE.getLengthMs()) {
            minuteWindow.pollFirst();
        }
        while (!hourWindow.isEmpty() && now - hourWindow.peekFirst() >= RateLimitWindow.HOUR.getLengthMs()) {
            hourWindow.pollFirst();
        }
    }

    private static Instant toInstant(Long epochMs) {
        return epochMs == null ? null : Instant.ofEpochMilli(epochMs);
    }
}
