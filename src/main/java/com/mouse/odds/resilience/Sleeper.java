package com.mouse.odds.resilience;

/**
 * Suspension point used by the rate limiter and retry backoff. Swapped for a clock-advancing
 * fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleeper() {
        return Thread::sleep;
    }
}
