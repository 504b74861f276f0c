package com.mouse.odds.resilience;

import com.mouse.odds.events.RetryAttempt;
import com.mouse.odds.exception.UpstreamHttpException;
import com.mouse.odds.interfaces.SignalPublisher;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;

/**
 * Bounded exponential backoff with up to 10% jitter for transient failures.
 * <p>
 * Retryable: no response at all (any {@link IOException}, timeouts included), HTTP 5xx and 429.
 * Everything else propagates on the first failure.
 */
@Slf4j
public class RetryPolicy {

    private static final double JITTER_RATIO = 0.1;

    private final String sourceId;
    private final long baseDelayMs;
    private final Sleeper sleeper;
    private final SignalPublisher publisher;
    private final DoubleSupplier random;

    public RetryPolicy(String sourceId, long baseDelayMs, Sleeper sleeper, SignalPublisher publisher) {
        this(sourceId, baseDelayMs, sleeper, publisher, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(String sourceId, long baseDelayMs, Sleeper sleeper, SignalPublisher publisher, DoubleSupplier random) {
        this.sourceId = sourceId;
        this.baseDelayMs = baseDelayMs;
        this.sleeper = sleeper;
        this.publisher = publisher;
        this.random = random;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws IOException, InterruptedException;
    }

    /**
     * Runs {@code call}, retrying retryable failures up to {@code maxRetries} times. The last failure
     * is rethrown unchanged. An interrupted caller gets {@link InterruptedException} instead of another attempt.
     */
    public <T> T execute(Attempt<T> call, int maxRetries, double backoffMultiplier, long maxBackoffMs)
            throws IOException, InterruptedException {
        return execute(call, maxRetries, backoffMultiplier, maxBackoffMs, () -> false);
    }

    /**
     * As above, but a retryable failure is rethrown without backoff once {@code retryBlocked} holds,
     * e.g. when the failure has just opened the circuit.
     */
    public <T> T execute(Attempt<T> call, int maxRetries, double backoffMultiplier, long maxBackoffMs,
                         BooleanSupplier retryBlocked) throws IOException, InterruptedException {
        int attempt = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Cancelled before attempt " + (attempt + 1) + " for " + sourceId);
            }

            try {
                return call.run();
            } catch (IOException | RuntimeException e) {
                if (attempt >= maxRetries || !isRetryable(e)) {
                    if (attempt > 0) {
                        log.warn("Giving up on {} after {} attempt(s): {}", sourceId, attempt + 1, e.getMessage());
                    }
                    throw e;
                }
                if (retryBlocked.getAsBoolean()) {
                    log.warn("Not retrying {} after attempt {}, circuit is open: {}", sourceId, attempt + 1, e.getMessage());
                    throw e;
                }

                long backoffMs = calculateBackoff(attempt, backoffMultiplier, maxBackoffMs);
                attempt++;
                log.info("Retry {}/{} for {} in {}ms after: {}", attempt, maxRetries, sourceId, backoffMs, e.getMessage());
                publisher.publish(new RetryAttempt(sourceId, attempt, maxRetries, backoffMs, e.getMessage()));
                sleeper.sleep(backoffMs);
            }
        }
    }

    public static boolean isRetryable(Throwable error) {
        if (error instanceof UpstreamHttpException httpError) {
            return httpError.isServerError() || httpError.isTooManyRequests();
        }
        return error instanceof IOException;
    }

    long calculateBackoff(int attempt, double backoffMultiplier, long maxBackoffMs) {
        double backoff = baseDelayMs * Math.pow(backoffMultiplier, attempt);
        double jitter = random.getAsDouble() * JITTER_RATIO * backoff;
        return (long) Math.min(backoff + jitter, maxBackoffMs);
    }
}
