package io.github.drompincen.jobengine.runtime.dispatch;

import java.time.Duration;

/**
 * Tuning knobs of the dispatcher. {@code pauseAfterConsecutiveFailures} of 0 disables the
 * circuit breaker; a zero {@code catchUpWindow} disables skipping of stale occurrences.
 */
public record DispatchPolicy(
        int batchSize,
        int workerThreads,
        Duration handlerTimeout,
        int maxAttempts,
        Duration initialBackoff,
        double backoffMultiplier,
        Duration maxBackoff,
        Duration catchUpWindow,
        int pauseAfterConsecutiveFailures
) {

    public static DispatchPolicy defaults() {
        return new DispatchPolicy(50, 4, Duration.ofSeconds(30), 3, Duration.ofSeconds(1), 2.0,
                Duration.ofSeconds(30), Duration.ofHours(24), 0);
    }

    /** Delay before retry number {@code attempt + 1}, counting attempts from 1. */
    public Duration backoff(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }

    /**
     * Longest time a dispatcher holds a claim without renewing it: one handler attempt
     * followed by either the retry backoff or the retries of the final store writes. The
     * claim lease has to be longer than this.
     */
    public Duration longestLeaseGap() {
        Duration retryBackoff = Duration.ZERO;
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            Duration delay = backoff(attempt);
            if (delay.compareTo(retryBackoff) > 0) retryBackoff = delay;
        }
        Duration finalizeRetries = Duration.ZERO;
        for (int attempt = 1; attempt < JobDispatcher.FINALIZE_ATTEMPTS; attempt++) {
            finalizeRetries = finalizeRetries.plus(backoff(attempt));
        }
        return handlerTimeout.plus(retryBackoff.compareTo(finalizeRetries) > 0 ? retryBackoff : finalizeRetries);
    }
}
