package simrun.coordinator.util;

import simrun.coordinator.config.CoordinatorConfig;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * @param maxAttempts    total attempts including the first one
 * @param initialBackoff pause before the second attempt
 * @param multiplier     growth factor between consecutive pauses
 * @param maxBackoff     upper bound for a single pause
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1: " + multiplier);
        }
    }

    public static RetryPolicy from(CoordinatorConfig config) {
        return new RetryPolicy(config.syncMaxAttempts(), config.syncInitialBackoff(),
                config.syncBackoffMultiplier(), config.syncMaxBackoff());
    }

    /**
     * Pause to take after failed attempt number {@code attempt} (1-based).
     */
    public Duration backoffAfter(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    /** How the caller waits between attempts; tests substitute a recording no-op. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;

        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
    }
}
