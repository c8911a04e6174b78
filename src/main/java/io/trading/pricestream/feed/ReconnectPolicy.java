package io.trading.pricestream.feed;

import java.time.Duration;

/**
 * Retry settings for a connector's receive path.
 *
 * @param initialDelay Delay before the first retry
 * @param multiplier   Delay multiplier per failed attempt (1.0 keeps the delay fixed)
 * @param maxDelay     Upper bound of the delay
 * @param maxRetries   Maximum consecutive attempts, -1 for unlimited
 */
public record ReconnectPolicy(
    Duration initialDelay,
    double multiplier,
    Duration maxDelay,
    int maxRetries
) {
    public static final int UNLIMITED = -1;

    public ReconnectPolicy {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (maxRetries < UNLIMITED) {
            throw new IllegalArgumentException("maxRetries must be -1 (unlimited) or >= 0");
        }
    }

    /**
     * Fixed delay, unlimited retries.
     */
    public static ReconnectPolicy fixed(Duration delay) {
        return new ReconnectPolicy(delay, 1.0, delay, UNLIMITED);
    }

    /**
     * Returns whether another attempt is allowed after {@code attempts} failures.
     */
    public boolean allowsAttempt(int attempts) {
        return maxRetries == UNLIMITED || attempts < maxRetries;
    }

    /**
     * Delay that follows {@code current}.
     */
    public Duration nextDelay(Duration current) {
        long next = (long) (current.toMillis() * multiplier);
        return Duration.ofMillis(Math.min(next, maxDelay.toMillis()));
    }
}
