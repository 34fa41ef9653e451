package com.demo.retryengine.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry configuration. Safe to share across any number of concurrent executions.
 *
 * Delay before retry k (1-indexed), before jitter:
 *   min(maxDelay, initialDelay * multiplier^(k-1))
 *
 * @param maxRetries   retries after the initial attempt (total attempts = maxRetries + 1)
 * @param initialDelay delay before the first retry
 * @param maxDelay     cap applied to every computed delay
 * @param multiplier   exponential growth factor per retry
 * @param jitterFactor fractional random perturbation in [0, 1]; 0 gives reproducible delays
 */
public record RetryPolicy(
    int maxRetries,
    Duration initialDelay,
    Duration maxDelay,
    double multiplier,
    double jitterFactor
) {
    private static final RetryPolicy DEFAULT =
        new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.1);

    private static final RetryPolicy AGGRESSIVE =
        new RetryPolicy(5, Duration.ofMillis(500), Duration.ofSeconds(60), 1.5, 0.2);

    private static final RetryPolicy NO_RETRY =
        new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(1), 1.0, 0.0);

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive: " + initialDelay);
        }
        if (maxDelay.isNegative() || maxDelay.isZero()) {
            throw new IllegalArgumentException("maxDelay must be positive: " + maxDelay);
        }
        if (!(multiplier > 0) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a positive finite number: " + multiplier);
        }
        if (!(jitterFactor >= 0.0 && jitterFactor <= 1.0)) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]: " + jitterFactor);
        }
    }

    /** 3 retries, 1s initial delay, 30s cap, x2, 10% jitter. */
    public static RetryPolicy defaults() {
        return DEFAULT;
    }

    /** 5 retries, 500ms initial delay, 60s cap, x1.5, 20% jitter. */
    public static RetryPolicy aggressive() {
        return AGGRESSIVE;
    }

    /** A single attempt; failures surface immediately. */
    public static RetryPolicy noRetry() {
        return NO_RETRY;
    }

    public static RetryPolicy of(int maxRetries, Duration initialDelay, Duration maxDelay,
                                 double multiplier, double jitterFactor) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, multiplier, jitterFactor);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, multiplier, jitterFactor);
    }

    public RetryPolicy withInitialDelay(Duration initialDelay) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, multiplier, jitterFactor);
    }

    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, multiplier, jitterFactor);
    }

    public RetryPolicy withMultiplier(double multiplier) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, multiplier, jitterFactor);
    }

    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, multiplier, jitterFactor);
    }
}
