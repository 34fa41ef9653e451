package com.demo.retryengine.retry;

import com.demo.retryengine.observability.FailureClassification;
import com.demo.retryengine.observability.FailureKind;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the wait before the next attempt.
 *
 * Two paths:
 * 1. Server hint: RATE_LIMITED with a retry-after value -> that value, verbatim
 *    (saturated at {@link #MAX_DELAY}, so the result always converts to nanoseconds)
 * 2. Exponential: min(maxDelay, initialDelay * multiplier^(k-1)), then multiplied by a uniform
 *    factor from [1 - jitterFactor, 1 + jitterFactor] and clamped to [0, maxDelay]
 */
public class BackoffCalculator {

    /** Longest delay expressible in nanoseconds; longer hints saturate here. */
    public static final Duration MAX_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    private final DoubleSupplier unitRandom;

    /** Uses the calling thread's {@link ThreadLocalRandom}, so concurrent calls share no generator state. */
    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param unitRandom source of uniform values in [0, 1)
     */
    public BackoffCalculator(DoubleSupplier unitRandom) {
        this.unitRandom = Objects.requireNonNull(unitRandom, "unitRandom");
    }

    /**
     * @param attempt        index of the attempt that just failed (1-based), i.e. the retry number
     * @param policy         retry policy
     * @param classification classification of that failure, may be null
     * @return delay before the next attempt
     */
    public Duration delay(int attempt, RetryPolicy policy, @Nullable FailureClassification classification) {
        Objects.requireNonNull(policy, "policy");
        if (classification != null
            && classification.kind() == FailureKind.RATE_LIMITED
            && classification.retryAfter() != null) {
            return saturate(classification.retryAfter());
        }

        Duration base = baseDelay(attempt, policy);
        if (policy.jitterFactor() == 0.0) {
            return base;
        }

        double factor = 1.0 - policy.jitterFactor() + 2.0 * policy.jitterFactor() * unitRandom.getAsDouble();
        double jittered = base.toNanos() * factor;
        long capNanos = toNanos(policy.maxDelay());
        return Duration.ofNanos(Math.max(0L, Math.min(capNanos, Math.round(jittered))));
    }

    /**
     * Delay before retry {@code attempt} without jitter: min(maxDelay, initialDelay * multiplier^(attempt-1)).
     */
    public Duration baseDelay(int attempt, RetryPolicy policy) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1: " + attempt);
        }
        long capNanos = toNanos(policy.maxDelay());
        double exponential = toNanos(policy.initialDelay()) * Math.pow(policy.multiplier(), attempt - 1);
        if (Double.isNaN(exponential) || exponential >= capNanos) {
            return saturate(policy.maxDelay());
        }
        return Duration.ofNanos(Math.round(exponential));
    }

    private static Duration saturate(Duration delay) {
        return delay.compareTo(MAX_DELAY) > 0 ? MAX_DELAY : delay;
    }

    private static long toNanos(Duration delay) {
        return saturate(delay).toNanos();
    }
}
