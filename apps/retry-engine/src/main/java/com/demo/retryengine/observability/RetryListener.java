package com.demo.retryengine.observability;

import java.time.Duration;

/**
 * Receives attempt outcomes from a retry executor. Implementations must be thread-safe:
 * one listener serves every concurrent execute call.
 */
public interface RetryListener {

    RetryListener NOOP = new RetryListener() {
    };

    /** The operation succeeded on {@code outcome.attempt()}. */
    default void onSuccess(String executor, AttemptOutcome outcome) {
    }

    /** The attempt failed and another one is scheduled after {@code delay}. */
    default void onRetry(String executor, AttemptOutcome outcome, Throwable failure, Duration delay) {
    }

    /** The attempt failed and the failure is surfaced to the caller. */
    default void onFailure(String executor, AttemptOutcome outcome, Throwable failure) {
    }
}
