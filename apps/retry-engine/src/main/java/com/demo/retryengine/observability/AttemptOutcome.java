package com.demo.retryengine.observability;

import com.demo.retryengine.retry.RetryState;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one attempt inside an execute call.
 *
 * @param attempt        1-based attempt index
 * @param timestamp      when the attempt finished
 * @param state          state the call moved to after this attempt
 * @param classification failure classification, null for a successful attempt
 */
public record AttemptOutcome(
    int attempt,
    Instant timestamp,
    RetryState state,
    @Nullable FailureClassification classification
) {
    public AttemptOutcome {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1: " + attempt);
        }
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(state, "state");
    }

    public boolean isSuccess() {
        return state == RetryState.SUCCESS;
    }

    public String resultLabel() {
        return isSuccess() ? "SUCCESS" : "FAILURE";
    }

    public String kindLabel() {
        return classification == null ? "NONE" : classification.kind().name();
    }
}
