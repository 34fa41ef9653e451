package com.demo.retryengine.retry;

import com.demo.retryengine.observability.ErrorClassifier;
import com.demo.retryengine.observability.FailureClassification;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.function.Predicate;

/**
 * Retry Decision Policy: bridges classifier output (or a caller predicate) to a retry decision.
 *
 * Decision flow:
 * 1. No failure? -> NO retry
 * 2. Hard stop (cancellation, VM error, circuit breaker rejection)? -> NO retry, predicate not consulted
 * 3. Caller predicate present? -> predicate alone decides
 * 4. Otherwise -> classification.isRetryable()
 *
 * Examples:
 *   networkTimeout, connectionError, serverError(503), rateLimited -> RETRY
 *   serverError(404), SSLHandshakeException, IllegalStateException -> NO RETRY
 *   CancellationException, InterruptedException -> NO RETRY, even if the predicate says yes
 */
@Component
public class RetryDecisionPolicy {

    private final ErrorClassifier classifier;

    @Autowired
    public RetryDecisionPolicy(ErrorClassifier classifier) {
        this.classifier = classifier;
    }

    public ErrorClassifier classifier() {
        return classifier;
    }

    public boolean shouldRetry(@Nullable Throwable failure) {
        return shouldRetry(failure, null);
    }

    public boolean shouldRetry(@Nullable Throwable failure, @Nullable Predicate<Throwable> override) {
        return shouldRetry(failure, override, null);
    }

    /**
     * @param failure        failure of the last attempt
     * @param override       caller-supplied predicate; bypasses the classifier when present. It is
     *                       tested against the unwrapped failure, not the CompletionException around it
     * @param classification already computed classification of {@code failure}, or null to classify here
     */
    public boolean shouldRetry(@Nullable Throwable failure,
                               @Nullable Predicate<Throwable> override,
                               @Nullable FailureClassification classification) {
        Throwable error = ErrorClassifier.unwrap(failure);
        if (error == null) {
            return false;
        }

        if (isHardStop(error)) {
            return false;
        }

        if (override != null) {
            return override.test(error);
        }

        FailureClassification outcome = classification != null ? classification : classifier.classify(error);
        return outcome.isRetryable();
    }

    /**
     * Failures that end the attempt loop no matter what the caller's predicate says.
     * Retrying a circuit breaker rejection would defeat the breaker.
     */
    public static boolean isHardStop(Throwable error) {
        return ErrorClassifier.isCancellation(error)
            || error instanceof VirtualMachineError
            || error instanceof CallNotPermittedException;
    }
}
