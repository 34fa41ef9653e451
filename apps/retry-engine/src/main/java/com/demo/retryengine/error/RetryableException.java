package com.demo.retryengine.error;

import com.demo.retryengine.observability.FailureClassification;
import com.demo.retryengine.observability.FailureKind;
import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * Transport or server failure reported by an API client in the engine's own taxonomy.
 *
 * The carried classification is what the client observed; {@code ErrorClassifier} still decides
 * whether it is retryable (e.g. {@code serverError(404)} is not).
 */
public class RetryableException extends RuntimeException {

    private final FailureClassification reported;

    private RetryableException(FailureClassification reported, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.reported = reported;
    }

    public static RetryableException networkTimeout() {
        return new RetryableException(FailureClassification.networkTimeout(), "Network request timed out", null);
    }

    public static RetryableException networkTimeout(Throwable cause) {
        return new RetryableException(FailureClassification.networkTimeout(), "Network request timed out", cause);
    }

    public static RetryableException connectionError() {
        return new RetryableException(FailureClassification.connectionError(), "Connection to host failed", null);
    }

    public static RetryableException connectionError(Throwable cause) {
        return new RetryableException(FailureClassification.connectionError(), "Connection to host failed", cause);
    }

    public static RetryableException serverError(int statusCode) {
        return new RetryableException(FailureClassification.serverError(statusCode),
            "Server responded with status " + statusCode, null);
    }

    public static RetryableException rateLimited(@Nullable Duration retryAfter) {
        String message = retryAfter == null
            ? "Rate limited by server"
            : "Rate limited by server, retry after " + retryAfter.toMillis() + " ms";
        return new RetryableException(FailureClassification.rateLimited(retryAfter), message, null);
    }

    public FailureClassification reported() {
        return reported;
    }

    public FailureKind kind() {
        return reported.kind();
    }
}
