package com.demo.retryengine.observability;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Classification result for a failed attempt.
 *
 * Only two kinds carry data:
 * - SERVER_ERROR: the status code that was observed (always present)
 * - RATE_LIMITED: the server's retry-after hint (may be absent)
 */
public record FailureClassification(
    FailureKind kind,
    @Nullable Integer statusCode,
    @Nullable Duration retryAfter
) {
    private static final FailureClassification NETWORK_TIMEOUT =
        new FailureClassification(FailureKind.NETWORK_TIMEOUT, null, null);
    private static final FailureClassification CONNECTION_ERROR =
        new FailureClassification(FailureKind.CONNECTION_ERROR, null, null);
    private static final FailureClassification NON_RETRYABLE =
        new FailureClassification(FailureKind.NON_RETRYABLE, null, null);

    public FailureClassification {
        Objects.requireNonNull(kind, "kind");
        if (kind == FailureKind.SERVER_ERROR && statusCode == null) {
            throw new IllegalArgumentException("SERVER_ERROR requires a status code");
        }
        if (kind != FailureKind.SERVER_ERROR && statusCode != null) {
            throw new IllegalArgumentException(kind + " does not carry a status code");
        }
        if (retryAfter != null) {
            if (kind != FailureKind.RATE_LIMITED) {
                throw new IllegalArgumentException(kind + " does not carry a retry-after hint");
            }
            if (retryAfter.isNegative()) {
                throw new IllegalArgumentException("retryAfter must not be negative: " + retryAfter);
            }
        }
    }

    public static FailureClassification networkTimeout() {
        return NETWORK_TIMEOUT;
    }

    public static FailureClassification connectionError() {
        return CONNECTION_ERROR;
    }

    public static FailureClassification serverError(int statusCode) {
        return new FailureClassification(FailureKind.SERVER_ERROR, statusCode, null);
    }

    public static FailureClassification rateLimited(@Nullable Duration retryAfter) {
        return new FailureClassification(FailureKind.RATE_LIMITED, null, retryAfter);
    }

    public static FailureClassification nonRetryable() {
        return NON_RETRYABLE;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SERVER_ERROR -> "serverError(" + statusCode + ")";
            case RATE_LIMITED -> "rateLimited(" + (retryAfter == null ? "none" : retryAfter.toMillis() + "ms") + ")";
            case NETWORK_TIMEOUT -> "networkTimeout";
            case CONNECTION_ERROR -> "connectionError";
            case NON_RETRYABLE -> "nonRetryable";
        };
    }
}
