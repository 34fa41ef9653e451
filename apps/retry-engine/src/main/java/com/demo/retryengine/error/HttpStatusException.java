package com.demo.retryengine.error;

import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Failure carrying the HTTP status of an unsuccessful response.
 */
public class HttpStatusException extends RuntimeException {

    private final int statusCode;
    @Nullable
    private final Duration retryAfter;

    public HttpStatusException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public HttpStatusException(int statusCode, String message, @Nullable Duration retryAfter) {
        super(message);
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("Not an HTTP status code: " + statusCode);
        }
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative: " + retryAfter);
        }
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    /**
     * Builds the exception from a raw response, parsing the {@code Retry-After} header if one was sent.
     */
    public static HttpStatusException of(int statusCode, @Nullable String retryAfterHeader, Clock clock) {
        Duration hint = RetryAfterHeader.parse(retryAfterHeader, clock).orElse(null);
        return new HttpStatusException(statusCode, "HTTP " + statusCode, hint);
    }

    public int statusCode() {
        return statusCode;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
