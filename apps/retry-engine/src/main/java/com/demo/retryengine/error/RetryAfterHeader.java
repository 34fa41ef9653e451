package com.demo.retryengine.error;

import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses the value of an HTTP {@code Retry-After} header.
 *
 * Accepted forms:
 * - delta-seconds: {@code Retry-After: 120}
 * - HTTP-date:     {@code Retry-After: Wed, 21 Oct 2015 07:28:00 GMT}
 */
public final class RetryAfterHeader {

    private RetryAfterHeader() {
    }

    public static Optional<Duration> parse(@Nullable String value, Clock clock) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(Duration.ofSeconds(Long.parseLong(trimmed)));
            } catch (NumberFormatException e) {
                return Optional.empty(); // Overflows a long
            }
        }
        try {
            Instant retryAt = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration untilRetry = Duration.between(clock.instant(), retryAt);
            return Optional.of(untilRetry.isNegative() ? Duration.ZERO : untilRetry);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
