package com.demo.retryengine.error;

import org.springframework.lang.Nullable;

import java.util.OptionalInt;

/**
 * The response arrived but its body could not be decoded. Never retried.
 */
public class ResponseDecodingException extends RuntimeException {

    @Nullable
    private final Integer statusCode;

    public ResponseDecodingException(String message) {
        this(message, null, null);
    }

    public ResponseDecodingException(String message, @Nullable Integer statusCode, @Nullable Throwable cause) {
        super(statusCode == null ? message : "Decoding error (status " + statusCode + "): " + message, cause);
        this.statusCode = statusCode;
    }

    public OptionalInt statusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
