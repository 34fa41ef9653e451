package com.demo.retryengine.observability;

/**
 * Fixed failure taxonomy produced by {@link ErrorClassifier}.
 * Used as the 'kind' label in retry_attempts_total metric.
 */
public enum FailureKind {
    NETWORK_TIMEOUT,         // Socket/HTTP timeout, gRPC DEADLINE_EXCEEDED
    CONNECTION_ERROR,        // Connection lost, host not found, connect refused
    SERVER_ERROR,            // 5xx, gRPC INTERNAL
    RATE_LIMITED,            // 429, gRPC RESOURCE_EXHAUSTED
    NON_RETRYABLE;           // Client errors, decoding/security failures, anything unrecognized

    public boolean isRetryable() {
        return this != NON_RETRYABLE;
    }
}
