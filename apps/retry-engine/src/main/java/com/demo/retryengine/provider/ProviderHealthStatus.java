package com.demo.retryengine.provider;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/**
 * Point-in-time health snapshot of a provider, derived from its circuit breaker.
 *
 * @param provider          provider the snapshot belongs to
 * @param healthy           whether callers should consider the provider usable
 * @param circuitState      breaker state at snapshot time
 * @param successRate       successful / recorded calls in the sliding window, 1.0 when nothing was recorded
 * @param totalCalls        calls recorded in the sliding window
 * @param healthDescription short human-readable label (e.g., "Excellent", "Service Unavailable")
 */
public record ProviderHealthStatus(
    ServiceProvider provider,
    boolean healthy,
    CircuitBreaker.State circuitState,
    double successRate,
    int totalCalls,
    String healthDescription
) {
}
