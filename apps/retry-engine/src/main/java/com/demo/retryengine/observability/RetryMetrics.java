package com.demo.retryengine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for retry executions.
 *
 * - retry_attempts_total{executor, outcome, kind}: every attempt (outcome = success | retry | failure)
 * - retry_executions_total{executor, result}: every execute call once it reaches a terminal state
 * - retry_backoff_delay{executor}: delays chosen before each retry
 * - retry_breaker_state{provider}: circuit breaker state (0=closed, 1=open, 2=half-open)
 */
public class RetryMetrics implements RetryListener {
    private final MeterRegistry registry;
    private final Map<String, AtomicInteger> breakerStates = new ConcurrentHashMap<>();

    public RetryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public void onSuccess(String executor, AttemptOutcome outcome) {
        recordAttempt(executor, "success", outcome);
        recordExecution(executor, outcome);
    }

    @Override
    public void onRetry(String executor, AttemptOutcome outcome, Throwable failure, Duration delay) {
        recordAttempt(executor, "retry", outcome);

        Timer.builder("retry_backoff_delay")
            .description("Backoff delay chosen before a retry")
            .tag("executor", executor)
            .register(registry)
            .record(delay);
    }

    @Override
    public void onFailure(String executor, AttemptOutcome outcome, Throwable failure) {
        recordAttempt(executor, "failure", outcome);
        recordExecution(executor, outcome);
    }

    /**
     * Record a circuit breaker state for a provider.
     *
     * @param provider provider id (e.g., "cursor")
     * @param state 0=closed, 1=open, 2=half-open
     */
    public void setBreakerState(String provider, int state) {
        breakerStates.computeIfAbsent(provider, id -> {
            AtomicInteger holder = new AtomicInteger(0);
            Gauge.builder("retry_breaker_state", holder, AtomicInteger::get)
                .description("Circuit breaker state per provider")
                .tag("provider", id)
                .register(registry);
            return holder;
        }).set(state);
    }

    private void recordAttempt(String executor, String outcomeLabel, AttemptOutcome outcome) {
        Counter.builder("retry_attempts_total")
            .description("Total attempts made by retry executors")
            .tag("executor", executor)
            .tag("outcome", outcomeLabel)
            .tag("kind", outcome.kindLabel())
            .register(registry)
            .increment();
    }

    private void recordExecution(String executor, AttemptOutcome outcome) {
        Counter.builder("retry_executions_total")
            .description("Total execute calls that reached a terminal state")
            .tag("executor", executor)
            .tag("result", outcome.resultLabel())
            .register(registry)
            .increment();
    }
}
