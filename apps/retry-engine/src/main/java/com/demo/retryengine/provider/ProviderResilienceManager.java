package com.demo.retryengine.provider;

import com.demo.retryengine.observability.RetryMetrics;
import com.demo.retryengine.retry.RetryExecutor;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Per-provider resilience: circuit breaker around every attempt, retry executor around the breaker.
 *
 * Layering (outermost first):
 *   RetryExecutor -> CircuitBreaker -> operation
 *
 * - Each attempt asks the breaker for a permit and records its own success/failure
 * - OPEN breaker -> CallNotPermittedException, which the executor never retries
 *   (retrying a rejection would defeat the breaker)
 *
 * Circuit breaker settings:
 *   default: window=10, minCalls=5, failureRate=50%, open=60s, halfOpenProbes=3
 *   cursor:  window=8,  minCalls=3, failureRate=50%, open=120s, halfOpenProbes=2 (conservative)
 *
 * State transitions update retry_breaker_state{provider}: CLOSED=0, OPEN=1, HALF_OPEN=2.
 */
public class ProviderResilienceManager {
    private static final Logger logger = LoggerFactory.getLogger(ProviderResilienceManager.class);

    private final Map<ServiceProvider, CircuitBreaker> breakers = new EnumMap<>(ServiceProvider.class);
    private final Map<ServiceProvider, RetryExecutor> executors = new EnumMap<>(ServiceProvider.class);
    private final RetryMetrics metrics;

    public ProviderResilienceManager(ProviderRetryPolicies policies, RetryMetrics metrics) {
        this(CircuitBreakerRegistry.ofDefaults(), defaultBreakerConfigs(), policies, metrics);
    }

    /**
     * @param registry       registry the provider breakers are created in (named by provider id)
     * @param breakerConfigs breaker configuration per provider; missing providers use {@link #defaultBreakerConfig()}
     */
    public ProviderResilienceManager(CircuitBreakerRegistry registry,
                                     Map<ServiceProvider, CircuitBreakerConfig> breakerConfigs,
                                     ProviderRetryPolicies policies,
                                     RetryMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        for (ServiceProvider provider : ServiceProvider.values()) {
            CircuitBreakerConfig config = breakerConfigs.getOrDefault(provider, defaultBreakerConfig());
            CircuitBreaker breaker = registry.circuitBreaker(provider.id(), config);
            breaker.getEventPublisher().onStateTransition(event -> {
                CircuitBreaker.State state = event.getStateTransition().getToState();
                int stateCode = stateCode(state);
                metrics.setBreakerState(provider.id(), stateCode);
                logger.info("Circuit breaker {} state -> {} ({})", provider.id(), state, stateCode);
            });
            metrics.setBreakerState(provider.id(), stateCode(breaker.getState()));
            breakers.put(provider, breaker);
            executors.put(provider, policies.executorFor(provider, metrics));
        }
        logger.info("ProviderResilienceManager initialized: providers={}", breakers.keySet());
    }

    public static CircuitBreakerConfig defaultBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(60))
            .permittedNumberOfCallsInHalfOpenState(3)
            .build();
    }

    /** Cursor trips sooner and stays open longer. */
    public static CircuitBreakerConfig cursorBreakerConfig() {
        return CircuitBreakerConfig.from(defaultBreakerConfig())
            .slidingWindowSize(8)
            .minimumNumberOfCalls(3)
            .waitDurationInOpenState(Duration.ofSeconds(120))
            .permittedNumberOfCallsInHalfOpenState(2)
            .build();
    }

    public static Map<ServiceProvider, CircuitBreakerConfig> defaultBreakerConfigs() {
        Map<ServiceProvider, CircuitBreakerConfig> configs = new EnumMap<>(ServiceProvider.class);
        configs.put(ServiceProvider.CURSOR, cursorBreakerConfig());
        configs.put(ServiceProvider.CLAUDE, defaultBreakerConfig());
        return Collections.unmodifiableMap(configs);
    }

    public <T> T executeWithResilience(ServiceProvider provider, Callable<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation");
        CircuitBreaker breaker = circuitBreaker(provider);
        return executors.get(provider).execute(() -> breaker.executeCallable(operation));
    }

    public <T> CompletableFuture<T> executeWithResilienceAsync(ServiceProvider provider,
                                                             Supplier<? extends CompletionStage<T>> operation) {
        Objects.requireNonNull(operation, "operation");
        CircuitBreaker breaker = circuitBreaker(provider);
        return executors.get(provider).executeAsync(() -> breaker.executeCompletionStage(operation::get));
    }

    /**
     * Health rules:
     * - CLOSED: healthy if successRate > 0.8 or nothing recorded
     *     "No recent activity" | "Excellent" (>0.9) | "Good" (>0.7) | "Degraded"
     * - OPEN: unhealthy, "Service Unavailable"
     * - HALF_OPEN: healthy if successRate > 0.5, "Testing Recovery"
     */
    public ProviderHealthStatus getHealthStatus(ServiceProvider provider) {
        CircuitBreaker breaker = circuitBreaker(provider);
        CircuitBreaker.State state = breaker.getState();
        CircuitBreaker.Metrics breakerMetrics = breaker.getMetrics();
        int totalCalls = breakerMetrics.getNumberOfBufferedCalls();
        double successRate = totalCalls == 0
            ? 1.0
            : (double) breakerMetrics.getNumberOfSuccessfulCalls() / totalCalls;

        return switch (state) {
            case OPEN, FORCED_OPEN ->
                new ProviderHealthStatus(provider, false, state, successRate, totalCalls, "Service Unavailable");
            case HALF_OPEN ->
                new ProviderHealthStatus(provider, successRate > 0.5, state, successRate, totalCalls, "Testing Recovery");
            default -> new ProviderHealthStatus(provider, totalCalls == 0 || successRate > 0.8, state,
                successRate, totalCalls, closedDescription(totalCalls, successRate));
        };
    }

    public void resetCircuitBreaker(ServiceProvider provider) {
        CircuitBreaker breaker = circuitBreaker(provider);
        breaker.reset();
        metrics.setBreakerState(provider.id(), stateCode(breaker.getState()));
        logger.info("Circuit breaker {} reset", provider.id());
    }

    public CircuitBreaker circuitBreaker(ServiceProvider provider) {
        Objects.requireNonNull(provider, "provider");
        return breakers.get(provider);
    }

    public RetryExecutor executor(ServiceProvider provider) {
        Objects.requireNonNull(provider, "provider");
        return executors.get(provider);
    }

    private static String closedDescription(int totalCalls, double successRate) {
        if (totalCalls == 0) {
            return "No recent activity";
        }
        if (successRate > 0.9) {
            return "Excellent";
        }
        if (successRate > 0.7) {
            return "Good";
        }
        return "Degraded";
    }

    static int stateCode(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> 1;   // Shedding load (fast-fail)
            case HALF_OPEN -> 2;           // Probing recovery
            default -> 0;                  // Normal operation
        };
    }
}
