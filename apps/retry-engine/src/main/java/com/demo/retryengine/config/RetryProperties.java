package com.demo.retryengine.config;

import com.demo.retryengine.provider.ProviderResilienceManager;
import com.demo.retryengine.provider.ServiceProvider;
import com.demo.retryengine.retry.RetryPolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retry engine configuration (prefix "retry-engine").
 *
 * <pre>
 * retry-engine:
 *   default-policy:
 *     max-retries: 3
 *     initial-delay: 1s
 *   providers:
 *     cursor:
 *       max-retries: 5
 *   circuit-breaker:
 *     failure-rate-threshold: 50
 *     providers:
 *       cursor:
 *         wait-duration-in-open-state: 120s
 * </pre>
 *
 * Unset policy fields fall back to the preset they override; provider entries fall back to the
 * resolved default policy. Unknown provider ids fail startup.
 */
@ConfigurationProperties(prefix = "retry-engine")
public class RetryProperties {

    private PolicySettings defaultPolicy = new PolicySettings();
    private PolicySettings aggressivePolicy = new PolicySettings();
    private Map<String, PolicySettings> providers = new LinkedHashMap<>();
    private CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();

    public PolicySettings getDefaultPolicy() {
        return defaultPolicy;
    }

    public void setDefaultPolicy(PolicySettings defaultPolicy) {
        this.defaultPolicy = defaultPolicy;
    }

    public PolicySettings getAggressivePolicy() {
        return aggressivePolicy;
    }

    public void setAggressivePolicy(PolicySettings aggressivePolicy) {
        this.aggressivePolicy = aggressivePolicy;
    }

    public Map<String, PolicySettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, PolicySettings> providers) {
        this.providers = providers;
    }

    public CircuitBreakerSettings getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreakerSettings circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public RetryPolicy resolveDefaultPolicy() {
        return defaultPolicy.applyTo(RetryPolicy.defaults());
    }

    public RetryPolicy resolveAggressivePolicy() {
        return aggressivePolicy.applyTo(RetryPolicy.aggressive());
    }

    public Map<ServiceProvider, RetryPolicy> resolveProviderPolicies() {
        RetryPolicy base = resolveDefaultPolicy();
        Map<ServiceProvider, RetryPolicy> resolved = new EnumMap<>(ServiceProvider.class);
        providers.forEach((id, settings) -> resolved.put(provider(id), settings.applyTo(base)));
        return resolved;
    }

    public Map<ServiceProvider, CircuitBreakerConfig> resolveBreakerConfigs() {
        Map<ServiceProvider, CircuitBreakerConfig> resolved = new EnumMap<>(ServiceProvider.class);
        ProviderResilienceManager.defaultBreakerConfigs().forEach((provider, preset) ->
            resolved.put(provider, circuitBreaker.applyTo(preset)));
        circuitBreaker.getProviders().forEach((id, settings) -> {
            ServiceProvider provider = provider(id);
            resolved.put(provider, settings.applyTo(resolved.get(provider)));
        });
        return resolved;
    }

    private static ServiceProvider provider(String id) {
        return ServiceProvider.fromId(id)
            .orElseThrow(() -> new IllegalArgumentException("Unknown provider in retry-engine configuration: " + id));
    }

    /**
     * Retry policy fields; null means "keep the preset value".
     */
    public static class PolicySettings {
        private Integer maxRetries;
        private Duration initialDelay;
        private Duration maxDelay;
        private Double multiplier;
        private Double jitterFactor;

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public Double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(Double multiplier) {
            this.multiplier = multiplier;
        }

        public Double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(Double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        public RetryPolicy applyTo(RetryPolicy preset) {
            return new RetryPolicy(
                maxRetries != null ? maxRetries : preset.maxRetries(),
                initialDelay != null ? initialDelay : preset.initialDelay(),
                maxDelay != null ? maxDelay : preset.maxDelay(),
                multiplier != null ? multiplier : preset.multiplier(),
                jitterFactor != null ? jitterFactor : preset.jitterFactor());
        }
    }

    /**
     * Circuit breaker fields; null means "keep the preset value".
     */
    public static class BreakerSettings {
        private Float failureRateThreshold;
        private Integer slidingWindowSize;
        private Integer minimumNumberOfCalls;
        private Duration waitDurationInOpenState;
        private Integer permittedNumberOfCallsInHalfOpenState;

        public Float getFailureRateThreshold() {
            return failureRateThreshold;
        }

        public void setFailureRateThreshold(Float failureRateThreshold) {
            this.failureRateThreshold = failureRateThreshold;
        }

        public Integer getSlidingWindowSize() {
            return slidingWindowSize;
        }

        public void setSlidingWindowSize(Integer slidingWindowSize) {
            this.slidingWindowSize = slidingWindowSize;
        }

        public Integer getMinimumNumberOfCalls() {
            return minimumNumberOfCalls;
        }

        public void setMinimumNumberOfCalls(Integer minimumNumberOfCalls) {
            this.minimumNumberOfCalls = minimumNumberOfCalls;
        }

        public Duration getWaitDurationInOpenState() {
            return waitDurationInOpenState;
        }

        public void setWaitDurationInOpenState(Duration waitDurationInOpenState) {
            this.waitDurationInOpenState = waitDurationInOpenState;
        }

        public Integer getPermittedNumberOfCallsInHalfOpenState() {
            return permittedNumberOfCallsInHalfOpenState;
        }

        public void setPermittedNumberOfCallsInHalfOpenState(Integer permittedNumberOfCallsInHalfOpenState) {
            this.permittedNumberOfCallsInHalfOpenState = permittedNumberOfCallsInHalfOpenState;
        }

        public CircuitBreakerConfig applyTo(CircuitBreakerConfig preset) {
            CircuitBreakerConfig.Builder builder = CircuitBreakerConfig.from(preset);
            if (failureRateThreshold != null) {
                builder.failureRateThreshold(failureRateThreshold);
            }
            if (slidingWindowSize != null) {
                builder.slidingWindowSize(slidingWindowSize);
            }
            if (minimumNumberOfCalls != null) {
                builder.minimumNumberOfCalls(minimumNumberOfCalls);
            }
            if (waitDurationInOpenState != null) {
                builder.waitDurationInOpenState(waitDurationInOpenState);
            }
            if (permittedNumberOfCallsInHalfOpenState != null) {
                builder.permittedNumberOfCallsInHalfOpenState(permittedNumberOfCallsInHalfOpenState);
            }
            return builder.build();
        }
    }

    /**
     * Shared breaker settings plus per-provider overrides.
     */
    public static class CircuitBreakerSettings extends BreakerSettings {
        private Map<String, BreakerSettings> providers = new LinkedHashMap<>();

        public Map<String, BreakerSettings> getProviders() {
            return providers;
        }

        public void setProviders(Map<String, BreakerSettings> providers) {
            this.providers = providers;
        }
    }
}
