package com.demo.retryengine.provider;

import com.demo.retryengine.observability.ErrorClassifier;
import com.demo.retryengine.observability.RetryListener;
import com.demo.retryengine.retry.BackoffCalculator;
import com.demo.retryengine.retry.RetryDecisionPolicy;
import com.demo.retryengine.retry.RetryExecutor;
import com.demo.retryengine.retry.RetryPolicy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the retry policy used for each provider.
 *
 * Resolution:
 * - provider has an override -> override
 * - otherwise -> default policy
 *
 * Resolution is a plain lookup, so one instance serves all callers. Every executor built here
 * shares the same decision policy and backoff calculator.
 */
public class ProviderRetryPolicies {

    private final RetryPolicy defaultPolicy;
    private final Map<ServiceProvider, RetryPolicy> overrides;
    private final RetryDecisionPolicy decisionPolicy;
    private final BackoffCalculator backoff;

    public ProviderRetryPolicies() {
        this(RetryPolicy.defaults(), Map.of());
    }

    public ProviderRetryPolicies(RetryPolicy defaultPolicy, Map<ServiceProvider, RetryPolicy> overrides) {
        this(defaultPolicy, overrides, new RetryDecisionPolicy(new ErrorClassifier()), new BackoffCalculator());
    }

    public ProviderRetryPolicies(RetryPolicy defaultPolicy,
                                 Map<ServiceProvider, RetryPolicy> overrides,
                                 RetryDecisionPolicy decisionPolicy,
                                 BackoffCalculator backoff) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
        this.decisionPolicy = Objects.requireNonNull(decisionPolicy, "decisionPolicy");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        Map<ServiceProvider, RetryPolicy> copy = new EnumMap<>(ServiceProvider.class);
        copy.putAll(overrides);
        this.overrides = Collections.unmodifiableMap(copy);
    }

    public RetryPolicy defaultPolicy() {
        return defaultPolicy;
    }

    public RetryPolicy forProvider(ServiceProvider provider) {
        Objects.requireNonNull(provider, "provider");
        return overrides.getOrDefault(provider, defaultPolicy);
    }

    public RetryExecutor executorFor(ServiceProvider provider) {
        return executorFor(provider, RetryListener.NOOP);
    }

    /**
     * Executor named after the provider id, so logs and metric tags identify the upstream.
     */
    public RetryExecutor executorFor(ServiceProvider provider, RetryListener listener) {
        return RetryExecutor.builder(forProvider(provider))
            .name(provider.id())
            .decisionPolicy(decisionPolicy)
            .backoffCalculator(backoff)
            .listener(listener)
            .build();
    }
}
