package com.demo.retryengine.config;

import com.demo.retryengine.observability.ErrorClassifier;
import com.demo.retryengine.observability.RetryMetrics;
import com.demo.retryengine.provider.ProviderResilienceManager;
import com.demo.retryengine.provider.ProviderRetryPolicies;
import com.demo.retryengine.retry.BackoffCalculator;
import com.demo.retryengine.retry.RetryDecisionPolicy;
import com.demo.retryengine.retry.RetryExecutor;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the retry engine into a Spring Boot application.
 * Every bean backs off when the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(RetryProperties.class)
public class RetryEngineAutoConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(RetryEngineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryDecisionPolicy retryDecisionPolicy(ErrorClassifier errorClassifier) {
        return new RetryDecisionPolicy(errorClassifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new RetryMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderRetryPolicies providerRetryPolicies(RetryProperties properties,
                                                       RetryDecisionPolicy decisionPolicy,
                                                       BackoffCalculator backoffCalculator) {
        return new ProviderRetryPolicies(properties.resolveDefaultPolicy(), properties.resolveProviderPolicies(),
            decisionPolicy, backoffCalculator);
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(ProviderRetryPolicies policies,
                                       RetryDecisionPolicy decisionPolicy,
                                       BackoffCalculator backoffCalculator,
                                       RetryMetrics retryMetrics) {
        RetryExecutor executor = RetryExecutor.builder(policies.defaultPolicy())
            .decisionPolicy(decisionPolicy)
            .backoffCalculator(backoffCalculator)
            .listener(retryMetrics)
            .build();
        logger.info("Default retry executor initialized: {}", executor.policy());
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderResilienceManager providerResilienceManager(CircuitBreakerRegistry circuitBreakerRegistry,
                                                               RetryProperties properties,
                                                               ProviderRetryPolicies policies,
                                                               RetryMetrics retryMetrics) {
        return new ProviderResilienceManager(
            circuitBreakerRegistry, properties.resolveBreakerConfigs(), policies, retryMetrics);
    }
}
