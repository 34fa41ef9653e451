package com.demo.retryengine.config;

import com.demo.retryengine.observability.ErrorClassifier;
import com.demo.retryengine.observability.FailureClassification;
import com.demo.retryengine.observability.RetryMetrics;
import com.demo.retryengine.provider.ProviderResilienceManager;
import com.demo.retryengine.provider.ProviderRetryPolicies;
import com.demo.retryengine.provider.ServiceProvider;
import com.demo.retryengine.retry.RetryExecutor;
import com.demo.retryengine.retry.RetryPolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryEngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RetryEngineAutoConfiguration.class));

    @Test
    void testDefaults_AllBeansPresent() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertEquals(RetryPolicy.defaults(), context.getBean(RetryExecutor.class).policy());
            assertEquals(RetryPolicy.defaults(),
                context.getBean(ProviderRetryPolicies.class).forProvider(ServiceProvider.CURSOR));
            assertNotNull(context.getBean(ProviderResilienceManager.class));
            assertNotNull(context.getBean(RetryMetrics.class).registry(), "Falls back to a simple registry");
        });
    }

    @Test
    void testPolicyProperties_Bound() {
        contextRunner
            .withPropertyValues(
                "retry-engine.default-policy.max-retries=5",
                "retry-engine.default-policy.initial-delay=250ms",
                "retry-engine.providers.cursor.max-retries=1",
                "retry-engine.providers.cursor.jitter-factor=0")
            .run(context -> {
                ProviderRetryPolicies policies = context.getBean(ProviderRetryPolicies.class);
                RetryPolicy claude = policies.forProvider(ServiceProvider.CLAUDE);
                RetryPolicy cursor = policies.forProvider(ServiceProvider.CURSOR);

                assertEquals(5, claude.maxRetries());
                assertEquals(Duration.ofMillis(250), claude.initialDelay());
                assertEquals(Duration.ofSeconds(30), claude.maxDelay(), "Unset fields keep the preset");

                assertEquals(1, cursor.maxRetries());
                assertEquals(0.0, cursor.jitterFactor());
                assertEquals(Duration.ofMillis(250), cursor.initialDelay(), "Provider entries extend the default policy");
            });
    }

    @Test
    void testBreakerProperties_Bound() {
        contextRunner
            .withPropertyValues(
                "retry-engine.circuit-breaker.failure-rate-threshold=70",
                "retry-engine.circuit-breaker.providers.claude.sliding-window-size=20")
            .run(context -> {
                ProviderResilienceManager manager = context.getBean(ProviderResilienceManager.class);
                CircuitBreakerConfig claude = manager.circuitBreaker(ServiceProvider.CLAUDE).getCircuitBreakerConfig();
                CircuitBreakerConfig cursor = manager.circuitBreaker(ServiceProvider.CURSOR).getCircuitBreakerConfig();

                assertEquals(70.0f, claude.getFailureRateThreshold());
                assertEquals(20, claude.getSlidingWindowSize());
                assertEquals(70.0f, cursor.getFailureRateThreshold());
                assertEquals(8, cursor.getSlidingWindowSize(), "Cursor keeps its conservative preset");
            });
    }

    @Test
    void testUnknownProvider_FailsStartup() {
        contextRunner
            .withPropertyValues("retry-engine.providers.openai.max-retries=2")
            .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void testInvalidPolicy_FailsStartup() {
        contextRunner
            .withPropertyValues("retry-engine.default-policy.jitter-factor=2")
            .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void testApplicationMeterRegistry_Used() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        contextRunner
            .withBean(MeterRegistry.class, () -> meterRegistry)
            .run(context -> assertSame(meterRegistry, context.getBean(RetryMetrics.class).registry()));
    }

    @Test
    void testApplicationClassifier_UsedByProviderExecutors() {
        ErrorClassifier staleTokenRetryable = new ErrorClassifier() {
            @Override
            public FailureClassification classify(Throwable failure) {
                return failure instanceof IllegalStateException
                    ? FailureClassification.connectionError()
                    : super.classify(failure);
            }
        };
        contextRunner
            .withBean(ErrorClassifier.class, () -> staleTokenRetryable)
            .withPropertyValues(
                "retry-engine.default-policy.initial-delay=1ms",
                "retry-engine.default-policy.jitter-factor=0")
            .run(context -> {
                ProviderResilienceManager manager = context.getBean(ProviderResilienceManager.class);
                AtomicInteger calls = new AtomicInteger();

                String result = manager.executeWithResilience(ServiceProvider.CLAUDE, () -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new IllegalStateException("stale token");
                    }
                    return "ok";
                });

                assertEquals("ok", result);
                assertEquals(2, calls.get(), "The application's classifier should make the failure retryable");
            });
    }
}
