package com.demo.retryengine.retry;

import com.demo.retryengine.observability.AttemptOutcome;
import com.demo.retryengine.observability.ErrorClassifier;
import com.demo.retryengine.observability.FailureClassification;
import com.demo.retryengine.observability.RetryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retry Executor: runs an operation until it succeeds, fails terminally, or runs out of retries.
 *
 * Attempt loop (per call, no state shared between calls):
 *   1. attempt = 1
 *   2. invoke the operation
 *   3. success -> return the value, no delay
 *   4. failure -> RetryDecisionPolicy (caller predicate, or ErrorClassifier)
 *        not retryable, or attempt > maxRetries -> surface the ORIGINAL failure
 *        otherwise -> wait BackoffCalculator.delay(attempt), attempt++, go to 2
 *
 * Two flavours share the loop:
 * - execute / executeOptional: blocking, the wait goes through the {@link Sleeper} (interruptible)
 * - executeAsync / executeOptionalAsync: the wait is a delayed hop on the async executor;
 *   cancelling the returned future cancels the in-flight attempt and stops the loop
 *
 * Instances are immutable and can be shared by any number of concurrent callers.
 */
public final class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    public static final String DEFAULT_NAME = "default";

    private final String name;
    private final RetryPolicy policy;
    private final RetryDecisionPolicy decisionPolicy;
    private final BackoffCalculator backoff;
    private final RetryListener listener;
    private final Executor asyncExecutor;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryExecutor(RetryPolicy policy) {
        this(builder(policy));
    }

    private RetryExecutor(Builder builder) {
        this.name = builder.name;
        this.policy = builder.policy;
        this.decisionPolicy = builder.decisionPolicy;
        this.backoff = builder.backoff;
        this.listener = builder.listener;
        this.asyncExecutor = builder.asyncExecutor;
        this.sleeper = builder.sleeper;
        this.clock = builder.clock;
    }

    public static RetryExecutor withDefaults() {
        return new RetryExecutor(RetryPolicy.defaults());
    }

    public static RetryExecutor aggressive() {
        return new RetryExecutor(RetryPolicy.aggressive());
    }

    public static Builder builder(RetryPolicy policy) {
        return new Builder(policy);
    }

    public String name() {
        return name;
    }

    public RetryPolicy policy() {
        return policy;
    }

    // ------------------------------------------------------------------ blocking

    public <T> T execute(Callable<T> operation) throws Exception {
        return execute(operation, null);
    }

    /**
     * @param shouldRetry decides retryability instead of the built-in classifier; null to use the classifier.
     *                    It receives the failure with CompletionException, ExecutionException and
     *                    UncheckedIOException wrappers removed, the same object the classifier sees.
     *                    Cancellation, VM errors and circuit breaker rejections never reach it.
     * @throws Exception the failure of the last attempt, unchanged
     */
    public <T> T execute(Callable<T> operation, @Nullable Predicate<Throwable> shouldRetry) throws Exception {
        Objects.requireNonNull(operation, "operation");
        int attempt = 1;
        while (true) {
            logger.debug("{}: attempt {}/{}", name, attempt, policy.maxAttempts());
            T value;
            try {
                value = operation.call();
            } catch (Exception e) {
                Duration delay = nextDelay(e, attempt, shouldRetry);
                if (delay == null) {
                    throw e;
                }
                // InterruptedException escapes here: cancellation ends the loop
                sleeper.sleep(delay);
                attempt++;
                continue;
            }
            succeeded(attempt);
            return value;
        }
    }

    public <T> Optional<T> executeOptional(Callable<? extends T> operation) throws Exception {
        return executeOptional(operation, null);
    }

    /**
     * A null result is a successful outcome: it is returned as {@link Optional#empty()} and not retried.
     */
    public <T> Optional<T> executeOptional(Callable<? extends T> operation,
                                           @Nullable Predicate<Throwable> shouldRetry) throws Exception {
        Objects.requireNonNull(operation, "operation");
        T value = this.<T>execute(operation::call, shouldRetry);
        return Optional.ofNullable(value);
    }

    // ------------------------------------------------------------------ async

    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        return executeAsync(operation, null);
    }

    /**
     * The returned future completes with the operation's value, or exceptionally with the original
     * failure of the last attempt (never a CompletionException wrapper). If {@code shouldRetry}
     * itself throws, the future completes with that exception, the attempt's failure suppressed on it.
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation,
                                                 @Nullable Predicate<Throwable> shouldRetry) {
        Objects.requireNonNull(operation, "operation");
        CompletableFuture<T> result = new CompletableFuture<>();
        attemptAsync(operation, shouldRetry, result, 1);
        return result;
    }

    public <T> CompletableFuture<Optional<T>> executeOptionalAsync(Supplier<? extends CompletionStage<T>> operation) {
        return executeOptionalAsync(operation, null);
    }

    public <T> CompletableFuture<Optional<T>> executeOptionalAsync(Supplier<? extends CompletionStage<T>> operation,
                                                                   @Nullable Predicate<Throwable> shouldRetry) {
        CompletableFuture<T> execution = executeAsync(operation, shouldRetry);
        CompletableFuture<Optional<T>> result = new CompletableFuture<>();
        execution.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(Optional.ofNullable(value));
            } else {
                result.completeExceptionally(error);
            }
        });
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                execution.cancel(true);
            }
        });
        return result;
    }

    private <T> void attemptAsync(Supplier<? extends CompletionStage<T>> operation,
                                  @Nullable Predicate<Throwable> shouldRetry,
                                  CompletableFuture<T> result,
                                  int attempt) {
        if (result.isDone()) {
            logger.debug("{}: cancelled before attempt {}", name, attempt);
            return;
        }

        logger.debug("{}: attempt {}/{}", name, attempt, policy.maxAttempts());
        CompletableFuture<T> inflight = invoke(operation);
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                inflight.cancel(true);
            }
        });

        inflight.whenComplete((value, error) -> {
            if (result.isDone()) {
                return;
            }
            if (error == null) {
                succeeded(attempt);
                result.complete(value);
                return;
            }

            Throwable failure = Objects.requireNonNull(ErrorClassifier.unwrap(error));
            try {
                Duration delay = nextDelay(failure, attempt, shouldRetry);
                if (delay == null) {
                    result.completeExceptionally(failure);
                    return;
                }
                CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS, asyncExecutor)
                    .execute(() -> attemptAsync(operation, shouldRetry, result, attempt + 1));
            } catch (Throwable t) {
                // e.g. a shouldRetry predicate that throws
                logger.debug("{}: retry decision failed on attempt {}", name, attempt, t);
                if (t != failure) {
                    t.addSuppressed(failure);
                }
                result.completeExceptionally(t);
            }
        });
    }

    private static <T> CompletableFuture<T> invoke(Supplier<? extends CompletionStage<T>> operation) {
        try {
            CompletionStage<T> stage = operation.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("operation returned a null stage"));
            }
            return stage.toCompletableFuture();
        } catch (Throwable t) {
            // A supplier that throws instead of returning a failed stage is treated the same way
            return CompletableFuture.failedFuture(t);
        }
    }

    // ------------------------------------------------------------------ shared

    /**
     * @return the delay before the next attempt, or null when the failure is terminal
     */
    @Nullable
    private Duration nextDelay(Throwable failure, int attempt, @Nullable Predicate<Throwable> shouldRetry) {
        FailureClassification classification = decisionPolicy.classifier().classify(failure);
        boolean retryable = decisionPolicy.shouldRetry(failure, shouldRetry, classification);

        if (!retryable || attempt > policy.maxRetries()) {
            AttemptOutcome outcome = new AttemptOutcome(attempt, clock.instant(), RetryState.FAILED, classification);
            logger.debug("{}: giving up after {} attempt(s), retryable={} [{}]: {}",
                name, attempt, retryable, classification, failure.toString());
            notifyListener(() -> listener.onFailure(name, outcome, failure));
            return null;
        }

        Duration delay = backoff.delay(attempt, policy, classification);
        AttemptOutcome outcome = new AttemptOutcome(attempt, clock.instant(), RetryState.RETRYING, classification);
        logger.warn("{} failed on attempt {}/{}, retrying in {} ms: {}",
            name, attempt, policy.maxAttempts(), delay.toMillis(), failure.toString());
        notifyListener(() -> listener.onRetry(name, outcome, failure, delay));
        return delay;
    }

    private void succeeded(int attempt) {
        AttemptOutcome outcome = new AttemptOutcome(attempt, clock.instant(), RetryState.SUCCESS, null);
        if (attempt > 1) {
            logger.debug("{}: succeeded on attempt {}", name, attempt);
        }
        notifyListener(() -> listener.onSuccess(name, outcome));
    }

    private void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.warn("{}: retry listener failed", name, e);
        }
    }

    @Override
    public String toString() {
        return "RetryExecutor[" + name + ", " + policy + "]";
    }

    /**
     * Builder for {@link RetryExecutor}.
     */
    public static final class Builder {
        private final RetryPolicy policy;
        private String name = DEFAULT_NAME;
        private RetryDecisionPolicy decisionPolicy = new RetryDecisionPolicy(new ErrorClassifier());
        private BackoffCalculator backoff = new BackoffCalculator();
        private RetryListener listener = RetryListener.NOOP;
        private Executor asyncExecutor = ForkJoinPool.commonPool();
        private Sleeper sleeper = Sleeper.THREAD;
        private Clock clock = Clock.systemUTC();

        private Builder(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
        }

        /** Name used in logs and as the 'executor' metric tag. */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.decisionPolicy = new RetryDecisionPolicy(Objects.requireNonNull(classifier, "classifier"));
            return this;
        }

        public Builder decisionPolicy(RetryDecisionPolicy decisionPolicy) {
            this.decisionPolicy = Objects.requireNonNull(decisionPolicy, "decisionPolicy");
            return this;
        }

        public Builder backoffCalculator(BackoffCalculator backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        public Builder listener(RetryListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        /** Executor that runs async attempts after a backoff delay. */
        public Builder asyncExecutor(Executor asyncExecutor) {
            this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
