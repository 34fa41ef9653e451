package com.demo.retryengine.retry;

import com.demo.retryengine.error.HttpStatusException;
import com.demo.retryengine.error.RetryableException;
import com.demo.retryengine.observability.AttemptOutcome;
import com.demo.retryengine.observability.FailureKind;
import com.demo.retryengine.observability.RetryListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Blocking attempt loop. Waits go through a recording {@link Sleeper}, so no test actually sleeps
 * except the timing scenario at the end.
 */
class RetryExecutorTest {

    private static final RetryPolicy NO_JITTER = RetryPolicy.defaults().withJitterFactor(0.0);

    private List<Duration> sleeps;
    private AtomicInteger calls;

    @BeforeEach
    void setup() {
        sleeps = new ArrayList<>();
        calls = new AtomicInteger();
    }

    private RetryExecutor executor(RetryPolicy policy) {
        return RetryExecutor.builder(policy).sleeper(sleeps::add).build();
    }

    @Test
    void testSuccessOnFirstAttempt_NoDelay() throws Exception {
        String result = executor(NO_JITTER).execute(() -> {
            calls.incrementAndGet();
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty(), "Success should not wait");
    }

    @Test
    void testServerErrorsThenSuccess_ExponentialDelays() throws Exception {
        String result = executor(NO_JITTER).execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw RetryableException.serverError(503);
            }
            return "recovered";
        });

        assertEquals("recovered", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void testRetriesExhausted_OriginalFailureSurfaces() {
        RetryableException failure = RetryableException.serverError(503);
        RetryExecutor executor = executor(NO_JITTER.withMaxRetries(2));

        RetryableException thrown = assertThrows(RetryableException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw failure;
        }));

        assertSame(failure, thrown, "The last failure should surface unchanged");
        assertEquals(3, calls.get(), "maxRetries=2 means 3 attempts");
        assertEquals(2, sleeps.size());
    }

    @Test
    void testNonRetryableFailure_SingleAttempt() {
        RetryExecutor executor = executor(NO_JITTER);

        assertThrows(RetryableException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw RetryableException.serverError(404);
        }));

        assertEquals(1, calls.get(), "404 should not be retried");
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testNoRetryPolicy_SingleAttempt() {
        RetryExecutor executor = executor(RetryPolicy.noRetry());

        assertThrows(RetryableException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw RetryableException.networkTimeout();
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void testCheckedFailure_PropagatesUnchanged() {
        IOException failure = new IOException("disk full");
        RetryExecutor executor = executor(NO_JITTER);

        IOException thrown = assertThrows(IOException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw failure;
        }));

        assertSame(failure, thrown);
        assertEquals(1, calls.get(), "A generic IOException is not a transport failure");
    }

    @Test
    void testRateLimitHint_DrivesDelay() throws Exception {
        String result = executor(RetryPolicy.defaults()).execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new HttpStatusException(429, "HTTP 429", Duration.ofMillis(200));
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(List.of(Duration.ofMillis(200)), sleeps);
    }

    @Test
    void testPredicate_RetriesOtherwiseNonRetryableFailure() throws Exception {
        String result = executor(NO_JITTER).execute(() -> {
            if (calls.incrementAndGet() < 2) {
                throw new IllegalStateException("stale token");
            }
            return "ok";
        }, e -> e instanceof IllegalStateException);

        assertEquals("ok", result);
        assertEquals(2, calls.get());
    }

    @Test
    void testPredicate_BlocksOtherwiseRetryableFailure() {
        RetryExecutor executor = executor(NO_JITTER);

        assertThrows(RetryableException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw RetryableException.networkTimeout();
        }, e -> false));

        assertEquals(1, calls.get());
    }

    @Test
    void testCancellation_NotRetriedEvenWithPermissivePredicate() {
        RetryExecutor executor = executor(NO_JITTER);

        assertThrows(CancellationException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new CancellationException("caller gave up");
        }, e -> true));

        assertEquals(1, calls.get());
    }

    @Test
    void testInterruptedDuringBackoff_StopsWithoutFurtherAttempts() {
        RetryExecutor executor = RetryExecutor.builder(NO_JITTER)
            .sleeper(delay -> {
                throw new InterruptedException("cancelled while waiting");
            })
            .build();

        assertThrows(InterruptedException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw RetryableException.connectionError();
        }));

        assertEquals(1, calls.get(), "No attempt should start after cancellation");
    }

    @Test
    void testExecuteOptional_NullIsSuccess() throws Exception {
        Optional<String> result = executor(NO_JITTER).executeOptional(() -> {
            calls.incrementAndGet();
            return null;
        });

        assertTrue(result.isEmpty());
        assertEquals(1, calls.get(), "A null result should not be retried");
    }

    @Test
    void testExecuteOptional_RetriesFailures() throws Exception {
        Optional<Integer> result = executor(NO_JITTER).executeOptional(() -> {
            if (calls.incrementAndGet() < 2) {
                throw RetryableException.connectionError();
            }
            return 42;
        });

        assertEquals(Optional.of(42), result);
    }

    @Test
    void testListener_ReceivesEveryAttempt() throws Exception {
        List<String> events = new ArrayList<>();
        RetryListener listener = new RetryListener() {
            @Override
            public void onSuccess(String executor, AttemptOutcome outcome) {
                events.add(executor + ":success@" + outcome.attempt());
            }

            @Override
            public void onRetry(String executor, AttemptOutcome outcome, Throwable failure, Duration delay) {
                events.add(executor + ":retry@" + outcome.attempt() + ":" + outcome.classification().kind());
            }
        };
        RetryExecutor executor = RetryExecutor.builder(NO_JITTER)
            .name("cursor")
            .listener(listener)
            .sleeper(sleeps::add)
            .build();

        executor.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw RetryableException.networkTimeout();
            }
            return "ok";
        });

        assertEquals(List.of("cursor:retry@1:" + FailureKind.NETWORK_TIMEOUT, "cursor:success@2"), events);
    }

    @Test
    void testListener_FailureDoesNotAffectLoop() throws Exception {
        RetryListener broken = new RetryListener() {
            @Override
            public void onRetry(String executor, AttemptOutcome outcome, Throwable failure, Duration delay) {
                throw new IllegalStateException("listener bug");
            }
        };
        RetryExecutor executor = RetryExecutor.builder(NO_JITTER).listener(broken).sleeper(sleeps::add).build();

        String result = executor.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw RetryableException.connectionError();
            }
            return "ok";
        });

        assertEquals("ok", result);
    }

    @Test
    void testRealBackoff_WaitsBetweenAttempts() throws Exception {
        RetryPolicy policy = RetryPolicy.of(2, Duration.ofMillis(20), Duration.ofSeconds(1), 2.0, 0.0);
        RetryExecutor executor = new RetryExecutor(policy);

        long start = System.nanoTime();
        String result = executor.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw RetryableException.networkTimeout();
            }
            return "ok";
        });
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals("ok", result);
        assertTrue(elapsedMs >= 60, "Expected 20ms + 40ms of backoff, took " + elapsedMs + "ms");
    }

    @Test
    void testPersistentTimeout_FourAttemptsUnderOneSecond() {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(10), Duration.ofMillis(100), 2.0, 0.0);
        RetryExecutor executor = new RetryExecutor(policy);

        long start = System.nanoTime();
        RetryableException thrown = assertThrows(RetryableException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw RetryableException.networkTimeout();
        }));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals(4, calls.get());
        assertEquals(FailureKind.NETWORK_TIMEOUT, thrown.kind());
        assertTrue(elapsedMs < 1000, "10 + 20 + 40 ms of backoff should finish well under a second, took " + elapsedMs);
    }

    @Test
    void testRealRateLimitHint_WaitsAtLeastHint() throws Exception {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(10), Duration.ofMillis(100), 2.0, 0.0);
        RetryExecutor executor = new RetryExecutor(policy);
        List<Long> startTimes = new ArrayList<>();

        executor.execute(() -> {
            startTimes.add(System.nanoTime());
            if (calls.incrementAndGet() == 1) {
                throw RetryableException.rateLimited(Duration.ofMillis(200));
            }
            return "ok";
        });

        long gapMs = Duration.ofNanos(startTimes.get(1) - startTimes.get(0)).toMillis();
        assertTrue(gapMs >= 200, "The retry-after hint governs the wait, waited " + gapMs + "ms");
    }

    @Test
    void testHugeRetryAfterHint_OriginalFailureSurfaces() {
        HttpStatusException failure = new HttpStatusException(429, "HTTP 429", Duration.ofSeconds(10_000_000_000L));
        RetryExecutor executor = executor(NO_JITTER.withMaxRetries(1));

        HttpStatusException thrown = assertThrows(HttpStatusException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw failure;
        }));

        assertSame(failure, thrown, "An out-of-range hint must not replace the 429");
        assertEquals(2, calls.get());
        assertEquals(List.of(BackoffCalculator.MAX_DELAY), sleeps, "The hint saturates instead of overflowing");
    }

    @Test
    void testPredicateThrows_PropagatesFromExecute() {
        RetryExecutor executor = executor(NO_JITTER);

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> executor.execute(() -> {
            calls.incrementAndGet();
            throw RetryableException.networkTimeout();
        }, e -> {
            throw new IllegalStateException("predicate bug");
        }));

        assertEquals("predicate bug", thrown.getMessage());
        assertEquals(1, calls.get());
    }
}
