package com.demo.retryengine.observability;

import com.demo.retryengine.error.HttpStatusException;
import com.demo.retryengine.error.ResponseDecodingException;
import com.demo.retryengine.error.RetryableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLException;
import java.io.EOFException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.ProtocolException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.CharacterCodingException;
import java.security.cert.CertificateException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Error Classifier: Maps a failure to a {@link FailureClassification}.
 *
 * Input is whatever the wrapped operation threw:
 * 1. The engine's own taxonomy ({@link RetryableException})
 * 2. HTTP-shaped failures ({@link HttpStatusException}): 5xx, 429, other statuses
 * 3. gRPC failures ({@link StatusRuntimeException}, {@link StatusException})
 * 4. Structural failures (TLS, certificates, decoding) - never retryable
 * 5. Transport failures from java.net / java.nio (timeouts, connection problems)
 *
 * Unknown failures are non-retryable. The classifier is total: it never throws.
 */
@Component
public class ErrorClassifier {

    private static final int TOO_MANY_REQUESTS = 429;
    private static final int MAX_UNWRAP_DEPTH = 16;  // Guards against cause cycles

    public FailureClassification classify(@Nullable Throwable failure) {
        Throwable error = unwrap(failure);
        if (error == null) {
            return FailureClassification.nonRetryable();
        }

        // Cancellation is a hard stop, not a failure
        if (isCancellation(error) || error instanceof CallNotPermittedException) {
            return FailureClassification.nonRetryable();
        }

        if (error instanceof RetryableException re) {
            FailureClassification reported = re.reported();
            return reported.kind() == FailureKind.SERVER_ERROR
                ? fromStatusCode(reported.statusCode(), null)
                : reported;
        }

        if (error instanceof HttpStatusException hse) {
            return fromStatusCode(hse.statusCode(), hse.retryAfter().orElse(null));
        }

        if (error instanceof StatusRuntimeException sre) {
            return fromGrpcStatus(sre.getStatus());
        }
        if (error instanceof StatusException se) {
            return fromGrpcStatus(se.getStatus());
        }

        // SSLException is an IOException: check before the transport rules
        if (isStructural(error)) {
            return FailureClassification.nonRetryable();
        }

        return classifyTransport(error).orElse(FailureClassification.nonRetryable());
    }

    /**
     * Converts a transport-layer failure into the retryable taxonomy.
     *
     * @return the classification, or empty when the failure is not a recognised transport failure
     */
    public static Optional<FailureClassification> classifyTransport(@Nullable Throwable failure) {
        Throwable error = unwrap(failure);
        if (error == null || isStructural(error)) {
            return Optional.empty();
        }
        if (error instanceof SocketTimeoutException
            || error instanceof HttpTimeoutException
            || error instanceof TimeoutException) {
            return Optional.of(FailureClassification.networkTimeout());
        }
        // ConnectException, NoRouteToHostException and PortUnreachableException are SocketExceptions
        // too; they are listed for readability.
        if (error instanceof UnknownHostException
            || error instanceof ConnectException
            || error instanceof NoRouteToHostException
            || error instanceof PortUnreachableException
            || error instanceof SocketException
            || error instanceof EOFException
            || (error instanceof ClosedChannelException && !(error instanceof ClosedByInterruptException))) {
            return Optional.of(FailureClassification.connectionError());
        }
        return Optional.empty();
    }

    /**
     * True for signals that mean "stop", which must never be retried.
     */
    public static boolean isCancellation(@Nullable Throwable failure) {
        Throwable error = unwrap(failure);
        return error instanceof CancellationException
            || error instanceof InterruptedException
            || error instanceof ClosedByInterruptException
            || (error instanceof InterruptedIOException && !(error instanceof SocketTimeoutException));
    }

    /**
     * Strips the wrappers added by futures and lambdas so the original failure is classified.
     */
    @Nullable
    public static Throwable unwrap(@Nullable Throwable failure) {
        Throwable current = failure;
        int depth = 0;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof UncheckedIOException)
            && current.getCause() != null
            && depth++ < MAX_UNWRAP_DEPTH) {
            current = current.getCause();
        }
        return current;
    }

    static FailureClassification fromStatusCode(int statusCode, @Nullable Duration retryAfter) {
        if (statusCode >= 500 && statusCode <= 599) {
            return FailureClassification.serverError(statusCode);
        }
        if (statusCode == TOO_MANY_REQUESTS) {
            return FailureClassification.rateLimited(retryAfter);
        }
        return FailureClassification.nonRetryable();
    }

    static FailureClassification fromGrpcStatus(Status status) {
        return switch (status.getCode()) {
            case DEADLINE_EXCEEDED -> FailureClassification.networkTimeout();
            case UNAVAILABLE -> FailureClassification.connectionError();
            case RESOURCE_EXHAUSTED -> FailureClassification.rateLimited(null);
            case INTERNAL, UNKNOWN -> FailureClassification.serverError(500);
            default -> FailureClassification.nonRetryable();
        };
    }

    private static boolean isStructural(Throwable error) {
        return error instanceof ResponseDecodingException
            || error instanceof SSLException
            || error instanceof CertificateException
            || error instanceof CharacterCodingException
            || error instanceof ProtocolException
            || error instanceof MalformedURLException
            || error instanceof URISyntaxException;
    }
}
