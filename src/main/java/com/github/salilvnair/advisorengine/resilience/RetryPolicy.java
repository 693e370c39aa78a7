package com.github.salilvnair.advisorengine.resilience;

import com.github.salilvnair.advisorengine.engine.exception.TransientCallException;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.List;

public record RetryPolicy(
        int maxAttempts,
        long initialBackoffMs,
        long maxBackoffMs,
        double backoffMultiplier,
        List<Class<? extends Throwable>> retryOn
) {

    public static final List<Class<? extends Throwable>> DEFAULT_RETRY_ON = List.of(
            TransientCallException.class,
            HttpTimeoutException.class,
            ConnectException.class);

    public RetryPolicy {
        maxAttempts = Math.max(maxAttempts, 1);
        initialBackoffMs = Math.max(initialBackoffMs, 0L);
        maxBackoffMs = Math.max(maxBackoffMs, initialBackoffMs);
        backoffMultiplier = Math.max(backoffMultiplier, 1.0d);
        retryOn = retryOn == null ? List.of() : List.copyOf(retryOn);
    }

    public static RetryPolicy of(int maxAttempts, long initialBackoffMs, long maxBackoffMs, double backoffMultiplier) {
        return new RetryPolicy(maxAttempts, initialBackoffMs, maxBackoffMs, backoffMultiplier, DEFAULT_RETRY_ON);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0L, 0L, 1.0d, List.of());
    }

    /**
     * A failure is retryable when it, or anything in its cause chain, is one of {@link #retryOn()}.
     */
    public boolean isRetryable(Throwable failure) {
        Throwable current = failure;
        int depth = 0;
        while (current != null && depth < 10) {
            for (Class<? extends Throwable> type : retryOn) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    public long nextBackoffMs(long currentBackoffMs) {
        long next = Math.round(Math.max(1L, currentBackoffMs) * backoffMultiplier);
        return Math.min(maxBackoffMs, Math.max(initialBackoffMs, next));
    }

    /**
     * Upper bound of time spent sleeping between attempts for one logical call.
     */
    public long worstCaseBackoffMs() {
        long total = 0L;
        long backoff = initialBackoffMs;
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            total += backoff;
            backoff = nextBackoffMs(backoff);
        }
        return total;
    }
}
