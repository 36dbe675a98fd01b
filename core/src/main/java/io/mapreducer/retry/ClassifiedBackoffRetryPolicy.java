package io.mapreducer.retry;

import io.mapreducer.core.ProviderException;

import java.time.Duration;
import java.util.Optional;

/**
 * Retries rate limiting (429) and server errors (5xx) with capped exponential backoff; every
 * other failure is fatal. A 429 that carries a retry-after hint waits exactly that long.
 */
public class ClassifiedBackoffRetryPolicy implements RetryPolicy {
    public static final int DEFAULT_MAX_RETRIES = 7;
    public static final long DEFAULT_BASE_MILLIS = 1_000;
    public static final long DEFAULT_MAX_MILLIS = 8_000;

    private final int maxRetries;
    private final long baseMillis;
    private final long maxMillis;

    public ClassifiedBackoffRetryPolicy() {
        this(DEFAULT_MAX_RETRIES, DEFAULT_BASE_MILLIS, DEFAULT_MAX_MILLIS);
    }

    public ClassifiedBackoffRetryPolicy(int maxRetries) {
        this(maxRetries, DEFAULT_BASE_MILLIS, DEFAULT_MAX_MILLIS);
    }

    public ClassifiedBackoffRetryPolicy(int maxRetries, long baseMillis, long maxMillis) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
    }

    @Override
    public FailureClass classify(Exception e) {
        Optional<ProviderException> provider = findProviderException(e);
        if (provider.isEmpty()) return FailureClass.FATAL;
        if (provider.get().isRateLimited()) return FailureClass.RATE_LIMITED;
        if (provider.get().isServerError()) return FailureClass.SERVER_ERROR;
        return FailureClass.FATAL;
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt <= maxRetries && classify(e) != FailureClass.FATAL;
    }

    @Override
    public long backoffMillis(int attempt, Exception e) {
        if (classify(e) == FailureClass.RATE_LIMITED) {
            Optional<Duration> hint = findProviderException(e).flatMap(ProviderException::retryAfter);
            if (hint.isPresent() && !hint.get().isNegative()) return hint.get().toMillis();
        }
        long delay = baseMillis * (1L << Math.min(20, attempt));
        return Math.min(delay, maxMillis);
    }

    @Override
    public int maxRetries() { return maxRetries; }

    static Optional<ProviderException> findProviderException(Throwable t) {
        Throwable cur = t;
        int depth = 0;
        while (cur != null && depth++ < 10) {
            if (cur instanceof ProviderException pe) return Optional.of(pe);
            cur = cur.getCause();
        }
        return Optional.empty();
    }
}
