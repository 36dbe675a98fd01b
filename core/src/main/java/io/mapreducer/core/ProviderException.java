package io.mapreducer.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Failure reported by the remote provider, carrying its HTTP status and, for rate limiting,
 * the optional retry-after hint.
 */
public class ProviderException extends Exception {
    private final int status;
    private final Duration retryAfter;

    public ProviderException(int status, String message) {
        this(status, null, message);
    }

    public ProviderException(int status, Duration retryAfter, String message) {
        super(message);
        this.status = status;
        this.retryAfter = retryAfter;
    }

    public int status() { return status; }

    public Optional<Duration> retryAfter() { return Optional.ofNullable(retryAfter); }

    public boolean isRateLimited() { return status == 429; }

    public boolean isServerError() { return status >= 500; }
}
