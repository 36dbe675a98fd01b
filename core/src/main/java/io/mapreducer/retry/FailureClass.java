package io.mapreducer.retry;

/** How a failed attempt is treated by a {@link RetryPolicy}. */
public enum FailureClass {
    RATE_LIMITED,
    SERVER_ERROR,
    FATAL
}
