package io.mapreducer.retry;

public interface RetryPolicy {
    FailureClass classify(Exception e);

    /** Whether the attempt numbered {@code attempt} (1-based) that failed with {@code e} gets another try. */
    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt, Exception e);

    /** Retries after the first attempt; total invocations are at most {@code maxRetries() + 1}. */
    int maxRetries();
}
