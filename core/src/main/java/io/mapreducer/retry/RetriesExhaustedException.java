package io.mapreducer.retry;

/** Every allowed attempt failed with a retryable error. The last failure is the cause. */
public class RetriesExhaustedException extends Exception {
    private final int attempts;

    public RetriesExhaustedException(int attempts, Exception last) {
        super("Retries exhausted after " + attempts + " attempts: "
                + (last.getMessage() != null ? last.getMessage() : last.getClass().getSimpleName()), last);
        this.attempts = attempts;
    }

    public int attempts() { return attempts; }
}
