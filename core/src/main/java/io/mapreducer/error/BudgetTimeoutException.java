package io.mapreducer.error;

/**
 * The token window never freed enough room for a job within the configured timeout. Signals a
 * structurally insufficient tokens-per-minute setting, so the whole run is aborted.
 */
public class BudgetTimeoutException extends SummarizationException {
    private final long needed;
    private final long remaining;
    private final long waitedMillis;

    public BudgetTimeoutException(Phase phase, Integer segmentIndex, long needed, long remaining, long waitedMillis) {
        super(ErrorKind.BUDGET_TIMEOUT, phase, segmentIndex,
                "Token budget timeout after " + (waitedMillis / 1000) + " seconds: need " + needed + ", have " + remaining,
                null);
        this.needed = needed;
        this.remaining = remaining;
        this.waitedMillis = waitedMillis;
    }

    public long needed() { return needed; }

    public long remaining() { return remaining; }

    public long waitedMillis() { return waitedMillis; }
}
