package io.mapreducer.error;

/**
 * A single request's estimate exceeds the whole token window, so waiting can never admit it.
 */
public class ImpossibleEstimateException extends ConfigurationException {
    private final long estimate;
    private final long capacity;

    public ImpossibleEstimateException(Phase phase, Integer segmentIndex, long estimate, long capacity) {
        super(phase, segmentIndex, "tokensPerMinute",
                phase + " operation token estimate (" + estimate + ") exceeds TPM limit (" + capacity + ")"
                        + (segmentIndex == null ? "" : " for segment " + segmentIndex)
                        + (phase == Phase.REDUCE ? ". Consider reducing reduceOutputMaxTokens or the hierarchy group size." : ""));
        this.estimate = estimate;
        this.capacity = capacity;
    }

    public long estimate() { return estimate; }

    public long capacity() { return capacity; }
}
