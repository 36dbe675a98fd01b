package io.mapreducer.error;

/** A reduce group failed. There is no subset that can be dropped from a reduction, so it is fatal. */
public class ReduceFailureException extends SummarizationException {
    private final int round;
    private final int groupIndex;

    public ReduceFailureException(int round, int groupIndex, Throwable cause) {
        super(ErrorKind.REDUCE_FAILURE, Phase.REDUCE, null,
                "Reduce operation failed in round " + round + ", group " + groupIndex + ": "
                        + SegmentFailureException.describe(cause),
                cause);
        this.round = round;
        this.groupIndex = groupIndex;
    }

    public int round() { return round; }

    public int groupIndex() { return groupIndex; }
}
