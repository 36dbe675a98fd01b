package io.mapreducer.reduce;

/** A combine call failed; identifies the round (1-based) and the group within it (0-based). */
public class ReductionException extends Exception {
    private final int round;
    private final int groupIndex;

    public ReductionException(int round, int groupIndex, Throwable cause) {
        super("Reduction failed in round " + round + ", group " + groupIndex, cause);
        this.round = round;
        this.groupIndex = groupIndex;
    }

    public int round() { return round; }

    public int groupIndex() { return groupIndex; }
}
