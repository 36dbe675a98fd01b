package io.mapreducer.error;

/** Every map-phase segment failed. Individual causes are attached as suppressed exceptions. */
public class NoSegmentsSucceededException extends SummarizationException {
    private final int totalSegments;

    public NoSegmentsSucceededException(int totalSegments) {
        super(ErrorKind.SEGMENT_FAILURE, Phase.MAP, null,
                "No segments succeeded: all " + totalSegments + " segments failed in MAP phase", null);
        this.totalSegments = totalSegments;
    }

    public int totalSegments() { return totalSegments; }
}
