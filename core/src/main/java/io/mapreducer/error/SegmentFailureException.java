package io.mapreducer.error;

/** One map-phase segment could not be summarized. Recovered by skipping the segment. */
public class SegmentFailureException extends SummarizationException {
    public SegmentFailureException(int segmentIndex, Throwable cause) {
        super(ErrorKind.SEGMENT_FAILURE, Phase.MAP, segmentIndex,
                "Segment " + segmentIndex + " failed: " + describe(cause), cause);
    }

    static String describe(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
