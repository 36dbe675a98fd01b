package io.mapreducer.error;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Terminal failure of a summarization run. Carries enough context (kind, phase, segment) to tell
 * a misconfigured budget apart from a provider outage.
 */
public class SummarizationException extends Exception {
    private final ErrorKind kind;
    private final Phase phase;
    private final Integer segmentIndex;

    protected SummarizationException(ErrorKind kind, Phase phase, Integer segmentIndex, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.phase = phase;
        this.segmentIndex = segmentIndex;
    }

    public ErrorKind kind() { return kind; }

    public Optional<Phase> phase() { return Optional.ofNullable(phase); }

    public OptionalInt segmentIndex() {
        return segmentIndex == null ? OptionalInt.empty() : OptionalInt.of(segmentIndex);
    }
}
