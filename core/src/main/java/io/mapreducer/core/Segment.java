package io.mapreducer.core;

import java.util.Objects;

/**
 * One ordered slice of the input text. The index is the segment's position in the source order
 * and is what partial results are re-ordered by once the map phase completes.
 */
public record Segment(int index, String text, int approximateTokenCount) {
    public Segment {
        Objects.requireNonNull(text, "text");
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (approximateTokenCount < 0) throw new IllegalArgumentException("approximateTokenCount must be >= 0");
    }

    public boolean isBlank() { return text.isBlank(); }
}
