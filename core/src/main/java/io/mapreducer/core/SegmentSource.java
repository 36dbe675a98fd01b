package io.mapreducer.core;

import java.util.List;

/**
 * Produces the ordered segments a run maps over. Implementations decide the chunking strategy;
 * the orchestrator only relies on the returned order.
 */
public interface SegmentSource {
    List<Segment> split(String text);
}
