package io.mapreducer.runtime;

import io.mapreducer.error.SegmentFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buffers map outputs that complete out of order and returns them in input order, keyed by each
 * segment's position in the run.
 * Failed segments leave no placeholder.
 */
public final class PartialResults {
    private final TreeMap<Integer, String> succeeded = new TreeMap<>();
    private final TreeMap<Integer, SegmentFailureException> failed = new TreeMap<>();

    public synchronized void record(int position, String text) {
        if (failed.containsKey(position) || succeeded.putIfAbsent(position, text) != null) {
            throw new IllegalStateException("position " + position + " already settled");
        }
    }

    public synchronized void fail(int position, SegmentFailureException failure) {
        if (succeeded.containsKey(position) || failed.putIfAbsent(position, failure) != null) {
            throw new IllegalStateException("position " + position + " already settled");
        }
    }

    /** Successful outputs ordered by position. */
    public synchronized List<String> ordered() {
        return new ArrayList<>(succeeded.values());
    }

    public synchronized List<SegmentFailureException> failures() {
        return new ArrayList<>(failed.values());
    }

    public synchronized int succeededCount() { return succeeded.size(); }

    public synchronized int failedCount() { return failed.size(); }

    @Override
    public synchronized String toString() {
        StringBuilder sb = new StringBuilder("PartialResults{ok=[");
        for (Map.Entry<Integer, String> e : succeeded.entrySet()) {
            if (sb.charAt(sb.length() - 1) != '[') sb.append(',');
            sb.append(e.getKey());
        }
        return sb.append("], failed=").append(failed.keySet()).append('}').toString();
    }
}
