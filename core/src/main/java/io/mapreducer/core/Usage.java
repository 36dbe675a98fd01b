package io.mapreducer.core;

import java.util.OptionalLong;

/**
 * Token usage reported by the provider. Every field may be missing.
 */
public record Usage(Integer inputTokens, Integer outputTokens, Integer totalTokens) {
    public static final Usage NONE = new Usage(null, null, null);

    /**
     * Tokens to charge against the budget: input + output when both are known, else the total,
     * else empty (the caller falls back to its own estimate).
     */
    public OptionalLong billedTokens() {
        if (inputTokens != null && outputTokens != null) return OptionalLong.of((long) inputTokens + outputTokens);
        if (totalTokens != null) return OptionalLong.of(totalTokens);
        return OptionalLong.empty();
    }
}
