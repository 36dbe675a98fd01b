package io.mapreducer.budget;

/**
 * TokenBudget governs token consumption against a per-window ceiling.
 */
public interface TokenBudget {
    /** True if {@code estimate} more tokens fit into the current window. */
    boolean canUse(long estimate);

    /** Record consumed tokens. Never rejects; may push the window over capacity. */
    void use(long amount);

    /** Tokens left in the current window, never negative. */
    long remaining();

    /** Total tokens a single window admits. */
    long capacity();

    /** Milliseconds until the current window rolls over. */
    long millisUntilReset();
}
