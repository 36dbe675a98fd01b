package io.mapreducer.budget;

import java.time.Clock;

/**
 * Fixed reset window: usage accumulates until {@code windowMillis} has elapsed since the window
 * started, then snaps back to zero on the next access. All reads and writes go through this
 * instance's monitor.
 */
public class TokenBudgetTracker implements TokenBudget {
    private final long capacityTokens;
    private final long windowMillis;
    private final Clock clock;

    private long usedTokens;
    private long windowStart;

    public TokenBudgetTracker(long capacityTokens, long windowMillis) {
        this(capacityTokens, windowMillis, null);
    }

    public TokenBudgetTracker(long capacityTokens, long windowMillis, Clock clock) {
        if (capacityTokens <= 0) throw new IllegalArgumentException("capacityTokens must be > 0");
        if (windowMillis <= 0) throw new IllegalArgumentException("windowMillis must be > 0");
        this.capacityTokens = capacityTokens;
        this.windowMillis = windowMillis;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.windowStart = this.clock.millis();
    }

    @Override
    public synchronized boolean canUse(long estimate) {
        resetIfNeeded();
        return usedTokens + estimate <= capacityTokens;
    }

    @Override
    public synchronized void use(long amount) {
        resetIfNeeded();
        usedTokens += amount;
    }

    @Override
    public synchronized long remaining() {
        resetIfNeeded();
        return Math.max(0, capacityTokens - usedTokens);
    }

    @Override
    public long capacity() { return capacityTokens; }

    @Override
    public synchronized long millisUntilReset() {
        resetIfNeeded();
        return Math.max(0, windowStart + windowMillis - clock.millis());
    }

    public synchronized long used() {
        resetIfNeeded();
        return usedTokens;
    }

    private void resetIfNeeded() {
        long now = clock.millis();
        if (now - windowStart >= windowMillis) {
            usedTokens = 0;
            windowStart = now;
        }
    }

    @Override
    public String toString() {
        return "TokenBudgetTracker{capacity=" + capacityTokens + ", windowMillis=" + windowMillis + '}';
    }
}
