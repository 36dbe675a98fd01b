package io.mapreducer.budget;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TokenBudgetTrackerTest {
    @Test
    void admits_up_to_capacity_within_window() {
        MutableClock clock = new MutableClock(1_000);
        TokenBudgetTracker t = new TokenBudgetTracker(100, 60_000, clock);
        assertTrue(t.canUse(100), "a full window should admit exactly capacity");
        assertFalse(t.canUse(101));
        t.use(60);
        assertTrue(t.canUse(40));
        assertFalse(t.canUse(41), "60 used + 41 > 100");
        assertEquals(40, t.remaining());
    }

    @Test
    void window_resets_lazily_after_elapsed() {
        MutableClock clock = new MutableClock(0);
        TokenBudgetTracker t = new TokenBudgetTracker(100, 60_000, clock);
        t.use(90);
        clock.advance(59_999);
        assertFalse(t.canUse(20), "window still open");
        assertEquals(1, t.millisUntilReset());
        clock.advance(1);
        assertTrue(t.canUse(100), "window rolled over");
        assertEquals(0, t.used());
        assertEquals(60_000, t.millisUntilReset());
    }

    @Test
    void use_does_not_check_capacity() {
        TokenBudgetTracker t = new TokenBudgetTracker(100, 60_000, new MutableClock(0));
        t.use(80);
        t.use(80);
        assertEquals(160, t.used(), "overshoot is recorded as is");
        assertEquals(0, t.remaining());
        assertFalse(t.canUse(0), "nothing fits once over capacity");
    }

    @Test
    void rejects_invalid_construction() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBudgetTracker(0, 1000));
        assertThrows(IllegalArgumentException.class, () -> new TokenBudgetTracker(10, 0));
    }
}
