package io.mapreducer.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Blocks a caller until a token estimate fits into the budget or a timeout elapses.
 * Sleeps until the earlier of the next poll and the window rollover, so a freed window is
 * picked up without waiting a full poll interval. Interruptible.
 */
public class BudgetGate {
    private static final Logger log = LoggerFactory.getLogger(BudgetGate.class);

    private final TokenBudget budget;
    private final long pollMillis;

    public BudgetGate(TokenBudget budget, long pollMillis) {
        this.budget = Objects.requireNonNull(budget, "budget");
        this.pollMillis = Math.max(1, pollMillis);
    }

    /**
     * @return the number of milliseconds waited, or -1 if the timeout elapsed first
     */
    public long await(long estimate, long timeoutMillis, String label) throws InterruptedException {
        long start = System.nanoTime();
        while (!budget.canUse(estimate)) {
            long waited = elapsedMillis(start);
            if (waited > timeoutMillis) {
                log.error("[{}] Token budget timeout after {} ms: need {}, have {}", label, waited, estimate, budget.remaining());
                return -1;
            }
            log.info("[{}] Waiting for token budget... (need {}, have {})", label, estimate, budget.remaining());
            long sleep = Math.min(pollMillis, Math.max(1, budget.millisUntilReset()));
            sleep = Math.min(sleep, Math.max(1, timeoutMillis - waited + 1));
            TimeUnit.MILLISECONDS.sleep(sleep);
        }
        return elapsedMillis(start);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
