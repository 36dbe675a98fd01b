package io.mapreducer.retry;

import com.codahale.metrics.Counter;
import io.mapreducer.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Runs a unit of work under a {@link RetryPolicy}. This is the only place where failures are
 * downgraded to delayed re-execution; fatal failures propagate unchanged and retryable ones are
 * wrapped in {@link RetriesExhaustedException} once the policy gives up.
 */
public class Retrier {
    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Counter retryCounter;

    public Retrier(RetryPolicy policy) {
        this(policy, Sleeper.SYSTEM, null);
    }

    public Retrier(RetryPolicy policy, Sleeper sleeper, Metrics metrics) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.retryCounter = metrics == null ? null : metrics.counter(Metrics.RETRY_ATTEMPTS);
    }

    public <T> T withRetry(Callable<T> fn) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return fn.call();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw ie;
            } catch (Exception e) {
                FailureClass failure = policy.classify(e);
                if (failure == FailureClass.FATAL) throw e;
                if (!policy.shouldRetry(attempt, e)) {
                    log.warn("Giving up after {} attempts: {}", attempt, e.getMessage());
                    throw new RetriesExhaustedException(attempt, e);
                }
                long delay = policy.backoffMillis(attempt, e);
                if (failure == FailureClass.RATE_LIMITED) {
                    log.warn("429 received, retry {}/{} in {} ms", attempt, policy.maxRetries() + 1, delay);
                } else {
                    log.warn("Server error, retry {}/{} in {} ms: {}", attempt, policy.maxRetries() + 1, delay, e.getMessage());
                }
                if (retryCounter != null) retryCounter.inc();
                sleeper.sleep(delay);
            }
        }
    }
}
