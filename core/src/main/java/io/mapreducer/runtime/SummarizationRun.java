package io.mapreducer.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import io.mapreducer.budget.BudgetGate;
import io.mapreducer.budget.TokenBudgetTracker;
import io.mapreducer.config.SummarizeConfig;
import io.mapreducer.core.EmptyResponseException;
import io.mapreducer.core.InvocationOptions;
import io.mapreducer.core.LanguageModel;
import io.mapreducer.core.ModelResponse;
import io.mapreducer.core.PromptTemplate;
import io.mapreducer.core.Segment;
import io.mapreducer.core.TokenCounter;
import io.mapreducer.core.Usage;
import io.mapreducer.error.BudgetTimeoutException;
import io.mapreducer.error.ConfigurationException;
import io.mapreducer.error.ImpossibleEstimateException;
import io.mapreducer.error.NoSegmentsSucceededException;
import io.mapreducer.error.Phase;
import io.mapreducer.error.ReduceFailureException;
import io.mapreducer.error.RunCancelledException;
import io.mapreducer.error.SegmentFailureException;
import io.mapreducer.error.SummarizationException;
import io.mapreducer.metrics.Metrics;
import io.mapreducer.queue.AdmissionQueue;
import io.mapreducer.reduce.HierarchicalReducer;
import io.mapreducer.reduce.ReductionException;
import io.mapreducer.retry.ClassifiedBackoffRetryPolicy;
import io.mapreducer.retry.Retrier;
import io.mapreducer.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * One summarization run: {@code IDLE -> MAPPING -> REDUCING -> DONE}, or {@code FAILED}.
 *
 * <p>Every model call follows the same path: estimate (prompt tokens + output cap), reject an
 * estimate larger than the whole window, wait for the token budget, submit to the admission queue
 * wrapped in the retrier, then charge the budget with the reported usage or the estimate.
 *
 * <p>Map failures skip their segment; a budget timeout, an impossible estimate, a reduce failure or
 * cancellation end the run. A run executes once.
 */
public class SummarizationRun {
    private static final Logger log = LoggerFactory.getLogger(SummarizationRun.class);

    private final SummarizeConfig config;
    private final LanguageModel model;
    private final TokenCounter tokenCounter;
    private final PromptTemplate mapPrompt;
    private final PromptTemplate combinePrompt;
    private final List<Segment> segments;

    private final TokenBudgetTracker tracker;
    private final BudgetGate gate;
    private final Retrier retrier;

    private final Counter tokensUsed;
    private final Counter budgetWaits;
    private final Counter segmentsSucceeded;
    private final Counter segmentsSkipped;
    private final Counter combines;
    private final Counter runFailures;
    private final Timer invokeTimer;
    private final Timer mapTimer;
    private final Timer reduceTimer;
    private final Metrics metrics;

    private final Object lock = new Object();
    private volatile RunState state = RunState.IDLE;
    private Thread runner;
    private AdmissionQueue queue;
    private boolean cancelled;
    private String cancelReason;
    private volatile Phase currentPhase;

    SummarizationRun(SummarizeConfig config,
                     LanguageModel model,
                     TokenCounter tokenCounter,
                     PromptTemplate mapPrompt,
                     PromptTemplate combinePrompt,
                     Metrics metrics,
                     Sleeper retrySleeper,
                     List<Segment> segments) {
        this.config = config;
        this.model = model;
        this.tokenCounter = tokenCounter;
        this.mapPrompt = mapPrompt;
        this.combinePrompt = combinePrompt;
        this.segments = segments == null ? List.of() : List.copyOf(segments);
        this.metrics = metrics;
        this.tracker = new TokenBudgetTracker(config.tokensPerMinute(), config.tokenBudgetWindowMs());
        this.gate = new BudgetGate(tracker, config.budgetPollIntervalMs());
        this.retrier = new Retrier(new ClassifiedBackoffRetryPolicy(config.maxRetries()), retrySleeper, metrics);
        this.tokensUsed = metrics.counter(Metrics.BUDGET_TOKENS_USED);
        this.budgetWaits = metrics.counter(Metrics.BUDGET_WAITS);
        this.segmentsSucceeded = metrics.counter(Metrics.MAP_SEGMENTS_SUCCEEDED);
        this.segmentsSkipped = metrics.counter(Metrics.MAP_SEGMENTS_SKIPPED);
        this.combines = metrics.counter(Metrics.REDUCE_COMBINES);
        this.runFailures = metrics.counter(Metrics.RUN_FAILURES);
        this.invokeTimer = metrics.timer(Metrics.MODEL_INVOKE_TIME);
        this.mapTimer = metrics.timer(Metrics.MAP_PHASE_TIME);
        this.reduceTimer = metrics.timer(Metrics.REDUCE_PHASE_TIME);
    }

    public String execute() throws SummarizationException {
        synchronized (lock) {
            if (state != RunState.IDLE) throw new IllegalStateException("run already executed, state=" + state);
            if (cancelled) {
                state = RunState.FAILED;
                throw new RunCancelledException(null, cancelReason, null);
            }
            runner = Thread.currentThread();
        }
        ScheduledExecutorService timeoutTimer = null;
        try {
            if (segments.isEmpty()) throw new ConfigurationException("segments", "No documents provided for summarization");
            timeoutTimer = scheduleRunTimeout();
            try (AdmissionQueue q = new AdmissionQueue(config.queueConcurrency(), config.requestsPerMinute(),
                    config.queueIntervalMs(), metrics)) {
                synchronized (lock) {
                    if (cancelled) q.close();
                    queue = q;
                }
                List<String> partials = mapPhase(q);
                String result = reducePhase(q, partials);
                transition(RunState.DONE);
                log.info("MAP-REDUCE completed successfully");
                return result;
            }
        } catch (SummarizationException e) {
            fail(e);
            throw e;
        } catch (InterruptedException e) {
            RunCancelledException rce = cancellation(e);
            fail(rce);
            throw rce;
        } finally {
            if (timeoutTimer != null) timeoutTimer.shutdownNow();
            synchronized (lock) {
                runner = null;
                queue = null;
                // drop an interrupt that this run delivered to its own thread
                if (cancelled) Thread.interrupted();
            }
        }
    }

    /**
     * Abandon the run: jobs not yet started are cancelled, running jobs and the budget wait are
     * interrupted, and {@link #execute()} fails with {@link RunCancelledException}.
     */
    public void cancel() {
        cancel("Run cancelled");
    }

    public RunState state() { return state; }

    /** The run's own token tracker; exposed for inspection. */
    public TokenBudgetTracker tracker() { return tracker; }

    private void cancel(String reason) {
        synchronized (lock) {
            if (state.isTerminal() || cancelled) return;
            cancelled = true;
            cancelReason = reason;
            log.warn("{} during {}", reason, currentPhase == null ? "startup" : currentPhase + " phase");
            if (queue != null) queue.close();
            if (runner != null) runner.interrupt();
        }
    }

    private ScheduledExecutorService scheduleRunTimeout() {
        if (config.runTimeoutMs() <= 0) return null;
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "summarization-run-timeout");
            t.setDaemon(true);
            return t;
        });
        timer.schedule(() -> cancel("Run timed out after " + config.runTimeoutMs() + " ms"),
                config.runTimeoutMs(), TimeUnit.MILLISECONDS);
        return timer;
    }

    private List<String> mapPhase(AdmissionQueue q) throws SummarizationException, InterruptedException {
        currentPhase = Phase.MAP;
        transition(RunState.MAPPING);
        logInputAnalysis();

        List<MapJob> jobs = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            if (segment.isBlank()) {
                log.warn("Skipping segment {}: no text found", segment.index() + 1);
                continue;
            }
            String payload = mapPrompt.format(segment.text());
            int promptTokens = tokenCounter.count(payload, config.encoding());
            long estimate = (long) promptTokens + config.mapOutputMaxTokens();
            log.debug("MAP segment {}: input={} tokens, prompt={} tokens, estimated={} tokens",
                    segment.index() + 1, segment.approximateTokenCount(), promptTokens, estimate);
            if (estimate > tracker.capacity()) {
                throw new ImpossibleEstimateException(Phase.MAP, segment.index(), estimate, tracker.capacity());
            }
            jobs.add(new MapJob(jobs.size(), segment.index(), payload, estimate));
        }

        PartialResults partials = new PartialResults();
        List<CompletableFuture<Void>> settled = new ArrayList<>(jobs.size());
        try (Timer.Context ignored = mapTimer.time()) {
            for (MapJob job : jobs) {
                String label = "MAP segment " + (job.index + 1);
                awaitBudget(Phase.MAP, job.index, job.estimate, label);
                log.info("{} (est ~{} tokens)", label, job.estimate);
                CompletableFuture<String> call = q.submit(
                        () -> retrier.withRetry(() -> invoke(job.payload, config.mapOutputMaxTokens(), job.estimate, label)));
                settled.add(call.handle((text, err) -> {
                    settle(partials, job, text, err);
                    return null;
                }));
            }
            for (CompletableFuture<Void> f : settled) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Could not record map result", e.getCause());
                }
            }
        }
        if (cancelledNow()) throw new InterruptedException(cancelReason());

        if (partials.succeededCount() == 0) {
            NoSegmentsSucceededException none = new NoSegmentsSucceededException(segments.size());
            partials.failures().forEach(none::addSuppressed);
            throw none;
        }
        log.info("MAP phase completed: {}/{} segments processed", partials.succeededCount(), segments.size());
        return partials.ordered();
    }

    private void settle(PartialResults partials, MapJob job, String text, Throwable err) {
        if (err == null) {
            partials.record(job.position, text);
            segmentsSucceeded.inc();
            return;
        }
        Throwable cause = unwrap(err);
        SegmentFailureException failure = new SegmentFailureException(job.index, cause);
        partials.fail(job.position, failure);
        segmentsSkipped.inc();
        if (!cancelledNow()) {
            log.warn("Skipping segment {} due to error, continuing with remaining segments: {}", job.index + 1, failure.getMessage());
        }
    }

    private String reducePhase(AdmissionQueue q, List<String> partials) throws SummarizationException, InterruptedException {
        currentPhase = Phase.REDUCE;
        transition(RunState.REDUCING);
        log.info("Starting REDUCE phase with {} partial results, group size {}", partials.size(), config.hierarchyGroupSize());
        HierarchicalReducer<String> reducer = new HierarchicalReducer<>(config.hierarchyGroupSize());
        try (Timer.Context ignored = reduceTimer.time()) {
            return reducer.reduce(partials, group -> combine(q, group)).trim();
        } catch (ReductionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof SummarizationException se) throw se;
            if (cancelledNow() || cause instanceof InterruptedException) throw new InterruptedException(cancelReason());
            throw new ReduceFailureException(e.round(), e.groupIndex(), cause);
        }
    }

    private CompletionStage<String> combine(AdmissionQueue q, List<String> group) throws SummarizationException, InterruptedException {
        String joined = String.join(MapReduceOrchestrator.GROUP_SEPARATOR, group);
        if (joined.isBlank()) throw new IllegalStateException("Empty text provided for reduce operation");
        int inputTokens = tokenCounter.count(joined, config.encoding());
        String payload = combinePrompt.format(joined);
        int promptTokens = tokenCounter.count(payload, config.encoding());
        long estimate = (long) promptTokens + config.reduceOutputMaxTokens();
        log.debug("REDUCE: items={}, input={} tokens, prompt={} tokens, estimated={} tokens",
                group.size(), inputTokens, promptTokens, estimate);
        if (estimate > tracker.capacity()) {
            throw new ImpossibleEstimateException(Phase.REDUCE, null, estimate, tracker.capacity());
        }
        awaitBudget(Phase.REDUCE, null, estimate, "REDUCE");
        combines.inc();
        log.info("REDUCE (est ~{} tokens)", estimate);
        return q.submit(() -> retrier.withRetry(() -> invoke(payload, config.reduceOutputMaxTokens(), estimate, "REDUCE")));
    }

    private void awaitBudget(Phase phase, Integer segmentIndex, long estimate, String label)
            throws BudgetTimeoutException, InterruptedException {
        long waited = gate.await(estimate, config.tokenBudgetTimeoutMs(), label);
        if (waited < 0) {
            throw new BudgetTimeoutException(phase, segmentIndex, estimate, tracker.remaining(), config.tokenBudgetTimeoutMs());
        }
        if (waited > 0) budgetWaits.inc();
    }

    private String invoke(String payload, int maxOutputTokens, long estimate, String label) throws Exception {
        ModelResponse res;
        try (Timer.Context ignored = invokeTimer.time()) {
            res = model.invoke(payload, new InvocationOptions(maxOutputTokens, config.temperature()));
        }
        if (res == null || res.isEmpty()) throw new EmptyResponseException("Empty response from model for " + label);

        long reported = res.usageIfReported().map(Usage::billedTokens).orElse(OptionalLong.empty()).orElse(0L);
        long actual = reported > 0 ? reported : estimate;
        tracker.use(actual);
        tokensUsed.inc(actual);
        log.debug("[{}] Used {} tokens - completed successfully", label, actual);
        return res.content().trim();
    }

    private void logInputAnalysis() {
        long total = 0;
        int max = 0;
        for (Segment s : segments) {
            total += s.approximateTokenCount();
            max = Math.max(max, s.approximateTokenCount());
        }
        log.info("Starting MAP-REDUCE with {} segments", segments.size());
        log.debug("Input token analysis: total={}, avg={}, max={}", total, Math.round((double) total / segments.size()), max);
    }

    private void transition(RunState next) {
        synchronized (lock) {
            state = next;
        }
    }

    private void fail(SummarizationException e) {
        transition(RunState.FAILED);
        runFailures.inc();
        log.error("{} phase failed: {}", e.phase().map(Enum::name).orElse("Run"), e.getMessage());
    }

    private RunCancelledException cancellation(InterruptedException e) {
        synchronized (lock) {
            if (!cancelled) Thread.currentThread().interrupt();
            String reason = cancelled ? cancelReason : "Run interrupted";
            return new RunCancelledException(currentPhase, reason, e);
        }
    }

    private boolean cancelledNow() {
        synchronized (lock) {
            return cancelled;
        }
    }

    private String cancelReason() {
        synchronized (lock) {
            return cancelReason == null ? "Run interrupted" : cancelReason;
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    /** {@code position} orders the partial results; {@code index} is the caller's segment number. */
    private record MapJob(int position, int index, String payload, long estimate) {}
}
