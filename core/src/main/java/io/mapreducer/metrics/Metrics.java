package io.mapreducer.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String QUEUE_JOBS_STARTED = "mapreducer.queue.jobs.started";
    public static final String QUEUE_INTERVAL_STALLS = "mapreducer.queue.interval.stalls";
    public static final String RETRY_ATTEMPTS = "mapreducer.retry.attempts";
    public static final String BUDGET_TOKENS_USED = "mapreducer.budget.tokens.used";
    public static final String BUDGET_WAITS = "mapreducer.budget.waits";
    public static final String MAP_SEGMENTS_SUCCEEDED = "mapreducer.map.segments.succeeded";
    public static final String MAP_SEGMENTS_SKIPPED = "mapreducer.map.segments.skipped";
    public static final String REDUCE_COMBINES = "mapreducer.reduce.combines";
    public static final String MODEL_INVOKE_TIME = "mapreducer.model.invoke.time";
    public static final String MAP_PHASE_TIME = "mapreducer.map.phase.time";
    public static final String REDUCE_PHASE_TIME = "mapreducer.reduce.phase.time";
    public static final String RUN_FAILURES = "mapreducer.run.failures";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry == null ? new MetricRegistry() : registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }
}
