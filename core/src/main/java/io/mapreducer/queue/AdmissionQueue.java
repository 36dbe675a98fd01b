package io.mapreducer.queue;

import com.codahale.metrics.Counter;
import io.mapreducer.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * FIFO job queue enforcing two caps at once: at most {@code concurrencyLimit} jobs running, and at
 * most {@code intervalCap} jobs started per {@code intervalMillis} window. A job waits while either
 * cap is saturated; submission itself never blocks or rejects for capacity reasons.
 *
 * <p>The interval window resets lazily like the token budget: the first start observed after the
 * window expired opens a new one. When the interval cap stalls the queue, a scheduler wakes it at
 * the rollover instead of polling.
 */
public class AdmissionQueue implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdmissionQueue.class);
    private static final AtomicInteger QUEUE_SEQUENCE = new AtomicInteger();

    private final int concurrencyLimit;
    private final int intervalCap;
    private final long intervalNanos;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Deque<Job<?>> pending = new ArrayDeque<>();
    private final Counter startedCounter;
    private final Counter stallCounter;

    private int running;
    private long intervalStartNanos;
    private int startedInInterval;
    private boolean drainScheduled;
    private boolean closed;

    public AdmissionQueue(int concurrencyLimit, int intervalCap, long intervalMillis) {
        this(concurrencyLimit, intervalCap, intervalMillis, null);
    }

    public AdmissionQueue(int concurrencyLimit, int intervalCap, long intervalMillis, Metrics metrics) {
        if (concurrencyLimit <= 0) throw new IllegalArgumentException("concurrencyLimit must be > 0");
        if (intervalCap <= 0) throw new IllegalArgumentException("intervalCap must be > 0");
        if (intervalMillis <= 0) throw new IllegalArgumentException("intervalMillis must be > 0");
        this.concurrencyLimit = concurrencyLimit;
        this.intervalCap = intervalCap;
        this.intervalNanos = TimeUnit.MILLISECONDS.toNanos(intervalMillis);
        int id = QUEUE_SEQUENCE.incrementAndGet();
        this.workers = Executors.newFixedThreadPool(concurrencyLimit, daemonFactory("admission-queue-" + id + "-worker"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonFactory("admission-queue-" + id + "-timer"));
        this.startedCounter = metrics == null ? null : metrics.counter(Metrics.QUEUE_JOBS_STARTED);
        this.stallCounter = metrics == null ? null : metrics.counter(Metrics.QUEUE_INTERVAL_STALLS);
        this.intervalStartNanos = System.nanoTime();
    }

    /**
     * Enqueue a job. The returned future completes with the job's result, or exceptionally with the
     * job's own failure; it is cancelled if the queue is closed before the job starts.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        Job<T> job = new Job<>(Objects.requireNonNull(task, "task"));
        synchronized (this) {
            if (closed) {
                job.future.completeExceptionally(new CancellationException("admission queue is closed"));
                return job.future;
            }
            pending.addLast(job);
            drain();
        }
        return job.future;
    }

    // caller holds the monitor
    private void drain() {
        while (!closed && !pending.isEmpty() && running < concurrencyLimit) {
            long now = System.nanoTime();
            if (now - intervalStartNanos >= intervalNanos) {
                intervalStartNanos = now;
                startedInInterval = 0;
            }
            if (startedInInterval >= intervalCap) {
                scheduleDrain(intervalStartNanos + intervalNanos - now);
                return;
            }
            Job<?> job = pending.pollFirst();
            running++;
            startedInInterval++;
            if (startedCounter != null) startedCounter.inc();
            try {
                workers.execute(() -> run(job));
            } catch (RejectedExecutionException e) {
                running--;
                job.future.completeExceptionally(e);
            }
        }
    }

    private void scheduleDrain(long delayNanos) {
        if (drainScheduled) return;
        drainScheduled = true;
        if (stallCounter != null) stallCounter.inc();
        log.debug("Interval cap {} reached, {} jobs waiting, resuming in {} ms",
                intervalCap, pending.size(), TimeUnit.NANOSECONDS.toMillis(delayNanos));
        try {
            scheduler.schedule(() -> {
                synchronized (this) {
                    drainScheduled = false;
                    drain();
                }
            }, Math.max(1, delayNanos), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            drainScheduled = false;
        }
    }

    private <T> void run(Job<T> job) {
        try {
            job.future.complete(job.task.call());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            job.future.completeExceptionally(ie);
        } catch (Throwable t) {
            job.future.completeExceptionally(t);
        } finally {
            synchronized (this) {
                running--;
                drain();
            }
        }
    }

    public synchronized int running() { return running; }
    public synchronized int pending() { return pending.size(); }
    public synchronized boolean isClosed() { return closed; }

    /**
     * Cancel every job that has not started and interrupt the running ones. In-flight remote calls
     * are abandoned, not awaited.
     */
    @Override
    public void close() {
        List<Job<?>> dropped;
        synchronized (this) {
            if (closed) return;
            closed = true;
            dropped = new ArrayList<>(pending);
            pending.clear();
        }
        for (Job<?> job : dropped) {
            job.future.completeExceptionally(new CancellationException("admission queue closed before job started"));
        }
        if (!dropped.isEmpty()) log.debug("Admission queue closed with {} jobs not started", dropped.size());
        workers.shutdownNow();
        scheduler.shutdownNow();
    }

    private static ThreadFactory daemonFactory(String name) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Job<T> {
        final Callable<T> task;
        final CompletableFuture<T> future = new CompletableFuture<>();

        Job(Callable<T> task) { this.task = task; }
    }
}
