package io.mapreducer.queue;

import com.codahale.metrics.MetricRegistry;
import io.mapreducer.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class AdmissionQueueTest {
    @Test
    void running_jobs_never_exceed_concurrency_limit() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        try (AdmissionQueue q = new AdmissionQueue(2, 1_000, 60_000)) {
            List<CompletableFuture<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                int n = i;
                futures.add(q.submit(() -> {
                    peak.accumulateAndGet(active.incrementAndGet(), Math::max);
                    Thread.sleep(30);
                    active.decrementAndGet();
                    return n;
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(i, futures.get(i).get(5, TimeUnit.SECONDS));
            }
        }
        assertTrue(peak.get() <= 2, "peak concurrency should be <= 2 but was " + peak.get());
        assertEquals(2, peak.get(), "both slots should have been used");
    }

    @Test
    void interval_cap_delays_starts_until_rollover() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        List<Long> starts = new CopyOnWriteArrayList<>();
        long t0 = System.nanoTime();
        try (AdmissionQueue q = new AdmissionQueue(5, 2, 300, new Metrics(registry))) {
            List<CompletableFuture<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(q.submit(() -> {
                    long at = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
                    starts.add(at);
                    return at;
                }));
            }
            long third = futures.get(2).get(5, TimeUnit.SECONDS);
            assertTrue(futures.get(0).get() < 200, "first job should start right away");
            assertTrue(futures.get(1).get() < 200, "second job should start right away");
            assertTrue(third >= 250, "third job should wait for the next interval but started at " + third + "ms");
        }
        assertEquals(3, starts.size());
        assertEquals(3, registry.counter(Metrics.QUEUE_JOBS_STARTED).getCount());
        assertTrue(registry.counter(Metrics.QUEUE_INTERVAL_STALLS).getCount() >= 1);
    }

    @Test
    void starts_jobs_in_submission_order() throws Exception {
        List<Integer> order = new CopyOnWriteArrayList<>();
        try (AdmissionQueue q = new AdmissionQueue(1, 100, 60_000)) {
            List<CompletableFuture<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                int n = i;
                futures.add(q.submit(() -> { order.add(n); return n; }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        }
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), order);
    }

    @Test
    void job_failure_completes_future_exceptionally() throws Exception {
        try (AdmissionQueue q = new AdmissionQueue(1, 10, 60_000)) {
            CompletableFuture<String> failed = q.submit(() -> { throw new IllegalStateException("boom"); });
            ExecutionException e = assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertEquals("next", q.submit(() -> "next").get(5, TimeUnit.SECONDS), "queue keeps working after a failure");
            assertEquals(0, q.running());
        }
    }

    @Test
    void close_cancels_jobs_not_started() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AdmissionQueue q = new AdmissionQueue(1, 10, 60_000);
        CompletableFuture<String> running = q.submit(() -> {
            entered.countDown();
            release.await();
            return "done";
        });
        CompletableFuture<String> waiting = q.submit(() -> "never");
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertEquals(1, q.pending());
        q.close();
        assertTrue(q.isClosed());
        ExecutionException e = assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, e.getCause());
        // running job is interrupted by close
        ExecutionException r = assertThrows(ExecutionException.class, () -> running.get(5, TimeUnit.SECONDS));
        assertInstanceOf(InterruptedException.class, r.getCause());
        assertTrue(q.submit(() -> "late").isCompletedExceptionally(), "submit after close fails fast");
    }

    @Test
    void rejects_invalid_limits() {
        assertThrows(IllegalArgumentException.class, () -> new AdmissionQueue(0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new AdmissionQueue(1, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new AdmissionQueue(1, 1, 0));
    }
}
