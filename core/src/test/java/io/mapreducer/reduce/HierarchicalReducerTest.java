package io.mapreducer.reduce;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;

public class HierarchicalReducerTest {
    private final List<Integer> groupSizes = new CopyOnWriteArrayList<>();

    private Combiner<String> concat() {
        return group -> {
            groupSizes.add(group.size());
            return CompletableFuture.completedFuture("(" + String.join(",", group) + ")");
        };
    }

    private static List<String> items(int n) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(String.valueOf((char) ('a' + i)));
        return out;
    }

    @Test
    void fits_in_one_group_means_single_combine() throws Exception {
        assertEquals("(a,b,c)", new HierarchicalReducer<String>(4).reduce(items(3), concat()));
        assertEquals(List.of(3), groupSizes);
    }

    @Test
    void single_item_is_still_combined() throws Exception {
        assertEquals("(a)", new HierarchicalReducer<String>(2).reduce(items(1), concat()));
        assertEquals(1, groupSizes.size());
    }

    @Test
    void five_items_with_pairs_take_three_rounds() throws Exception {
        String out = new HierarchicalReducer<String>(2).reduce(items(5), concat());
        assertEquals("(((a,b),(c,d)),((e)))", out);
        // round 1: 3 groups, round 2: 2 groups, final: 1
        assertEquals(List.of(2, 2, 1, 2, 1, 2), groupSizes);
    }

    @Test
    void first_round_has_ceil_n_over_g_groups() throws Exception {
        List<Integer> firstRound = new ArrayList<>();
        int[] calls = {0};
        Combiner<String> c = group -> {
            if (calls[0]++ < 4) firstRound.add(group.size());
            return CompletableFuture.completedFuture("x");
        };
        new HierarchicalReducer<String>(3).reduce(items(10), c);
        assertEquals(List.of(3, 3, 3, 1), firstRound);
        // 10 -> 4 -> 2 -> final
        assertEquals(4 + 2 + 1, calls[0]);
    }

    @Test
    void group_size_one_terminates() throws Exception {
        String out = new HierarchicalReducer<String>(1).reduce(items(4), concat());
        assertEquals("(((a,b),(c,d)))", out);
        assertEquals(List.of(2, 2, 2, 1), groupSizes);
    }

    @Test
    void keeps_order_when_groups_complete_out_of_order() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Combiner<String> slow = group -> CompletableFuture.supplyAsync(() -> {
                try {
                    Thread.sleep(ThreadLocalRandom.current().nextInt(1, 40));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return String.join("", group);
            }, pool);
            assertEquals("abcdefghij", new HierarchicalReducer<String>(2).reduce(items(10), slow));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failing_combine_reports_round_and_group() {
        Combiner<String> c = group -> {
            if (group.contains("c")) return CompletableFuture.failedFuture(new IllegalStateException("boom"));
            return CompletableFuture.completedFuture("ok");
        };
        ReductionException e = assertThrows(ReductionException.class,
                () -> new HierarchicalReducer<String>(2).reduce(items(4), c));
        assertEquals(1, e.round());
        assertEquals(1, e.groupIndex());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void combiner_throwing_synchronously_is_wrapped() {
        Combiner<String> c = group -> { throw new IllegalArgumentException("bad group"); };
        ReductionException e = assertThrows(ReductionException.class,
                () -> new HierarchicalReducer<String>(2).reduce(items(3), c));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void same_input_reduces_to_same_result() throws Exception {
        HierarchicalReducer<String> reducer = new HierarchicalReducer<>(3);
        assertEquals(reducer.reduce(items(11), concat()), reducer.reduce(items(11), concat()));
    }

    @Test
    void partition_keeps_contiguous_slices() {
        assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), HierarchicalReducer.partition(List.of(1, 2, 3, 4, 5), 2));
        assertTrue(HierarchicalReducer.partition(List.<Integer>of(), 2).isEmpty());
    }

    @Test
    void rejects_empty_input_and_bad_group_size() {
        assertThrows(IllegalArgumentException.class, () -> new HierarchicalReducer<String>(0));
        assertThrows(IllegalArgumentException.class, () -> new HierarchicalReducer<String>(2).reduce(List.of(), concat()));
    }
}
