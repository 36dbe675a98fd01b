package io.mapreducer.reduce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Tree reduction: while more than {@code groupSize} items remain, split them into contiguous
 * left-to-right groups, combine every group concurrently and keep the outputs in group order.
 * Once the items fit into one group a final combine produces the result.
 *
 * <p>Rounds run in a loop rather than by recursion. With {@code groupSize == 1} intermediate
 * rounds collapse pairs, so the item count still shrinks every round.
 */
public final class HierarchicalReducer<T> {
    private static final Logger log = LoggerFactory.getLogger(HierarchicalReducer.class);

    private final int groupSize;

    public HierarchicalReducer(int groupSize) {
        if (groupSize < 1) throw new IllegalArgumentException("groupSize must be >= 1");
        this.groupSize = groupSize;
    }

    public T reduce(List<T> items, Combiner<T> combiner) throws ReductionException, InterruptedException {
        Objects.requireNonNull(combiner, "combiner");
        if (items == null || items.isEmpty()) throw new IllegalArgumentException("items must not be empty");

        List<T> level = new ArrayList<>(items);
        int fanIn = Math.max(2, groupSize);
        int round = 0;
        log.debug("Starting hierarchical reduce with {} items, groupSize: {}", level.size(), groupSize);

        while (level.size() > groupSize) {
            round++;
            List<List<T>> groups = partition(level, fanIn);
            log.debug("Round {}: {} items in {} groups, sizes {}", round, level.size(), groups.size(), sizes(groups));
            List<CompletableFuture<T>> pending = new ArrayList<>(groups.size());
            for (int g = 0; g < groups.size(); g++) {
                pending.add(start(round, g, combiner, groups.get(g), pending));
            }
            level = collect(round, pending);
            log.debug("Round {} completed, {} items remain", round, level.size());
        }

        round++;
        log.debug("Final reduction step (round {}): {} items fit in one group", round, level.size());
        List<CompletableFuture<T>> last = new ArrayList<>(1);
        last.add(start(round, 0, combiner, level, last));
        return collect(round, last).get(0);
    }

    /** Contiguous slices of at most {@code size} items; only the last one may be smaller. */
    public static <E> List<List<E>> partition(List<E> items, int size) {
        if (size < 1) throw new IllegalArgumentException("size must be >= 1");
        List<List<E>> groups = new ArrayList<>((items.size() + size - 1) / size);
        for (int i = 0; i < items.size(); i += size) {
            groups.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return groups;
    }

    private CompletableFuture<T> start(int round, int groupIndex, Combiner<T> combiner, List<T> group,
                                       List<CompletableFuture<T>> started) throws ReductionException, InterruptedException {
        try {
            CompletionStage<T> stage = combiner.combine(List.copyOf(group));
            return Objects.requireNonNull(stage, "combiner returned null").toCompletableFuture();
        } catch (InterruptedException ie) {
            cancelAll(started);
            throw ie;
        } catch (Exception e) {
            cancelAll(started);
            throw new ReductionException(round, groupIndex, e);
        }
    }

    private List<T> collect(int round, List<CompletableFuture<T>> pending) throws ReductionException, InterruptedException {
        List<T> out = new ArrayList<>(pending.size());
        for (int g = 0; g < pending.size(); g++) {
            try {
                out.add(pending.get(g).get());
            } catch (ExecutionException e) {
                cancelAll(pending);
                throw new ReductionException(round, g, e.getCause() != null ? e.getCause() : e);
            } catch (InterruptedException ie) {
                cancelAll(pending);
                throw ie;
            } catch (CancellationException ce) {
                cancelAll(pending);
                throw new ReductionException(round, g, ce);
            }
        }
        return out;
    }

    private static <E> void cancelAll(List<CompletableFuture<E>> futures) {
        for (CompletableFuture<E> f : futures) f.cancel(true);
    }

    private static <E> List<Integer> sizes(List<List<E>> groups) {
        List<Integer> sizes = new ArrayList<>(groups.size());
        for (List<E> g : groups) sizes.add(g.size());
        return sizes;
    }
}
