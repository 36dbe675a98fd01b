package io.mapreducer.reduce;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Combines one group of items into a single item. May block before returning its stage (for
 * instance while waiting for admission); the work itself completes through the stage.
 */
@FunctionalInterface
public interface Combiner<T> {
    CompletionStage<T> combine(List<T> group) throws Exception;
}
