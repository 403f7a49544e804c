package com.shelf.matching.scheduler;

import com.shelf.matching.core.model.FailureKind;
import com.shelf.matching.stats.RunOutcome;

import java.time.Duration;

/**
 * Per-item work executed by the {@link RollingWindowScheduler}.
 *
 * <p>{@link #process} runs on a worker thread; every other method is called
 * from the run's coordinator thread.</p>
 *
 * @param <T> work item type
 * @param <R> terminal result type
 */
public interface ItemProcessor<T, R> {

    /**
     * Identifier used in logs and progress events.
     */
    String idOf(T item);

    /**
     * Processes one item to its terminal result. Any exception is turned into a
     * result by {@link #failed}.
     */
    R process(T item, ItemContext context) throws Exception;

    /**
     * Builds the terminal result of an item whose execution failed or timed out.
     */
    R failed(T item, FailureKind kind, Throwable cause);

    /**
     * Statistics bucket of a terminal result.
     */
    RunOutcome outcomeOf(R result);

    /**
     * Short human-readable summary of a result for the progress stream.
     */
    default String describe(R result) {
        return outcomeOf(result).name();
    }

    /**
     * Called once per item after its result was counted.
     */
    default void onCompleted(T item, R result, Duration elapsed) {
    }
}
