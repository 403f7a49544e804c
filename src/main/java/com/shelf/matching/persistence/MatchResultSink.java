package com.shelf.matching.persistence;

import com.shelf.matching.pipeline.ItemMatchResult;

/**
 * Persistence collaborator receiving every finished, non-error item result.
 *
 * <p>Called from worker threads, concurrently for different items. A sink that
 * throws turns the item into an error; it never affects other items.</p>
 *
 * <p>The item commits to its result before {@code save} is called, so a slow sink
 * is not cut short by the item timeout and the result it receives is the one the
 * run reports.</p>
 */
@FunctionalInterface
public interface MatchResultSink {

    void save(ItemMatchResult result);

    static MatchResultSink discarding() {
        return result -> { };
    }
}
