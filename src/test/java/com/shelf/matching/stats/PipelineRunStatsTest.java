package com.shelf.matching.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineRunStats Tests")
class PipelineRunStatsTest {

    @Test
    @DisplayName("Each record moves exactly one bucket")
    void recordMovesOneBucket() {
        PipelineRunStats stats = new PipelineRunStats(3);

        stats.record(RunOutcome.SUCCESS);
        stats.record(RunOutcome.NO_MATCH);
        RunStatsSnapshot snapshot = stats.record(RunOutcome.ERROR);

        assertEquals(new RunStatsSnapshot(3, 3, 1, 1, 1), snapshot);
        assertEquals(0, snapshot.remaining());
        assertEquals(snapshot, stats.snapshot());
    }

    @Test
    @DisplayName("Concurrent updates stay consistent")
    void concurrentUpdates() throws Exception {
        PipelineRunStats stats = new PipelineRunStats(4_000);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4_000; i++) {
                RunOutcome outcome = RunOutcome.values()[i % 3];
                futures.add(pool.submit(() -> stats.record(outcome)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        RunStatsSnapshot snapshot = stats.snapshot();
        assertEquals(4_000, snapshot.processed());
        assertEquals(1_334, snapshot.success());
        assertEquals(1_333, snapshot.noMatch());
        assertEquals(1_333, snapshot.errors());
    }

    @Test
    @DisplayName("Inconsistent snapshots are rejected")
    void inconsistentSnapshot() {
        assertThrows(IllegalArgumentException.class, () -> new RunStatsSnapshot(5, 2, 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new RunStatsSnapshot(-1, 0, 0, 0, 0));
    }
}
