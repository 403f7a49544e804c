package com.shelf.matching.scheduler;

import com.shelf.matching.core.MatchingException;
import com.shelf.matching.core.model.FailureKind;
import com.shelf.matching.progress.ProgressEvent;
import com.shelf.matching.progress.ProgressEventType;
import com.shelf.matching.stats.RunOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RollingWindowScheduler Tests")
@Timeout(30)
class RollingWindowSchedulerTest {

    record TestItem(String id, long sleepMs, RuntimeException failure) {
        static TestItem sleeping(String id, long sleepMs) {
            return new TestItem(id, sleepMs, null);
        }
    }

    record TestResult(String id, RunOutcome outcome, FailureKind failureKind) {
    }

    static class RetrievalBoom extends MatchingException {
        RetrievalBoom() {
            super(FailureKind.RETRIEVAL, "search unavailable");
        }
    }

    /**
     * Sleeps, optionally fails, and records start/end times and concurrency.
     */
    static class TestProcessor implements ItemProcessor<TestItem, TestResult> {
        final AtomicInteger current = new AtomicInteger();
        final AtomicInteger maxObserved = new AtomicInteger();
        final Map<String, Long> startNanos = new ConcurrentHashMap<>();
        final Map<String, Long> endNanos = new ConcurrentHashMap<>();
        final Map<String, ItemContext> contexts = new ConcurrentHashMap<>();
        final List<String> completed = new CopyOnWriteArrayList<>();

        @Override
        public String idOf(TestItem item) {
            return item.id();
        }

        @Override
        public TestResult process(TestItem item, ItemContext context) throws Exception {
            contexts.put(item.id(), context);
            startNanos.put(item.id(), System.nanoTime());
            maxObserved.accumulateAndGet(current.incrementAndGet(), Math::max);
            try {
                context.reportStage("working");
                Thread.sleep(item.sleepMs());
                if (item.failure() != null) {
                    throw item.failure();
                }
                return new TestResult(item.id(), RunOutcome.SUCCESS, null);
            } finally {
                current.decrementAndGet();
                endNanos.put(item.id(), System.nanoTime());
            }
        }

        @Override
        public TestResult failed(TestItem item, FailureKind kind, Throwable cause) {
            return new TestResult(item.id(), RunOutcome.ERROR, kind);
        }

        @Override
        public RunOutcome outcomeOf(TestResult result) {
            return result.outcome();
        }

        @Override
        public void onCompleted(TestItem item, TestResult result, Duration elapsed) {
            completed.add(item.id());
        }
    }

    private final TestProcessor processor = new TestProcessor();
    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private RollingWindowScheduler<TestItem, TestResult> scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    private RollingWindowScheduler<TestItem, TestResult> scheduler(SchedulerOptions options) {
        scheduler = new RollingWindowScheduler<>(processor, options);
        return scheduler;
    }

    private static List<TestItem> items(int count, long sleepMs) {
        return IntStream.range(0, count)
                .mapToObj(i -> TestItem.sleeping("item-" + i, sleepMs))
                .toList();
    }

    private static long millisBetween(long fromNanos, long toNanos) {
        return Duration.ofNanos(toNanos - fromNanos).toMillis();
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        @Test
        @DisplayName("Every item reaches exactly one result")
        void allItemsComplete() {
            BatchRunResult<TestResult> result = scheduler(SchedulerOptions.unthrottled(4))
                    .run(items(20, 5), events::add);

            assertEquals(20, result.size());
            assertEquals(20, result.stats().processed());
            assertEquals(20, result.stats().success());
            assertFalse(result.stopped());
            assertEquals(0, result.notAdmitted());
            assertEquals(20, result.results().stream().map(TestResult::id).distinct().count());
            assertEquals(20, processor.completed.size());
        }

        @Test
        @DisplayName("Empty work list completes immediately")
        void emptyList() {
            BatchRunResult<TestResult> result = scheduler(SchedulerOptions.defaults()).run(List.of(), events::add);

            assertEquals(0, result.size());
            assertEquals(List.of(ProgressEventType.START, ProgressEventType.COMPLETE),
                    events.stream().map(ProgressEvent::type).toList());
        }

        @Test
        @DisplayName("Results are listed in completion order")
        void completionOrder() {
            BatchRunResult<TestResult> result = scheduler(SchedulerOptions.unthrottled(2)).run(List.of(
                    TestItem.sleeping("slow", 400),
                    TestItem.sleeping("fast", 10)), events::add);

            assertEquals(List.of("fast", "slow"), result.results().stream().map(TestResult::id).toList());
        }

        @Test
        @DisplayName("Failed items become error results without affecting siblings")
        void failureIsolation() {
            List<TestItem> work = new ArrayList<>(items(5, 10));
            work.add(new TestItem("broken", 5, new IllegalStateException("boom")));
            work.add(new TestItem("no-search", 5, new RetrievalBoom()));

            BatchRunResult<TestResult> result = scheduler(SchedulerOptions.unthrottled(3)).run(work, events::add);

            assertEquals(7, result.size());
            assertEquals(5, result.stats().success());
            assertEquals(2, result.stats().errors());
            Map<String, FailureKind> kinds = new ConcurrentHashMap<>();
            result.results().stream()
                    .filter(r -> r.failureKind() != null)
                    .forEach(r -> kinds.put(r.id(), r.failureKind()));
            assertEquals(Map.of("broken", FailureKind.INTERNAL, "no-search", FailureKind.RETRIEVAL), kinds);
        }
    }

    @Nested
    @DisplayName("Concurrency and throttling")
    class ConcurrencyTests {

        @Test
        @DisplayName("In-flight executions never exceed maxConcurrency")
        void boundedConcurrency() {
            scheduler(SchedulerOptions.unthrottled(3)).run(items(15, 30), events::add);

            assertTrue(processor.maxObserved.get() <= 3, "max in flight " + processor.maxObserved.get());
            assertEquals(3, processor.maxObserved.get());
        }

        @Test
        @DisplayName("Ramp-up admits sub-batches separated by the admission delay")
        void throttledRampUp() {
            SchedulerOptions options = SchedulerOptions.builder()
                    .maxConcurrency(10)
                    .admissionBatchSize(2)
                    .admissionDelay(Duration.ofMillis(300))
                    .build();

            scheduler(options).run(items(6, 50), events::add);

            for (int i = 0; i + 2 < 6; i++) {
                long gap = millisBetween(processor.startNanos.get("item-" + i),
                        processor.startNanos.get("item-" + (i + 2)));
                assertTrue(gap >= 250, "item-" + i + " to item-" + (i + 2) + " started " + gap + "ms apart");
            }
        }

        @Test
        @DisplayName("A freed slot is refilled without waiting for the rest of its sub-batch")
        void rollingWindowRefillsFreedSlot() {
            List<TestItem> work = new ArrayList<>();
            work.add(TestItem.sleeping("long", 800));
            work.addAll(items(6, 40));

            BatchRunResult<TestResult> result = scheduler(SchedulerOptions.unthrottled(2)).run(work, events::add);

            assertEquals(7, result.size());
            long longEnd = processor.endNanos.get("long");
            for (int i = 0; i < 6; i++) {
                assertTrue(processor.startNanos.get("item-" + i) < longEnd,
                        "item-" + i + " waited for the long item");
            }
            assertEquals("long", result.results().get(6).id());
        }
    }

    @Nested
    @DisplayName("Timeouts and stop")
    class TimeoutAndStopTests {

        @Test
        @DisplayName("Item exceeding its timeout becomes a TIMEOUT error and its signal fires")
        void itemTimeout() {
            SchedulerOptions options = SchedulerOptions.unthrottled(2).toBuilder()
                    .itemTimeout(Duration.ofMillis(200))
                    .build();

            BatchRunResult<TestResult> result = scheduler(options).run(List.of(
                    TestItem.sleeping("stuck", 5_000),
                    TestItem.sleeping("quick", 10)), events::add);

            assertEquals(2, result.size());
            TestResult stuck = result.results().stream().filter(r -> r.id().equals("stuck")).findFirst().orElseThrow();
            assertEquals(FailureKind.TIMEOUT, stuck.failureKind());
            assertTrue(processor.contexts.get("stuck").signal().isCancelled());
            assertFalse(processor.contexts.get("quick").signal().isCancelled());
            assertTrue(result.elapsed().toMillis() < 5_000);
        }

        @Test
        @DisplayName("Committed execution is no longer subject to its timeout")
        void committedExecutionOutlivesTimeout() {
            TestProcessor committing = new TestProcessor() {
                @Override
                public TestResult process(TestItem item, ItemContext context) throws Exception {
                    if (item.id().startsWith("commit")) {
                        context.commit();
                    }
                    return super.process(item, context);
                }
            };
            SchedulerOptions options = SchedulerOptions.unthrottled(2).toBuilder()
                    .itemTimeout(Duration.ofMillis(200))
                    .build();
            scheduler = new RollingWindowScheduler<>(committing, options);

            BatchRunResult<TestResult> result = scheduler.run(List.of(
                    TestItem.sleeping("commit-slow", 600),
                    TestItem.sleeping("uncommitted-slow", 600)), events::add);

            TestResult kept = result.results().stream()
                    .filter(r -> r.id().equals("commit-slow")).findFirst().orElseThrow();
            TestResult timedOut = result.results().stream()
                    .filter(r -> r.id().equals("uncommitted-slow")).findFirst().orElseThrow();
            assertEquals(RunOutcome.SUCCESS, kept.outcome());
            assertEquals(FailureKind.TIMEOUT, timedOut.failureKind());
            assertFalse(committing.contexts.get("commit-slow").signal().isCancelled());
            assertTrue(committing.contexts.get("commit-slow").signal().isCommitted());
            assertEquals(1, result.stats().success());
            assertEquals(1, result.stats().errors());
        }

        @Test
        @DisplayName("Stop halts admissions and in-flight items still finish")
        void stopHaltsAdmissions() {
            BatchRun<TestResult>[] handle = new BatchRun[1];
            RollingWindowScheduler<TestItem, TestResult> s = scheduler(SchedulerOptions.unthrottled(2));
            List<TestItem> work = List.of(
                    TestItem.sleeping("a", 50), TestItem.sleeping("b", 300),
                    TestItem.sleeping("c", 50), TestItem.sleeping("d", 50),
                    TestItem.sleeping("e", 50), TestItem.sleeping("f", 50));

            synchronized (handle) {
                handle[0] = s.start(work, event -> {
                    events.add(event);
                    if ("done".equals(event.stage())) {
                        synchronized (handle) {
                            handle[0].stop();
                        }
                    }
                });
            }
            BatchRunResult<TestResult> result = handle[0].await();

            assertTrue(result.stopped());
            assertEquals(2, result.size());
            assertEquals(4, result.notAdmitted());
            assertEquals(2, result.stats().processed());
            assertEquals(ProgressEventType.COMPLETE, events.get(events.size() - 1).type());
            assertTrue(events.get(events.size() - 1).message().startsWith("Stopped"));
        }

        @Test
        @DisplayName("Stop after every item was admitted is not reported as stopped")
        void stopAfterAllAdmitted() {
            BatchRun<TestResult> run = scheduler(SchedulerOptions.unthrottled(5)).start(items(3, 100), events::add);
            run.stop();
            run.stop();

            BatchRunResult<TestResult> result = run.await();

            assertEquals(3, result.size() + result.notAdmitted());
            assertEquals(result.notAdmitted() > 0, result.stopped());
            assertTrue(run.isDone());
        }
    }

    @Nested
    @DisplayName("Progress stream")
    class ProgressTests {

        @Test
        @DisplayName("Stream starts with START, ends with COMPLETE and counts monotonically")
        void eventOrdering() {
            scheduler(SchedulerOptions.unthrottled(3)).run(items(8, 10), events::add);

            assertEquals(ProgressEventType.START, events.get(0).type());
            assertEquals(8, events.get(0).total());
            assertEquals(ProgressEventType.COMPLETE, events.get(events.size() - 1).type());
            assertEquals(8, events.get(events.size() - 1).processed());

            long previous = 0;
            for (ProgressEvent event : events) {
                assertTrue(event.processed() >= previous);
                assertEquals(event.processed(),
                        event.cumulativeSuccess() + event.cumulativeNoMatch() + event.cumulativeErrors());
                previous = event.processed();
            }
            assertEquals(8, events.stream().filter(e -> "done".equals(e.stage())).count());
            assertTrue(events.stream().anyMatch(e -> "working".equals(e.stage())));
        }

        @Test
        @DisplayName("Throwing listener does not affect the run")
        void throwingListener() {
            BatchRunResult<TestResult> result = scheduler(SchedulerOptions.unthrottled(2))
                    .run(items(4, 5), event -> {
                        throw new IllegalStateException("listener broken");
                    });

            assertEquals(4, result.size());
        }
    }

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("Stalled admission aborts the run with an ERROR event")
        void stalledAdmissionAborts() {
            scheduler = new RollingWindowScheduler<>(processor, SchedulerOptions.unthrottled(2)) {
                @Override
                int admissionCount(int inFlightCount, int pendingCount) {
                    return 0;
                }
            };

            assertThrows(SchedulerInvariantException.class, () -> scheduler.run(items(3, 5), events::add));
            assertEquals(ProgressEventType.ERROR, events.get(events.size() - 1).type());
        }

        @Test
        @DisplayName("Over-admission aborts the run")
        void overAdmissionAborts() {
            scheduler = new RollingWindowScheduler<>(processor, SchedulerOptions.unthrottled(2)) {
                @Override
                int admissionCount(int inFlightCount, int pendingCount) {
                    return pendingCount;
                }
            };

            BatchRun<TestResult> run = scheduler.start(items(4, 200), events::add);

            SchedulerInvariantException e = assertThrows(SchedulerInvariantException.class, run::await);
            assertTrue(e.getMessage().contains("exceed maxConcurrency"));
            assertEquals(FailureKind.SCHEDULER, e.getKind());
        }

        @Test
        @DisplayName("Admission count respects batch size, capacity and pending work")
        void admissionCount() {
            RollingWindowScheduler<TestItem, TestResult> s = scheduler(SchedulerOptions.builder()
                    .maxConcurrency(5).admissionBatchSize(3).build());

            assertEquals(3, s.admissionCount(0, 10));
            assertEquals(2, s.admissionCount(3, 10));
            assertEquals(1, s.admissionCount(0, 1));
            assertEquals(0, s.admissionCount(5, 10));
        }

        @Test
        @DisplayName("Failures are classified by kind")
        void classify() {
            assertEquals(FailureKind.TIMEOUT, RollingWindowScheduler.classify(new TimeoutException()));
            assertEquals(FailureKind.RETRIEVAL, RollingWindowScheduler.classify(new RetrievalBoom()));
            assertEquals(FailureKind.INTERNAL, RollingWindowScheduler.classify(new NullPointerException()));
        }
    }
}
