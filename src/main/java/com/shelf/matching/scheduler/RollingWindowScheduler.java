package com.shelf.matching.scheduler;

import com.shelf.matching.core.MatchingException;
import com.shelf.matching.core.model.FailureKind;
import com.shelf.matching.logging.LogContext;
import com.shelf.matching.metrics.MetricsService;
import com.shelf.matching.metrics.NoOpMetricsService;
import com.shelf.matching.progress.ProgressEvent;
import com.shelf.matching.progress.ProgressListener;
import com.shelf.matching.stats.PipelineRunStats;
import com.shelf.matching.stats.RunOutcome;
import com.shelf.matching.stats.RunStatsSnapshot;
import com.shelf.matching.tracing.NoOpTracingService;
import com.shelf.matching.tracing.Span;
import com.shelf.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an {@link ItemProcessor} over a work list with a rolling window of
 * bounded concurrency and throttled ramp-up.
 *
 * <p>Each run has one coordinator thread that owns the in-flight set. Per cycle it</p>
 * <ol>
 *   <li>admits up to {@code min(B, C - inFlight, remaining)} executions onto the worker pool;</li>
 *   <li>if a full sub-batch of B was admitted and work remains, pauses D before the next
 *       admission check;</li>
 *   <li>otherwise waits for the next signal from any execution (stage change or completion),
 *       counts a completion, emits its progress event and loops, so a freed slot is refilled
 *       at once.</li>
 * </ol>
 * <p>Workers never touch shared state: they post signals to a fan-in queue drained by the
 * coordinator, so progress events are emitted one at a time and in completion order.</p>
 *
 * <p>Each execution is bounded by {@code itemTimeout}. On expiry its cancellation signal
 * fires and the item resolves through {@link ItemProcessor#failed} with
 * {@link FailureKind#TIMEOUT}; the worker is interrupted. An execution that already
 * {@link ItemContext#commit() committed} is past the timeout and its own result stands.
 * Failures of one item never affect another. Only a {@link SchedulerInvariantException}
 * aborts a run.</p>
 *
 * @param <T> work item type
 * @param <R> terminal result type
 */
public class RollingWindowScheduler<T, R> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RollingWindowScheduler.class);

    private final ItemProcessor<T, R> processor;
    private final SchedulerOptions options;
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final AtomicInteger coordinatorCount = new AtomicInteger();

    public RollingWindowScheduler(ItemProcessor<T, R> processor, SchedulerOptions options) {
        this(processor, options, new NoOpMetricsService(), new NoOpTracingService());
    }

    public RollingWindowScheduler(ItemProcessor<T, R> processor, SchedulerOptions options,
                                  MetricsService metricsService, TracingService tracingService) {
        this(processor, options, null, metricsService, tracingService);
    }

    /**
     * @param workers executor running item executions; null creates a cached pool owned
     *                (and shut down) by this scheduler
     */
    public RollingWindowScheduler(ItemProcessor<T, R> processor, SchedulerOptions options,
                                  ExecutorService workers, MetricsService metricsService,
                                  TracingService tracingService) {
        this.processor = Objects.requireNonNull(processor, "processor is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.ownsWorkers = workers == null;
        this.workers = workers != null ? workers : Executors.newCachedThreadPool(namedThreads("shelf-match-worker"));
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Runs the items and blocks until every admitted item has a result.
     */
    public BatchRunResult<R> run(List<T> items, ProgressListener listener) {
        return start(items, listener).await();
    }

    /**
     * Starts a run on its own coordinator thread and returns immediately.
     */
    public BatchRun<R> start(List<T> items, ProgressListener listener) {
        Objects.requireNonNull(items, "items is required");
        String runId = LogContext.generateRunId();
        BatchRun<R> run = new BatchRun<>(runId, new PipelineRunStats(items.size()));
        Coordinator coordinator = new Coordinator(run, List.copyOf(items),
                listener != null ? listener : ProgressListener.noOp());
        Thread thread = new Thread(coordinator,
                "shelf-match-coordinator-" + coordinatorCount.incrementAndGet());
        thread.setDaemon(true);
        thread.start();
        return run;
    }

    /**
     * Number of executions to admit this cycle.
     */
    int admissionCount(int inFlightCount, int pendingCount) {
        int capacity = options.getMaxConcurrency() - inFlightCount;
        return Math.max(0, Math.min(options.getAdmissionBatchSize(), Math.min(capacity, pendingCount)));
    }

    public SchedulerOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        if (!ownsWorkers) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Maps an execution failure to the kind it is reported under.
     */
    static FailureKind classify(Throwable failure) {
        if (failure instanceof TimeoutException || failure instanceof CancellationException) {
            return FailureKind.TIMEOUT;
        }
        if (failure instanceof MatchingException me) {
            return me.getKind();
        }
        return FailureKind.INTERNAL;
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private final class Execution {
        final T item;
        final String itemId;
        final CancellationSignal signal = new CancellationSignal();
        final long startedNanos = System.nanoTime();
        volatile Future<?> task;

        Execution(T item, String itemId) {
            this.item = item;
            this.itemId = itemId;
        }
    }

    private interface Signal {
    }

    private record StageChanged(Object execution, String stage) implements Signal {
    }

    private record Finished(Object execution, Object result, Throwable failure) implements Signal {
    }

    private final class Coordinator implements Runnable {
        private final BatchRun<R> run;
        private final List<T> items;
        private final ProgressListener listener;
        private final Deque<T> pending;
        private final Set<Execution> inFlight = ConcurrentHashMap.newKeySet();
        private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
        private final List<R> results = new ArrayList<>();
        private final long startedNanos = System.nanoTime();

        Coordinator(BatchRun<R> run, List<T> items, ProgressListener listener) {
            this.run = run;
            this.items = items;
            this.listener = listener;
            this.pending = new ArrayDeque<>(items);
        }

        @Override
        public void run() {
            try (LogContext ignored = LogContext.forRun(run.runId());
                 Span span = tracingService.startRunSpan(run.runId(), items.size())) {
                log.info("batch.started runId={} items={} {}", run.runId(), items.size(), options);
                emit(ProgressEvent.start(run.runId(), run.stats().snapshot()));
                try {
                    loop();
                    finish(span);
                } catch (SchedulerInvariantException e) {
                    abort(span, e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    abort(span, new CancellationException("Coordinator interrupted"));
                } catch (RuntimeException e) {
                    abort(span, e);
                }
            }
        }

        private void loop() throws InterruptedException {
            while ((!pending.isEmpty() && !run.isStopRequested()) || !inFlight.isEmpty()) {
                int admitted = 0;
                if (!run.isStopRequested()) {
                    admitted = admit();
                }

                if (admitted == options.getAdmissionBatchSize() && !pending.isEmpty()
                        && !run.isStopRequested() && !options.getAdmissionDelay().isZero()) {
                    log.debug("batch.throttle admitted={} inFlight={} pending={} delayMs={}",
                            admitted, inFlight.size(), pending.size(), options.getAdmissionDelay().toMillis());
                    run.stopLatch().await(options.getAdmissionDelay().toMillis(), TimeUnit.MILLISECONDS);
                    drainAvailable();
                    if (inFlight.size() < options.getMaxConcurrency()) {
                        continue;
                    }
                }

                if (inFlight.isEmpty()) {
                    if (run.isStopRequested()) {
                        continue;
                    }
                    throw new SchedulerInvariantException("Nothing in flight and nothing admitted with "
                            + pending.size() + " items pending");
                }
                handle(signals.take());
            }
        }

        private int admit() {
            int count = admissionCount(inFlight.size(), pending.size());
            for (int i = 0; i < count; i++) {
                launch(pending.poll());
            }
            if (inFlight.size() > options.getMaxConcurrency()) {
                throw new SchedulerInvariantException("In-flight executions " + inFlight.size()
                        + " exceed maxConcurrency " + options.getMaxConcurrency());
            }
            return count;
        }

        private void launch(T item) {
            Execution execution = new Execution(item, processor.idOf(item));
            inFlight.add(execution);
            metricsService.adjustInFlight(1);

            ItemContext context = new ItemContext(run.runId(), execution.itemId, execution.signal,
                    stage -> signals.add(new StageChanged(execution, stage)));
            CompletableFuture<R> result = new CompletableFuture<>();
            Future<?> task = workers.submit(() -> {
                try {
                    result.complete(processor.process(item, context));
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
            execution.task = task;
            long timeoutMs = options.getItemTimeout().toMillis();
            CompletableFuture.delayedExecutor(timeoutMs, TimeUnit.MILLISECONDS).execute(() -> {
                if (!result.isDone() && execution.signal.cancel()) {
                    task.cancel(true);
                    result.completeExceptionally(new TimeoutException(
                            "Item " + execution.itemId + " exceeded " + timeoutMs + "ms"));
                }
            });
            result.whenComplete((value, failure) -> signals.add(new Finished(execution, value, failure)));
        }

        private void drainAvailable() {
            Signal signal;
            while ((signal = signals.poll()) != null) {
                handle(signal);
            }
        }

        @SuppressWarnings("unchecked")
        private void handle(Signal signal) {
            if (signal instanceof StageChanged changed) {
                Execution execution = (Execution) changed.execution();
                if (inFlight.contains(execution)) {
                    emit(ProgressEvent.stage(run.runId(), run.stats().snapshot(), execution.itemId, changed.stage()));
                }
            } else if (signal instanceof Finished finished) {
                complete((Execution) finished.execution(), (R) finished.result(), finished.failure());
            }
        }

        private void complete(Execution execution, R value, Throwable failure) {
            if (!inFlight.remove(execution)) {
                throw new SchedulerInvariantException("Execution for item " + execution.itemId
                        + " completed twice or was never admitted");
            }
            metricsService.adjustInFlight(-1);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - execution.startedNanos);

            R result = value;
            if (failure != null || value == null) {
                Throwable cause = failure != null
                        ? unwrap(failure)
                        : new IllegalStateException("Processor returned no result");
                FailureKind kind = classify(cause);
                log.warn("item.failed itemId={} kind={} elapsedMs={}: {}",
                        execution.itemId, kind, elapsed.toMillis(), cause.toString());
                result = processor.failed(execution.item, kind, cause);
            }

            RunOutcome outcome = processor.outcomeOf(result);
            RunStatsSnapshot snapshot = run.stats().record(outcome);
            if (snapshot.processed() > snapshot.total()) {
                throw new SchedulerInvariantException("Processed " + snapshot.processed()
                        + " items out of " + snapshot.total());
            }
            results.add(result);
            processor.onCompleted(execution.item, result, elapsed);

            log.debug("item.completed itemId={} outcome={} elapsedMs={} processed={}/{}",
                    execution.itemId, outcome, elapsed.toMillis(), snapshot.processed(), snapshot.total());
            emit(ProgressEvent.itemCompleted(run.runId(), snapshot, execution.itemId,
                    outcome == RunOutcome.ERROR ? "error" : "done", processor.describe(result)));
        }

        private void finish(Span span) {
            RunStatsSnapshot stats = run.stats().snapshot();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedNanos);
            boolean stopped = run.isStopRequested() && !pending.isEmpty();
            emit(ProgressEvent.complete(run.runId(), stats, elapsed.toMillis(), stopped));
            log.info("batch.completed runId={} processed={} success={} noMatch={} errors={} stopped={} elapsedMs={}",
                    run.runId(), stats.processed(), stats.success(), stats.noMatch(), stats.errors(),
                    stopped, elapsed.toMillis());

            span.setAttribute("items.processed", stats.processed());
            span.setAttribute("items.errors", stats.errors());
            span.succeed();
            run.completion().complete(new BatchRunResult<>(run.runId(), results, stats, elapsed,
                    stopped, pending.size()));
        }

        private void abort(Span span, RuntimeException failure) {
            for (Execution execution : inFlight) {
                execution.signal.cancel();
                Future<?> task = execution.task;
                if (task != null) {
                    task.cancel(true);
                }
            }
            metricsService.adjustInFlight(-inFlight.size());
            RunStatsSnapshot stats = run.stats().snapshot();
            long elapsedMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
            log.error("batch.aborted runId={} processed={}/{} inFlight={}: {}",
                    run.runId(), stats.processed(), stats.total(), inFlight.size(), failure.getMessage(), failure);
            emit(ProgressEvent.error(run.runId(), stats, failure.getMessage(), elapsedMs));

            span.fail(failure);
            run.completion().completeExceptionally(failure);
        }

        private void emit(ProgressEvent event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("progress.listener.failed type={} itemId={}: {}",
                        event.type().wireName(), event.currentItemId(), e.getMessage(), e);
            }
        }
    }
}
