package com.shelf.matching.api;

import com.shelf.matching.classification.ClassificationProvider;
import com.shelf.matching.core.model.DetectionItem;
import com.shelf.matching.metrics.MetricsService;
import com.shelf.matching.metrics.NoOpMetricsService;
import com.shelf.matching.persistence.MatchResultSink;
import com.shelf.matching.pipeline.ItemMatchResult;
import com.shelf.matching.pipeline.MatchingPipeline;
import com.shelf.matching.progress.ProgressListener;
import com.shelf.matching.retrieval.CachingRetrievalProvider;
import com.shelf.matching.retrieval.RetrievalCacheConfig;
import com.shelf.matching.retrieval.RetrievalCacheStats;
import com.shelf.matching.retrieval.RetrievalProvider;
import com.shelf.matching.scheduler.BatchRun;
import com.shelf.matching.scheduler.BatchRunResult;
import com.shelf.matching.scheduler.RollingWindowScheduler;
import com.shelf.matching.scheduler.SchedulerOptions;
import com.shelf.matching.tracing.NoOpTracingService;
import com.shelf.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Main entry point of the shelf matching library.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ShelfMatcher matcher = ShelfMatcher.builder()
 *     .retrievalProvider(catalogSearch)
 *     .classificationProvider(visualClassifier)
 *     .resultSink(resultStore)
 *     .schedulerOptions(SchedulerOptions.builder().maxConcurrency(100).build())
 *     .build();
 *
 * // Single item
 * ItemMatchResult result = matcher.matchItem(item);
 *
 * // Batch with an SSE progress stream
 * BatchRunResult&lt;ItemMatchResult&gt; run = matcher.runBatch(items, new SseProgressWriter(writer));
 * </pre>
 */
public class ShelfMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ShelfMatcher.class);

    private final MatchingPipeline pipeline;
    private final RollingWindowScheduler<DetectionItem, ItemMatchResult> scheduler;
    private final CachingRetrievalProvider retrievalCache;
    private final MatchingOptions options;

    private ShelfMatcher(Builder builder) {
        this.options = builder.options;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        RetrievalProvider retrieval = builder.retrievalProvider;
        if (builder.cacheConfig.enabled()) {
            this.retrievalCache = new CachingRetrievalProvider(retrieval, builder.cacheConfig);
            retrieval = retrievalCache;
        } else {
            this.retrievalCache = null;
        }

        this.pipeline = new MatchingPipeline(retrieval, builder.classificationProvider, builder.resultSink,
                builder.options, metricsService, tracingService);
        this.scheduler = new RollingWindowScheduler<>(pipeline, builder.schedulerOptions,
                builder.workerExecutor, metricsService, tracingService);

        log.info("ShelfMatcher initialized: retrieval={} classification={} {} {}",
                retrieval.getProviderName(), builder.classificationProvider.getProviderName(),
                builder.options, builder.schedulerOptions);
    }

    // ========== Matching API ==========

    /**
     * Matches one item synchronously on the calling thread.
     * Per-item failures come back as an {@code error} result.
     */
    public ItemMatchResult matchItem(DetectionItem item) {
        return pipeline.match(item);
    }

    /**
     * Matches a batch and blocks until every admitted item has a result.
     *
     * @throws com.shelf.matching.scheduler.SchedulerInvariantException if the run aborted
     */
    public BatchRunResult<ItemMatchResult> runBatch(List<DetectionItem> items, ProgressListener listener) {
        return scheduler.run(items, listener);
    }

    public BatchRunResult<ItemMatchResult> runBatch(List<DetectionItem> items) {
        return runBatch(items, ProgressListener.noOp());
    }

    /**
     * Starts a batch in the background. The returned handle can stop admissions and await the result.
     */
    public BatchRun<ItemMatchResult> startBatch(List<DetectionItem> items, ProgressListener listener) {
        return scheduler.start(items, listener);
    }

    // ========== Accessors ==========

    public MatchingOptions getOptions() {
        return options;
    }

    public SchedulerOptions getSchedulerOptions() {
        return scheduler.getOptions();
    }

    /**
     * Statistics of the retrieval cache, empty when caching is disabled.
     */
    public RetrievalCacheStats getRetrievalCacheStats() {
        return retrievalCache != null ? retrievalCache.getStats() : RetrievalCacheStats.EMPTY;
    }

    @Override
    public void close() {
        log.info("Closing ShelfMatcher");
        scheduler.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RetrievalProvider retrievalProvider;
        private ClassificationProvider classificationProvider;
        private MatchResultSink resultSink = MatchResultSink.discarding();
        private MatchingOptions options = MatchingOptions.defaults();
        private SchedulerOptions schedulerOptions = SchedulerOptions.defaults();
        private RetrievalCacheConfig cacheConfig = RetrievalCacheConfig.disabled();
        private ExecutorService workerExecutor;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder retrievalProvider(RetrievalProvider retrievalProvider) {
            this.retrievalProvider = retrievalProvider;
            return this;
        }

        public Builder classificationProvider(ClassificationProvider classificationProvider) {
            this.classificationProvider = classificationProvider;
            return this;
        }

        /**
         * Sets the persistence collaborator. Results are discarded if not set.
         */
        public Builder resultSink(MatchResultSink resultSink) {
            this.resultSink = resultSink;
            return this;
        }

        public Builder options(MatchingOptions options) {
            this.options = options;
            return this;
        }

        public Builder schedulerOptions(SchedulerOptions schedulerOptions) {
            this.schedulerOptions = schedulerOptions;
            return this;
        }

        /**
         * Enables the retrieval cache. Disabled by default.
         */
        public Builder retrievalCache(RetrievalCacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Sets the executor item pipelines run on. Defaults to a cached pool owned by the matcher.
         */
        public Builder workerExecutor(ExecutorService workerExecutor) {
            this.workerExecutor = workerExecutor;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public ShelfMatcher build() {
            if (retrievalProvider == null) {
                throw new IllegalStateException("RetrievalProvider is required");
            }
            if (classificationProvider == null) {
                throw new IllegalStateException("ClassificationProvider is required");
            }
            if (options == null || schedulerOptions == null || cacheConfig == null) {
                throw new IllegalStateException("options, schedulerOptions and retrievalCache must not be null");
            }
            return new ShelfMatcher(this);
        }
    }
}
