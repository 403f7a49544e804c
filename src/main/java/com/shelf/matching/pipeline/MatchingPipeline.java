package com.shelf.matching.pipeline;

import com.shelf.matching.api.MatchingOptions;
import com.shelf.matching.classification.ClassificationException;
import com.shelf.matching.classification.ClassificationProvider;
import com.shelf.matching.core.MatchingException;
import com.shelf.matching.core.model.Candidate;
import com.shelf.matching.core.model.ClassifiedCandidate;
import com.shelf.matching.core.model.DetectionItem;
import com.shelf.matching.core.model.FailureKind;
import com.shelf.matching.core.model.MatchDecision;
import com.shelf.matching.core.model.MatchOutcome;
import com.shelf.matching.core.model.ScoredCandidate;
import com.shelf.matching.decision.DecisionEngine;
import com.shelf.matching.logging.LogContext;
import com.shelf.matching.metrics.MetricsService;
import com.shelf.matching.metrics.NoOpMetricsService;
import com.shelf.matching.persistence.MatchPersistenceException;
import com.shelf.matching.persistence.MatchResultSink;
import com.shelf.matching.prefilter.TextPreFilterScorer;
import com.shelf.matching.retrieval.RetrievalException;
import com.shelf.matching.retrieval.RetrievalProvider;
import com.shelf.matching.retrieval.SearchQuery;
import com.shelf.matching.scheduler.ItemContext;
import com.shelf.matching.scheduler.ItemProcessor;
import com.shelf.matching.stats.RunOutcome;
import com.shelf.matching.tracing.NoOpTracingService;
import com.shelf.matching.tracing.Span;
import com.shelf.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Matches one detection item end to end:
 * retrieval, text pre-filter, truncation to K, visual classification, decision, save.
 *
 * <p>Stateless apart from its collaborators; one instance serves every item of
 * every run. Failures are thrown as {@link MatchingException}s
 * and turned into error results by {@link #failed}, either by the scheduler or by
 * {@link #match} for standalone calls.</p>
 */
public class MatchingPipeline implements ItemProcessor<DetectionItem, ItemMatchResult> {
    private static final Logger log = LoggerFactory.getLogger(MatchingPipeline.class);

    private final RetrievalProvider retrievalProvider;
    private final ClassificationProvider classificationProvider;
    private final MatchResultSink resultSink;
    private final MatchingOptions options;
    private final TextPreFilterScorer preFilterScorer;
    private final DecisionEngine decisionEngine;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public MatchingPipeline(RetrievalProvider retrievalProvider,
                            ClassificationProvider classificationProvider,
                            MatchResultSink resultSink,
                            MatchingOptions options) {
        this(retrievalProvider, classificationProvider, resultSink, options,
                new NoOpMetricsService(), new NoOpTracingService());
    }

    public MatchingPipeline(RetrievalProvider retrievalProvider,
                            ClassificationProvider classificationProvider,
                            MatchResultSink resultSink,
                            MatchingOptions options,
                            MetricsService metricsService,
                            TracingService tracingService) {
        this.retrievalProvider = Objects.requireNonNull(retrievalProvider, "retrievalProvider is required");
        this.classificationProvider = Objects.requireNonNull(classificationProvider,
                "classificationProvider is required");
        this.resultSink = resultSink != null ? resultSink : MatchResultSink.discarding();
        this.options = options != null ? options : MatchingOptions.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
        this.preFilterScorer = new TextPreFilterScorer(this.options.getPreFilterThreshold(),
                this.options.getPreFilterWeights());
        this.decisionEngine = new DecisionEngine(this.options.getTieBreakThreshold());
    }

    /**
     * Matches a single item on the calling thread. Never throws for per-item
     * failures; they come back as an error result.
     */
    public ItemMatchResult match(DetectionItem item) {
        Objects.requireNonNull(item, "item is required");
        long started = System.nanoTime();
        ItemMatchResult result;
        try {
            result = process(item, ItemContext.standalone(item.id()));
        } catch (RuntimeException e) {
            FailureKind kind = e instanceof MatchingException me ? me.getKind() : FailureKind.INTERNAL;
            log.warn("item.failed itemId={} kind={}: {}", item.id(), kind, e.toString());
            result = failed(item, kind, e);
        }
        onCompleted(item, result, Duration.ofNanos(System.nanoTime() - started));
        return result;
    }

    @Override
    public String idOf(DetectionItem item) {
        return item.id();
    }

    @Override
    public ItemMatchResult process(DetectionItem item, ItemContext context) {
        try (LogContext ignored = LogContext.forItem(context.runId(), item.id());
             Span span = tracingService.startItemSpan(context.runId(), item.id())) {
            try {
                ItemMatchResult result = run(item, context, span);
                span.setAttribute("outcome", result.outcome().wireName());
                span.setAttribute("candidates.retrieved", result.retrievedCount());
                span.setAttribute("candidates.prefiltered", result.scoredCandidates().size());
                span.succeed();
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private ItemMatchResult run(DetectionItem item, ItemContext context, Span span) {
        validate(item);

        enter(PipelineStage.SEARCHING, context, span);
        SearchQuery query = SearchQuery.forItem(item, options.getMaxRetrievalResults());
        if (query.isBlank()) {
            return save(context, span, new ItemMatchResult(item.id(),
                    MatchDecision.noMatch("Item has no searchable text attributes"), List.of(), List.of(), 0));
        }
        List<Candidate> retrieved = retrieve(item, query);
        metricsService.recordCandidatesRetrieved(retrieved.size());
        if (retrieved.isEmpty()) {
            return save(context, span, new ItemMatchResult(item.id(),
                    MatchDecision.noMatch("No catalog candidates found for '" + query.term() + "'"),
                    List.of(), List.of(), 0));
        }

        context.checkCancelled();
        enter(PipelineStage.PREFILTERING, context, span);
        List<ScoredCandidate> scored = preFilterScorer.score(item, retrieved);
        metricsService.recordCandidatesPreFiltered(scored.size());
        if (scored.isEmpty()) {
            return save(context, span, new ItemMatchResult(item.id(),
                    MatchDecision.noMatch(retrieved.size() + " candidates, none passed the pre-filter"),
                    List.of(), List.of(), retrieved.size()));
        }

        List<ScoredCandidate> shortlist = scored.size() > options.getMaxClassifierCandidates()
                ? scored.subList(0, options.getMaxClassifierCandidates())
                : scored;

        enter(PipelineStage.CLASSIFYING, context, span);
        List<ClassifiedCandidate> classified = classify(item, shortlist, context);

        context.checkCancelled();
        enter(PipelineStage.DECIDING, context, span);
        MatchDecision decision = decisionEngine.decide(classified);
        log.debug("item.decided itemId={} retrieved={} prefiltered={} classified={} outcome={}",
                item.id(), retrieved.size(), scored.size(), classified.size(), decision.outcome().wireName());

        return save(context, span, new ItemMatchResult(item.id(), decision, scored, classified, retrieved.size()));
    }

    private void validate(DetectionItem item) {
        if (item.id().isBlank()) {
            throw new ItemValidationException("Detection item id is blank");
        }
        if (!item.hasReferenceImage()) {
            throw new ItemValidationException("Detection item " + item.id() + " has no reference image");
        }
    }

    private List<Candidate> retrieve(DetectionItem item, SearchQuery query) {
        List<Candidate> candidates;
        try {
            candidates = retrievalProvider.retrieve(query);
        } catch (RetrievalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RetrievalException("Retrieval failed for item " + item.id() + ": " + e.getMessage(), e);
        }
        if (candidates == null) {
            return List.of();
        }
        return candidates.size() > query.maxResults() ? candidates.subList(0, query.maxResults()) : candidates;
    }

    private List<ClassifiedCandidate> classify(DetectionItem item, List<ScoredCandidate> shortlist,
                                               ItemContext context) {
        List<ClassifiedCandidate> classified;
        try {
            context.checkCancelled();
            classified = classificationProvider.classify(item.referenceImage(), shortlist, context.signal());
        } catch (ClassificationException e) {
            throw e;
        } catch (CancellationException e) {
            throw new ClassificationException("Classification cancelled for item " + item.id(), e);
        } catch (RuntimeException e) {
            throw new ClassificationException("Classification failed for item " + item.id() + ": "
                    + e.getMessage(), e);
        }

        if (classified == null || classified.size() != shortlist.size()) {
            throw new ClassificationException("Classifier returned " + (classified == null ? 0 : classified.size())
                    + " results for " + shortlist.size() + " candidates of item " + item.id());
        }
        for (int i = 0; i < shortlist.size(); i++) {
            if (!shortlist.get(i).candidateId().equals(classified.get(i).candidateId())) {
                throw new ClassificationException("Classifier result " + i + " is for candidate "
                        + classified.get(i).candidateId() + ", expected " + shortlist.get(i).candidateId());
            }
        }
        return classified;
    }

    private void enter(PipelineStage stage, ItemContext context, Span span) {
        span.addEvent(stage.wireName());
        context.reportStage(stage.wireName());
    }

    private ItemMatchResult save(ItemContext context, Span span, ItemMatchResult result) {
        context.commit();
        enter(PipelineStage.SAVING, context, span);
        try {
            resultSink.save(result);
        } catch (RuntimeException e) {
            throw new MatchPersistenceException("Failed to save result of item " + result.itemId(), e);
        }
        return result;
    }

    @Override
    public ItemMatchResult failed(DetectionItem item, FailureKind kind, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (kind == FailureKind.TIMEOUT) {
            message = "Item timed out";
        }
        return ItemMatchResult.failed(item.id(), kind, message);
    }

    @Override
    public RunOutcome outcomeOf(ItemMatchResult result) {
        return switch (result.outcome()) {
            case AUTO_SAVED -> RunOutcome.SUCCESS;
            case ERROR -> RunOutcome.ERROR;
            case NEEDS_MANUAL_REVIEW, NO_MATCH -> RunOutcome.NO_MATCH;
        };
    }

    @Override
    public String describe(ItemMatchResult result) {
        return result.outcome().wireName() + ": " + result.decision().reason();
    }

    @Override
    public void onCompleted(DetectionItem item, ItemMatchResult result, Duration elapsed) {
        MatchDecision decision = result.decision();
        metricsService.recordMatchDuration(decision.outcome(), elapsed);
        metricsService.incrementOutcome(decision.outcome());
        if (decision.outcome() == MatchOutcome.AUTO_SAVED) {
            metricsService.incrementSelection(decision.selectionMethod());
            log.info("item.matched itemId={} candidateId={} method={} elapsedMs={}", item.id(),
                    decision.selectedCandidate().candidateId(), decision.selectionMethod().wireName(),
                    elapsed.toMillis());
        } else {
            log.info("item.matched itemId={} outcome={} elapsedMs={} reason='{}'", item.id(),
                    decision.outcome().wireName(), elapsed.toMillis(), decision.reason());
        }
    }

    public MatchingOptions getOptions() {
        return options;
    }
}
