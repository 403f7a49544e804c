package com.shelf.matching.cdi;

import com.shelf.matching.api.MatchingOptions;
import com.shelf.matching.prefilter.PreFilterWeights;
import com.shelf.matching.retrieval.RetrievalCacheConfig;
import com.shelf.matching.scheduler.SchedulerOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that builds the shelf matching configuration from MicroProfile Config.
 *
 * <p>The retrieval and classification capabilities are application-specific, so
 * the application produces the {@link com.shelf.matching.api.ShelfMatcher} itself
 * from the beans below:</p>
 * <pre>
 * &#64;Produces &#64;ApplicationScoped
 * ShelfMatcher matcher(MatchingOptions options, SchedulerOptions scheduling,
 *                      RetrievalCacheConfig cache) {
 *     return ShelfMatcher.builder()
 *         .retrievalProvider(search).classificationProvider(classifier)
 *         .options(options).schedulerOptions(scheduling).retrievalCache(cache)
 *         .build();
 * }
 * </pre>
 *
 * <p>Option values are produced as {@link Singleton}s; final types cannot be client-proxied.
 * All keys live under {@code shelf-matching.}; defaults are listed in
 * {@code META-INF/microprofile-config.properties}.</p>
 */
@ApplicationScoped
public class ShelfMatchingProducer {

    private static final Logger log = LoggerFactory.getLogger(ShelfMatchingProducer.class);

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "shelf-matching.prefilter.threshold", defaultValue = "0.85")
    double preFilterThreshold;

    @Inject
    @ConfigProperty(name = "shelf-matching.prefilter.brand-weight", defaultValue = "0.35")
    double brandWeight;

    @Inject
    @ConfigProperty(name = "shelf-matching.prefilter.retailer-weight", defaultValue = "0.30")
    double retailerWeight;

    @Inject
    @ConfigProperty(name = "shelf-matching.classifier.max-candidates", defaultValue = "10")
    int maxClassifierCandidates;

    @Inject
    @ConfigProperty(name = "shelf-matching.decision.tie-break-threshold", defaultValue = "0.70")
    double tieBreakThreshold;

    @Inject
    @ConfigProperty(name = "shelf-matching.retrieval.max-results", defaultValue = "100")
    int maxRetrievalResults;

    // ── Scheduler ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "shelf-matching.scheduler.max-concurrency", defaultValue = "50")
    int maxConcurrency;

    @Inject
    @ConfigProperty(name = "shelf-matching.scheduler.admission-batch-size", defaultValue = "10")
    int admissionBatchSize;

    @Inject
    @ConfigProperty(name = "shelf-matching.scheduler.admission-delay-millis", defaultValue = "2000")
    long admissionDelayMillis;

    @Inject
    @ConfigProperty(name = "shelf-matching.scheduler.item-timeout-seconds", defaultValue = "60")
    long itemTimeoutSeconds;

    // ── Retrieval cache ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "shelf-matching.cache.enabled", defaultValue = "false")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "shelf-matching.cache.max-terms", defaultValue = "1000")
    int cacheMaxTerms;

    @Inject
    @ConfigProperty(name = "shelf-matching.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public MatchingOptions matchingOptions() {
        MatchingOptions options = MatchingOptions.builder()
                .preFilterThreshold(preFilterThreshold)
                .preFilterWeights(new PreFilterWeights(brandWeight, retailerWeight))
                .maxClassifierCandidates(maxClassifierCandidates)
                .tieBreakThreshold(tieBreakThreshold)
                .maxRetrievalResults(maxRetrievalResults)
                .build();
        log.info("Producing {}", options);
        return options;
    }

    @Produces
    @Singleton
    public SchedulerOptions schedulerOptions() {
        SchedulerOptions options = SchedulerOptions.builder()
                .maxConcurrency(maxConcurrency)
                .admissionBatchSize(admissionBatchSize)
                .admissionDelay(Duration.ofMillis(admissionDelayMillis))
                .itemTimeout(Duration.ofSeconds(itemTimeoutSeconds))
                .build();
        if (options.getMaxConcurrency() != maxConcurrency) {
            log.warn("shelf-matching.scheduler.max-concurrency={} clamped to {}",
                    maxConcurrency, options.getMaxConcurrency());
        }
        log.info("Producing {}", options);
        return options;
    }

    @Produces
    @Singleton
    public RetrievalCacheConfig retrievalCacheConfig() {
        if (!cacheEnabled) {
            log.info("Retrieval cache disabled");
            return RetrievalCacheConfig.disabled();
        }
        log.info("Retrieval cache enabled: maxTerms={} ttl={}s", cacheMaxTerms, cacheTtlSeconds);
        return RetrievalCacheConfig.of(cacheMaxTerms, Duration.ofSeconds(cacheTtlSeconds));
    }
}
