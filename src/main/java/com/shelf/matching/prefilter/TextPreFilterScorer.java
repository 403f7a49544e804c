package com.shelf.matching.prefilter;

import com.shelf.matching.core.model.Candidate;
import com.shelf.matching.core.model.DetectionItem;
import com.shelf.matching.core.model.ScoredCandidate;
import com.shelf.matching.core.model.Scores;
import com.shelf.matching.rules.DefaultNormalizationRules;
import com.shelf.matching.rules.NormalizationEngine;
import com.shelf.matching.rules.TextField;
import com.shelf.matching.similarity.RetailerResolver;
import com.shelf.matching.similarity.TieredStringSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores raw catalog candidates on structured text only, before any visual comparison.
 *
 * <p>Two terms are evaluated, each only when it applies:</p>
 * <ul>
 *   <li><b>Brand</b> (item brand known): best tiered similarity of the item brand
 *       against the candidate brand, manufacturer and title.</li>
 *   <li><b>Retailer</b> (item retailer known and candidate lists retailers): full
 *       credit if the candidate is sold there; otherwise the candidate is excluded
 *       outright.</li>
 * </ul>
 * <p>Score = applied weighted sub-scores / weights of applicable terms, capped at 1.0.
 * Size is not scored here; the extracted value is too noisy and is left to the
 * classification stage.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class TextPreFilterScorer {
    private static final Logger log = LoggerFactory.getLogger(TextPreFilterScorer.class);

    public static final double DEFAULT_THRESHOLD = 0.85;

    private static final double BRAND_REASON_FLOOR = 0.5;

    private final double threshold;
    private final PreFilterWeights weights;
    private final TieredStringSimilarity brandSimilarity;
    private final TieredStringSimilarity titleSimilarity;
    private final RetailerResolver retailerResolver;

    public TextPreFilterScorer() {
        this(DEFAULT_THRESHOLD, PreFilterWeights.defaultWeights());
    }

    public TextPreFilterScorer(double threshold, PreFilterWeights weights) {
        this(threshold, weights, DefaultNormalizationRules.createDefaultEngine());
    }

    public TextPreFilterScorer(double threshold, PreFilterWeights weights, NormalizationEngine normalizer) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
        this.weights = Objects.requireNonNull(weights, "weights is required");
        this.brandSimilarity = new TieredStringSimilarity(normalizer, TextField.BRAND);
        this.titleSimilarity = brandSimilarity.forField(TextField.TITLE);
        this.retailerResolver = new RetailerResolver(normalizer);
    }

    /**
     * Scores candidates using the item's own retailer context.
     */
    public List<ScoredCandidate> score(DetectionItem item, List<Candidate> candidates) {
        return score(item, candidates, item.retailerContext());
    }

    /**
     * Scores candidates and returns those at or above the threshold, best first.
     * Candidates with equal scores keep their retrieval order.
     *
     * @param retailerContext store name the item was photographed in; may be null
     */
    public List<ScoredCandidate> score(DetectionItem item, List<Candidate> candidates, String retailerContext) {
        Objects.requireNonNull(item, "item is required");
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        Optional<String> itemRetailer = DetectionItem.isKnown(retailerContext)
                ? retailerResolver.fromStoreName(retailerContext)
                : Optional.empty();

        List<ScoredCandidate> passed = new ArrayList<>();
        int excluded = 0;
        for (Candidate candidate : candidates) {
            Optional<Evaluation> evaluation = evaluate(item, candidate, itemRetailer.orElse(null));
            if (evaluation.isEmpty()) {
                excluded++;
                continue;
            }
            Evaluation e = evaluation.get();
            if (e.score() >= threshold) {
                passed.add(new ScoredCandidate(candidate, e.score(), 0, e.reasons()));
            }
        }

        passed.sort(Comparator.comparingDouble(ScoredCandidate::similarityScore).reversed());
        List<ScoredCandidate> ranked = new ArrayList<>(passed.size());
        for (int i = 0; i < passed.size(); i++) {
            ranked.add(passed.get(i).withRank(i));
        }

        log.debug("prefilter.done itemId={} retailer={} candidates={} excludedByRetailer={} passed={} threshold={}",
                item.id(), itemRetailer.orElse("-"), candidates.size(), excluded, ranked.size(), threshold);
        return List.copyOf(ranked);
    }

    /**
     * Evaluates one candidate. Empty when the retailer term excludes it.
     *
     * @param itemRetailer canonical retailer of the item, or null if unknown
     */
    Optional<Evaluation> evaluate(DetectionItem item, Candidate candidate, String itemRetailer) {
        double applied = 0.0;
        double possible = 0.0;
        List<String> reasons = new ArrayList<>();

        if (item.hasBrand()) {
            double brand = Math.max(
                    Math.max(brandSimilarity.compute(item.brand(), candidate.brand()),
                            brandSimilarity.compute(item.brand(), candidate.manufacturer())),
                    titleSimilarity.compute(item.brand(), candidate.title()));
            applied += brand * weights.brandWeight();
            possible += weights.brandWeight();
            if (brand > BRAND_REASON_FLOOR) {
                reasons.add(String.format("Brand match: %.0f%%", brand * 100));
            }
        }

        if (itemRetailer != null && candidate.hasKnownRetailers()) {
            boolean soldThere = candidate.retailers().stream()
                    .map(retailerResolver::canonicalize)
                    .anyMatch(itemRetailer::equals);
            if (!soldThere) {
                log.trace("prefilter.excluded itemId={} candidateId={} retailer={} candidateRetailers={}",
                        item.id(), candidate.id(), itemRetailer, candidate.retailers());
                return Optional.empty();
            }
            applied += weights.retailerWeight();
            possible += weights.retailerWeight();
            reasons.add("Retailer match: " + itemRetailer);
        }

        double score = possible == 0.0 ? 0.0 : Scores.clamp(applied / possible);
        return Optional.of(new Evaluation(score, reasons));
    }

    public double getThreshold() {
        return threshold;
    }

    public PreFilterWeights getWeights() {
        return weights;
    }

    /**
     * Score and reasons for one candidate before thresholding.
     */
    record Evaluation(double score, List<String> reasons) {
        Evaluation {
            reasons = List.copyOf(reasons);
        }
    }
}
