package com.shelf.matching.decision;

import com.shelf.matching.core.model.ClassifiedCandidate;
import com.shelf.matching.core.model.MatchDecision;
import com.shelf.matching.core.model.SelectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns the classified candidates of one item into its single {@link MatchDecision}.
 *
 * <p>Rules, in strict priority order:</p>
 * <ol>
 *   <li>Any {@code identical}: the best-ranked one is auto-saved ({@link SelectionMethod#AUTO_SELECT}).</li>
 *   <li>Exactly one {@code almost_same}: it is auto-saved ({@link SelectionMethod#CONSOLIDATION}).</li>
 *   <li>Several {@code almost_same}: visual tie-break. The candidate with the highest visual
 *       similarity wins ({@link SelectionMethod#VISUAL_MATCHING}) only if it reaches the
 *       tie-break threshold and strictly beats every other one; otherwise the item needs
 *       manual review with all {@code almost_same} candidates kept as alternatives.</li>
 *   <li>Otherwise no match.</li>
 * </ol>
 *
 * <p>Pure and thread-safe; the same input always yields an equal decision. Scores closer than {@value #TIE_EPSILON} are treated as a tie.</p>
 */
public class DecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    public static final double DEFAULT_TIE_BREAK_THRESHOLD = 0.70;
    public static final double TIE_EPSILON = 1e-9;

    private static final Comparator<ClassifiedCandidate> BY_RANK =
            Comparator.comparingInt(ClassifiedCandidate::rank);
    private static final Comparator<ClassifiedCandidate> BY_VISUAL_DESC =
            Comparator.comparingDouble(ClassifiedCandidate::visualSimilarity).reversed()
                    .thenComparing(BY_RANK);

    private final double tieBreakThreshold;

    public DecisionEngine() {
        this(DEFAULT_TIE_BREAK_THRESHOLD);
    }

    public DecisionEngine(double tieBreakThreshold) {
        if (tieBreakThreshold < 0.0 || tieBreakThreshold > 1.0) {
            throw new IllegalArgumentException("tieBreakThreshold must be between 0.0 and 1.0");
        }
        this.tieBreakThreshold = tieBreakThreshold;
    }

    /**
     * Decides the outcome for one item.
     *
     * @param classified classified candidates, null or empty meaning nothing survived the pre-filter
     */
    public MatchDecision decide(List<ClassifiedCandidate> classified) {
        if (classified == null || classified.isEmpty()) {
            return MatchDecision.noMatch("No candidates to classify");
        }

        Optional<ClassifiedCandidate> identical = classified.stream()
                .filter(ClassifiedCandidate::isIdentical)
                .min(BY_RANK);
        if (identical.isPresent()) {
            ClassifiedCandidate selected = identical.get();
            return MatchDecision.autoSaved(selected, SelectionMethod.AUTO_SELECT,
                    "Identical match " + selected.candidateId() + " at rank " + selected.rank());
        }

        List<ClassifiedCandidate> almostSame = new ArrayList<>();
        for (ClassifiedCandidate candidate : classified) {
            if (candidate.isAlmostSame()) {
                almostSame.add(candidate);
            }
        }

        if (almostSame.size() == 1) {
            ClassifiedCandidate selected = almostSame.get(0);
            return MatchDecision.autoSaved(selected, SelectionMethod.CONSOLIDATION,
                    "Single almost_same candidate " + selected.candidateId());
        }

        if (almostSame.size() > 1) {
            return visualTieBreak(almostSame);
        }

        return MatchDecision.noMatch("None of " + classified.size() + " classified candidates matched");
    }

    private MatchDecision visualTieBreak(List<ClassifiedCandidate> almostSame) {
        List<ClassifiedCandidate> ranked = new ArrayList<>(almostSame);
        ranked.sort(BY_VISUAL_DESC);

        ClassifiedCandidate top = ranked.get(0);
        ClassifiedCandidate runnerUp = ranked.get(1);
        double margin = top.visualSimilarity() - runnerUp.visualSimilarity();

        if (top.visualSimilarity() >= tieBreakThreshold && margin > TIE_EPSILON) {
            return MatchDecision.autoSaved(top, SelectionMethod.VISUAL_MATCHING, String.format(Locale.ROOT,
                    "Visual tie-break winner %s among %d almost_same candidates (%.4f vs %.4f)",
                    top.candidateId(), ranked.size(), top.visualSimilarity(), runnerUp.visualSimilarity()));
        }

        String why = top.visualSimilarity() < tieBreakThreshold
                ? String.format(Locale.ROOT, "best visual similarity %.4f is below %.2f",
                        top.visualSimilarity(), tieBreakThreshold)
                : String.format(Locale.ROOT, "visual similarity tie at %.4f", top.visualSimilarity());
        log.debug("decision.tiebreak.unresolved candidates={} reason='{}'", ranked.size(), why);
        return MatchDecision.manualReview(ranked,
                ranked.size() + " almost_same candidates without a unique visual winner: " + why);
    }

    public double getTieBreakThreshold() {
        return tieBreakThreshold;
    }
}
