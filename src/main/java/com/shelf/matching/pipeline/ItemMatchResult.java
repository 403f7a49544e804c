package com.shelf.matching.pipeline;

import com.shelf.matching.core.model.ClassifiedCandidate;
import com.shelf.matching.core.model.FailureKind;
import com.shelf.matching.core.model.MatchDecision;
import com.shelf.matching.core.model.MatchOutcome;
import com.shelf.matching.core.model.ScoredCandidate;

import java.util.List;
import java.util.Objects;

/**
 * Terminal result of one item: the decision plus the candidates it was made from,
 * as handed to the persistence collaborator for audit.
 *
 * @param itemId               detection item id
 * @param decision             the single terminal decision
 * @param scoredCandidates     candidates that passed the pre-filter, best first
 * @param classifiedCandidates candidates sent to the classifier with their verdicts
 * @param retrievedCount       raw catalog candidates returned by retrieval
 */
public record ItemMatchResult(
        String itemId,
        MatchDecision decision,
        List<ScoredCandidate> scoredCandidates,
        List<ClassifiedCandidate> classifiedCandidates,
        int retrievedCount
) {
    public ItemMatchResult {
        Objects.requireNonNull(itemId, "itemId is required");
        Objects.requireNonNull(decision, "decision is required");
        scoredCandidates = scoredCandidates != null ? List.copyOf(scoredCandidates) : List.of();
        classifiedCandidates = classifiedCandidates != null ? List.copyOf(classifiedCandidates) : List.of();
        if (retrievedCount < 0) {
            throw new IllegalArgumentException("retrievedCount must be >= 0");
        }
    }

    public static ItemMatchResult failed(String itemId, FailureKind kind, String message) {
        return new ItemMatchResult(itemId, MatchDecision.error(kind, message), List.of(), List.of(), 0);
    }

    public MatchOutcome outcome() {
        return decision.outcome();
    }
}
