package com.shelf.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A catalog candidate that passed the text pre-filter.
 *
 * @param candidate       the raw catalog entry
 * @param similarityScore normalized text score, clamped to [0, 1]
 * @param rank            zero-based position in the pre-filter ordering
 * @param matchReasons    human-readable reasons, in the order they were found
 */
public record ScoredCandidate(
        Candidate candidate,
        double similarityScore,
        int rank,
        List<String> matchReasons
) {
    public ScoredCandidate {
        Objects.requireNonNull(candidate, "candidate is required");
        similarityScore = Scores.clamp(similarityScore);
        if (rank < 0) {
            throw new IllegalArgumentException("rank must be >= 0");
        }
        matchReasons = matchReasons != null ? List.copyOf(matchReasons) : List.of();
    }

    public String candidateId() {
        return candidate.id();
    }

    /**
     * Returns a copy carrying a different rank, used after sorting.
     */
    public ScoredCandidate withRank(int newRank) {
        return new ScoredCandidate(candidate, similarityScore, newRank, matchReasons);
    }
}
