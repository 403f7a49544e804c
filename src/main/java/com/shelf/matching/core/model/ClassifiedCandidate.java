package com.shelf.matching.core.model;

import java.util.Objects;

/**
 * A pre-filtered candidate with the verdict of the classification capability.
 * Confidence and visual similarity are clamped to [0, 1].
 */
public record ClassifiedCandidate(
        ScoredCandidate scored,
        MatchStatus status,
        double confidence,
        double visualSimilarity,
        String reasoning
) {
    public ClassifiedCandidate {
        Objects.requireNonNull(scored, "scored is required");
        Objects.requireNonNull(status, "status is required");
        confidence = Scores.clamp(confidence);
        visualSimilarity = Scores.clamp(visualSimilarity);
        reasoning = reasoning != null ? reasoning : "";
    }

    public String candidateId() {
        return scored.candidateId();
    }

    public int rank() {
        return scored.rank();
    }

    public boolean isIdentical() {
        return status == MatchStatus.IDENTICAL;
    }

    public boolean isAlmostSame() {
        return status == MatchStatus.ALMOST_SAME;
    }
}
