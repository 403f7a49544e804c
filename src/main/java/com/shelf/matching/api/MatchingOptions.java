package com.shelf.matching.api;

import com.shelf.matching.prefilter.PreFilterWeights;

/**
 * Options for per-item matching, from catalog retrieval through the visual tie-break.
 */
public class MatchingOptions {

    public static final double DEFAULT_PRE_FILTER_THRESHOLD = 0.85;
    public static final int DEFAULT_MAX_CLASSIFIER_CANDIDATES = 10;
    public static final double DEFAULT_TIE_BREAK_THRESHOLD = 0.70;
    public static final int DEFAULT_MAX_RETRIEVAL_RESULTS = 100;

    private final double preFilterThreshold;
    private final int maxClassifierCandidates;
    private final double tieBreakThreshold;
    private final int maxRetrievalResults;
    private final PreFilterWeights preFilterWeights;

    private MatchingOptions(Builder builder) {
        this.preFilterThreshold = builder.preFilterThreshold;
        this.maxClassifierCandidates = builder.maxClassifierCandidates;
        this.tieBreakThreshold = builder.tieBreakThreshold;
        this.maxRetrievalResults = builder.maxRetrievalResults;
        this.preFilterWeights = builder.preFilterWeights;
    }

    public double getPreFilterThreshold() {
        return preFilterThreshold;
    }

    /**
     * K: upper bound on candidates sent to the classifier per item.
     */
    public int getMaxClassifierCandidates() {
        return maxClassifierCandidates;
    }

    public double getTieBreakThreshold() {
        return tieBreakThreshold;
    }

    public int getMaxRetrievalResults() {
        return maxRetrievalResults;
    }

    public PreFilterWeights getPreFilterWeights() {
        return preFilterWeights;
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Stricter options: fewer, closer candidates and a higher visual bar.
     */
    public static MatchingOptions strict() {
        return builder()
                .preFilterThreshold(0.95)
                .maxClassifierCandidates(5)
                .tieBreakThreshold(0.85)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double preFilterThreshold = DEFAULT_PRE_FILTER_THRESHOLD;
        private int maxClassifierCandidates = DEFAULT_MAX_CLASSIFIER_CANDIDATES;
        private double tieBreakThreshold = DEFAULT_TIE_BREAK_THRESHOLD;
        private int maxRetrievalResults = DEFAULT_MAX_RETRIEVAL_RESULTS;
        private PreFilterWeights preFilterWeights = PreFilterWeights.defaultWeights();

        public Builder preFilterThreshold(double preFilterThreshold) {
            validateThreshold(preFilterThreshold, "preFilterThreshold");
            this.preFilterThreshold = preFilterThreshold;
            return this;
        }

        public Builder maxClassifierCandidates(int maxClassifierCandidates) {
            if (maxClassifierCandidates <= 0) {
                throw new IllegalArgumentException("maxClassifierCandidates must be positive");
            }
            this.maxClassifierCandidates = maxClassifierCandidates;
            return this;
        }

        public Builder tieBreakThreshold(double tieBreakThreshold) {
            validateThreshold(tieBreakThreshold, "tieBreakThreshold");
            this.tieBreakThreshold = tieBreakThreshold;
            return this;
        }

        public Builder maxRetrievalResults(int maxRetrievalResults) {
            if (maxRetrievalResults <= 0) {
                throw new IllegalArgumentException("maxRetrievalResults must be positive");
            }
            this.maxRetrievalResults = maxRetrievalResults;
            return this;
        }

        public Builder preFilterWeights(PreFilterWeights preFilterWeights) {
            if (preFilterWeights == null) {
                throw new IllegalArgumentException("preFilterWeights is required");
            }
            this.preFilterWeights = preFilterWeights;
            return this;
        }

        public MatchingOptions build() {
            if (maxClassifierCandidates > maxRetrievalResults) {
                throw new IllegalArgumentException(
                        "maxClassifierCandidates must be <= maxRetrievalResults");
            }
            return new MatchingOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "preFilterThreshold=" + preFilterThreshold +
                ", maxClassifierCandidates=" + maxClassifierCandidates +
                ", tieBreakThreshold=" + tieBreakThreshold +
                ", maxRetrievalResults=" + maxRetrievalResults +
                ", preFilterWeights=" + preFilterWeights +
                '}';
    }
}
