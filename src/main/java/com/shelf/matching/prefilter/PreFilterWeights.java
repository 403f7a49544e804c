package com.shelf.matching.prefilter;

/**
 * Relative weights of the text pre-filter terms. Only terms that apply to a
 * given item/candidate pair enter the normalization denominator, so the weights
 * need not sum to 1.0.
 */
public record PreFilterWeights(double brandWeight, double retailerWeight) {

    public PreFilterWeights {
        if (brandWeight <= 0 || retailerWeight <= 0) {
            throw new IllegalArgumentException("Weights must be positive");
        }
    }

    /**
     * Default weights: brand 0.35, retailer 0.30.
     */
    public static PreFilterWeights defaultWeights() {
        return new PreFilterWeights(0.35, 0.30);
    }
}
