package com.shelf.matching.pipeline;

import java.util.Locale;

/**
 * Stages an item passes through, reported on the progress stream.
 */
public enum PipelineStage {
    SEARCHING,
    PREFILTERING,
    CLASSIFYING,
    DECIDING,
    SAVING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
