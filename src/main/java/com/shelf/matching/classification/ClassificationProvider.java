package com.shelf.matching.classification;

import com.shelf.matching.core.model.ClassifiedCandidate;
import com.shelf.matching.core.model.ScoredCandidate;
import com.shelf.matching.scheduler.CancellationSignal;

import java.util.List;

/**
 * External visual classification capability.
 *
 * <p>Compares the reference image of a detected item against each pre-filtered
 * candidate and labels it identical, almost_same or not_match. Implementations
 * are shared across concurrent pipelines and must be thread-safe.</p>
 */
public interface ClassificationProvider {

    /**
     * Classifies candidates against the reference image.
     *
     * @param referenceImage handle of the cropped item image
     * @param candidates     pre-filtered candidates in rank order, already truncated by the caller
     * @param signal         fired when the caller no longer wants the answer; implementations
     *                       should abort outstanding requests
     * @return exactly one classified candidate per input, in the same order
     * @throws ClassificationException on transport failure or unusable response
     */
    List<ClassifiedCandidate> classify(String referenceImage,
                                       List<ScoredCandidate> candidates,
                                       CancellationSignal signal);

    /**
     * Returns the name/identifier of this provider.
     */
    default String getProviderName() {
        return getClass().getSimpleName();
    }
}
