package com.shelf.matching.metrics;

import com.shelf.matching.core.model.MatchOutcome;
import com.shelf.matching.core.model.SelectionMethod;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}. Used when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(MatchOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementOutcome(MatchOutcome outcome) {
    }

    @Override
    public void incrementSelection(SelectionMethod method) {
    }

    @Override
    public void recordCandidatesRetrieved(int count) {
    }

    @Override
    public void recordCandidatesPreFiltered(int count) {
    }

    @Override
    public void adjustInFlight(int delta) {
    }
}
