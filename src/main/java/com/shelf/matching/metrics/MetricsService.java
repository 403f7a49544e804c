package com.shelf.matching.metrics;

import com.shelf.matching.core.model.MatchOutcome;
import com.shelf.matching.core.model.SelectionMethod;

import java.time.Duration;

/**
 * Interface for recording shelf matching metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordMatchDuration(MatchOutcome outcome, Duration duration);

    void incrementOutcome(MatchOutcome outcome);

    void incrementSelection(SelectionMethod method);

    void recordCandidatesRetrieved(int count);

    void recordCandidatesPreFiltered(int count);

    /**
     * Adjusts the number of item executions currently in flight.
     */
    void adjustInFlight(int delta);
}
