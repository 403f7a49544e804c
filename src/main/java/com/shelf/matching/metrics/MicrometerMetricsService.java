package com.shelf.matching.metrics;

import com.shelf.matching.core.model.MatchOutcome;
import com.shelf.matching.core.model.SelectionMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code shelf.match.duration}: Timer (tag: outcome)</li>
 *   <li>{@code shelf.match.outcome}: Counter (tag: outcome)</li>
 *   <li>{@code shelf.match.selection}: Counter (tag: method)</li>
 *   <li>{@code shelf.candidates.retrieved}: DistributionSummary</li>
 *   <li>{@code shelf.candidates.prefiltered}: DistributionSummary</li>
 *   <li>{@code shelf.scheduler.inflight}: Gauge</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<MatchOutcome, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary retrievedSummary;
    private final DistributionSummary preFilteredSummary;
    private final AtomicInteger inFlight = new AtomicInteger();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.retrievedSummary = DistributionSummary.builder("shelf.candidates.retrieved")
                .description("Catalog candidates returned per item")
                .register(registry);
        this.preFilteredSummary = DistributionSummary.builder("shelf.candidates.prefiltered")
                .description("Candidates passing the text pre-filter per item")
                .register(registry);
        Gauge.builder("shelf.scheduler.inflight", inFlight, AtomicInteger::get)
                .description("Item executions currently in flight")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(MatchOutcome outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, o ->
                Timer.builder("shelf.match.duration")
                        .description("Duration of per-item matching")
                        .tag("outcome", o.wireName())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementOutcome(MatchOutcome outcome) {
        counterCache.computeIfAbsent("outcome:" + outcome.name(), k ->
                Counter.builder("shelf.match.outcome")
                        .description("Terminal decisions by outcome")
                        .tag("outcome", outcome.wireName())
                        .register(registry)).increment();
    }

    @Override
    public void incrementSelection(SelectionMethod method) {
        counterCache.computeIfAbsent("selection:" + method.name(), k ->
                Counter.builder("shelf.match.selection")
                        .description("Auto-saved matches by selection method")
                        .tag("method", method.wireName())
                        .register(registry)).increment();
    }

    @Override
    public void recordCandidatesRetrieved(int count) {
        retrievedSummary.record(count);
    }

    @Override
    public void recordCandidatesPreFiltered(int count) {
        preFilteredSummary.record(count);
    }

    @Override
    public void adjustInFlight(int delta) {
        inFlight.addAndGet(delta);
    }
}
