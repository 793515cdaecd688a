package com.metabolite.classification.metrics;

import com.metabolite.classification.core.model.DataSource;
import com.metabolite.classification.core.model.LookupError;
import com.metabolite.classification.core.model.MetaboliteType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code metabolite.lookup} - Counter (tags: source, outcome)</li>
 *   <li>{@code metabolite.fetch.duration} - Timer (tags: source, success)</li>
 *   <li>{@code metabolite.classified} - Counter (tag: finalType)</li>
 *   <li>{@code metabolite.run.size} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final DistributionSummary runSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.runSizeSummary = DistributionSummary.builder("metabolite.run.size")
                .description("Number of metabolite names per pipeline run")
                .register(registry);
    }

    @Override
    public void recordResolution(DataSource source, LookupError error) {
        String outcome = error == null ? "found" : error.name().toLowerCase(Locale.ROOT);
        String key = "lookup:" + source.name() + ":" + outcome;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("metabolite.lookup")
                        .description("Name-to-id resolutions by outcome")
                        .tag("source", source.name())
                        .tag("outcome", outcome)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordFetch(DataSource source, boolean success, Duration duration) {
        String key = source.name() + ":" + success;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("metabolite.fetch.duration")
                        .description("Duration of detail fetches")
                        .tag("source", source.name())
                        .tag("success", String.valueOf(success))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementClassified(MetaboliteType finalType) {
        String key = "classified:" + finalType.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("metabolite.classified")
                        .description("Metabolites by final type")
                        .tag("finalType", finalType.getLabel())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordRunSize(int size) {
        runSizeSummary.record(size);
    }
}
