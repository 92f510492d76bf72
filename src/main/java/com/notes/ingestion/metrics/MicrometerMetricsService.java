package com.notes.ingestion.metrics;

import com.notes.ingestion.core.model.EntityKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-backed {@link MetricsService}.
 *
 * <ul>
 *   <li>{@code note.processing.duration}: timer, tag {@code outcome}</li>
 *   <li>{@code note.entity.created}, {@code note.entity.merged}, {@code note.entity.fallback}: counters, tag {@code entityKind}</li>
 *   <li>{@code note.similarity.score}: distribution summary</li>
 *   <li>{@code note.enrichment.lookup}: counter, tag {@code outcome}</li>
 *   <li>{@code note.oracle.failure}: counter, tag {@code oracle}</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScores;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScores = DistributionSummary.builder("note.similarity.score")
                .description("Similarity of the best fuzzy name match")
                .register(registry);
    }

    @Override
    public void recordNoteProcessed(boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        timers.computeIfAbsent(outcome, k ->
                        Timer.builder("note.processing.duration")
                                .description("Time to process one note end to end")
                                .tag("outcome", outcome)
                                .register(registry))
                .record(duration);
    }

    @Override
    public void incrementEntityCreated(EntityKind kind) {
        kindCounter("note.entity.created", "Entities created from notes", kind).increment();
    }

    @Override
    public void incrementEntityMerged(EntityKind kind) {
        kindCounter("note.entity.merged", "Entities merged into existing records", kind).increment();
    }

    @Override
    public void incrementLocalFallback(EntityKind kind) {
        kindCounter("note.entity.fallback", "Entities kept locally after a failed store write", kind).increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScores.record(score);
    }

    @Override
    public void recordEnrichmentLookup(String outcome) {
        counter("note.enrichment.lookup", "Web-search location lookups", "outcome", outcome).increment();
    }

    @Override
    public void incrementOracleFailure(String oracle) {
        counter("note.oracle.failure", "Failed oracle calls", "oracle", oracle).increment();
    }

    private Counter kindCounter(String name, String description, EntityKind kind) {
        return counter(name, description, "entityKind", kind.label());
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counters.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
