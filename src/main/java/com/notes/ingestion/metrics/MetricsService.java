package com.notes.ingestion.metrics;

import com.notes.ingestion.core.model.EntityKind;

import java.time.Duration;

/**
 * Records pipeline metrics. The default {@link NoOpMetricsService} does nothing, so the pipeline
 * runs without a metrics backend.
 */
public interface MetricsService {

    void recordNoteProcessed(boolean success, Duration duration);

    void incrementEntityCreated(EntityKind kind);

    void incrementEntityMerged(EntityKind kind);

    void incrementLocalFallback(EntityKind kind);

    void recordSimilarityScore(double score);

    void recordEnrichmentLookup(String outcome);

    void incrementOracleFailure(String oracle);
}
