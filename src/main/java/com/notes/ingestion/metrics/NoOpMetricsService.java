package com.notes.ingestion.metrics;

import com.notes.ingestion.core.model.EntityKind;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordNoteProcessed(boolean success, Duration duration) {
    }

    @Override
    public void incrementEntityCreated(EntityKind kind) {
    }

    @Override
    public void incrementEntityMerged(EntityKind kind) {
    }

    @Override
    public void incrementLocalFallback(EntityKind kind) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordEnrichmentLookup(String outcome) {
    }

    @Override
    public void incrementOracleFailure(String oracle) {
    }
}
