package com.notes.ingestion.core.model;

import java.time.Instant;

/**
 * Common shape of the records the pipeline persists.
 * {@code version} is assigned by the document store and drives conditional updates.
 */
public interface DomainEntity {

    String id();

    EntityKind kind();

    /**
     * Canonical name used for matching and summaries.
     */
    String displayName();

    Instant createdAt();

    Instant updatedAt();

    Long version();
}
