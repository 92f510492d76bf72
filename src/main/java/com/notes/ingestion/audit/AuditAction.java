package com.notes.ingestion.audit;

/**
 * Auditable steps of note processing.
 */
public enum AuditAction {
    NOTE_RECEIVED,
    NOTE_TRANSLATED,
    EXTRACTION_FAILED,
    CANDIDATE_SKIPPED,
    ENTITY_CREATED,
    ENTITY_MERGED,
    ENTITY_FALLBACK,
    WORKFORCE_UPDATED,
    RELATIONSHIP_CREATED,
    SATELLITE_SAVED
}
