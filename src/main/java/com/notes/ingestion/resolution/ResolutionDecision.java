package com.notes.ingestion.resolution;

/**
 * Route taken by a candidate after identity resolution.
 */
public enum ResolutionDecision {
    /** An existing entity of the same kind was found; the candidate is merged into it. */
    MERGE,
    /** Nothing matched; the candidate becomes a new entity if it passes validation. */
    CREATE
}
