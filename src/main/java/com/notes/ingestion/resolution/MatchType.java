package com.notes.ingestion.resolution;

/**
 * How an existing entity was found.
 */
public enum MatchType {
    EXACT,
    OFFICIAL_NAME,
    FUZZY,
    NAME_VARIANT
}
