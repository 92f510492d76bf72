package com.notes.ingestion.store;

/**
 * Whether an entity reached the document store or only exists in the current result.
 */
public enum StorageState {
    PERSISTED,
    LOCAL
}
