package com.notes.ingestion.extraction;

import java.util.Locale;

/**
 * Category the extraction oracle assigns to a note.
 */
public enum NoteCategory {
    OFFICE,
    PROJECT,
    REGULATION,
    UNKNOWN;

    /**
     * Strict lookup: an unrecognised label is a parse failure, not {@link #UNKNOWN}.
     */
    public static NoteCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("category is missing");
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
