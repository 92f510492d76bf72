package com.notes.ingestion.audit;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Stored copy of a received note ({@code userInputs} collection).
 * {@code text} is a preview capped at {@link NoteLog#PREVIEW_LENGTH} characters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NoteRecord(
        String text,
        String fullText,
        String textHash,
        Instant timestamp,
        boolean processed,
        int length,
        int wordCount,
        String processingResult,
        boolean wasTranslated,
        String originalText
) {
}
