package com.notes.ingestion.language;

/**
 * Text handed to the rest of the pipeline, with the original kept for the note log.
 *
 * @param originalText the note as received
 * @param text         English text used downstream
 * @param translated   whether {@code text} came from a translation
 */
public record NormalizedText(String originalText, String text, boolean translated) {

    public static NormalizedText unchanged(String text) {
        return new NormalizedText(text, text, false);
    }
}
