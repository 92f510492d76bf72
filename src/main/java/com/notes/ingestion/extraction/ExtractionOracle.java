package com.notes.ingestion.extraction;

/**
 * Categorises a note and extracts structured fields from it.
 */
public interface ExtractionOracle {

    /**
     * @throws ExtractionException when no structured answer can be obtained; implementations never
     *                             fall back to a default category
     */
    ExtractionResult analyzeText(String text);
}
