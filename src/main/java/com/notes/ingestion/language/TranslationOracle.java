package com.notes.ingestion.language;

/**
 * Language detection and translation service.
 * Implementations may throw {@link com.notes.ingestion.llm.LLMException}; callers treat that as
 * "no translation available".
 */
public interface TranslationOracle {

    boolean detectEnglish(String text);

    String translate(String text);
}
