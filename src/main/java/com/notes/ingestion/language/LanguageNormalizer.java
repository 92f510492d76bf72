package com.notes.ingestion.language;

import com.notes.ingestion.metrics.MetricsService;
import com.notes.ingestion.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First pipeline stage: makes sure downstream stages see English text.
 *
 * <p>Detection failures default to English and translation failures fall back to the original
 * text, so this stage never stops a note.</p>
 */
public class LanguageNormalizer {
    private static final Logger log = LoggerFactory.getLogger(LanguageNormalizer.class);

    private final TranslationOracle oracle;
    private final MetricsService metrics;

    public LanguageNormalizer(TranslationOracle oracle) {
        this(oracle, new NoOpMetricsService());
    }

    public LanguageNormalizer(TranslationOracle oracle, MetricsService metrics) {
        this.oracle = oracle;
        this.metrics = metrics;
    }

    public NormalizedText normalize(String text) {
        if (text == null || text.isBlank()) {
            return NormalizedText.unchanged(text);
        }

        boolean english;
        try {
            english = oracle.detectEnglish(text);
        } catch (RuntimeException e) {
            log.warn("Language detection failed, treating note as English: {}", e.getMessage());
            metrics.incrementOracleFailure("translation");
            return NormalizedText.unchanged(text);
        }
        if (english) {
            return NormalizedText.unchanged(text);
        }

        try {
            String translated = oracle.translate(text);
            if (translated == null || translated.isBlank()) {
                log.warn("Translation returned no text, keeping original note");
                return NormalizedText.unchanged(text);
            }
            log.info("Note translated to English ({} -> {} chars)", text.length(), translated.length());
            return new NormalizedText(text, translated, true);
        } catch (RuntimeException e) {
            log.warn("Translation failed, keeping original note: {}", e.getMessage());
            metrics.incrementOracleFailure("translation");
            return NormalizedText.unchanged(text);
        }
    }
}
