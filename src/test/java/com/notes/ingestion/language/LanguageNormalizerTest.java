package com.notes.ingestion.language;

import com.notes.ingestion.llm.LLMException;
import com.notes.ingestion.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LanguageNormalizerTest {

    @Mock
    private TranslationOracle oracle;

    @Mock
    private MetricsService metrics;

    private LanguageNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new LanguageNormalizer(oracle, metrics);
    }

    @Test
    @DisplayName("English text passes through untouched")
    void englishUnchanged() {
        when(oracle.detectEnglish("Met Foster + Partners in London")).thenReturn(true);

        NormalizedText result = normalizer.normalize("Met Foster + Partners in London");

        assertFalse(result.translated());
        assertEquals("Met Foster + Partners in London", result.text());
        verify(oracle, never()).translate(anyString());
    }

    @Test
    @DisplayName("Non-English text is translated and the original kept")
    void translated() {
        when(oracle.detectEnglish("Reunión con Foster + Partners en Londres")).thenReturn(false);
        when(oracle.translate("Reunión con Foster + Partners en Londres"))
                .thenReturn("Meeting with Foster + Partners in London");

        NormalizedText result = normalizer.normalize("Reunión con Foster + Partners en Londres");

        assertTrue(result.translated());
        assertEquals("Meeting with Foster + Partners in London", result.text());
        assertEquals("Reunión con Foster + Partners en Londres", result.originalText());
    }

    @Test
    @DisplayName("A failing translation keeps the original text")
    void translationFailsOpen() {
        when(oracle.detectEnglish(anyString())).thenReturn(false);
        when(oracle.translate(anyString())).thenThrow(new LLMException("timeout"));

        NormalizedText result = normalizer.normalize("Bonjour");

        assertFalse(result.translated());
        assertEquals("Bonjour", result.text());
        verify(metrics).incrementOracleFailure("translation");
    }

    @Test
    @DisplayName("A failing detection treats the note as English")
    void detectionFailsOpen() {
        when(oracle.detectEnglish(anyString())).thenThrow(new LLMException("unreachable"));

        NormalizedText result = normalizer.normalize("Hallo");

        assertEquals("Hallo", result.text());
        verify(oracle, never()).translate(anyString());
    }

    @Test
    @DisplayName("A blank translation keeps the original text")
    void blankTranslation() {
        when(oracle.detectEnglish(anyString())).thenReturn(false);
        when(oracle.translate(anyString())).thenReturn("  ");

        assertEquals("Ciao", normalizer.normalize("Ciao").text());
    }

    @Test
    @DisplayName("Blank notes skip the oracle")
    void blankNote() {
        assertFalse(normalizer.normalize(" ").translated());
        verify(oracle, never()).detectEnglish(anyString());
    }
}
