package com.notes.ingestion.language;

import com.notes.ingestion.llm.LLMClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmTranslationOracleTest {

    @Mock
    private LLMClient client;

    private LlmTranslationOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new LlmTranslationOracle(client);
    }

    @Test
    @DisplayName("A NO answer means the text is not English")
    void detectsNo() {
        when(client.generate(contains("Is the following text written in English?"))).thenReturn("No.");

        assertFalse(oracle.detectEnglish("Hola"));
    }

    @Test
    @DisplayName("Ambiguous answers count as English")
    void ambiguous() {
        when(client.generate(anyString())).thenReturn("I am not sure");

        assertTrue(oracle.detectEnglish("Hello"));
    }

    @Test
    @DisplayName("Surrounding quotes are stripped from translations")
    void stripsQuotes() {
        when(client.generate(contains("Translate the following text"))).thenReturn(" \"Hello there\"\n");

        assertEquals("Hello there", oracle.translate("Hola"));
    }
}
