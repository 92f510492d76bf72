package com.notes.ingestion.enrichment;

import com.notes.ingestion.llm.LLMClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmWebSearchOracleTest {

    @Mock
    private LLMClient client;

    @Test
    @DisplayName("Should read the location from a JSON answer")
    void readsLocation() {
        when(client.generateJson(anyString()))
                .thenReturn("Sure: {\"country\": \"Norway\", \"city\": \"Oslo\", \"extra\": 1}");

        Optional<LocationSearchResult> result = new LlmWebSearchOracle(client).searchOfficeLocation("Snøhetta");

        assertTrue(result.isPresent());
        assertEquals("Oslo", result.get().city());
    }

    @Test
    @DisplayName("Unknown or unreadable answers are empty")
    void emptyAnswers() {
        when(client.generateJson(anyString()))
                .thenReturn("{\"country\": \"Unknown\", \"city\": null}")
                .thenReturn("no idea")
                .thenReturn("{not json}");
        LlmWebSearchOracle oracle = new LlmWebSearchOracle(client);

        assertTrue(oracle.searchOfficeLocation("A").isEmpty());
        assertTrue(oracle.searchOfficeLocation("B").isEmpty());
        assertTrue(oracle.searchOfficeLocation("C").isEmpty());
    }
}
