package com.notes.ingestion.api;

import com.notes.ingestion.relationship.RelationshipScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineOptions Tests")
class PipelineOptionsTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        PipelineOptions options = PipelineOptions.defaults();

        assertEquals(0.7, options.getFuzzyMatchThreshold());
        assertTrue(options.isWebEnrichmentEnabled());
        assertEquals(RelationshipScope.CITY_OR_COUNTRY, options.getRelationshipScope());
        assertEquals(200, options.getLocationWindowChars());
        assertEquals(3, options.getMaxMergeRetries());
        assertEquals(5, options.getIdCollisionRetries());
        assertEquals("note-ingestion", options.getSourceSystem());
    }

    @Test
    @DisplayName("withoutWebSearch only turns enrichment off")
    void withoutWebSearch() {
        PipelineOptions options = PipelineOptions.withoutWebSearch();

        assertFalse(options.isWebEnrichmentEnabled());
        assertEquals(0.7, options.getFuzzyMatchThreshold());
    }

    @Test
    @DisplayName("Builder should reject out-of-range values")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().fuzzyMatchThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().fuzzyMatchThreshold(-0.1));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().relationshipScope(null));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().locationWindowChars(-1));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().maxMergeRetries(-1));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().idCollisionRetries(0));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().sourceSystem(" "));
    }

    @Test
    @DisplayName("toString lists every option")
    void describes() {
        String text = PipelineOptions.builder()
                .relationshipScope(RelationshipScope.CITY_ONLY)
                .sourceSystem("crm")
                .build()
                .toString();

        assertTrue(text.contains("relationshipScope=CITY_ONLY"));
        assertTrue(text.contains("sourceSystem='crm'"));
    }
}
