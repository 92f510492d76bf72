package com.notes.ingestion.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OfficeNameVariantsTest {

    private final OfficeNameVariants variants = new OfficeNameVariants();

    @Test
    @DisplayName("Should strip organizational suffixes")
    void stripsSuffix() {
        assertTrue(variants.generate("Boris Pena Architects").contains("Boris Pena"));
        assertTrue(variants.generate("Snøhetta Studio").contains("Snøhetta"));
    }

    @Test
    @DisplayName("Should produce initials for multi-word names")
    void initials() {
        List<String> generated = variants.generate("Boris Pena Architecture");

        assertTrue(generated.contains("BPA"));
        assertTrue(generated.contains("Boris PA"));
    }

    @Test
    @DisplayName("Should swap Architecture and Architects")
    void swapsArchitecture() {
        assertTrue(variants.generate("Boris Pena Architecture").contains("Boris Pena Architects"));
        assertTrue(variants.generate("Boris Pena Architects").contains("Boris Pena Architecture"));
    }

    @Test
    @DisplayName("Should never return the input or duplicates")
    void noInputNoDuplicates() {
        List<String> generated = variants.generate("Foster Partners");

        assertFalse(generated.contains("Foster Partners"));
        assertEquals(generated.stream().distinct().count(), generated.size());
    }

    @Test
    @DisplayName("Single words without suffix have no variants")
    void singleWord() {
        assertTrue(variants.generate("MVRDV").isEmpty());
        assertTrue(variants.generate("  ").isEmpty());
    }
}
