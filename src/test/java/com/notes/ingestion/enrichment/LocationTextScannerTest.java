package com.notes.ingestion.enrichment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LocationTextScannerTest {

    private final LocationTextScanner scanner = new LocationTextScanner(100);

    @Test
    @DisplayName("A known city near the name counts as a location")
    void cityNearName() {
        assertTrue(scanner.mentionsLocation("Met Foster + Partners in London today", "Foster + Partners"));
    }

    @Test
    @DisplayName("Location phrases count as a location")
    void phrase() {
        assertTrue(scanner.mentionsLocation("Arup, based in a city I forgot, called", "arup"));
    }

    @Test
    @DisplayName("Short tokens inside longer words do not count")
    void wholeWords() {
        assertFalse(scanner.mentionsLocation("Spoke to MVRDV about usability and their team", "MVRDV"));
    }

    @Test
    @DisplayName("Places outside the window are ignored")
    void outsideWindow() {
        LocationTextScanner narrow = new LocationTextScanner(10);
        String text = "Foster + Partners sent a long proposal which we will review next week, from London";

        assertFalse(narrow.mentionsLocation(text, "Foster + Partners"));
    }

    @Test
    @DisplayName("A name absent from the text has no location")
    void nameAbsent() {
        assertFalse(scanner.mentionsLocation("Met someone in London", "Snøhetta"));
        assertFalse(scanner.mentionsLocation(null, "Snøhetta"));
    }

    @Test
    @DisplayName("Window must not be negative")
    void negativeWindow() {
        assertThrows(IllegalArgumentException.class, () -> new LocationTextScanner(-1));
    }
}
