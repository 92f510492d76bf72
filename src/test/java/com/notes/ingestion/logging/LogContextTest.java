package com.notes.ingestion.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forNote should set noteId and operation in MDC")
    void forNoteSetsMDC() {
        try (LogContext ctx = LogContext.forNote("note-1")) {
            assertEquals("note-1", MDC.get("noteId"));
            assertEquals("ingest", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMerge should set entity kind, id and stage without touching the note keys")
    void forMergeNested() {
        try (LogContext note = LogContext.forNote("note-1")) {
            try (LogContext merge = LogContext.forMerge("office", "UKLD123")) {
                assertEquals("office", MDC.get("entityKind"));
                assertEquals("UKLD123", MDC.get("entityId"));
                assertEquals("merge", MDC.get("stage"));
            }
            assertNull(MDC.get("entityId"));
            assertEquals("ingest", MDC.get("operation"));
            assertEquals("note-1", MDC.get("noteId"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close, including added keys")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forNote("note-1").with("category", "office");
        assertEquals("office", MDC.get("category"));

        ctx.close();

        assertNull(MDC.get("noteId"));
        assertNull(MDC.get("category"));
    }

    @Test
    @DisplayName("newNoteId should be unique")
    void uniqueNoteIds() {
        assertNotEquals(LogContext.newNoteId(), LogContext.newNoteId());
    }
}
