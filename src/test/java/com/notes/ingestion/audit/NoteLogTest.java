package com.notes.ingestion.audit;

import com.notes.ingestion.language.NormalizedText;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NoteLog Tests")
class NoteLogTest {

    private InMemoryDocumentStore store;
    private NoteLog noteLog;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        noteLog = new NoteLog(new EntityRepository(store));
    }

    private Map<String, Object> onlyRecord() {
        List<Map<String, Object>> records = store.query(NoteLog.COLLECTION, List.of()).data();
        assertEquals(1, records.size());
        return records.get(0);
    }

    @Test
    @DisplayName("Should store a pending record with text statistics")
    void pending() {
        noteLog.recordPending(NormalizedText.unchanged("Met Foster + Partners in London"));

        Map<String, Object> record = onlyRecord();
        assertEquals(false, record.get("processed"));
        assertEquals("pending", record.get("processingResult"));
        assertEquals(6, ((Number) record.get("wordCount")).intValue());
        assertEquals(64, record.get("textHash").toString().length());
        assertFalse(record.containsKey("originalText"));
    }

    @Test
    @DisplayName("Translated notes keep their original text")
    void translated() {
        noteLog.recordPending(new NormalizedText("Hola Londres", "Hello London", true));

        Map<String, Object> record = onlyRecord();
        assertEquals("Hello London", record.get("fullText"));
        assertEquals("Hola Londres", record.get("originalText"));
        assertEquals(true, record.get("wasTranslated"));
    }

    @Test
    @DisplayName("Should mark the pending record as processed")
    void markProcessed() {
        noteLog.recordPending(NormalizedText.unchanged("Met Foster + Partners in London"));

        noteLog.markProcessed("Met Foster + Partners in London", "success", Map.of("offices", 1),
                "Successfully created: 1 office(s) created: Foster + Partners (UKLD123)");

        Map<String, Object> record = onlyRecord();
        assertEquals(true, record.get("processed"));
        assertEquals("success", record.get("processingResult"));
        assertEquals(Map.of("offices", 1), record.get("entitiesCreated"));
        assertNotNull(record.get("processedAt"));
    }

    @Test
    @DisplayName("Long notes are previewed")
    void preview() {
        String longText = "a".repeat(NoteLog.PREVIEW_LENGTH + 5);

        assertEquals(NoteLog.PREVIEW_LENGTH + 3, NoteLog.preview(longText).length());
        assertEquals("short", NoteLog.preview("short"));
        assertEquals(0, NoteLog.wordCount("   "));
    }
}
