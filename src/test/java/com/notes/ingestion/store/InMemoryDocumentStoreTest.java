package com.notes.ingestion.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryDocumentStore Tests")
class InMemoryDocumentStoreTest {

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    private static Map<String, Object> doc(Object... keyValues) {
        Map<String, Object> doc = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            doc.put((String) keyValues[i], keyValues[i + 1]);
        }
        return doc;
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("Should generate an id and set version and timestamps")
        void generatesIdAndMetadata() {
            StoreResult<Map<String, Object>> result = store.create("offices", doc("name", "Foster + Partners"));

            assertTrue(result.success());
            assertNotNull(result.data().get(DocumentStore.ID));
            assertEquals(1L, result.data().get(DocumentStore.VERSION));
            assertNotNull(result.data().get(DocumentStore.CREATED_AT));
            assertEquals(result.data().get(DocumentStore.CREATED_AT), result.data().get(DocumentStore.UPDATED_AT));
        }

        @Test
        @DisplayName("Should keep a supplied id")
        void keepsSuppliedId() {
            StoreResult<Map<String, Object>> result = store.create("offices", doc("id", "UKLD123", "name", "Foster"));

            assertEquals("UKLD123", result.data().get(DocumentStore.ID));
            assertEquals(1, store.count("offices"));
        }

        @Test
        @DisplayName("Should report a conflict when the id already exists")
        void duplicateIdConflicts() {
            store.create("offices", doc("id", "UKLD123", "name", "Foster"));

            StoreResult<Map<String, Object>> second = store.create("offices", doc("id", "UKLD123", "name", "Other"));

            assertFalse(second.success());
            assertTrue(second.conflict());
            assertEquals("Foster", store.get("offices", "UKLD123").data().get("name"));
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("Should apply the partial and bump the version")
        void appliesPartial() {
            store.create("offices", doc("id", "A1", "name", "Foster", "founded", 1967));

            StoreResult<Map<String, Object>> result = store.update("offices", "A1", doc("founded", 1968), 1L);

            assertTrue(result.success());
            assertEquals(1968, result.data().get("founded"));
            assertEquals("Foster", result.data().get("name"));
            assertEquals(2L, result.data().get(DocumentStore.VERSION));
        }

        @Test
        @DisplayName("Should reject a stale expected version")
        void staleVersionConflicts() {
            store.create("offices", doc("id", "A1", "name", "Foster"));
            store.update("offices", "A1", doc("founded", 1967), 1L);

            StoreResult<Map<String, Object>> stale = store.update("offices", "A1", doc("founded", 1970), 1L);

            assertFalse(stale.success());
            assertTrue(stale.conflict());
            assertEquals(1967, store.get("offices", "A1").data().get("founded"));
        }

        @Test
        @DisplayName("Should never overwrite id, version or createdAt from the partial")
        void protectsManagedFields() {
            Map<String, Object> created = store.create("offices", doc("id", "A1")).data();

            store.update("offices", "A1", doc("id", "B2", "version", 99L, "createdAt", "1970-01-01T00:00:00Z"));

            Map<String, Object> stored = store.get("offices", "A1").data();
            assertEquals("A1", stored.get(DocumentStore.ID));
            assertEquals(2L, stored.get(DocumentStore.VERSION));
            assertEquals(created.get(DocumentStore.CREATED_AT), stored.get(DocumentStore.CREATED_AT));
        }

        @Test
        @DisplayName("Should fail for a missing document")
        void missingDocumentFails() {
            StoreResult<Map<String, Object>> result = store.update("offices", "nope", doc("name", "x"));

            assertFalse(result.success());
            assertFalse(result.conflict());
        }
    }

    @Test
    @DisplayName("Should filter queries by field equality")
    void queryFilters() {
        store.create("offices", doc("name", "Foster", "status", "active"));
        store.create("offices", doc("name", "Zaha", "status", "active"));
        store.create("projects", doc("projectName", "Foster"));

        List<Map<String, Object>> hits = store.query("offices", List.of(QueryFilter.eq("name", "Foster"))).data();

        assertEquals(1, hits.size());
        assertEquals(2, store.query("offices", List.of(QueryFilter.eq("status", "active"))).data().size());
    }

    @Test
    @DisplayName("Should not share nested state with callers")
    void deepCopies() {
        List<Object> specializations = new ArrayList<>(List.of("housing"));
        store.create("offices", doc("id", "A1", "specializations", specializations));

        specializations.add("mutated");
        @SuppressWarnings("unchecked")
        List<Object> read = (List<Object>) store.get("offices", "A1").data().get("specializations");
        read.add("also mutated");

        assertEquals(List.of("housing"), store.get("offices", "A1").data().get("specializations"));
    }
}
