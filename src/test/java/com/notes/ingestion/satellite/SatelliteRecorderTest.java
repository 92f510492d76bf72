package com.notes.ingestion.satellite;

import com.notes.ingestion.audit.AuditAction;
import com.notes.ingestion.audit.AuditService;
import com.notes.ingestion.identity.IdentifierSynthesizer;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SatelliteRecorder Tests")
class SatelliteRecorderTest {

    private InMemoryDocumentStore store;
    private AuditService auditService;
    private SatelliteRecorder recorder;
    private IdentifierSynthesizer identifiers;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        EntityRepository repository = new EntityRepository(store);
        identifiers = new IdentifierSynthesizer(repository, new Random(7),
                Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC), 3);
        auditService = new AuditService();
        recorder = new SatelliteRecorder(repository, identifiers, auditService);
    }

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        @DisplayName("Client ids use the name and four digits")
        void clientId() {
            String id = SatelliteKind.CLIENT.synthesizeId(
                    new SatelliteFields(Map.of("clientName", "Apple")), identifiers);

            assertTrue(id.matches("CLI-APPL-\\d{4}"), id);
        }

        @Test
        @DisplayName("Keyed kinds derive their id from the owner")
        void keyedIds() {
            assertEquals("CITY-london", SatelliteKind.CITY_DATA.synthesizeId(
                    new SatelliteFields(Map.of("cityId", "london")), identifiers));
            assertEquals("STRUCT-UKLD123", SatelliteKind.COMPANY_STRUCTURE.synthesizeId(
                    new SatelliteFields(Map.of("officeId", "UKLD123")), identifiers));
            assertEquals("UKLD-DIV-ARC-2023", SatelliteKind.DIVISION_PERCENTAGES.synthesizeId(
                    new SatelliteFields(Map.of("officeId", "UKLD123", "divisionType", "architecture",
                            "period", Map.of("year", 2023))), identifiers));
        }

        @Test
        @DisplayName("Political context ids combine the jurisdiction parts")
        void politicalId() {
            String id = SatelliteKind.POLITICAL_CONTEXT.synthesizeId(new SatelliteFields(Map.of(
                    "jurisdiction", Map.of("country", "uk", "level", "city", "cityId", "london"))), identifiers);

            assertTrue(id.matches("POL-UKCLON-\\d{4}"), id);
        }

        @Test
        @DisplayName("Kinds are found by their extraction key")
        void fromKey() {
            assertEquals(SatelliteKind.SUPPLY_CHAIN, SatelliteKind.fromKey("supplyChain"));
            assertNull(SatelliteKind.fromKey("unknown"));
        }
    }

    @Nested
    @DisplayName("Saving")
    class Saving {

        @Test
        @DisplayName("Valid records are saved and audited, invalid ones skipped")
        void savesValidRecords() {
            Map<SatelliteKind, Integer> saved = recorder.record(Map.of(
                    SatelliteKind.CLIENT, List.of(Map.of("clientName", "Apple"), Map.of("industry", "tech")),
                    SatelliteKind.SUPPLY_CHAIN, List.of(Map.of("supplierName", "Permasteelisa"))),
                    null, "note-1");

            assertEquals(Map.of(SatelliteKind.CLIENT, 1, SatelliteKind.SUPPLY_CHAIN, 1), saved);
            assertEquals(1, store.count("clients"));
            assertEquals(2, auditService.getEntriesByAction(AuditAction.SATELLITE_SAVED).size());
            assertEquals("clients", auditService.getEntriesForNote("note-1").stream()
                    .filter(e -> e.entityId().startsWith("CLI-")).findFirst().orElseThrow().details().get("kind"));
        }

        @Test
        @DisplayName("Office-scoped records inherit the note's office")
        void inheritsOffice() {
            Map<SatelliteKind, Integer> saved = recorder.record(Map.of(
                    SatelliteKind.TECHNOLOGY, List.of(Map.of("technologyName", "Rhino"))), "UKLD123", "note-1");

            assertEquals(1, saved.get(SatelliteKind.TECHNOLOGY));
            Map<String, Object> stored = store.query("technology", List.of()).data().get(0);
            assertEquals("UKLD123", stored.get("officeId"));
        }

        @Test
        @DisplayName("Office-scoped records without an office are skipped")
        void noOffice() {
            Map<SatelliteKind, Integer> saved = recorder.record(Map.of(
                    SatelliteKind.TECHNOLOGY, List.of(Map.of("technologyName", "Rhino"))), null, "note-1");

            assertTrue(saved.isEmpty());
        }

        @Test
        @DisplayName("Clients never inherit an office id")
        void clientNotScoped() {
            recorder.record(Map.of(SatelliteKind.CLIENT, List.of(Map.of("clientName", "Apple"))), "UKLD123", "n");

            assertFalse(store.query("clients", List.of()).data().get(0).containsKey("officeId"));
        }

        @Test
        @DisplayName("Keyed records are updated when saved again")
        void keyedUpdate() {
            recorder.record(Map.of(SatelliteKind.CITY_DATA,
                    List.of(Map.of("cityId", "london", "population", 8_000_000))), null, "note-1");
            Map<SatelliteKind, Integer> saved = recorder.record(Map.of(SatelliteKind.CITY_DATA,
                    List.of(Map.of("cityId", "london", "population", 9_000_000))), null, "note-2");

            assertEquals(1, saved.get(SatelliteKind.CITY_DATA));
            Map<String, Object> stored = store.get("cityData", "CITY-london").data();
            assertEquals(9_000_000, ((Number) stored.get("population")).intValue());
            assertEquals(2L, ((Number) stored.get("version")).longValue());
        }
    }
}
