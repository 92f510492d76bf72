package com.notes.ingestion.identity;

import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentifierSynthesizer Tests")
class IdentifierSynthesizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    /** Always draws zero, so generated ids are predictable. */
    private static final class ZeroRandom extends Random {
        @Override
        public int nextInt(int bound) {
            return 0;
        }
    }

    private EntityRepository repository;

    @BeforeEach
    void setUp() {
        repository = new EntityRepository(new InMemoryDocumentStore());
    }

    private static Office candidate(String id, String city, String country) {
        return Office.builder().id(id).name("Foster + Partners").headquarters(city, country).build();
    }

    @Nested
    @DisplayName("Office ids")
    class OfficeIds {

        @Test
        @DisplayName("Should derive country, city and three digits")
        void derivedFormat() {
            IdentifierSynthesizer identifiers = new IdentifierSynthesizer(repository, 3);

            String id = identifiers.officeId(candidate(null, "London", "United Kingdom"));

            assertTrue(id.matches("UKLD\\d{3}"), id);
        }

        @Test
        @DisplayName("Unknown places fall back to their first letters")
        void unknownPlace() {
            IdentifierSynthesizer identifiers = new IdentifierSynthesizer(repository, new ZeroRandom(), CLOCK, 3);

            assertEquals("PORO000", identifiers.officeId(candidate(null, "Rotterdam", "Portugal")));
        }

        @Test
        @DisplayName("Should keep a usable supplied id")
        void keepsSuppliedId() {
            IdentifierSynthesizer identifiers = new IdentifierSynthesizer(repository, 3);

            assertEquals("UKLD042", identifiers.officeId(candidate("UKLD042", "London", "United Kingdom")));
        }

        @Test
        @DisplayName("Placeholder ids are replaced")
        void placeholderReplaced() {
            IdentifierSynthesizer identifiers = new IdentifierSynthesizer(repository, new ZeroRandom(), CLOCK, 3);

            assertEquals("UKLD000", identifiers.officeId(candidate("UKXX123", "London", "UK")));
            assertFalse(IdentifierSynthesizer.isUsableId("NO_LOCATION_DATA"));
            assertFalse(IdentifierSynthesizer.isUsableId(" "));
        }

        @Test
        @DisplayName("Without a headquarters the name-based fallback form is used")
        void fallbackForm() {
            IdentifierSynthesizer identifiers = new IdentifierSynthesizer(repository, new ZeroRandom(), CLOCK, 3);

            assertEquals("FOXX000", identifiers.officeId(Office.builder().name("Foster + Partners").build()));
            assertEquals("FOXX000", identifiers.fallbackOfficeId("Foster + Partners"));
        }

        @Test
        @DisplayName("Should widen the suffix after repeated collisions")
        void collisionWidening() {
            repository.create(candidate("UKLD000", "London", "UK"), Office.class);
            IdentifierSynthesizer identifiers = new IdentifierSynthesizer(repository, new ZeroRandom(), CLOCK, 2);

            assertEquals("UKLD0000", identifiers.officeId(candidate(null, "London", "UK")));
        }

        @Test
        @DisplayName("A supplied id that is taken is not reused")
        void suppliedIdTaken() {
            repository.create(candidate("UKLD042", "London", "UK"), Office.class);
            IdentifierSynthesizer identifiers = new IdentifierSynthesizer(repository, new ZeroRandom(), CLOCK, 3);

            assertEquals("UKLD000", identifiers.officeId(candidate("UKLD042", "London", "UK")));
        }
    }

    @Test
    @DisplayName("Local project and regulation ids carry the clock and four digits")
    void localIds() {
        IdentifierSynthesizer identifiers = new IdentifierSynthesizer(repository, new ZeroRandom(), CLOCK, 3);
        long millis = CLOCK.millis();

        assertEquals("project-" + millis + "-0000", identifiers.localProjectId());
        assertEquals("regulation-" + millis + "-0000", identifiers.localRegulationId());
    }

    @Test
    @DisplayName("Collision retries must be at least one")
    void invalidRetries() {
        assertThrows(IllegalArgumentException.class, () -> new IdentifierSynthesizer(repository, 0));
    }

    @Test
    @DisplayName("Location codes")
    void locationCodes() {
        assertEquals("UK", LocationCodes.countryCode(" United Kingdom "));
        assertEquals("SP", LocationCodes.countryCode("Spain"));
        assertEquals("NY", LocationCodes.cityCode("New York"));
        assertEquals("XX", LocationCodes.cityCode(null));
        assertEquals("FOST", LocationCodes.compact("Foster + Partners", 4));
        assertTrue(LocationCodes.placeNames().contains("london"));
        assertFalse(LocationCodes.placeNames().contains("uk"));
    }
}
