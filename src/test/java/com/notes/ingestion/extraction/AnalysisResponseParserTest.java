package com.notes.ingestion.extraction;

import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.OfficeStatus;
import com.notes.ingestion.core.model.Regulation;
import com.notes.ingestion.core.model.SizeCategory;
import com.notes.ingestion.satellite.SatelliteKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalysisResponseParser Tests")
class AnalysisResponseParserTest {

    private final AnalysisResponseParser parser = new AnalysisResponseParser();

    private static final String OFFICE_RESPONSE = """
            Here is the analysis:
            {
              "categorization": {"category": "office", "confidence": 0.93, "reasoning": "Describes a firm"},
              "extraction": {
                "extractedData": {
                  "name": "Foster + Partners",
                  "founded": 1967,
                  "status": "Active",
                  "location": {"headquarters": {"city": "London", "country": "United Kingdom"}},
                  "size": {"sizeCategory": "global", "employeeCount": 1500},
                  "specializations": ["airports", "towers"]
                },
                "missingFields": ["website"],
                "employees": ["Norman Foster", {"name": "Ana", "role": "Partner", "expertise": ["facades"]}],
                "employeeDistribution": {"architects": 10, "engineers": 2},
                "technology": [{"technologyName": "Rhino", "officeId": "UKLD123"}],
                "clients": {"clientName": "Apple"},
                "newsArticles": "not a record"
              }
            }
            Let me know if you need more.
            """;

    @Nested
    @DisplayName("Office answers")
    class OfficeAnswers {

        @Test
        @DisplayName("Should read category and office fields from a wrapped answer")
        void officeFields() {
            ExtractionResult result = parser.parse(OFFICE_RESPONSE);

            assertEquals(NoteCategory.OFFICE, result.category());
            assertEquals(0.93, result.confidence(), 1e-9);
            assertEquals(List.of("website"), result.missingFields());

            Office office = result.entities().offices().get(0);
            assertEquals("Foster + Partners", office.name());
            assertEquals(OfficeStatus.ACTIVE, office.status());
            assertEquals("London", office.headquarters().city());
            assertEquals(SizeCategory.GLOBAL, office.size().sizeCategory());
            assertTrue(result.entities().projects().isEmpty());
        }

        @Test
        @DisplayName("Should accept employees as names or objects")
        void employees() {
            ExtractionResult result = parser.parse(OFFICE_RESPONSE);

            assertEquals(2, result.employees().size());
            assertEquals("Norman Foster", result.employees().get(0).name());
            assertEquals("Partner", result.employees().get(1).role());
            assertEquals(10, result.employeeDistribution().architects());
        }

        @Test
        @DisplayName("Should collect satellites from arrays and single objects")
        void satellites() {
            ExtractionResult result = parser.parse(OFFICE_RESPONSE);

            assertEquals("Rhino", result.satellites().get(SatelliteKind.TECHNOLOGY).get(0).get("technologyName"));
            assertEquals(1, result.satellites().get(SatelliteKind.CLIENT).size());
            assertFalse(result.satellites().containsKey(SatelliteKind.NEWS_ARTICLES));
        }
    }

    @Test
    @DisplayName("Store-managed fields in the answer are ignored")
    void storeFieldsStripped() {
        String response = """
                {"categorization": {"category": "regulation", "confidence": 0.8},
                 "extraction": {"extractedData": {
                    "name": "London Plan", "version": "2021 edition", "createdAt": "yesterday",
                    "jurisdiction": {"level": "city", "cityName": "London", "countryName": "United Kingdom"},
                    "effectiveDate": "2021-03-02"}}}
                """;

        Regulation regulation = parser.parse(response).entities().regulations().get(0);

        assertEquals("London Plan", regulation.name());
        assertNull(regulation.version());
        assertNull(regulation.createdAt());
        assertEquals("London", regulation.jurisdiction().cityName());
    }

    @Test
    @DisplayName("Unknown category yields no candidates")
    void unknownCategory() {
        ExtractionResult result = parser.parse("""
                {"categorization": {"category": "unknown"}, "extraction": {"extractedData": {"name": "x"}}}
                """);

        assertEquals(NoteCategory.UNKNOWN, result.category());
        assertEquals(0, result.entities().size());
    }

    @Nested
    @DisplayName("Unusable answers")
    class UnusableAnswers {

        @Test
        @DisplayName("No JSON is an extraction failure")
        void noJson() {
            assertThrows(ExtractionException.class, () -> parser.parse("I cannot help with that"));
            assertThrows(ExtractionException.class, () -> parser.parse(null));
        }

        @Test
        @DisplayName("Broken JSON is an extraction failure")
        void brokenJson() {
            assertThrows(ExtractionException.class, () -> parser.parse("{\"categorization\": {"));
        }

        @Test
        @DisplayName("A missing or invented category is an extraction failure")
        void badCategory() {
            assertThrows(ExtractionException.class, () -> parser.parse("{\"extraction\": {}}"));
            assertThrows(ExtractionException.class,
                    () -> parser.parse("{\"categorization\": {\"category\": \"person\"}}"));
        }

        @Test
        @DisplayName("A main record of the wrong shape is an extraction failure")
        void malformedRecord() {
            String response = """
                    {"categorization": {"category": "office"},
                     "extraction": {"extractedData": {"name": "Foster + Partners", "founded": "long ago"}}}
                    """;

            assertThrows(ExtractionException.class, () -> parser.parse(response));
        }
    }
}
