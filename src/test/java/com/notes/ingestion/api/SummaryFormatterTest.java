package com.notes.ingestion.api;

import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.Project;
import com.notes.ingestion.core.model.Workforce;
import com.notes.ingestion.store.Stored;
import com.notes.ingestion.workforce.WorkforceUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SummaryFormatter Tests")
class SummaryFormatterTest {

    private static Stored<Office> office(String id, String name) {
        return Stored.persisted(Office.builder().id(id).name(name).build());
    }

    @Test
    @DisplayName("Nothing created")
    void nothingCreated() {
        assertEquals(SummaryFormatter.NOTHING_CREATED, SummaryFormatter.format(EntitiesCreated.empty(), List.of()));
    }

    @Test
    @DisplayName("Created and merged offices are listed by name and id")
    void offices() {
        EntitiesCreated created = new EntitiesCreated(
                List.of(office("UKLD123", "Foster + Partners")),
                List.of(Stored.persisted(Project.builder().projectName("Apple Park").build())),
                List.of(), List.of(),
                List.of(office("SPBA001", "Boris Pena Architecture")));

        assertEquals("Successfully created: 1 office(s) created: Foster + Partners (UKLD123), "
                        + "1 office(s) merged (already existing): Boris Pena Architecture (SPBA001), "
                        + "1 project(s) created",
                SummaryFormatter.format(created, List.of()));
    }

    @Test
    @DisplayName("Workforce changes replace the record count")
    void workforce() {
        EntitiesCreated created = new EntitiesCreated(List.of(), List.of(), List.of(),
                List.of(Stored.persisted(Workforce.emptyFor("UKLD123", "Foster + Partners"))), List.of());

        assertEquals("Successfully created: Updated Foster + Partners: 1 new employee(s) added, "
                        + "2 employee(s) updated. Total employees: 5",
                SummaryFormatter.format(created,
                        List.of(new WorkforceUpdate("UKLD123", "Foster + Partners", 1, 2, 5))));
        assertEquals("Successfully created: 1 workforce record(s) created",
                SummaryFormatter.format(created,
                        List.of(new WorkforceUpdate("UKLD123", "Foster + Partners", 0, 0, 5))));
    }

    @Test
    @DisplayName("Locally kept entities are reported")
    void localSuffix() {
        EntitiesCreated created = new EntitiesCreated(
                List.of(Stored.local(Office.builder().id("FOXX000").name("Foster + Partners").build(), "down")),
                List.of(), List.of(), List.of(), List.of());

        assertEquals("Successfully created: 1 office(s) created: Foster + Partners (FOXX000) "
                + "(1 saved locally, store unavailable)", SummaryFormatter.format(created, List.of()));
    }
}
