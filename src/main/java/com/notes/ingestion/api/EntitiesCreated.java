package com.notes.ingestion.api;

import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.Project;
import com.notes.ingestion.core.model.Regulation;
import com.notes.ingestion.core.model.Workforce;
import com.notes.ingestion.store.Stored;

import java.util.List;
import java.util.stream.Stream;

/**
 * Entities a note produced, each tagged with whether it reached the store.
 * Projects and regulations include merged ones, as only offices are reported separately when merged.
 */
public record EntitiesCreated(
        List<Stored<Office>> offices,
        List<Stored<Project>> projects,
        List<Stored<Regulation>> regulations,
        List<Stored<Workforce>> workforce,
        List<Stored<Office>> mergedOffices
) {
    public EntitiesCreated {
        offices = List.copyOf(offices);
        projects = List.copyOf(projects);
        regulations = List.copyOf(regulations);
        workforce = List.copyOf(workforce);
        mergedOffices = List.copyOf(mergedOffices);
    }

    public static EntitiesCreated empty() {
        return new EntitiesCreated(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public int total() {
        return offices.size() + projects.size() + regulations.size() + workforce.size() + mergedOffices.size();
    }

    /**
     * Number of entities built locally after a failed store write.
     */
    public long localCount() {
        return Stream.of(offices, projects, regulations, workforce, mergedOffices)
                .flatMap(List::stream)
                .filter(stored -> !stored.isPersisted())
                .count();
    }
}
