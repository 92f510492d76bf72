package com.notes.ingestion.extraction;

import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.Project;
import com.notes.ingestion.core.model.Regulation;
import com.notes.ingestion.core.model.Values;

import java.util.List;

/**
 * Candidates found in one note, grouped by kind.
 */
public record ExtractedEntities(List<Office> offices, List<Project> projects, List<Regulation> regulations) {

    public ExtractedEntities {
        offices = Values.cleanList(offices);
        projects = Values.cleanList(projects);
        regulations = Values.cleanList(regulations);
    }

    public static ExtractedEntities none() {
        return new ExtractedEntities(List.of(), List.of(), List.of());
    }

    public static ExtractedEntities ofOffice(Office office) {
        return new ExtractedEntities(List.of(office), List.of(), List.of());
    }

    public static ExtractedEntities ofProject(Project project) {
        return new ExtractedEntities(List.of(), List.of(project), List.of());
    }

    public static ExtractedEntities ofRegulation(Regulation regulation) {
        return new ExtractedEntities(List.of(), List.of(), List.of(regulation));
    }

    public ExtractedEntities withOffices(List<Office> replacement) {
        return new ExtractedEntities(replacement, projects, regulations);
    }

    public int size() {
        return offices.size() + projects.size() + regulations.size();
    }
}
