package com.notes.ingestion.api;

import com.notes.ingestion.core.model.Relationship;
import com.notes.ingestion.extraction.NoteCategory;
import com.notes.ingestion.satellite.SatelliteKind;
import com.notes.ingestion.workforce.WorkforceUpdate;

import java.util.List;
import java.util.Map;

/**
 * What processing one note produced.
 *
 * @param success          false only when the note could not be analysed at all
 * @param noteId           id used for the note's log context and audit entries
 * @param category         category assigned by extraction, {@code null} on failure
 * @param entitiesCreated  created and merged entities
 * @param workforceUpdates roster deltas, one per office whose roster changed
 * @param relationships    links newly stored for this note
 * @param satellitesSaved  saved auxiliary records per kind
 * @param summary          human-readable recap
 * @param totalCreated     {@link EntitiesCreated#total()}
 */
public record ProcessingResult(
        boolean success,
        String noteId,
        NoteCategory category,
        EntitiesCreated entitiesCreated,
        List<WorkforceUpdate> workforceUpdates,
        List<Relationship> relationships,
        Map<SatelliteKind, Integer> satellitesSaved,
        String summary,
        int totalCreated
) {
    public ProcessingResult {
        entitiesCreated = entitiesCreated != null ? entitiesCreated : EntitiesCreated.empty();
        workforceUpdates = workforceUpdates != null ? List.copyOf(workforceUpdates) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
        satellitesSaved = satellitesSaved != null ? Map.copyOf(satellitesSaved) : Map.of();
    }

    public static ProcessingResult failure(String noteId, String summary) {
        return new ProcessingResult(false, noteId, null, EntitiesCreated.empty(), List.of(), List.of(), Map.of(),
                summary, 0);
    }
}
