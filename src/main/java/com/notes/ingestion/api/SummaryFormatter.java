package com.notes.ingestion.api;

import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.store.Stored;
import com.notes.ingestion.workforce.WorkforceUpdate;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the one-line recap returned with every processed note.
 */
final class SummaryFormatter {

    static final String NOTHING_CREATED = "No entities created - no relevant data found in text";

    private SummaryFormatter() {
    }

    static String format(EntitiesCreated created, List<WorkforceUpdate> workforceUpdates) {
        List<String> parts = new ArrayList<>();
        if (!created.offices().isEmpty()) {
            parts.add(created.offices().size() + " office(s) created: " + describe(created.offices()));
        }
        if (!created.mergedOffices().isEmpty()) {
            parts.add(created.mergedOffices().size() + " office(s) merged (already existing): "
                    + describe(created.mergedOffices()));
        }
        if (!created.projects().isEmpty()) {
            parts.add(created.projects().size() + " project(s) created");
        }
        if (!created.regulations().isEmpty()) {
            parts.add(created.regulations().size() + " regulation(s) created");
        }

        List<WorkforceUpdate> changed = workforceUpdates.stream().filter(WorkforceUpdate::hasChanges).toList();
        if (!changed.isEmpty()) {
            changed.forEach(update -> parts.add(describe(update)));
        } else if (!created.workforce().isEmpty()) {
            parts.add(created.workforce().size() + " workforce record(s) created");
        }

        if (parts.isEmpty()) {
            return NOTHING_CREATED;
        }
        String summary = "Successfully created: " + String.join(", ", parts);
        long local = created.localCount();
        return local > 0 ? summary + " (" + local + " saved locally, store unavailable)" : summary;
    }

    private static String describe(List<Stored<Office>> offices) {
        return offices.stream()
                .map(Stored::entity)
                .map(office -> office.name() != null && office.id() != null
                        ? office.name() + " (" + office.id() + ")"
                        : office.name() != null ? office.name() : office.id())
                .collect(Collectors.joining(", "));
    }

    private static String describe(WorkforceUpdate update) {
        List<String> messages = new ArrayList<>();
        if (update.employeesAdded() > 0) {
            messages.add(update.employeesAdded() + " new employee(s) added");
        }
        if (update.employeesUpdated() > 0) {
            messages.add(update.employeesUpdated() + " employee(s) updated");
        }
        return "Updated " + update.officeName() + ": " + String.join(", ", messages)
                + ". Total employees: " + update.totalEmployees();
    }
}
