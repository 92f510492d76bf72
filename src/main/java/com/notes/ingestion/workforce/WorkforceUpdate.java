package com.notes.ingestion.workforce;

/**
 * Roster delta for one office, as reported in the processing result.
 */
public record WorkforceUpdate(String officeId, String officeName, int employeesAdded, int employeesUpdated,
                              int totalEmployees) {

    public boolean hasChanges() {
        return employeesAdded > 0 || employeesUpdated > 0;
    }
}
