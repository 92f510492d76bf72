package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Roster of one office. The id is always derived from the office id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Workforce(
        String id,
        String officeId,
        String officeName,
        List<Employee> employees,
        WorkforceAggregate aggregate,
        Instant createdAt,
        Instant updatedAt,
        Long version
) implements DomainEntity {

    private static final String ID_PREFIX = "WF-";

    public Workforce {
        employees = Values.cleanList(employees);
    }

    public static String idFor(String officeId) {
        return ID_PREFIX + officeId;
    }

    public static Workforce emptyFor(String officeId, String officeName) {
        return new Workforce(idFor(officeId), officeId, officeName, List.of(), null, null, null, null);
    }

    public Workforce withEmployees(List<Employee> roster) {
        return new Workforce(id, officeId, officeName, roster, aggregate, createdAt, updatedAt, version);
    }

    public Workforce withAggregate(WorkforceAggregate newAggregate) {
        return new Workforce(id, officeId, officeName, employees, newAggregate, createdAt, updatedAt, version);
    }

    public int distinctEmployeeCount() {
        return (int) employees.stream()
                .map(Employee::key)
                .filter(key -> !key.isEmpty())
                .distinct()
                .count();
    }

    @Override
    public EntityKind kind() {
        return EntityKind.WORKFORCE;
    }

    @Override
    public String displayName() {
        return officeName != null ? officeName : officeId;
    }
}
