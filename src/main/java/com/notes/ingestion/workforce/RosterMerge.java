package com.notes.ingestion.workforce;

import com.notes.ingestion.core.model.Employee;
import com.notes.ingestion.core.model.EmployeeDistribution;
import com.notes.ingestion.core.model.Values;
import com.notes.ingestion.core.model.Workforce;
import com.notes.ingestion.core.model.WorkforceAggregate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds newly mentioned employees into a roster. Counts reflect the most recent {@link #applyTo} call,
 * so the merge can be re-applied after a version conflict.
 */
class RosterMerge {

    private final List<Employee> incoming;
    private final EmployeeDistribution distribution;
    private int added;
    private int updated;

    RosterMerge(List<Employee> incoming, EmployeeDistribution distribution) {
        this.incoming = incoming;
        this.distribution = distribution;
    }

    Workforce applyTo(Workforce workforce) {
        added = 0;
        updated = 0;
        Map<String, Employee> roster = new LinkedHashMap<>();
        for (Employee employee : workforce.employees()) {
            if (!employee.key().isEmpty()) {
                roster.merge(employee.key(), employee, Employee::absorb);
            }
        }
        for (Employee employee : incoming) {
            if (!Values.hasText(employee.name())) {
                continue;
            }
            Employee named = new Employee(employee.name().trim(), employee.description(), employee.role(),
                    employee.expertise(), employee.location());
            Employee existing = roster.get(named.key());
            if (existing != null) {
                roster.put(named.key(), existing.absorb(named));
                updated++;
            } else {
                roster.put(named.key(), named);
                added++;
            }
        }

        Workforce merged = workforce.withEmployees(new ArrayList<>(roster.values()));
        if (distribution != null && distribution.hasAnyCount()) {
            merged = merged.withAggregate(WorkforceAggregate.of(merged.distinctEmployeeCount(), distribution));
        }
        return merged;
    }

    int added() {
        return added;
    }

    int updated() {
        return updated;
    }
}
