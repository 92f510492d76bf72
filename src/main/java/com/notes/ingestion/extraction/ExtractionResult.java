package com.notes.ingestion.extraction;

import com.notes.ingestion.core.model.Employee;
import com.notes.ingestion.core.model.EmployeeDistribution;
import com.notes.ingestion.core.model.Values;
import com.notes.ingestion.satellite.SatelliteKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured answer of the extraction oracle.
 *
 * @param category              sole categorisation of the note
 * @param confidence            categorisation confidence, 0.0 to 1.0
 * @param reasoning             the oracle's explanation of the category
 * @param entities              candidates of the category (at most one kind is filled by the oracle)
 * @param missingFields         fields the oracle could not find in the text
 * @param employees             named people mentioned in the note, independent of the category
 * @param employeeDistribution  headcount split by discipline, or {@code null}
 * @param satellites            auxiliary records keyed by kind
 */
public record ExtractionResult(
        NoteCategory category,
        double confidence,
        String reasoning,
        ExtractedEntities entities,
        List<String> missingFields,
        List<Employee> employees,
        EmployeeDistribution employeeDistribution,
        Map<SatelliteKind, List<Map<String, Object>>> satellites
) {
    public ExtractionResult {
        Objects.requireNonNull(category, "category is required");
        entities = entities != null ? entities : ExtractedEntities.none();
        missingFields = Values.cleanList(missingFields);
        employees = Values.cleanList(employees);
        satellites = satellites == null || satellites.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(satellites));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .category(category)
                .confidence(confidence)
                .reasoning(reasoning)
                .entities(entities)
                .missingFields(missingFields)
                .employees(employees)
                .employeeDistribution(employeeDistribution)
                .satellites(satellites);
    }

    public static class Builder {
        private NoteCategory category;
        private double confidence;
        private String reasoning;
        private ExtractedEntities entities;
        private List<String> missingFields;
        private List<Employee> employees;
        private EmployeeDistribution employeeDistribution;
        private Map<SatelliteKind, List<Map<String, Object>>> satellites;

        public Builder category(NoteCategory category) {
            this.category = category;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder entities(ExtractedEntities entities) {
            this.entities = entities;
            return this;
        }

        public Builder missingFields(List<String> missingFields) {
            this.missingFields = missingFields;
            return this;
        }

        public Builder employees(List<Employee> employees) {
            this.employees = employees;
            return this;
        }

        public Builder employeeDistribution(EmployeeDistribution employeeDistribution) {
            this.employeeDistribution = employeeDistribution;
            return this;
        }

        public Builder satellites(Map<SatelliteKind, List<Map<String, Object>>> satellites) {
            this.satellites = satellites;
            return this;
        }

        public ExtractionResult build() {
            return new ExtractionResult(category, confidence, reasoning, entities, missingFields,
                    employees, employeeDistribution, satellites);
        }
    }
}
