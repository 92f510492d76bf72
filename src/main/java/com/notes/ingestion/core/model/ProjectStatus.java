package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Delivery stage of a project.
 */
public enum ProjectStatus {
    CONCEPT, PLANNING, CONSTRUCTION, COMPLETED;

    /**
     * Planning and construction count towards an office's active projects.
     */
    public boolean isActive() {
        return this == PLANNING || this == CONSTRUCTION;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProjectStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ProjectStatus candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
