package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of an office.
 */
public enum OfficeStatus {
    ACTIVE, ACQUIRED, DISSOLVED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used when reading oracle output; unknown values map to {@code null}.
     */
    @JsonCreator
    public static OfficeStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (OfficeStatus candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
