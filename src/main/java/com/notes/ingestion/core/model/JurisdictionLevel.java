package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JurisdictionLevel {
    CITY, STATE, COUNTRY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JurisdictionLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (JurisdictionLevel candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
