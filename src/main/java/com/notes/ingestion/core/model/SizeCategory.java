package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Office size bands derived from headcount.
 */
public enum SizeCategory {
    BOUTIQUE, MEDIUM, LARGE, GLOBAL;

    /**
     * Band for a distinct-employee headcount: under 10 boutique, under 50 medium,
     * under 200 large, otherwise global.
     */
    public static SizeCategory forHeadcount(int headcount) {
        if (headcount < 10) {
            return BOUTIQUE;
        }
        if (headcount < 50) {
            return MEDIUM;
        }
        if (headcount < 200) {
            return LARGE;
        }
        return GLOBAL;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used when reading oracle output; unknown values map to {@code null}.
     */
    @JsonCreator
    public static SizeCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SizeCategory candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
