package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of records persisted by the pipeline, each stored in its own collection.
 */
public enum EntityKind {
    OFFICE("offices", "name"),
    PROJECT("projects", "projectName"),
    REGULATION("regulations", "name"),
    WORKFORCE("workforce", "officeId");

    private final String collection;
    private final String nameField;

    EntityKind(String collection, String nameField) {
        this.collection = collection;
        this.nameField = nameField;
    }

    public String collection() {
        return collection;
    }

    /**
     * Document field holding the canonical name used for exact-match lookups.
     */
    public String nameField() {
        return nameField;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EntityKind fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (EntityKind kind : values()) {
            if (kind.label().equalsIgnoreCase(label.trim())) {
                return kind;
            }
        }
        return null;
    }
}
