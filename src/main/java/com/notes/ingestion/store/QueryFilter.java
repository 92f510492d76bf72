package com.notes.ingestion.store;

import java.util.Map;
import java.util.Objects;

/**
 * Equality filter on a top-level document field.
 */
public record QueryFilter(String field, Object value) {

    public QueryFilter {
        Objects.requireNonNull(field, "field is required");
    }

    public static QueryFilter eq(String field, Object value) {
        return new QueryFilter(field, value);
    }

    public boolean matches(Map<String, Object> document) {
        return Objects.equals(document.get(field), value);
    }
}
