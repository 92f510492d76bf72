package com.notes.ingestion.merge;

import com.notes.ingestion.core.model.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Applies the per-field merge rules and remembers which fields changed.
 */
final class FieldMerger {

    private final List<String> changed = new ArrayList<>();

    /**
     * Incoming wins when present and different. Blank strings count as absent.
     */
    <V> V scalar(String field, V existing, V incoming) {
        if (incoming == null || (incoming instanceof String s && !Values.hasText(s))) {
            return existing;
        }
        if (!incoming.equals(existing)) {
            changed.add(field);
            return incoming;
        }
        return existing;
    }

    /**
     * Appends incoming values not already present, compared case-sensitively.
     */
    <V> List<V> union(String field, List<V> existing, List<V> incoming) {
        List<V> merged = Values.union(existing, incoming);
        if (merged.size() != Values.cleanList(existing).size()) {
            changed.add(field);
        }
        return merged;
    }

    /**
     * Shallow merge of a nested object: incoming sub-fields override, absent ones are kept.
     */
    <V> V nested(String field, V existing, V incoming, BinaryOperator<V> overlay) {
        if (incoming == null) {
            return existing;
        }
        V merged = existing == null ? incoming : overlay.apply(existing, incoming);
        if (!Objects.equals(merged, existing)) {
            changed.add(field);
        }
        return merged;
    }

    List<String> changedFields() {
        return List.copyOf(changed);
    }
}
