package com.notes.ingestion.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Small helpers shared by the model records and the pipeline stages.
 */
public final class Values {

    private Values() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * True when the value is present and is not the "Unknown" placeholder used by
     * fallback records.
     */
    public static boolean isKnown(String value) {
        return hasText(value) && !Place.UNKNOWN.equalsIgnoreCase(value.trim());
    }

    public static String normalizeKey(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean equalsIgnoreCase(String a, String b) {
        return hasText(a) && hasText(b) && a.trim().equalsIgnoreCase(b.trim());
    }

    /**
     * Copies a list dropping null elements. A null list becomes an empty list.
     */
    public static <T> List<T> cleanList(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Union keeping the order of {@code existing} followed by new values of {@code incoming}.
     * Duplicates are compared case-sensitively.
     */
    public static <T> List<T> union(List<T> existing, List<T> incoming) {
        LinkedHashSet<T> merged = new LinkedHashSet<>(cleanList(existing));
        merged.addAll(cleanList(incoming));
        return List.copyOf(new ArrayList<>(merged));
    }

    public static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    public static String firstText(String preferred, String fallback) {
        return hasText(preferred) ? preferred : fallback;
    }
}
