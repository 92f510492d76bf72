package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A named person on an office roster. The roster key is the lower-cased, trimmed name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "description", "role", "expertise", "location"})
public record Employee(String name, String description, String role, List<String> expertise, Place location) {

    public Employee {
        expertise = Values.cleanList(expertise);
    }

    public static Employee named(String name) {
        return new Employee(name, null, null, List.of(), null);
    }

    public String key() {
        return Values.normalizeKey(name);
    }

    /**
     * Folds a newer mention of the same person into this one: expertise is unioned, and a
     * non-empty description, role or location from {@code newer} replaces the current value.
     */
    public Employee absorb(Employee newer) {
        return new Employee(
                name,
                Values.firstText(newer.description, description),
                Values.firstText(newer.role, role),
                Values.union(expertise, newer.expertise),
                hasLocation(newer.location) ? newer.location : location);
    }

    private static boolean hasLocation(Place place) {
        return place != null && (Values.hasText(place.city()) || Values.hasText(place.country()));
    }
}
