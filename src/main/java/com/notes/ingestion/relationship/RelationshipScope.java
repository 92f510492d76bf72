package com.notes.ingestion.relationship;

import com.notes.ingestion.core.model.Place;

/**
 * How close two entities must be located for a link to be proposed.
 */
public enum RelationshipScope {
    /** Same city or same country. */
    CITY_OR_COUNTRY,
    /** Same city only. */
    CITY_ONLY,
    /** Never link. */
    DISABLED;

    public boolean accepts(Place a, Place b) {
        if (a == null || b == null) {
            return false;
        }
        boolean sameCity = a.sameCity(b.city());
        return switch (this) {
            case CITY_OR_COUNTRY -> sameCity || a.sameCountry(b.country());
            case CITY_ONLY -> sameCity;
            case DISABLED -> false;
        };
    }
}
