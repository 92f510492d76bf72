package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A city/country pair. Either part may be absent on extracted candidates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Place(String city, String country) {

    public static final String UNKNOWN = "Unknown";

    public static Place of(String city, String country) {
        return new Place(city, country);
    }

    public static Place unknown() {
        return new Place(UNKNOWN, UNKNOWN);
    }

    public boolean hasCity() {
        return Values.isKnown(city);
    }

    public boolean hasCountry() {
        return Values.isKnown(country);
    }

    public boolean hasCityAndCountry() {
        return hasCity() && hasCountry();
    }

    public boolean sameCity(String otherCity) {
        return hasCity() && Values.equalsIgnoreCase(city, otherCity);
    }

    public boolean sameCountry(String otherCountry) {
        return hasCountry() && Values.equalsIgnoreCase(country, otherCountry);
    }

    /**
     * Shallow merge: incoming parts win, absent parts are kept from this place.
     */
    public Place overlay(Place incoming) {
        if (incoming == null) {
            return this;
        }
        return new Place(
                Values.firstText(incoming.city, city),
                Values.firstText(incoming.country, country));
    }
}
