package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OfficeLocation(Place headquarters, List<Place> otherOffices) {

    public OfficeLocation {
        otherOffices = Values.cleanList(otherOffices);
    }

    public static OfficeLocation headquarteredIn(String city, String country) {
        return new OfficeLocation(Place.of(city, country), List.of());
    }

    public OfficeLocation withHeadquarters(Place place) {
        return new OfficeLocation(place, otherOffices);
    }

    public boolean hasHeadquarters() {
        return headquarters != null && headquarters.hasCityAndCountry();
    }
}
