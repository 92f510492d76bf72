package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Where a regulation applies. {@code cityName} and {@code stateName} are only set for
 * sub-national regulations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Jurisdiction(JurisdictionLevel level, String cityName, String stateName, String countryName) {

    public Jurisdiction overlay(Jurisdiction incoming) {
        if (incoming == null) {
            return this;
        }
        return new Jurisdiction(
                Values.firstNonNull(incoming.level, level),
                Values.firstText(incoming.cityName, cityName),
                Values.firstText(incoming.stateName, stateName),
                Values.firstText(incoming.countryName, countryName));
    }
}
