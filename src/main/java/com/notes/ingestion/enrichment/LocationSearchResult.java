package com.notes.ingestion.enrichment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.notes.ingestion.core.model.Values;

/**
 * What a web search found about an office. Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LocationSearchResult(String country, String city, String website, String description) {

    public boolean hasLocation() {
        return Values.isKnown(city) || Values.isKnown(country);
    }
}
