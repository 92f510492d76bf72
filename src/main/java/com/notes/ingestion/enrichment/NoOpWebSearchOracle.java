package com.notes.ingestion.enrichment;

import java.util.Optional;

public class NoOpWebSearchOracle implements WebSearchOracle {

    @Override
    public Optional<LocationSearchResult> searchOfficeLocation(String officeName) {
        return Optional.empty();
    }
}
