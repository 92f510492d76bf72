package com.notes.ingestion.enrichment;

import java.util.Optional;

/**
 * Looks up where an office is based. Best effort: an empty result is normal, and implementations
 * may throw when the backing service is down.
 */
public interface WebSearchOracle {

    Optional<LocationSearchResult> searchOfficeLocation(String officeName);
}
