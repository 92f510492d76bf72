package com.notes.ingestion.enrichment;

import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.OfficeLocation;
import com.notes.ingestion.core.model.Place;
import com.notes.ingestion.core.model.Values;
import com.notes.ingestion.identity.IdentifierSynthesizer;
import com.notes.ingestion.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fills in missing headquarters for office candidates by asking a {@link WebSearchOracle}.
 *
 * <p>An office is looked up only when it has a name, lacks a headquarters city or country, and the
 * note text does not already place it. Lookups are best effort: any failure leaves the candidate
 * unchanged.</p>
 */
public class EnrichmentResolver {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentResolver.class);

    public static final String OUTCOME_FOUND = "found";
    public static final String OUTCOME_NOT_FOUND = "not_found";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_DECLINED = "declined";

    private final WebSearchOracle searchOracle;
    private final LocationTextScanner scanner;
    private final IdentifierSynthesizer identifiers;
    private final SearchConsent consent;
    private final MetricsService metrics;

    public EnrichmentResolver(WebSearchOracle searchOracle, LocationTextScanner scanner,
                              IdentifierSynthesizer identifiers, SearchConsent consent,
                              MetricsService metrics) {
        this.searchOracle = searchOracle;
        this.scanner = scanner;
        this.identifiers = identifiers;
        this.consent = consent;
        this.metrics = metrics;
    }

    /**
     * Returns the candidates in the same order, enriched where a lookup succeeded.
     */
    public List<Office> enrich(List<Office> candidates, String noteText) {
        List<String> toSearch = candidates.stream()
                .filter(office -> needsLookup(office, noteText))
                .map(Office::name)
                .toList();
        if (toSearch.isEmpty()) {
            return candidates;
        }
        if (!consent.allowSearch(toSearch)) {
            log.info("Web search declined for {} office(s)", toSearch.size());
            metrics.recordEnrichmentLookup(OUTCOME_DECLINED);
            return candidates;
        }

        List<Office> enriched = new ArrayList<>(candidates.size());
        for (Office candidate : candidates) {
            enriched.add(toSearch.contains(candidate.name()) ? lookup(candidate) : candidate);
        }
        return enriched;
    }

    boolean needsLookup(Office office, String noteText) {
        if (!Values.hasText(office.name())) {
            return false;
        }
        Place hq = office.headquarters();
        if (hq != null && hq.hasCityAndCountry()) {
            return false;
        }
        return !scanner.mentionsLocation(noteText, office.name());
    }

    private Office lookup(Office candidate) {
        Optional<LocationSearchResult> found;
        try {
            found = searchOracle.searchOfficeLocation(candidate.name());
        } catch (RuntimeException e) {
            log.warn("Location lookup failed for '{}': {}", candidate.name(), e.getMessage());
            metrics.recordEnrichmentLookup(OUTCOME_FAILED);
            return candidate;
        }
        if (found.isEmpty() || !found.get().hasLocation()) {
            log.debug("No location found for '{}'", candidate.name());
            metrics.recordEnrichmentLookup(OUTCOME_NOT_FOUND);
            return candidate;
        }
        metrics.recordEnrichmentLookup(OUTCOME_FOUND);
        return apply(candidate, found.get());
    }

    private Office apply(Office candidate, LocationSearchResult info) {
        Place existing = candidate.headquarters();
        String city = existing != null && existing.hasCity() ? existing.city() : known(info.city());
        String country = existing != null && existing.hasCountry() ? existing.country() : known(info.country());
        Place hq = Place.of(city, country);

        OfficeLocation location = candidate.location() != null
                ? candidate.location().withHeadquarters(hq)
                : new OfficeLocation(hq, List.of());
        Office.Builder builder = candidate.toBuilder().location(location);
        if (!Values.hasText(candidate.website()) && Values.isKnown(info.website())) {
            builder.website(info.website());
        }
        Office enriched = builder.build();

        if (hq.hasCityAndCountry()) {
            enriched = enriched.toBuilder().id(identifiers.officeId(enriched)).build();
        }
        log.info("Enriched '{}' with headquarters {}, {}", candidate.name(), hq.city(), hq.country());
        return enriched;
    }

    private static String known(String value) {
        return Values.isKnown(value) ? value : null;
    }
}
