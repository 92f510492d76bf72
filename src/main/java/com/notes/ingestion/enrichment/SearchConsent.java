package com.notes.ingestion.enrichment;

import java.util.List;

/**
 * Asked once per note before any web search is issued. Returning {@code false} skips enrichment for
 * that note.
 */
@FunctionalInterface
public interface SearchConsent {

    SearchConsent ALWAYS = officeNames -> true;

    SearchConsent NEVER = officeNames -> false;

    boolean allowSearch(List<String> officeNames);
}
