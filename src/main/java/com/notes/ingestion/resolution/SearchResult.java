package com.notes.ingestion.resolution;

import com.notes.ingestion.core.model.DomainEntity;

/**
 * Outcome of looking a candidate up in its own collection.
 *
 * @param entity      the matched entity, {@code null} when nothing matched
 * @param similarity  1.0 for exact matches, the fuzzy score otherwise
 * @param matchType   how the match was made, {@code null} when nothing matched
 * @param matchedName the name (or variant) that produced the match
 */
public record SearchResult<T extends DomainEntity>(T entity, double similarity, MatchType matchType,
                                                   String matchedName) {

    public static <T extends DomainEntity> SearchResult<T> notFound() {
        return new SearchResult<>(null, 0.0, null, null);
    }

    public static <T extends DomainEntity> SearchResult<T> exact(T entity, MatchType type, String name) {
        return new SearchResult<>(entity, 1.0, type, name);
    }

    public boolean found() {
        return entity != null;
    }

    public ResolutionDecision decision() {
        return found() ? ResolutionDecision.MERGE : ResolutionDecision.CREATE;
    }
}
