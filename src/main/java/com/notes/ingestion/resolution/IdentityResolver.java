package com.notes.ingestion.resolution;

import com.notes.ingestion.core.model.DomainEntity;
import com.notes.ingestion.core.model.EntityKind;
import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.Project;
import com.notes.ingestion.core.model.Regulation;
import com.notes.ingestion.core.model.Values;
import com.notes.ingestion.metrics.MetricsService;
import com.notes.ingestion.rules.OfficeNameVariants;
import com.notes.ingestion.similarity.SimilarityAlgorithm;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Finds the stored entity a candidate refers to.
 *
 * <p>Lookups only ever read the candidate's own collection, so an office search can never return a
 * project or regulation of the same name. The order is: exact name, the official name matched exactly
 * against stored names then stored official names (offices), fuzzy name above the threshold, fuzzy
 * official name (offices), then fuzzy match on name variants (offices). A failed store read
 * counts as no match.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private static final Comparator<DomainEntity> OLDEST_FIRST = Comparator
            .comparing((DomainEntity e) -> e.createdAt() != null ? e.createdAt() : Instant.MAX)
            .thenComparing(e -> e.id() != null ? e.id() : "");

    private final EntityRepository repository;
    private final SimilarityAlgorithm similarity;
    private final OfficeNameVariants nameVariants;
    private final double fuzzyThreshold;
    private final MetricsService metrics;

    public IdentityResolver(EntityRepository repository, SimilarityAlgorithm similarity,
                            OfficeNameVariants nameVariants, double fuzzyThreshold, MetricsService metrics) {
        this.repository = repository;
        this.similarity = similarity;
        this.nameVariants = nameVariants;
        this.fuzzyThreshold = fuzzyThreshold;
        this.metrics = metrics;
    }

    public SearchResult<Office> searchExistingOffice(Office candidate) {
        return searchExistingOffice(candidate.name(), candidate.officialName(), true);
    }

    public SearchResult<Office> searchExistingOffice(String name) {
        return searchExistingOffice(name, null, true);
    }

    /**
     * @param tryVariants whether to fall back to name variants
     */
    public SearchResult<Office> searchExistingOffice(String name, String officialName, boolean tryVariants) {
        if (!Values.hasText(name)) {
            return SearchResult.notFound();
        }
        SearchResult<Office> exact = exactMatch(EntityKind.OFFICE, Office.class, EntityKind.OFFICE.nameField(), name,
                MatchType.EXACT);
        if (exact.found()) {
            return exact;
        }
        boolean hasOfficialName = Values.hasText(officialName) && !officialName.trim().equals(name.trim());
        if (hasOfficialName) {
            SearchResult<Office> official = exactMatch(EntityKind.OFFICE, Office.class,
                    EntityKind.OFFICE.nameField(), officialName, MatchType.OFFICIAL_NAME);
            if (!official.found()) {
                official = exactMatch(EntityKind.OFFICE, Office.class, "officialName", officialName,
                        MatchType.OFFICIAL_NAME);
            }
            if (official.found()) {
                return official;
            }
        }

        List<Office> offices = loadAll(EntityKind.OFFICE, Office.class);
        SearchResult<Office> fuzzy = bestFuzzy(offices, name, MatchType.FUZZY);
        if (!fuzzy.found() && hasOfficialName) {
            fuzzy = bestFuzzy(offices, officialName, MatchType.OFFICIAL_NAME);
        }
        if (fuzzy.found() || !tryVariants) {
            return fuzzy;
        }
        for (String variant : nameVariants.generate(name)) {
            SearchResult<Office> match = bestFuzzy(offices, variant, MatchType.NAME_VARIANT);
            if (match.found()) {
                log.info("Office '{}' matched existing '{}' through variant '{}'",
                        name, match.entity().name(), variant);
                return match;
            }
        }
        return SearchResult.notFound();
    }

    public SearchResult<Project> searchExistingProject(String projectName) {
        return search(EntityKind.PROJECT, Project.class, projectName);
    }

    public SearchResult<Regulation> searchExistingRegulation(String name) {
        return search(EntityKind.REGULATION, Regulation.class, name);
    }

    private <T extends DomainEntity> SearchResult<T> search(EntityKind kind, Class<T> type, String name) {
        if (!Values.hasText(name)) {
            return SearchResult.notFound();
        }
        SearchResult<T> exact = exactMatch(kind, type, kind.nameField(), name, MatchType.EXACT);
        if (exact.found()) {
            return exact;
        }
        return bestFuzzy(loadAll(kind, type), name, MatchType.FUZZY);
    }

    private <T extends DomainEntity> SearchResult<T> exactMatch(EntityKind kind, Class<T> type, String field,
                                                               String name, MatchType matchType) {
        StoreResult<List<T>> result = repository.findBy(kind, field, name, type);
        if (!result.success() || result.data().isEmpty()) {
            return SearchResult.notFound();
        }
        List<T> hits = result.data();
        if (hits.size() > 1) {
            log.warn("{} {} records share the {} '{}', using the oldest", hits.size(), kind.label(), field, name);
        }
        T match = hits.stream().min(OLDEST_FIRST).orElseThrow();
        return SearchResult.exact(match, matchType, name);
    }

    private <T extends DomainEntity> SearchResult<T> bestFuzzy(List<T> entities, String name, MatchType matchType) {
        T best = null;
        double bestScore = 0.0;
        for (T entity : entities.stream().sorted(OLDEST_FIRST).toList()) {
            double score = similarity.compute(name, entity.displayName());
            if (score > fuzzyThreshold && score > bestScore) {
                best = entity;
                bestScore = score;
            }
        }
        if (best == null) {
            return SearchResult.notFound();
        }
        metrics.recordSimilarityScore(bestScore);
        log.debug("Fuzzy match for '{}': '{}' ({})", name, best.displayName(), bestScore);
        return new SearchResult<>(best, bestScore, matchType, name);
    }

    private <T extends DomainEntity> List<T> loadAll(EntityKind kind, Class<T> type) {
        StoreResult<List<T>> result = repository.findAll(kind, type);
        if (!result.success()) {
            log.warn("Could not load {} for fuzzy matching: {}", kind.collection(), result.error());
            return List.of();
        }
        return result.data();
    }
}
