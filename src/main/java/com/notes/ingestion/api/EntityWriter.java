package com.notes.ingestion.api;

import com.notes.ingestion.audit.AuditAction;
import com.notes.ingestion.audit.AuditService;
import com.notes.ingestion.core.model.ConnectionCounts;
import com.notes.ingestion.core.model.DomainEntity;
import com.notes.ingestion.core.model.Jurisdiction;
import com.notes.ingestion.core.model.JurisdictionLevel;
import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.OfficeLocation;
import com.notes.ingestion.core.model.OfficeSize;
import com.notes.ingestion.core.model.OfficeStatus;
import com.notes.ingestion.core.model.Place;
import com.notes.ingestion.core.model.Project;
import com.notes.ingestion.core.model.ProjectDetails;
import com.notes.ingestion.core.model.ProjectFinancial;
import com.notes.ingestion.core.model.ProjectStatus;
import com.notes.ingestion.core.model.Regulation;
import com.notes.ingestion.core.model.SizeCategory;
import com.notes.ingestion.core.model.Values;
import com.notes.ingestion.identity.IdentifierSynthesizer;
import com.notes.ingestion.merge.MergeEngine;
import com.notes.ingestion.merge.MergeResult;
import com.notes.ingestion.metrics.MetricsService;
import com.notes.ingestion.resolution.IdentityResolver;
import com.notes.ingestion.resolution.SearchResult;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.StorageState;
import com.notes.ingestion.store.StoreResult;
import com.notes.ingestion.store.Stored;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Create-or-merge step for the three main entity kinds.
 *
 * <p>Each candidate is looked up first; a match is merged, a miss is created. A failed store write
 * produces a locally built entity with defaults filled in, tagged {@link StorageState#LOCAL}.
 * Candidates that fail validation are skipped and audited.</p>
 */
class EntityWriter {
    private static final Logger log = LoggerFactory.getLogger(EntityWriter.class);

    private final EntityRepository repository;
    private final IdentityResolver resolver;
    private final MergeEngine mergeEngine;
    private final IdentifierSynthesizer identifiers;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final Clock clock;

    EntityWriter(EntityRepository repository, IdentityResolver resolver, MergeEngine mergeEngine,
                 IdentifierSynthesizer identifiers, AuditService auditService, MetricsService metrics, Clock clock) {
        this.repository = repository;
        this.resolver = resolver;
        this.mergeEngine = mergeEngine;
        this.identifiers = identifiers;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
    }

    Optional<Written<Office>> writeOffice(Office candidate, String noteId) {
        if (!Values.hasText(candidate.name())) {
            skip(noteId, "office", "no name");
            return Optional.empty();
        }
        SearchResult<Office> match = resolver.searchExistingOffice(candidate);
        if (match.found()) {
            return merged(mergeEngine.mergeOffice(match.entity(), candidate), noteId);
        }

        Place hq = candidate.headquarters();
        if (hq == null || !hq.hasCityAndCountry()) {
            skip(noteId, candidate.name(), "headquarters city and country are required");
            return Optional.empty();
        }
        StoreResult<Office> result = createOffice(candidate);
        if (result.success()) {
            return created(result.data(), noteId);
        }
        return fallback(localOffice(candidate), result.error(), noteId);
    }

    /**
     * Creates the office, drawing a fresh id whenever the store reports the id as taken.
     */
    private StoreResult<Office> createOffice(Office candidate) {
        Office source = candidate;
        StoreResult<Office> result = null;
        for (int attempt = 0; attempt <= identifiers.getCollisionRetries(); attempt++) {
            Office office = forCreate(source.toBuilder().id(identifiers.officeId(source)).build());
            result = repository.create(office, Office.class);
            if (!result.conflict()) {
                return result;
            }
            log.info("Office id {} was taken concurrently, drawing a new one", office.id());
            source = candidate.toBuilder().id(null).build();
        }
        return result;
    }

    Optional<Written<Project>> writeProject(Project candidate, String noteId) {
        if (!Values.hasText(candidate.projectName())) {
            skip(noteId, "project", "no project name");
            return Optional.empty();
        }
        SearchResult<Project> match = resolver.searchExistingProject(candidate.projectName());
        if (match.found()) {
            return merged(mergeEngine.mergeProject(match.entity(), candidate), noteId);
        }
        StoreResult<Project> result = repository.create(candidate.toBuilder().id(null).build(), Project.class);
        if (result.success()) {
            return created(result.data(), noteId);
        }
        return fallback(localProject(candidate), result.error(), noteId);
    }

    Optional<Written<Regulation>> writeRegulation(Regulation candidate, String noteId) {
        if (!Values.hasText(candidate.name())) {
            skip(noteId, "regulation", "no name");
            return Optional.empty();
        }
        SearchResult<Regulation> match = resolver.searchExistingRegulation(candidate.name());
        if (match.found()) {
            return merged(mergeEngine.mergeRegulation(match.entity(), candidate), noteId);
        }
        StoreResult<Regulation> result = repository.create(candidate.toBuilder().id(null).build(), Regulation.class);
        if (result.success()) {
            return created(result.data(), noteId);
        }
        return fallback(localRegulation(candidate), result.error(), noteId);
    }

    /**
     * Office as first written: defaults filled in, extracted headcount dropped, size kept only
     * when it carries a category or revenue.
     */
    static Office forCreate(Office candidate) {
        OfficeLocation location = candidate.location();
        OfficeSize size = candidate.size();
        OfficeSize kept = null;
        if (size != null && (size.sizeCategory() != null || size.annualRevenue() != null)) {
            kept = size.withoutEmployeeCount();
        }
        return candidate.toBuilder()
                .status(Values.firstNonNull(candidate.status(), OfficeStatus.ACTIVE))
                .location(new OfficeLocation(location.headquarters(), location.otherOffices()))
                .size(kept)
                .connectionCounts(Values.firstNonNull(candidate.connectionCounts(), ConnectionCounts.zero()))
                .build();
    }

    Office localOffice(Office candidate) {
        Instant now = clock.instant();
        OfficeLocation location = candidate.location() != null && candidate.headquarters() != null
                ? candidate.location()
                : new OfficeLocation(Place.unknown(), candidate.location() != null
                        ? candidate.location().otherOffices() : List.of());
        return candidate.toBuilder()
                .id(identifiers.fallbackOfficeId(candidate.name()))
                .officialName(Values.firstText(candidate.officialName(), candidate.name()))
                .founded(Values.firstNonNull(candidate.founded(), Year.now(clock).getValue()))
                .status(Values.firstNonNull(candidate.status(), OfficeStatus.ACTIVE))
                .location(location)
                .size(candidate.size() != null
                        ? candidate.size().withoutEmployeeCount()
                        : OfficeSize.ofCategory(SizeCategory.MEDIUM))
                .connectionCounts(Values.firstNonNull(candidate.connectionCounts(), ConnectionCounts.zero()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    Project localProject(Project candidate) {
        Instant now = clock.instant();
        return candidate.toBuilder()
                .id(identifiers.localProjectId())
                .status(Values.firstNonNull(candidate.status(), ProjectStatus.PLANNING))
                .location(Values.firstNonNull(candidate.location(), Place.unknown()))
                .financial(Values.firstNonNull(candidate.financial(), new ProjectFinancial(0.0, "USD")))
                .details(Values.firstNonNull(candidate.details(), new ProjectDetails("unknown", "Unknown project")))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    Regulation localRegulation(Regulation candidate) {
        Instant now = clock.instant();
        return candidate.toBuilder()
                .id(identifiers.localRegulationId())
                .regulationType(Values.firstText(candidate.regulationType(), "zoning"))
                .jurisdiction(Values.firstNonNull(candidate.jurisdiction(),
                        new Jurisdiction(JurisdictionLevel.CITY, null, null, Place.UNKNOWN)))
                .effectiveDate(Values.firstText(candidate.effectiveDate(), LocalDate.now(clock).toString()))
                .description(Values.firstText(candidate.description(), "Unknown regulation"))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private <T extends DomainEntity> Optional<Written<T>> created(T entity, String noteId) {
        log.info("Created {} '{}' ({})", entity.kind().label(), entity.displayName(), entity.id());
        metrics.incrementEntityCreated(entity.kind());
        auditService.record(AuditAction.ENTITY_CREATED, noteId, entity.id(),
                Map.of("kind", entity.kind().label()));
        return Optional.of(new Written<>(Stored.persisted(entity), false));
    }

    private <T extends DomainEntity> Optional<Written<T>> merged(MergeResult<T> result, String noteId) {
        if (!result.success()) {
            log.error("Merge into {} failed: {}", result.mergedEntity().id(), result.error());
            return Optional.empty();
        }
        T entity = result.mergedEntity();
        Map<String, Object> details = Map.of(
                "kind", entity.kind().label(),
                "changedFields", String.join(",", result.changedFields()));
        if (result.storage() == StorageState.LOCAL) {
            auditService.record(AuditAction.ENTITY_FALLBACK, noteId, entity.id(),
                    Map.of("kind", entity.kind().label(), "error", Objects.toString(result.error(), "unknown")));
            return Optional.of(new Written<>(Stored.local(entity, result.error()), true));
        }
        auditService.record(AuditAction.ENTITY_MERGED, noteId, entity.id(), details);
        return Optional.of(new Written<>(Stored.persisted(entity), true));
    }

    private <T extends DomainEntity> Optional<Written<T>> fallback(T local, String error, String noteId) {
        log.warn("Store write failed for {} '{}', keeping local copy {}: {}", local.kind().label(),
                local.displayName(), local.id(), error);
        metrics.incrementLocalFallback(local.kind());
        auditService.record(AuditAction.ENTITY_FALLBACK, noteId, local.id(),
                Map.of("kind", local.kind().label(), "error", Objects.toString(error, "unknown")));
        return Optional.of(new Written<>(Stored.local(local, error), false));
    }

    private void skip(String noteId, String candidate, String reason) {
        log.warn("Skipping candidate '{}': {}", candidate, reason);
        auditService.record(AuditAction.CANDIDATE_SKIPPED, noteId, null,
                Map.of("candidate", candidate, "reason", reason));
    }
}
