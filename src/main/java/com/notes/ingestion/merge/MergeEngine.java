package com.notes.ingestion.merge;

import com.notes.ingestion.core.model.DomainEntity;
import com.notes.ingestion.core.model.Jurisdiction;
import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.OfficeLocation;
import com.notes.ingestion.core.model.OfficeSize;
import com.notes.ingestion.core.model.Place;
import com.notes.ingestion.core.model.Project;
import com.notes.ingestion.core.model.ProjectDetails;
import com.notes.ingestion.core.model.ProjectFinancial;
import com.notes.ingestion.core.model.Regulation;
import com.notes.ingestion.logging.LogContext;
import com.notes.ingestion.metrics.MetricsService;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BiFunction;

/**
 * Field-level merge of a candidate into an existing entity.
 *
 * <p>Rules: scalars are overwritten when the candidate has a different value, list fields are
 * unioned, nested objects are merged sub-field by sub-field. The id and the canonical name are never
 * changed. Writes are conditional on the version that was read; on a version conflict the entity
 * is re-read and the candidate merged again on top of it.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final EntityRepository repository;
    private final MetricsService metrics;
    private final int maxRetries;

    public MergeEngine(EntityRepository repository, MetricsService metrics, int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.repository = repository;
        this.metrics = metrics;
        this.maxRetries = maxRetries;
    }

    public MergeResult<Office> mergeOffice(Office existing, Office incoming) {
        return merge(existing, incoming, Office.class, MergeEngine::computeOffice);
    }

    public MergeResult<Project> mergeProject(Project existing, Project incoming) {
        return merge(existing, incoming, Project.class, MergeEngine::computeProject);
    }

    public MergeResult<Regulation> mergeRegulation(Regulation existing, Regulation incoming) {
        return merge(existing, incoming, Regulation.class, MergeEngine::computeRegulation);
    }

    static Merged<Office> computeOffice(Office existing, Office incoming) {
        FieldMerger fields = new FieldMerger();
        OfficeLocation location = existing.location();
        OfficeLocation incomingLocation = incoming.location();
        if (incomingLocation != null) {
            Place headquarters = fields.nested("location.headquarters",
                    location != null ? location.headquarters() : null,
                    incomingLocation.headquarters(), Place::overlay);
            List<Place> otherOffices = fields.union("location.otherOffices",
                    location != null ? location.otherOffices() : List.of(),
                    incomingLocation.otherOffices());
            location = new OfficeLocation(headquarters, otherOffices);
        }
        OfficeSize incomingSize = incoming.size() != null ? incoming.size().withoutEmployeeCount() : null;
        if (incomingSize != null && incomingSize.isEmpty()) {
            incomingSize = null;
        }

        Office merged = existing.toBuilder()
                .officialName(fields.scalar("officialName", existing.officialName(), incoming.officialName()))
                .founded(fields.scalar("founded", existing.founded(), incoming.founded()))
                .status(fields.scalar("status", existing.status(), incoming.status()))
                .website(fields.scalar("website", existing.website(), incoming.website()))
                .location(location)
                .size(fields.nested("size", existing.size(), incomingSize, OfficeSize::overlay))
                .specializations(fields.union("specializations", existing.specializations(), incoming.specializations()))
                .notableWorks(fields.union("notableWorks", existing.notableWorks(), incoming.notableWorks()))
                .build();
        return new Merged<>(merged, fields.changedFields());
    }

    static Merged<Project> computeProject(Project existing, Project incoming) {
        FieldMerger fields = new FieldMerger();
        Project merged = existing.toBuilder()
                .officeId(fields.scalar("officeId", existing.officeId(), incoming.officeId()))
                .status(fields.scalar("status", existing.status(), incoming.status()))
                .location(fields.nested("location", existing.location(), incoming.location(), Place::overlay))
                .financial(fields.nested("financial", existing.financial(), incoming.financial(),
                        ProjectFinancial::overlay))
                .details(fields.nested("details", existing.details(), incoming.details(), ProjectDetails::overlay))
                .build();
        return new Merged<>(merged, fields.changedFields());
    }

    static Merged<Regulation> computeRegulation(Regulation existing, Regulation incoming) {
        FieldMerger fields = new FieldMerger();
        Regulation merged = existing.toBuilder()
                .jurisdiction(fields.nested("jurisdiction", existing.jurisdiction(), incoming.jurisdiction(),
                        Jurisdiction::overlay))
                .regulationType(fields.scalar("regulationType", existing.regulationType(), incoming.regulationType()))
                .effectiveDate(fields.scalar("effectiveDate", existing.effectiveDate(), incoming.effectiveDate()))
                .description(fields.scalar("description", existing.description(), incoming.description()))
                .build();
        return new Merged<>(merged, fields.changedFields());
    }

    private <T extends DomainEntity> MergeResult<T> merge(T existing, T incoming, Class<T> type,
                                                          BiFunction<T, T, Merged<T>> rules) {
        try (LogContext ctx = LogContext.forMerge(existing.kind().label(), existing.id())) {
            T current = existing;
            Merged<T> merged = rules.apply(current, incoming);
            if (merged.changedFields().isEmpty()) {
                log.info("{} '{}' already up to date", existing.kind().label(), existing.displayName());
                metrics.incrementEntityMerged(existing.kind());
                return MergeResult.persisted(current, List.of());
            }

            for (int attempt = 0; ; attempt++) {
                StoreResult<T> write = repository.update(merged.entity(), type);
                if (write.success()) {
                    log.info("Merged into {} '{}': {}", existing.kind().label(), existing.displayName(),
                            merged.changedFields());
                    metrics.incrementEntityMerged(existing.kind());
                    return MergeResult.persisted(write.data(), merged.changedFields());
                }
                if (!write.conflict()) {
                    metrics.incrementLocalFallback(existing.kind());
                    return MergeResult.local(merged.entity(), merged.changedFields(), write.error());
                }
                if (attempt >= maxRetries) {
                    log.warn("Giving up on {} {} after {} version conflicts", existing.kind().label(),
                            existing.id(), attempt + 1);
                    metrics.incrementLocalFallback(existing.kind());
                    return MergeResult.local(merged.entity(), merged.changedFields(), write.error());
                }

                StoreResult<T> reread = repository.findById(existing.kind(), existing.id(), type);
                if (!reread.success() || reread.data() == null) {
                    return MergeResult.failure(current, "Could not re-read " + existing.id() + " after conflict");
                }
                current = reread.data();
                merged = rules.apply(current, incoming);
                log.debug("Version conflict on {}, re-merging onto version {}", existing.id(), current.version());
                if (merged.changedFields().isEmpty()) {
                    metrics.incrementEntityMerged(existing.kind());
                    return MergeResult.persisted(current, List.of());
                }
            }
        }
    }

    /**
     * Merge computed in memory, before it is written.
     */
    record Merged<T>(T entity, List<String> changedFields) {
    }
}
