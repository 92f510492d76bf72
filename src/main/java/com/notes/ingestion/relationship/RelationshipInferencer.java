package com.notes.ingestion.relationship;

import com.notes.ingestion.core.model.ConnectionCounts;
import com.notes.ingestion.core.model.DomainEntity;
import com.notes.ingestion.core.model.EntityKind;
import com.notes.ingestion.core.model.EntityRef;
import com.notes.ingestion.core.model.Jurisdiction;
import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.Place;
import com.notes.ingestion.core.model.Project;
import com.notes.ingestion.core.model.Regulation;
import com.notes.ingestion.core.model.Relationship;
import com.notes.ingestion.core.model.RelationshipType;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Links the entities resolved from one note when they are located close enough together.
 *
 * <p>Candidate pairs are office/project, office/regulation and project/regulation. Links are stored
 * in the {@value #COLLECTION} collection under a deterministic id, so a pair already linked by an
 * earlier note is not linked again. Each new office/project link bumps the office's project counters.</p>
 */
public class RelationshipInferencer {
    private static final Logger log = LoggerFactory.getLogger(RelationshipInferencer.class);

    public static final String COLLECTION = "relationships";

    private final EntityRepository repository;
    private final RelationshipScope scope;
    private final int maxRetries;

    public RelationshipInferencer(EntityRepository repository, RelationshipScope scope, int maxRetries) {
        this.repository = repository;
        this.scope = scope;
        this.maxRetries = maxRetries;
    }

    /**
     * Proposes links between the given persisted entities.
     *
     * @return the links that were newly stored
     */
    public List<Relationship> infer(List<Office> offices, List<Project> projects, List<Regulation> regulations) {
        List<Relationship> proposed = propose(offices, projects, regulations);
        List<Relationship> created = new ArrayList<>();
        for (Relationship relationship : proposed) {
            if (store(relationship)) {
                created.add(relationship);
                if (relationship.relationshipType() == RelationshipType.OFFICE_PROJECT) {
                    countProjectLink(relationship, projects);
                }
            }
        }
        return created;
    }

    /**
     * Pairs that satisfy the location scope, before anything is written.
     */
    public List<Relationship> propose(List<Office> offices, List<Project> projects, List<Regulation> regulations) {
        List<Relationship> links = new ArrayList<>();
        if (scope == RelationshipScope.DISABLED) {
            return links;
        }
        for (Office office : offices) {
            for (Project project : projects) {
                link(office, placeOf(office), project, placeOf(project), RelationshipType.OFFICE_PROJECT, links);
            }
            for (Regulation regulation : regulations) {
                link(office, placeOf(office), regulation, placeOf(regulation), RelationshipType.OFFICE_REGULATION,
                        links);
            }
        }
        for (Project project : projects) {
            for (Regulation regulation : regulations) {
                link(project, placeOf(project), regulation, placeOf(regulation), RelationshipType.PROJECT_REGULATION,
                        links);
            }
        }
        return links;
    }

    private void link(DomainEntity source, Place sourcePlace, DomainEntity target, Place targetPlace,
                      RelationshipType type, List<Relationship> links) {
        if (source.id() == null || target.id() == null || !scope.accepts(sourcePlace, targetPlace)) {
            return;
        }
        links.add(Relationship.between(EntityRef.of(source), EntityRef.of(target), type));
    }

    private boolean store(Relationship relationship) {
        StoreResult<Map<String, Object>> result = repository.createDocument(COLLECTION, relationship);
        if (result.success()) {
            log.info("Linked {} -> {} ({})", relationship.sourceEntity(), relationship.targetEntity(),
                    relationship.relationshipType().value());
            return true;
        }
        if (result.conflict()) {
            log.debug("Relationship {} already exists", relationship.id());
        } else {
            log.warn("Could not store relationship {}: {}", relationship.id(), result.error());
        }
        return false;
    }

    private void countProjectLink(Relationship relationship, List<Project> projects) {
        String officeId = relationship.sourceEntity().id();
        boolean active = projects.stream()
                .filter(p -> relationship.targetEntity().id().equals(p.id()))
                .anyMatch(p -> p.status() != null && p.status().isActive());
        StoreResult<Office> office = repository.findById(EntityKind.OFFICE, officeId, Office.class);
        if (!office.success() || office.data() == null) {
            log.warn("Could not update connection counts of office {}", officeId);
            return;
        }
        StoreResult<Office> write = repository.modify(office.data(), current -> current.toBuilder()
                .connectionCounts((current.connectionCounts() != null
                        ? current.connectionCounts() : ConnectionCounts.zero()).withProjectLink(active))
                .build(), Office.class, maxRetries);
        if (!write.success()) {
            log.warn("Could not update connection counts of office {}: {}", officeId, write.error());
        }
    }

    static Place placeOf(Office office) {
        return office.headquarters();
    }

    static Place placeOf(Project project) {
        return project.location();
    }

    static Place placeOf(Regulation regulation) {
        Jurisdiction jurisdiction = regulation.jurisdiction();
        return jurisdiction != null ? Place.of(jurisdiction.cityName(), jurisdiction.countryName()) : null;
    }
}
