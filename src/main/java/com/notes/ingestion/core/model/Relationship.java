package com.notes.ingestion.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A link between two entities. Links are bidirectional: the source/target order only records
 * which side was proposed first.
 */
public record Relationship(
        String id,
        EntityRef sourceEntity,
        EntityRef targetEntity,
        RelationshipType relationshipType,
        boolean bidirectional,
        Instant createdAt
) {

    public Relationship {
        Objects.requireNonNull(sourceEntity, "sourceEntity is required");
        Objects.requireNonNull(targetEntity, "targetEntity is required");
        Objects.requireNonNull(relationshipType, "relationshipType is required");
        if (id == null) {
            id = keyOf(sourceEntity, targetEntity, relationshipType);
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static Relationship between(EntityRef source, EntityRef target, RelationshipType type) {
        return new Relationship(null, source, target, type, true, null);
    }

    /**
     * Deterministic key, so the same pair is stored once per type.
     */
    public static String keyOf(EntityRef source, EntityRef target, RelationshipType type) {
        return type.value() + ":" + source + "->" + target;
    }
}
