package com.notes.ingestion.core.model;

import java.util.Objects;

public record EntityRef(EntityKind type, String id) {

    public EntityRef {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(id, "id is required");
    }

    public static EntityRef of(DomainEntity entity) {
        return new EntityRef(entity.kind(), entity.id());
    }

    @Override
    public String toString() {
        return type.label() + ":" + id;
    }
}
