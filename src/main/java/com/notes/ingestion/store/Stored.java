package com.notes.ingestion.store;

import java.util.Objects;

/**
 * An entity tagged with where it lives. {@link StorageState#LOCAL} entities were built after a failed
 * store write and are never retried.
 */
public record Stored<T>(T entity, StorageState state, String error) {

    public Stored {
        Objects.requireNonNull(entity, "entity is required");
        Objects.requireNonNull(state, "state is required");
    }

    public static <T> Stored<T> persisted(T entity) {
        return new Stored<>(entity, StorageState.PERSISTED, null);
    }

    public static <T> Stored<T> local(T entity, String error) {
        return new Stored<>(entity, StorageState.LOCAL, error);
    }

    public boolean isPersisted() {
        return state == StorageState.PERSISTED;
    }
}
