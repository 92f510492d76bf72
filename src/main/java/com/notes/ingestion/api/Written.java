package com.notes.ingestion.api;

import com.notes.ingestion.core.model.DomainEntity;
import com.notes.ingestion.store.Stored;

/**
 * One candidate after the create-or-merge step.
 *
 * @param stored the entity as written, or as built locally
 * @param merged true when the candidate was folded into an existing entity
 */
record Written<T extends DomainEntity>(Stored<T> stored, boolean merged) {

    T entity() {
        return stored.entity();
    }
}
