package com.notes.ingestion.merge;

import com.notes.ingestion.core.model.DomainEntity;
import com.notes.ingestion.store.StorageState;

import java.util.List;

/**
 * Outcome of merging a candidate into an existing entity.
 *
 * @param success       false only when nothing usable came out of the merge
 * @param mergedEntity  the entity after the merge
 * @param changedFields names of the fields the merge changed, empty when the candidate added nothing
 * @param storage       whether the merged entity was written; {@link StorageState#LOCAL} after a failed write
 * @param error         store error for local results and failures
 */
public record MergeResult<T extends DomainEntity>(
        boolean success,
        T mergedEntity,
        List<String> changedFields,
        StorageState storage,
        String error
) {
    public MergeResult {
        changedFields = changedFields != null ? List.copyOf(changedFields) : List.of();
    }

    public static <T extends DomainEntity> MergeResult<T> persisted(T entity, List<String> changedFields) {
        return new MergeResult<>(true, entity, changedFields, StorageState.PERSISTED, null);
    }

    public static <T extends DomainEntity> MergeResult<T> local(T entity, List<String> changedFields, String error) {
        return new MergeResult<>(true, entity, changedFields, StorageState.LOCAL, error);
    }

    public static <T extends DomainEntity> MergeResult<T> failure(T existing, String error) {
        return new MergeResult<>(false, existing, List.of(), StorageState.PERSISTED, error);
    }

    public boolean hasChanges() {
        return !changedFields.isEmpty();
    }
}
