package com.notes.ingestion.store;

import java.util.function.Function;

/**
 * Outcome of a document store call. Expected failures are reported here rather than thrown.
 *
 * @param success  whether the operation completed
 * @param data     the returned payload, present on success
 * @param error    failure description, present on failure
 * @param conflict true when a conditional write failed because the stored version moved on
 */
public record StoreResult<T>(boolean success, T data, String error, boolean conflict) {

    public static <T> StoreResult<T> success(T data) {
        return new StoreResult<>(true, data, null, false);
    }

    public static <T> StoreResult<T> failure(String error) {
        return new StoreResult<>(false, null, error, false);
    }

    public static <T> StoreResult<T> conflict(String error) {
        return new StoreResult<>(false, null, error, true);
    }

    public <R> StoreResult<R> map(Function<T, R> mapper) {
        if (!success) {
            return new StoreResult<>(false, null, error, conflict);
        }
        return success(data == null ? null : mapper.apply(data));
    }
}
