package com.notes.ingestion.store;

import java.util.List;
import java.util.Map;

/**
 * Generic document API the pipeline persists through.
 *
 * <p>Every stored document carries {@code id}, {@code version}, {@code createdAt} and
 * {@code updatedAt} fields managed by the store. {@code version} starts at 1 and grows by one per
 * successful update.</p>
 */
public interface DocumentStore {

    String ID = "id";
    String VERSION = "version";
    String CREATED_AT = "createdAt";
    String UPDATED_AT = "updatedAt";

    /**
     * Creates a document. When the document has no {@code id} one is generated.
     * Creating an id that already exists fails with a conflict.
     */
    StoreResult<Map<String, Object>> create(String collection, Map<String, Object> document);

    /**
     * Shallow-merges {@code partial} into the stored document.
     *
     * @param expectedVersion when non-null, the write only succeeds if the stored version matches;
     *                        otherwise the result is a conflict
     */
    StoreResult<Map<String, Object>> update(String collection, String id, Map<String, Object> partial,
                                            Long expectedVersion);

    default StoreResult<Map<String, Object>> update(String collection, String id, Map<String, Object> partial) {
        return update(collection, id, partial, null);
    }

    /**
     * Returns documents matching every filter. No filters returns the whole collection.
     */
    StoreResult<List<Map<String, Object>>> query(String collection, List<QueryFilter> filters);

    /**
     * Fetches one document; a missing document is a successful result with {@code null} data.
     */
    StoreResult<Map<String, Object>> get(String collection, String id);
}
