package com.notes.ingestion.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory {@link DocumentStore}.
 * Documents are deep-copied on the way in and out so callers never share mutable state with the store.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final ConcurrentMap<String, ConcurrentMap<String, Map<String, Object>>> collections =
            new ConcurrentHashMap<>();

    @Override
    public StoreResult<Map<String, Object>> create(String collection, Map<String, Object> document) {
        Map<String, Object> stored = copyMap(document);
        Object rawId = stored.get(ID);
        String id = rawId != null ? rawId.toString() : UUID.randomUUID().toString();
        String now = Instant.now().toString();
        stored.put(ID, id);
        stored.put(VERSION, 1L);
        stored.put(CREATED_AT, now);
        stored.put(UPDATED_AT, now);

        Map<String, Object> previous = collection(collection).putIfAbsent(id, stored);
        if (previous != null) {
            return StoreResult.conflict("Document " + collection + "/" + id + " already exists");
        }
        log.debug("Created document {}/{}", collection, id);
        return StoreResult.success(copyMap(stored));
    }

    @Override
    public StoreResult<Map<String, Object>> update(String collection, String id, Map<String, Object> partial,
                                                   Long expectedVersion) {
        ConcurrentMap<String, Map<String, Object>> docs = collection(collection);
        Object[] outcome = new Object[1];

        docs.computeIfPresent(id, (key, current) -> {
            long currentVersion = versionOf(current);
            if (expectedVersion != null && expectedVersion != currentVersion) {
                outcome[0] = StoreResult.conflict("Version conflict on " + collection + "/" + id
                        + ": expected " + expectedVersion + " but was " + currentVersion);
                return current;
            }
            Map<String, Object> next = copyMap(current);
            copyMap(partial).forEach((field, value) -> {
                if (!ID.equals(field) && !VERSION.equals(field) && !CREATED_AT.equals(field)) {
                    next.put(field, value);
                }
            });
            next.put(VERSION, currentVersion + 1);
            next.put(UPDATED_AT, Instant.now().toString());
            outcome[0] = StoreResult.success(copyMap(next));
            return next;
        });

        if (outcome[0] == null) {
            return StoreResult.failure("Document " + collection + "/" + id + " not found");
        }
        @SuppressWarnings("unchecked")
        StoreResult<Map<String, Object>> result = (StoreResult<Map<String, Object>>) outcome[0];
        return result;
    }

    @Override
    public StoreResult<List<Map<String, Object>>> query(String collection, List<QueryFilter> filters) {
        List<Map<String, Object>> matches = new ArrayList<>();
        for (Map<String, Object> doc : collection(collection).values()) {
            if (filters == null || filters.stream().allMatch(f -> f.matches(doc))) {
                matches.add(copyMap(doc));
            }
        }
        return StoreResult.success(matches);
    }

    @Override
    public StoreResult<Map<String, Object>> get(String collection, String id) {
        Map<String, Object> doc = collection(collection).get(id);
        return StoreResult.success(doc == null ? null : copyMap(doc));
    }

    /**
     * Number of documents in a collection.
     */
    public int count(String collection) {
        return collection(collection).size();
    }

    public void clear() {
        collections.clear();
    }

    private ConcurrentMap<String, Map<String, Object>> collection(String name) {
        return collections.computeIfAbsent(name, k -> new ConcurrentHashMap<>());
    }

    private static long versionOf(Map<String, Object> doc) {
        Object version = doc.get(VERSION);
        return version instanceof Number n ? n.longValue() : 0L;
    }

    private static Map<String, Object> copyMap(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, copyValue(v)));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }
}
