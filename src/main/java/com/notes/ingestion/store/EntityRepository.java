package com.notes.ingestion.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notes.ingestion.core.ObjectMappers;
import com.notes.ingestion.core.model.DomainEntity;
import com.notes.ingestion.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Typed access to the entity collections of a {@link DocumentStore}.
 * Records are mapped to documents with Jackson; store exceptions are turned into failed results.
 */
public class EntityRepository {
    private static final Logger log = LoggerFactory.getLogger(EntityRepository.class);
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private final DocumentStore store;
    private final ObjectMapper mapper;

    public EntityRepository(DocumentStore store) {
        this(store, ObjectMappers.create());
    }

    public EntityRepository(DocumentStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    public <T extends DomainEntity> StoreResult<T> create(T entity, Class<T> type) {
        String collection = entity.kind().collection();
        return guarded("create " + collection, () ->
                store.create(collection, toDocument(entity)).map(doc -> fromDocument(doc, type)));
    }

    /**
     * Writes the full entity, conditional on the version it was read at.
     */
    public <T extends DomainEntity> StoreResult<T> update(T entity, Class<T> type) {
        String collection = entity.kind().collection();
        return guarded("update " + collection + "/" + entity.id(), () ->
                store.update(collection, entity.id(), toDocument(entity), entity.version())
                        .map(doc -> fromDocument(doc, type)));
    }

    /**
     * Applies {@code change} to {@code current} and writes the result. On a version conflict the entity
     * is re-read and the change applied again, at most {@code maxRetries} times. A change that leaves
     * the entity equal to what was read is not written.
     */
    public <T extends DomainEntity> StoreResult<T> modify(T current, UnaryOperator<T> change, Class<T> type,
                                                          int maxRetries) {
        T base = current;
        for (int attempt = 0; ; attempt++) {
            T changed = change.apply(base);
            if (changed.equals(base)) {
                return StoreResult.success(base);
            }
            StoreResult<T> write = update(changed, type);
            if (write.success() || !write.conflict() || attempt >= maxRetries) {
                return write;
            }
            log.debug("Version conflict on {}/{}, retrying", base.kind().collection(), base.id());
            StoreResult<T> reread = findById(base.kind(), base.id(), type);
            if (!reread.success() || reread.data() == null) {
                return StoreResult.failure("Could not re-read " + base.id() + " after conflict");
            }
            base = reread.data();
        }
    }

    public <T extends DomainEntity> StoreResult<List<T>> findBy(EntityKind kind, String field, Object value,
                                                                Class<T> type) {
        return query(kind, List.of(QueryFilter.eq(field, value)), type);
    }

    public <T extends DomainEntity> StoreResult<List<T>> findAll(EntityKind kind, Class<T> type) {
        return query(kind, List.of(), type);
    }

    public <T extends DomainEntity> StoreResult<T> findById(EntityKind kind, String id, Class<T> type) {
        return guarded("get " + kind.collection() + "/" + id, () ->
                store.get(kind.collection(), id).map(doc -> fromDocument(doc, type)));
    }

    /**
     * True when a document with this id exists. A failed lookup counts as absent; the following
     * create reports the store problem.
     */
    public boolean exists(String collection, String id) {
        StoreResult<Map<String, Object>> result = guarded("get " + collection + "/" + id,
                () -> store.get(collection, id));
        return result.success() && result.data() != null;
    }

    /**
     * Raw document write used for records without a typed model (satellites, note log, links).
     */
    public StoreResult<Map<String, Object>> createDocument(String collection, Object value) {
        return guarded("create " + collection, () -> store.create(collection, toDocument(value)));
    }

    public StoreResult<Map<String, Object>> updateDocument(String collection, String id, Map<String, Object> partial) {
        return guarded("update " + collection + "/" + id, () -> store.update(collection, id, partial));
    }

    public StoreResult<List<Map<String, Object>>> queryDocuments(String collection, List<QueryFilter> filters) {
        return guarded("query " + collection, () -> store.query(collection, filters));
    }

    public Map<String, Object> toDocument(Object value) {
        return mapper.convertValue(value, DOCUMENT);
    }

    public <T> T fromDocument(Map<String, Object> document, Class<T> type) {
        return mapper.convertValue(document, type);
    }

    private <T extends DomainEntity> StoreResult<List<T>> query(EntityKind kind, List<QueryFilter> filters,
                                                                Class<T> type) {
        return guarded("query " + kind.collection(), () ->
                store.query(kind.collection(), filters).map(docs -> {
                    List<T> entities = new ArrayList<>(docs.size());
                    docs.forEach(doc -> entities.add(fromDocument(doc, type)));
                    return entities;
                }));
    }

    private <R> StoreResult<R> guarded(String operation, Supplier<StoreResult<R>> call) {
        try {
            StoreResult<R> result = call.get();
            if (!result.success()) {
                log.warn("Store {} failed: {}", operation, result.error());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Store {} threw: {}", operation, e.getMessage(), e);
            return StoreResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
