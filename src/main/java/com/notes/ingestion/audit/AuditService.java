package com.notes.ingestion.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail of note processing.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final String actorId;

    public AuditService() {
        this(new InMemoryAuditRepository(), "note-ingestion");
    }

    public AuditService(AuditRepository repository, String actorId) {
        this.repository = repository;
        this.actorId = actorId;
    }

    public AuditEntry record(AuditAction action, String noteId, String entityId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .noteId(noteId)
                .entityId(entityId)
                .actorId(actorId)
                .details(details)
                .build();
        repository.save(entry);
        log.debug("Audit entry recorded: {} for entity {} (note {})", action, entityId, noteId);
        return entry;
    }

    public AuditEntry record(AuditAction action, String noteId, String entityId) {
        return record(action, noteId, entityId, null);
    }

    public List<AuditEntry> getEntriesForNote(String noteId) {
        return repository.findByNoteId(noteId);
    }

    public List<AuditEntry> getEntriesForEntity(String entityId) {
        return repository.findByEntityId(entityId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public int size() {
        return repository.count();
    }
}
