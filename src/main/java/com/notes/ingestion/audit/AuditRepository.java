package com.notes.ingestion.audit;

import java.util.List;

/**
 * Storage for audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByNoteId(String noteId);

    List<AuditEntry> findByEntityId(String entityId);

    List<AuditEntry> findByAction(AuditAction action);

    int count();
}
