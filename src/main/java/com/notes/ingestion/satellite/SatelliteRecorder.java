package com.notes.ingestion.satellite;

import com.notes.ingestion.audit.AuditAction;
import com.notes.ingestion.audit.AuditService;
import com.notes.ingestion.identity.IdentifierSynthesizer;
import com.notes.ingestion.store.DocumentStore;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Saves the auxiliary records of a note, one at a time. A record that fails validation or cannot be
 * written is logged and skipped; the others are still saved.
 */
public class SatelliteRecorder {
    private static final Logger log = LoggerFactory.getLogger(SatelliteRecorder.class);

    private final EntityRepository repository;
    private final IdentifierSynthesizer identifiers;
    private final AuditService auditService;

    public SatelliteRecorder(EntityRepository repository, IdentifierSynthesizer identifiers,
                             AuditService auditService) {
        this.repository = repository;
        this.identifiers = identifiers;
        this.auditService = auditService;
    }

    /**
     * @param satellites  extracted records by kind
     * @param officeId    id of the note's only resolved office, or {@code null} when it resolved none or several
     * @param noteId      note the records came from, for the audit trail
     * @return number of saved records per kind, kinds with none saved omitted
     */
    public Map<SatelliteKind, Integer> record(Map<SatelliteKind, List<Map<String, Object>>> satellites,
                                              String officeId, String noteId) {
        Map<SatelliteKind, Integer> saved = new EnumMap<>(SatelliteKind.class);
        satellites.forEach((kind, records) -> {
            for (Map<String, Object> values : records) {
                if (save(kind, new SatelliteFields(values), officeId, noteId)) {
                    saved.merge(kind, 1, Integer::sum);
                }
            }
        });
        return saved;
    }

    boolean save(SatelliteKind kind, SatelliteFields fields, String officeId, String noteId) {
        SatelliteFields record = fields;
        if (kind.isOfficeScoped() && !record.has("officeId") && officeId != null) {
            record = record.with("officeId", officeId);
        }
        if (!kind.isValid(record)) {
            log.warn("Skipping {} record: {}", kind.key(), kind.requirement());
            return false;
        }
        if (!record.has(DocumentStore.ID)) {
            record = record.with(DocumentStore.ID, kind.synthesizeId(record, identifiers));
        }
        String id = record.text(DocumentStore.ID);

        StoreResult<Map<String, Object>> result = repository.createDocument(kind.collection(), record.asMap());
        if (!result.success() && result.conflict() && kind.isKeyed()) {
            result = repository.updateDocument(kind.collection(), id, record.asMap());
        }
        if (!result.success()) {
            log.warn("Could not save {} record {}: {}", kind.key(), id, result.error());
            return false;
        }
        log.info("Saved {} record {}", kind.key(), id);
        auditService.record(AuditAction.SATELLITE_SAVED, noteId, id, Map.of("kind", kind.key()));
        return true;
    }
}
