package com.notes.ingestion.audit;

import com.notes.ingestion.language.NormalizedText;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.QueryFilter;
import com.notes.ingestion.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the {@code userInputs} log of received notes.
 *
 * <p>A note is written as pending before entity creation and marked processed afterwards. The
 * pending record is found again by the hash of its original text. Failures are logged and never
 * stop the pipeline.</p>
 */
public class NoteLog {
    private static final Logger log = LoggerFactory.getLogger(NoteLog.class);

    public static final String COLLECTION = "userInputs";
    public static final int PREVIEW_LENGTH = 1000;

    private final EntityRepository repository;

    public NoteLog(EntityRepository repository) {
        this.repository = repository;
    }

    public void recordPending(NormalizedText note) {
        String original = note.originalText();
        NoteRecord record = new NoteRecord(
                preview(note.text()),
                note.text(),
                hash(original),
                Instant.now(),
                false,
                note.text().length(),
                wordCount(note.text()),
                "pending",
                note.translated(),
                note.translated() ? original : null);
        StoreResult<Map<String, Object>> result = repository.createDocument(COLLECTION, record);
        if (!result.success()) {
            log.warn("Could not save note to {}: {}", COLLECTION, result.error());
        }
    }

    /**
     * Marks the pending record for this note as processed.
     *
     * @param createdCounts per-kind counts written to {@code entitiesCreated}
     */
    public void markProcessed(String originalText, String processingResult, Map<String, Integer> createdCounts,
                              String summary) {
        String textHash = hash(originalText);
        StoreResult<List<Map<String, Object>>> pending = repository.queryDocuments(COLLECTION, List.of(
                QueryFilter.eq("textHash", textHash),
                QueryFilter.eq("processed", false)));
        if (!pending.success() || pending.data().isEmpty()) {
            log.warn("No pending note record found for hash {}", textHash);
            return;
        }

        Map<String, Object> update = new LinkedHashMap<>();
        update.put("processed", true);
        update.put("processingResult", processingResult);
        update.put("entitiesCreated", new LinkedHashMap<>(createdCounts));
        update.put("summary", summary);
        update.put("processedAt", Instant.now().toString());

        for (Map<String, Object> record : pending.data()) {
            String id = String.valueOf(record.get("id"));
            StoreResult<Map<String, Object>> result = repository.updateDocument(COLLECTION, id, update);
            if (!result.success()) {
                log.warn("Could not mark note record {} as processed: {}", id, result.error());
            }
        }
    }

    static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    static String hash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
