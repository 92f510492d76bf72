package com.notes.ingestion.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable SLF4J MDC scope. Keys added through this context are removed on close, so
 * nested scopes must use distinct keys.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forNote(noteId)) {
 *     log.info("note.processed created={}", total);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forNote(String noteId) {
        LogContext ctx = new LogContext();
        ctx.put("noteId", noteId);
        ctx.put("operation", "ingest");
        return ctx;
    }

    public static LogContext forMerge(String entityKind, String entityId) {
        LogContext ctx = new LogContext();
        ctx.put("entityKind", entityKind);
        ctx.put("entityId", entityId);
        ctx.put("stage", "merge");
        return ctx;
    }

    public static String newNoteId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
