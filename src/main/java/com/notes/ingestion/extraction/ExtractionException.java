package com.notes.ingestion.extraction;

/**
 * The extraction oracle could not be reached or did not return a usable structured answer.
 * Processing of the note stops; nothing is created.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
