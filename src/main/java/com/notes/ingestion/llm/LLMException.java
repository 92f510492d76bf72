package com.notes.ingestion.llm;

/**
 * Raised when the language model cannot be reached or answers with an error status.
 */
public class LLMException extends RuntimeException {

    public LLMException(String message) {
        super(message);
    }

    public LLMException(String message, Throwable cause) {
        super(message, cause);
    }
}
