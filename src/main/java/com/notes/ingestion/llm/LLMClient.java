package com.notes.ingestion.llm;

/**
 * Text-completion transport shared by the translation, extraction and web-search oracles.
 */
public interface LLMClient {

    /**
     * Sends a prompt and returns the raw completion text.
     *
     * @throws LLMException when the model is unreachable or returns an error
     */
    String generate(String prompt);

    /**
     * Same as {@link #generate(String)} but asks the model to answer with a JSON object.
     * Providers without a JSON mode fall back to plain generation.
     */
    default String generateJson(String prompt) {
        return generate(prompt);
    }

    String getProviderName();

    boolean isAvailable();
}
