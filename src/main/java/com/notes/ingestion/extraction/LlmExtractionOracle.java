package com.notes.ingestion.extraction;

import com.notes.ingestion.llm.LLMClient;
import com.notes.ingestion.llm.LLMException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ExtractionOracle} that prompts a language model for a JSON answer.
 */
public class LlmExtractionOracle implements ExtractionOracle {
    private static final Logger log = LoggerFactory.getLogger(LlmExtractionOracle.class);

    private final LLMClient client;
    private final AnalysisResponseParser parser;

    public LlmExtractionOracle(LLMClient client) {
        this(client, new AnalysisResponseParser());
    }

    public LlmExtractionOracle(LLMClient client, AnalysisResponseParser parser) {
        this.client = client;
        this.parser = parser;
    }

    @Override
    public ExtractionResult analyzeText(String text) {
        String response;
        try {
            response = client.generateJson(AnalysisPrompt.forText(text));
        } catch (LLMException e) {
            throw new ExtractionException("Extraction oracle unavailable via " + client.getProviderName()
                    + ": " + e.getMessage(), e);
        }
        log.debug("Extraction response received, length: {}", response == null ? 0 : response.length());
        return parser.parse(response);
    }
}
