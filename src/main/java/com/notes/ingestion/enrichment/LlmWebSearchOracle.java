package com.notes.ingestion.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notes.ingestion.core.ObjectMappers;
import com.notes.ingestion.llm.LLMClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link WebSearchOracle} that asks a language model for the office's public details.
 * Transport errors propagate as {@link com.notes.ingestion.llm.LLMException}; an answer that cannot be
 * read is treated as no result.
 */
public class LlmWebSearchOracle implements WebSearchOracle {
    private static final Logger log = LoggerFactory.getLogger(LlmWebSearchOracle.class);

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private final LLMClient client;
    private final ObjectMapper mapper;

    public LlmWebSearchOracle(LLMClient client) {
        this.client = client;
        this.mapper = ObjectMappers.create();
    }

    @Override
    public Optional<LocationSearchResult> searchOfficeLocation(String officeName) {
        String prompt = "Where is the architecture office \"" + officeName + "\" headquartered?\n"
                + "Respond with JSON only: {\"country\": \"...\", \"city\": \"...\", "
                + "\"website\": \"...\", \"description\": \"...\"}.\n"
                + "Use null for anything you do not know.";
        String answer = client.generateJson(prompt);

        Matcher matcher = JSON_OBJECT.matcher(answer);
        if (!matcher.find()) {
            log.debug("No JSON in location answer for '{}'", officeName);
            return Optional.empty();
        }
        try {
            LocationSearchResult result = mapper.readValue(matcher.group(), LocationSearchResult.class);
            return result.hasLocation() ? Optional.of(result) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Unreadable location answer for '{}': {}", officeName, e.getMessage());
            return Optional.empty();
        }
    }
}
