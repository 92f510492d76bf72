package com.notes.ingestion.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.notes.ingestion.core.ObjectMappers;
import com.notes.ingestion.core.model.Employee;
import com.notes.ingestion.core.model.EmployeeDistribution;
import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.Project;
import com.notes.ingestion.core.model.Regulation;
import com.notes.ingestion.satellite.SatelliteKind;
import com.notes.ingestion.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the oracle's answer into an {@link ExtractionResult}.
 *
 * <p>The answer may wrap the JSON object in prose; the outermost {@code {...}} span is parsed.
 * A missing or unknown category, or a main record that does not fit its type, is an
 * {@link ExtractionException}. Auxiliary structures that do not parse are dropped with a warning.</p>
 */
public class AnalysisResponseParser {
    private static final Logger log = LoggerFactory.getLogger(AnalysisResponseParser.class);

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public AnalysisResponseParser() {
        this(ObjectMappers.create());
    }

    public AnalysisResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ExtractionResult parse(String response) {
        if (response == null) {
            throw new ExtractionException("Empty response from extraction oracle");
        }
        Matcher matcher = JSON_OBJECT.matcher(response);
        if (!matcher.find()) {
            throw new ExtractionException("No JSON found in extraction response");
        }

        JsonNode root;
        try {
            root = mapper.readTree(matcher.group());
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Failed to parse extraction response", e);
        }

        JsonNode categorization = root.path("categorization");
        NoteCategory category;
        try {
            category = NoteCategory.fromLabel(categorization.path("category").asText(null));
        } catch (IllegalArgumentException e) {
            throw new ExtractionException("Extraction response has no valid category: "
                    + categorization.path("category").asText("<missing>"), e);
        }

        JsonNode extraction = root.path("extraction");
        JsonNode data = extraction.path("extractedData");

        return ExtractionResult.builder()
                .category(category)
                .confidence(categorization.path("confidence").asDouble(0.0))
                .reasoning(categorization.path("reasoning").asText(""))
                .entities(entities(category, data))
                .missingFields(strings(extraction.path("missingFields")))
                .employees(employees(extraction.path("employees")))
                .employeeDistribution(optional(extraction.path("employeeDistribution"), EmployeeDistribution.class))
                .satellites(satellites(extraction))
                .build();
    }

    private ExtractedEntities entities(NoteCategory category, JsonNode data) {
        if (!data.isObject() || category == NoteCategory.UNKNOWN) {
            return ExtractedEntities.none();
        }
        // fields owned by the store; a regulation's own "version" label must not reach the record
        ObjectNode fields = ((ObjectNode) data).deepCopy();
        fields.remove(List.of(DocumentStore.VERSION, DocumentStore.CREATED_AT, DocumentStore.UPDATED_AT));
        data = fields;
        try {
            return switch (category) {
                case OFFICE -> ExtractedEntities.ofOffice(mapper.treeToValue(data, Office.class));
                case PROJECT -> ExtractedEntities.ofProject(mapper.treeToValue(data, Project.class));
                case REGULATION -> ExtractedEntities.ofRegulation(mapper.treeToValue(data, Regulation.class));
                case UNKNOWN -> ExtractedEntities.none();
            };
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ExtractionException("Extracted " + category.name().toLowerCase() + " data is malformed", e);
        }
    }

    private List<Employee> employees(JsonNode node) {
        List<Employee> employees = new ArrayList<>();
        if (!node.isArray()) {
            return employees;
        }
        for (JsonNode item : node) {
            if (item.isTextual()) {
                employees.add(Employee.named(item.asText()));
            } else {
                Employee employee = optional(item, Employee.class);
                if (employee != null) {
                    employees.add(employee);
                }
            }
        }
        return employees;
    }

    private Map<SatelliteKind, List<Map<String, Object>>> satellites(JsonNode extraction) {
        Map<SatelliteKind, List<Map<String, Object>>> satellites = new EnumMap<>(SatelliteKind.class);
        for (SatelliteKind kind : SatelliteKind.values()) {
            JsonNode node = extraction.path(kind.key());
            List<Map<String, Object>> records = new ArrayList<>();
            if (node.isArray()) {
                node.forEach(item -> addRecord(records, item));
            } else {
                addRecord(records, node);
            }
            if (!records.isEmpty()) {
                satellites.put(kind, records);
            }
        }
        return satellites;
    }

    private void addRecord(List<Map<String, Object>> records, JsonNode node) {
        if (node.isObject()) {
            records.add(mapper.convertValue(node, RECORD));
        }
    }

    private List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            });
        }
        return values;
    }

    private <T> T optional(JsonNode node, Class<T> type) {
        if (node == null || !node.isObject()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Ignoring malformed {} in extraction response: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }
}
