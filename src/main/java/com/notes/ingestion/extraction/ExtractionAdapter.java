package com.notes.ingestion.extraction;

import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.OfficeSize;
import com.notes.ingestion.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Second pipeline stage: asks the extraction oracle for the note's category and fields.
 *
 * <p>The oracle is the only source of categorisation. Any failure, including an unexpected runtime
 * error from the oracle, surfaces as an {@link ExtractionException}. Office candidates leave this
 * stage without an employee count, which is owned by the workforce roster.</p>
 */
public class ExtractionAdapter {
    private static final Logger log = LoggerFactory.getLogger(ExtractionAdapter.class);

    private final ExtractionOracle oracle;
    private final MetricsService metrics;

    public ExtractionAdapter(ExtractionOracle oracle, MetricsService metrics) {
        this.oracle = oracle;
        this.metrics = metrics;
    }

    public ExtractionResult extract(String text) {
        ExtractionResult result;
        try {
            result = oracle.analyzeText(text);
        } catch (ExtractionException e) {
            metrics.incrementOracleFailure("extraction");
            throw e;
        } catch (RuntimeException e) {
            metrics.incrementOracleFailure("extraction");
            throw new ExtractionException("Extraction oracle failed: " + e.getMessage(), e);
        }
        if (result == null) {
            metrics.incrementOracleFailure("extraction");
            throw new ExtractionException("Extraction oracle returned no result");
        }

        log.info("Note categorized as {} (confidence {}), {} candidate(s), {} employee(s)",
                result.category(), result.confidence(), result.entities().size(), result.employees().size());
        if (!result.missingFields().isEmpty()) {
            log.debug("Fields missing from note: {}", result.missingFields());
        }

        List<Office> offices = result.entities().offices().stream()
                .map(ExtractionAdapter::withoutEmployeeCount)
                .toList();
        return result.toBuilder()
                .entities(result.entities().withOffices(offices))
                .build();
    }

    private static Office withoutEmployeeCount(Office office) {
        OfficeSize size = office.size();
        if (size == null || size.employeeCount() == null) {
            return office;
        }
        return office.toBuilder().size(size.withoutEmployeeCount()).build();
    }
}
