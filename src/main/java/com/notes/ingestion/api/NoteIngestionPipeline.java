package com.notes.ingestion.api;

import com.notes.ingestion.audit.AuditAction;
import com.notes.ingestion.audit.AuditService;
import com.notes.ingestion.audit.InMemoryAuditRepository;
import com.notes.ingestion.audit.NoteLog;
import com.notes.ingestion.cache.CachingWebSearchOracle;
import com.notes.ingestion.cache.LocationCacheConfig;
import com.notes.ingestion.core.model.Employee;
import com.notes.ingestion.core.model.Office;
import com.notes.ingestion.core.model.Project;
import com.notes.ingestion.core.model.Regulation;
import com.notes.ingestion.core.model.Relationship;
import com.notes.ingestion.core.model.Workforce;
import com.notes.ingestion.enrichment.EnrichmentResolver;
import com.notes.ingestion.enrichment.LocationTextScanner;
import com.notes.ingestion.enrichment.NoOpWebSearchOracle;
import com.notes.ingestion.enrichment.SearchConsent;
import com.notes.ingestion.enrichment.WebSearchOracle;
import com.notes.ingestion.extraction.ExtractionAdapter;
import com.notes.ingestion.extraction.ExtractionException;
import com.notes.ingestion.extraction.ExtractionOracle;
import com.notes.ingestion.extraction.ExtractionResult;
import com.notes.ingestion.identity.IdentifierSynthesizer;
import com.notes.ingestion.language.LanguageNormalizer;
import com.notes.ingestion.language.NoOpTranslationOracle;
import com.notes.ingestion.language.NormalizedText;
import com.notes.ingestion.language.TranslationOracle;
import com.notes.ingestion.logging.LogContext;
import com.notes.ingestion.merge.MergeEngine;
import com.notes.ingestion.metrics.MetricsService;
import com.notes.ingestion.metrics.NoOpMetricsService;
import com.notes.ingestion.relationship.RelationshipInferencer;
import com.notes.ingestion.resolution.IdentityResolver;
import com.notes.ingestion.rules.OfficeNameVariants;
import com.notes.ingestion.satellite.SatelliteKind;
import com.notes.ingestion.satellite.SatelliteRecorder;
import com.notes.ingestion.similarity.LevenshteinSimilarity;
import com.notes.ingestion.similarity.SimilarityAlgorithm;
import com.notes.ingestion.store.DocumentStore;
import com.notes.ingestion.store.EntityRepository;
import com.notes.ingestion.store.InMemoryDocumentStore;
import com.notes.ingestion.store.Stored;
import com.notes.ingestion.workforce.EmployerInference;
import com.notes.ingestion.workforce.WorkforceReconciler;
import com.notes.ingestion.workforce.WorkforceUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Main entry point: turns one free-text note into stored offices, projects, regulations and
 * their workforce, satellite records and links.
 *
 * <p>Usage:</p>
 * <pre>
 * NoteIngestionPipeline pipeline = NoteIngestionPipeline.builder()
 *     .extractionOracle(new LlmExtractionOracle(ollama))
 *     .documentStore(store)
 *     .build();
 *
 * ProcessingResult result = pipeline.processNote("Foster + Partners, founded in 1967, based in London");
 * </pre>
 *
 * <p>Stages run in order for each note: language normalization, extraction, web enrichment, create or
 * merge, workforce, satellite records, relationships. Only an extraction failure fails the note; every
 * other stage degrades.</p>
 */
public class NoteIngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(NoteIngestionPipeline.class);

    private final PipelineOptions options;
    private final EntityRepository repository;
    private final LanguageNormalizer normalizer;
    private final ExtractionAdapter extractionAdapter;
    private final EnrichmentResolver enrichment;
    private final EntityWriter writer;
    private final EmployerInference employerInference;
    private final WorkforceReconciler workforceReconciler;
    private final SatelliteRecorder satelliteRecorder;
    private final RelationshipInferencer relationshipInferencer;
    private final NoteLog noteLog;
    private final AuditService auditService;
    private final MetricsService metrics;

    private NoteIngestionPipeline(Builder builder) {
        this.options = builder.options;
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null
                ? builder.auditService
                : new AuditService(new InMemoryAuditRepository(), options.getSourceSystem());
        DocumentStore store = builder.documentStore != null ? builder.documentStore : new InMemoryDocumentStore();
        this.repository = new EntityRepository(store);

        IdentifierSynthesizer identifiers = new IdentifierSynthesizer(repository, builder.random, builder.clock,
                options.getIdCollisionRetries());
        IdentityResolver resolver = new IdentityResolver(repository, builder.similarity, new OfficeNameVariants(),
                options.getFuzzyMatchThreshold(), metrics);
        MergeEngine mergeEngine = new MergeEngine(repository, metrics, options.getMaxMergeRetries());

        this.normalizer = new LanguageNormalizer(builder.translationOracle, metrics);
        this.extractionAdapter = new ExtractionAdapter(builder.extractionOracle, metrics);
        WebSearchOracle search = builder.locationCacheConfig.enabled()
                ? new CachingWebSearchOracle(builder.webSearchOracle, builder.locationCacheConfig)
                : builder.webSearchOracle;
        this.enrichment = new EnrichmentResolver(search, new LocationTextScanner(options.getLocationWindowChars()),
                identifiers, builder.searchConsent, metrics);
        this.writer = new EntityWriter(repository, resolver, mergeEngine, identifiers, auditService, metrics,
                builder.clock);
        this.employerInference = new EmployerInference(resolver);
        this.workforceReconciler = new WorkforceReconciler(repository, metrics, options.getMaxMergeRetries());
        this.satelliteRecorder = new SatelliteRecorder(repository, identifiers, auditService);
        this.relationshipInferencer = new RelationshipInferencer(repository, options.getRelationshipScope(),
                options.getMaxMergeRetries());
        this.noteLog = new NoteLog(repository);
    }

    /**
     * Processes one note. Never throws for oracle or store problems: an extraction failure gives a
     * result with {@code success=false}; store failures show up as local entities or omissions.
     */
    public ProcessingResult processNote(String text) {
        String noteId = LogContext.newNoteId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forNote(noteId)) {
            if (text == null || text.isBlank()) {
                log.warn("Ignoring empty note");
                return finish(ProcessingResult.failure(noteId, "Note text is empty"), start);
            }
            auditService.record(AuditAction.NOTE_RECEIVED, noteId, null, Map.of("length", text.length()));

            NormalizedText normalized = normalizer.normalize(text);
            if (normalized.translated()) {
                auditService.record(AuditAction.NOTE_TRANSLATED, noteId, null);
            }

            ExtractionResult extraction;
            try {
                extraction = extractionAdapter.extract(normalized.text());
            } catch (ExtractionException e) {
                log.error("Failed to analyze note: {}", e.getMessage(), e);
                auditService.record(AuditAction.EXTRACTION_FAILED, noteId, null,
                        Map.of("error", String.valueOf(e.getMessage())));
                return finish(ProcessingResult.failure(noteId, "Failed to analyze text: " + e.getMessage()), start);
            }

            ProcessingResult result = process(noteId, normalized, extraction);
            return finish(result, start);
        }
    }

    private ProcessingResult process(String noteId, NormalizedText normalized, ExtractionResult extraction) {
        List<Office> officeCandidates = extraction.entities().offices();
        if (options.isWebEnrichmentEnabled()) {
            officeCandidates = enrichment.enrich(officeCandidates, normalized.text());
        }
        noteLog.recordPending(normalized);

        List<Stored<Office>> createdOffices = new ArrayList<>();
        List<Stored<Office>> mergedOffices = new ArrayList<>();
        for (Office candidate : officeCandidates) {
            writer.writeOffice(candidate, noteId).ifPresent(written ->
                    (written.merged() ? mergedOffices : createdOffices).add(written.stored()));
        }
        List<Stored<Project>> projects = new ArrayList<>();
        for (Project candidate : extraction.entities().projects()) {
            writer.writeProject(candidate, noteId).ifPresent(written -> projects.add(written.stored()));
        }
        List<Stored<Regulation>> regulations = new ArrayList<>();
        for (Regulation candidate : extraction.entities().regulations()) {
            writer.writeRegulation(candidate, noteId).ifPresent(written -> regulations.add(written.stored()));
        }

        List<Office> resolvedOffices = new ArrayList<>(persisted(createdOffices));
        resolvedOffices.addAll(persisted(mergedOffices));
        // an inferred employer only receives the roster, it is not part of this note's batch
        List<Office> employers = new ArrayList<>(resolvedOffices);
        if (officeCandidates.isEmpty() && !extraction.employees().isEmpty()) {
            employerInference.inferEmployer(normalized.text()).ifPresent(employers::add);
        }

        List<Stored<Workforce>> workforce = new ArrayList<>();
        List<WorkforceUpdate> workforceUpdates = new ArrayList<>();
        reconcileWorkforce(noteId, employers, extraction, workforce, workforceUpdates);

        String onlyOfficeId = resolvedOffices.size() == 1 ? resolvedOffices.get(0).id() : null;
        Map<SatelliteKind, Integer> satellitesSaved = satelliteRecorder.record(extraction.satellites(),
                onlyOfficeId, noteId);

        List<Relationship> relationships = relationshipInferencer.infer(resolvedOffices, persisted(projects),
                persisted(regulations));
        relationships.forEach(link -> auditService.record(AuditAction.RELATIONSHIP_CREATED, noteId, link.id(),
                Map.of("type", link.relationshipType().value())));

        EntitiesCreated created = new EntitiesCreated(createdOffices, projects, regulations, workforce,
                mergedOffices);
        String summary = SummaryFormatter.format(created, workforceUpdates);
        noteLog.markProcessed(normalized.originalText(), created.total() > 0 ? "success" : "no_entities",
                createdCounts(created), summary);
        log.info("Note processed: {}", summary);

        return new ProcessingResult(true, noteId, extraction.category(), created, workforceUpdates, relationships,
                satellitesSaved, summary, created.total());
    }

    private void reconcileWorkforce(String noteId, List<Office> offices, ExtractionResult extraction,
                                    List<Stored<Workforce>> workforce, List<WorkforceUpdate> updates) {
        List<Employee> employees = extraction.employees();
        if (employees.isEmpty()) {
            return;
        }
        if (offices.isEmpty()) {
            log.info("{} employee(s) mentioned but no office resolved, roster not updated", employees.size());
            return;
        }
        for (Office office : offices) {
            workforceReconciler.reconcile(office, employees, extraction.employeeDistribution())
                    .ifPresent(reconciled -> {
                        workforce.add(Stored.persisted(reconciled.workforce()));
                        WorkforceUpdate update = reconciled.update();
                        if (update.hasChanges()) {
                            updates.add(update);
                        }
                        auditService.record(AuditAction.WORKFORCE_UPDATED, noteId, reconciled.workforce().id(),
                                Map.of("added", update.employeesAdded(), "updated", update.employeesUpdated(),
                                        "total", update.totalEmployees()));
                    });
        }
    }

    private ProcessingResult finish(ProcessingResult result, long startNanos) {
        metrics.recordNoteProcessed(result.success(), Duration.ofNanos(System.nanoTime() - startNanos));
        return result;
    }

    private static <T> List<T> persisted(List<Stored<T>> stored) {
        return stored.stream().filter(Stored::isPersisted).map(Stored::entity).toList();
    }

    private static Map<String, Integer> createdCounts(EntitiesCreated created) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("offices", created.offices().size());
        counts.put("projects", created.projects().size());
        counts.put("regulations", created.regulations().size());
        counts.put("workforce", created.workforce().size());
        counts.put("mergedOffices", created.mergedOffices().size());
        return counts;
    }

    public PipelineOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public EntityRepository getRepository() {
        return repository;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ExtractionOracle extractionOracle;
        private DocumentStore documentStore;
        private TranslationOracle translationOracle = new NoOpTranslationOracle();
        private WebSearchOracle webSearchOracle = new NoOpWebSearchOracle();
        private SearchConsent searchConsent = SearchConsent.ALWAYS;
        private LocationCacheConfig locationCacheConfig = LocationCacheConfig.defaults();
        private SimilarityAlgorithm similarity = new LevenshteinSimilarity();
        private MetricsService metricsService;
        private AuditService auditService;
        private PipelineOptions options = PipelineOptions.defaults();
        private Clock clock = Clock.systemUTC();
        private Random random = new Random();

        /**
         * Required: the oracle that categorizes notes and extracts candidates.
         */
        public Builder extractionOracle(ExtractionOracle extractionOracle) {
            this.extractionOracle = extractionOracle;
            return this;
        }

        public Builder documentStore(DocumentStore documentStore) {
            this.documentStore = documentStore;
            return this;
        }

        public Builder translationOracle(TranslationOracle translationOracle) {
            this.translationOracle = translationOracle;
            return this;
        }

        public Builder webSearchOracle(WebSearchOracle webSearchOracle) {
            this.webSearchOracle = webSearchOracle;
            return this;
        }

        public Builder searchConsent(SearchConsent searchConsent) {
            this.searchConsent = searchConsent;
            return this;
        }

        public Builder locationCache(LocationCacheConfig locationCacheConfig) {
            this.locationCacheConfig = locationCacheConfig;
            return this;
        }

        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = similarity;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Random source for identifier suffixes. Tests pass a seeded instance.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public NoteIngestionPipeline build() {
            if (extractionOracle == null) {
                throw new IllegalStateException("ExtractionOracle is required");
            }
            if (options == null) {
                throw new IllegalStateException("PipelineOptions is required");
            }
            return new NoteIngestionPipeline(this);
        }
    }
}
