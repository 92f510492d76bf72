package com.notes.ingestion.api;

import com.notes.ingestion.relationship.RelationshipScope;

/**
 * Tuning options for {@link NoteIngestionPipeline}.
 */
public class PipelineOptions {

    private static final double DEFAULT_FUZZY_MATCH_THRESHOLD = 0.7;
    private static final int DEFAULT_LOCATION_WINDOW_CHARS = 200;
    private static final int DEFAULT_MAX_MERGE_RETRIES = 3;
    private static final int DEFAULT_ID_COLLISION_RETRIES = 5;

    private final double fuzzyMatchThreshold;
    private final boolean webEnrichmentEnabled;
    private final RelationshipScope relationshipScope;
    private final int locationWindowChars;
    private final int maxMergeRetries;
    private final int idCollisionRetries;
    private final String sourceSystem;

    private PipelineOptions(Builder builder) {
        this.fuzzyMatchThreshold = builder.fuzzyMatchThreshold;
        this.webEnrichmentEnabled = builder.webEnrichmentEnabled;
        this.relationshipScope = builder.relationshipScope;
        this.locationWindowChars = builder.locationWindowChars;
        this.maxMergeRetries = builder.maxMergeRetries;
        this.idCollisionRetries = builder.idCollisionRetries;
        this.sourceSystem = builder.sourceSystem;
    }

    /**
     * Similarity a fuzzy match must strictly exceed.
     */
    public double getFuzzyMatchThreshold() {
        return fuzzyMatchThreshold;
    }

    public boolean isWebEnrichmentEnabled() {
        return webEnrichmentEnabled;
    }

    public RelationshipScope getRelationshipScope() {
        return relationshipScope;
    }

    /**
     * Characters scanned on each side of an office name for an existing location mention.
     */
    public int getLocationWindowChars() {
        return locationWindowChars;
    }

    public int getMaxMergeRetries() {
        return maxMergeRetries;
    }

    public int getIdCollisionRetries() {
        return idCollisionRetries;
    }

    /**
     * Actor recorded on audit entries.
     */
    public String getSourceSystem() {
        return sourceSystem;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    /**
     * Defaults with web search turned off.
     */
    public static PipelineOptions withoutWebSearch() {
        return builder().webEnrichmentEnabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double fuzzyMatchThreshold = DEFAULT_FUZZY_MATCH_THRESHOLD;
        private boolean webEnrichmentEnabled = true;
        private RelationshipScope relationshipScope = RelationshipScope.CITY_OR_COUNTRY;
        private int locationWindowChars = DEFAULT_LOCATION_WINDOW_CHARS;
        private int maxMergeRetries = DEFAULT_MAX_MERGE_RETRIES;
        private int idCollisionRetries = DEFAULT_ID_COLLISION_RETRIES;
        private String sourceSystem = "note-ingestion";

        public Builder fuzzyMatchThreshold(double fuzzyMatchThreshold) {
            if (fuzzyMatchThreshold < 0.0 || fuzzyMatchThreshold > 1.0) {
                throw new IllegalArgumentException("fuzzyMatchThreshold must be between 0.0 and 1.0");
            }
            this.fuzzyMatchThreshold = fuzzyMatchThreshold;
            return this;
        }

        public Builder webEnrichmentEnabled(boolean webEnrichmentEnabled) {
            this.webEnrichmentEnabled = webEnrichmentEnabled;
            return this;
        }

        public Builder relationshipScope(RelationshipScope relationshipScope) {
            if (relationshipScope == null) {
                throw new IllegalArgumentException("relationshipScope is required");
            }
            this.relationshipScope = relationshipScope;
            return this;
        }

        public Builder locationWindowChars(int locationWindowChars) {
            if (locationWindowChars < 0) {
                throw new IllegalArgumentException("locationWindowChars must not be negative");
            }
            this.locationWindowChars = locationWindowChars;
            return this;
        }

        public Builder maxMergeRetries(int maxMergeRetries) {
            if (maxMergeRetries < 0) {
                throw new IllegalArgumentException("maxMergeRetries must not be negative");
            }
            this.maxMergeRetries = maxMergeRetries;
            return this;
        }

        public Builder idCollisionRetries(int idCollisionRetries) {
            if (idCollisionRetries <= 0) {
                throw new IllegalArgumentException("idCollisionRetries must be positive");
            }
            this.idCollisionRetries = idCollisionRetries;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            if (sourceSystem == null || sourceSystem.isBlank()) {
                throw new IllegalArgumentException("sourceSystem is required");
            }
            this.sourceSystem = sourceSystem;
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }

    @Override
    public String toString() {
        return "PipelineOptions{" +
                "fuzzyMatchThreshold=" + fuzzyMatchThreshold +
                ", webEnrichmentEnabled=" + webEnrichmentEnabled +
                ", relationshipScope=" + relationshipScope +
                ", locationWindowChars=" + locationWindowChars +
                ", maxMergeRetries=" + maxMergeRetries +
                ", idCollisionRetries=" + idCollisionRetries +
                ", sourceSystem='" + sourceSystem + '\'' +
                '}';
    }
}
