package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Regulation(
        String id,
        String name,
        Jurisdiction jurisdiction,
        String regulationType,
        String effectiveDate,
        String description,
        Instant createdAt,
        Instant updatedAt,
        Long version
) implements DomainEntity {

    @Override
    public EntityKind kind() {
        return EntityKind.REGULATION;
    }

    @Override
    public String displayName() {
        return name;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .jurisdiction(jurisdiction)
                .regulationType(regulationType)
                .effectiveDate(effectiveDate)
                .description(description)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private Jurisdiction jurisdiction;
        private String regulationType;
        private String effectiveDate;
        private String description;
        private Instant createdAt;
        private Instant updatedAt;
        private Long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder jurisdiction(Jurisdiction jurisdiction) {
            this.jurisdiction = jurisdiction;
            return this;
        }

        public Builder regulationType(String regulationType) {
            this.regulationType = regulationType;
            return this;
        }

        public Builder effectiveDate(String effectiveDate) {
            this.effectiveDate = effectiveDate;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(Long version) {
            this.version = version;
            return this;
        }

        public Regulation build() {
            return new Regulation(id, name, jurisdiction, regulationType, effectiveDate, description,
                    createdAt, updatedAt, version);
        }
    }
}
