package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A construction project, optionally attributed to an office.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Project(
        String id,
        String projectName,
        String officeId,
        ProjectStatus status,
        Place location,
        ProjectFinancial financial,
        ProjectDetails details,
        Instant createdAt,
        Instant updatedAt,
        Long version
) implements DomainEntity {

    @Override
    public EntityKind kind() {
        return EntityKind.PROJECT;
    }

    @Override
    public String displayName() {
        return projectName;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .projectName(projectName)
                .officeId(officeId)
                .status(status)
                .location(location)
                .financial(financial)
                .details(details)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String projectName;
        private String officeId;
        private ProjectStatus status;
        private Place location;
        private ProjectFinancial financial;
        private ProjectDetails details;
        private Instant createdAt;
        private Instant updatedAt;
        private Long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder officeId(String officeId) {
            this.officeId = officeId;
            return this;
        }

        public Builder status(ProjectStatus status) {
            this.status = status;
            return this;
        }

        public Builder location(Place location) {
            this.location = location;
            return this;
        }

        public Builder financial(ProjectFinancial financial) {
            this.financial = financial;
            return this;
        }

        public Builder details(ProjectDetails details) {
            this.details = details;
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

        public Project build() {
            return new Project(id, projectName, officeId, status, location, financial, details,
                    createdAt, updatedAt, version);
        }
    }
}
