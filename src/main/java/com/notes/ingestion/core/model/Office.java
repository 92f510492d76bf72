package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * An architecture office. Also used as the partial candidate produced by extraction, in which
 * case most fields may be {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Office(
        String id,
        String name,
        String officialName,
        Integer founded,
        OfficeStatus status,
        OfficeLocation location,
        OfficeSize size,
        List<String> specializations,
        List<String> notableWorks,
        ConnectionCounts connectionCounts,
        String website,
        Instant createdAt,
        Instant updatedAt,
        Long version
) implements DomainEntity {

    public Office {
        specializations = Values.cleanList(specializations);
        notableWorks = Values.cleanList(notableWorks);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.OFFICE;
    }

    @Override
    public String displayName() {
        return name;
    }

    public Place headquarters() {
        return location != null ? location.headquarters() : null;
    }

    public boolean hasHeadquarters() {
        return location != null && location.hasHeadquarters();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .officialName(officialName)
                .founded(founded)
                .status(status)
                .location(location)
                .size(size)
                .specializations(specializations)
                .notableWorks(notableWorks)
                .connectionCounts(connectionCounts)
                .website(website)
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
        private String officialName;
        private Integer founded;
        private OfficeStatus status;
        private OfficeLocation location;
        private OfficeSize size;
        private List<String> specializations;
        private List<String> notableWorks;
        private ConnectionCounts connectionCounts;
        private String website;
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

        public Builder officialName(String officialName) {
            this.officialName = officialName;
            return this;
        }

        public Builder founded(Integer founded) {
            this.founded = founded;
            return this;
        }

        public Builder status(OfficeStatus status) {
            this.status = status;
            return this;
        }

        public Builder location(OfficeLocation location) {
            this.location = location;
            return this;
        }

        public Builder headquarters(String city, String country) {
            List<Place> others = location != null ? location.otherOffices() : List.of();
            this.location = new OfficeLocation(Place.of(city, country), others);
            return this;
        }

        public Builder size(OfficeSize size) {
            this.size = size;
            return this;
        }

        public Builder specializations(List<String> specializations) {
            this.specializations = specializations;
            return this;
        }

        public Builder notableWorks(List<String> notableWorks) {
            this.notableWorks = notableWorks;
            return this;
        }

        public Builder connectionCounts(ConnectionCounts connectionCounts) {
            this.connectionCounts = connectionCounts;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
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

        public Office build() {
            return new Office(id, name, officialName, founded, status, location, size,
                    specializations, notableWorks, connectionCounts, website,
                    createdAt, updatedAt, version);
        }
    }
}
