package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectDetails(String projectType, String description) {

    public ProjectDetails overlay(ProjectDetails incoming) {
        if (incoming == null) {
            return this;
        }
        return new ProjectDetails(
                Values.firstText(incoming.projectType, projectType),
                Values.firstText(incoming.description, description));
    }
}
