package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectFinancial(Double budget, String currency) {

    public ProjectFinancial overlay(ProjectFinancial incoming) {
        if (incoming == null) {
            return this;
        }
        return new ProjectFinancial(
                Values.firstNonNull(incoming.budget, budget),
                Values.firstText(incoming.currency, currency));
    }
}
