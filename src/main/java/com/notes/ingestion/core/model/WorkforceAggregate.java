package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkforceAggregate(
        int totalEmployees,
        EmployeeDistribution distribution,
        double retentionRate,
        double growthRate
) {

    /**
     * Aggregate as written after a roster update; rates are not tracked yet and stay at zero.
     */
    public static WorkforceAggregate of(int totalEmployees, EmployeeDistribution distribution) {
        return new WorkforceAggregate(totalEmployees, distribution, 0.0, 0.0);
    }
}
