package com.notes.ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Size block of an office. {@code employeeCount} is owned by the workforce roster and is
 * dropped from extracted candidates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OfficeSize(Integer employeeCount, SizeCategory sizeCategory, Double annualRevenue) {

    public static OfficeSize ofCategory(SizeCategory category) {
        return new OfficeSize(null, category, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return employeeCount == null && sizeCategory == null && annualRevenue == null;
    }

    public OfficeSize withoutEmployeeCount() {
        return new OfficeSize(null, sizeCategory, annualRevenue);
    }

    public OfficeSize withEmployeeCount(int count) {
        return new OfficeSize(count, sizeCategory, annualRevenue);
    }

    public OfficeSize withSizeCategory(SizeCategory category) {
        return new OfficeSize(employeeCount, category, annualRevenue);
    }

    public OfficeSize overlay(OfficeSize incoming) {
        if (incoming == null) {
            return this;
        }
        return new OfficeSize(
                Values.firstNonNull(incoming.employeeCount, employeeCount),
                Values.firstNonNull(incoming.sizeCategory, sizeCategory),
                Values.firstNonNull(incoming.annualRevenue, annualRevenue));
    }
}
