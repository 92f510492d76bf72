package com.notes.ingestion.core.model;

public record EmployeeDistribution(int architects, int engineers, int designers, int administrative) {

    public boolean hasAnyCount() {
        return architects > 0 || engineers > 0 || designers > 0 || administrative > 0;
    }
}
