package com.notes.ingestion.core.model;

/**
 * Denormalized link counters kept on an office.
 */
public record ConnectionCounts(int totalProjects, int activeProjects, int clients, int competitors, int suppliers) {

    public static ConnectionCounts zero() {
        return new ConnectionCounts(0, 0, 0, 0, 0);
    }

    public ConnectionCounts withProjectLink(boolean activeProject) {
        return new ConnectionCounts(
                totalProjects + 1,
                activeProject ? activeProjects + 1 : activeProjects,
                clients, competitors, suppliers);
    }
}
