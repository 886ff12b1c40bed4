package de.mirkosertic.sessionmemory.search;

import java.util.List;

/**
 * Totals over all recorded sessions plus the per-project breakdown, most active project first.
 */
public record MemoryStatistics(
        int sessionCount,
        int observationCount,
        List<ProjectStatistics> projects
) {
    public MemoryStatistics {
        projects = List.copyOf(projects);
    }

    public int projectCount() {
        return projects.size();
    }
}
