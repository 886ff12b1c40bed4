package de.mirkosertic.sessionmemory.search;

/**
 * Activity recorded for one project.
 *
 * @param project          the project name, {@code unknown} for sessions without one
 * @param sessionCount     number of recorded sessions
 * @param observationCount number of tool operations over all of them
 */
public record ProjectStatistics(
        String project,
        int sessionCount,
        int observationCount
) {
}
