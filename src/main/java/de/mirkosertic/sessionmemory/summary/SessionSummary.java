package de.mirkosertic.sessionmemory.summary;

/**
 * A generated session summary and how it was produced.
 */
public record SessionSummary(String text, SummaryType type) {
}
