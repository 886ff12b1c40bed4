package de.mirkosertic.sessionmemory.summary;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a session summary, stored as {@code summary_type}.
 */
public enum SummaryType {

    AI("ai"),
    LOCAL("local");

    private final String value;

    SummaryType(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
