package de.mirkosertic.sessionmemory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Tool specific details of an observation. Which fields are set depends on the tool:
 * file edits carry {@code file}, shell executions carry {@code command}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObservationDetails(
        @Nullable String file,
        @Nullable String command,
        @Nullable Boolean success,
        @Nullable String preview,
        @Nullable String output
) {
    public static ObservationDetails forFile(final String file) {
        return new ObservationDetails(file, null, null, null, null);
    }

    public static ObservationDetails forCommand(final String command) {
        return new ObservationDetails(null, command, null, null, null);
    }

    public boolean failed() {
        return Boolean.FALSE.equals(success);
    }
}
