package de.mirkosertic.sessionmemory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * A recorded tool operation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Observation(
        @Nullable String tool,
        @Nullable String summary,
        @Nullable ObservationDetails details,
        @Nullable ObservationContext context,
        @Nullable String timestamp
) {
    public static Observation of(final String tool, final String summary, @Nullable final ObservationDetails details) {
        return new Observation(tool, summary, details, null, null);
    }

    @Nullable
    public String file() {
        return details != null ? details.file() : null;
    }

    @Nullable
    public String command() {
        return details != null ? details.command() : null;
    }

    @Nullable
    public String lastUserMessage() {
        return context != null ? context.lastUserMessage() : null;
    }
}
