package de.mirkosertic.sessionmemory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Conversation state at the time a tool was used, i.e. why the tool was used.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObservationContext(
        @Nullable String lastUserMessage,
        @Nullable String lastAssistantMessage
) {
}
