package de.mirkosertic.sessionmemory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * A user message captured during a session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationEntry(
        @Nullable String role,
        @Nullable String message,
        @Nullable ConversationType type,
        @Nullable String timestamp
) {
    public static ConversationEntry of(final String message) {
        return new ConversationEntry("user", message, ConversationType.classify(message), null);
    }
}
