package de.mirkosertic.sessionmemory.summary;

import de.mirkosertic.sessionmemory.model.ConversationEntry;
import de.mirkosertic.sessionmemory.model.Observation;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Everything captured during one session that a {@link Summarizer} may condense.
 */
public record SummaryRequest(
        @Nullable String project,
        List<Observation> observations,
        List<ConversationEntry> conversations
) {
    public SummaryRequest {
        observations = observations != null
                ? observations.stream().filter(Objects::nonNull).toList()
                : List.of();
        conversations = conversations != null
                ? conversations.stream().filter(Objects::nonNull).toList()
                : List.of();
    }

    public boolean isEmpty() {
        return observations.isEmpty() && conversations.isEmpty();
    }
}
