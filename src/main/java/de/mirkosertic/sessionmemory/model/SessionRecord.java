package de.mirkosertic.sessionmemory.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A previously recorded session, as loaded by the persistence layer.
 *
 * <p>The ranking engine treats instances as read-only input and hands them back
 * unchanged inside {@code ScoredSession}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionRecord(
        /** ISO-8601 time the session ended. Stored as {@code date}. */
        @JsonProperty("date") @JsonAlias("timestamp") @Nullable String timestamp,
        @Nullable String summary,
        @Nullable String project,
        @JsonProperty("summary_type") @Nullable String summaryType,
        @Nullable List<String> keywords,
        @Nullable List<ConversationEntry> conversations,
        @Nullable List<Observation> observations,
        @JsonProperty("observation_count") @Nullable Integer observationCount,
        @JsonProperty("conversation_count") @Nullable Integer conversationCount
) {
    public static SessionRecord of(final String timestamp, final String summary) {
        return new SessionRecord(timestamp, summary, null, null, null, null, null, null, null);
    }

    public SessionRecord withConversations(final List<ConversationEntry> conversations) {
        return new SessionRecord(timestamp, summary, project, summaryType, keywords, conversations, observations,
                observationCount, conversationCount);
    }

    public SessionRecord withObservations(final List<Observation> observations) {
        return new SessionRecord(timestamp, summary, project, summaryType, keywords, conversations, observations,
                observationCount, conversationCount);
    }

    public SessionRecord withProject(final String project) {
        return new SessionRecord(timestamp, summary, project, summaryType, keywords, conversations, observations,
                observationCount, conversationCount);
    }

    public boolean hasConversations() {
        return conversations != null && !conversations.isEmpty();
    }

    public List<ConversationEntry> conversationsOrEmpty() {
        return conversations != null ? conversations : List.of();
    }

    public List<Observation> observationsOrEmpty() {
        return observations != null ? observations : List.of();
    }

    /**
     * Number of recorded tool operations: the stored count when positive, the size of the
     * stored observations otherwise.
     */
    public int observationTotal() {
        if (observationCount != null && observationCount > 0) {
            return observationCount;
        }
        return observations != null ? observations.size() : 0;
    }

    public List<String> keywordsOrEmpty() {
        return keywords != null ? keywords : List.of();
    }
}
