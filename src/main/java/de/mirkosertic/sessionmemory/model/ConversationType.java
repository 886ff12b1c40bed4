package de.mirkosertic.sessionmemory.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Kind of a captured user message.
 */
public enum ConversationType {

    QUESTION("question"),
    REQUEST("request"),
    FEEDBACK("feedback"),
    STATEMENT("statement");

    private static final List<String> QUESTION_MARKERS = List.of(
            "뭐", "어떻게", "왜", "언제", "what", "how", "why", "when");

    private static final List<String> REQUEST_MARKERS = List.of(
            "해줘", "해주세요", "만들어", "수정", "추가", "삭제",
            "please", "create", "fix", "add", "update", "delete");

    private static final List<String> FEEDBACK_MARKERS = List.of(
            "좋아", "됐어", "아니", "다시", "ㅋ", "ㅎ", "ok", "good", "no", "wrong");

    private final String value;

    ConversationType(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Maps a stored value to a type. Unknown values are read as {@link #STATEMENT}.
     */
    @JsonCreator
    public static ConversationType fromValue(@Nullable final String value) {
        if (value != null) {
            for (final ConversationType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        return STATEMENT;
    }

    /**
     * Classifies a user message by substring markers. Questions win over requests,
     * requests over feedback.
     *
     * @param message the raw message (may be null)
     * @return the detected type, {@link #STATEMENT} when nothing matches
     */
    public static ConversationType classify(@Nullable final String message) {
        if (message == null || message.isBlank()) {
            return STATEMENT;
        }
        final String lower = message.toLowerCase(Locale.ROOT);
        if (message.indexOf('?') >= 0 || containsAny(lower, QUESTION_MARKERS)) {
            return QUESTION;
        }
        if (containsAny(lower, REQUEST_MARKERS)) {
            return REQUEST;
        }
        if (containsAny(lower, FEEDBACK_MARKERS)) {
            return FEEDBACK;
        }
        return STATEMENT;
    }

    private static boolean containsAny(final String text, final List<String> markers) {
        for (final String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
