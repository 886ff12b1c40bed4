package de.mirkosertic.sessionmemory.selection;

import de.mirkosertic.sessionmemory.model.SessionRecord;
import de.mirkosertic.sessionmemory.ranking.ScoredSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ContextSelector")
class ContextSelectorTest {

    private final ContextSelector selector = new ContextSelector(0.1, 5, 3);

    private static List<ScoredSession> ranked(final double... scores) {
        final List<ScoredSession> result = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            final SessionRecord session = SessionRecord.of("2026-01-" + (10 + i), "session " + i);
            result.add(new ScoredSession(session, 0.0, scores[i], 0.0, scores[i]));
        }
        return result;
    }

    @Test
    @DisplayName("Keeps sessions at or above the threshold")
    void threshold() {
        final List<ScoredSession> selected = selector.select(ranked(0.8, 0.1, 0.09, 0.02));

        assertThat(selected).extracting(ScoredSession::score).containsExactly(0.8, 0.1);
    }

    @Test
    @DisplayName("Caps the number of selected sessions")
    void cap() {
        final List<ScoredSession> selected = selector.select(ranked(0.9, 0.8, 0.7, 0.6, 0.5, 0.4, 0.3));

        assertThat(selected).hasSize(5);
        assertThat(selected).extracting(ScoredSession::score).containsExactly(0.9, 0.8, 0.7, 0.6, 0.5);
    }

    @Test
    @DisplayName("Falls back to the top entries when nothing is relevant")
    void fallback() {
        final List<ScoredSession> ranked = ranked(0.05, 0.04, 0.03, 0.02);

        assertThat(selector.select(ranked)).containsExactlyElementsOf(ranked.subList(0, 3));
        assertThat(selector.select(ranked(0.05))).hasSize(1);
    }

    @Test
    @DisplayName("Empty ranking selects nothing")
    void emptyRanking() {
        assertThat(selector.select(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Rejects negative limits")
    void negativeLimits() {
        assertThatThrownBy(() -> new ContextSelector(0.1, -1, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ContextSelector(0.1, 5, -3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
