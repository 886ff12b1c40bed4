package de.mirkosertic.sessionmemory.ranking;

import de.mirkosertic.sessionmemory.KeywordExtractor;
import de.mirkosertic.sessionmemory.model.ConversationEntry;
import de.mirkosertic.sessionmemory.model.CurrentContext;
import de.mirkosertic.sessionmemory.model.SessionRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("RelevanceRanker")
class RelevanceRankerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private static final List<ConversationEntry> ONE_CONVERSATION =
            List.of(new ConversationEntry("user", null, null, null));

    private KeywordExtractor keywordExtractor;
    private RelevanceRanker ranker;

    @BeforeEach
    void setUp() {
        keywordExtractor = new KeywordExtractor();
        ranker = new RelevanceRanker(keywordExtractor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        keywordExtractor.close();
    }

    private static String ago(final Duration duration) {
        return NOW.minus(duration).toString();
    }

    @Nested
    @DisplayName("Empty input")
    class EmptyInput {

        @Test
        @DisplayName("Returns an empty list for an empty or missing corpus")
        void emptyCorpus() {
            final CurrentContext context = CurrentContext.of("/home/user/projects/auth-service");

            assertThat(ranker.rank(context, List.of())).isEmpty();
            assertThat(ranker.rank(context, null)).isEmpty();
        }

        @Test
        @DisplayName("Ranks by recency alone when there is no context")
        void missingContext() {
            final SessionRecord session = SessionRecord.of(ago(Duration.ofHours(12)), "auth service");

            final List<ScoredSession> ranked = ranker.rank(null, List.of(session));

            assertThat(ranked).singleElement().satisfies(scored -> {
                assertThat(scored.similarity()).isZero();
                assertThat(scored.score()).isCloseTo(0.75 * 0.45, within(1e-12));
            });
        }

        @Test
        @DisplayName("Skips null sessions")
        void nullSessions() {
            final SessionRecord session = SessionRecord.of(NOW.toString(), "auth");

            final List<ScoredSession> ranked = ranker.rank(CurrentContext.of("/auth"), Arrays.asList(null, session, null));

            assertThat(ranked).extracting(ScoredSession::session).containsExactly(session);
        }
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("Ranks related recent work first and unrelated old work last")
        void endToEnd() {
            // Given: the auth-service project and three past sessions
            final CurrentContext context = CurrentContext.of("/home/user/projects/auth-service");
            final SessionRecord jwt = SessionRecord.of(ago(Duration.ofHours(2)), "implemented JWT refresh token logic")
                    .withConversations(ONE_CONVERSATION);
            final SessionRecord css = SessionRecord.of(ago(Duration.ofDays(10)), "fixed CSS layout bug");
            final SessionRecord login = SessionRecord.of(ago(Duration.ofDays(30)), "refactored auth service login flow")
                    .withConversations(ONE_CONVERSATION);

            // When
            final List<ScoredSession> ranked = ranker.rank(context, List.of(jwt, css, login));

            // Then
            assertThat(ranked).extracting(ScoredSession::session).containsExactly(jwt, login, css);

            assertThat(ranked.get(0).similarity()).isZero();
            assertThat(ranked.get(0).timeWeight()).isCloseTo(1.0 - 2.0 / 48.0, within(1e-12));
            assertThat(ranked.get(0).score()).isCloseTo(0.58125, within(1e-9));

            assertThat(ranked.get(1).similarity()).isCloseTo(0.292984, within(1e-6));
            assertThat(ranked.get(1).structuralBonus()).isEqualTo(RelevanceRanker.CONVERSATION_BONUS);
            assertThat(ranked.get(1).score()).isCloseTo(0.3199872, within(1e-6));

            assertThat(ranked.get(2).similarity()).isZero();
            assertThat(ranked.get(2).structuralBonus()).isZero();
            assertThat(ranked.get(2).score()).isCloseTo(0.2202937, within(1e-6));
        }

        @Test
        @DisplayName("A session identical to the context and from now scores 0.85")
        void selfSimilarity() {
            final SessionRecord session = SessionRecord.of(NOW.toString(), "auth service");

            final ScoredSession scored = ranker.rank(CurrentContext.of("/auth/service"), List.of(session)).get(0);

            assertThat(scored.similarity()).isCloseTo(1.0, within(1e-9));
            assertThat(scored.timeWeight()).isEqualTo(1.0);
            assertThat(scored.score()).isCloseTo(0.85, within(1e-9));
        }

        @Test
        @DisplayName("Captured conversation adds exactly 0.15")
        void conversationBonus() {
            final String timestamp = ago(Duration.ofDays(3));
            final SessionRecord plain = SessionRecord.of(timestamp, "auth login");
            final SessionRecord talked = SessionRecord.of(timestamp, "auth login").withConversations(ONE_CONVERSATION);

            final List<ScoredSession> ranked = ranker.rank(CurrentContext.of("/src/auth"), List.of(plain, talked));

            assertThat(ranked.get(0).session()).isEqualTo(talked);
            assertThat(ranked.get(0).score() - ranked.get(1).score()).isCloseTo(0.15, within(1e-12));
        }

        @Test
        @DisplayName("Clamps the fused score to 1.0")
        void clampsScore() {
            final SessionRecord future = SessionRecord.of(NOW.plus(Duration.ofHours(12)).toString(), "auth service")
                    .withConversations(ONE_CONVERSATION);

            final ScoredSession scored = ranker.rank(CurrentContext.of("/auth/service"), List.of(future)).get(0);

            assertThat(scored.timeWeight()).isCloseTo(1.25, within(1e-12));
            assertThat(scored.score()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Scores stay within [0, 1] and come out sorted")
        void boundsAndOrder() {
            final List<SessionRecord> corpus = new ArrayList<>();
            for (int day = 0; day < 20; day++) {
                final SessionRecord session = SessionRecord.of(ago(Duration.ofDays(day).plusHours(day)),
                        day % 3 == 0 ? "auth service session " + day : "unrelated styling work");
                corpus.add(day % 2 == 0 ? session.withConversations(ONE_CONVERSATION) : session);
            }
            corpus.add(SessionRecord.of("not a date", "auth"));

            final List<ScoredSession> ranked = ranker.rank(CurrentContext.of("/projects/auth-service"), corpus);

            assertThat(ranked).hasSize(corpus.size());
            assertThat(ranked).allSatisfy(scored -> assertThat(scored.score()).isBetween(0.0, 1.0));
            assertThat(ranked).extracting(ScoredSession::score)
                    .isSortedAccordingTo((a, b) -> Double.compare(b, a));
        }

        @Test
        @DisplayName("Equal scores keep corpus order")
        void stableTies() {
            final String timestamp = ago(Duration.ofDays(1));
            final SessionRecord first = SessionRecord.of(timestamp, "auth").withProject("first");
            final SessionRecord second = SessionRecord.of(timestamp, "auth").withProject("second");
            final SessionRecord third = SessionRecord.of(timestamp, "auth").withProject("third");

            final List<ScoredSession> ranked = ranker.rank(CurrentContext.of("/auth"), List.of(first, second, third));

            assertThat(ranked).extracting(scored -> scored.session().project())
                    .containsExactly("first", "second", "third");
        }

        @Test
        @DisplayName("Fuses with fixed weights")
        void fuse() {
            assertThat(RelevanceRanker.fuse(0.5, 0.5, 0.0)).isCloseTo(0.425, within(1e-12));
            assertThat(RelevanceRanker.fuse(1.0, 1.0, 0.15)).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("A session whose keywords cannot be extracted is treated as empty")
        void failingDocument() {
            // Given
            final SessionDocumentBuilder documentBuilder = mock(SessionDocumentBuilder.class);
            final TimeDecay timeDecay = mock(TimeDecay.class);
            final CurrentContext context = CurrentContext.of("/auth");
            final SessionRecord good = SessionRecord.of("2026-01-15T11:00:00Z", "auth");
            final SessionRecord broken = SessionRecord.of("2026-01-15T10:00:00Z", "auth");
            when(documentBuilder.contextDocument(context)).thenReturn(List.of("auth"));
            when(documentBuilder.sessionDocument(good)).thenReturn(List.of("auth"));
            when(documentBuilder.sessionDocument(broken)).thenThrow(new IllegalStateException("broken analyzer"));
            when(timeDecay.weight(good.timestamp())).thenReturn(1.0);
            when(timeDecay.weight(broken.timestamp())).thenReturn(0.5);

            // When
            final List<ScoredSession> ranked = new RelevanceRanker(documentBuilder, timeDecay)
                    .rank(context, List.of(broken, good));

            // Then
            assertThat(ranked).extracting(ScoredSession::session).containsExactly(good, broken);
            assertThat(ranked.get(1).similarity()).isZero();
            assertThat(ranked.get(1).score()).isCloseTo(0.225, within(1e-12));
        }

        @Test
        @DisplayName("A session that cannot be scored keeps only its bonus")
        void failingScore() {
            // Given
            final SessionDocumentBuilder documentBuilder = mock(SessionDocumentBuilder.class);
            final TimeDecay timeDecay = mock(TimeDecay.class);
            final CurrentContext context = CurrentContext.of("/auth");
            final SessionRecord good = SessionRecord.of("2026-01-15T11:00:00Z", "css");
            final SessionRecord broken = SessionRecord.of("2026-01-15T10:00:00Z", "auth")
                    .withConversations(ONE_CONVERSATION);
            when(documentBuilder.contextDocument(context)).thenReturn(List.of("auth"));
            when(documentBuilder.sessionDocument(good)).thenReturn(List.of("css"));
            when(documentBuilder.sessionDocument(broken)).thenReturn(List.of("auth"));
            when(timeDecay.weight(good.timestamp())).thenReturn(1.0);
            when(timeDecay.weight(broken.timestamp())).thenThrow(new IllegalStateException("clock failure"));

            // When
            final List<ScoredSession> ranked = new RelevanceRanker(documentBuilder, timeDecay)
                    .rank(context, List.of(broken, good));

            // Then
            assertThat(ranked).hasSize(2);
            assertThat(ranked.get(0).session()).isEqualTo(good);
            assertThat(ranked.get(1)).isEqualTo(new ScoredSession(broken, 0.0, 0.0, 0.15, 0.15));
        }
    }
}
