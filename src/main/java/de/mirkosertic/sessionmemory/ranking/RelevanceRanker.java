package de.mirkosertic.sessionmemory.ranking;

import de.mirkosertic.sessionmemory.KeywordExtractor;
import de.mirkosertic.sessionmemory.model.CurrentContext;
import de.mirkosertic.sessionmemory.model.SessionRecord;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranks recorded sessions by their estimated relevance to the current working context.
 *
 * <p>Each session is scored as
 * {@code min(1, similarity * 0.4 + timeWeight * 0.45 + bonus)}, where {@code similarity}
 * is the cosine similarity of TF-IDF vectors of the context and session documents,
 * {@code timeWeight} comes from {@link TimeDecay} and {@code bonus} is 0.15 for sessions
 * with captured conversation. The weights are fixed.</p>
 *
 * <p>Document frequencies are rebuilt for every call over the context document plus all
 * session documents. The ranker keeps no state between calls and may be shared between
 * threads. Scoring never fails as a whole: a session that cannot be scored is reported
 * with zero similarity and zero time weight.</p>
 */
public class RelevanceRanker {

    private static final Logger logger = LoggerFactory.getLogger(RelevanceRanker.class);

    public static final double SIMILARITY_WEIGHT = 0.4;
    public static final double TIME_WEIGHT = 0.45;
    public static final double CONVERSATION_BONUS = 0.15;

    private static final Comparator<ScoredSession> BY_SCORE_DESCENDING =
            Comparator.comparingDouble(ScoredSession::score).reversed();

    private final SessionDocumentBuilder documentBuilder;
    private final TimeDecay timeDecay;

    public RelevanceRanker(final KeywordExtractor keywordExtractor, final Clock clock) {
        this(new SessionDocumentBuilder(keywordExtractor), new TimeDecay(clock));
    }

    public RelevanceRanker(final SessionDocumentBuilder documentBuilder, final TimeDecay timeDecay) {
        this.documentBuilder = documentBuilder;
        this.timeDecay = timeDecay;
    }

    /**
     * Scores and sorts the corpus, most relevant first. Equal scores keep corpus order.
     *
     * @param context the current working context
     * @param corpus  the sessions to rank (null entries are skipped)
     * @return one scored entry per non-null session
     */
    public List<ScoredSession> rank(@Nullable final CurrentContext context, @Nullable final List<SessionRecord> corpus) {
        if (corpus == null || corpus.isEmpty()) {
            return List.of();
        }
        final long startTime = System.nanoTime();

        final List<SessionRecord> sessions = corpus.stream()
                .filter(Objects::nonNull)
                .toList();

        final List<String> contextDocument = context != null
                ? documentBuilder.contextDocument(context)
                : List.of();
        final List<List<String>> sessionDocuments = new ArrayList<>(sessions.size());
        for (final SessionRecord session : sessions) {
            sessionDocuments.add(sessionDocumentOrEmpty(session));
        }

        final List<List<String>> allDocuments = new ArrayList<>(sessions.size() + 1);
        allDocuments.add(contextDocument);
        allDocuments.addAll(sessionDocuments);
        final DocumentFrequencyTable documentFrequencies = TfIdfIndexer.documentFrequency(allDocuments);
        final int totalDocuments = sessions.size() + 1;

        final SparseVector contextVector = TfIdfIndexer.tfidf(contextDocument, documentFrequencies, totalDocuments);

        final List<ScoredSession> scored = new ArrayList<>(sessions.size());
        for (int i = 0; i < sessions.size(); i++) {
            final SessionRecord session = sessions.get(i);
            try {
                scored.add(score(session, sessionDocuments.get(i), contextVector, documentFrequencies, totalDocuments));
            } catch (final RuntimeException e) {
                logger.warn("Failed to score session from {}, ranking it by bonus only", session.timestamp(), e);
                final double bonus = structuralBonus(session);
                scored.add(new ScoredSession(session, 0.0, 0.0, bonus, Math.min(bonus, 1.0)));
            }
        }
        scored.sort(BY_SCORE_DESCENDING);

        if (logger.isDebugEnabled()) {
            logger.debug("Ranked {} sessions over {} distinct terms in {} ms",
                    scored.size(), documentFrequencies.termCount(), (System.nanoTime() - startTime) / 1_000_000);
        }
        return scored;
    }

    private ScoredSession score(final SessionRecord session, final List<String> document,
                                final SparseVector contextVector, final DocumentFrequencyTable documentFrequencies,
                                final int totalDocuments) {
        final SparseVector sessionVector = TfIdfIndexer.tfidf(document, documentFrequencies, totalDocuments);
        final double similarity = CosineSimilarity.between(contextVector, sessionVector);
        final double timeWeight = timeDecay.weight(session.timestamp());
        final double bonus = structuralBonus(session);
        return new ScoredSession(session, similarity, timeWeight, bonus, fuse(similarity, timeWeight, bonus));
    }

    private List<String> sessionDocumentOrEmpty(final SessionRecord session) {
        try {
            return documentBuilder.sessionDocument(session);
        } catch (final RuntimeException e) {
            logger.warn("Failed to extract keywords of session from {}, treating it as empty", session.timestamp(), e);
            return List.of();
        }
    }

    static double structuralBonus(final SessionRecord session) {
        return session.hasConversations() ? CONVERSATION_BONUS : 0.0;
    }

    static double fuse(final double similarity, final double timeWeight, final double bonus) {
        final double score = similarity * SIMILARITY_WEIGHT + timeWeight * TIME_WEIGHT + bonus;
        return Math.min(score, 1.0);
    }
}
