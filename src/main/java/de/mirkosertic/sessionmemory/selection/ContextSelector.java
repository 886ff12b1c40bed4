package de.mirkosertic.sessionmemory.selection;

import de.mirkosertic.sessionmemory.ranking.ScoredSession;

import java.util.List;

/**
 * Picks the ranked sessions worth injecting into a new session.
 *
 * <p>Keeps entries scoring at least {@code minScore}, at most {@code maxSessions} of them.
 * When no entry reaches the threshold, the first {@code fallbackCount} ranked entries are
 * returned instead so that recent work is still shown.</p>
 */
public class ContextSelector {

    private final double minScore;
    private final int maxSessions;
    private final int fallbackCount;

    public ContextSelector(final double minScore, final int maxSessions, final int fallbackCount) {
        if (maxSessions < 0 || fallbackCount < 0) {
            throw new IllegalArgumentException("maxSessions and fallbackCount must not be negative");
        }
        this.minScore = minScore;
        this.maxSessions = maxSessions;
        this.fallbackCount = fallbackCount;
    }

    /**
     * @param ranked sessions sorted by descending score
     */
    public List<ScoredSession> select(final List<ScoredSession> ranked) {
        final List<ScoredSession> relevant = ranked.stream()
                .filter(scored -> scored.score() >= minScore)
                .limit(maxSessions)
                .toList();
        if (relevant.isEmpty() && !ranked.isEmpty()) {
            return List.copyOf(ranked.subList(0, Math.min(fallbackCount, ranked.size())));
        }
        return relevant;
    }

    public double getMinScore() {
        return minScore;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public int getFallbackCount() {
        return fallbackCount;
    }
}
