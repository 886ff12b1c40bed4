package de.mirkosertic.sessionmemory.ranking;

import de.mirkosertic.sessionmemory.model.SessionRecord;

/**
 * A session together with the components of its relevance score.
 *
 * @param session         the input record, unchanged
 * @param similarity      cosine similarity to the current context
 * @param timeWeight      recency weight
 * @param structuralBonus bonus for sessions with captured conversation
 * @param score           fused score, never above 1.0
 */
public record ScoredSession(
        SessionRecord session,
        double similarity,
        double timeWeight,
        double structuralBonus,
        double score
) {
}
