package de.mirkosertic.sessionmemory.ranking;

/**
 * Cosine similarity between two sparse weight vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Returns exactly 0 when either vector has zero norm. With non-negative weights the
     * result lies in [0, 1].
     */
    public static double between(final SparseVector a, final SparseVector b) {
        final double normA = a.norm();
        final double normB = b.norm();
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        final double similarity = a.dot(b) / (normA * normB);
        // rounding can push identical vectors marginally above 1
        return Math.min(similarity, 1.0);
    }
}
