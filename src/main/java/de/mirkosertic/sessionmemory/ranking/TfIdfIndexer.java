package de.mirkosertic.sessionmemory.ranking;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Term weighting for the relevance ranking.
 *
 * <p>TF is the raw count divided by the largest count in the same document, so the most
 * frequent term always weighs 1.0. IDF is smoothed as {@code ln((N + 1) / (df + 1)) + 1},
 * which stays positive for every term, including terms the table has never seen.</p>
 */
public final class TfIdfIndexer {

    private TfIdfIndexer() {
    }

    /**
     * Max-normalized term frequencies. An empty document yields an empty vector.
     */
    public static SparseVector termFrequency(final List<String> tokens) {
        final Map<String, Double> counts = new LinkedHashMap<>();
        for (final String token : tokens) {
            counts.merge(token, 1.0, Double::sum);
        }
        double maxCount = 1.0;
        for (final double count : counts.values()) {
            maxCount = Math.max(maxCount, count);
        }
        final double divisor = maxCount;
        counts.replaceAll((term, count) -> count / divisor);
        return SparseVector.of(counts);
    }

    public static DocumentFrequencyTable documentFrequency(final List<List<String>> documents) {
        return DocumentFrequencyTable.build(documents);
    }

    /**
     * Smoothed inverse document frequency.
     */
    public static double inverseDocumentFrequency(final int documentFrequency, final int totalDocuments) {
        return Math.log((totalDocuments + 1.0) / (documentFrequency + 1.0)) + 1.0;
    }

    /**
     * TF-IDF weights of one document.
     *
     * <p>The caller must have built {@code table} over the same document set the
     * {@code tokens} belong to; no consistency check is made.</p>
     *
     * @param tokens         the document's tokens
     * @param table          document frequencies of the active corpus
     * @param totalDocuments number of documents {@code table} was built from
     */
    public static SparseVector tfidf(final List<String> tokens, final DocumentFrequencyTable table, final int totalDocuments) {
        final Map<String, Double> weights = new LinkedHashMap<>(termFrequency(tokens).asMap());
        weights.replaceAll((term, tf) -> tf * inverseDocumentFrequency(table.frequency(term), totalDocuments));
        return SparseVector.of(weights);
    }
}
