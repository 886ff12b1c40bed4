package de.mirkosertic.sessionmemory.ranking;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Number of documents each term occurs in, counted over one exact corpus.
 *
 * <p>IDF values are corpus-relative, so a table must only be used to weight the
 * documents it was built from and is never reused across ranking calls.</p>
 */
public final class DocumentFrequencyTable {

    private final Map<String, Integer> frequencies;
    private final int documentCount;

    private DocumentFrequencyTable(final Map<String, Integer> frequencies, final int documentCount) {
        this.frequencies = frequencies;
        this.documentCount = documentCount;
    }

    /**
     * Counts every distinct term once per document.
     *
     * @param documents token sequences, one per corpus member
     */
    public static DocumentFrequencyTable build(final List<List<String>> documents) {
        final Map<String, Integer> frequencies = new HashMap<>();
        for (final List<String> document : documents) {
            final Set<String> distinct = new HashSet<>(document);
            for (final String term : distinct) {
                frequencies.merge(term, 1, Integer::sum);
            }
        }
        return new DocumentFrequencyTable(Collections.unmodifiableMap(frequencies), documents.size());
    }

    /**
     * @return number of documents containing the term, 0 for unseen terms
     */
    public int frequency(final String term) {
        return frequencies.getOrDefault(term, 0);
    }

    /**
     * @return number of documents the table was built from
     */
    public int documentCount() {
        return documentCount;
    }

    public int termCount() {
        return frequencies.size();
    }
}
