package de.mirkosertic.sessionmemory.summary;

import de.mirkosertic.sessionmemory.KeywordExtractor;
import de.mirkosertic.sessionmemory.model.ConversationEntry;
import de.mirkosertic.sessionmemory.model.Observation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the distinct search keywords stored alongside a finished session.
 */
public class SessionKeywordCollector {

    private final KeywordExtractor keywordExtractor;
    private final int maxKeywords;

    public SessionKeywordCollector(final KeywordExtractor keywordExtractor, final int maxKeywords) {
        if (maxKeywords < 0) {
            throw new IllegalArgumentException("maxKeywords must not be negative");
        }
        this.keywordExtractor = keywordExtractor;
        this.maxKeywords = maxKeywords;
    }

    /**
     * Keywords of conversation messages first, then of observation summaries, file paths
     * and commands, deduplicated in first-seen order and capped at {@code maxKeywords}.
     */
    public List<String> collect(final SummaryRequest request) {
        final Set<String> keywords = new LinkedHashSet<>();
        for (final ConversationEntry conversation : request.conversations()) {
            keywords.addAll(keywordExtractor.extractKeywords(conversation.message()));
        }
        for (final Observation observation : request.observations()) {
            keywords.addAll(keywordExtractor.extractKeywords(observation.summary()));
            keywords.addAll(keywordExtractor.extractPathKeywords(observation.file()));
            keywords.addAll(keywordExtractor.extractKeywords(observation.command()));
        }
        return keywords.stream()
                .limit(maxKeywords)
                .toList();
    }
}
