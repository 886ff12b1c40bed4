package de.mirkosertic.sessionmemory.ranking;

import de.mirkosertic.sessionmemory.KeywordExtractor;
import de.mirkosertic.sessionmemory.model.ConversationEntry;
import de.mirkosertic.sessionmemory.model.CurrentContext;
import de.mirkosertic.sessionmemory.model.Observation;
import de.mirkosertic.sessionmemory.model.SessionRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the token sequences ("documents") the ranker compares.
 */
public class SessionDocumentBuilder {

    private final KeywordExtractor keywordExtractor;

    public SessionDocumentBuilder(final KeywordExtractor keywordExtractor) {
        this.keywordExtractor = keywordExtractor;
    }

    /**
     * Path keywords of the working directory followed by those of every recent file.
     */
    public List<String> contextDocument(final CurrentContext context) {
        final List<String> tokens = new ArrayList<>(keywordExtractor.extractPathKeywords(context.workingDirectory()));
        for (final String file : context.recentFiles()) {
            tokens.addAll(keywordExtractor.extractPathKeywords(file));
        }
        return tokens;
    }

    /**
     * Concatenates, in this order: summary, every conversation message, and per observation
     * its summary, file path, shell command and the user message that led to it.
     */
    public List<String> sessionDocument(final SessionRecord session) {
        final List<String> tokens = new ArrayList<>(keywordExtractor.extractKeywords(session.summary()));
        for (final ConversationEntry conversation : session.conversationsOrEmpty()) {
            if (conversation != null) {
                tokens.addAll(keywordExtractor.extractKeywords(conversation.message()));
            }
        }
        for (final Observation observation : session.observationsOrEmpty()) {
            if (observation == null) {
                continue;
            }
            tokens.addAll(keywordExtractor.extractKeywords(observation.summary()));
            tokens.addAll(keywordExtractor.extractPathKeywords(observation.file()));
            tokens.addAll(keywordExtractor.extractKeywords(observation.command()));
            tokens.addAll(keywordExtractor.extractKeywords(observation.lastUserMessage()));
        }
        return tokens;
    }
}
