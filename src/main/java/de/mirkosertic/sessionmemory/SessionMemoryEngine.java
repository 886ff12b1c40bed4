package de.mirkosertic.sessionmemory;

import de.mirkosertic.sessionmemory.config.EngineConfig;
import de.mirkosertic.sessionmemory.model.CurrentContext;
import de.mirkosertic.sessionmemory.model.SessionRecord;
import de.mirkosertic.sessionmemory.ranking.RelevanceRanker;
import de.mirkosertic.sessionmemory.ranking.ScoredSession;
import de.mirkosertic.sessionmemory.ranking.SessionDocumentBuilder;
import de.mirkosertic.sessionmemory.ranking.TimeDecay;
import de.mirkosertic.sessionmemory.search.MemoryStatistics;
import de.mirkosertic.sessionmemory.search.SessionSearch;
import de.mirkosertic.sessionmemory.selection.ContextSelector;
import de.mirkosertic.sessionmemory.summary.LocalSummarizer;
import de.mirkosertic.sessionmemory.summary.SessionKeywordCollector;
import de.mirkosertic.sessionmemory.summary.SessionSummary;
import de.mirkosertic.sessionmemory.summary.SummarizationException;
import de.mirkosertic.sessionmemory.summary.Summarizer;
import de.mirkosertic.sessionmemory.summary.Summarizers;
import de.mirkosertic.sessionmemory.summary.SummaryRequest;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.util.List;
import java.util.function.Function;

/**
 * Entry point for the hook adapters of the surrounding system.
 *
 * <p>Session start calls {@link #recall}, session end calls {@link #summarize} and
 * {@link #collectKeywords}, the memory commands call {@link #search}, {@link #timeline} and
 * {@link #statistics}. All of them share one
 * keyword extractor and one ranker; loading and storing sessions is left to the caller.</p>
 */
public class SessionMemoryEngine implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(SessionMemoryEngine.class);

    private final KeywordExtractor keywordExtractor;
    private final RelevanceRanker ranker;
    private final ContextSelector selector;
    private final Summarizer summarizer;
    private final LocalSummarizer localSummarizer;
    private final SessionKeywordCollector keywordCollector;
    private final SessionSearch search;

    public SessionMemoryEngine(final EngineConfig config) {
        this(config, Clock.systemDefaultZone(), null);
    }

    /**
     * @param config        the engine configuration
     * @param clock         time source for recency weighting
     * @param remoteFactory creates a service backed summarizer from the configured API key (may be null)
     */
    public SessionMemoryEngine(final EngineConfig config, final Clock clock,
                               @Nullable final Function<String, Summarizer> remoteFactory) {
        // Initialize services in dependency order
        this.keywordExtractor = new KeywordExtractor();
        final TimeDecay timeDecay = new TimeDecay(clock);

        this.ranker = new RelevanceRanker(new SessionDocumentBuilder(keywordExtractor), timeDecay);
        this.selector = new ContextSelector(config.getMinScore(), config.getMaxSessions(), config.getFallbackCount());
        this.localSummarizer = new LocalSummarizer();
        this.summarizer = Summarizers.select(config.getApiKey(), remoteFactory);
        this.keywordCollector = new SessionKeywordCollector(keywordExtractor, config.getMaxKeywords());
        this.search = new SessionSearch(timeDecay);

        logger.debug("Session memory engine initialized");
    }

    /**
     * Full ranking of the corpus, most relevant first.
     */
    public List<ScoredSession> rank(@Nullable final CurrentContext context, final List<SessionRecord> corpus) {
        return ranker.rank(context, corpus);
    }

    /**
     * The ranked sessions worth injecting at session start, after threshold, cap and fallback.
     */
    public List<ScoredSession> recall(@Nullable final CurrentContext context, final List<SessionRecord> corpus) {
        final List<ScoredSession> ranked = ranker.rank(context, corpus);
        final List<ScoredSession> selected = selector.select(ranked);
        logger.debug("Selected {} of {} ranked sessions for {}", selected.size(), ranked.size(),
                context != null ? context.workingDirectory() : null);
        return selected;
    }

    /**
     * Summarizes a finished session. Never fails: the local summary is the last resort.
     */
    public SessionSummary summarize(final SummaryRequest request) {
        try {
            return summarizer.summarize(request);
        } catch (final SummarizationException e) {
            logger.warn("Summarization failed, using local summary: {}", e.getMessage());
            return localSummarizer.summarize(request);
        }
    }

    public List<String> collectKeywords(final SummaryRequest request) {
        return keywordCollector.collect(request);
    }

    public List<SessionRecord> search(final String keyword, final List<SessionRecord> corpus) {
        return search.search(keyword, corpus);
    }

    /**
     * The most recent sessions, 10 by default and never more than 20.
     */
    public List<SessionRecord> timeline(final List<SessionRecord> corpus, @Nullable final Integer count) {
        return search.timeline(corpus, count);
    }

    public MemoryStatistics statistics(final List<SessionRecord> corpus) {
        return search.statistics(corpus);
    }

    @Override
    public void close() {
        keywordExtractor.close();
    }
}
