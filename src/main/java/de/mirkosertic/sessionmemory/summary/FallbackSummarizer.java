package de.mirkosertic.sessionmemory.summary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries a primary summarizer and falls back to a second one when the primary fails,
 * throws unexpectedly or returns a blank summary.
 */
public class FallbackSummarizer implements Summarizer {

    private static final Logger logger = LoggerFactory.getLogger(FallbackSummarizer.class);

    private final Summarizer primary;
    private final Summarizer fallback;

    public FallbackSummarizer(final Summarizer primary, final Summarizer fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public SessionSummary summarize(final SummaryRequest request) throws SummarizationException {
        try {
            final SessionSummary summary = primary.summarize(request);
            if (summary != null && summary.text() != null && !summary.text().isBlank()) {
                return summary;
            }
            logger.warn("Primary summarizer returned an empty summary, using fallback");
        } catch (final SummarizationException e) {
            logger.warn("Primary summarizer failed: {}, using fallback", e.getMessage());
        } catch (final RuntimeException e) {
            logger.warn("Primary summarizer failed unexpectedly, using fallback", e);
        }
        return fallback.summarize(request);
    }

    public Summarizer getPrimary() {
        return primary;
    }

    public Summarizer getFallback() {
        return fallback;
    }
}
