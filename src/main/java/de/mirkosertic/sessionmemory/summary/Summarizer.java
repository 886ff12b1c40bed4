package de.mirkosertic.sessionmemory.summary;

/**
 * Condenses a finished session into a short text.
 *
 * <p>Implementations backed by an external service live outside this project and are
 * plugged in through {@link Summarizers#select}. {@link LocalSummarizer} is the
 * heuristic implementation that never fails.</p>
 */
public interface Summarizer {

    /**
     * @param request the captured session activity
     * @return the summary, never {@code null}
     * @throws SummarizationException if no summary could be produced
     */
    SessionSummary summarize(SummaryRequest request) throws SummarizationException;
}
