package de.mirkosertic.sessionmemory.summary;

/**
 * Raised by a {@link Summarizer} that could not produce a summary.
 */
public class SummarizationException extends Exception {

    public SummarizationException(final String message) {
        super(message);
    }

    public SummarizationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
