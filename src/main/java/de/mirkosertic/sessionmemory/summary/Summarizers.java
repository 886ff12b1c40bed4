package de.mirkosertic.sessionmemory.summary;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Chooses the summarizer for the available credentials.
 */
public final class Summarizers {

    private static final Logger logger = LoggerFactory.getLogger(Summarizers.class);

    private Summarizers() {
    }

    /**
     * Returns a {@link FallbackSummarizer} around the remote summarizer when an API key and a
     * factory are available, the plain {@link LocalSummarizer} otherwise.
     *
     * @param apiKey        the credential of the external service (may be null or blank)
     * @param remoteFactory creates the service backed summarizer for a key (may be null)
     */
    public static Summarizer select(@Nullable final String apiKey,
                                    @Nullable final Function<String, Summarizer> remoteFactory) {
        final LocalSummarizer local = new LocalSummarizer();
        if (apiKey == null || apiKey.isBlank() || remoteFactory == null) {
            logger.debug("No summarization service configured, using local summaries");
            return local;
        }
        final Summarizer remote = remoteFactory.apply(apiKey);
        if (remote == null) {
            logger.warn("Summarizer factory returned no summarizer, using local summaries");
            return local;
        }
        logger.info("Using {} with local fallback", remote.getClass().getSimpleName());
        return new FallbackSummarizer(remote, local);
    }
}
