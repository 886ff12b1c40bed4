package de.mirkosertic.sessionmemory;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.jspecify.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns free text and file paths into normalized keyword sequences.
 *
 * <p>Order and duplicates are preserved because they drive term frequency downstream.
 * Both operations are deterministic and return an empty list for {@code null} or empty
 * input. Instances are thread-safe: Lucene analyzers keep their token stream components
 * per thread.</p>
 */
public class KeywordExtractor implements Closeable {

    private static final String FIELD = "keywords";
    private static final Pattern LAST_EXTENSION = Pattern.compile("\\.[^.]+$");

    private final Analyzer textAnalyzer;
    private final Analyzer pathAnalyzer;

    public KeywordExtractor() {
        this(new TextKeywordAnalyzer(), new PathSegmentAnalyzer());
    }

    KeywordExtractor(final Analyzer textAnalyzer, final Analyzer pathAnalyzer) {
        this.textAnalyzer = textAnalyzer;
        this.pathAnalyzer = pathAnalyzer;
    }

    /**
     * Extracts keywords from free text.
     *
     * @param text the text to analyze (may be null)
     * @return lowercase keywords of length two or more, without stopwords and pure numbers
     */
    public List<String> extractKeywords(@Nullable final String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return analyze(textAnalyzer, text);
    }

    /**
     * Extracts keywords from a file or directory path.
     *
     * <p>Backslashes are treated as separators, the last extension of every segment is
     * removed and segments shorter than two characters are skipped. Each remaining segment
     * is split at camelCase boundaries, hyphens, underscores and whitespace.</p>
     *
     * @param path the path to analyze (may be null)
     * @return lowercase keywords in path order
     */
    public List<String> extractPathKeywords(@Nullable final String path) {
        if (path == null || path.isEmpty()) {
            return List.of();
        }
        final List<String> keywords = new ArrayList<>();
        for (final String rawSegment : path.replace('\\', '/').split("/")) {
            final String segment = LAST_EXTENSION.matcher(rawSegment).replaceFirst("");
            if (segment.length() > 1) {
                keywords.addAll(analyze(pathAnalyzer, segment));
            }
        }
        return keywords;
    }

    private static List<String> analyze(final Analyzer analyzer, final String text) {
        final List<String> tokens = new ArrayList<>();
        try (final TokenStream tokenStream = analyzer.tokenStream(FIELD, text)) {
            final CharTermAttribute termAttr = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            tokenStream.end();
        } catch (final IOException e) {
            // Only in-memory readers are involved
            throw new UncheckedIOException("Failed to analyze text", e);
        }
        return tokens;
    }

    @Override
    public void close() {
        textAnalyzer.close();
        pathAnalyzer.close();
    }
}
