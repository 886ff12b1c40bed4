package de.mirkosertic.sessionmemory;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.pattern.PatternReplaceCharFilter;
import org.apache.lucene.analysis.pattern.PatternTokenizer;

import java.io.Reader;
import java.util.regex.Pattern;

/**
 * Analyzer for a single path segment with its extension already removed.
 *
 * <p>The {@link PatternReplaceCharFilter} inserts a space at every lower-to-upper case
 * boundary before tokenization, then the segment is split on hyphens, underscores and
 * any Unicode whitespace, no-break and ideographic spaces included. {@code handleUserLogin}
 * yields {@code handle}, {@code user}, {@code login}; {@code user_profile-view} yields {@code user}, {@code profile}, {@code view}.</p>
 *
 * <p>Unlike {@link TextKeywordAnalyzer}, punctuation other than the separators stays inside
 * the token and pure-digit tokens are kept.</p>
 */
public class PathSegmentAnalyzer extends Analyzer {

    private static final Pattern CAMEL_CASE_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[-_\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    protected Reader initReader(final String fieldName, final Reader reader) {
        return new PatternReplaceCharFilter(CAMEL_CASE_BOUNDARY, "$1 $2", reader);
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new PatternTokenizer(SEPARATORS, -1);
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new LengthFilter(stream, 2, Integer.MAX_VALUE);
        stream = new StopFilter(stream, Stopwords.SET);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
