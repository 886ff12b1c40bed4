package de.mirkosertic.sessionmemory;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.pattern.PatternTokenizer;

import java.util.regex.Pattern;

/**
 * Analyzer for free text such as session summaries, user prompts and shell commands.
 *
 * <p>Token chain: {@code PatternTokenizer -> LowerCaseFilter -> LengthFilter(2) -> StopFilter -> DigitsOnlyFilter}</p>
 *
 * <p>A token is a maximal run of ASCII word characters ({@code [A-Za-z0-9_]}) or Hangul
 * syllables. Every other character, punctuation included, acts as a separator, so
 * {@code auth_service} stays one token while {@code auth-service} becomes two.</p>
 */
public class TextKeywordAnalyzer extends Analyzer {

    static final Pattern WORD_RUN = Pattern.compile("[A-Za-z0-9_가-힣]+");

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new PatternTokenizer(WORD_RUN, 0);
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new LengthFilter(stream, 2, Integer.MAX_VALUE);
        stream = new StopFilter(stream, Stopwords.SET);
        stream = new DigitsOnlyFilter(stream);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
