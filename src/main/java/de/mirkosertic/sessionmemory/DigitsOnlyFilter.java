package de.mirkosertic.sessionmemory;

import org.apache.lucene.analysis.FilteringTokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Token filter that drops tokens consisting solely of ASCII digits.
 *
 * <p>Line numbers, ports and exit codes carry no topical signal, so {@code 8080} or
 * {@code 404} are removed while mixed tokens like {@code v2} or {@code utf8} pass.</p>
 */
public final class DigitsOnlyFilter extends FilteringTokenFilter {

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);

    public DigitsOnlyFilter(final TokenStream input) {
        super(input);
    }

    @Override
    protected boolean accept() {
        final int length = termAtt.length();
        if (length == 0) {
            return false;
        }
        final char[] buffer = termAtt.buffer();
        for (int i = 0; i < length; i++) {
            final char c = buffer[i];
            if (c < '0' || c > '9') {
                return true;
            }
        }
        return false;
    }
}
