package de.mirkosertic.sessionmemory;

import org.apache.lucene.analysis.CharArraySet;

import java.util.List;

/**
 * Fixed stopword list shared by the text and path analyzers.
 *
 * <p>Covers English function words, Korean particles and the keyword noise of
 * JavaScript-like source text, so that code pasted into a conversation does not
 * dominate the term space.</p>
 */
public final class Stopwords {

    private static final List<String> ENGLISH = List.of(
            "the", "a", "an", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could", "should",
            "may", "might", "must", "shall", "can", "need", "dare", "ought", "used",
            "to", "of", "in", "for", "on", "with", "at", "by", "from", "as", "into",
            "through", "during", "before", "after", "above", "below", "between",
            "and", "but", "or", "nor", "so", "yet", "both", "either", "neither",
            "not", "only", "own", "same", "than", "too", "very", "just",
            "this", "that", "these", "those", "it", "its"
    );

    private static final List<String> KOREAN = List.of(
            "이", "그", "저", "것", "수", "등", "들", "및", "에", "의", "를", "을",
            "은", "는", "가", "와", "과", "로", "으로", "에서", "까지", "부터"
    );

    private static final List<String> CODE_NOISE = List.of(
            "const", "let", "var", "function", "return", "import", "export",
            "true", "false", "null", "undefined", "new", "class", "extends",
            "async", "await", "try", "catch", "if", "else", "while"
    );

    /**
     * Immutable, case-sensitive set. Tokens are lowercased before they are checked.
     */
    public static final CharArraySet SET;

    static {
        final CharArraySet set = new CharArraySet(ENGLISH.size() + KOREAN.size() + CODE_NOISE.size(), false);
        set.addAll(ENGLISH);
        set.addAll(KOREAN);
        set.addAll(CODE_NOISE);
        SET = CharArraySet.unmodifiableSet(set);
    }

    private Stopwords() {
    }

    public static boolean contains(final String token) {
        return SET.contains(token);
    }
}
