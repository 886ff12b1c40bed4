package de.mirkosertic.sessionmemory.util;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Helpers for turning captured messages, commands and paths into short display snippets.
 */
public final class TextSnippets {

    /**
     * Characters that only appear through broken decoding or invisible formatting:
     * NUL and control characters other than tab, LF and CR, zero-width space/joiners,
     * the byte order mark and the replacement character.
     */
    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +
        "\u000B-\u000C" +
        "\u000E-\u001F" +
        "\u200B-\u200D" +
        "\uFEFF" +
        "\uFFFD" +
        "]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextSnippets() {
    }

    /**
     * Removes invalid characters and collapses every whitespace run, line breaks included,
     * into a single space.
     *
     * @return the cleaned single-line text, empty for null input
     */
    public static String clean(@Nullable final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        final String valid = INVALID_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(valid).replaceAll(" ").trim();
    }

    /**
     * Cleans the text and returns at most its first {@code maxLength} characters.
     */
    public static String head(@Nullable final String text, final int maxLength) {
        final String cleaned = clean(text);
        return cleaned.length() > maxLength ? cleaned.substring(0, maxLength) : cleaned;
    }

    /**
     * Last segment of a slash or backslash separated path.
     */
    public static String baseName(@Nullable final String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        final String normalized = path.replace('\\', '/');
        final String trimmed = normalized.endsWith("/") ? normalized.substring(0, normalized.length() - 1) : normalized;
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    /**
     * First whitespace separated word of a command line.
     */
    public static String firstWord(@Nullable final String commandLine) {
        final String cleaned = clean(commandLine);
        final int space = cleaned.indexOf(' ');
        return space < 0 ? cleaned : cleaned.substring(0, space);
    }
}
