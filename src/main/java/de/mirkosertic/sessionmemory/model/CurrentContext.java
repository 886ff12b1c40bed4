package de.mirkosertic.sessionmemory.model;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * The working context sessions are ranked against.
 *
 * @param workingDirectory the current working directory path
 * @param recentFiles      recently touched file paths, empty when unknown
 */
public record CurrentContext(
        @Nullable String workingDirectory,
        List<String> recentFiles
) {
    public CurrentContext {
        recentFiles = recentFiles != null
                ? recentFiles.stream().filter(Objects::nonNull).toList()
                : List.of();
    }

    public static CurrentContext of(final String workingDirectory) {
        return new CurrentContext(workingDirectory, List.of());
    }
}
