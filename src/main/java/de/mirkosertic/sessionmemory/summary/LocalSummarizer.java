package de.mirkosertic.sessionmemory.summary;

import de.mirkosertic.sessionmemory.model.ConversationEntry;
import de.mirkosertic.sessionmemory.model.ConversationType;
import de.mirkosertic.sessionmemory.model.Observation;
import de.mirkosertic.sessionmemory.util.TextSnippets;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Statistical summary built from the captured activity alone.
 *
 * <p>Example: {@code Tools: Edit(3), Bash(2) | Files: Login.js, auth.js | Commands: git commit -m "login" | Question: "how do refresh tokens expire"}</p>
 */
public class LocalSummarizer implements Summarizer {

    static final int MAX_FILES = 5;
    static final int MAX_COMMANDS = 2;
    static final int COMMAND_LENGTH = 30;
    static final int QUESTION_LENGTH = 50;

    private static final String SHELL_TOOL = "Bash";
    private static final Set<String> NOTABLE_COMMANDS = Set.of("git", "npm", "yarn", "pip", "docker");
    private static final String SEPARATOR = " | ";

    @Override
    public SessionSummary summarize(final SummaryRequest request) {
        final Map<String, Integer> toolCounts = new LinkedHashMap<>();
        final Set<String> files = new LinkedHashSet<>();
        final List<String> commands = new ArrayList<>();
        boolean hasError = false;

        for (final Observation observation : request.observations()) {
            final String tool = observation.tool() != null ? observation.tool() : "unknown";
            toolCounts.merge(tool, 1, Integer::sum);

            if (observation.file() != null && !observation.file().isBlank()) {
                files.add(TextSnippets.baseName(observation.file()));
            }
            if (SHELL_TOOL.equals(observation.tool()) && observation.command() != null
                    && NOTABLE_COMMANDS.contains(TextSnippets.firstWord(observation.command()))) {
                commands.add(TextSnippets.head(observation.command(), COMMAND_LENGTH));
            }
            if (observation.details() != null && observation.details().failed()) {
                hasError = true;
            }
        }

        final List<String> questions = new ArrayList<>();
        for (final ConversationEntry conversation : request.conversations()) {
            final ConversationType type = conversation.type() != null
                    ? conversation.type()
                    : ConversationType.classify(conversation.message());
            if (type == ConversationType.QUESTION && conversation.message() != null) {
                questions.add(TextSnippets.head(conversation.message(), QUESTION_LENGTH));
            }
        }

        final List<String> parts = new ArrayList<>();
        if (!toolCounts.isEmpty()) {
            parts.add("Tools: " + toolCounts.entrySet().stream()
                    .map(entry -> entry.getKey() + "(" + entry.getValue() + ")")
                    .collect(Collectors.joining(", ")));
        }
        if (!files.isEmpty()) {
            final String fileList = files.stream().limit(MAX_FILES).collect(Collectors.joining(", "));
            parts.add("Files: " + fileList + andMore(files.size() - MAX_FILES));
        }
        if (!commands.isEmpty()) {
            parts.add("Commands: " + String.join(", ", commands.subList(0, Math.min(MAX_COMMANDS, commands.size()))));
        }
        if (hasError) {
            parts.add("Some operations failed");
        }
        if (!questions.isEmpty()) {
            parts.add("Question: \"" + questions.get(0) + "\"" + andMore(questions.size() - 1));
        }

        final String text = parts.isEmpty() ? "No recorded activity" : String.join(SEPARATOR, parts);
        return new SessionSummary(text, SummaryType.LOCAL);
    }

    private static String andMore(final int remaining) {
        return remaining > 0 ? " and " + remaining + " more" : "";
    }
}
