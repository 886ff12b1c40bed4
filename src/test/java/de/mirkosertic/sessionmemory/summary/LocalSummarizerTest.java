package de.mirkosertic.sessionmemory.summary;

import de.mirkosertic.sessionmemory.model.ConversationEntry;
import de.mirkosertic.sessionmemory.model.ConversationType;
import de.mirkosertic.sessionmemory.model.Observation;
import de.mirkosertic.sessionmemory.model.ObservationDetails;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LocalSummarizer")
class LocalSummarizerTest {

    private final LocalSummarizer summarizer = new LocalSummarizer();

    @Test
    @DisplayName("Summarizes tools, files, commands and the first question")
    void fullSummary() {
        // Given
        final List<Observation> observations = List.of(
                Observation.of("Edit", "edited", ObservationDetails.forFile("src/auth/Login.js")),
                Observation.of("Edit", "edited", ObservationDetails.forFile("src\\auth\\token.js")),
                Observation.of("Bash", "committed", ObservationDetails.forCommand("git push origin feature/rotate-refresh-tokens")),
                Observation.of("Bash", "listed", ObservationDetails.forCommand("ls -la")),
                Observation.of("Edit", "edited again", ObservationDetails.forFile("src/auth/Login.js")));
        final List<ConversationEntry> conversations = List.of(
                ConversationEntry.of("please rotate the tokens"),
                ConversationEntry.of("how do refresh tokens expire?"),
                new ConversationEntry("user", "why is the test red", null, null));

        // When
        final SessionSummary summary = summarizer.summarize(new SummaryRequest("auth", observations, conversations));

        // Then
        assertThat(summary.type()).isEqualTo(SummaryType.LOCAL);
        assertThat(summary.text()).isEqualTo(
                "Tools: Edit(3), Bash(2)"
                        + " | Files: Login.js, token.js"
                        + " | Commands: git push origin feature/rotate"
                        + " | Question: \"how do refresh tokens expire?\" and 1 more");
    }

    @Test
    @DisplayName("Lists at most five files and at most two commands")
    void limits() {
        final List<Observation> observations = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            observations.add(Observation.of("Write", "wrote", ObservationDetails.forFile("f" + i + ".js")));
        }
        observations.add(Observation.of("Bash", "", ObservationDetails.forCommand("npm install")));
        observations.add(Observation.of("Bash", "", ObservationDetails.forCommand("docker compose up")));
        observations.add(Observation.of("Bash", "", ObservationDetails.forCommand("yarn build")));

        final String text = summarizer.summarize(new SummaryRequest(null, observations, List.of())).text();

        assertThat(text).contains("Files: f1.js, f2.js, f3.js, f4.js, f5.js and 2 more");
        assertThat(text).contains("Commands: npm install, docker compose up");
        assertThat(text).doesNotContain("yarn");
    }

    @Test
    @DisplayName("Reports failed operations")
    void failures() {
        final Observation failed = Observation.of("Bash", "tests",
                new ObservationDetails(null, "mvn test", false, null, "BUILD FAILURE"));

        final String text = summarizer.summarize(new SummaryRequest(null, List.of(failed), List.of())).text();

        assertThat(text).isEqualTo("Tools: Bash(1) | Some operations failed");
    }

    @Test
    @DisplayName("Uses the stored conversation type over the text")
    void storedType() {
        final ConversationEntry stored = new ConversationEntry("user", "fix it", ConversationType.QUESTION, null);

        final String text = summarizer.summarize(new SummaryRequest(null, List.of(), List.of(stored))).text();

        assertThat(text).isEqualTo("Question: \"fix it\"");
    }

    @Test
    @DisplayName("Empty sessions still get a summary")
    void emptySession() {
        final SessionSummary summary = summarizer.summarize(new SummaryRequest(null, null, null));

        assertThat(summary.text()).isEqualTo("No recorded activity");
        assertThat(summary.type()).isEqualTo(SummaryType.LOCAL);
    }
}
