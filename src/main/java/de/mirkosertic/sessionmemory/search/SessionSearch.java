package de.mirkosertic.sessionmemory.search;

import de.mirkosertic.sessionmemory.model.Observation;
import de.mirkosertic.sessionmemory.model.SessionRecord;
import de.mirkosertic.sessionmemory.ranking.TimeDecay;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Literal keyword lookup, timeline and statistics over recorded sessions.
 *
 * <p>A session matches when the keyword occurs, ignoring case, in its summary, one of its
 * stored keywords, or an observation's summary, file path, command or triggering user
 * message. Matches are returned newest first; sessions without a readable timestamp come
 * last in corpus order.</p>
 */
public class SessionSearch {

    static final int DEFAULT_TIMELINE_SIZE = 10;
    static final int MAX_TIMELINE_SIZE = 20;

    private static final String UNKNOWN_PROJECT = "unknown";

    private final TimeDecay timestamps;
    private final Comparator<SessionRecord> newestFirst;

    public SessionSearch(final TimeDecay timestamps) {
        this.timestamps = timestamps;
        this.newestFirst = Comparator.comparing(
                (SessionRecord session) -> timestamps.parse(session.timestamp()).orElse(Instant.MIN))
                .reversed();
    }

    public List<SessionRecord> search(@Nullable final String keyword, final List<SessionRecord> corpus) {
        if (keyword == null || keyword.isBlank()) {
            return List.of();
        }
        final String needle = keyword.trim().toLowerCase(Locale.ROOT);
        return corpus.stream()
                .filter(Objects::nonNull)
                .filter(session -> matches(session, needle))
                .sorted(newestFirst)
                .toList();
    }

    /**
     * The most recent sessions, newest first.
     *
     * @param corpus the recorded sessions (null entries are skipped)
     * @param count  number of sessions; missing or non-positive means 10, at most 20 are returned
     */
    public List<SessionRecord> timeline(final List<SessionRecord> corpus, @Nullable final Integer count) {
        final int limit = count == null || count <= 0
                ? DEFAULT_TIMELINE_SIZE
                : Math.min(count, MAX_TIMELINE_SIZE);
        return corpus.stream()
                .filter(Objects::nonNull)
                .sorted(newestFirst)
                .limit(limit)
                .toList();
    }

    /**
     * Session and observation counts, overall and per project. Projects are ordered by
     * session count, most active first; equal counts keep the order in which the projects
     * first appear in the timeline.
     */
    public MemoryStatistics statistics(final List<SessionRecord> corpus) {
        final Map<String, int[]> perProject = new LinkedHashMap<>();
        int sessions = 0;
        int observations = 0;
        for (final SessionRecord session : corpus.stream().filter(Objects::nonNull).sorted(newestFirst).toList()) {
            final String project = session.project() != null ? session.project() : UNKNOWN_PROJECT;
            final int[] counts = perProject.computeIfAbsent(project, key -> new int[2]);
            counts[0]++;
            counts[1] += session.observationTotal();
            sessions++;
            observations += session.observationTotal();
        }

        final List<ProjectStatistics> projects = new ArrayList<>(perProject.size());
        perProject.forEach((project, counts) -> projects.add(new ProjectStatistics(project, counts[0], counts[1])));
        projects.sort(Comparator.comparingInt(ProjectStatistics::sessionCount).reversed());
        return new MemoryStatistics(sessions, observations, projects);
    }

    /**
     * Observations of a matching session that mention the keyword in their summary or
     * triggering user message.
     */
    public List<Observation> matchingObservations(final SessionRecord session, final String keyword, final int limit) {
        final String needle = keyword.trim().toLowerCase(Locale.ROOT);
        return session.observationsOrEmpty().stream()
                .filter(Objects::nonNull)
                .filter(observation -> contains(observation.summary(), needle)
                        || contains(observation.lastUserMessage(), needle))
                .limit(limit)
                .toList();
    }

    static boolean matches(final SessionRecord session, final String needle) {
        if (contains(session.summary(), needle)) {
            return true;
        }
        for (final String stored : session.keywordsOrEmpty()) {
            if (contains(stored, needle)) {
                return true;
            }
        }
        for (final Observation observation : session.observationsOrEmpty()) {
            if (observation != null && (contains(observation.summary(), needle)
                    || contains(observation.file(), needle)
                    || contains(observation.command(), needle)
                    || contains(observation.lastUserMessage(), needle))) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(@Nullable final String text, final String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }
}
