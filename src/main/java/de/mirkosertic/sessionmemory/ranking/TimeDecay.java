package de.mirkosertic.sessionmemory.ranking;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Recency weight of a session.
 *
 * <p>Two regimes: within the first 24 hours the weight falls linearly from 1.0 to 0.5
 * ({@code 1 - h / 48}); after that it is {@code exp(-d / 14)} with {@code d} in days. The
 * jump from 0.5 up to roughly 0.93 right after the 24 hour mark is intentional and must
 * not be smoothed.</p>
 *
 * <p>Missing or unparseable timestamps weigh 0.</p>
 */
public class TimeDecay {

    private static final Logger logger = LoggerFactory.getLogger(TimeDecay.class);

    static final double LINEAR_WINDOW_HOURS = 24.0;
    static final double LINEAR_SLOPE_HOURS = 48.0;
    static final double DECAY_DAYS = 14.0;

    private static final double MILLIS_PER_HOUR = 60.0 * 60.0 * 1000.0;

    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private final Clock clock;

    public TimeDecay(final Clock clock) {
        this.clock = clock;
    }

    public double weight(@Nullable final String timestamp) {
        return parse(timestamp)
                .map(this::weightAt)
                .orElse(0.0);
    }

    public double weightAt(final Instant timestamp) {
        final double hours = (clock.millis() - timestamp.toEpochMilli()) / MILLIS_PER_HOUR;
        return weightForHours(hours);
    }

    static double weightForHours(final double hours) {
        if (hours <= LINEAR_WINDOW_HOURS) {
            return 1.0 - hours / LINEAR_SLOPE_HOURS;
        }
        final double days = hours / 24.0;
        return Math.exp(-days / DECAY_DAYS);
    }

    /**
     * Parses an ISO-8601 date-time with offset, a local date-time (in the clock's zone)
     * or a plain date (UTC midnight).
     */
    public Optional<Instant> parse(@Nullable final String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return Optional.empty();
        }
        final String value = timestamp.trim();
        try {
            final TemporalAccessor parsed = TIMESTAMP_FORMAT.parseBest(value,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return Optional.of(offsetDateTime.toInstant());
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return Optional.of(localDateTime.atZone(clock.getZone()).toInstant());
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (final DateTimeParseException e) {
            logger.debug("Ignoring unparseable session timestamp '{}': {}", value, e.getMessage());
            return Optional.empty();
        }
    }
}
