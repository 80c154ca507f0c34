package cz.vut.fit.domaincheck.checker.collectors;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses the dates returned by the registration provider and renders them relative to the current time,
 * e.g. "in 3 months" or "5 years ago".
 */
final class RelativeTime {
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    // Accepts "2024-05-01", "2024-05-01T10:00:00Z", "2024-05-01T10:00:00+02:00" and "2024-05-01T10:00:00+0200"
    private static final DateTimeFormatter DATE_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHMM", "Z")
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private RelativeTime() {
    }

    /**
     * Parses an ISO 8601 date or date-time. Values without an offset are taken as UTC.
     *
     * @param text The date to parse.
     * @return The instant, or empty if the text is not a supported date.
     */
    static Optional<Instant> parseDate(@NotNull String text) {
        final TemporalAccessor parsed;
        try {
            parsed = DATE_FORMAT.parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }

        if (parsed instanceof OffsetDateTime offsetDateTime)
            return Optional.of(offsetDateTime.toInstant());
        if (parsed instanceof LocalDateTime localDateTime)
            return Optional.of(localDateTime.toInstant(ZoneOffset.UTC));

        return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    /**
     * Renders the distance between two instants in words, rounding to the largest fitting unit.
     *
     * @param then The instant to describe.
     * @param now  The reference instant.
     * @return E.g. "a few seconds ago", "in an hour", "in 3 months", "5 years ago".
     */
    static String fromNow(@NotNull Instant then, @NotNull Instant now) {
        final var diffMillis = Duration.between(now, then).toMillis();
        final var text = humanize(Math.abs(diffMillis));
        return diffMillis > 0 ? "in " + text : text + " ago";
    }

    private static String humanize(long millis) {
        final var seconds = Math.round(millis / 1000.0);
        final var minutes = Math.round(millis / 60_000.0);
        final var hours = Math.round(millis / 3_600_000.0);
        final var days = Math.round(millis / MILLIS_PER_DAY);
        // Average Gregorian month: 146097 days per 400 years
        final var exactMonths = millis / MILLIS_PER_DAY * 4800 / 146097;
        final var months = Math.round(exactMonths);
        final var years = Math.round(exactMonths / 12);

        if (seconds < 45)
            return "a few seconds";
        if (minutes <= 1)
            return "a minute";
        if (minutes < 45)
            return minutes + " minutes";
        if (hours <= 1)
            return "an hour";
        if (hours < 22)
            return hours + " hours";
        if (days <= 1)
            return "a day";
        if (days < 26)
            return days + " days";
        if (months <= 1)
            return "a month";
        if (months < 11)
            return months + " months";
        if (years <= 1)
            return "a year";

        return years + " years";
    }
}
