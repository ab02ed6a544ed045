package kinet.newsfeed.scrape;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Publish dates as sites print them: ISO-8601, RFC-1123, or relative text such as
 * "3 hours ago", "yesterday", "just now" (resolved against the clock).
 */
public final class DateParser {
    private static final Pattern AGO = Pattern.compile(
            "(\\d{1,6})\\s*(second|sec|minute|min|hour|hr|day|week|month|year)s?\\s+ago",
            Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public DateParser(Clock clock) {
        this.clock = clock;
    }

    public Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String text = raw.strip();

        Optional<Instant> absolute = parseAbsolute(text);
        if (absolute.isPresent()) return absolute;
        return parseRelative(text);
    }

    Optional<Instant> parseAbsolute(String text) {
        return attempt(() -> Instant.parse(text))
                .or(() -> attempt(() -> OffsetDateTime.parse(text).toInstant()))
                .or(() -> attempt(() -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()))
                .or(() -> attempt(() -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC)))
                .or(() -> text.length() < 10 ? Optional.<Instant>empty()
                        : attempt(() -> LocalDate.parse(text.substring(0, 10)).atStartOfDay(ZoneOffset.UTC).toInstant()));
    }

    Optional<Instant> parseRelative(String text) {
        String t = text.toLowerCase(Locale.ROOT);
        Instant now = clock.instant();
        if (t.contains("just now") || t.startsWith("today")) {
            return Optional.of(now);
        }
        if (t.contains("yesterday")) {
            return Optional.of(now.minus(Duration.ofDays(1)));
        }
        Matcher m = AGO.matcher(t);
        if (!m.find()) return Optional.empty();

        long n = Long.parseLong(m.group(1));
        Duration unit = switch (m.group(2)) {
            case "second", "sec" -> Duration.ofSeconds(1);
            case "minute", "min" -> Duration.ofMinutes(1);
            case "hour", "hr" -> Duration.ofHours(1);
            case "day" -> Duration.ofDays(1);
            case "week" -> Duration.ofDays(7);
            case "month" -> Duration.ofDays(30);
            default -> Duration.ofDays(365);
        };
        return Optional.of(now.minus(unit.multipliedBy(n)));
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
