package kinet.newsfeed.scrape;

import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.testng.Assert.*;

public class DateParserTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private final DateParser parser = new DateParser(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    public void absoluteFormats() {
        assertEquals(parser.parse("2024-04-30T10:00:00Z"), Optional.of(Instant.parse("2024-04-30T10:00:00Z")));
        assertEquals(parser.parse("2024-04-30T10:00:00+02:00"), Optional.of(Instant.parse("2024-04-30T08:00:00Z")));
        assertEquals(parser.parse("Tue, 30 Apr 2024 10:00:00 GMT"), Optional.of(Instant.parse("2024-04-30T10:00:00Z")));
        assertEquals(parser.parse("2024-04-30T10:00:00"), Optional.of(Instant.parse("2024-04-30T10:00:00Z")));
        assertEquals(parser.parse("2024-04-30 | Politics"), Optional.of(Instant.parse("2024-04-30T00:00:00Z")));
    }

    @Test
    public void relativeFormats() {
        assertEquals(parser.parse("3 hours ago"), Optional.of(NOW.minus(Duration.ofHours(3))));
        assertEquals(parser.parse("Updated 2 days ago"), Optional.of(NOW.minus(Duration.ofDays(2))));
        assertEquals(parser.parse("1 month ago"), Optional.of(NOW.minus(Duration.ofDays(30))));
        assertEquals(parser.parse("5 mins ago"), Optional.of(NOW.minus(Duration.ofMinutes(5))));
        assertEquals(parser.parse("Yesterday, 18:30"), Optional.of(NOW.minus(Duration.ofDays(1))));
        assertEquals(parser.parse("Just now"), Optional.of(NOW));
        assertEquals(parser.parse("Today"), Optional.of(NOW));
    }

    @Test
    public void garbageIsAbsent() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("by Jane Roe").isEmpty());
        assertTrue(parser.parse("2024-13-45").isEmpty());
    }
}
