package com.seqmine.engine.normalize;

import com.seqmine.core.model.NormalizerOptions;
import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class TimestampParserTest {

    private final TimestampParser parser = new TimestampParser(NormalizerOptions.defaults());

    @Test
    void parse_shouldReadYmdHmsStringsAsUtc() {
        assertEquals(Instant.parse("2024-01-15T10:30:45Z"), parser.parse("2024-01-15 10:30:45"));
        assertEquals(Instant.parse("2024-01-15T10:30:45Z"), parser.parse("2024/1/15T10:30:45"));
        assertEquals(Instant.parse("2024-01-15T10:30:45Z"), parser.parse("  2024.01.15 10:30:45 "));
    }

    @Test
    void parse_shouldKeepFractionUpToConfiguredDigits() {
        assertEquals(Instant.parse("2024-01-15T10:30:45.500Z"), parser.parse("2024-01-15 10:30:45,5"));
        assertEquals(Instant.parse("2024-01-15T10:30:45.123456789Z"), parser.parse("2024-01-15 10:30:45.123456789"));

        TimestampParser four = new TimestampParser(NormalizerOptions.defaults().withSubSecondDigits(4));
        assertEquals(Instant.parse("2024-01-15T10:30:45.1234Z"), four.parse("2024-01-15 10:30:45.123456789"));

        TimestampParser seconds = new TimestampParser(NormalizerOptions.defaults().withSubSecondDigits(0));
        assertEquals(Instant.parse("2024-01-15T10:30:45Z"), seconds.parse("2024-01-15 10:30:45.999"));
    }

    @Test
    void parse_shouldTruncateAcrossEpochAndKeepSeconds() {
        TimestampParser millis = new TimestampParser(NormalizerOptions.defaults().withSubSecondDigits(3));

        assertEquals(Instant.parse("1969-12-31T23:59:59.999Z"), millis.parse("1969-12-31 23:59:59.9999"));
        assertEquals(Instant.parse("2024-01-15T10:30:45.001Z"), millis.parse(Instant.parse("2024-01-15T10:30:45.001999Z")));
    }

    @Test
    void parse_shouldApplyExplicitOffsets() {
        assertEquals(Instant.parse("2024-01-15T08:30:45Z"), parser.parse("2024-01-15T10:30:45+02:00"));
        assertEquals(Instant.parse("2024-01-15T15:30:45Z"), parser.parse("2024-01-15 10:30:45-0500"));
        assertEquals(Instant.parse("2024-01-15T10:30:45Z"), parser.parse("2024-01-15T10:30:45Z"));
    }

    @Test
    void parse_shouldUseConfiguredZoneForLocalValues() {
        TimestampParser berlin = new TimestampParser(
            NormalizerOptions.defaults().withZone(ZoneId.of("Europe/Berlin")));

        assertEquals(Instant.parse("2024-01-15T09:30:45Z"), berlin.parse("2024-01-15 10:30:45"));
        assertEquals(Instant.parse("2024-01-15T09:30:45Z"), berlin.parse(LocalDateTime.of(2024, 1, 15, 10, 30, 45)));
    }

    @Test
    void parse_shouldAcceptTemporalAndNumericValues() {
        Instant instant = Instant.parse("2024-01-15T10:30:45Z");

        assertEquals(instant, parser.parse(instant));
        assertEquals(instant, parser.parse(OffsetDateTime.of(2024, 1, 15, 10, 30, 45, 0, ZoneOffset.UTC)));
        assertEquals(instant, parser.parse(Date.from(instant)));
        assertEquals(instant, parser.parse(instant.getEpochSecond()));
        assertEquals(instant.plusMillis(250), parser.parse(instant.getEpochSecond() + 0.25));
    }

    @Test
    void parse_shouldRejectGarbageAndMissingValues() {
        assertThrows(DateTimeException.class, () -> parser.parse("yesterday"));
        assertThrows(DateTimeException.class, () -> parser.parse("2024-01-15"));
        assertThrows(DateTimeException.class, () -> parser.parse("2024-13-45 10:30:45"));
        assertThrows(DateTimeException.class, () -> parser.parse(null));
        assertThrows(DateTimeException.class, () -> parser.parse(Double.NaN));
    }
}
