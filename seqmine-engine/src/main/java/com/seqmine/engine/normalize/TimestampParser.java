package com.seqmine.engine.normalize;

import com.seqmine.core.model.NormalizerOptions;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses year-month-day hour:minute:second timestamps into instants.
 * 
 * Accepts java.time values, {@link Date}, epoch seconds as a {@link Number}, and strings such as
 * {@code 2024-01-15 10:30:45}, {@code 2024/01/15T10:30:45.1234}, {@code 2024-01-15 10:30:45,5+02:00}.
 * Offset-less values are read in the configured zone. By default the full nanosecond
 * precision is kept; a lower configured digit count truncates the result.
 */
public class TimestampParser {

    private static final Pattern YMD_HMS = Pattern.compile(
        "^(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})[ T](\\d{1,2}):(\\d{1,2}):(\\d{1,2})"
            + "(?:[.,](\\d{1,9}))?\\s*(Z|[+-]\\d{2}:?\\d{2})?$");

    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

    private final NormalizerOptions options;

    public TimestampParser(NormalizerOptions options) {
        this.options = options;
    }

    /**
     * Parse a raw value.
     *
     * @throws DateTimeException if the value is null or not a recognizable timestamp
     */
    public Instant parse(Object value) {
        return truncate(toInstant(value));
    }

    private Instant toInstant(Object value) {
        if (value == null) {
            throw new DateTimeException("Timestamp value is missing");
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.atZone(options.zone()).toInstant();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number number) {
            return fromEpochSeconds(number);
        }
        return parseText(value.toString().trim());
    }

    private Instant parseText(String text) {
        Matcher m = YMD_HMS.matcher(text);
        if (!m.matches()) {
            throw new DateTimeException("Not a year-month-day hour:minute:second timestamp: " + text);
        }
        int nanos = 0;
        String fraction = m.group(7);
        if (fraction != null) {
            // right-pad to nanoseconds: "5" -> 500000000
            nanos = Integer.parseInt((fraction + "000000000").substring(0, 9));
        }
        LocalDateTime local = LocalDateTime.of(
            Integer.parseInt(m.group(1)),
            Integer.parseInt(m.group(2)),
            Integer.parseInt(m.group(3)),
            Integer.parseInt(m.group(4)),
            Integer.parseInt(m.group(5)),
            Integer.parseInt(m.group(6)),
            nanos
        );
        String offset = m.group(8);
        if (offset == null) {
            return local.atZone(options.zone()).toInstant();
        }
        return local.atOffset(parseOffset(offset)).toInstant();
    }

    private static ZoneOffset parseOffset(String offset) {
        if ("Z".equals(offset)) {
            return ZoneOffset.UTC;
        }
        if (offset.indexOf(':') < 0) {
            offset = offset.substring(0, 3) + ":" + offset.substring(3);
        }
        return ZoneOffset.of(offset);
    }

    private static Instant fromEpochSeconds(Number number) {
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new DateTimeException("Not a finite epoch second value: " + number);
        }
        BigDecimal seconds = new BigDecimal(number.toString());
        BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
        long nanos = seconds.subtract(whole).multiply(NANOS_PER_SECOND).longValue();
        return Instant.ofEpochSecond(whole.longValueExact(), nanos);
    }

    private Instant truncate(Instant instant) {
        int digits = options.subSecondDigits();
        if (digits >= 9) {
            return instant;
        }
        long unit = (long) Math.pow(10, 9 - digits);
        long nanos = instant.getNano();
        return Instant.ofEpochSecond(instant.getEpochSecond(), nanos - nanos % unit);
    }
}
