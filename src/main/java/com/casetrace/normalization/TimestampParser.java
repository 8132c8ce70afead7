package com.casetrace.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses raw timestamp values into ISO-8601 strings.
 *
 * Attempts, in order: ISO-8601 (with or without offset), a bare date, a Unix
 * epoch, then a fixed list of locale date-time patterns. Values carrying an
 * offset keep it ({@code +HH:MM}); values without one are rendered without
 * one. Epoch values are rendered in UTC.
 */
public class TimestampParser {

    private static final Logger log = LoggerFactory.getLogger(TimestampParser.class);

    /**
     * Epoch values above this are milliseconds
     */
    static final long MILLIS_THRESHOLD = 10_000_000_000L;

    private static final Pattern DIGITS = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern BARE_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private static final DateTimeFormatter LOCAL_OUTPUT = new DateTimeFormatterBuilder()
        .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .toFormatter();

    private static final DateTimeFormatter OFFSET_OUTPUT = new DateTimeFormatterBuilder()
        .append(LOCAL_OUTPUT)
        .appendOffset("+HH:MM", "+00:00")
        .toFormatter();

    private static final List<DateTimeFormatter> LOCALE_PATTERNS = List.of(
        strict("MM/dd/uuuu HH:mm:ss"),
        strict("MM/dd/uuuu HH:mm"),
        strict("dd/MM/uuuu HH:mm:ss"),
        strict("uuuu/MM/dd HH:mm:ss"),
        strict("MM-dd-uuuu HH:mm:ss"),
        strict("uuuu-MM-dd HH:mm:ss")
    );

    /**
     * Parse a raw value taken from a record.
     *
     * @param raw string or number
     * @return ISO-8601 string, or empty when no format matched
     */
    public Optional<String> parse(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number) {
            try {
                return fromEpoch(new BigDecimal(raw.toString()));
            } catch (NumberFormatException e) {
                log.debug("Non-finite numeric timestamp: {}", raw);
                return Optional.empty();
            }
        }

        String value = raw.toString().trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }

        if (value.indexOf('T') > 0) {
            Optional<String> iso = parseIso(value);
            if (iso.isPresent()) {
                return iso;
            }
        }
        if (BARE_DATE.matcher(value).matches()) {
            try {
                return Optional.of(LOCAL_OUTPUT.format(LocalDate.parse(value).atStartOfDay()));
            } catch (DateTimeParseException e) {
                log.debug("Invalid bare date: {}", value);
                return Optional.empty();
            }
        }
        if (DIGITS.matcher(value).matches()) {
            return fromEpoch(new BigDecimal(value));
        }

        for (DateTimeFormatter pattern : LOCALE_PATTERNS) {
            try {
                return Optional.of(LOCAL_OUTPUT.format(LocalDateTime.parse(value, pattern)));
            } catch (DateTimeParseException e) {
                // next pattern
            }
        }

        log.debug("Unrecognised timestamp format: {}", value);
        return Optional.empty();
    }

    private Optional<String> parseIso(String value) {
        String candidate = value.endsWith("Z") || value.endsWith("z")
            ? value.substring(0, value.length() - 1) + "+00:00"
            : value;
        try {
            return Optional.of(OFFSET_OUTPUT.format(
                OffsetDateTime.parse(candidate, DateTimeFormatter.ISO_OFFSET_DATE_TIME)));
        } catch (DateTimeParseException e) {
            log.trace("Not an offset timestamp: {}", value);
        }
        try {
            return Optional.of(LOCAL_OUTPUT.format(
                LocalDateTime.parse(candidate, DateTimeFormatter.ISO_LOCAL_DATE_TIME)));
        } catch (DateTimeParseException e) {
            log.trace("Not a local timestamp: {}", value);
        }
        return Optional.empty();
    }

    private Optional<String> fromEpoch(BigDecimal epoch) {
        if (epoch.signum() < 0) {
            return Optional.empty();
        }
        BigDecimal millis = epoch.compareTo(BigDecimal.valueOf(MILLIS_THRESHOLD)) > 0
            ? epoch
            : epoch.movePointRight(3);
        try {
            Instant instant = Instant.ofEpochMilli(millis.setScale(0, RoundingMode.DOWN).longValueExact());
            return Optional.of(OFFSET_OUTPUT.format(instant.atOffset(ZoneOffset.UTC)));
        } catch (ArithmeticException | DateTimeException e) {
            log.debug("Epoch value out of range: {}", epoch);
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
