package com.di.organizer.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class DateFormatUtils {
    private static final Logger logger = LoggerFactory.getLogger(DateFormatUtils.class);

    private DateFormatUtils() {
    }

    /** Output format of every date column. */
    public static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    /**
     * Date-only patterns tried in order; the first one that parses wins.
     * Month-first comes before day-first for ambiguous input such as 03/04/2024.
     */
    private static final List<String> KNOWN_PATTERNS = Arrays.asList(
            "uuuu-MM-dd",   // ISO standard
            "uuuu/MM/dd",   // Logs
            "uuuu.MM.dd",   // Asia / Legacy systems
            "MM/dd/uuuu",   // US
            "MM-dd-uuuu",   // US alternate
            "dd/MM/uuuu",   // UK / EU
            "dd-MM-uuuu",   // Forms
            "dd.MM.uuuu",   // Central Europe
            "uuuuMMdd",
            "uuuu-M-d",
            "uuuu/M/d",
            "M/d/uuuu",
            "d MMM uuuu",   // 26 Sep 2017
            "d MMMM uuuu"   // 26 September 2017
    );

    /** Date-time patterns; only the date part is kept. */
    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = Arrays.asList(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu/MM/dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT)
    );

    /**
     * Tries known patterns to read a calendar date from a string.
     *
     * @param inputDate the input date string (e.g. "2024-06-21", "06/21/2024", "2024-06-21T08:30:00")
     * @return the parsed date, or empty when no pattern matches
     */
    public static Optional<LocalDate> parseDate(String inputDate) {
        if (inputDate == null || inputDate.isBlank()) {
            return Optional.empty();
        }
        String text = inputDate.trim();
        for (String pattern : KNOWN_PATTERNS) {
            try {
                DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                        .parseCaseInsensitive()
                        .appendPattern(pattern)
                        .toFormatter(Locale.ENGLISH)
                        .withResolverStyle(ResolverStyle.STRICT);
                return Optional.of(LocalDate.parse(text, formatter));
            } catch (DateTimeParseException ignored) {
                logger.trace("Pattern failed: {}, error: {}", pattern, ignored.getMessage());
            }
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(text, formatter).toLocalDate());
            } catch (DateTimeParseException ignored) {
                logger.trace("Date-time format failed for '{}': {}", text, ignored.getMessage());
            }
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException ignored) {
            logger.debug("Unrecognized date format: {}", text);
        }
        return Optional.empty();
    }

    /**
     * Converts any supported date value to a {@code yyyy-MM-dd} string.
     * Strings go through {@link #parseDate(String)}; java.time and java.util date objects are
     * formatted directly. Anything else (numbers, booleans, unparsable text) yields an empty string.
     *
     * @param value raw cell or JSON value, may be null
     * @return ISO date, or an empty string; never null
     */
    public static String toIsoDateString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).format(ISO_DATE);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate().format(ISO_DATE);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDate().format(ISO_DATE);
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDate().format(ISO_DATE);
        }
        if (value instanceof Instant) {
            return ((Instant) value).atZone(ZoneId.systemDefault()).toLocalDate().format(ISO_DATE);
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().format(ISO_DATE);
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant().atZone(ZoneId.systemDefault()).toLocalDate().format(ISO_DATE);
        }
        if (value instanceof CharSequence) {
            return parseDate(value.toString()).map(d -> d.format(ISO_DATE)).orElse("");
        }
        return "";
    }
}
