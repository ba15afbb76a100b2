package com.propertyintel.crimeintel.service.event;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Reads the timestamp shapes found across feeds: ISO-8601 with or without an
 * offset, {@code yyyy-MM-dd HH:mm:ss}, bare dates, and epoch seconds or millis.
 *
 * Values without an offset are taken as UTC. Anything unreadable gives null.
 */
@Slf4j
public final class TimestampParser {

    /** Epoch values above this are taken to be milliseconds */
    private static final long EPOCH_MILLIS_CUTOFF = 100_000_000_000L;

    private static final DateTimeFormatter FLEXIBLE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter();

    private TimestampParser() {}

    public static OffsetDateTime parse(Object value) {
        if (value == null) return null;
        if (value instanceof OffsetDateTime odt) return odt;
        if (value instanceof ZonedDateTime zdt) return zdt.toOffsetDateTime();
        if (value instanceof Instant instant) return instant.atOffset(ZoneOffset.UTC);
        if (value instanceof LocalDateTime ldt) return ldt.atOffset(ZoneOffset.UTC);
        if (value instanceof Number number) return fromEpoch(number);
        return parseText(value.toString().trim());
    }

    private static OffsetDateTime parseText(String text) {
        if (text.isEmpty()) return null;

        if (text.chars().allMatch(Character::isDigit) && text.length() > 8) {
            try {
                return fromEpoch(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return null;
            }
        }

        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay().atOffset(ZoneOffset.UTC);
            }
            TemporalAccessor parsed = FLEXIBLE.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) return odt;
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Could not parse timestamp: {}", text);
            return null;
        }
    }

    private static OffsetDateTime fromEpoch(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double epoch = number.doubleValue();
            if (Double.isNaN(epoch) || Double.isInfinite(epoch)) return null;
        }
        return fromEpoch(number.longValue());
    }

    private static OffsetDateTime fromEpoch(long epoch) {
        try {
            Instant instant = epoch > EPOCH_MILLIS_CUTOFF
                    ? Instant.ofEpochMilli(epoch)
                    : Instant.ofEpochSecond(epoch);
            return instant.atOffset(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            log.debug("Epoch value out of range: {}", epoch);
            return null;
        }
    }
}
