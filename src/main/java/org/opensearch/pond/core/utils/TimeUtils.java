/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.utils;

import org.opensearch.pond.core.exception.UtilityException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.Locale;

/**
 * Conversions between epoch milliseconds and zone-aware time values.
 *
 * <p>Every instant handled by the library is an epoch-millisecond {@code long}. Values coming in
 * from callers must carry a zone or offset; a {@link LocalDateTime} or {@link LocalDate} is
 * rejected because turning it into an instant would mean guessing a zone.</p>
 */
public final class TimeUtils {

    private static final DateTimeFormatter UTC_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT)
        .withZone(ZoneOffset.UTC);

    private TimeUtils() {}

    /**
     * Converts a time value to epoch milliseconds.
     *
     * @param time a {@link Number} of epoch ms, an {@link Instant}, {@link ZonedDateTime},
     *             {@link OffsetDateTime} or {@link Date}
     * @return epoch milliseconds
     * @throws UtilityException if the value is null, naive, or of an unsupported type
     */
    public static long toEpochMillis(Object time) {
        if (time instanceof Number number) {
            return number.longValue();
        } else if (time instanceof Instant instant) {
            return instant.toEpochMilli();
        } else if (time instanceof ZonedDateTime zoned) {
            return zoned.toInstant().toEpochMilli();
        } else if (time instanceof OffsetDateTime offset) {
            return offset.toInstant().toEpochMilli();
        } else if (time instanceof Date date) {
            return date.getTime();
        } else if (time instanceof LocalDateTime || time instanceof LocalDate) {
            throw new UtilityException(
                String.format(Locale.ROOT, "time value [%s] has no zone, attach a zone or offset before using it", time)
            );
        }
        throw new UtilityException(String.format(Locale.ROOT, "unable to convert [%s] to a timestamp", time));
    }

    public static Instant toInstant(long ms) {
        return Instant.ofEpochMilli(ms);
    }

    public static ZonedDateTime toUtc(long ms) {
        return Instant.ofEpochMilli(ms).atZone(ZoneOffset.UTC);
    }

    /**
     * Converts epoch milliseconds to a date-time in the JVM default zone.
     */
    public static ZonedDateTime toLocal(long ms) {
        return Instant.ofEpochMilli(ms).atZone(ZoneId.systemDefault());
    }

    public static ZonedDateTime toZone(long ms, boolean utc) {
        return utc ? toUtc(ms) : toLocal(ms);
    }

    /**
     * Attaches a zone to a naive date-time. This is the only sanctioned way to turn a
     * {@link LocalDateTime} into an instant.
     */
    public static ZonedDateTime localize(LocalDateTime dateTime, ZoneId zone) {
        if (dateTime == null || zone == null) {
            throw new UtilityException("localize needs both a date-time and a zone");
        }
        return dateTime.atZone(zone);
    }

    /**
     * Moves a timestamp by whole calendar months in UTC, clamping the day of month.
     */
    public static long plusMonths(long ms, int months) {
        return toUtc(ms).plusMonths(months).toInstant().toEpochMilli();
    }

    public static String formatUtc(long ms) {
        return UTC_FORMAT.format(Instant.ofEpochMilli(ms));
    }

    public static String formatLocal(long ms) {
        return toLocal(ms).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
