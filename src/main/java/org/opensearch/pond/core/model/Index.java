/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.pond.core.exception.IndexException;
import org.opensearch.pond.core.utils.TimeUtils;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A string key naming a time bucket, resolved to the {@link TimeRange} it covers.
 *
 * <h2>Supported forms</h2>
 * <ul>
 *   <li><strong>Fixed window</strong>: {@code <N><unit>-<position>} with unit one of {@code s, m, h, d}.
 *   The bucket length is {@code N} units and the position is {@code floor(epochMs / length)}, so
 *   {@code "5m-4754394"} covers {@code [4754394 * 300000, 4754395 * 300000]}.</li>
 *   <li><strong>Year</strong>: {@code YYYY}</li>
 *   <li><strong>Month</strong>: {@code YYYY-MM}</li>
 *   <li><strong>Day</strong>: {@code YYYY-MM-DD}</li>
 * </ul>
 *
 * <p>Calendar buckets always resolve in UTC and end at the last millisecond of the period. Asking
 * for a local calendar index logs a warning and the index is coerced to UTC.</p>
 */
public final class Index implements Writeable {

    private static final Logger logger = LogManager.getLogger(Index.class);

    private static final Pattern FIXED_INDEX = Pattern.compile("^(\\d+)([smhd])-(-?\\d+)$");
    private static final Pattern WINDOW = Pattern.compile("^(\\d+)([smhd])$");
    private static final Pattern YEAR = Pattern.compile("^(\\d{4})$");
    private static final Pattern MONTH = Pattern.compile("^(\\d{4})-(\\d{2})$");
    private static final Pattern DAY = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})$");

    private final String index;
    private final boolean utc;
    private final TimeRange range;

    public Index(String index) {
        this(index, true);
    }

    /**
     * @param index the index string
     * @param utc whether the index is in UTC; a local calendar index is coerced to UTC
     * @throws IndexException if the string is not a known index form
     */
    public Index(String index, boolean utc) {
        if (index == null) {
            throw new IndexException("index string must not be null");
        }
        this.index = index;
        this.range = rangeFromIndexString(index);
        boolean fixed = FIXED_INDEX.matcher(index).matches();
        if (!utc && !fixed) {
            logger.warn("calendar index [{}] requested in local time, interpreting it as UTC", index);
        }
        this.utc = utc || !fixed;
    }

    public static Index readFrom(StreamInput in) throws IOException {
        return new Index(in.readString(), in.readBoolean());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeString(index);
        out.writeBoolean(utc);
    }

    private static TimeRange rangeFromIndexString(String index) {
        try {
            Matcher fixed = FIXED_INDEX.matcher(index);
            if (fixed.matches()) {
                long duration = windowDuration(fixed.group(1) + fixed.group(2));
                long position = Long.parseLong(fixed.group(3));
                return new TimeRange(position * duration, (position + 1) * duration);
            }
            Matcher day = DAY.matcher(index);
            if (day.matches()) {
                ZonedDateTime begin = ZonedDateTime.of(
                    Integer.parseInt(day.group(1)),
                    Integer.parseInt(day.group(2)),
                    Integer.parseInt(day.group(3)),
                    0,
                    0,
                    0,
                    0,
                    ZoneOffset.UTC
                );
                return calendarRange(begin, begin.plusDays(1));
            }
            Matcher month = MONTH.matcher(index);
            if (month.matches()) {
                ZonedDateTime begin = ZonedDateTime.of(
                    Integer.parseInt(month.group(1)),
                    Integer.parseInt(month.group(2)),
                    1,
                    0,
                    0,
                    0,
                    0,
                    ZoneOffset.UTC
                );
                return calendarRange(begin, begin.plusMonths(1));
            }
            Matcher year = YEAR.matcher(index);
            if (year.matches()) {
                ZonedDateTime begin = ZonedDateTime.of(Integer.parseInt(year.group(1)), 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
                return calendarRange(begin, begin.plusYears(1));
            }
        } catch (DateTimeException | NumberFormatException e) {
            throw new IndexException(String.format(Locale.ROOT, "invalid index string [%s]: %s", index, e.getMessage()), e);
        }
        throw new IndexException(String.format(Locale.ROOT, "unable to parse index string [%s]", index));
    }

    private static TimeRange calendarRange(ZonedDateTime begin, ZonedDateTime nextBegin) {
        return new TimeRange(begin.toInstant().toEpochMilli(), nextBegin.toInstant().toEpochMilli() - 1);
    }

    public String getIndex() {
        return index;
    }

    public boolean isUtc() {
        return utc;
    }

    public TimeRange asTimeRange() {
        return range;
    }

    public long begin() {
        return range.getBegin();
    }

    public long end() {
        return range.getEnd();
    }

    public String toJson() {
        return index;
    }

    /**
     * Formats a calendar index with a {@link DateTimeFormatter} pattern, e.g. {@code "MMMM"} turns
     * {@code "2015-07"} into {@code "July"}. Fixed window indexes and a null pattern return the
     * index string unchanged.
     */
    public String toNiceString(String pattern) {
        if (pattern == null || FIXED_INDEX.matcher(index).matches()) {
            return index;
        }
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).format(TimeUtils.toUtc(range.getBegin()));
    }

    /**
     * Length of a window string such as {@code "30s"}, {@code "5m"}, {@code "1h"} or {@code "1d"}.
     *
     * @return window length in milliseconds
     * @throws IndexException if the window string is malformed
     */
    public static long windowDuration(String window) {
        if (window == null || !WINDOW.matcher(window).matches()) {
            throw new IndexException(String.format(Locale.ROOT, "invalid window [%s], expected <N><s|m|h|d>", window));
        }
        long millis = TimeValue.parseTimeValue(window, null, "window").getMillis();
        if (millis <= 0) {
            throw new IndexException(String.format(Locale.ROOT, "window [%s] must have a positive length", window));
        }
        return millis;
    }

    public static long windowPositionFromDate(String window, long timestamp) {
        return Math.floorDiv(timestamp, windowDuration(window));
    }

    /**
     * @return the fixed window index string of the bucket holding {@code timestamp}
     */
    public static String getIndexString(String window, long timestamp) {
        return window + "-" + windowPositionFromDate(window, timestamp);
    }

    /**
     * Lists the index strings of every bucket from the one holding the range's begin through the
     * one holding its end, inclusive.
     */
    public static List<String> getIndexStringList(String window, TimeRange range) {
        long first = windowPositionFromDate(window, range.getBegin());
        long last = windowPositionFromDate(window, range.getEnd());
        List<String> indexes = new ArrayList<>((int) Math.max(0, last - first + 1));
        for (long position = first; position <= last; position++) {
            indexes.add(window + "-" + position);
        }
        return indexes;
    }

    public static String getDailyIndexString(long timestamp, boolean utc) {
        ZonedDateTime date = TimeUtils.toZone(timestamp, utc);
        return String.format(Locale.ROOT, "%04d-%02d-%02d", date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public static String getMonthlyIndexString(long timestamp, boolean utc) {
        ZonedDateTime date = TimeUtils.toZone(timestamp, utc);
        return String.format(Locale.ROOT, "%04d-%02d", date.getYear(), date.getMonthValue());
    }

    public static String getYearlyIndexString(long timestamp, boolean utc) {
        return String.format(Locale.ROOT, "%04d", TimeUtils.toZone(timestamp, utc).getYear());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Index other = (Index) o;
        return utc == other.utc && index.equals(other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, utc);
    }

    @Override
    public String toString() {
        return index;
    }
}
