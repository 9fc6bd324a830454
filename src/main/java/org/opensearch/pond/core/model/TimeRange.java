/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.model;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.pond.core.exception.TimeRangeException;
import org.opensearch.pond.core.exception.UtilityException;
import org.opensearch.pond.core.utils.TimeUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An immutable, inclusive span of time between two epoch-millisecond instants.
 *
 * <p>The range algebra follows these rules:</p>
 * <ul>
 *   <li><strong>contains</strong>: a timestamp inside {@code [begin, end]}, or a range lying wholly inside this one</li>
 *   <li><strong>within</strong>: this range lies wholly inside the other one</li>
 *   <li><strong>overlaps</strong>: exactly one end of the other range falls inside this one, so a
 *   range that contains or equals this one does not overlap it</li>
 *   <li><strong>disjoint</strong>: the ranges share no instant</li>
 * </ul>
 *
 * <p>Mutators return new instances.</p>
 */
public final class TimeRange implements Writeable {

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    private final long begin;
    private final long end;

    /**
     * @param begin begin timestamp in epoch milliseconds
     * @param end end timestamp in epoch milliseconds, not before {@code begin}
     * @throws TimeRangeException if {@code begin > end}
     */
    public TimeRange(long begin, long end) {
        if (begin > end) {
            throw new TimeRangeException(String.format(Locale.ROOT, "begin [%d] must not be after end [%d]", begin, end));
        }
        this.begin = begin;
        this.end = end;
    }

    /**
     * Builds a range from any pair of time values accepted by {@link TimeUtils#toEpochMillis(Object)}.
     */
    public static TimeRange of(Object begin, Object end) {
        try {
            return new TimeRange(TimeUtils.toEpochMillis(begin), TimeUtils.toEpochMillis(end));
        } catch (UtilityException e) {
            throw new TimeRangeException("unable to build a time range: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a range from a two element list, the wire form of a range.
     */
    public static TimeRange fromList(List<?> pair) {
        if (pair == null || pair.size() != 2) {
            throw new TimeRangeException("a time range needs exactly two values, got: " + pair);
        }
        return of(pair.get(0), pair.get(1));
    }

    public static TimeRange readFrom(StreamInput in) throws IOException {
        return new TimeRange(in.readLong(), in.readLong());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeLong(begin);
        out.writeLong(end);
    }

    public long getBegin() {
        return begin;
    }

    public long getEnd() {
        return end;
    }

    public TimeRange setBegin(long newBegin) {
        return new TimeRange(newBegin, end);
    }

    public TimeRange setEnd(long newEnd) {
        return new TimeRange(begin, newEnd);
    }

    /**
     * @return length of the range in milliseconds
     */
    public long duration() {
        return end - begin;
    }

    public boolean contains(long timestamp) {
        return begin <= timestamp && timestamp <= end;
    }

    public boolean contains(TimeRange other) {
        return begin <= other.begin && end >= other.end;
    }

    public boolean within(TimeRange other) {
        return begin >= other.begin && end <= other.end;
    }

    public boolean overlaps(TimeRange other) {
        return (contains(other.begin) && !contains(other.end)) || (contains(other.end) && !contains(other.begin));
    }

    public boolean disjoint(TimeRange other) {
        return end < other.begin || begin > other.end;
    }

    /**
     * @return the smallest range covering both ranges
     */
    public TimeRange extents(TimeRange other) {
        return new TimeRange(Math.min(begin, other.begin), Math.max(end, other.end));
    }

    /**
     * @return the shared part of both ranges, or null when they are disjoint
     */
    public TimeRange intersection(TimeRange other) {
        if (disjoint(other)) {
            return null;
        }
        return new TimeRange(Math.max(begin, other.begin), Math.min(end, other.end));
    }

    public List<Long> toJson() {
        return List.of(begin, end);
    }

    public String toUtcString() {
        return "[" + TimeUtils.formatUtc(begin) + ", " + TimeUtils.formatUtc(end) + "]";
    }

    public String toLocalString() {
        return "[" + TimeUtils.formatLocal(begin) + ", " + TimeUtils.formatLocal(end) + "]";
    }

    /**
     * Renders the duration in words, largest units first, for example {@code "1 day, 2 hours"}.
     * Zero-valued units are left out; a zero length range is {@code "0 seconds"}.
     */
    public String humanizeDuration() {
        long remaining = duration();
        List<String> parts = new ArrayList<>();
        remaining = appendUnit(parts, remaining, DAY, "day");
        remaining = appendUnit(parts, remaining, HOUR, "hour");
        remaining = appendUnit(parts, remaining, MINUTE, "minute");
        appendUnit(parts, remaining, SECOND, "second");
        return parts.isEmpty() ? "0 seconds" : String.join(", ", parts);
    }

    private static long appendUnit(List<String> parts, long remaining, long unit, String name) {
        long count = remaining / unit;
        if (count > 0) {
            parts.add(count + " " + name + (count == 1 ? "" : "s"));
        }
        return remaining % unit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeRange other = (TimeRange) o;
        return begin == other.begin && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(begin, end);
    }

    @Override
    public String toString() {
        return "[" + begin + ", " + end + "]";
    }
}
