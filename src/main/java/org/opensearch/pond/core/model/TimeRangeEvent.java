/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.model;

import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.pond.core.exception.EventException;
import org.opensearch.pond.core.exception.TimeRangeException;

import java.io.IOException;
import java.util.List;

/**
 * An event covering a span of time. Its timestamp is the begin of the range.
 */
public final class TimeRangeEvent extends Event {

    private final TimeRange range;

    public TimeRangeEvent(TimeRange range, Object data) {
        super(data);
        if (range == null) {
            throw new EventException("a range event needs a time range");
        }
        this.range = range;
    }

    public TimeRangeEvent(long begin, long end, Object data) {
        this(new TimeRange(begin, end), data);
    }

    /**
     * Builds a range event from a {@link TimeRange} or a two element {@code [begin, end]} list.
     */
    public static TimeRangeEvent of(Object range, Object data) {
        if (range instanceof TimeRange timeRange) {
            return new TimeRangeEvent(timeRange, data);
        } else if (range instanceof List<?> pair) {
            try {
                return new TimeRangeEvent(TimeRange.fromList(pair), data);
            } catch (TimeRangeException e) {
                throw new EventException("invalid range for event: " + e.getMessage(), e);
            }
        }
        throw new EventException("unable to build a range event from " + range);
    }

    @Override
    public EventType getType() {
        return EventType.TIME_RANGE;
    }

    @Override
    public long getTimestamp() {
        return range.getBegin();
    }

    @Override
    public long getBegin() {
        return range.getBegin();
    }

    @Override
    public long getEnd() {
        return range.getEnd();
    }

    @Override
    public TimeRange getTimeRange() {
        return range;
    }

    @Override
    public List<Long> getKey() {
        return range.toJson();
    }

    @Override
    public TimeRangeEvent setData(Object newData) {
        return new TimeRangeEvent(range, newData);
    }

    @Override
    protected void writeKey(StreamOutput out) throws IOException {
        range.writeTo(out);
    }
}
