/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.model;

import org.opensearch.core.common.io.stream.StreamOutput;

import java.io.IOException;

/**
 * An event at a single point in time.
 */
public final class TimeEvent extends Event {

    private final long timestamp;

    /**
     * @param timestamp epoch milliseconds
     * @param data payload map or scalar value
     */
    public TimeEvent(long timestamp, Object data) {
        super(data);
        this.timestamp = timestamp;
    }

    /**
     * Builds a point event from any zone-aware time value.
     *
     * @throws org.opensearch.pond.core.exception.EventException for naive or unsupported time values
     */
    public static TimeEvent of(Object time, Object data) {
        return new TimeEvent(timestampFromArg(time), data);
    }

    @Override
    public EventType getType() {
        return EventType.TIME;
    }

    @Override
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public long getBegin() {
        return timestamp;
    }

    @Override
    public long getEnd() {
        return timestamp;
    }

    @Override
    public TimeRange getTimeRange() {
        return new TimeRange(timestamp, timestamp);
    }

    @Override
    public Long getKey() {
        return timestamp;
    }

    @Override
    public TimeEvent setData(Object newData) {
        return new TimeEvent(timestamp, newData);
    }

    @Override
    protected void writeKey(StreamOutput out) throws IOException {
        out.writeLong(timestamp);
    }
}
