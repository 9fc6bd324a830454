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
import org.opensearch.pond.core.exception.IndexException;

import java.io.IOException;

/**
 * An event attached to a time bucket named by an {@link Index}, such as {@code "1h-396199"} or
 * {@code "2015-07"}. Its timestamp is the begin of the bucket.
 */
public final class IndexedEvent extends Event {

    private final Index index;

    public IndexedEvent(Index index, Object data) {
        super(data);
        if (index == null) {
            throw new EventException("an indexed event needs an index");
        }
        this.index = index;
    }

    public IndexedEvent(String index, Object data) {
        this(index, data, true);
    }

    public IndexedEvent(String index, Object data, boolean utc) {
        this(parseIndex(index, utc), data);
    }

    private static Index parseIndex(String index, boolean utc) {
        try {
            return new Index(index, utc);
        } catch (IndexException e) {
            throw new EventException("invalid index for event: " + e.getMessage(), e);
        }
    }

    public Index getIndex() {
        return index;
    }

    public String getIndexAsString() {
        return index.toString();
    }

    public boolean isUtc() {
        return index.isUtc();
    }

    @Override
    public EventType getType() {
        return EventType.INDEXED;
    }

    @Override
    public long getTimestamp() {
        return index.begin();
    }

    @Override
    public long getBegin() {
        return index.begin();
    }

    @Override
    public long getEnd() {
        return index.end();
    }

    @Override
    public TimeRange getTimeRange() {
        return index.asTimeRange();
    }

    @Override
    public String getKey() {
        return index.toString();
    }

    @Override
    public IndexedEvent setData(Object newData) {
        return new IndexedEvent(index, newData);
    }

    @Override
    protected void writeKey(StreamOutput out) throws IOException {
        index.writeTo(out);
    }
}
