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

import java.io.IOException;

/**
 * The three event variants. Each variant has a byte id for binary serialization and the name of
 * its key column in the JSON wire format.
 */
public enum EventType implements Writeable {
    /** Event at a single timestamp, keyed by {@code "time"} */
    TIME((byte) 0, "time"),
    /** Event spanning a {@link TimeRange}, keyed by {@code "timerange"} */
    TIME_RANGE((byte) 1, "timerange"),
    /** Event attached to an {@link Index} bucket, keyed by {@code "index"} */
    INDEXED((byte) 2, "index");

    private final byte id;
    private final String keyName;

    EventType(byte id, String keyName) {
        this.id = id;
        this.keyName = keyName;
    }

    public byte getId() {
        return id;
    }

    /**
     * @return the wire format column naming this variant's key
     */
    public String getKeyName() {
        return keyName;
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeByte(id);
    }

    public static EventType readFrom(StreamInput in) throws IOException {
        return fromId(in.readByte());
    }

    public static EventType fromId(byte id) {
        for (EventType type : values()) {
            if (type.id == id) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type ID: " + id);
    }

    /**
     * @return the variant whose key column is {@code keyName}, or null if there is none
     */
    public static EventType fromKeyName(String keyName) {
        for (EventType type : values()) {
            if (type.keyName.equals(keyName)) {
                return type;
            }
        }
        return null;
    }
}
