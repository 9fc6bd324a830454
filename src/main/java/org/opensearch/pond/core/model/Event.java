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
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.pond.core.exception.EventException;
import org.opensearch.pond.core.exception.UtilityException;
import org.opensearch.pond.core.utils.FieldPaths;
import org.opensearch.pond.core.utils.TimeUtils;
import org.opensearch.pond.core.utils.XContentUtils;
import org.opensearch.pond.query.function.Reducer;
import org.opensearch.pond.query.function.Reducers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable piece of time-series data: a time key plus a payload map.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li><strong>{@link TimeEvent}</strong>: keyed by a single timestamp</li>
 *   <li><strong>{@link TimeRangeEvent}</strong>: keyed by a {@link TimeRange}</li>
 *   <li><strong>{@link IndexedEvent}</strong>: keyed by an {@link Index} bucket</li>
 * </ul>
 *
 * <h2>Payload</h2>
 * <p>The payload is a frozen, insertion-ordered map. Passing a scalar ({@link Number},
 * {@link String} or {@link Boolean}) as data is shorthand for {@code {"value": scalar}}. Values
 * are addressed by field paths, either dotted ({@code "direction.in"}) or as a segment list; a
 * lookup that misses any segment returns null.</p>
 *
 * <p>Events never change. {@link #setData(Object)} returns a new event of the same variant with
 * the same key.</p>
 */
public abstract class Event implements Writeable, ToXContentObject {

    private static final String DATA_FIELD = "data";

    private final Map<String, Object> data;

    protected Event(Object data) {
        this.data = dataFromArg(data);
    }

    private static Map<String, Object> dataFromArg(Object data) {
        if (data == null) {
            return Collections.emptyMap();
        } else if (data instanceof Map<?, ?> map) {
            return FieldPaths.freeze(map);
        } else if (data instanceof Number || data instanceof String || data instanceof Boolean) {
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put(FieldPaths.DEFAULT_FIELD, data);
            return FieldPaths.freeze(wrapped);
        }
        throw new EventException(String.format(Locale.ROOT, "unable to interpret [%s] as event data", data));
    }

    /**
     * Converts a caller supplied time value, rejecting values without a zone.
     */
    protected static long timestampFromArg(Object time) {
        try {
            return TimeUtils.toEpochMillis(time);
        } catch (UtilityException e) {
            throw new EventException(e.getMessage(), e);
        }
    }

    public abstract EventType getType();

    /**
     * @return the event time; the begin of the range for range and indexed events
     */
    public abstract long getTimestamp();

    public abstract long getBegin();

    public abstract long getEnd();

    public abstract TimeRange getTimeRange();

    /**
     * @return the key in wire form: epoch ms, a {@code [begin, end]} list, or an index string
     */
    public abstract Object getKey();

    /**
     * @return a new event of the same variant and key carrying {@code newData}
     */
    public abstract Event setData(Object newData);

    protected abstract void writeKey(StreamOutput out) throws IOException;

    public Map<String, Object> getData() {
        return data;
    }

    /**
     * @return the value of the default {@code "value"} field
     */
    public Object get() {
        return data.get(FieldPaths.DEFAULT_FIELD);
    }

    public Object get(String fieldPath) {
        return FieldPaths.get(data, FieldPaths.split(fieldPath));
    }

    public Object get(List<String> fieldPath) {
        return FieldPaths.get(data, FieldPaths.toPath(fieldPath));
    }

    /**
     * Reduces several fields into one named field.
     *
     * @param fieldSpecList paths of the fields to reduce
     * @param name name of the output field
     * @param reducer reducer applied to the field values
     * @param append keep the existing fields when true, otherwise only the new field remains
     */
    public Event collapse(List<String> fieldSpecList, String name, Reducer reducer, boolean append) {
        List<Object> values = new ArrayList<>(fieldSpecList.size());
        for (String fieldPath : fieldSpecList) {
            values.add(get(fieldPath));
        }
        Map<String, Object> newData = append ? FieldPaths.thaw(data) : new LinkedHashMap<>();
        newData.put(name, reducer.reduce(values));
        return setData(newData);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(getType().getKeyName(), getKey());
        json.put(DATA_FIELD, data);
        return json;
    }

    /**
     * Renders the event as a wire format row: the key followed by the value of each column.
     */
    public List<Object> toPoint(List<String> columns) {
        List<Object> point = new ArrayList<>(columns.size() + 1);
        point.add(getKey());
        for (String column : columns) {
            point.add(data.get(column));
        }
        return point;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field(getType().getKeyName(), getKey());
        builder.field(DATA_FIELD, data);
        builder.endObject();
        return builder;
    }

    @Override
    public final void writeTo(StreamOutput out) throws IOException {
        getType().writeTo(out);
        writeKey(out);
        out.writeVInt(data.size());
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            out.writeString(entry.getKey());
            out.writeGenericValue(entry.getValue());
        }
    }

    public static Event readFrom(StreamInput in) throws IOException {
        EventType type = EventType.readFrom(in);
        return switch (type) {
            case TIME -> {
                long timestamp = in.readLong();
                yield new TimeEvent(timestamp, readData(in));
            }
            case TIME_RANGE -> {
                TimeRange range = TimeRange.readFrom(in);
                yield new TimeRangeEvent(range, readData(in));
            }
            case INDEXED -> {
                Index index = Index.readFrom(in);
                yield new IndexedEvent(index, readData(in));
            }
        };
    }

    private static Map<String, Object> readData(StreamInput in) throws IOException {
        int size = in.readVInt();
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            result.put(in.readString(), in.readGenericValue());
        }
        return result;
    }

    // -- static helpers over events

    /**
     * @return false if the field is missing, null, an empty string or NaN
     */
    public static boolean isValidValue(Event event, String fieldPath) {
        return FieldPaths.isValid(event.get(fieldPath));
    }

    /**
     * Projects an event onto the given fields. The selected paths become top-level keys of the
     * new payload. A null field spec returns the event unchanged.
     */
    public static Event selector(Event event, Object fieldSpec) {
        if (fieldSpec == null) {
            return event;
        }
        Map<String, Object> selected = new LinkedHashMap<>();
        for (String fieldPath : FieldPaths.toFieldSpec(fieldSpec)) {
            selected.put(fieldPath, event.get(fieldPath));
        }
        return event.setData(selected);
    }

    public static boolean same(Event a, Event b) {
        return Objects.equals(a, b);
    }

    /**
     * Merges events sharing one key into a single event holding the union of their fields.
     *
     * @return the merged event, or null for an empty list
     * @throws EventException if the variants or keys differ, or if two events share a field
     */
    public static Event merge(List<? extends Event> events) {
        if (events == null || events.isEmpty()) {
            return null;
        }
        Event first = events.get(0);
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Event event : events) {
            if (event.getType() != first.getType()) {
                throw new EventException("Events for merge must all be of the same type");
            }
            if (!Objects.equals(event.getKey(), first.getKey())) {
                throw new EventException(switch (first.getType()) {
                    case TIME -> "Events for merge must have the same timestamp";
                    case TIME_RANGE -> "Events for merge must have the same time range";
                    case INDEXED -> "Events for merge must have the same index";
                });
            }
            for (Map.Entry<String, Object> entry : event.getData().entrySet()) {
                if (merged.containsKey(entry.getKey())) {
                    throw new EventException(
                        String.format(Locale.ROOT, "Events for merge share the field [%s] at [%s]", entry.getKey(), event.getKey())
                    );
                }
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return first.setData(merged);
    }

    /**
     * Groups point events by timestamp and reduces each field per timestamp, producing one event
     * per distinct timestamp in order of first appearance.
     *
     * @param fieldSpec fields to combine; null combines every top-level field of each event
     */
    public static List<Event> combine(List<? extends Event> events, Object fieldSpec, Reducer reducer) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        Map<Long, Map<String, List<Object>>> buckets = new LinkedHashMap<>();
        for (Event event : events) {
            if (event.getType() != EventType.TIME) {
                throw new EventException("combine only supports point events, got " + event.getType());
            }
            List<String> fields = fieldSpec == null ? new ArrayList<>(event.getData().keySet()) : FieldPaths.toFieldSpec(fieldSpec);
            Map<String, List<Object>> bucket = buckets.computeIfAbsent(event.getTimestamp(), ts -> new LinkedHashMap<>());
            for (String field : fields) {
                bucket.computeIfAbsent(field, f -> new ArrayList<>()).add(event.get(field));
            }
        }
        List<Event> result = new ArrayList<>(buckets.size());
        for (Map.Entry<Long, Map<String, List<Object>>> bucket : buckets.entrySet()) {
            Map<String, Object> reduced = new LinkedHashMap<>();
            for (Map.Entry<String, List<Object>> column : bucket.getValue().entrySet()) {
                FieldPaths.setIn(reduced, FieldPaths.split(column.getKey()), reducer.reduce(column.getValue()));
            }
            result.add(new TimeEvent(bucket.getKey(), reduced));
        }
        return result;
    }

    public static List<Event> sum(List<? extends Event> events, Object fieldSpec) {
        return combine(events, fieldSpec, Reducers.sum());
    }

    public static List<Event> avg(List<? extends Event> events, Object fieldSpec) {
        return combine(events, fieldSpec, Reducers.avg());
    }

    /**
     * Collects the values of each field across events into columns.
     *
     * @param fieldSpec fields to collect; null collects every top-level field
     */
    public static Map<String, List<Object>> map(List<? extends Event> events, Object fieldSpec) {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (Event event : events) {
            List<String> fields = fieldSpec == null ? new ArrayList<>(event.getData().keySet()) : FieldPaths.toFieldSpec(fieldSpec);
            for (String field : fields) {
                columns.computeIfAbsent(field, f -> new ArrayList<>()).add(event.get(field));
            }
        }
        return columns;
    }

    public static Map<String, Object> reduce(Map<String, List<Object>> columns, Reducer reducer) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> column : columns.entrySet()) {
            result.put(column.getKey(), reducer.reduce(column.getValue()));
        }
        return result;
    }

    public static Map<String, Object> mapReduce(List<? extends Event> events, Object fieldSpec, Reducer reducer) {
        return reduce(map(events, fieldSpec), reducer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event other = (Event) o;
        return Objects.equals(getKey(), other.getKey()) && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType(), getKey(), data);
    }

    @Override
    public String toString() {
        return XContentUtils.toJsonString(this);
    }
}
