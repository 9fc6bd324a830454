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
import org.opensearch.pond.core.exception.PondException;
import org.opensearch.pond.core.exception.TimeSeriesException;
import org.opensearch.pond.core.utils.FieldPaths;
import org.opensearch.pond.core.utils.XContentUtils;
import org.opensearch.pond.query.function.Interpolation;
import org.opensearch.pond.query.function.Reducer;
import org.opensearch.pond.query.pipeline.Aggregation;
import org.opensearch.pond.query.pipeline.CollectionOut;
import org.opensearch.pond.query.pipeline.EmitPolicy;
import org.opensearch.pond.query.pipeline.Pipeline;
import org.opensearch.pond.query.processor.FillMethod;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A chronological {@link EventCollection} with a name, an optional {@link Index}, a UTC flag and
 * free-form metadata.
 *
 * <p>A series is a value: every transform and every setter returns a new series. Transforms such
 * as {@link #fill}, {@link #align}, {@link #rate} and the rollups run a batch {@link Pipeline}
 * over the series' events.</p>
 *
 * <h2>Wire format</h2>
 * <pre>{@code
 * {
 *   "name": "traffic",
 *   "utc": true,
 *   "columns": ["time", "in", "out"],
 *   "points": [[1400425947000, 52, 34], [1400425948000, 18, 13]]
 * }
 * }</pre>
 * <p>The first column names the event variant: {@code "time"}, {@code "timerange"} or
 * {@code "index"}. Any other top-level key is kept as metadata and written back.</p>
 */
public class TimeSeries implements Writeable, ToXContentObject {

    public static final String NAME_FIELD = "name";
    public static final String UTC_FIELD = "utc";
    public static final String INDEX_FIELD = "index";
    public static final String COLUMNS_FIELD = "columns";
    public static final String POINTS_FIELD = "points";

    private final String name;
    private final Index index;
    private final boolean utc;
    private final Map<String, Object> meta;
    private final EventCollection collection;

    /**
     * @throws TimeSeriesException if the events are not in chronological order
     */
    public TimeSeries(String name, EventCollection collection) {
        this(name, null, true, Collections.emptyMap(), collection);
    }

    private TimeSeries(String name, Index index, boolean utc, Map<String, Object> meta, EventCollection collection) {
        if (collection == null) {
            throw new TimeSeriesException("a time series needs a collection of events");
        }
        if (!collection.isChronological()) {
            throw new TimeSeriesException("Events supplied to a time series must be in chronological order");
        }
        this.name = name;
        this.index = index;
        this.utc = utc;
        this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        this.collection = collection;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for a series carrying an index or extra metadata.
     */
    public static final class Builder {
        private String name;
        private Index index;
        private boolean utc = true;
        private final Map<String, Object> meta = new LinkedHashMap<>();
        private EventCollection collection = new EventCollection();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder index(Index index) {
            this.index = index;
            return this;
        }

        public Builder index(String index) {
            this.index = index == null ? null : new Index(index, utc);
            return this;
        }

        public Builder utc(boolean utc) {
            this.utc = utc;
            return this;
        }

        /**
         * Adds a metadata entry; {@code name}, {@code utc} and {@code index} set the typed fields.
         */
        public Builder meta(String key, Object value) {
            switch (key) {
                case NAME_FIELD -> name = value == null ? null : String.valueOf(value);
                case UTC_FIELD -> utc = value == null || Boolean.parseBoolean(String.valueOf(value));
                case INDEX_FIELD -> index(value == null ? null : String.valueOf(value));
                case COLUMNS_FIELD, POINTS_FIELD -> throw new TimeSeriesException(
                    String.format(Locale.ROOT, "[%s] is reserved and cannot be used as metadata", key)
                );
                default -> meta.put(key, FieldPaths.freezeValue(value));
            }
            return this;
        }

        public Builder collection(EventCollection collection) {
            this.collection = collection;
            return this;
        }

        public Builder events(List<? extends Event> events) {
            this.collection = new EventCollection(events);
            return this;
        }

        public TimeSeries build() {
            return new TimeSeries(name, index, utc, meta, collection);
        }
    }

    // -- wire format

    /**
     * Builds a series from its wire structure.
     *
     * @throws TimeSeriesException if columns or points are missing or malformed, or the events are
     *         not in chronological order
     */
    public static TimeSeries fromJson(Map<String, Object> json) {
        Object columnsValue = json.get(COLUMNS_FIELD);
        Object pointsValue = json.get(POINTS_FIELD);
        if (!(columnsValue instanceof List<?> columns) || columns.isEmpty()) {
            throw new TimeSeriesException("time series data needs a non-empty [columns] list");
        }
        if (!(pointsValue instanceof List<?> points)) {
            throw new TimeSeriesException("time series data needs a [points] list");
        }
        EventType type = EventType.fromKeyName(String.valueOf(columns.get(0)));
        if (type == null) {
            throw new TimeSeriesException(
                String.format(Locale.ROOT, "first column must be one of [time, timerange, index], got [%s]", columns.get(0))
            );
        }

        Builder builder = builder();
        for (Map.Entry<String, Object> entry : json.entrySet()) {
            if (!COLUMNS_FIELD.equals(entry.getKey()) && !POINTS_FIELD.equals(entry.getKey()) && !INDEX_FIELD.equals(entry.getKey())) {
                builder.meta(entry.getKey(), entry.getValue());
            }
        }
        if (json.get(INDEX_FIELD) != null) {
            builder.index(String.valueOf(json.get(INDEX_FIELD)));
        }

        List<Event> events = new ArrayList<>(points.size());
        try {
            for (Object pointValue : points) {
                if (!(pointValue instanceof List<?> point) || point.isEmpty()) {
                    throw new TimeSeriesException(String.format(Locale.ROOT, "malformed point [%s]", pointValue));
                }
                Map<String, Object> data = new LinkedHashMap<>();
                for (int i = 1; i < columns.size(); i++) {
                    data.put(String.valueOf(columns.get(i)), i < point.size() ? point.get(i) : null);
                }
                events.add(switch (type) {
                    case TIME -> TimeEvent.of(point.get(0), data);
                    case TIME_RANGE -> TimeRangeEvent.of(point.get(0), data);
                    case INDEXED -> new IndexedEvent(String.valueOf(point.get(0)), data, builder.utc);
                });
            }
        } catch (TimeSeriesException e) {
            throw e;
        } catch (PondException e) {
            throw new TimeSeriesException("unable to read time series points: " + e.getMessage(), e);
        }
        return builder.events(events).build();
    }

    /**
     * Parses a JSON document in the wire format.
     */
    public static TimeSeries parse(String json) {
        try {
            return fromJson(XContentUtils.parseMap(json));
        } catch (IOException e) {
            throw new TimeSeriesException("unable to parse time series json: " + e.getMessage(), e);
        }
    }

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(NAME_FIELD, name);
        json.put(UTC_FIELD, utc);
        if (index != null) {
            json.put(INDEX_FIELD, index.toJson());
        }
        json.putAll(meta);

        List<String> dataColumns = getColumns();
        List<Object> columns = new ArrayList<>(dataColumns.size() + 1);
        columns.add(keyColumn());
        columns.addAll(dataColumns);
        json.put(COLUMNS_FIELD, columns);

        List<Object> points = new ArrayList<>(collection.size());
        for (Event event : collection) {
            points.add(event.toPoint(dataColumns));
        }
        json.put(POINTS_FIELD, points);
        return json;
    }

    private String keyColumn() {
        EventType type = collection.getType();
        return type == null ? EventType.TIME.getKeyName() : type.getKeyName();
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        return builder.map(toJson());
    }

    public static TimeSeries readFrom(StreamInput in) throws IOException {
        String name = in.readOptionalString();
        boolean utc = in.readBoolean();
        Index index = in.readOptionalWriteable(Index::readFrom);
        Map<String, Object> meta = in.readMap();
        EventCollection collection = EventCollection.readFrom(in);
        return new TimeSeries(name, index, utc, meta, collection);
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeOptionalString(name);
        out.writeBoolean(utc);
        out.writeOptionalWriteable(index);
        out.writeMap(meta);
        collection.writeTo(out);
    }

    // -- accessors

    public String getName() {
        return name;
    }

    public TimeSeries setName(String newName) {
        return new TimeSeries(newName, index, utc, meta, collection);
    }

    public Index getIndex() {
        return index;
    }

    public String getIndexAsString() {
        return index == null ? null : index.getIndex();
    }

    public TimeRange getIndexAsRange() {
        return index == null ? null : index.asTimeRange();
    }

    public boolean isUtc() {
        return utc;
    }

    public Object getMeta(String key) {
        return switch (key) {
            case NAME_FIELD -> name;
            case UTC_FIELD -> utc;
            case INDEX_FIELD -> getIndexAsString();
            default -> meta.get(key);
        };
    }

    public TimeSeries setMeta(String key, Object value) {
        Builder builder = toBuilder();
        builder.meta(key, value);
        return builder.build();
    }

    /**
     * @return the data columns: every top-level payload key, in order of first appearance
     */
    public List<String> getColumns() {
        Set<String> columns = new LinkedHashSet<>();
        for (Event event : collection) {
            columns.addAll(event.getData().keySet());
        }
        return new ArrayList<>(columns);
    }

    public EventCollection getCollection() {
        return collection;
    }

    public TimeSeries setCollection(EventCollection newCollection) {
        return new TimeSeries(name, index, utc, meta, newCollection);
    }

    private Builder toBuilder() {
        Builder builder = builder().name(name).utc(utc).index(index).collection(collection);
        builder.meta.putAll(meta);
        return builder;
    }

    // -- queries

    /**
     * @return the range spanning every event, or null for an empty series
     */
    public TimeRange timerange() {
        return collection.range();
    }

    public long begin() {
        return requireRange().getBegin();
    }

    public long end() {
        return requireRange().getEnd();
    }

    private TimeRange requireRange() {
        TimeRange range = timerange();
        if (range == null) {
            throw new TimeSeriesException("an empty time series has no time range");
        }
        return range;
    }

    public Event at(int position) {
        return collection.at(position);
    }

    public Event atTime(long timestamp) {
        return collection.atTime(timestamp);
    }

    public Event atFirst() {
        return collection.atFirst();
    }

    public Event atLast() {
        return collection.atLast();
    }

    public Integer bisect(long timestamp) {
        return collection.bisect(timestamp, 0);
    }

    public Integer bisect(long timestamp, int begin) {
        return collection.bisect(timestamp, begin);
    }

    public TimeSeries slice(int begin, int end) {
        return setCollection(collection.slice(begin, end));
    }

    /**
     * @return the events whose timestamp lies within {@code range}, ends included
     */
    public TimeSeries crop(TimeRange range) {
        return setCollection(collection.filter(event -> range.contains(event.getTimestamp())));
    }

    public TimeSeries clean(String fieldPath) {
        return setCollection(collection.clean(fieldPath));
    }

    public List<Event> events() {
        return collection.events();
    }

    public int size() {
        return collection.size();
    }

    public int sizeValid(String fieldPath) {
        return collection.sizeValid(fieldPath);
    }

    public long count() {
        return collection.count();
    }

    public Object aggregate(Reducer reducer, String fieldPath) {
        return collection.aggregate(reducer, fieldPath);
    }

    public Double sum(String fieldPath) {
        return collection.sum(fieldPath);
    }

    public Double avg(String fieldPath) {
        return collection.avg(fieldPath);
    }

    public Double mean(String fieldPath) {
        return collection.mean(fieldPath);
    }

    public Double max(String fieldPath) {
        return collection.max(fieldPath);
    }

    public Double min(String fieldPath) {
        return collection.min(fieldPath);
    }

    public Double median(String fieldPath) {
        return collection.median(fieldPath);
    }

    public Double stdev(String fieldPath) {
        return collection.stdev(fieldPath);
    }

    public Double percentile(double percentile, String fieldPath) {
        return collection.percentile(percentile, fieldPath);
    }

    public Double percentile(double percentile, String fieldPath, Interpolation interpolation) {
        return collection.percentile(percentile, fieldPath, interpolation);
    }

    public List<Double> quantile(int count, String fieldPath) {
        return collection.quantile(count, fieldPath);
    }

    public List<Double> quantile(int count, String fieldPath, Interpolation interpolation) {
        return collection.quantile(count, fieldPath, interpolation);
    }

    // -- transforms

    public Pipeline pipeline() {
        return new Pipeline().from(this);
    }

    private TimeSeries withEvents(Pipeline pipeline) {
        return setCollection(new EventCollection(pipeline.toEventList()));
    }

    public TimeSeries map(Function<Event, Event> op) {
        return withEvents(pipeline().map(op));
    }

    public TimeSeries select(Object fieldSpec) {
        return withEvents(pipeline().select(fieldSpec));
    }

    public TimeSeries collapse(List<String> fieldSpecList, String name, Reducer reducer, boolean append) {
        return withEvents(pipeline().collapse(fieldSpecList, name, reducer, append));
    }

    /**
     * Fills missing values. Linear fill handles one field per pass, so several fields get one
     * pass each.
     */
    public TimeSeries fill(Object fieldSpec, FillMethod method, Integer fillLimit) {
        Pipeline pipeline = pipeline();
        if (method == FillMethod.LINEAR) {
            for (String fieldPath : FieldPaths.toFieldSpec(fieldSpec)) {
                pipeline = pipeline.fill(fieldPath, method, fillLimit);
            }
        } else {
            pipeline = pipeline.fill(fieldSpec, method, fillLimit);
        }
        return withEvents(pipeline);
    }

    public TimeSeries fill(Object fieldSpec, String method, Integer fillLimit) {
        return fill(fieldSpec, FillMethod.fromString(method), fillLimit);
    }

    public TimeSeries align(Object fieldSpec, String window, String method, Integer limit) {
        return withEvents(pipeline().align(fieldSpec, window, method, limit));
    }

    public TimeSeries rate(Object fieldSpec, Boolean allowNegative) {
        return withEvents(pipeline().rate(fieldSpec, allowNegative));
    }

    // -- rollups

    /**
     * Aggregates the series into fixed windows.
     *
     * @param window window such as {@code "1h"}
     * @param toEvents emit point events at the window centers instead of indexed events
     */
    public TimeSeries fixedWindowRollup(String window, Map<String, Aggregation> aggregation, boolean toEvents) {
        return rollup(pipeline().windowBy(window), aggregation, toEvents);
    }

    public TimeSeries dailyRollup(Map<String, Aggregation> aggregation, boolean toEvents) {
        return dailyRollup(aggregation, toEvents, utc);
    }

    public TimeSeries dailyRollup(Map<String, Aggregation> aggregation, boolean toEvents, boolean utc) {
        return rollup(pipeline().windowBy("daily", utc), aggregation, toEvents);
    }

    public TimeSeries monthlyRollup(Map<String, Aggregation> aggregation, boolean toEvents) {
        return monthlyRollup(aggregation, toEvents, utc);
    }

    public TimeSeries monthlyRollup(Map<String, Aggregation> aggregation, boolean toEvents, boolean utc) {
        return rollup(pipeline().windowBy("monthly", utc), aggregation, toEvents);
    }

    public TimeSeries yearlyRollup(Map<String, Aggregation> aggregation, boolean toEvents) {
        return yearlyRollup(aggregation, toEvents, utc);
    }

    public TimeSeries yearlyRollup(Map<String, Aggregation> aggregation, boolean toEvents, boolean utc) {
        return rollup(pipeline().windowBy("yearly", utc), aggregation, toEvents);
    }

    private TimeSeries rollup(Pipeline windowed, Map<String, Aggregation> aggregation, boolean toEvents) {
        Pipeline pipeline = windowed.emitOn(EmitPolicy.DISCARD).aggregate(aggregation);
        if (toEvents) {
            pipeline = pipeline.asEvents(null);
        }
        EventCollection result = pipeline.clearWindow().toKeyedCollections().get(CollectionOut.ALL);
        return setCollection(result == null ? new EventCollection() : result);
    }

    /**
     * Splits the series into one series per fixed window, keyed by window index string.
     */
    public Map<String, TimeSeries> collectByFixedWindow(String window) {
        Map<String, EventCollection> collections = pipeline().windowBy(window).emitOn(EmitPolicy.DISCARD).toKeyedCollections();
        Map<String, TimeSeries> result = new LinkedHashMap<>();
        for (Map.Entry<String, EventCollection> entry : collections.entrySet()) {
            result.put(entry.getKey(), setCollection(entry.getValue()));
        }
        return result;
    }

    // -- comparison

    /**
     * @return true if both series share the same event list instance and equal metadata
     */
    public static boolean equal(TimeSeries a, TimeSeries b) {
        return EventCollection.equal(a.collection, b.collection)
            && Objects.equals(a.name, b.name)
            && Objects.equals(a.index, b.index)
            && a.utc == b.utc
            && a.meta.equals(b.meta);
    }

    /**
     * @return true if both series have equal events and metadata
     */
    public static boolean same(TimeSeries a, TimeSeries b) {
        return a.equals(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeSeries other = (TimeSeries) o;
        return utc == other.utc
            && Objects.equals(name, other.name)
            && Objects.equals(index, other.index)
            && meta.equals(other.meta)
            && collection.equals(other.collection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, index, utc, meta, collection);
    }

    @Override
    public String toString() {
        return XContentUtils.toJsonString(this);
    }

    // -- operations over several series

    /**
     * Pools the events of every series, hands them to {@code reducer} and builds a series from
     * the result, ordered by time.
     *
     * @param meta metadata of the new series, such as {@code {"name": "total"}}
     */
    public static TimeSeries timeSeriesListReduce(
        Map<String, Object> meta,
        List<TimeSeries> seriesList,
        BiFunction<List<Event>, Object, List<Event>> reducer,
        Object fieldSpec
    ) {
        List<Event> events = new ArrayList<>();
        for (TimeSeries series : seriesList) {
            events.addAll(series.events());
        }
        Builder builder = builder();
        for (Map.Entry<String, Object> entry : meta.entrySet()) {
            builder.meta(entry.getKey(), entry.getValue());
        }
        return builder.collection(new EventCollection(reducer.apply(events, fieldSpec)).sortByTime()).build();
    }

    /**
     * Merges series holding different fields into one series, joining events by key.
     *
     * @throws org.opensearch.pond.core.exception.EventException if two series hold the same field
     *         at the same key
     */
    public static TimeSeries timeSeriesListMerge(Map<String, Object> meta, List<TimeSeries> seriesList) {
        return timeSeriesListReduce(meta, seriesList, (events, fieldSpec) -> mergeByKey(events), null);
    }

    private static List<Event> mergeByKey(List<Event> events) {
        Map<Object, List<Event>> byKey = new LinkedHashMap<>();
        for (Event event : events) {
            byKey.computeIfAbsent(event.getKey(), key -> new ArrayList<>()).add(event);
        }
        List<Event> merged = new ArrayList<>(byKey.size());
        for (List<Event> group : byKey.values()) {
            merged.add(Event.merge(group));
        }
        return merged;
    }

    /**
     * Sums the given fields of point series timestamp by timestamp.
     */
    public static TimeSeries timeSeriesListSum(Map<String, Object> meta, List<TimeSeries> seriesList, Object fieldSpec) {
        return timeSeriesListReduce(meta, seriesList, Event::sum, fieldSpec);
    }

    public static TimeSeries timeSeriesListAvg(Map<String, Object> meta, List<TimeSeries> seriesList, Object fieldSpec) {
        return timeSeriesListReduce(meta, seriesList, Event::avg, fieldSpec);
    }
}
