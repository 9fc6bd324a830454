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
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.pond.core.exception.CollectionException;
import org.opensearch.pond.core.utils.FieldPaths;
import org.opensearch.pond.core.utils.XContentUtils;
import org.opensearch.pond.query.function.Interpolation;
import org.opensearch.pond.query.function.MissingValuePolicy;
import org.opensearch.pond.query.function.PercentileUtils;
import org.opensearch.pond.query.function.Reducer;
import org.opensearch.pond.query.function.Reducers;
import org.opensearch.pond.query.pipeline.Pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An immutable, ordered sequence of events of a single variant.
 *
 * <p>Every transform returns a new collection. The events may be in any order;
 * {@link #isChronological()} reports whether they are sorted by timestamp.</p>
 */
public class EventCollection implements Iterable<Event>, Writeable {

    private static final Logger logger = LogManager.getLogger(EventCollection.class);

    private final List<Event> events;
    private final EventType type;

    public EventCollection() {
        this.events = Collections.emptyList();
        this.type = null;
    }

    /**
     * @throws CollectionException if the events are not all of one variant
     */
    public EventCollection(List<? extends Event> events) {
        this.type = checkTypes(events);
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
    }

    public EventCollection(EventCollection other) {
        this.events = other.events;
        this.type = other.type;
    }

    /**
     * Builds a collection from a list of events or another collection. Anything else is logged
     * and gives an empty collection.
     */
    public static EventCollection of(Object input) {
        if (input == null) {
            return new EventCollection();
        } else if (input instanceof EventCollection collection) {
            return new EventCollection(collection);
        } else if (input instanceof List<?> list && list.stream().allMatch(Event.class::isInstance)) {
            List<Event> events = new ArrayList<>(list.size());
            for (Object item : list) {
                events.add((Event) item);
            }
            return new EventCollection(events);
        }
        logger.warn("unable to build a collection from [{}], using an empty collection", input.getClass().getName());
        return new EventCollection();
    }

    public static EventCollection readFrom(StreamInput in) throws IOException {
        return new EventCollection(in.readList(Event::readFrom));
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeCollection(events);
    }

    private static EventType checkTypes(List<? extends Event> events) {
        EventType type = null;
        for (Event event : events) {
            if (event == null) {
                throw new CollectionException("a collection cannot hold null events");
            }
            if (type == null) {
                type = event.getType();
            } else if (event.getType() != type) {
                throw new CollectionException(
                    String.format(Locale.ROOT, "Events being added to a %s collection must be of the same type, got %s", type, event.getType())
                );
            }
        }
        return type;
    }

    /**
     * @return the variant of the events, or null for an empty collection
     */
    public EventType getType() {
        return type;
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * @return the number of events with a valid value at {@code fieldPath}
     */
    public int sizeValid(String fieldPath) {
        int count = 0;
        for (Event event : events) {
            if (Event.isValidValue(event, fieldPath)) {
                count++;
            }
        }
        return count;
    }

    public Event at(int position) {
        if (position < 0 || position >= events.size()) {
            throw new CollectionException(
                String.format(Locale.ROOT, "position [%d] is out of range for a collection of size [%d]", position, events.size())
            );
        }
        return events.get(position);
    }

    /**
     * @return the event at or just before {@code timestamp}, or null for an empty collection
     */
    public Event atTime(long timestamp) {
        Integer position = bisect(timestamp, 0);
        if (position == null || position >= events.size()) {
            return null;
        }
        return events.get(position);
    }

    public Event atFirst() {
        return events.isEmpty() ? null : events.get(0);
    }

    public Event atLast() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    /**
     * Finds the position of {@code timestamp}, scanning from {@code begin}: the position of an
     * event with exactly that timestamp, else the position of the last event before it. A
     * timestamp before every event maps to {@code begin}.
     *
     * @return the position, or null for an empty collection
     */
    public Integer bisect(long timestamp, int begin) {
        int size = events.size();
        if (size == 0) {
            return null;
        }
        int i = begin;
        while (i < size) {
            long current = events.get(i).getTimestamp();
            if (current > timestamp) {
                return i - begin > 0 ? i - 1 : begin;
            } else if (current == timestamp) {
                return i;
            }
            i++;
        }
        return i - 1;
    }

    public List<Event> events() {
        return events;
    }

    @Override
    public Iterator<Event> iterator() {
        return events.iterator();
    }

    /**
     * @return the range spanning every event, or null for an empty collection
     */
    public TimeRange range() {
        TimeRange range = null;
        for (Event event : events) {
            range = range == null ? event.getTimeRange() : range.extents(event.getTimeRange());
        }
        return range;
    }

    /**
     * Returns a new collection with {@code event} appended, leaving this one unchanged.
     *
     * <p>Each call copies the event list, so building a collection event by event is quadratic.
     * Gather the events in a list and pass it to {@link #EventCollection(List)} instead.</p>
     *
     * @throws CollectionException if the event variant differs from the collection's
     */
    public EventCollection addEvent(Event event) {
        List<Event> added = new ArrayList<>(events.size() + 1);
        added.addAll(events);
        added.add(event);
        return new EventCollection(added);
    }

    /**
     * @return events from {@code begin} inclusive to {@code end} exclusive, clamped to the collection
     */
    public EventCollection slice(int begin, int end) {
        int from = Math.max(0, Math.min(begin, events.size()));
        int to = Math.max(from, Math.min(end, events.size()));
        return new EventCollection(events.subList(from, to));
    }

    public EventCollection filter(Predicate<Event> predicate) {
        List<Event> kept = new ArrayList<>();
        for (Event event : events) {
            if (predicate.test(event)) {
                kept.add(event);
            }
        }
        return new EventCollection(kept);
    }

    public EventCollection map(Function<Event, Event> mapper) {
        List<Event> mapped = new ArrayList<>(events.size());
        for (Event event : events) {
            mapped.add(mapper.apply(event));
        }
        return new EventCollection(mapped);
    }

    /**
     * @return the events whose value at {@code fieldPath} is valid
     */
    public EventCollection clean(String fieldPath) {
        return filter(event -> Event.isValidValue(event, fieldPath));
    }

    public EventCollection collapse(List<String> fieldSpecList, String name, Reducer reducer, boolean append) {
        return map(event -> event.collapse(fieldSpecList, name, reducer, append));
    }

    public EventCollection select(Object fieldSpec) {
        return map(event -> Event.selector(event, fieldSpec));
    }

    public EventCollection sortByTime() {
        List<Event> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingLong(Event::getTimestamp));
        return new EventCollection(sorted);
    }

    /**
     * Sorts by the value at {@code fieldPath}; numbers compare numerically, other values by their
     * string form, and missing values go last.
     *
     * @throws CollectionException if no event has the field
     */
    public EventCollection sort(String fieldPath) {
        if (events.isEmpty()) {
            return this;
        }
        List<String> path = FieldPaths.split(fieldPath);
        boolean found = events.stream().anyMatch(event -> FieldPaths.hasPath(event.getData(), path));
        if (!found) {
            throw new CollectionException(String.format(Locale.ROOT, "Invalid field path [%s] for sort", fieldPath));
        }
        List<Event> sorted = new ArrayList<>(events);
        sorted.sort((a, b) -> compareValues(a.get(path), b.get(path)));
        return new EventCollection(sorted);
    }

    private static int compareValues(Object a, Object b) {
        boolean validA = FieldPaths.isValid(a);
        boolean validB = FieldPaths.isValid(b);
        if (!validA || !validB) {
            return Boolean.compare(!validA, !validB);
        }
        if (a instanceof Number numberA && b instanceof Number numberB) {
            return Double.compare(numberA.doubleValue(), numberB.doubleValue());
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    public boolean isChronological() {
        long previous = Long.MIN_VALUE;
        for (Event event : events) {
            if (event.getTimestamp() < previous) {
                return false;
            }
            previous = event.getTimestamp();
        }
        return true;
    }

    /**
     * Applies a reducer to the column of values at {@code fieldPath}.
     */
    public Object aggregate(Reducer reducer, String fieldPath) {
        List<String> path = FieldPaths.split(fieldPath);
        List<Object> values = new ArrayList<>(events.size());
        for (Event event : events) {
            values.add(event.get(path));
        }
        return reducer.reduce(values);
    }

    public Object first(String fieldPath) {
        return aggregate(Reducers.first(), fieldPath);
    }

    public Object first(String fieldPath, MissingValuePolicy policy) {
        return aggregate(Reducers.first(policy), fieldPath);
    }

    public Object last(String fieldPath) {
        return aggregate(Reducers.last(), fieldPath);
    }

    public Object last(String fieldPath, MissingValuePolicy policy) {
        return aggregate(Reducers.last(policy), fieldPath);
    }

    public Double sum(String fieldPath) {
        return (Double) aggregate(Reducers.sum(), fieldPath);
    }

    public Double sum(String fieldPath, MissingValuePolicy policy) {
        return (Double) aggregate(Reducers.sum(policy), fieldPath);
    }

    public Double avg(String fieldPath) {
        return (Double) aggregate(Reducers.avg(), fieldPath);
    }

    public Double avg(String fieldPath, MissingValuePolicy policy) {
        return (Double) aggregate(Reducers.avg(policy), fieldPath);
    }

    public Double mean(String fieldPath) {
        return avg(fieldPath);
    }

    public Double max(String fieldPath) {
        return (Double) aggregate(Reducers.max(), fieldPath);
    }

    public Double max(String fieldPath, MissingValuePolicy policy) {
        return (Double) aggregate(Reducers.max(policy), fieldPath);
    }

    public Double min(String fieldPath) {
        return (Double) aggregate(Reducers.min(), fieldPath);
    }

    public Double min(String fieldPath, MissingValuePolicy policy) {
        return (Double) aggregate(Reducers.min(policy), fieldPath);
    }

    public Double median(String fieldPath) {
        return (Double) aggregate(Reducers.median(), fieldPath);
    }

    public Double median(String fieldPath, MissingValuePolicy policy) {
        return (Double) aggregate(Reducers.median(policy), fieldPath);
    }

    public Double stdev(String fieldPath) {
        return (Double) aggregate(Reducers.stddev(), fieldPath);
    }

    public Double stdev(String fieldPath, MissingValuePolicy policy) {
        return (Double) aggregate(Reducers.stddev(policy), fieldPath);
    }

    /**
     * @return the number of events
     */
    public long count() {
        return events.size();
    }

    public Long count(String fieldPath, MissingValuePolicy policy) {
        return (Long) aggregate(Reducers.count(policy), fieldPath);
    }

    public Double percentile(double percentile, String fieldPath) {
        return percentile(percentile, fieldPath, Interpolation.LINEAR);
    }

    /**
     * @param percentile percentile between 0 and 100
     * @throws CollectionException for a percentile outside 0 to 100
     */
    public Double percentile(double percentile, String fieldPath, Interpolation interpolation) {
        return (Double) aggregate(Reducers.percentile(percentile, interpolation), fieldPath);
    }

    public List<Double> quantile(int count, String fieldPath) {
        return quantile(count, fieldPath, Interpolation.LINEAR);
    }

    /**
     * Cut points splitting the values at {@code fieldPath} into {@code count} equal groups.
     *
     * @throws CollectionException if {@code count} exceeds the size of the collection
     */
    public List<Double> quantile(int count, String fieldPath, Interpolation interpolation) {
        if (count > events.size()) {
            throw new CollectionException(
                String.format(Locale.ROOT, "Subset n [%d] is greater than the collection length [%d]", count, events.size())
            );
        }
        List<Double> sorted = new ArrayList<>(events.size());
        for (Event event : events) {
            Object value = event.get(fieldPath);
            if (FieldPaths.isNumeric(value)) {
                sorted.add(((Number) value).doubleValue());
            }
        }
        Collections.sort(sorted);
        return PercentileUtils.calculateQuantiles(sorted, count, interpolation);
    }

    /**
     * @return a batch pipeline reading from this collection
     */
    public Pipeline pipeline() {
        return new Pipeline().from(this);
    }

    public List<Map<String, Object>> toJson() {
        List<Map<String, Object>> json = new ArrayList<>(events.size());
        for (Event event : events) {
            json.add(event.toJson());
        }
        return json;
    }

    /**
     * @return true if both collections wrap the very same event list
     */
    public static boolean equal(EventCollection a, EventCollection b) {
        return a.events == b.events;
    }

    /**
     * @return true if both collections hold equal events in the same order
     */
    public static boolean same(EventCollection a, EventCollection b) {
        return a.equals(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return events.equals(((EventCollection) o).events);
    }

    @Override
    public int hashCode() {
        return events.hashCode();
    }

    @Override
    public String toString() {
        return XContentUtils.toJsonValue(toJson());
    }
}
