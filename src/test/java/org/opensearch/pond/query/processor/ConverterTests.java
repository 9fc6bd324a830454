/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.processor;

import org.opensearch.pond.core.exception.ProcessorException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventCollection;
import org.opensearch.pond.core.model.EventType;
import org.opensearch.pond.core.model.IndexedEvent;
import org.opensearch.pond.core.model.TimeEvent;
import org.opensearch.pond.core.model.TimeRangeEvent;
import org.opensearch.pond.query.pipeline.Pipeline;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class ConverterTests extends OpenSearchTestCase {

    private static final long HOUR = 3600000L;
    private static final long TS = 1426316400000L;

    private static Pipeline pointInput() {
        return new Pipeline().from(new EventCollection(List.of(new TimeEvent(TS, 3))));
    }

    private static Pipeline rangeInput() {
        return new Pipeline().from(new EventCollection(List.of(new TimeRangeEvent(TS, TS + HOUR, 3))));
    }

    private static Pipeline indexedInput() {
        return new Pipeline().from(new EventCollection(List.of(new IndexedEvent("1h-396199", 3))));
    }

    private static Event single(Pipeline pipeline) {
        List<Event> events = pipeline.toEventList();
        assertEquals(1, events.size());
        return events.get(0);
    }

    public void testPointToRange() {
        Event front = single(pointInput().asTimeRangeEvents("front", "1h"));
        assertEquals(EventType.TIME_RANGE, front.getType());
        assertEquals(List.of(TS, TS + HOUR), front.getKey());
        assertEquals(3L, front.get());

        assertEquals(List.of(TS - HOUR / 2, TS + HOUR / 2), single(pointInput().asTimeRangeEvents("center", "1h")).getKey());
        assertEquals(List.of(TS - HOUR, TS), single(pointInput().asTimeRangeEvents("behind", "1h")).getKey());
        assertEquals(List.of(TS - HOUR / 2, TS + HOUR / 2), single(pointInput().asTimeRangeEvents(null, "1h")).getKey());
    }

    public void testPointToIndexed() {
        Event indexed = single(pointInput().asIndexedEvents("1h"));
        assertEquals(EventType.INDEXED, indexed.getType());
        assertEquals("1h-396199", indexed.getKey());
        assertEquals(3L, indexed.get());
    }

    public void testRangeToPoint() {
        assertEquals(TS, single(rangeInput().asEvents("lag")).getTimestamp());
        assertEquals(TS + HOUR / 2, single(rangeInput().asEvents("center")).getTimestamp());
        assertEquals(TS + HOUR, single(rangeInput().asEvents("lead")).getTimestamp());
        assertEquals(EventType.TIME, single(rangeInput().asEvents(null)).getType());
    }

    public void testIndexedConversions() {
        assertEquals(TS, single(indexedInput().asEvents("lag")).getTimestamp());
        assertEquals(TS + HOUR / 2, single(indexedInput().asEvents(null)).getTimestamp());
        assertEquals(TS + HOUR, single(indexedInput().asEvents("lead")).getTimestamp());

        Event range = single(indexedInput().asTimeRangeEvents(null, null));
        assertEquals(List.of(TS, TS + HOUR), range.getKey());
    }

    public void testSameTypePassesThrough() {
        assertEquals(new TimeEvent(TS, 3), single(pointInput().asEvents("lead")));
        assertEquals(new TimeRangeEvent(TS, TS + HOUR, 3), single(rangeInput().asTimeRangeEvents("front", null)));
        assertEquals(new IndexedEvent("1h-396199", 3), single(indexedInput().asIndexedEvents("5m")));
    }

    public void testUnsupportedConversions() {
        expectThrows(ProcessorException.class, () -> rangeInput().asIndexedEvents("1h").toEventList());
        expectThrows(ProcessorException.class, () -> pointInput().asTimeRangeEvents("front", null).toEventList());
        expectThrows(ProcessorException.class, () -> pointInput().asIndexedEvents(null).toEventList());
        expectThrows(ProcessorException.class, () -> pointInput().asTimeRangeEvents("lead", "1h").toEventList());
        expectThrows(ProcessorException.class, () -> rangeInput().asEvents("front").toEventList());
    }

    public void testInvalidOptions() {
        expectThrows(ProcessorException.class, () -> pointInput().asEvents("sideways"));
        expectThrows(ProcessorException.class, () -> pointInput().asTimeRangeEvents("front", "1 hour"));
        expectThrows(ProcessorException.class, () -> new Converter(pointInput(), null, null, null));
    }
}
