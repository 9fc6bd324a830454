/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.model;

import org.opensearch.common.io.stream.BytesStreamOutput;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.pond.core.exception.EventException;
import org.opensearch.pond.query.function.Reducers;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class EventTests extends OpenSearchTestCase {

    private static final long TS = 1429673400000L;

    public void testScalarDataIsWrappedAsValue() {
        TimeEvent event = new TimeEvent(TS, 3);
        assertEquals(Map.of("value", 3L), event.getData());
        assertEquals(3L, event.get());
        assertEquals(3L, event.get("value"));
    }

    public void testNestedLookup() {
        TimeEvent event = new TimeEvent(TS, Map.of("direction", Map.of("in", 5, "out", 7)));
        assertEquals(5L, event.get("direction.in"));
        assertEquals(7L, event.get(List.of("direction", "out")));
        assertNull(event.get("direction.sideways"));
        assertNull(event.get("missing.deeper"));
    }

    public void testDataIsImmutableAndSetDataCopies() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("a", 1);
        TimeEvent event = new TimeEvent(TS, data);
        data.put("a", 2);

        assertEquals(1L, event.get("a"));
        expectThrows(UnsupportedOperationException.class, () -> event.getData().put("b", 1));

        TimeEvent updated = event.setData(Map.of("a", 5));
        assertEquals(TS, updated.getTimestamp());
        assertEquals(5L, updated.get("a"));
        assertEquals(1L, event.get("a"));
    }

    public void testNaiveDatetimeIsRejected() {
        expectThrows(EventException.class, () -> TimeEvent.of(LocalDateTime.of(2015, 4, 22, 3, 30), 1));
        TimeEvent event = TimeEvent.of(ZonedDateTime.of(2015, 4, 22, 3, 30, 0, 0, ZoneOffset.UTC), 1);
        assertEquals(TS, event.getTimestamp());
    }

    public void testUnsupportedDataIsRejected() {
        expectThrows(EventException.class, () -> new TimeEvent(TS, new Object()));
    }

    public void testVariantsKeysAndRanges() {
        TimeRangeEvent range = new TimeRangeEvent(1000L, 2000L, 1);
        assertEquals(List.of(1000L, 2000L), range.getKey());
        assertEquals(1000L, range.getTimestamp());
        assertEquals(2000L, range.getEnd());

        IndexedEvent indexed = new IndexedEvent("1h-1", 1);
        assertEquals("1h-1", indexed.getKey());
        assertEquals(3600000L, indexed.getBegin());
        assertEquals(7200000L, indexed.getEnd());

        expectThrows(EventException.class, () -> new IndexedEvent("bogus", 1));
        expectThrows(EventException.class, () -> TimeRangeEvent.of(List.of(2000L, 1000L), 1));
    }

    public void testToJson() {
        assertEquals("{\"time\":1000,\"data\":{\"value\":1}}", new TimeEvent(1000L, 1).toString());
        assertEquals("{\"timerange\":[1000,2000],\"data\":{\"value\":1}}", new TimeRangeEvent(1000L, 2000L, 1).toString());
        assertEquals("{\"index\":\"1h-1\",\"data\":{\"value\":1}}", new IndexedEvent("1h-1", 1).toString());
    }

    public void testEqualityByValue() {
        assertEquals(new TimeEvent(TS, Map.of("a", 1)), new TimeEvent(TS, Map.of("a", 1L)));
        assertNotEquals(new TimeEvent(TS, Map.of("a", 1)), new TimeEvent(TS + 1, Map.of("a", 1)));
        assertTrue(Event.same(new TimeEvent(TS, 1), new TimeEvent(TS, 1)));
    }

    public void testMergeUnionsDisjointFields() {
        Event merged = Event.merge(List.of(new TimeEvent(TS, Map.of("a", 1)), new TimeEvent(TS, Map.of("b", 2))));
        assertEquals(TS, merged.getTimestamp());
        assertEquals(Map.of("a", 1L, "b", 2L), merged.getData());
        assertNull(Event.merge(List.of()));
    }

    public void testMergeRejectsCollisionsAndMismatches() {
        expectThrows(EventException.class, () -> Event.merge(List.of(new TimeEvent(TS, Map.of("a", 1)), new TimeEvent(TS, Map.of("a", 2)))));
        expectThrows(EventException.class, () -> Event.merge(List.of(new TimeEvent(TS, Map.of("a", 1)), new TimeEvent(TS + 1, Map.of("b", 2)))));
        expectThrows(EventException.class, () -> Event.merge(List.of(new TimeEvent(TS, 1), new IndexedEvent("1h-1", Map.of("b", 2)))));
        expectThrows(
            EventException.class,
            () -> Event.merge(List.of(new IndexedEvent("1h-1", Map.of("a", 1)), new IndexedEvent("1h-2", Map.of("b", 2))))
        );
    }

    public void testCombineSumsPerTimestamp() {
        List<Event> events = List.of(
            new TimeEvent(1000L, Map.of("a", 1, "b", 2)),
            new TimeEvent(2000L, Map.of("a", 3, "b", 4)),
            new TimeEvent(1000L, Map.of("a", 5, "b", 6))
        );
        List<Event> summed = Event.sum(events, List.of("a", "b"));

        assertEquals(2, summed.size());
        assertEquals(1000L, summed.get(0).getTimestamp());
        assertEquals(6.0, summed.get(0).get("a"));
        assertEquals(8.0, summed.get(0).get("b"));
        assertEquals(3.0, summed.get(1).get("a"));

        List<Event> averaged = Event.avg(events, "a");
        assertEquals(3.0, averaged.get(0).get("a"));
        assertNull(averaged.get(0).get("b"));

        expectThrows(EventException.class, () -> Event.sum(List.of(new TimeRangeEvent(1L, 2L, 1)), null));
    }

    public void testCombineRebuildsNestedPaths() {
        List<Event> events = List.of(
            new TimeEvent(1000L, Map.of("direction", Map.of("in", 1))),
            new TimeEvent(1000L, Map.of("direction", Map.of("in", 2)))
        );
        List<Event> summed = Event.sum(events, "direction.in");
        assertEquals(3.0, summed.get(0).get("direction.in"));
    }

    public void testSelectorAndCollapse() {
        TimeEvent event = new TimeEvent(TS, Map.of("in", 2, "out", 3, "other", 9));

        Event selected = Event.selector(event, List.of("in", "out"));
        assertEquals(Map.of("in", 2L, "out", 3L), selected.getData());
        assertSame(event, Event.selector(event, null));

        Event collapsed = event.collapse(List.of("in", "out"), "total", Reducers.sum(), false);
        assertEquals(Map.of("total", 5.0), collapsed.getData());

        Event appended = event.collapse(List.of("in", "out"), "total", Reducers.sum(), true);
        assertEquals(4, appended.getData().size());
    }

    public void testMapReduce() {
        List<Event> events = List.of(new TimeEvent(1000L, Map.of("a", 1)), new TimeEvent(2000L, Map.of("a", 3)));
        assertEquals(Map.of("a", List.of(1L, 3L)), Event.map(events, "a"));
        assertEquals(Map.of("a", 2.0), Event.mapReduce(events, "a", Reducers.avg()));
    }

    public void testWireRoundTrip() throws IOException {
        List<Event> events = List.of(
            new TimeEvent(TS, Map.of("a", 1, "nested", Map.of("b", "x"))),
            new TimeRangeEvent(1000L, 2000L, Map.of("a", 2.5)),
            new IndexedEvent("2015-04", Map.of("a", List.of(1, 2)))
        );
        for (Event event : events) {
            try (BytesStreamOutput out = new BytesStreamOutput()) {
                event.writeTo(out);
                try (StreamInput in = out.bytes().streamInput()) {
                    assertEquals(event, Event.readFrom(in));
                }
            }
        }
    }
}
