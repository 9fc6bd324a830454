/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.model;

import org.opensearch.pond.core.exception.CollectionException;
import org.opensearch.pond.query.function.Interpolation;
import org.opensearch.pond.query.function.MissingValuePolicy;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class EventCollectionTests extends OpenSearchTestCase {

    private static EventCollection collection(Object... values) {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            Map<String, Object> data = new HashMap<>();
            data.put("value", values[i]);
            events.add(new TimeEvent(1000L * (i + 1), data));
        }
        return new EventCollection(events);
    }

    public void testMixedVariantsAreRejected() {
        expectThrows(
            CollectionException.class,
            () -> new EventCollection(List.of(new TimeEvent(1000L, 1), new TimeRangeEvent(1000L, 2000L, 1)))
        );
        expectThrows(CollectionException.class, () -> collection(1).addEvent(new IndexedEvent("1h-1", 1)));
        expectThrows(CollectionException.class, () -> new EventCollection(Arrays.asList(new TimeEvent(1000L, 1), null)));
    }

    public void testOfUnknownInputIsEmpty() {
        EventCollection empty = EventCollection.of("not events");
        assertTrue(empty.isEmpty());
        assertNull(empty.getType());
        assertEquals(2, EventCollection.of(List.of(new TimeEvent(1L, 1), new TimeEvent(2L, 2))).size());
    }

    public void testAccessors() {
        EventCollection collection = collection(1, 2, 3);
        assertEquals(EventType.TIME, collection.getType());
        assertEquals(2L, collection.at(1).get());
        assertEquals(1L, collection.atFirst().get());
        assertEquals(3L, collection.atLast().get());
        assertEquals(new TimeRange(1000L, 3000L), collection.range());
        expectThrows(CollectionException.class, () -> collection.at(3));
        expectThrows(CollectionException.class, () -> collection.at(-1));
    }

    public void testBisectAndAtTime() {
        EventCollection collection = collection(1, 2, 3);
        assertEquals(Integer.valueOf(1), collection.bisect(2000L, 0));
        assertEquals(Integer.valueOf(1), collection.bisect(2500L, 0));
        assertEquals(Integer.valueOf(0), collection.bisect(500L, 0));
        assertEquals(Integer.valueOf(2), collection.bisect(9000L, 0));
        assertEquals(2L, collection.atTime(2500L).get());
        assertNull(new EventCollection().bisect(1000L, 0));
    }

    public void testTransformsReturnNewCollections() {
        EventCollection collection = collection(1, null, 3);
        assertEquals(2, collection.clean("value").size());
        assertEquals(3, collection.size());
        assertEquals(2, collection.slice(1, 10).size());
        assertEquals(1, collection.filter(event -> event.get() != null && ((Long) event.get()) > 2).size());
        assertEquals(2, collection.sizeValid("value"));

        EventCollection added = collection.addEvent(new TimeEvent(4000L, 4));
        assertEquals(4, added.size());
        assertEquals(3, collection.size());
    }

    public void testSortByFieldPutsMissingLast() {
        EventCollection sorted = collection(3, null, 1, 2).sort("value");
        assertEquals(1L, sorted.at(0).get());
        assertEquals(2L, sorted.at(1).get());
        assertEquals(3L, sorted.at(2).get());
        assertNull(sorted.at(3).get());
        assertFalse(sorted.isChronological());
        assertTrue(sorted.sortByTime().isChronological());

        expectThrows(CollectionException.class, () -> collection(1, 2).sort("missing"));
    }

    public void testStatistics() {
        EventCollection collection = collection(1, 2, 3, 4, 5);
        assertEquals(15.0, collection.sum("value"), 0.0);
        assertEquals(3.0, collection.avg("value"), 0.0);
        assertEquals(5.0, collection.max("value"), 0.0);
        assertEquals(1.0, collection.min("value"), 0.0);
        assertEquals(3.0, collection.median("value"), 0.0);
        assertEquals(Math.sqrt(2.0), collection.stdev("value"), 1e-12);
        assertEquals(1L, collection.first("value"));
        assertEquals(5L, collection.last("value"));
        assertEquals(5L, collection.count());
    }

    public void testStatisticsWithMissingValues() {
        EventCollection collection = collection(1, null, 3);
        assertEquals(4.0, collection.sum("value", MissingValuePolicy.IGNORE_MISSING), 0.0);
        assertNull(collection.sum("value", MissingValuePolicy.PROPAGATE_MISSING));
        assertEquals(4.0 / 3, collection.avg("value", MissingValuePolicy.ZERO_MISSING), 1e-12);
        assertEquals(Long.valueOf(2), collection.count("value", MissingValuePolicy.IGNORE_MISSING));
        assertEquals(Long.valueOf(3), collection.count("value", MissingValuePolicy.KEEP_MISSING));
    }

    public void testPercentile() {
        EventCollection collection = collection(5, 1, 4, 2, 3);
        assertEquals(3.0, collection.percentile(50, "value"), 0.0);
        assertEquals(2.0, collection.percentile(25, "value"), 0.0);
        assertEquals(4.6, collection.percentile(90, "value"), 1e-12);
        assertEquals(4.0, collection.percentile(90, "value", Interpolation.LOWER), 0.0);
        assertEquals(5.0, collection.percentile(90, "value", Interpolation.HIGHER), 0.0);
        assertEquals(5.0, collection.percentile(90, "value", Interpolation.NEAREST), 0.0);
        assertEquals(4.5, collection.percentile(90, "value", Interpolation.MIDPOINT), 0.0);
        assertEquals(1.0, collection.percentile(0, "value"), 0.0);
        assertEquals(5.0, collection.percentile(100, "value"), 0.0);
        expectThrows(CollectionException.class, () -> collection.percentile(101, "value"));
        expectThrows(CollectionException.class, () -> collection.percentile(-1, "value"));
    }

    public void testQuantile() {
        EventCollection collection = collection(5, 1, 4, 2, 3);
        assertEquals(List.of(2.0, 3.0, 4.0), collection.quantile(4, "value"));
        assertEquals(List.of(3.0), collection.quantile(2, "value"));
        expectThrows(CollectionException.class, () -> collection.quantile(6, "value"));
    }

    public void testQuantileSkipsMissingValues() {
        EventCollection collection = collection(1, null, 3, 5);
        assertEquals(List.of(2.0, 3.0, 4.0), collection.quantile(4, "value"));
        assertEquals(List.of(), collection(null, null).quantile(2, "value"));
    }

    public void testEqualAndSame() {
        EventCollection a = collection(1, 2);
        EventCollection copy = new EventCollection(a);
        EventCollection rebuilt = collection(1, 2);

        assertTrue(EventCollection.equal(a, copy));
        assertFalse(EventCollection.equal(a, rebuilt));
        assertTrue(EventCollection.same(a, rebuilt));
    }

    public void testToString() {
        assertEquals("[{\"time\":1000,\"data\":{\"value\":1}}]", collection(1).toString());
    }
}
