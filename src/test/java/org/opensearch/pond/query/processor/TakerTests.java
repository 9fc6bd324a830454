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
import org.opensearch.pond.core.model.TimeEvent;
import org.opensearch.pond.query.pipeline.Pipeline;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class TakerTests extends OpenSearchTestCase {

    private static EventCollection minuteEvents() {
        long[] offsets = { 0L, 20000L, 40000L, 60000L, 80000L, 130000L };
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < offsets.length; i++) {
            events.add(new TimeEvent(offsets[i], Map.of("value", i + 1, "host", i % 2 == 0 ? "a" : "b")));
        }
        return new EventCollection(events);
    }

    public void testTakeFromWholeInput() {
        List<Event> taken = new Pipeline().from(minuteEvents()).take(2).toEventList();
        assertEquals(2, taken.size());
        assertEquals(1L, taken.get(0).get());
        assertEquals(2L, taken.get(1).get());
    }

    public void testTakePerWindow() {
        List<Event> taken = new Pipeline().from(minuteEvents()).windowBy("1m").take(1).toEventList();
        assertEquals(3, taken.size());
        assertEquals(0L, taken.get(0).getTimestamp());
        assertEquals(60000L, taken.get(1).getTimestamp());
        assertEquals(130000L, taken.get(2).getTimestamp());
    }

    public void testTakePerGroup() {
        List<Event> taken = new Pipeline().from(minuteEvents()).groupBy("host").take(1).toEventList();
        assertEquals(2, taken.size());
        assertEquals("a", taken.get(0).get("host"));
        assertEquals("b", taken.get(1).get("host"));
    }

    public void testTakeNothing() {
        assertTrue(new Pipeline().from(minuteEvents()).take(0).toEventList().isEmpty());
        expectThrows(ProcessorException.class, () -> new Pipeline().from(minuteEvents()).take(-1));
    }
}
