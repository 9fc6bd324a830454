/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.processor;

import org.opensearch.common.settings.Settings;
import org.opensearch.pond.PondSettings;
import org.opensearch.pond.core.exception.ProcessorException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventCollection;
import org.opensearch.pond.core.model.EventType;
import org.opensearch.pond.core.model.IndexedEvent;
import org.opensearch.pond.core.model.TimeEvent;
import org.opensearch.pond.query.pipeline.Pipeline;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class RateTests extends OpenSearchTestCase {

    private static final long[][] SERIES = {
        { 0L, 1 },
        { 30000L, 3 },
        { 60000L, 10 },
        { 90000L, 40 },
        { 120000L, 70 },
        { 150000L, 130 },
        { 180000L, 190 },
        { 210000L, 220 },
        { 240000L, 225 },
        { 270000L, 250 },
        { 300000L, 275 } };

    private static EventCollection series(String field) {
        List<Event> events = new ArrayList<>();
        for (long[] point : SERIES) {
            events.add(new TimeEvent(point[0], Map.of(field, point[1])));
        }
        return new EventCollection(events);
    }

    public void testRates() {
        List<Event> rates = new Pipeline().from(series("in")).rate("in", null).toEventList();

        double[] expected = { 2.0 / 30, 7.0 / 30, 1, 1, 2, 2, 1, 5.0 / 30, 25.0 / 30, 25.0 / 30 };
        assertEquals(expected.length, rates.size());
        for (int i = 0; i < expected.length; i++) {
            Event rate = rates.get(i);
            assertEquals(EventType.TIME_RANGE, rate.getType());
            assertEquals(expected[i], (Double) rate.get("in_rate"), 1e-12);
            assertEquals(SERIES[i][0], rate.getBegin());
            assertEquals(SERIES[i + 1][0], rate.getEnd());
        }
        assertEquals(List.of(0L, 30000L), rates.get(0).getKey());
    }

    public void testNegativeRates() {
        EventCollection events = new EventCollection(List.of(new TimeEvent(0L, 10), new TimeEvent(1000L, 5)));

        assertEquals(-5.0, new Pipeline().from(events).rate(null, true).toEventList().get(0).get("value_rate"));
        Event dropped = new Pipeline().from(events).rate(null, false).toEventList().get(0);
        assertTrue(dropped.getData().containsKey("value_rate"));
        assertNull(dropped.get("value_rate"));

        Settings settings = Settings.builder().put(PondSettings.RATE_ALLOW_NEGATIVE.getKey(), false).build();
        assertNull(new Pipeline(settings).from(events).rate(null, null).toEventList().get(0).get("value_rate"));
    }

    public void testNestedPaths() {
        EventCollection events = new EventCollection(
            List.of(
                new TimeEvent(0L, Map.of("direction", Map.of("in", 1, "out", 2))),
                new TimeEvent(10000L, Map.of("direction", Map.of("in", 11, "out", 4)))
            )
        );
        Event rate = new Pipeline().from(events).rate(List.of("direction.in", "direction.out"), null).toEventList().get(0);

        assertEquals(1.0, rate.get("direction.in_rate"));
        assertEquals(0.2, rate.get("direction.out_rate"));
    }

    public void testUnusableValuesGiveNull() {
        EventCollection sameTime = new EventCollection(List.of(new TimeEvent(0L, 1), new TimeEvent(0L, 3)));
        assertNull(new Pipeline().from(sameTime).rate(null, null).toEventList().get(0).get("value_rate"));

        EventCollection text = new EventCollection(List.of(new TimeEvent(0L, "a"), new TimeEvent(1000L, "b")));
        assertNull(new Pipeline().from(text).rate(null, null).toEventList().get(0).get("value_rate"));

        EventCollection missing = new EventCollection(List.of(new TimeEvent(0L, 1), new TimeEvent(1000L, 2)));
        assertNull(new Pipeline().from(missing).rate("other", null).toEventList().get(0).get("other_rate"));
    }

    public void testSingleEventGivesNoRate() {
        EventCollection events = new EventCollection(List.of(new TimeEvent(0L, 1)));
        assertTrue(new Pipeline().from(events).rate(null, null).toEventList().isEmpty());
    }

    public void testRequiresOrderedPointEvents() {
        EventCollection indexed = new EventCollection(List.of(new IndexedEvent("1h-1", 1)));
        expectThrows(ProcessorException.class, () -> new Pipeline().from(indexed).rate(null, null).toEventList());

        EventCollection unordered = new EventCollection(List.of(new TimeEvent(1000L, 1), new TimeEvent(0L, 2)));
        expectThrows(ProcessorException.class, () -> new Pipeline().from(unordered).rate(null, null).toEventList());
    }
}
