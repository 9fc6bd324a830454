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
import org.opensearch.pond.core.utils.XContentUtils;
import org.opensearch.pond.query.function.Reducers;
import org.opensearch.pond.query.pipeline.Pipeline;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.Map;

/**
 * Stateless processors: map, filter, select and collapse.
 */
public class SimpleProcessorTests extends OpenSearchTestCase {

    private static EventCollection traffic() {
        return new EventCollection(
            List.of(
                new TimeEvent(0L, Map.of("in", 1, "out", 2, "host", "a")),
                new TimeEvent(1000L, Map.of("in", 3, "out", 4, "host", "b")),
                new TimeEvent(2000L, Map.of("in", 5, "out", 6, "host", "a"))
            )
        );
    }

    public void testMapAndFilter() {
        List<Event> events = new Pipeline().from(traffic())
            .filter(e -> "a".equals(e.get("host")))
            .map(e -> e.setData(Map.of("total", ((Long) e.get("in")) + ((Long) e.get("out")))))
            .toEventList();

        assertEquals(2, events.size());
        assertEquals(3L, events.get(0).get("total"));
        assertEquals(11L, events.get(1).get("total"));
        assertEquals(2000L, events.get(1).getTimestamp());
    }

    public void testSelect() {
        Event selected = new Pipeline().from(traffic()).select(List.of("in", "host")).toEventList().get(1);
        assertEquals(Map.of("in", 3L, "host", "b"), selected.getData());
    }

    public void testCollapse() {
        List<Event> replaced = new Pipeline().from(traffic()).collapse(List.of("in", "out"), "total", Reducers.sum(), false).toEventList();
        assertEquals(Map.of("total", 7.0), replaced.get(1).getData());

        List<Event> appended = new Pipeline().from(traffic()).collapse(List.of("in", "out"), "avg", Reducers.avg(), true).toEventList();
        assertEquals(5.5, appended.get(2).get("avg"));
        assertEquals("a", appended.get(2).get("host"));
    }

    public void testInvalidArguments() {
        Pipeline pipeline = new Pipeline().from(traffic());
        expectThrows(ProcessorException.class, () -> pipeline.map(null));
        expectThrows(ProcessorException.class, () -> pipeline.filter(null));
        expectThrows(ProcessorException.class, () -> pipeline.collapse(List.of(), "total", Reducers.sum(), false));
        expectThrows(ProcessorException.class, () -> pipeline.collapse(List.of("in"), null, Reducers.sum(), false));
        expectThrows(ProcessorException.class, () -> pipeline.collapse(List.of("in"), "total", null, false));
    }

    public void testDescribe() {
        Pipeline pipeline = new Pipeline().from(traffic()).select("in").take(1).offsetBy(1, "in");

        assertEquals(3, pipeline.getProcessors().size());
        assertSame(pipeline.getProcessors().get(1), pipeline.last().prev());
        assertNull(pipeline.first().prev());

        String json = XContentUtils.toJsonString(pipeline.last());
        assertTrue(json, json.contains("\"processor\":\"offset\""));
        assertTrue(json, json.contains("\"by\":1.0"));
    }
}
