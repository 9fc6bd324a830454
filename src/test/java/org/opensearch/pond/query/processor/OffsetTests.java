/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.processor;

import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventCollection;
import org.opensearch.pond.core.model.TimeEvent;
import org.opensearch.pond.query.pipeline.Pipeline;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.Map;

public class OffsetTests extends OpenSearchTestCase {

    public void testOffsetKeepsOnlySelectedFields() {
        EventCollection events = new EventCollection(
            List.of(new TimeEvent(0L, Map.of("value", 1, "other", "x")), new TimeEvent(1000L, Map.of("value", 2.5, "other", "y")))
        );
        List<Event> offset = new Pipeline().from(events).offsetBy(2.5, "value").toEventList();

        assertEquals(2, offset.size());
        assertEquals(Map.of("value", 3.5), offset.get(0).getData());
        assertEquals(Map.of("value", 5.0), offset.get(1).getData());
        assertEquals(1000L, offset.get(1).getTimestamp());
    }

    public void testNonNumericValuesPassUnchanged() {
        EventCollection events = new EventCollection(List.of(new TimeEvent(0L, Map.of("value", 1, "name", "x"))));
        Event offset = new Pipeline().from(events).offsetBy(-1, List.of("value", "name")).toEventList().get(0);

        assertEquals(0.0, offset.get("value"));
        assertEquals("x", offset.get("name"));
    }

    public void testChainedOffsets() {
        EventCollection events = new EventCollection(List.of(new TimeEvent(0L, 1)));
        Event offset = new Pipeline().from(events).offsetBy(1, null).offsetBy(2, null).toEventList().get(0);
        assertEquals(4.0, offset.get());
    }
}
