/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.processor;

import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.pond.core.exception.ProcessorException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.query.pipeline.Collector;
import org.opensearch.pond.query.pipeline.Pipeline;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Passes on at most {@code limit} events per window and group, keyed the way a {@link Collector}
 * keys its collections.
 */
public class Taker extends Processor {

    public static final String NAME = "take";

    private final int limit;
    private final Map<String, Integer> counts = new HashMap<>();

    public Taker(Pipeline pipeline, int limit) {
        super(pipeline);
        if (limit < 0) {
            throw new ProcessorException("Taker limit must not be negative, got " + limit);
        }
        this.limit = limit;
    }

    private Taker(Taker other) {
        super(other);
        this.limit = other.limit;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Taker copy() {
        return new Taker(this);
    }

    @Override
    protected void optionsToXContent(XContentBuilder builder) throws IOException {
        builder.field("limit", limit);
    }

    @Override
    public void addEvent(Event event) {
        if (!hasObservers()) {
            return;
        }
        Pipeline pipeline = getPipeline();
        String windowKey = Collector.windowKey(
            pipeline.getWindowType(),
            pipeline.getWindowDuration(),
            pipeline.isUtc(),
            event.getTimestamp()
        );
        String key = Collector.collectionKey(windowKey, Collector.groupByKey(pipeline.getGroupBy(), event));
        int count = counts.merge(key, 1, Integer::sum);
        if (count <= limit) {
            emit(event);
        }
    }
}
