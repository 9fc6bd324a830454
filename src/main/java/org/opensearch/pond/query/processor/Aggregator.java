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
import org.opensearch.pond.core.model.EventCollection;
import org.opensearch.pond.core.model.IndexedEvent;
import org.opensearch.pond.core.model.TimeRangeEvent;
import org.opensearch.pond.query.pipeline.Aggregation;
import org.opensearch.pond.query.pipeline.Collector;
import org.opensearch.pond.query.pipeline.Pipeline;
import org.opensearch.pond.query.pipeline.PipelineMode;
import org.opensearch.pond.query.pipeline.WindowType;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects events by window and group and reduces every emitted collection to a single event.
 *
 * <p>Each output field is produced by applying its {@link Aggregation}'s reducer to the values of
 * the aggregation's input field. The output event is a {@link TimeRangeEvent} covering the
 * collection for the global window, and an {@link IndexedEvent} keyed by the window otherwise.
 * When collections are emitted is decided by the pipeline's emit policy.</p>
 */
public class Aggregator extends Processor {

    public static final String NAME = "aggregate";

    private final Map<String, Aggregation> fields;
    private final Collector collector;

    public Aggregator(Pipeline pipeline, Map<String, Aggregation> fields) {
        super(pipeline);
        if (fields == null || fields.isEmpty()) {
            throw new ProcessorException("Aggregator needs a mapping of output fields to aggregations");
        }
        for (Map.Entry<String, Aggregation> field : fields.entrySet()) {
            if (field.getKey() == null || field.getValue() == null) {
                throw new ProcessorException("Aggregator output fields need a name and an aggregation");
            }
        }
        if (pipeline.getMode() == PipelineMode.STREAM && pipeline.getWindowType() == WindowType.GLOBAL) {
            throw new ProcessorException("Unable to aggregate a stream without a window, call windowBy() first");
        }
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.collector = new Collector(pipeline, this::aggregate);
    }

    private Aggregator(Aggregator other) {
        super(other);
        this.fields = other.fields;
        this.collector = new Collector(other.getPipeline(), this::aggregate);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Aggregator copy() {
        return new Aggregator(this);
    }

    @Override
    protected void optionsToXContent(XContentBuilder builder) throws IOException {
        builder.startObject("fields");
        for (Map.Entry<String, Aggregation> field : fields.entrySet()) {
            builder.field(field.getKey(), field.getValue().fieldPath());
        }
        builder.endObject();
    }

    private void aggregate(EventCollection collection, String windowKey, String groupByKey) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (Map.Entry<String, Aggregation> field : fields.entrySet()) {
            Aggregation aggregation = field.getValue();
            data.put(field.getKey(), collection.aggregate(aggregation.reducer(), aggregation.fieldPath()));
        }
        if (WindowType.GLOBAL.getName().equals(windowKey)) {
            emit(new TimeRangeEvent(collection.range(), data));
        } else {
            emit(new IndexedEvent(windowKey, data, getPipeline().isUtc()));
        }
    }

    @Override
    public void addEvent(Event event) {
        if (hasObservers()) {
            collector.addEvent(event);
        }
    }

    @Override
    public void flush() {
        collector.flushCollections();
        super.flush();
    }
}
