/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.processor;

import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.utils.FieldPaths;
import org.opensearch.pond.query.pipeline.Pipeline;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds a constant to the selected fields. The output payload holds only those fields;
 * non-numeric values pass through unchanged.
 */
public class Offset extends Processor {

    public static final String NAME = "offset";

    private final double by;
    private final List<String> fieldSpec;

    public Offset(Pipeline pipeline, double by, Object fieldSpec) {
        super(pipeline);
        this.by = by;
        this.fieldSpec = FieldPaths.toFieldSpec(fieldSpec);
    }

    private Offset(Offset other) {
        super(other);
        this.by = other.by;
        this.fieldSpec = other.fieldSpec;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Offset copy() {
        return new Offset(this);
    }

    @Override
    protected void optionsToXContent(XContentBuilder builder) throws IOException {
        builder.field("by", by);
        builder.field("field_spec", fieldSpec);
    }

    @Override
    public void addEvent(Event event) {
        if (!hasObservers()) {
            return;
        }
        Event selected = Event.selector(event, fieldSpec);
        Map<String, Object> data = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : selected.getData().entrySet()) {
            Object value = entry.getValue();
            data.put(entry.getKey(), FieldPaths.isNumeric(value) ? ((Number) value).doubleValue() + by : value);
        }
        emit(event.setData(data));
    }
}
