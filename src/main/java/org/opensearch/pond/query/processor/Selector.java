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
import java.util.List;

/**
 * Keeps only the selected fields of each event.
 */
public class Selector extends Processor {

    public static final String NAME = "select";

    private final List<String> fieldSpec;

    public Selector(Pipeline pipeline, Object fieldSpec) {
        super(pipeline);
        this.fieldSpec = FieldPaths.toFieldSpec(fieldSpec);
    }

    private Selector(Selector other) {
        super(other);
        this.fieldSpec = other.fieldSpec;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Selector copy() {
        return new Selector(this);
    }

    @Override
    protected void optionsToXContent(XContentBuilder builder) throws IOException {
        builder.field("field_spec", fieldSpec);
    }

    @Override
    public void addEvent(Event event) {
        if (hasObservers()) {
            emit(Event.selector(event, fieldSpec));
        }
    }
}
