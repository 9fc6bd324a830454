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
import org.opensearch.pond.query.function.Reducer;
import org.opensearch.pond.query.pipeline.Pipeline;

import java.io.IOException;
import java.util.List;

/**
 * Reduces several fields of each event into one named field, either replacing the payload or
 * appending to it.
 */
public class Collapser extends Processor {

    public static final String NAME = "collapse";

    private final List<String> fieldSpecList;
    private final String name;
    private final Reducer reducer;
    private final boolean append;

    public Collapser(Pipeline pipeline, List<String> fieldSpecList, String name, Reducer reducer, boolean append) {
        super(pipeline);
        if (fieldSpecList == null || fieldSpecList.isEmpty()) {
            throw new ProcessorException("Collapser needs at least one field to collapse");
        }
        if (name == null || reducer == null) {
            throw new ProcessorException("Collapser needs an output name and a reducer");
        }
        this.fieldSpecList = List.copyOf(fieldSpecList);
        this.name = name;
        this.reducer = reducer;
        this.append = append;
    }

    private Collapser(Collapser other) {
        super(other);
        this.fieldSpecList = other.fieldSpecList;
        this.name = other.name;
        this.reducer = other.reducer;
        this.append = other.append;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Collapser copy() {
        return new Collapser(this);
    }

    @Override
    protected void optionsToXContent(XContentBuilder builder) throws IOException {
        builder.field("field_spec", fieldSpecList);
        builder.field("name", name);
        builder.field("append", append);
    }

    @Override
    public void addEvent(Event event) {
        if (hasObservers()) {
            emit(event.collapse(fieldSpecList, name, reducer, append));
        }
    }
}
