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
import org.opensearch.pond.query.pipeline.Pipeline;

import java.util.function.Function;

/**
 * Replaces each event by the result of a function.
 */
public class Mapper extends Processor {

    public static final String NAME = "map";

    private final Function<Event, Event> op;

    public Mapper(Pipeline pipeline, Function<Event, Event> op) {
        super(pipeline);
        if (op == null) {
            throw new ProcessorException("Mapper needs a mapping function");
        }
        this.op = op;
    }

    private Mapper(Mapper other) {
        super(other);
        this.op = other.op;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Mapper copy() {
        return new Mapper(this);
    }

    @Override
    public void addEvent(Event event) {
        if (hasObservers()) {
            emit(op.apply(event));
        }
    }
}
