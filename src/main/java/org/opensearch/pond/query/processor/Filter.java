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

import java.util.function.Predicate;

/**
 * Passes on the events matching a predicate.
 */
public class Filter extends Processor {

    public static final String NAME = "filter";

    private final Predicate<Event> op;

    public Filter(Pipeline pipeline, Predicate<Event> op) {
        super(pipeline);
        if (op == null) {
            throw new ProcessorException("Filter needs a predicate");
        }
        this.op = op;
    }

    private Filter(Filter other) {
        super(other);
        this.op = other.op;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Filter copy() {
        return new Filter(this);
    }

    @Override
    public void addEvent(Event event) {
        if (hasObservers() && op.test(event)) {
            emit(event);
        }
    }
}
