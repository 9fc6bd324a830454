/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

import org.opensearch.pond.core.model.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Output handing every event to a callback, or collecting the events when there is no callback.
 */
public class EventOut extends PipelineOutput {

    private final Consumer<Event> callback;
    private final List<Event> results = new ArrayList<>();
    private boolean done;

    public EventOut(Pipeline pipeline, Consumer<Event> callback) {
        super(pipeline);
        this.callback = callback;
    }

    @Override
    public void addEvent(Event event) {
        if (callback != null) {
            callback.accept(event);
        } else {
            results.add(event);
        }
    }

    @Override
    public void flush() {
        done = true;
    }

    /**
     * @return true once the input has been flushed
     */
    public boolean isDone() {
        return done;
    }

    public List<Event> getResults() {
        return Collections.unmodifiableList(results);
    }
}
