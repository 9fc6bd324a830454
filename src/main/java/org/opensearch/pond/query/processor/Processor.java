/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.processor;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.query.pipeline.EventObserver;
import org.opensearch.pond.query.pipeline.Pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A node of a processing chain.
 *
 * <p>A processor receives events through {@link #addEvent(Event)}, may keep state between
 * events, and forwards results to its observers. {@link #flush()} marks the end of the input;
 * processors holding events emit them before passing the flush on.</p>
 *
 * <h2>Configuration and state</h2>
 * <p>The instance a {@link Pipeline} holds is a configuration prototype. It remembers the pipeline
 * it was built on and the position of the processor before it, so the chain can be walked
 * backwards with {@link #prev()}. Evaluation works on {@link #copy()}s, which share the
 * configuration but start with empty state and no observers.</p>
 *
 * <p>A processor without observers does nothing with the events it receives.</p>
 */
public abstract class Processor implements EventObserver, ToXContentObject {

    private final Pipeline pipeline;
    private final int previousPosition;
    private final List<EventObserver> observers = new ArrayList<>();

    protected Processor(Pipeline pipeline) {
        this.pipeline = pipeline;
        this.previousPosition = pipeline.getProcessors().size() - 1;
    }

    /**
     * Copy constructor: same configuration and position, no observers.
     */
    protected Processor(Processor other) {
        this.pipeline = other.pipeline;
        this.previousPosition = other.previousPosition;
    }

    /**
     * @return the name of the processor as shown in pipeline descriptions
     */
    public abstract String getName();

    /**
     * @return a processor with the same configuration and fresh state
     */
    public abstract Processor copy();

    /**
     * Writes the processor's options into an object already started by {@link #toXContent}.
     */
    protected void optionsToXContent(XContentBuilder builder) throws IOException {}

    /**
     * @return the processor before this one in its pipeline, or null for the first processor
     */
    public Processor prev() {
        return previousPosition < 0 ? null : pipeline.getProcessors().get(previousPosition);
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void addObserver(EventObserver observer) {
        observers.add(observer);
    }

    public boolean hasObservers() {
        return !observers.isEmpty();
    }

    protected void emit(Event event) {
        for (EventObserver observer : observers) {
            observer.addEvent(event);
        }
    }

    @Override
    public void flush() {
        for (EventObserver observer : observers) {
            observer.flush();
        }
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("processor", getName());
        optionsToXContent(builder);
        builder.endObject();
        return builder;
    }
}
