/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.pond.core.exception.PipelineException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Unbounded source of a streaming pipeline. The caller pushes events with {@link #addEvent(Event)}
 * and ends the stream with {@link #stop()}, which flushes every subscribed chain.
 *
 * <p>All events of a stream must be of the variant of the first one.</p>
 */
public class EventStream {

    private static final Logger logger = LogManager.getLogger(EventStream.class);

    private final List<EventObserver> observers = new ArrayList<>();
    private EventType type;
    private boolean running = true;

    public void addObserver(EventObserver observer) {
        observers.add(observer);
    }

    public boolean hasObservers() {
        return !observers.isEmpty();
    }

    public boolean isRunning() {
        return running;
    }

    public void start() {
        running = true;
    }

    public void stop() {
        logger.debug("stopping stream, flushing {} observers", observers.size());
        running = false;
        for (EventObserver observer : observers) {
            observer.flush();
        }
    }

    /**
     * Pushes an event through every subscribed chain before returning.
     *
     * @throws PipelineException if the stream is stopped or the event variant differs from the first event's
     */
    public void addEvent(Event event) {
        if (!running) {
            throw new PipelineException("unable to add an event to a stopped stream");
        }
        if (type == null) {
            type = event.getType();
        } else if (event.getType() != type) {
            throw new PipelineException(
                String.format(Locale.ROOT, "Homogeneous events expected: stream holds %s events, got %s", type, event.getType())
            );
        }
        for (EventObserver observer : observers) {
            observer.addEvent(event);
        }
    }

    /**
     * @throws PipelineException always, an unbounded source has no event list
     */
    public List<Event> events() {
        throw new PipelineException("an unbounded stream has no event list");
    }
}
