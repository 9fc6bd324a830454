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
import org.opensearch.pond.core.model.EventCollection;
import org.opensearch.pond.query.processor.Processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Evaluates a batch pipeline.
 *
 * <p>The runner walks the pipeline's processors backwards from the last one, instantiates a fresh
 * copy of each (same configuration, no accumulated state), links the copies forward into the
 * output, and then pushes every event of the bounded source through the new chain. The pipeline's
 * own processors only hold configuration and never see an event, so one pipeline can be run any
 * number of times.</p>
 */
public class Runner {

    private static final Logger logger = LogManager.getLogger(Runner.class);

    private final EventCollection input;
    private final EventObserver head;

    public Runner(Pipeline pipeline, PipelineOutput output) {
        if (pipeline.getMode() != PipelineMode.BATCH || pipeline.getBoundedInput() == null) {
            throw new PipelineException("a runner needs a pipeline reading from a bounded source");
        }
        List<Processor> chain = chain(pipeline);
        this.input = pipeline.getBoundedInput();
        this.head = instantiate(chain, output);
        logger.debug("built a chain of {} processors over {} events", chain.size(), input.size());
    }

    /**
     * @return the pipeline's processors from first to last, found by following {@link Processor#prev()}
     */
    static List<Processor> chain(Pipeline pipeline) {
        List<Processor> chain = new ArrayList<>();
        for (Processor node = pipeline.last(); node != null; node = node.prev()) {
            chain.add(node);
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Copies each prototype and links the copies in order, ending in {@code output}.
     *
     * @return the head of the new chain, {@code output} itself when there are no processors
     */
    static EventObserver instantiate(List<Processor> prototypes, EventObserver output) {
        EventObserver next = output;
        for (int i = prototypes.size() - 1; i >= 0; i--) {
            Processor processor = prototypes.get(i).copy();
            processor.addObserver(next);
            next = processor;
        }
        return next;
    }

    /**
     * Pushes every input event through the chain.
     *
     * @param force send a terminal flush after the last event
     */
    public void start(boolean force) {
        for (Event event : input) {
            head.addEvent(event);
        }
        if (force) {
            head.flush();
        }
    }
}
