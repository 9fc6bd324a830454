/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

import org.opensearch.pond.core.model.Event;

/**
 * A node of the push graph: receives events one at a time and a single terminal flush.
 */
public interface EventObserver {

    void addEvent(Event event);

    /**
     * Signals the end of the input. Stateful observers emit whatever they still hold and pass the
     * signal on.
     */
    void flush();
}
