/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventCollection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output gathering events into collections with the pipeline's window, grouping and emit policy.
 *
 * <p>Without a callback the collections are kept by result key: the window key unless it is
 * {@code "global"}, and the group key unless it is missing or {@code "all"}, joined with
 * {@code "--"}. When neither is present the key is {@code "all"}. A later emission for the same
 * key replaces the earlier one.</p>
 */
public class CollectionOut extends PipelineOutput {

    public static final String ALL = "all";

    private final Collector collector;
    private final CollectionCallback callback;
    private final Map<String, EventCollection> results = new LinkedHashMap<>();

    public CollectionOut(Pipeline pipeline, CollectionCallback callback) {
        super(pipeline);
        this.callback = callback;
        this.collector = new Collector(pipeline, this::onCollection);
    }

    private void onCollection(EventCollection collection, String windowKey, String groupByKey) {
        if (callback != null) {
            callback.onCollection(collection, windowKey, groupByKey);
        } else {
            results.put(resultKey(windowKey, groupByKey), collection);
        }
    }

    static String resultKey(String windowKey, String groupByKey) {
        List<String> parts = new ArrayList<>(2);
        if (windowKey != null && !WindowType.GLOBAL.getName().equals(windowKey)) {
            parts.add(windowKey);
        }
        if (groupByKey != null && !ALL.equals(groupByKey)) {
            parts.add(groupByKey);
        }
        return parts.isEmpty() ? ALL : String.join("--", parts);
    }

    @Override
    public void addEvent(Event event) {
        collector.addEvent(event);
    }

    @Override
    public void flush() {
        collector.flushCollections();
    }

    public Map<String, EventCollection> getResults() {
        return Collections.unmodifiableMap(results);
    }
}
