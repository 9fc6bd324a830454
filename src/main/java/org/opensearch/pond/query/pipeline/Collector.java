/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

import org.opensearch.pond.core.exception.CollectionException;
import org.opensearch.pond.core.model.Event;
import org.opensearch.pond.core.model.EventCollection;
import org.opensearch.pond.core.model.Index;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Accumulates events into collections keyed by window and group, and emits those collections
 * according to an {@link EmitPolicy}.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li><strong>Window key</strong>: the fixed window index string ({@code "5m-4754394"}), the
 *   calendar index string for daily, monthly and yearly windows, or {@code "global"}</li>
 *   <li><strong>Group key</strong>: the result of the pipeline's group-by function, or null</li>
 *   <li><strong>Collection key</strong>: {@code "<window>::<group>"} when there is a group key,
 *   the window key otherwise</li>
 * </ul>
 *
 * <h2>Emission</h2>
 * <p>With fixed windows, creating a collection for a new key seals every collection of a
 * different window. {@link EmitPolicy#EACH_EVENT} emits every held collection after each event,
 * {@link EmitPolicy#DISCARD} emits the sealed collections and drops them, and
 * {@link EmitPolicy#FLUSH} waits for {@link #flushCollections()}.</p>
 *
 * <p>Collections are emitted in the order their keys were first seen.</p>
 */
public class Collector {

    private final WindowType windowType;
    private final String windowDuration;
    private final Function<Event, Object> groupBy;
    private final EmitPolicy emitOn;
    private final boolean utc;
    private final CollectionCallback callback;

    private final Map<String, Bucket> collections = new LinkedHashMap<>();

    private static final class Bucket {
        private final String windowKey;
        private final String groupByKey;
        private final List<Event> events = new ArrayList<>();

        private Bucket(String windowKey, String groupByKey) {
            this.windowKey = windowKey;
            this.groupByKey = groupByKey;
        }
    }

    public Collector(
        WindowType windowType,
        String windowDuration,
        Function<Event, Object> groupBy,
        EmitPolicy emitOn,
        boolean utc,
        CollectionCallback callback
    ) {
        this.windowType = windowType;
        this.windowDuration = windowDuration;
        this.groupBy = groupBy;
        this.emitOn = emitOn;
        this.utc = utc;
        this.callback = callback;
    }

    /**
     * Collector configured with the pipeline's window, grouping and emit policy.
     */
    public Collector(Pipeline pipeline, CollectionCallback callback) {
        this(
            pipeline.getWindowType(),
            pipeline.getWindowDuration(),
            pipeline.getGroupBy(),
            pipeline.getEmitOn(),
            pipeline.isUtc(),
            callback
        );
    }

    public void addEvent(Event event) {
        String windowKey = windowKey(windowType, windowDuration, utc, event.getTimestamp());
        String groupByKey = groupByKey(groupBy, event);
        String collectionKey = collectionKey(windowKey, groupByKey);

        Map<String, Bucket> discards = new LinkedHashMap<>();
        Bucket bucket = collections.get(collectionKey);
        if (bucket == null) {
            if (windowType == WindowType.FIXED) {
                for (Map.Entry<String, Bucket> entry : collections.entrySet()) {
                    if (!entry.getValue().windowKey.equals(windowKey)) {
                        discards.put(entry.getKey(), entry.getValue());
                    }
                }
            }
            bucket = new Bucket(windowKey, groupByKey);
            collections.put(collectionKey, bucket);
        } else if (!bucket.events.isEmpty() && bucket.events.get(0).getType() != event.getType()) {
            throw new CollectionException(
                String.format(Locale.ROOT, "Events collected under [%s] must be of the same type", collectionKey)
            );
        }
        bucket.events.add(event);

        switch (emitOn) {
            case EACH_EVENT -> emitCollections(collections);
            case DISCARD -> {
                emitCollections(discards);
                for (String key : discards.keySet()) {
                    collections.remove(key);
                }
            }
            case FLUSH -> {
                // held until flushCollections()
            }
        }
    }

    /**
     * Emits every collection still held.
     */
    public void flushCollections() {
        emitCollections(collections);
    }

    /**
     * @return the number of collections currently held
     */
    public int size() {
        return collections.size();
    }

    private void emitCollections(Map<String, Bucket> toEmit) {
        if (callback == null) {
            return;
        }
        for (Bucket bucket : new ArrayList<>(toEmit.values())) {
            callback.onCollection(new EventCollection(bucket.events), bucket.windowKey, bucket.groupByKey);
        }
    }

    /**
     * Window key of a timestamp under the given windowing.
     */
    public static String windowKey(WindowType windowType, String windowDuration, boolean utc, long timestamp) {
        return switch (windowType) {
            case FIXED -> Index.getIndexString(windowDuration, timestamp);
            case DAILY -> Index.getDailyIndexString(timestamp, utc);
            case MONTHLY -> Index.getMonthlyIndexString(timestamp, utc);
            case YEARLY -> Index.getYearlyIndexString(timestamp, utc);
            case GLOBAL -> windowType.getName();
        };
    }

    /**
     * Group key of an event, or null when there is no group-by function or it returns null.
     */
    public static String groupByKey(Function<Event, Object> groupBy, Event event) {
        if (groupBy == null) {
            return null;
        }
        Object key = groupBy.apply(event);
        return key == null ? null : String.valueOf(key);
    }

    public static String collectionKey(String windowKey, String groupByKey) {
        return groupByKey != null ? windowKey + "::" + groupByKey : windowKey;
    }
}
