/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

import org.opensearch.pond.core.model.EventCollection;

/**
 * Receives the collections emitted by a {@link Collector}.
 */
@FunctionalInterface
public interface CollectionCallback {

    /**
     * @param collection events of one window and group
     * @param windowKey window key, such as {@code "global"}, {@code "5m-4754394"} or {@code "2015-07-01"}
     * @param groupByKey group key, or null when the pipeline is not grouped
     */
    void onCollection(EventCollection collection, String windowKey, String groupByKey);
}
