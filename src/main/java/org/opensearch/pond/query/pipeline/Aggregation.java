/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

import org.opensearch.pond.core.exception.ProcessorException;
import org.opensearch.pond.query.function.Reducer;

/**
 * One output field of an aggregation: the input field to read and the reducer to apply to it.
 *
 * @param fieldPath dotted path of the input field
 * @param reducer reducer applied to the field's values within a window
 */
public record Aggregation(String fieldPath, Reducer reducer) {

    public Aggregation {
        if (fieldPath == null || reducer == null) {
            throw new ProcessorException("an aggregation needs both a field path and a reducer");
        }
    }

    public static Aggregation of(String fieldPath, Reducer reducer) {
        return new Aggregation(fieldPath, reducer);
    }
}
