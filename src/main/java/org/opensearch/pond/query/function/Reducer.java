/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.function;

import java.util.List;

/**
 * Reduces a column of values to a single value. A reducer may return null, which marks the
 * result as missing.
 *
 * @see Reducers for the built-in reducers
 */
@FunctionalInterface
public interface Reducer {

    Object reduce(List<Object> values);
}
