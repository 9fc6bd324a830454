/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

/**
 * How a pipeline is evaluated, decided by its source.
 */
public enum PipelineMode {
    /** Bounded source pulled through a fresh chain by a {@link Runner} */
    BATCH,
    /** Unbounded source pushing events through the chain as the caller adds them */
    STREAM
}
