/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.pipeline;

import org.opensearch.pond.core.exception.PipelineException;

import java.util.Locale;

/**
 * When a {@link Collector} hands its collections to its callback.
 */
public enum EmitPolicy {
    /** Every held collection after each event */
    EACH_EVENT("eachEvent"),
    /** Fixed windows once a later window receives its first event, then they are dropped */
    DISCARD("discard"),
    /** Nothing until the input is flushed */
    FLUSH("flush");

    private final String name;

    EmitPolicy(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static EmitPolicy fromString(String name) {
        for (EmitPolicy policy : values()) {
            if (policy.name.equals(name)) {
                return policy;
            }
        }
        throw new PipelineException(String.format(Locale.ROOT, "Unknown emit policy: %s, expected eachEvent, discard or flush", name));
    }
}
