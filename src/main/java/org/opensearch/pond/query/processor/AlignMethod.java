/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.processor;

import org.opensearch.pond.core.exception.ProcessorException;

import java.util.Locale;

/**
 * How {@link Align} computes values at boundaries.
 */
public enum AlignMethod {
    /** Carry the previous value forward */
    HOLD("hold"),
    /** Interpolate between the previous and the current value */
    LINEAR("linear");

    private final String name;

    AlignMethod(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static AlignMethod fromString(String name) {
        for (AlignMethod method : values()) {
            if (method.name.equals(name)) {
                return method;
            }
        }
        throw new ProcessorException(String.format(Locale.ROOT, "Unknown align method: %s, expected hold or linear", name));
    }
}
