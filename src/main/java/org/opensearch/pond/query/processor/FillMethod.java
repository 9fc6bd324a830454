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
 * How {@link Filler} repairs missing values.
 */
public enum FillMethod {
    ZERO("zero"),
    PAD("pad"),
    LINEAR("linear");

    private final String name;

    FillMethod(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static FillMethod fromString(String name) {
        for (FillMethod method : values()) {
            if (method.name.equals(name)) {
                return method;
            }
        }
        throw new ProcessorException(String.format(Locale.ROOT, "Unknown fill method: %s, expected zero, pad or linear", name));
    }
}
