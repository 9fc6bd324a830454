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
 * Where a converted event sits relative to the original one.
 *
 * <p>{@code FRONT}, {@code CENTER} and {@code BEHIND} place a range built from a point: starting
 * at it, centered on it, or ending at it. {@code LAG}, {@code CENTER} and {@code LEAD} pick the
 * point taken from a range: its begin, its middle, or its end.</p>
 */
public enum ConversionAlignment {
    FRONT("front"),
    CENTER("center"),
    BEHIND("behind"),
    LAG("lag"),
    LEAD("lead");

    private final String name;

    ConversionAlignment(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static ConversionAlignment fromString(String name) {
        for (ConversionAlignment alignment : values()) {
            if (alignment.name.equals(name)) {
                return alignment;
            }
        }
        throw new ProcessorException(String.format(Locale.ROOT, "Unknown alignment: %s", name));
    }
}
