/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.function;

import org.opensearch.pond.core.exception.CollectionException;

import java.util.Locale;

/**
 * How a percentile falling between two ranked values {@code v0 <= v1} is resolved.
 */
public enum Interpolation {
    /** {@code v0 + (v1 - v0) * fraction} */
    LINEAR,
    /** {@code v0} */
    LOWER,
    /** {@code v1} */
    HIGHER,
    /** {@code v0} when the fraction is below one half, {@code v1} otherwise */
    NEAREST,
    /** {@code (v0 + v1) / 2} */
    MIDPOINT;

    double interpolate(double v0, double v1, double fraction) {
        if (fraction == 0) {
            return v0;
        }
        return switch (this) {
            case LINEAR -> v0 + (v1 - v0) * fraction;
            case LOWER -> v0;
            case HIGHER -> v1;
            case NEAREST -> fraction < 0.5 ? v0 : v1;
            case MIDPOINT -> (v0 + v1) / 2;
        };
    }

    public static Interpolation fromString(String name) {
        if (name != null) {
            for (Interpolation interpolation : values()) {
                if (interpolation.name().equalsIgnoreCase(name)) {
                    return interpolation;
                }
            }
        }
        throw new CollectionException(String.format(Locale.ROOT, "Unknown interpolation: %s", name));
    }
}
