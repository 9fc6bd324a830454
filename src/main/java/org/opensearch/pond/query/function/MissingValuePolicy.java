/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.function;

import org.opensearch.pond.core.exception.FilterException;
import org.opensearch.pond.core.utils.FieldPaths;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * How a reducer treats missing values (null, empty string or NaN) before reducing.
 *
 * <ul>
 *   <li><strong>KEEP_MISSING</strong>: leave the values untouched (numeric reducers skip missing values)</li>
 *   <li><strong>IGNORE_MISSING</strong>: drop missing values</li>
 *   <li><strong>ZERO_MISSING</strong>: replace missing values with 0</li>
 *   <li><strong>PROPAGATE_MISSING</strong>: a single missing value makes the whole result missing</li>
 *   <li><strong>NONE_IF_EMPTY</strong>: an empty column makes the result missing</li>
 * </ul>
 */
public enum MissingValuePolicy {
    KEEP_MISSING("keepMissing"),
    IGNORE_MISSING("ignoreMissing"),
    ZERO_MISSING("zeroMissing"),
    PROPAGATE_MISSING("propagateMissing"),
    NONE_IF_EMPTY("noneIfEmpty");

    private final String name;

    MissingValuePolicy(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Applies the policy.
     *
     * @return the values to reduce, or null when the result must be missing
     */
    public List<Object> apply(List<Object> values) {
        if (values == null) {
            return null;
        }
        return switch (this) {
            case KEEP_MISSING -> values;
            case IGNORE_MISSING -> {
                List<Object> kept = new ArrayList<>(values.size());
                for (Object value : values) {
                    if (FieldPaths.isValid(value)) {
                        kept.add(value);
                    }
                }
                yield kept;
            }
            case ZERO_MISSING -> {
                List<Object> filled = new ArrayList<>(values.size());
                for (Object value : values) {
                    filled.add(FieldPaths.isValid(value) ? value : 0L);
                }
                yield filled;
            }
            case PROPAGATE_MISSING -> {
                for (Object value : values) {
                    if (!FieldPaths.isValid(value)) {
                        yield null;
                    }
                }
                yield values;
            }
            case NONE_IF_EMPTY -> values.isEmpty() ? null : values;
        };
    }

    /**
     * Parses a policy from its camel case name ({@code "ignoreMissing"}) or its constant name in
     * any case ({@code "ignore_missing"}).
     *
     * @throws FilterException for an unknown policy
     */
    public static MissingValuePolicy fromString(String policy) {
        if (policy == null) {
            throw new FilterException("missing value policy must not be null");
        }
        for (MissingValuePolicy candidate : values()) {
            if (candidate.name.equals(policy) || candidate.name().equalsIgnoreCase(policy)) {
                return candidate;
            }
        }
        throw new FilterException(String.format(Locale.ROOT, "Unknown missing value policy: %s", policy));
    }
}
