/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.function;

import org.opensearch.pond.core.utils.FieldPaths;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Factories for the built-in reducers.
 *
 * <p>Every factory takes a {@link MissingValuePolicy}, applied to the column before reducing;
 * the no-argument forms use {@link MissingValuePolicy#KEEP_MISSING} except {@link #percentile(double)},
 * which ignores missing values. When the policy marks the column as missing the reducer returns
 * null.</p>
 *
 * <p>Numeric reducers ({@code sum}, {@code avg}, {@code min}, {@code max}, {@code median},
 * {@code stddev}, {@code difference}, {@code percentile}) only look at numeric values that are
 * not missing and return {@link Double}. {@code count} returns {@link Long}; {@code first} and
 * {@code last} return the raw value.</p>
 */
public final class Reducers {

    private Reducers() {}

    public static Reducer sum() {
        return sum(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer sum(MissingValuePolicy policy) {
        return values -> {
            List<Double> numbers = numbers(policy.apply(values));
            if (numbers == null) {
                return null;
            }
            double total = 0;
            for (double number : numbers) {
                total += number;
            }
            return total;
        };
    }

    public static Reducer avg() {
        return avg(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer avg(MissingValuePolicy policy) {
        return values -> {
            List<Double> numbers = numbers(policy.apply(values));
            if (numbers == null || numbers.isEmpty()) {
                return null;
            }
            return mean(numbers);
        };
    }

    public static Reducer max() {
        return max(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer max(MissingValuePolicy policy) {
        return values -> {
            List<Double> numbers = numbers(policy.apply(values));
            if (numbers == null || numbers.isEmpty()) {
                return null;
            }
            return Collections.max(numbers);
        };
    }

    public static Reducer min() {
        return min(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer min(MissingValuePolicy policy) {
        return values -> {
            List<Double> numbers = numbers(policy.apply(values));
            if (numbers == null || numbers.isEmpty()) {
                return null;
            }
            return Collections.min(numbers);
        };
    }

    public static Reducer count() {
        return count(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer count(MissingValuePolicy policy) {
        return values -> {
            List<Object> cleaned = policy.apply(values);
            return cleaned == null ? null : (long) cleaned.size();
        };
    }

    public static Reducer first() {
        return first(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer first(MissingValuePolicy policy) {
        return values -> {
            List<Object> cleaned = policy.apply(values);
            return cleaned == null || cleaned.isEmpty() ? null : cleaned.get(0);
        };
    }

    public static Reducer last() {
        return last(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer last(MissingValuePolicy policy) {
        return values -> {
            List<Object> cleaned = policy.apply(values);
            return cleaned == null || cleaned.isEmpty() ? null : cleaned.get(cleaned.size() - 1);
        };
    }

    /**
     * Difference between the largest and the smallest value.
     */
    public static Reducer difference() {
        return difference(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer difference(MissingValuePolicy policy) {
        return values -> {
            List<Double> numbers = numbers(policy.apply(values));
            if (numbers == null || numbers.isEmpty()) {
                return null;
            }
            return Collections.max(numbers) - Collections.min(numbers);
        };
    }

    public static Reducer median() {
        return median(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer median(MissingValuePolicy policy) {
        return values -> {
            List<Double> numbers = numbers(policy.apply(values));
            if (numbers == null) {
                return null;
            }
            Collections.sort(numbers);
            return PercentileUtils.calculateMedian(numbers);
        };
    }

    /**
     * Population standard deviation.
     */
    public static Reducer stddev() {
        return stddev(MissingValuePolicy.KEEP_MISSING);
    }

    public static Reducer stddev(MissingValuePolicy policy) {
        return values -> {
            List<Double> numbers = numbers(policy.apply(values));
            if (numbers == null || numbers.isEmpty()) {
                return null;
            }
            double mean = mean(numbers);
            double squares = 0;
            for (double number : numbers) {
                squares += (number - mean) * (number - mean);
            }
            return Math.sqrt(squares / numbers.size());
        };
    }

    public static Reducer percentile(double percentile) {
        return percentile(percentile, Interpolation.LINEAR, MissingValuePolicy.IGNORE_MISSING);
    }

    public static Reducer percentile(double percentile, Interpolation interpolation) {
        return percentile(percentile, interpolation, MissingValuePolicy.IGNORE_MISSING);
    }

    /**
     * @param percentile percentile between 0 and 100, checked when the reducer runs
     */
    public static Reducer percentile(double percentile, Interpolation interpolation, MissingValuePolicy policy) {
        return values -> {
            List<Double> numbers = numbers(policy.apply(values));
            if (numbers == null) {
                return null;
            }
            Collections.sort(numbers);
            return PercentileUtils.calculatePercentile(numbers, percentile, interpolation);
        };
    }

    /**
     * Numeric, non-missing values of a column, or null if the column itself is missing.
     */
    static List<Double> numbers(List<Object> values) {
        if (values == null) {
            return null;
        }
        List<Double> numbers = new ArrayList<>(values.size());
        for (Object value : values) {
            if (FieldPaths.isNumeric(value)) {
                numbers.add(((Number) value).doubleValue());
            }
        }
        return numbers;
    }

    private static double mean(List<Double> numbers) {
        double total = 0;
        for (double number : numbers) {
            total += number;
        }
        return total / numbers.size();
    }
}
