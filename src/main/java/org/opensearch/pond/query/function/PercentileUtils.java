/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.function;

import org.opensearch.pond.core.exception.CollectionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rank statistics over sorted values.
 *
 * <p>The rank of percentile {@code q} over {@code n} sorted values is {@code (n - 1) * q / 100}.
 * Its integer part selects {@code v0}, the next value is {@code v1}, and the fractional part is
 * handed to the {@link Interpolation}.</p>
 */
public final class PercentileUtils {

    private PercentileUtils() {}

    /**
     * @param sortedValues values in ascending order
     * @param percentile percentile between 0 and 100
     * @param interpolation how to resolve a rank between two values
     * @return the percentile, or null for an empty list
     */
    public static Double calculatePercentile(List<Double> sortedValues, double percentile, Interpolation interpolation) {
        if (percentile < 0 || percentile > 100) {
            throw new CollectionException(String.format(Locale.ROOT, "Percentile must be between 0 and 100, got %s", percentile));
        }
        int size = sortedValues.size();
        if (size == 0) {
            return null;
        }
        if (size == 1 || percentile == 0) {
            return sortedValues.get(0);
        }
        if (percentile == 100) {
            return sortedValues.get(size - 1);
        }
        return valueAtRank(sortedValues, percentile / 100, interpolation);
    }

    /**
     * Splits sorted values into {@code count} equal-sized groups and returns the {@code count - 1}
     * cut points between them. Cut points that fall past the last value are left out, so fewer
     * values than groups give fewer cut points.
     *
     * @throws CollectionException if {@code count} is not positive
     */
    public static List<Double> calculateQuantiles(List<Double> sortedValues, int count, Interpolation interpolation) {
        if (count <= 0) {
            throw new CollectionException("Quantile count must be positive, got " + count);
        }
        List<Double> results = new ArrayList<>(Math.max(0, count - 1));
        for (int k = 1; k < count; k++) {
            Double value = valueAtRank(sortedValues, (double) k / count, interpolation);
            if (value != null) {
                results.add(value);
            }
        }
        return results;
    }

    /**
     * Median of sorted values: the middle value, or the mean of the two middle values.
     *
     * @return the median, or null for an empty list
     */
    public static Double calculateMedian(List<Double> sortedValues) {
        int size = sortedValues.size();
        if (size == 0) {
            return null;
        }
        int middle = size / 2;
        if (size % 2 == 1) {
            return sortedValues.get(middle);
        }
        return (sortedValues.get(middle - 1) + sortedValues.get(middle)) / 2;
    }

    private static Double valueAtRank(List<Double> sortedValues, double ratio, Interpolation interpolation) {
        int size = sortedValues.size();
        double rank = (size - 1) * ratio;
        int index = (int) Math.floor(rank);
        if (index >= size - 1) {
            return null;
        }
        double fraction = rank - index;
        return interpolation.interpolate(sortedValues.get(index), sortedValues.get(index + 1), fraction);
    }
}
