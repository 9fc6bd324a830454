/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.query.function;

import org.opensearch.pond.core.exception.CollectionException;
import org.opensearch.pond.core.exception.FilterException;
import org.opensearch.test.OpenSearchTestCase;

import java.util.Arrays;
import java.util.List;

public class ReducersTests extends OpenSearchTestCase {

    private static final List<Object> WITH_GAP = Arrays.asList(1L, null, 3L);

    public void testSumWithPolicies() {
        assertEquals(4.0, Reducers.sum().reduce(WITH_GAP));
        assertEquals(4.0, Reducers.sum(MissingValuePolicy.IGNORE_MISSING).reduce(WITH_GAP));
        assertNull(Reducers.sum(MissingValuePolicy.PROPAGATE_MISSING).reduce(WITH_GAP));
        assertEquals(4.0, Reducers.sum(MissingValuePolicy.ZERO_MISSING).reduce(WITH_GAP));
    }

    public void testAvgWithPolicies() {
        assertEquals(2.0, Reducers.avg(MissingValuePolicy.IGNORE_MISSING).reduce(WITH_GAP));
        assertEquals(4.0 / 3, (Double) Reducers.avg(MissingValuePolicy.ZERO_MISSING).reduce(WITH_GAP), 1e-12);
        assertNull(Reducers.avg(MissingValuePolicy.PROPAGATE_MISSING).reduce(WITH_GAP));
    }

    public void testCount() {
        assertEquals(3L, Reducers.count().reduce(WITH_GAP));
        assertEquals(2L, Reducers.count(MissingValuePolicy.IGNORE_MISSING).reduce(WITH_GAP));
        assertNull(Reducers.count(MissingValuePolicy.NONE_IF_EMPTY).reduce(List.of()));
    }

    public void testFirstLastKeepRawValues() {
        List<Object> values = Arrays.asList(null, "a", "b", null);
        assertNull(Reducers.first().reduce(values));
        assertEquals("a", Reducers.first(MissingValuePolicy.IGNORE_MISSING).reduce(values));
        assertEquals("b", Reducers.last(MissingValuePolicy.IGNORE_MISSING).reduce(values));
    }

    public void testNumericReducers() {
        List<Object> values = List.of(2L, 4.0, 4L, 4L, 5L, 5L, 7L, 9L);
        assertEquals(9.0, Reducers.max().reduce(values));
        assertEquals(2.0, Reducers.min().reduce(values));
        assertEquals(7.0, Reducers.difference().reduce(values));
        assertEquals(4.5, Reducers.median().reduce(values));
        assertEquals(2.0, Reducers.stddev().reduce(values));
    }

    public void testEmptyColumns() {
        assertEquals(0.0, Reducers.sum().reduce(List.of()));
        assertNull(Reducers.avg().reduce(List.of()));
        assertNull(Reducers.max().reduce(List.of()));
        assertNull(Reducers.median().reduce(List.of()));
        assertEquals(0L, Reducers.count().reduce(List.of()));
    }

    public void testPercentileReducer() {
        List<Object> values = Arrays.asList(5L, null, 1L, 4L, 2L, 3L);
        assertEquals(3.0, Reducers.percentile(50).reduce(values));
        assertEquals(4.5, Reducers.percentile(90, Interpolation.MIDPOINT).reduce(values));
        expectThrows(CollectionException.class, () -> Reducers.percentile(150).reduce(values));
    }

    public void testPolicyParsing() {
        assertEquals(MissingValuePolicy.IGNORE_MISSING, MissingValuePolicy.fromString("ignoreMissing"));
        assertEquals(MissingValuePolicy.ZERO_MISSING, MissingValuePolicy.fromString("zero_missing"));
        expectThrows(FilterException.class, () -> MissingValuePolicy.fromString("dropEverything"));
        expectThrows(FilterException.class, () -> MissingValuePolicy.fromString(null));
    }

    public void testInterpolationParsing() {
        assertEquals(Interpolation.NEAREST, Interpolation.fromString("nearest"));
        expectThrows(CollectionException.class, () -> Interpolation.fromString("cubic"));
    }
}
