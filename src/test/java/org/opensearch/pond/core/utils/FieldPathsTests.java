/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.utils;

import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FieldPathsTests extends OpenSearchTestCase {

    public void testSplitDefaultsToValue() {
        assertEquals(List.of("value"), FieldPaths.split(null));
        assertEquals(List.of("value"), FieldPaths.split(""));
        assertEquals(List.of("direction", "in"), FieldPaths.split("direction.in"));
    }

    public void testToFieldSpec() {
        assertEquals(List.of("value"), FieldPaths.toFieldSpec(null));
        assertEquals(List.of("in"), FieldPaths.toFieldSpec("in"));
        assertEquals(List.of("in", "direction.out"), FieldPaths.toFieldSpec(List.of("in", List.of("direction", "out"))));
        expectThrows(IllegalArgumentException.class, () -> FieldPaths.toFieldSpec(42));
    }

    public void testGetMissingSegmentReturnsNull() {
        Map<String, Object> data = FieldPaths.freeze(Map.of("direction", Map.of("in", 1)));
        assertEquals(1L, FieldPaths.get(data, List.of("direction", "in")));
        assertNull(FieldPaths.get(data, List.of("direction", "out")));
        assertNull(FieldPaths.get(data, List.of("direction", "in", "deeper")));
        assertTrue(FieldPaths.hasPath(data, List.of("direction", "in")));
        assertFalse(FieldPaths.hasPath(data, List.of("direction", "out")));
    }

    public void testFreezeNormalizesNumbersAndIsUnmodifiable() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("int", 3);
        source.put("float", 1.5f);
        source.put("list", new ArrayList<>(Arrays.asList(1, 2)));
        Map<String, Object> frozen = FieldPaths.freeze(source);

        assertEquals(3L, frozen.get("int"));
        assertEquals(1.5d, frozen.get("float"));
        assertEquals(List.of(1L, 2L), frozen.get("list"));
        expectThrows(UnsupportedOperationException.class, () -> frozen.put("other", 1));
    }

    @SuppressWarnings("unchecked")
    public void testWithBuildsNestedPathOnCopy() {
        Map<String, Object> data = FieldPaths.freeze(Map.of("a", 1));
        Map<String, Object> updated = FieldPaths.with(data, List.of("b", "c"), 2);

        assertEquals(2, ((Map<String, Object>) updated.get("b")).get("c"));
        assertFalse(data.containsKey("b"));
    }

    public void testLeafPaths() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("a", 1);
        data.put("b", Map.of("c", 2));
        assertEquals(List.of("a", "b.c"), FieldPaths.leafPaths(data));
    }

    public void testValidity() {
        assertFalse(FieldPaths.isValid(null));
        assertFalse(FieldPaths.isValid(""));
        assertFalse(FieldPaths.isValid(Double.NaN));
        assertTrue(FieldPaths.isValid(0));
        assertTrue(FieldPaths.isValid("x"));
        assertTrue(FieldPaths.isNumeric(1.5));
        assertFalse(FieldPaths.isNumeric("1.5"));
    }
}
