/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.pond.core.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for event payloads: field path parsing, nested lookup and update, freezing and
 * value validity.
 *
 * <p>A field path is either a dotted string ({@code "direction.in"}) or a list of segments
 * ({@code ["direction", "in"]}). A null or empty path means the default {@code "value"} field.</p>
 */
public final class FieldPaths {

    /** Field used when a path is omitted and when a scalar is given as event data. */
    public static final String DEFAULT_FIELD = "value";

    private FieldPaths() {}

    public static List<String> split(String fieldPath) {
        if (fieldPath == null || fieldPath.isEmpty()) {
            return List.of(DEFAULT_FIELD);
        }
        return List.of(fieldPath.split("\\."));
    }

    /**
     * Normalizes a single path given as a dotted string or a segment list.
     */
    public static List<String> toPath(Object fieldPath) {
        if (fieldPath == null) {
            return List.of(DEFAULT_FIELD);
        } else if (fieldPath instanceof String s) {
            return split(s);
        } else if (fieldPath instanceof List<?> list) {
            if (list.isEmpty()) {
                return List.of(DEFAULT_FIELD);
            }
            List<String> segments = new ArrayList<>(list.size());
            for (Object segment : list) {
                segments.add(String.valueOf(segment));
            }
            return Collections.unmodifiableList(segments);
        }
        throw new IllegalArgumentException("field path must be a string or a list of strings, got: " + fieldPath);
    }

    /**
     * Normalizes a field spec (null, a dotted string, or a list of dotted strings) to a list of
     * dotted paths.
     */
    public static List<String> toFieldSpec(Object fieldSpec) {
        if (fieldSpec == null) {
            return List.of(DEFAULT_FIELD);
        } else if (fieldSpec instanceof String s) {
            return List.of(s);
        } else if (fieldSpec instanceof List<?> list) {
            List<String> paths = new ArrayList<>(list.size());
            for (Object path : list) {
                paths.add(path instanceof List<?> segments ? join(toPath(segments)) : String.valueOf(path));
            }
            return Collections.unmodifiableList(paths);
        }
        throw new IllegalArgumentException("field spec must be a string or a list of strings, got: " + fieldSpec);
    }

    public static String join(List<String> path) {
        return String.join(".", path);
    }

    /**
     * Looks up a nested value. Returns null as soon as a segment is missing or a non-map value
     * is reached before the end of the path.
     */
    public static Object get(Map<String, Object> data, List<String> path) {
        Object current = data;
        for (String segment : path) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else {
                return null;
            }
        }
        return current;
    }

    /**
     * Whether every segment of the path exists, even if the final value is null.
     */
    public static boolean hasPath(Map<String, Object> data, List<String> path) {
        Object current = data;
        for (String segment : path) {
            if (current instanceof Map<?, ?> map && map.containsKey(segment)) {
                current = map.get(segment);
            } else {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a mutable deep copy of {@code data} with {@code value} stored at {@code path},
     * creating intermediate maps as needed.
     */
    public static Map<String, Object> with(Map<String, Object> data, List<String> path, Object value) {
        Map<String, Object> copy = thaw(data);
        setIn(copy, path, value);
        return copy;
    }

    /**
     * Stores a value at a path inside a mutable map produced by {@link #thaw(Map)}.
     */
    @SuppressWarnings("unchecked")
    public static void setIn(Map<String, Object> mutable, List<String> path, Object value) {
        Map<String, Object> current = mutable;
        for (int i = 0; i < path.size() - 1; i++) {
            Object next = current.get(path.get(i));
            if (!(next instanceof Map<?, ?>)) {
                next = new LinkedHashMap<String, Object>();
                current.put(path.get(i), next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(path.get(path.size() - 1), value);
    }

    /**
     * Collects the dotted paths of every leaf value in the map, in iteration order.
     */
    public static List<String> leafPaths(Map<String, Object> data) {
        List<String> paths = new ArrayList<>();
        collectLeafPaths(data, "", paths);
        return paths;
    }

    @SuppressWarnings("unchecked")
    private static void collectLeafPaths(Map<String, Object> data, String prefix, List<String> paths) {
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            if (entry.getValue() instanceof Map<?, ?> nested) {
                collectLeafPaths((Map<String, Object>) nested, path, paths);
            } else {
                paths.add(path);
            }
        }
    }

    /**
     * Deep, unmodifiable copy of a payload map. Integral numbers become {@link Long} and
     * {@link Float} becomes {@link Double} so that equality does not depend on the boxed type
     * a caller happened to use.
     */
    public static Map<String, Object> freeze(Map<?, ?> data) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freezeValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    public static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freeze(map);
        } else if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freezeValue(item));
            }
            return Collections.unmodifiableList(copy);
        } else if (value instanceof Object[] array) {
            return freezeValue(Arrays.asList(array));
        } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        } else if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    /**
     * Deep mutable copy of a payload map.
     */
    public static Map<String, Object> thaw(Map<String, Object> data) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            copy.put(entry.getKey(), thawValue(entry.getValue()));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object thawValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return thaw((Map<String, Object>) map);
        } else if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(thawValue(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * A value is valid unless it is null, an empty string, or NaN.
     */
    public static boolean isValid(Object value) {
        if (value == null) {
            return false;
        } else if (value instanceof String s) {
            return !s.isEmpty();
        } else if (value instanceof Double d) {
            return !d.isNaN();
        } else if (value instanceof Float f) {
            return !f.isNaN();
        }
        return true;
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Number && isValid(value);
    }
}
