/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.flowsmith.model;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the nested key-value trees held in node parameters, credentials and
 * settings. Trees are built from maps, lists and scalars and may contain cycles when
 * supplied by callers; copies preserve that shape instead of recursing forever.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ParameterTrees {

    private ParameterTrees() {
    }

    /**
     * Deep copies a tree. Shared and circular references are reproduced in the copy.
     */
    public static Object deepCopy(Object value) {
        return deepCopy(value, new IdentityHashMap<>());
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyMap(Map<String, ?> map) {
        if (map == null) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) deepCopy(map);
    }

    private static Object deepCopy(Object value, IdentityHashMap<Object, Object> copies) {
        if (value instanceof Map<?, ?> map) {
            Object existing = copies.get(value);
            if (existing != null) {
                return existing;
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            copies.put(value, copy);
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue(), copies));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            Object existing = copies.get(value);
            if (existing != null) {
                return existing;
            }
            List<Object> copy = new ArrayList<>(list.size());
            copies.put(value, copy);
            for (Object item : list) {
                copy.add(deepCopy(item, copies));
            }
            return copy;
        }
        return value;
    }

    /**
     * Reads a dot-separated path such as {@code options.timeout}; absent segments yield null.
     */
    public static Object getPath(Map<String, Object> root, String path) {
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    /**
     * Writes a dot-separated path, creating intermediate maps as needed.
     *
     * @throws IllegalArgumentException if an intermediate segment holds a non-map value
     */
    @SuppressWarnings("unchecked")
    public static void setPath(Map<String, Object> root, String path, Object value) {
        String[] segments = path.split("\\.");
        Map<String, Object> current = root;
        for (int i = 0; i < segments.length - 1; i++) {
            Object next = current.get(segments[i]);
            if (next == null) {
                next = new LinkedHashMap<String, Object>();
                current.put(segments[i], next);
            } else if (!(next instanceof Map)) {
                throw new IllegalArgumentException("Cannot set '" + path + "': segment '" +
                        segments[i] + "' is not an object");
            }
            current = (Map<String, Object>) next;
        }
        current.put(segments[segments.length - 1], value);
    }

    public static String childPath(String parent, String key) {
        return parent == null || parent.isEmpty() ? key : parent + "." + key;
    }

    public static String indexPath(String parent, int index) {
        return (parent == null ? "" : parent) + "[" + index + "]";
    }
}
