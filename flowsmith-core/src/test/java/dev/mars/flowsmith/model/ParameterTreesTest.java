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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterTreesTest {

    @Test
    void testDeepCopyIsIndependent() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("timeout", 30);
        List<Object> headers = new ArrayList<>(List.of("a", "b"));
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("options", nested);
        root.put("headers", headers);

        Map<String, Object> copy = ParameterTrees.copyMap(root);
        nested.put("timeout", 60);
        headers.add("c");

        assertEquals(30, ParameterTrees.getPath(copy, "options.timeout"));
        assertEquals(List.of("a", "b"), copy.get("headers"));
    }

    @Test
    void testDeepCopyPreservesCycles() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("self", root);

        Map<String, Object> copy = ParameterTrees.copyMap(root);

        assertNotSame(root, copy);
        assertSame(copy, copy.get("self"));
    }

    @Test
    void testGetPath() {
        Map<String, Object> root = Map.of("options", Map.of("redirect", Map.of("follow", true)));

        assertEquals(true, ParameterTrees.getPath(root, "options.redirect.follow"));
        assertNull(ParameterTrees.getPath(root, "options.missing.follow"));
        assertNull(ParameterTrees.getPath(root, "options.redirect.follow.deeper"));
    }

    @Test
    void testSetPathCreatesIntermediateMaps() {
        Map<String, Object> root = new LinkedHashMap<>();

        ParameterTrees.setPath(root, "options.timeout", 10);

        assertEquals(10, ParameterTrees.getPath(root, "options.timeout"));
    }

    @Test
    void testSetPathThroughScalarFails() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("url", "https://example.com");

        assertThrows(IllegalArgumentException.class, () -> ParameterTrees.setPath(root, "url.host", "x"));
    }

    @Test
    void testPathHelpers() {
        assertEquals("body", ParameterTrees.childPath(null, "body"));
        assertEquals("body.headers", ParameterTrees.childPath("body", "headers"));
        assertEquals("body.headers[2]", ParameterTrees.indexPath("body.headers", 2));
    }
}
