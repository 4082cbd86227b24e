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


package dev.mars.flowsmith.nodetype;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeTypeNamesTest {

    @Test
    void testNormalize() {
        assertEquals("nodes-base.httpRequest", NodeTypeNames.normalize("n8n-nodes-base.httpRequest"));
        assertEquals("nodes-langchain.agent", NodeTypeNames.normalize("@n8n/n8n-nodes-langchain.agent"));
        assertEquals("nodes-base.code", NodeTypeNames.normalize("nodes-base.code"));
        assertEquals("community-nodes.custom", NodeTypeNames.normalize("community-nodes.custom"));
        assertNull(NodeTypeNames.normalize(null));
    }

    @Test
    void testToDocumentForm() {
        assertEquals("n8n-nodes-base.webhook", NodeTypeNames.toDocumentForm("nodes-base.webhook"));
        assertEquals("@n8n/n8n-nodes-langchain.agent", NodeTypeNames.toDocumentForm("nodes-langchain.agent"));
        assertEquals("n8n-nodes-base.webhook", NodeTypeNames.toDocumentForm("n8n-nodes-base.webhook"));
    }

    @Test
    void testShortFormAndPrefix() {
        assertTrue(NodeTypeNames.isShortForm("nodes-base.set"));
        assertFalse(NodeTypeNames.isShortForm("n8n-nodes-base.set"));

        assertTrue(NodeTypeNames.hasPackagePrefix("n8n-nodes-base.set"));
        assertFalse(NodeTypeNames.hasPackagePrefix("httpRequest"));
        assertFalse(NodeTypeNames.hasPackagePrefix(".httpRequest"));
        assertFalse(NodeTypeNames.hasPackagePrefix("n8n-nodes-base."));
    }

    @Test
    void testPackageAndLocalName() {
        assertEquals("n8n-nodes-base", NodeTypeNames.packageOf("n8n-nodes-base.set"));
        assertNull(NodeTypeNames.packageOf("set"));
        assertEquals("set", NodeTypeNames.localName("n8n-nodes-base.set"));
        assertEquals("set", NodeTypeNames.localName("set"));
    }

    @Test
    void testCorePackages() {
        assertTrue(NodeTypeNames.isCorePackage("n8n-nodes-base"));
        assertTrue(NodeTypeNames.isCorePackage("nodes-langchain"));
        assertTrue(NodeTypeNames.isCorePackage("@n8n/n8n-nodes-langchain"));
        assertFalse(NodeTypeNames.isCorePackage("n8n-nodes-acme"));
        assertFalse(NodeTypeNames.isCorePackage(null));
    }
}
