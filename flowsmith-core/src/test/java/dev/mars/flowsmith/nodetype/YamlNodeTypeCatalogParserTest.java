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

import dev.mars.flowsmith.core.exceptions.WorkflowFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class YamlNodeTypeCatalogParserTest {

    private YamlNodeTypeCatalogParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlNodeTypeCatalogParser();
    }

    @Test
    void testParseCatalogResource() throws WorkflowFormatException {
        List<NodeTypeSchema> schemas = parser.parseResource("catalog/basic-catalog.yaml");

        assertEquals(2, schemas.size());

        NodeTypeSchema http = schemas.get(0);
        assertEquals("nodes-base.httpRequest", http.getNodeType());
        assertEquals("HTTP Request", http.getDisplayName());
        assertEquals(4.2, http.getLatestVersion());
        assertTrue(http.isVersioned());
        assertFalse(http.isLoopCapable());
        assertEquals(1, http.getOutputCount());
        assertThat(http.getCredentials()).containsExactly(
                new CredentialRequirement("httpBasicAuth", false),
                new CredentialRequirement("oAuth2Api", false));

        PropertySchema method = http.getProperties().get(0);
        assertEquals("method", method.getName());
        assertEquals(PropertyType.OPTIONS, method.getPropertyType().orElseThrow());
        assertEquals("GET", method.getDefaultValue());
        assertEquals(List.of("GET", "POST"), method.getOptionValues());

        assertTrue(http.getProperties().get(1).isRequired());
    }

    @Test
    void testDisplayOptionsAndNestedSchemas() throws WorkflowFormatException {
        NodeTypeSchema http = parser.parseResource("catalog/basic-catalog.yaml").get(0);

        PropertySchema jsonBody = http.getProperties().get(2);
        assertEquals(List.of(true), jsonBody.getDisplayOptions().getShow().get("sendBody"));
        assertEquals(List.of(1), jsonBody.getDisplayOptions().getHide().get(DisplayOptions.VERSION_FIELD));

        PropertySchema options = http.getProperties().get(3);
        assertEquals(1, options.getProperties().size());
        assertEquals("timeout", options.getProperties().get(0).getName());

        PropertySchema bodyParameters = http.getProperties().get(4);
        assertTrue(bodyParameters.isMultipleValues());
        assertEquals(1, bodyParameters.getGroups().size());
        assertEquals("parameters", bodyParameters.getGroups().get(0).name());
        assertTrue(bodyParameters.getGroups().get(0).values().get(0).isRequired());
    }

    @Test
    void testLoopCapableTypeWithNamedOutputsAndMalformedProperty() throws WorkflowFormatException {
        NodeTypeSchema loop = parser.parseResource("catalog/basic-catalog.yaml").get(1);

        assertTrue(loop.isLoopCapable());
        assertEquals(2, loop.getOutputCount());
        assertEquals("loop", loop.getOutputName(1));
        assertEquals(1, loop.getProperties().size());
        assertFalse(loop.getProperties().get(0).isWellFormed());
    }

    @Test
    void testAiToolFlag() throws WorkflowFormatException {
        String yaml = """
                nodeTypes:
                  - nodeType: n8n-nodes-acme.lookup
                    packageName: n8n-nodes-acme
                    aiTool: true
                  - nodeType: n8n-nodes-acme.report
                """;

        List<NodeTypeSchema> schemas = parser.parseFromString(yaml);

        assertTrue(schemas.get(0).isAiTool());
        assertEquals("n8n-nodes-acme", schemas.get(0).getPackageName());
        assertFalse(schemas.get(1).isAiTool());
    }

    @Test
    void testMissingNodeTypeName() {
        String yaml = """
                nodeTypes:
                  - displayName: Nameless
                """;

        WorkflowFormatException e = assertThrows(WorkflowFormatException.class, () -> parser.parseFromString(yaml));
        assertEquals("nodeTypes[0].nodeType", e.getFieldPath());
    }

    @Test
    void testMissingNodeTypesList() {
        assertThrows(WorkflowFormatException.class, () -> parser.parseFromString("other: 1"));
        assertThrows(WorkflowFormatException.class, () -> parser.parseFromString(""));
    }

    @Test
    void testInvalidYaml() {
        assertThrows(WorkflowFormatException.class, () -> parser.parseFromString("nodeTypes: [unclosed"));
    }

    @Test
    void testMissingResource() {
        assertThrows(WorkflowFormatException.class, () -> parser.parseResource("catalog/does-not-exist.yaml"));
    }
}
