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


package dev.mars.flowsmith.workflow.validation;

import dev.mars.flowsmith.nodetype.InMemoryNodeTypeRepository;
import dev.mars.flowsmith.nodetype.NodeTypeSchema;
import dev.mars.flowsmith.workflow.TestCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class NodeConfigValidatorTest {

    private InMemoryNodeTypeRepository repository;
    private NodeConfigValidator validator;

    @BeforeEach
    void setUp() {
        repository = TestCatalog.repository();
        validator = new NodeConfigValidator();
    }

    @Test
    void testValidHttpRequest() {
        NodeConfigResult result = validator.validate(schema("nodes-base.httpRequest"),
                Map.of("method", "GET", "url", "https://example.com"), ValidationProfile.RUNTIME);

        assertTrue(result.isValid(), result.toString());
        assertTrue(result.getIssues().isEmpty());
        assertThat(result.getVisibleProperties()).contains("method", "url", "sendBody", "options");
        assertThat(result.getHiddenProperties()).contains("contentType", "jsonBody", "bodyParameters");
    }

    @Test
    void testMissingRequiredProperty() {
        NodeConfigResult result = validator.validate(schema("nodes-base.httpRequest"),
                Map.of("method", "GET"), ValidationProfile.MINIMAL);

        assertEquals(1, result.getErrors().size());
        ValidationIssue issue = result.getErrors().get(0);
        assertEquals(IssueCategory.REQUIRED, issue.getCategory());
        assertEquals("url", issue.getFieldPath());
        assertEquals("Required property 'URL' is missing", issue.getMessage());
    }

    @Test
    void testHiddenRequiredPropertyIsNotReported() {
        NodeConfigResult hidden = validator.validate(schema("nodes-base.httpRequest"),
                Map.of("method", "POST", "url", "https://example.com", "sendBody", false), ValidationProfile.RUNTIME);
        assertTrue(hidden.isValid());

        NodeConfigResult shown = validator.validate(schema("nodes-base.httpRequest"),
                body("json", null), ValidationProfile.RUNTIME);
        assertEquals(1, shown.getErrors().size());
        assertEquals("jsonBody", shown.getErrors().get(0).getFieldPath());
    }

    @Test
    void testInvalidJsonBody() {
        Map<String, Object> parameters = body("json", "{\"broken\": ");

        NodeConfigResult result = validator.validate(schema("nodes-base.httpRequest"), parameters, ValidationProfile.RUNTIME);

        assertEquals(1, result.getErrors().size());
        assertEquals(IssueCategory.TYPE, result.getErrors().get(0).getCategory());
        assertThat(result.getErrors().get(0).getMessage()).contains("does not contain valid JSON");
    }

    @Test
    void testInvalidOptionSuggestsCaseFix() {
        NodeConfigResult result = validator.validate(schema("nodes-base.httpRequest"),
                Map.of("method", "post", "url", "https://example.com", "sendBody", true, "contentType", "json",
                        "jsonBody", "{}"),
                ValidationProfile.RUNTIME);

        assertEquals(1, result.getErrors().size());
        ValidationIssue issue = result.getErrors().get(0);
        assertEquals("method", issue.getFieldPath());
        assertEquals("POST", issue.getSuggestedValue());
    }

    @Test
    void testTypeMismatchInCollection() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("timeout", "soon");
        options.put("retries", 3);

        NodeConfigResult runtime = validator.validate(schema("nodes-base.httpRequest"),
                Map.of("method", "GET", "url", "https://example.com", "options", options), ValidationProfile.RUNTIME);
        assertEquals(1, runtime.getErrors().size());
        assertEquals("options.timeout", runtime.getErrors().get(0).getFieldPath());
        assertEquals("Property 'Timeout' expects a number but got a string", runtime.getErrors().get(0).getMessage());

        NodeConfigResult strict = validator.validate(schema("nodes-base.httpRequest"),
                Map.of("method", "GET", "url", "https://example.com", "options", options), ValidationProfile.STRICT);
        assertThat(strict.getErrors()).extracting(ValidationIssue::getFieldPath)
                .containsExactlyInAnyOrder("options.timeout", "options.retries");
    }

    @Test
    void testFixedCollectionRequiredField() {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("value", "x");
        Map<String, Object> parameters = body("form-urlencoded", null);
        parameters.remove("jsonBody");
        parameters.put("bodyParameters", Map.of("parameters", List.of(entry)));

        NodeConfigResult result = validator.validate(schema("nodes-base.httpRequest"), parameters, ValidationProfile.RUNTIME);

        assertEquals(1, result.getErrors().size());
        assertEquals("bodyParameters.parameters[0].name", result.getErrors().get(0).getFieldPath());
        assertEquals(IssueCategory.REQUIRED, result.getErrors().get(0).getCategory());
    }

    @Test
    void testExpressionValuesSkipTypeChecks() {
        NodeConfigResult result = validator.validate(schema("nodes-base.httpRequest"),
                Map.of("method", "={{ $json.method }}", "url", "={{ $json.url }}"), ValidationProfile.STRICT);

        assertTrue(result.isValid(), result.toString());
    }

    @Test
    void testConfiguredButHiddenPropertyIsStyleWarning() {
        Map<String, Object> parameters = Map.of("method", "GET", "url", "https://example.com", "jsonBody", "{}");

        assertTrue(validator.validate(schema("nodes-base.httpRequest"), parameters, ValidationProfile.RUNTIME)
                .getWarnings().isEmpty());

        NodeConfigResult strict = validator.validate(schema("nodes-base.httpRequest"), parameters, ValidationProfile.STRICT);
        assertEquals(1, strict.getErrors().size());
        assertEquals(IssueCategory.STYLE, strict.getErrors().get(0).getCategory());
    }

    @Test
    void testMalformedPropertiesAreSkippedWithAnomalies() {
        NodeConfigResult result = validator.validate(schema("nodes-base.malformedExample"),
                Map.of("valid", "ok"), ValidationProfile.RUNTIME);

        assertTrue(result.isValid());
        assertEquals(2, result.getWarnings().size());
        assertThat(result.getWarnings()).allMatch(w -> w.getCategory() == IssueCategory.ANOMALY);
        assertEquals(List.of("valid"), result.getVisibleProperties());

        NodeConfigResult minimal = validator.validate(schema("nodes-base.malformedExample"),
                Map.of("valid", "ok"), ValidationProfile.MINIMAL);
        assertTrue(minimal.getIssues().isEmpty());
    }

    @Test
    void testAiFriendlyGuidance() {
        NodeConfigResult result = validator.validate(schema("nodes-base.httpRequest"),
                Map.of("method", "GET"), ValidationProfile.AI_FRIENDLY);

        assertThat(result.getNextSteps()).contains("Add the required properties: url");
        assertEquals("GET", result.getExampleConfig().get("method"));
        assertEquals("<url>", result.getExampleConfig().get("url"));

        NodeConfigResult runtime = validator.validate(schema("nodes-base.httpRequest"),
                Map.of("method", "GET"), ValidationProfile.RUNTIME);
        assertTrue(runtime.getNextSteps().isEmpty());
    }

    @Test
    void testVersionSpecificVisibility() {
        NodeTypeSchema slack = schema("nodes-base.slack");

        NodeConfigResult message = validator.validate(slack, Map.of("resource", "message"), 2.2, ValidationProfile.RUNTIME);
        assertThat(message.getErrors()).extracting(ValidationIssue::getFieldPath).containsExactly("channelId");

        NodeConfigResult channel = validator.validate(slack, Map.of("resource", "channel"), 2.2, ValidationProfile.RUNTIME);
        assertTrue(channel.isValid());
    }

    @Test
    void testCodeNodeRules() {
        NodeTypeSchema code = schema("nodes-base.code");

        NodeConfigResult empty = validator.validate(code, Map.of("language", "javaScript", "jsCode", "  "),
                ValidationProfile.RUNTIME);
        assertThat(empty.getErrors()).extracting(ValidationIssue::getMessage).contains("Code cannot be empty");

        NodeConfigResult noReturn = validator.validate(code, Map.of("language", "javaScript", "jsCode", "const a = 1;"),
                ValidationProfile.RUNTIME);
        assertEquals(1, noReturn.getErrors().size());
        assertEquals(IssueCategory.EXECUTION, noReturn.getErrors().get(0).getCategory());

        NodeConfigResult python = validator.validate(code, Map.of("language", "python", "pythonCode", "return items"),
                ValidationProfile.RUNTIME);
        assertTrue(python.isValid(), python.toString());
    }

    @Test
    void testWebhookPathRules() {
        NodeTypeSchema webhook = schema("nodes-base.webhook");

        NodeConfigResult missing = validator.validate(webhook, Map.of("httpMethod", "GET"), ValidationProfile.RUNTIME);
        assertThat(missing.getErrors()).extracting(ValidationIssue::getCategory)
                .containsExactlyInAnyOrder(IssueCategory.REQUIRED, IssueCategory.EXECUTION);

        NodeConfigResult slash = validator.validate(webhook, Map.of("path", "/orders"), ValidationProfile.STRICT);
        assertEquals(1, slash.getErrors().size());
        assertEquals("orders", slash.getErrors().get(0).getSuggestedValue());
    }

    @Test
    void testHttpRequestRules() {
        NodeTypeSchema http = schema("nodes-base.httpRequest");

        NodeConfigResult noScheme = validator.validate(http, Map.of("method", "GET", "url", "example.com/api"),
                ValidationProfile.RUNTIME);
        assertEquals(1, noScheme.getErrors().size());
        assertEquals("https://example.com/api", noScheme.getErrors().get(0).getSuggestedValue());

        NodeConfigResult ftp = validator.validate(http, Map.of("method", "GET", "url", "ftp://example.com"),
                ValidationProfile.RUNTIME);
        assertEquals(1, ftp.getErrors().size());
        assertNull(ftp.getErrors().get(0).getSuggestedValue());

        NodeConfigResult post = validator.validate(http, Map.of("method", "POST", "url", "https://example.com"),
                ValidationProfile.STRICT);
        assertThat(post.getErrors()).extracting(ValidationIssue::getMessage)
                .containsExactly("POST request does not send a body");
    }

    @Test
    void testDatabaseQueryRule() {
        NodeTypeSchema postgres = schema("nodes-base.postgres");

        NodeConfigResult delete = validator.validate(postgres,
                Map.of("operation", "executeQuery", "query", "DELETE FROM users"), ValidationProfile.RUNTIME);
        assertTrue(delete.isValid());
        assertEquals(1, delete.getWarnings().size());
        assertEquals(IssueCategory.SECURITY, delete.getWarnings().get(0).getCategory());

        NodeConfigResult scoped = validator.validate(postgres,
                Map.of("operation", "executeQuery", "query", "DELETE FROM users WHERE id = 1"), ValidationProfile.RUNTIME);
        assertTrue(scoped.getWarnings().isEmpty());

        NodeConfigResult interpolated = validator.validate(postgres,
                Map.of("operation", "executeQuery", "query", "=SELECT * FROM users WHERE id = {{ $json.id }}"),
                ValidationProfile.RUNTIME);
        assertThat(interpolated.getWarnings()).extracting(ValidationIssue::getMessage)
                .anyMatch(m -> m.contains("injection"));
    }

    @Test
    void testHardcodedSecret() {
        NodeConfigResult result = validator.validate(schema("nodes-base.noOp"),
                Map.of("apiKey", "sk-live-1234567890"), ValidationProfile.RUNTIME);

        assertEquals(1, result.getWarnings().size());
        assertEquals(IssueCategory.SECURITY, result.getWarnings().get(0).getCategory());
        assertEquals("apiKey", result.getWarnings().get(0).getFieldPath());

        NodeConfigResult expression = validator.validate(schema("nodes-base.noOp"),
                Map.of("apiKey", "={{ $env.API_KEY }}"), ValidationProfile.RUNTIME);
        assertTrue(expression.getWarnings().isEmpty());
    }

    private NodeTypeSchema schema(String type) {
        return repository.getNodeType(type).orElseThrow();
    }

    private static Map<String, Object> body(String contentType, String jsonBody) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("method", "POST");
        parameters.put("url", "https://example.com");
        parameters.put("sendBody", true);
        parameters.put("contentType", contentType);
        if (jsonBody != null) {
            parameters.put("jsonBody", jsonBody);
        }
        return parameters;
    }
}
