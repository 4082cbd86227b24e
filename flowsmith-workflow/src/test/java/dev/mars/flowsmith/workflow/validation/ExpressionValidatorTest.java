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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionValidatorTest {

    private ExpressionValidator validator;
    private ExpressionContext context;

    @BeforeEach
    void setUp() {
        validator = new ExpressionValidator();
        context = new ExpressionContext(Set.of("Start", "Fetch"), "Fetch", true);
    }

    @Test
    void testValidExpression() {
        ExpressionValidationResult result = validator.validateExpression("={{ $json.name }}", context);

        assertTrue(result.isValid());
        assertEquals(1, result.getExpressionCount());
        assertThat(result.getUsedVariables()).containsExactly("$json");
    }

    @Test
    void testPlainTextIsIgnored() {
        ExpressionValidationResult result = validator.validateExpression("just text", context);

        assertTrue(result.getIssues().isEmpty());
        assertEquals(0, result.getExpressionCount());
    }

    @Test
    void testUnmatchedDelimiters() {
        assertThat(validator.validateExpression("={{ $json.name", context).getErrors())
                .extracting(ValidationIssue::getMessage)
                .containsExactly("Unmatched opening expression delimiter '{{'");
        assertThat(validator.validateExpression("name }}", context).getErrors())
                .extracting(ValidationIssue::getMessage)
                .containsExactly("Unmatched closing expression delimiter '}}'");
    }

    @Test
    void testNestedAndEmptyExpressions() {
        assertThat(validator.validateExpression("={{ {{ $json.a }} }}", context).getErrors())
                .extracting(ValidationIssue::getMessage)
                .anyMatch(m -> m.startsWith("Nested expressions are not supported"));
        assertThat(validator.validateExpression("={{   }}", context).getErrors())
                .extracting(ValidationIssue::getMessage)
                .containsExactly("Empty expression '{{ }}'");
    }

    @Test
    void testUnknownNodeReferences() {
        ExpressionValidationResult result = validator.validateExpression(
                "={{ $node[\"Missing\"].json.id }} and {{ $('Start').item.json.id }}", context);

        assertEquals(1, result.getErrors().size());
        assertEquals("Expression references node 'Missing' which does not exist", result.getErrors().get(0).getMessage());
        assertThat(result.getReferencedNodes()).containsExactlyInAnyOrder("Missing", "Start");
        assertEquals(2, result.getExpressionCount());
    }

    @Test
    void testUnrestrictedContextAcceptsAnyNode() {
        ExpressionValidationResult result = validator.validateExpression(
                "={{ $node[\"Anything\"].json.id }}", ExpressionContext.unrestricted());

        assertTrue(result.isValid());
    }

    @Test
    void testNegativeItemsIndex() {
        ExpressionValidationResult result = validator.validateExpression("={{ $items('Start', -1) }}", context);

        assertEquals(1, result.getErrors().size());
        assertThat(result.getErrors().get(0).getMessage()).contains("cannot be negative");
    }

    @Test
    void testTemplateLiteralSyntax() {
        assertFalse(validator.validateExpression("={{ ${value} }}", context).isValid());
        assertTrue(validator.validateExpression("={{ `id-${$json.id}` }}", context).isValid());
    }

    @Test
    void testJsonWithoutInputIsWarning() {
        ExpressionContext noInput = new ExpressionContext(Set.of("Start"), "Start", false);
        ExpressionValidationResult result = validator.validateExpression("={{ $json.id }}", noInput);

        assertTrue(result.isValid());
        assertEquals(1, result.getWarnings().size());
        assertEquals(IssueCategory.EXPRESSION, result.getWarnings().get(0).getCategory());
    }

    @Test
    void testJsonWarningIsSkippedInsideLoops() {
        ExpressionContext loop = new ExpressionContext(Set.of("Start"), "Start", false).withInLoop(true);

        ExpressionValidationResult result = validator.validateExpression("={{ $json.id }}", loop);

        assertTrue(result.getIssues().isEmpty());
        assertTrue(loop.inLoop());
        assertFalse(context.inLoop());
    }

    @Test
    void testInputWithoutInputDataIsError() {
        ExpressionContext noInput = new ExpressionContext(Set.of("Start"), "Start", false);

        ExpressionValidationResult result = validator.validateExpression("={{ $input.item.json.id }}", noInput);

        assertFalse(result.isValid());
        assertThat(result.getErrors()).extracting(ValidationIssue::getMessage)
                .containsExactly("$input is only available when the node has input data");
        assertTrue(validator.validateExpression("={{ $input.item.json.id }}", context).isValid());
    }

    @Test
    void testInputWithoutInputDataIsErrorEvenInsideLoops() {
        ExpressionContext loop = new ExpressionContext(Set.of("Start"), "Start", false, true);

        assertFalse(validator.validateExpression("={{ $input.first() }}", loop).isValid());
    }

    @Test
    void testOptionalChainingIsWarning() {
        ExpressionValidationResult result = validator.validateExpression("={{ $json.customer?.email }}", context);

        assertTrue(result.isValid());
        assertThat(result.getWarnings()).extracting(ValidationIssue::getMessage)
                .containsExactly("Optional chaining (?.) is not supported in expressions");
        assertTrue(validator.validateExpression("={{ $json.flag ? .5 : 1 }}", context).getIssues().isEmpty());
    }

    @Test
    void testMissingDollarPrefixIsWarning() {
        ExpressionValidationResult result = validator.validateExpression("={{ json.name }}", context);

        assertTrue(result.isValid());
        assertEquals(1, result.getWarnings().size());
        assertEquals(IssueCategory.EXPRESSION, result.getWarnings().get(0).getCategory());
        assertEquals("Possible missing $ prefix for variable 'json'; use $json instead of json",
                result.getWarnings().get(0).getMessage());
    }

    @Test
    void testPrefixedVariablesAndQuotedWordsAreNotFlagged() {
        assertTrue(validator.validateExpression("={{ $node[\"Start\"].json.id }}", context).getIssues().isEmpty());
        assertTrue(validator.validateExpression("={{ $('Start').item.json.id }}", context).getIssues().isEmpty());
        assertTrue(validator.validateExpression("={{ $json.type === 'node.js' }}", context).getIssues().isEmpty());
        assertTrue(validator.validateExpression("={{ $json.items.length }}", context).getIssues().isEmpty());
    }

    @Test
    void testBracketAccessIsStyleWarning() {
        ExpressionValidationResult result = validator.validateExpression("={{ $json['id'] }}", context);

        assertEquals(1, result.getWarnings().size());
        assertEquals(IssueCategory.STYLE, result.getWarnings().get(0).getCategory());
        assertEquals("Prefer dot notation $json.id over bracket access", result.getWarnings().get(0).getMessage());
    }

    @Test
    void testParameterTreePaths() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("headers", List.of("={{ $json.ok }}", "={{ $node[\"Ghost\"].json }}"));
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("url", "={{ $json.url }}");
        parameters.put("options", options);

        ExpressionValidationResult result = validator.validateParameters(parameters, context);

        assertEquals(3, result.getExpressionCount());
        assertEquals(1, result.getErrors().size());
        assertEquals("options.headers[1]", result.getErrors().get(0).getFieldPath());
    }

    @Test
    void testDeepTreeReportsDepthOnceAndShallowIssues() {
        Map<String, Object> parameters = ParameterTreeWalkerTest.nested(105);
        Map<String, Object> level = parameters;
        for (int i = 0; i < 10; i++) {
            @SuppressWarnings("unchecked")
            Map<String, Object> next = (Map<String, Object>) level.get("level");
            level = next;
        }
        level.put("broken", "={{ $json.id");

        ExpressionValidationResult result = validator.validateParameters(parameters, context);

        assertEquals(1, result.getErrors().size());
        assertThat(result.getErrors().get(0).getFieldPath()).endsWith(".broken");
        assertEquals(1, result.getWarnings().size());
        assertEquals(IssueCategory.ANOMALY, result.getWarnings().get(0).getCategory());
    }

    @Test
    void testCircularParametersTerminate() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("text", "={{ $json.a }}");
        parameters.put("self", parameters);

        ExpressionValidationResult result = validator.validateParameters(parameters, context);

        assertEquals(1, result.getExpressionCount());
        assertEquals(1, result.getWarnings().size());
        assertThat(result.getWarnings().get(0).getMessage()).contains("Circular reference");
    }
}
