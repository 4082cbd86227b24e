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

import dev.mars.flowsmith.model.ConnectionTarget;
import dev.mars.flowsmith.model.WorkflowConnections;
import dev.mars.flowsmith.model.WorkflowDocument;
import dev.mars.flowsmith.model.WorkflowNode;
import dev.mars.flowsmith.workflow.TestCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static dev.mars.flowsmith.workflow.TestCatalog.httpRequest;
import static dev.mars.flowsmith.workflow.TestCatalog.manualTrigger;
import static dev.mars.flowsmith.workflow.TestCatalog.node;
import static dev.mars.flowsmith.workflow.TestCatalog.noOp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class WorkflowGraphValidatorTest {

    private WorkflowGraphValidator validator;

    @BeforeEach
    void setUp() {
        validator = new WorkflowGraphValidator(TestCatalog.repository());
    }

    @Test
    void testValidWorkflow() {
        WorkflowDocument document = workflow(
                WorkflowConnections.builder().main("Start", "Fetch").build(),
                manualTrigger("Start"), httpRequest("Fetch", "https://example.com"));

        ValidationReport report = validator.validate(document);

        assertTrue(report.isValid(), report.toString());
        assertEquals(0, report.getWarningCount(), report.toString());
        assertEquals(2, report.getStatistics().getTotalNodes());
        assertEquals(2, report.getStatistics().getEnabledNodes());
        assertEquals(1, report.getStatistics().getTriggerNodes());
        assertEquals(1, report.getStatistics().getValidConnections());
        assertEquals(0, report.getStatistics().getInvalidConnections());
    }

    @Test
    void testEmptyWorkflowIsValidWithOneWarning() {
        ValidationReport report = validator.validate(WorkflowDocument.builder().name("Empty").build());

        assertTrue(report.isValid());
        assertEquals(1, report.getWarningCount());
        assertEquals("Workflow has no nodes", report.getWarnings().get(0).getMessage());
    }

    @Test
    void testValidationIsDeterministicAndPure() {
        WorkflowDocument document = workflow(
                WorkflowConnections.builder().main("Start", "Fetch").main("Fetch", "Ghost").build(),
                manualTrigger("Start"), httpRequest("Fetch", "example.com"), noOp("Orphan"));
        WorkflowDocument copy = document.toBuilder().build();

        ValidationReport first = validator.validate(document, ValidationOptions.forProfile(ValidationProfile.STRICT));
        ValidationReport second = validator.validate(document, ValidationOptions.forProfile(ValidationProfile.STRICT));

        assertEquals(first, second);
        assertEquals(copy, document);
        assertFalse(first.isValid());
    }

    @Test
    void testDuplicateNames() {
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Step").build(),
                manualTrigger("Start"), noOp("Step"), noOp("Step").toBuilder().id("other").build());

        ValidationReport report = validator.validate(document);

        assertThat(report.getErrors()).extracting(ValidationIssue::getMessage)
                .contains("Duplicate node name 'Step'; node names must be unique");
    }

    @Test
    void testShortFormTypeIsRejectedWithFullFormSuggestion() {
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Fetch").build(),
                manualTrigger("Start"),
                httpRequest("Fetch", "https://example.com").toBuilder().type("nodes-base.httpRequest").build());

        ValidationReport report = validator.validate(document);

        ValidationIssue issue = onlyError(report);
        assertEquals("Fetch", issue.getNodeName());
        assertEquals("type", issue.getFieldPath());
        assertEquals("n8n-nodes-base.httpRequest", issue.getSuggestedValue());
        assertThat(issue.getMessage()).contains("must use the full type name 'n8n-nodes-base.httpRequest'");
    }

    @Test
    void testUnknownTypeSuggestsCloseMatch() {
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Fetch").build(),
                manualTrigger("Start"),
                node("Fetch", "n8n-nodes-base.httpRequst", 1, Map.of()));

        ValidationReport report = validator.validate(document);

        ValidationIssue issue = onlyError(report);
        assertThat(issue.getMessage()).startsWith("Unknown node type 'n8n-nodes-base.httpRequst'; did you mean");
        assertEquals("n8n-nodes-base.httpRequest", issue.getSuggestedValue());
    }

    @Test
    void testTypeWithoutPackagePrefix() {
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Fetch").build(),
                manualTrigger("Start"), node("Fetch", "httpRequest", 4.2, Map.of()));

        ValidationReport report = validator.validate(document);

        assertThat(onlyError(report).getMessage()).contains("is missing its package prefix");
    }

    @Test
    void testTypeVersionChecks() {
        WorkflowNode outdated = httpRequest("Old", "https://example.com").toBuilder().typeVersion(4.0).build();
        WorkflowNode future = httpRequest("Future", "https://example.com").toBuilder().typeVersion(5.0).build();
        WorkflowNode missing = httpRequest("Unversioned", "https://example.com").toBuilder()
                .typeVersion((Double) null).build();
        WorkflowDocument document = workflow(WorkflowConnections.builder()
                        .main("Start", "Old").main("Old", "Future").main("Future", "Unversioned").build(),
                manualTrigger("Start"), outdated, future, missing);

        ValidationReport report = validator.validate(document);

        assertThat(report.getWarnings()).extracting(ValidationIssue::getMessage)
                .contains("Outdated typeVersion 4; the latest version is 4.2");
        assertThat(report.getErrors()).extracting(ValidationIssue::getNodeName)
                .containsExactlyInAnyOrder("Future", "Unversioned");
        assertThat(report.getIssuesForNode("Future").get(0).getSuggestedValue()).isEqualTo(4.2);
    }

    @Test
    void testNegativeTargetIndexNamesTheNode() {
        WorkflowConnections connections = WorkflowConnections.builder()
                .add("Start", ConnectionTarget.MAIN, 0, new ConnectionTarget("Fetch", ConnectionTarget.MAIN, -1))
                .build();
        WorkflowDocument document = workflow(connections, manualTrigger("Start"), httpRequest("Fetch", "https://example.com"));

        ValidationReport report = validator.validate(document);

        ValidationIssue issue = onlyError(report);
        assertEquals(IssueCategory.CONNECTION, issue.getCategory());
        assertEquals("Start", issue.getNodeName());
        assertEquals("connections.Start.main[0][0].index", issue.getFieldPath());
        assertEquals("Invalid connection from 'Start' (main[0]) to 'Fetch': input index -1 must be a non-negative integer",
                issue.getMessage());
        assertEquals(1, report.getStatistics().getInvalidConnections());
    }

    @Test
    void testMissingTargetAndIdReference() {
        WorkflowDocument document = workflow(WorkflowConnections.builder()
                        .main("Start", "Ghost").main("Start", "fetch").build(),
                manualTrigger("Start"), httpRequest("Fetch", "https://example.com"));

        ValidationReport report = validator.validate(document);

        assertThat(report.getErrors()).extracting(ValidationIssue::getMessage)
                .contains("Connection target 'Ghost' does not exist");
        ValidationIssue idReference = report.getErrors().stream()
                .filter(e -> e.getMessage().contains("is a node id"))
                .findFirst().orElseThrow();
        assertEquals("Fetch", idReference.getSuggestedValue());
        assertEquals(2, report.getStatistics().getInvalidConnections());
    }

    @Test
    void testOutputIndexOutOfRange() {
        WorkflowNode check = node("Check", "n8n-nodes-base.if", 2, Map.of());
        WorkflowConnections connections = WorkflowConnections.builder()
                .main("Start", "Check")
                .add("Check", ConnectionTarget.MAIN, 0, ConnectionTarget.main("Yes"))
                .add("Check", ConnectionTarget.MAIN, 2, ConnectionTarget.main("No"))
                .build();

        ValidationReport report = validator.validate(workflow(connections, manualTrigger("Start"), check,
                noOp("Yes"), noOp("No")));

        ValidationIssue issue = onlyError(report);
        assertEquals("connections.Check.main[2]", issue.getFieldPath());
        assertThat(issue.getMessage()).contains("has 2 outputs (true, false)");

        WorkflowNode withErrorOutput = check.toBuilder().onError(WorkflowGraphValidator.CONTINUE_ERROR_OUTPUT).build();
        assertTrue(validator.validate(workflow(connections, manualTrigger("Start"), withErrorOutput,
                noOp("Yes"), noOp("No"))).isValid());
    }

    @Test
    void testUnconnectedErrorOutput() {
        WorkflowNode fetch = httpRequest("Fetch", "https://example.com").toBuilder()
                .onError(WorkflowGraphValidator.CONTINUE_ERROR_OUTPUT).build();
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Fetch").build(),
                manualTrigger("Start"), fetch);

        ValidationReport report = validator.validate(document);

        assertThat(report.getWarnings()).extracting(ValidationIssue::getMessage)
                .containsExactly("onError is 'continueErrorOutput' but the error output is not connected");
    }

    @Test
    void testSelfReferenceAllowedForLoopCapableTypes() {
        WorkflowNode loop = node("Loop", "n8n-nodes-base.splitInBatches", 3, Map.of("batchSize", 5));
        WorkflowConnections connections = WorkflowConnections.builder()
                .main("Start", "Loop")
                .add("Loop", ConnectionTarget.MAIN, 1, ConnectionTarget.main("Loop"))
                .build();

        ValidationReport report = validator.validate(workflow(connections, manualTrigger("Start"), loop),
                ValidationOptions.forProfile(ValidationProfile.STRICT));

        assertTrue(report.isValid(), report.toString());
        assertEquals(0, selfReferenceIssues(report).size());
    }

    @Test
    void testSelfReferenceWarningForOrdinaryTypes() {
        WorkflowConnections connections = WorkflowConnections.builder()
                .main("Start", "Work")
                .main("Work", "Work")
                .build();
        WorkflowDocument document = workflow(connections, manualTrigger("Start"), noOp("Work"));

        ValidationReport runtime = validator.validate(document);
        assertTrue(runtime.isValid());
        assertEquals(1, selfReferenceIssues(runtime).size());
        assertEquals(ValidationIssue.Severity.WARNING, selfReferenceIssues(runtime).get(0).getSeverity());

        ValidationReport strict = validator.validate(document, ValidationOptions.forProfile(ValidationProfile.STRICT));
        assertFalse(strict.isValid());
        assertEquals(1, selfReferenceIssues(strict).size());
        assertEquals(ValidationIssue.Severity.ERROR, selfReferenceIssues(strict).get(0).getSeverity());
    }

    @Test
    void testCycleWithoutLoopNodeIsError() {
        WorkflowConnections connections = WorkflowConnections.builder()
                .main("Start", "A").main("A", "B").main("B", "A")
                .build();

        ValidationReport report = validator.validate(workflow(connections, manualTrigger("Start"), noOp("A"), noOp("B")));

        ValidationIssue issue = onlyError(report);
        assertEquals(IssueCategory.CONNECTION, issue.getCategory());
        assertThat(issue.getMessage()).startsWith("Workflow contains a cycle between nodes A, B");
    }

    @Test
    void testCycleThroughLoopNodeIsAllowed() {
        WorkflowNode loop = node("Loop", "n8n-nodes-base.splitInBatches", 3, Map.of());
        WorkflowConnections connections = WorkflowConnections.builder()
                .main("Start", "Loop")
                .add("Loop", ConnectionTarget.MAIN, 1, ConnectionTarget.main("Process"))
                .main("Process", "Loop")
                .build();

        ValidationReport report = validator.validate(workflow(connections, manualTrigger("Start"), loop, noOp("Process")));

        assertTrue(report.isValid(), report.toString());
    }

    @Test
    void testLongLinearChainWarning() {
        ValidationReport eleven = validator.validate(chain(10));
        ValidationReport ten = validator.validate(chain(9));

        assertTrue(eleven.isValid(), eleven.toString());
        ValidationIssue issue = eleven.getWarnings().get(0);
        assertEquals(1, eleven.getWarningCount(), eleven.toString());
        assertEquals(IssueCategory.TOPOLOGY, issue.getCategory());
        assertThat(issue.getMessage()).startsWith("Long linear chain detected (11 nodes)");
        assertEquals(0, ten.getWarningCount(), ten.toString());
    }

    @Test
    void testLongestChainFollowsTheLongerBranch() {
        WorkflowConnections.Builder connections = WorkflowConnections.builder().main("Start", "Short").main("Start", "Step 1");
        List<WorkflowNode> nodes = new ArrayList<>(List.of(manualTrigger("Start"), noOp("Short")));
        for (int i = 1; i <= 10; i++) {
            nodes.add(noOp("Step " + i));
            if (i > 1) {
                connections.main("Step " + (i - 1), "Step " + i);
            }
        }

        ValidationReport report = validator.validate(workflow(connections.build(), nodes.toArray(new WorkflowNode[0])));

        assertThat(report.getWarnings()).extracting(ValidationIssue::getMessage)
                .anyMatch(m -> m.startsWith("Long linear chain detected (11 nodes)"));
    }

    @Test
    void testAgentWithoutToolsWarns() {
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Agent").build(),
                manualTrigger("Start"), agent("Agent"));

        ValidationReport report = validator.validate(document);

        assertTrue(report.isValid(), report.toString());
        assertEquals(1, report.getWarningCount(), report.toString());
        ValidationIssue issue = report.getWarnings().get(0);
        assertEquals("Agent", issue.getNodeName());
        assertEquals(IssueCategory.EXECUTION, issue.getCategory());
        assertThat(issue.getMessage()).startsWith("AI Agent has no tools connected");
        assertThat(report.getSuggestions()).noneMatch(s -> s.contains("N8N_COMMUNITY_PACKAGES_ALLOW_TOOL_USAGE"));
    }

    @Test
    void testAgentWithCoreToolHasNoWarnings() {
        WorkflowNode calculator = node("Calculator", "@n8n/n8n-nodes-langchain.toolCalculator", 1, Map.of());
        WorkflowDocument document = workflow(WorkflowConnections.builder()
                        .main("Start", "Agent")
                        .add("Calculator", ConnectionTarget.AI_TOOL, 0,
                                new ConnectionTarget("Agent", ConnectionTarget.AI_TOOL, 0))
                        .build(),
                manualTrigger("Start"), agent("Agent"), calculator);

        ValidationReport report = validator.validate(document);

        assertTrue(report.isValid(), report.toString());
        assertEquals(0, report.getWarningCount(), report.toString());
        assertThat(report.getSuggestions()).contains(
                "For community nodes used as AI tools, ensure N8N_COMMUNITY_PACKAGES_ALLOW_TOOL_USAGE=true is set");
    }

    @Test
    void testCommunityNodeUsedAsToolWarns() {
        WorkflowNode lookup = node("Lookup", "n8n-nodes-acme.lookup", 1, Map.of());
        WorkflowDocument document = workflow(WorkflowConnections.builder()
                        .main("Start", "Agent")
                        .add("Lookup", ConnectionTarget.AI_TOOL, 0,
                                new ConnectionTarget("Agent", ConnectionTarget.AI_TOOL, 0))
                        .build(),
                manualTrigger("Start"), agent("Agent"), lookup);

        ValidationReport report = validator.validate(document);

        assertTrue(report.isValid(), report.toString());
        assertEquals(1, report.getWarningCount(), report.toString());
        ValidationIssue issue = report.getWarnings().get(0);
        assertEquals("Lookup", issue.getNodeName());
        assertEquals("Community node 'Lookup' is being used as an AI tool; ensure " +
                "N8N_COMMUNITY_PACKAGES_ALLOW_TOOL_USAGE=true is set", issue.getMessage());
        assertThat(report.getSuggestions()).contains(
                "For community nodes used as AI tools, ensure N8N_COMMUNITY_PACKAGES_ALLOW_TOOL_USAGE=true is set");
    }

    @Test
    void testMultiNodeWithoutConnections() {
        ValidationReport report = validator.validate(workflow(WorkflowConnections.empty(),
                manualTrigger("Start"), noOp("Other")));

        ValidationIssue issue = onlyError(report);
        assertEquals(IssueCategory.STRUCTURE, issue.getCategory());
        assertThat(issue.getMessage()).startsWith("Multi-node workflow has no connections");
    }

    @Test
    void testOrphanAndStickyNote() {
        WorkflowNode sticky = node("Note", "n8n-nodes-base.stickyNote", 1, Map.of("content", "Read me"));
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "A").build(),
                manualTrigger("Start"), noOp("A"), noOp("B"), sticky);

        ValidationReport report = validator.validate(document);

        assertTrue(report.isValid());
        assertThat(report.getWarnings()).extracting(ValidationIssue::getMessage)
                .containsExactly("Node 'B' is not connected to any other node");
        assertEquals(3, report.getStatistics().getEnabledNodes());
    }

    @Test
    void testNoTriggerWarningAndSuggestion() {
        ValidationReport report = validator.validate(workflow(WorkflowConnections.empty(), noOp("Only")));

        assertThat(report.getWarnings()).extracting(ValidationIssue::getMessage)
                .containsExactly("Workflow has no trigger node; it can only be started manually");
        assertThat(report.getSuggestions()).anyMatch(s -> s.startsWith("Add a trigger node"));
    }

    @Test
    void testDisabledNodeIsNotValidated() {
        WorkflowNode disabled = httpRequest("Fetch", "not a url").toBuilder().disabled(true).build();
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Fetch").build(),
                manualTrigger("Start"), disabled);

        ValidationReport report = validator.validate(document);

        assertTrue(report.isValid());
        assertThat(report.getWarnings()).extracting(ValidationIssue::getMessage)
                .containsExactly("Connection to disabled node 'Fetch'");
        assertEquals(1, report.getStatistics().getEnabledNodes());
    }

    @Test
    void testExecutionControlChecks() {
        WorkflowNode fetch = httpRequest("Fetch", "https://example.com").toBuilder()
                .onError("continue")
                .continueOnFail(true)
                .maxTries(0)
                .build();
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Fetch").build(),
                manualTrigger("Start"), fetch);

        ValidationReport report = validator.validate(document);

        assertThat(report.getErrors()).extracting(ValidationIssue::getFieldPath)
                .containsExactlyInAnyOrder("onError", "continueOnFail", "maxTries");
        ValidationIssue onError = report.getErrors().stream()
                .filter(e -> "onError".equals(e.getFieldPath())).findFirst().orElseThrow();
        assertEquals(WorkflowGraphValidator.CONTINUE_REGULAR_OUTPUT, onError.getSuggestedValue());
        assertThat(report.getWarnings()).extracting(ValidationIssue::getFieldPath).contains("retryOnFail");
    }

    @Test
    void testNodeLevelPropertyInsideParameters() {
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Work").build(),
                manualTrigger("Start"), node("Work", "n8n-nodes-base.noOp", 1, Map.of("onError", "stopWorkflow")));

        ValidationIssue issue = onlyError(validator.validate(document));

        assertEquals("parameters.onError", issue.getFieldPath());
    }

    @Test
    void testCredentialChecks() {
        WorkflowNode withoutCredential = node("Query", "n8n-nodes-base.postgres", 1,
                Map.of("operation", "executeQuery", "query", "SELECT 1"));
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Query").build(),
                manualTrigger("Start"), withoutCredential);

        ValidationIssue issue = onlyError(validator.validate(document));
        assertEquals(IssueCategory.EXECUTION, issue.getCategory());
        assertEquals("Node type nodes-base.postgres requires credential 'postgres'", issue.getMessage());

        WorkflowNode withoutId = withoutCredential.toBuilder()
                .credentials(Map.of("postgres", Map.of("name", "Production DB")))
                .build();
        ValidationReport report = validator.validate(workflow(
                WorkflowConnections.builder().main("Start", "Query").build(), manualTrigger("Start"), withoutId));
        assertTrue(report.isValid());
        assertEquals("credentials.postgres", report.getWarnings().get(0).getFieldPath());
    }

    @Test
    void testExpressionWithoutPrefix() {
        WorkflowNode work = node("Work", "n8n-nodes-base.noOp", 1, Map.of("text", "{{ $env.API_KEY }}"));
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Work").build(),
                manualTrigger("Start"), work);

        ValidationReport report = validator.validate(document);

        ValidationIssue issue = onlyError(report);
        assertEquals("Work", issue.getNodeName());
        assertEquals("text", issue.getFieldPath());
        assertEquals("={{ $env.API_KEY }}", issue.getSuggestedValue());
        assertEquals(1, report.getStatistics().getExpressionsValidated());
    }

    @Test
    void testJsonWarningIsSkippedForLoopNodes() {
        WorkflowNode loop = node("Loop", "n8n-nodes-base.splitInBatches", 3, Map.of("note", "={{ $json.size }}"));
        WorkflowNode plain = node("Plain", "n8n-nodes-base.noOp", 1, Map.of("note", "={{ $json.size }}"));
        WorkflowDocument document = workflow(WorkflowConnections.builder()
                        .main("Start", "Process").main("Loop", "Process").main("Plain", "Process").build(),
                manualTrigger("Start"), loop, plain, noOp("Process"));

        ValidationReport report = validator.validate(document);

        assertThat(report.getWarnings())
                .filteredOn(w -> w.getMessage().startsWith("$json is used"))
                .extracting(ValidationIssue::getNodeName)
                .containsExactly("Plain");
    }

    @Test
    void testInputWithoutIncomingConnectionIsError() {
        WorkflowNode first = node("First", "n8n-nodes-base.noOp", 1, Map.of("text", "={{ $input.item.json.id }}"));
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("First", "Second").build(),
                first, noOp("Second"));

        ValidationReport report = validator.validate(document);

        ValidationIssue issue = onlyError(report);
        assertEquals("First", issue.getNodeName());
        assertEquals("$input is only available when the node has input data", issue.getMessage());
    }

    @Test
    void testExpressionReferencingUnknownNode() {
        WorkflowNode work = node("Work", "n8n-nodes-base.noOp", 1, Map.of("text", "={{ $node[\"Nowhere\"].json.id }}"));
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Work").build(),
                manualTrigger("Start"), work);

        ValidationReport report = validator.validate(document);

        assertEquals("Expression references node 'Nowhere' which does not exist", onlyError(report).getMessage());
        assertTrue(validator.validate(document, ValidationOptions.builder().validateExpressions(false).build()).isValid());
    }

    @Test
    void testDeeplyNestedParametersReportDepthOnce() {
        Map<String, Object> parameters = ParameterTreeWalkerTest.nested(105);
        WorkflowNode work = node("Work", "n8n-nodes-base.noOp", 1, parameters);
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Work").build(),
                manualTrigger("Start"), work);

        ValidationReport report = validator.validate(document);

        assertTrue(report.isValid());
        List<ValidationIssue> depthWarnings = report.getWarnings().stream()
                .filter(w -> w.getMessage().startsWith("Maximum nesting depth"))
                .collect(Collectors.toList());
        assertEquals(1, depthWarnings.size());
        assertEquals("Work", depthWarnings.get(0).getNodeName());
    }

    @Test
    void testMinimalProfileKeepsOnlyStructuralErrors() {
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Fetch").build(),
                manualTrigger("Start"),
                httpRequest("Fetch", "example.com").toBuilder().typeVersion(4.0).build(), noOp("Orphan"));

        ValidationReport report = validator.validate(document, ValidationOptions.forProfile(ValidationProfile.MINIMAL));

        assertTrue(report.isValid(), report.toString());
        assertEquals(0, report.getWarningCount());
    }

    @Test
    void testAiFriendlyAddsNodeGuidance() {
        WorkflowNode fetch = node("Fetch", "n8n-nodes-base.httpRequest", 4.2, Map.of("method", "GET"));
        WorkflowDocument document = workflow(WorkflowConnections.builder().main("Start", "Fetch").build(),
                manualTrigger("Start"), fetch);

        ValidationReport report = validator.validate(document, ValidationOptions.forProfile(ValidationProfile.AI_FRIENDLY));

        assertFalse(report.isValid());
        assertThat(report.getSuggestions()).contains("Node 'Fetch': Add the required properties: url");
    }

    private static WorkflowDocument workflow(WorkflowConnections connections, WorkflowNode... nodes) {
        return WorkflowDocument.builder()
                .id("wf-test")
                .name("Test Workflow")
                .nodes(List.of(nodes))
                .connections(connections)
                .build();
    }

    private static WorkflowDocument chain(int steps) {
        WorkflowConnections.Builder connections = WorkflowConnections.builder();
        List<WorkflowNode> nodes = new ArrayList<>(List.of(manualTrigger("Start")));
        String previous = "Start";
        for (int i = 1; i <= steps; i++) {
            nodes.add(noOp("Step " + i));
            connections.main(previous, "Step " + i);
            previous = "Step " + i;
        }
        return workflow(connections.build(), nodes.toArray(new WorkflowNode[0]));
    }

    private static WorkflowNode agent(String name) {
        return node(name, "@n8n/n8n-nodes-langchain.agent", 1, Map.of());
    }

    private static ValidationIssue onlyError(ValidationReport report) {
        assertEquals(1, report.getErrorCount(), report.toString());
        return report.getErrors().get(0);
    }

    private static List<ValidationIssue> selfReferenceIssues(ValidationReport report) {
        return report.getAllIssues().stream()
                .filter(i -> i.getMessage().contains("is connected to itself"))
                .collect(Collectors.toList());
    }
}
