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


package dev.mars.flowsmith.workflow;

import dev.mars.flowsmith.config.FlowsmithConfiguration;
import dev.mars.flowsmith.model.WorkflowDocument;
import dev.mars.flowsmith.model.WorkflowDocumentMapper;
import dev.mars.flowsmith.nodetype.CachingNodeTypeRepository;
import dev.mars.flowsmith.nodetype.InMemoryNodeTypeRepository;
import dev.mars.flowsmith.workflow.diff.DiffOperation;
import dev.mars.flowsmith.workflow.diff.DiffOperationMapper;
import dev.mars.flowsmith.workflow.diff.DiffOptions;
import dev.mars.flowsmith.workflow.diff.DiffResult;
import dev.mars.flowsmith.workflow.validation.NodeConfigResult;
import dev.mars.flowsmith.workflow.validation.ValidationIssue;
import dev.mars.flowsmith.workflow.validation.ValidationOptions;
import dev.mars.flowsmith.workflow.validation.ValidationProfile;
import dev.mars.flowsmith.workflow.validation.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link WorkflowService}: a workflow loaded from JSON is
 * validated, edited with a diff batch and validated again.
 */
class WorkflowServiceTest {

    private InMemoryNodeTypeRepository catalog;
    private WorkflowService service;
    private WorkflowDocument orderSync;

    @BeforeEach
    void setUp() throws Exception {
        catalog = TestCatalog.repository();
        service = new WorkflowService(catalog, FlowsmithConfiguration.defaults());
        orderSync = new WorkflowDocumentMapper().fromJson(readResource("workflows/order-sync.json"));
    }

    @Test
    void testRepositoryIsCachedByDefault() {
        assertInstanceOf(CachingNodeTypeRepository.class, service.getRepository());

        Properties properties = new Properties();
        properties.setProperty(FlowsmithConfiguration.SCHEMA_CACHE_ENABLED, "false");
        properties.setProperty(FlowsmithConfiguration.METRICS_ENABLED, "false");
        WorkflowService uncached = new WorkflowService(catalog, new FlowsmithConfiguration(properties));

        assertSame(catalog, uncached.getRepository());
    }

    @Test
    void testValidateLoadedWorkflow() {
        ValidationReport report = service.validateWorkflow(orderSync);

        assertTrue(report.isValid(), () -> "Unexpected errors: " + report.getErrors());
        assertEquals(ValidationProfile.RUNTIME, report.getProfile());
        assertEquals(5, report.getStatistics().getTotalNodes());
    }

    @Test
    void testConfiguredDefaultProfile() {
        Properties properties = new Properties();
        properties.setProperty(FlowsmithConfiguration.VALIDATION_PROFILE, "strict");
        WorkflowService strict = new WorkflowService(catalog, new FlowsmithConfiguration(properties));

        assertEquals(ValidationProfile.STRICT, strict.validateWorkflow(orderSync).getProfile());
    }

    @Test
    void testDiffFromJsonThenRevalidate() throws Exception {
        List<DiffOperation> operations = new DiffOperationMapper().fromJson("""
                [
                  {"type": "addNode", "node": {"name": "Notify", "type": "n8n-nodes-base.noOp", "typeVersion": 1,
                                               "position": [880, -100]}},
                  {"type": "addConnection", "source": "Mark Synced", "target": "Notify"},
                  {"type": "updateNode", "nodeName": "Fetch Orders",
                   "changes": {"parameters.url": "https://shop.example.com/api/v2/orders"}},
                  {"type": "addTag", "tag": "nightly"}
                ]
                """);

        DiffResult dryRun = service.applyDiff(orderSync, operations, DiffOptions.validateOnly());
        assertTrue(dryRun.isSuccess(), dryRun.getMessage());
        assertSame(orderSync, dryRun.getDocument());

        DiffResult applied = service.applyDiff(orderSync, operations, DiffOptions.defaults());
        assertTrue(applied.isSuccess(), applied.getMessage());
        assertEquals(4, applied.getOperationsApplied());

        WorkflowDocument updated = applied.getDocument();
        assertEquals(List.of("orders", "nightly"), updated.getTags());
        assertEquals("https://shop.example.com/api/v2/orders",
                updated.findNodeByName("Fetch Orders").orElseThrow().getParameters().get("url"));
        assertTrue(service.validateWorkflow(updated).isValid());
    }

    @Test
    void testDiffThatBreaksGraphIsRejected() throws Exception {
        List<DiffOperation> operations = new DiffOperationMapper().fromJson("""
                [
                  {"type": "removeNode", "nodeName": "Nothing To Do"},
                  {"type": "addConnection", "source": "Has Orders", "target": "Nothing To Do", "sourceIndex": 1}
                ]
                """);

        DiffResult result = service.applyDiff(orderSync, operations, DiffOptions.defaults());

        assertFalse(result.isSuccess());
        assertEquals(1, result.getFailedOperationIndex());
        assertEquals(5, result.getDocument().getNodes().size());
    }

    @Test
    void testValidateNodeConfig() {
        Optional<NodeConfigResult> result = service.validateNodeConfig("nodes-base.httpRequest",
                Map.of("method", "GET"), ValidationProfile.AI_FRIENDLY);

        assertTrue(result.isPresent());
        assertFalse(result.get().isValid());
        assertThat(result.get().getErrors())
                .extracting(ValidationIssue::getMessage)
                .contains("Required property 'URL' is missing");
        assertEquals("nodes-base.httpRequest",
                service.validateNodeConfig("n8n-nodes-base.httpRequest", Map.of("url", "https://example.com"),
                        ValidationProfile.RUNTIME).orElseThrow().getNodeType());
    }

    @Test
    void testValidateNodeConfigForUnknownType() {
        assertTrue(service.validateNodeConfig("n8n-nodes-base.doesNotExist", Map.of(), ValidationProfile.RUNTIME)
                .isEmpty());
    }

    @Test
    void testExplicitOptionsOverrideDefaultProfile() {
        ValidationReport report = service.validateWorkflow(orderSync,
                ValidationOptions.forProfile(ValidationProfile.MINIMAL));

        assertEquals(ValidationProfile.MINIMAL, report.getProfile());
        assertEquals(0, report.getWarningCount());
    }

    private static String readResource(String name) throws IOException {
        try (InputStream in = WorkflowServiceTest.class.getClassLoader().getResourceAsStream(name)) {
            assertNotNull(in, "Missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
