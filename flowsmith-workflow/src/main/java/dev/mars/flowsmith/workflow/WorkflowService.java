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
import dev.mars.flowsmith.nodetype.CachingNodeTypeRepository;
import dev.mars.flowsmith.nodetype.NodeTypeNames;
import dev.mars.flowsmith.nodetype.NodeTypeRepository;
import dev.mars.flowsmith.nodetype.NodeTypeSchema;
import dev.mars.flowsmith.workflow.diff.DiffOperation;
import dev.mars.flowsmith.workflow.diff.DiffOptions;
import dev.mars.flowsmith.workflow.diff.DiffResult;
import dev.mars.flowsmith.workflow.diff.WorkflowDiffEngine;
import dev.mars.flowsmith.workflow.observability.ValidationMetrics;
import dev.mars.flowsmith.workflow.validation.NodeConfigResult;
import dev.mars.flowsmith.workflow.validation.NodeConfigValidator;
import dev.mars.flowsmith.workflow.validation.ValidationOptions;
import dev.mars.flowsmith.workflow.validation.ValidationProfile;
import dev.mars.flowsmith.workflow.validation.ValidationReport;
import dev.mars.flowsmith.workflow.validation.WorkflowGraphValidator;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Entry point for callers: validates workflow documents and applies diff batches with
 * the defaults taken from {@link FlowsmithConfiguration}.
 *
 * <p>When schema caching is enabled the node-type repository is wrapped in a
 * {@link CachingNodeTypeRepository}. Metrics are recorded through
 * {@link ValidationMetrics} when enabled.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class WorkflowService {

    private static final Logger logger = Logger.getLogger(WorkflowService.class.getName());

    private final FlowsmithConfiguration configuration;
    private final NodeTypeRepository repository;
    private final WorkflowGraphValidator graphValidator;
    private final NodeConfigValidator nodeConfigValidator;
    private final WorkflowDiffEngine diffEngine;
    private final ValidationMetrics metrics;

    public WorkflowService(NodeTypeRepository repository) {
        this(repository, new FlowsmithConfiguration());
    }

    public WorkflowService(NodeTypeRepository repository, FlowsmithConfiguration configuration) {
        Objects.requireNonNull(repository, "Node type repository cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.repository = configuration.isSchemaCacheEnabled() && !(repository instanceof CachingNodeTypeRepository)
                ? new CachingNodeTypeRepository(repository)
                : repository;

        int maxDepth = configuration.getExpressionMaxDepth();
        this.graphValidator = new WorkflowGraphValidator(this.repository, maxDepth);
        this.nodeConfigValidator = new NodeConfigValidator(maxDepth);
        this.diffEngine = new WorkflowDiffEngine(this.repository, configuration);
        this.metrics = configuration.isMetricsEnabled() ? ValidationMetrics.getInstance() : null;

        logger.info("WorkflowService initialized: " + configuration);
    }

    /**
     * Validates with the configured default profile.
     */
    public ValidationReport validateWorkflow(WorkflowDocument document) {
        ValidationProfile profile = ValidationProfile.fromName(configuration.getDefaultValidationProfile());
        return validateWorkflow(document, ValidationOptions.forProfile(profile));
    }

    public ValidationReport validateWorkflow(WorkflowDocument document, ValidationOptions options) {
        long start = System.nanoTime();
        ValidationReport report = graphValidator.validate(document, options);
        double durationSeconds = (System.nanoTime() - start) / 1_000_000_000.0;

        if (metrics != null) {
            metrics.recordValidation(options.getProfile().getProfileName(), report.isValid(),
                    report.getErrorCount(), report.getWarningCount(), durationSeconds);
        }
        if (!report.isValid()) {
            logger.info("Workflow '" + document.getName() + "' failed validation with " +
                    report.getErrorCount() + " errors");
        }
        return report;
    }

    public DiffResult applyDiff(WorkflowDocument document, List<? extends DiffOperation> operations,
                                DiffOptions options) {
        DiffResult result = diffEngine.apply(document, operations, options);
        if (metrics != null) {
            metrics.recordDiffBatch(result.isSuccess(), result.isValidateOnly());
        }
        return result;
    }

    /**
     * Validates a single node configuration. Returns empty when the node type is not in
     * the catalog.
     */
    public Optional<NodeConfigResult> validateNodeConfig(String nodeType, Map<String, Object> parameters,
                                                         ValidationProfile profile) {
        Optional<NodeTypeSchema> schema = repository.getNodeType(NodeTypeNames.normalize(nodeType));
        if (schema.isEmpty()) {
            logger.fine("Node config requested for unknown node type: " + nodeType);
            return Optional.empty();
        }
        return Optional.of(nodeConfigValidator.validate(schema.get(), parameters, profile));
    }

    public NodeTypeRepository getRepository() {
        return repository;
    }

    public FlowsmithConfiguration getConfiguration() {
        return configuration;
    }
}
