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

import dev.mars.flowsmith.model.Connection;
import dev.mars.flowsmith.model.ConnectionTarget;
import dev.mars.flowsmith.model.WorkflowConnections;
import dev.mars.flowsmith.model.WorkflowDocument;
import dev.mars.flowsmith.model.WorkflowNode;
import dev.mars.flowsmith.nodetype.CredentialRequirement;
import dev.mars.flowsmith.nodetype.NodeTypeNames;
import dev.mars.flowsmith.nodetype.NodeTypeRepository;
import dev.mars.flowsmith.nodetype.NodeTypeSchema;
import dev.mars.flowsmith.nodetype.PropertySchema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Validates a workflow document as a whole: node identity, node types and versions,
 * execution-control attributes, every connection entry and the shape of the graph.
 * Each enabled node is also passed to {@link NodeConfigValidator},
 * {@link ExpressionValidator} and {@link ExpressionFormatValidator}.
 *
 * <p>All findings are accumulated in one {@link ValidationReport}. A workflow without
 * nodes is valid and carries the single warning "Workflow has no nodes".</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class WorkflowGraphValidator {

    private static final Logger logger = Logger.getLogger(WorkflowGraphValidator.class.getName());

    public static final String CONTINUE_REGULAR_OUTPUT = "continueRegularOutput";
    public static final String CONTINUE_ERROR_OUTPUT = "continueErrorOutput";
    public static final String STOP_WORKFLOW = "stopWorkflow";
    public static final Set<String> ON_ERROR_VALUES = Set.of(CONTINUE_REGULAR_OUTPUT, CONTINUE_ERROR_OUTPUT, STOP_WORKFLOW);

    private static final Set<String> NODE_LEVEL_PROPERTIES = Set.of(
            "onError", "continueOnFail", "retryOnFail", "maxTries", "waitBetweenTries",
            "alwaysOutputData", "executeOnce", "disabled", "notes", "notesInFlow", "credentials");
    private static final int MAX_TRIES_WARNING_THRESHOLD = 10;
    private static final int MAX_WAIT_BETWEEN_TRIES_MS = 300_000;
    private static final String STICKY_NOTE = "stickyNote";
    private static final int LONG_CHAIN_THRESHOLD = 10;
    private static final String COMMUNITY_TOOL_SETTING = "N8N_COMMUNITY_PACKAGES_ALLOW_TOOL_USAGE";

    private final NodeTypeRepository repository;
    private final NodeConfigValidator nodeConfigValidator;
    private final ExpressionValidator expressionValidator;
    private final ExpressionFormatValidator expressionFormatValidator;

    public WorkflowGraphValidator(NodeTypeRepository repository) {
        this(repository, ParameterTreeWalker.DEFAULT_MAX_DEPTH);
    }

    public WorkflowGraphValidator(NodeTypeRepository repository, int maxDepth) {
        this(repository, new NodeConfigValidator(maxDepth), new ExpressionValidator(maxDepth),
                new ExpressionFormatValidator(maxDepth));
    }

    public WorkflowGraphValidator(NodeTypeRepository repository, NodeConfigValidator nodeConfigValidator,
                                  ExpressionValidator expressionValidator,
                                  ExpressionFormatValidator expressionFormatValidator) {
        this.repository = Objects.requireNonNull(repository, "Node type repository cannot be null");
        this.nodeConfigValidator = Objects.requireNonNull(nodeConfigValidator, "Node config validator cannot be null");
        this.expressionValidator = Objects.requireNonNull(expressionValidator, "Expression validator cannot be null");
        this.expressionFormatValidator = Objects.requireNonNull(expressionFormatValidator,
                "Expression format validator cannot be null");
    }

    public ValidationReport validate(WorkflowDocument document) {
        return validate(document, ValidationOptions.defaults());
    }

    public ValidationReport validate(WorkflowDocument document, ValidationOptions options) {
        Objects.requireNonNull(document, "Document cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");

        ValidationReport.Builder report = ValidationReport.builder(options.getProfile());
        List<WorkflowNode> nodes = document.getNodes();
        report.statistics().setTotalNodes(nodes.size());

        if (nodes.isEmpty()) {
            report.add(ValidationIssue.warning(IssueCategory.STRUCTURE, null, "nodes", "Workflow has no nodes"));
            return report.build();
        }

        Map<String, WorkflowNode> byName = new LinkedHashMap<>();
        Map<String, WorkflowNode> byId = new HashMap<>();
        checkUniqueness(nodes, byName, byId, report);

        Set<String> nodesWithInput = new HashSet<>();
        for (Connection connection : document.getConnections().asList()) {
            nodesWithInput.add(connection.target().node());
        }
        Set<String> loopNodes = loopMembers(document.getConnections(), byName);

        Map<String, NodeTypeSchema> schemas = new HashMap<>();
        for (WorkflowNode node : nodes) {
            if (isStickyNote(node)) {
                continue;
            }
            if (!node.isDisabled()) {
                report.statistics().incrementEnabledNodes();
            }

            Optional<NodeTypeSchema> schema = resolveNodeType(node, report);
            schema.ifPresent(s -> schemas.putIfAbsent(node.getName(), s));
            if (schema.isPresent() && schema.get().isTrigger()) {
                report.statistics().incrementTriggerNodes();
            }

            if (!node.isDisabled()) {
                validateNode(node, schema.orElse(null), options, byName.keySet(),
                        nodesWithInput.contains(node.getName()), loopNodes.contains(node.getName()), report);
            }
        }

        if (options.isValidateConnections()) {
            validateConnections(document.getConnections(), byName, byId, schemas, report);
        }
        checkTopology(document, byName, schemas, report);
        checkWorkflowPatterns(document, byName, schemas, report);

        ValidationStatistics statistics = report.statistics();
        if (statistics.getEnabledNodes() > 0 && statistics.getTriggerNodes() == 0) {
            report.add(ValidationIssue.warning(IssueCategory.STRUCTURE, null, null,
                    "Workflow has no trigger node; it can only be started manually"));
        }
        addSuggestions(document, report);

        ValidationReport result = report.build();
        logger.fine("Validated workflow '" + document.getName() + "' with profile " + options.getProfile() +
                ": " + result.getErrorCount() + " errors, " + result.getWarningCount() + " warnings");
        return result;
    }

    private void checkUniqueness(List<WorkflowNode> nodes, Map<String, WorkflowNode> byName,
                                 Map<String, WorkflowNode> byId, ValidationReport.Builder report) {
        for (WorkflowNode node : nodes) {
            if (byName.putIfAbsent(node.getName(), node) != null) {
                report.add(ValidationIssue.error(IssueCategory.STRUCTURE, node.getName(), "name",
                        "Duplicate node name '" + node.getName() + "'; node names must be unique"));
            }
            if (node.getId() != null) {
                WorkflowNode existing = byId.putIfAbsent(node.getId(), node);
                if (existing != null) {
                    report.add(ValidationIssue.error(IssueCategory.STRUCTURE, node.getName(), "id",
                            "Duplicate node id '" + node.getId() + "' (also used by node '" + existing.getName() + "')"));
                }
            }
        }
    }

    private Optional<NodeTypeSchema> resolveNodeType(WorkflowNode node, ValidationReport.Builder report) {
        String type = node.getType();

        if (NodeTypeNames.isShortForm(type)) {
            String fullForm = NodeTypeNames.toDocumentForm(type);
            report.add(ValidationIssue.error(IssueCategory.STRUCTURE, node.getName(), "type",
                    "Invalid node type '" + type + "'; workflow documents must use the full type name '" +
                    fullForm + "'").withSuggestedValue(fullForm));
        } else if (!NodeTypeNames.hasPackagePrefix(type)) {
            List<String> suggestions = NodeTypeSuggestions.suggest(type, repository.getNodeTypeNames());
            report.add(withSuggestions(ValidationIssue.error(IssueCategory.STRUCTURE, node.getName(), "type",
                    "Node type '" + type + "' is missing its package prefix" + didYouMean(suggestions)), suggestions));
            return Optional.empty();
        }

        Optional<NodeTypeSchema> schema = repository.getNodeType(NodeTypeNames.normalize(type));
        if (schema.isEmpty()) {
            List<String> suggestions = NodeTypeSuggestions.suggest(type, repository.getNodeTypeNames());
            report.add(withSuggestions(ValidationIssue.error(IssueCategory.STRUCTURE, node.getName(), "type",
                    "Unknown node type '" + type + "'" + didYouMean(suggestions)), suggestions));
        }
        return schema;
    }

    private void validateNode(WorkflowNode node, NodeTypeSchema schema, ValidationOptions options,
                              Set<String> nodeNames, boolean hasInput, boolean inLoop,
                              ValidationReport.Builder report) {
        ValidationProfile profile = options.getProfile();
        String name = node.getName();

        checkExecutionControl(node, report);
        checkMisplacedProperties(node, schema, report);
        checkCredentials(node, schema, report);

        if (schema != null) {
            checkTypeVersion(node, schema, report);

            if (options.isValidateNodes()) {
                Double version = node.getTypeVersion() != null ? node.getTypeVersion() : schema.getLatestVersion();
                NodeConfigResult result = nodeConfigValidator.validate(schema, node.getParameters(), version, profile);
                for (ValidationIssue issue : result.getIssues()) {
                    report.add(issue.withNodeName(name));
                }
                for (String step : result.getNextSteps()) {
                    report.addSuggestion("Node '" + name + "': " + step);
                }
            }
        }

        if (options.isValidateExpressions() && profile.runs(IssueCategory.EXPRESSION)) {
            ExpressionContext context = new ExpressionContext(nodeNames, name, hasInput, inLoop);
            ExpressionValidationResult expressions = expressionValidator.validateParameters(node.getParameters(), context);
            for (ValidationIssue issue : expressions.getIssues()) {
                report.add(issue.withNodeName(name));
            }
            report.statistics().addExpressionsValidated(expressions.getExpressionCount());

            for (ValidationIssue issue : expressionFormatValidator.validateParameters(node.getParameters(),
                    topLevelProperties(schema))) {
                report.add(issue.withNodeName(name));
            }
        }
    }

    private void checkExecutionControl(WorkflowNode node, ValidationReport.Builder report) {
        String name = node.getName();
        String onError = node.getOnError();

        if (onError != null && !ON_ERROR_VALUES.contains(onError)) {
            ValidationIssue issue = ValidationIssue.error(IssueCategory.EXECUTION, name, "onError",
                    "Invalid onError value '" + onError + "'; valid values: continueRegularOutput, " +
                    "continueErrorOutput, stopWorkflow");
            String lower = onError.toLowerCase(Locale.ROOT);
            if (lower.contains("continue")) {
                issue = issue.withSuggestedValue(CONTINUE_REGULAR_OUTPUT);
            } else if (lower.contains("stop")) {
                issue = issue.withSuggestedValue(STOP_WORKFLOW);
            }
            report.add(issue);
        }

        if (node.getContinueOnFail() != null && onError != null) {
            report.add(ValidationIssue.error(IssueCategory.EXECUTION, name, "continueOnFail",
                    "Cannot use both continueOnFail and onError; use onError only"));
        } else if (Boolean.TRUE.equals(node.getContinueOnFail())) {
            report.add(ValidationIssue.warning(IssueCategory.EXECUTION, name, "continueOnFail",
                    "continueOnFail is deprecated; use onError: 'continueRegularOutput' instead")
                    .withSuggestedValue(CONTINUE_REGULAR_OUTPUT));
        }

        Integer maxTries = node.getMaxTries();
        if (maxTries != null) {
            if (maxTries < 1) {
                report.add(ValidationIssue.error(IssueCategory.EXECUTION, name, "maxTries",
                        "maxTries must be at least 1, got " + maxTries).withSuggestedValue(1));
            } else if (maxTries > MAX_TRIES_WARNING_THRESHOLD) {
                report.add(ValidationIssue.warning(IssueCategory.EXECUTION, name, "maxTries",
                        "maxTries of " + maxTries + " is unusually high and may delay failure detection"));
            }
        }

        Integer waitBetweenTries = node.getWaitBetweenTries();
        if (waitBetweenTries != null) {
            if (waitBetweenTries < 0) {
                report.add(ValidationIssue.error(IssueCategory.EXECUTION, name, "waitBetweenTries",
                        "waitBetweenTries cannot be negative, got " + waitBetweenTries).withSuggestedValue(0));
            } else if (waitBetweenTries > MAX_WAIT_BETWEEN_TRIES_MS) {
                report.add(ValidationIssue.warning(IssueCategory.EXECUTION, name, "waitBetweenTries",
                        "waitBetweenTries of " + waitBetweenTries + " ms exceeds 5 minutes"));
            }
        }

        if (!Boolean.TRUE.equals(node.getRetryOnFail()) && (maxTries != null || waitBetweenTries != null)) {
            report.add(ValidationIssue.warning(IssueCategory.EXECUTION, name, "retryOnFail",
                    "maxTries and waitBetweenTries have no effect unless retryOnFail is enabled"));
        }
    }

    private void checkMisplacedProperties(WorkflowNode node, NodeTypeSchema schema, ValidationReport.Builder report) {
        for (String key : node.getParameters().keySet()) {
            if (NODE_LEVEL_PROPERTIES.contains(key) && !declaresProperty(schema, key)) {
                report.add(ValidationIssue.error(IssueCategory.STRUCTURE, node.getName(), "parameters." + key,
                        "'" + key + "' is a node-level property and must be set on the node, not inside parameters"));
            }
        }
    }

    private void checkCredentials(WorkflowNode node, NodeTypeSchema schema, ValidationReport.Builder report) {
        Map<String, Object> credentials = node.getCredentials();
        if (credentials != null) {
            for (Map.Entry<String, Object> entry : credentials.entrySet()) {
                String path = "credentials." + entry.getKey();
                if (!(entry.getValue() instanceof Map<?, ?> reference)) {
                    report.add(ValidationIssue.error(IssueCategory.STRUCTURE, node.getName(), path,
                            "Credential reference must be an object with id and name"));
                    continue;
                }
                Object id = reference.get("id");
                if (id == null || id.toString().isBlank()) {
                    report.add(ValidationIssue.warning(IssueCategory.EXECUTION, node.getName(), path,
                            "Credential '" + entry.getKey() + "' has no id; select it again so the reference resolves"));
                }
            }
        }

        if (schema != null) {
            for (CredentialRequirement requirement : schema.getCredentials()) {
                if (requirement.required() && (credentials == null || !credentials.containsKey(requirement.name()))) {
                    report.add(ValidationIssue.error(IssueCategory.EXECUTION, node.getName(), "credentials",
                            "Node type " + schema.getNodeType() + " requires credential '" + requirement.name() + "'"));
                }
            }
        }
    }

    private void checkTypeVersion(WorkflowNode node, NodeTypeSchema schema, ValidationReport.Builder report) {
        if (!schema.isVersioned()) {
            return;
        }
        Double version = node.getTypeVersion();
        double latest = schema.getLatestVersion();
        String name = node.getName();

        if (version == null) {
            report.add(ValidationIssue.error(IssueCategory.STRUCTURE, name, "typeVersion",
                    "typeVersion is required for versioned node type " + schema.getNodeType())
                    .withSuggestedValue(latest));
        } else if (version <= 0) {
            report.add(ValidationIssue.error(IssueCategory.STRUCTURE, name, "typeVersion",
                    "Invalid typeVersion " + formatVersion(version) + "; versions are positive numbers")
                    .withSuggestedValue(latest));
        } else if (version > latest) {
            report.add(ValidationIssue.error(IssueCategory.STRUCTURE, name, "typeVersion",
                    "typeVersion " + formatVersion(version) + " exceeds the latest version " +
                    formatVersion(latest) + " of " + schema.getNodeType())
                    .withSuggestedValue(latest));
        } else if (version < latest) {
            report.add(ValidationIssue.warning(IssueCategory.STRUCTURE, name, "typeVersion",
                    "Outdated typeVersion " + formatVersion(version) + "; the latest version is " +
                    formatVersion(latest)));
        }
    }

    private void validateConnections(WorkflowConnections connections, Map<String, WorkflowNode> byName,
                                     Map<String, WorkflowNode> byId, Map<String, NodeTypeSchema> schemas,
                                     ValidationReport.Builder report) {
        ValidationStatistics statistics = report.statistics();

        for (String source : connections.getSourceNodes()) {
            Map<String, List<List<ConnectionTarget>>> outputs = connections.getOutputs(source);
            WorkflowNode sourceNode = byName.get(source);
            if (sourceNode == null) {
                report.add(missingNode(source, "connections." + source, source, byId, "Connection source"));
                for (List<List<ConnectionTarget>> ports : outputs.values()) {
                    for (List<ConnectionTarget> port : ports) {
                        for (int i = 0; i < port.size(); i++) {
                            statistics.incrementInvalidConnections();
                        }
                    }
                }
                continue;
            }

            NodeTypeSchema schema = schemas.get(source);
            boolean errorOutput = CONTINUE_ERROR_OUTPUT.equals(sourceNode.getOnError());

            for (Map.Entry<String, List<List<ConnectionTarget>>> output : outputs.entrySet()) {
                String outputType = output.getKey();
                List<List<ConnectionTarget>> ports = output.getValue();
                for (int i = 0; i < ports.size(); i++) {
                    List<ConnectionTarget> port = ports.get(i);
                    if (port.isEmpty()) {
                        continue;
                    }
                    String portPath = "connections." + source + "." + outputType + "[" + i + "]";
                    boolean portValid = true;

                    if (ConnectionTarget.MAIN.equals(outputType) && schema != null) {
                        int allowed = schema.getOutputCount() + (errorOutput ? 1 : 0);
                        if (i >= allowed) {
                            portValid = false;
                            report.add(ValidationIssue.error(IssueCategory.CONNECTION, source, portPath,
                                    "Output index " + i + " of node '" + source + "' is out of range: " +
                                    describeOutputs(schema, errorOutput)));
                        }
                    }

                    for (int j = 0; j < port.size(); j++) {
                        ConnectionTarget target = port.get(j);
                        String targetPath = portPath + "[" + j + "]";
                        boolean valid = portValid;

                        WorkflowNode targetNode = byName.get(target.node());
                        if (targetNode == null) {
                            valid = false;
                            report.add(missingNode(source, targetPath, target.node(), byId, "Connection target"));
                        }

                        if (target.index() < 0) {
                            valid = false;
                            report.add(ValidationIssue.error(IssueCategory.CONNECTION, source, targetPath + ".index",
                                    "Invalid connection from '" + source + "' (" + outputType + "[" + i + "]) to '" +
                                    target.node() + "': input index " + target.index() +
                                    " must be a non-negative integer"));
                        }

                        if (targetNode != null) {
                            if (targetNode.isDisabled()) {
                                report.add(ValidationIssue.warning(IssueCategory.TOPOLOGY, source, targetPath,
                                        "Connection to disabled node '" + target.node() + "'"));
                            }
                            if (source.equals(target.node()) && (schema == null || !schema.isLoopCapable())) {
                                report.add(ValidationIssue.warning(IssueCategory.TOPOLOGY, source, targetPath,
                                        "Node '" + source + "' is connected to itself; only loop-capable node " +
                                        "types may reference themselves"));
                            }
                        }

                        if (valid) {
                            statistics.incrementValidConnections();
                        } else {
                            statistics.incrementInvalidConnections();
                        }
                    }
                }
            }
        }

        for (WorkflowNode node : byName.values()) {
            NodeTypeSchema schema = schemas.get(node.getName());
            if (node.isDisabled() || schema == null || !CONTINUE_ERROR_OUTPUT.equals(node.getOnError())) {
                continue;
            }
            List<List<ConnectionTarget>> ports = connections.getOutputs(node.getName()).get(ConnectionTarget.MAIN);
            int errorIndex = schema.getOutputCount();
            if (ports == null || ports.size() <= errorIndex || ports.get(errorIndex).isEmpty()) {
                report.add(ValidationIssue.warning(IssueCategory.EXECUTION, node.getName(), "onError",
                        "onError is 'continueErrorOutput' but the error output is not connected"));
            }
        }
    }

    private ValidationIssue missingNode(String sourceName, String path, String reference,
                                        Map<String, WorkflowNode> byId, String role) {
        WorkflowNode idMatch = byId.get(reference);
        if (idMatch != null) {
            return ValidationIssue.error(IssueCategory.CONNECTION, sourceName, path,
                    role + " '" + reference + "' is a node id; connections must use node names (node '" +
                    idMatch.getName() + "')").withSuggestedValue(idMatch.getName());
        }
        return ValidationIssue.error(IssueCategory.CONNECTION, sourceName, path,
                role + " '" + reference + "' does not exist");
    }

    private void checkTopology(WorkflowDocument document, Map<String, WorkflowNode> byName,
                               Map<String, NodeTypeSchema> schemas, ValidationReport.Builder report) {
        List<WorkflowNode> workNodes = new ArrayList<>();
        for (WorkflowNode node : byName.values()) {
            if (!isStickyNote(node)) {
                workNodes.add(node);
            }
        }
        if (workNodes.size() < 2) {
            return;
        }

        List<Connection> edges = document.getConnections().asList();
        if (!document.getConnections().hasEdges()) {
            report.add(ValidationIssue.error(IssueCategory.STRUCTURE, null, "connections",
                    "Multi-node workflow has no connections; nodes will not pass data to each other"));
            return;
        }

        Set<String> connected = new HashSet<>();
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (Connection edge : edges) {
            if (byName.containsKey(edge.sourceNode()) && byName.containsKey(edge.target().node())) {
                connected.add(edge.sourceNode());
                connected.add(edge.target().node());
                if (!edge.isSelfReference()) {
                    adjacency.computeIfAbsent(edge.sourceNode(), k -> new ArrayList<>()).add(edge.target().node());
                }
            }
        }

        for (WorkflowNode node : workNodes) {
            if (!node.isDisabled() && !connected.contains(node.getName())) {
                report.add(ValidationIssue.warning(IssueCategory.TOPOLOGY, node.getName(), null,
                        "Node '" + node.getName() + "' is not connected to any other node"));
            }
        }

        for (List<String> component : new CycleFinder(byName.keySet(), adjacency).findCycles()) {
            boolean passesThroughLoop = false;
            for (String member : component) {
                NodeTypeSchema schema = schemas.get(member);
                passesThroughLoop |= schema != null && schema.isLoopCapable();
            }
            if (!passesThroughLoop) {
                report.add(ValidationIssue.error(IssueCategory.CONNECTION, component.get(0), null,
                        "Workflow contains a cycle between nodes " + String.join(", ", component) +
                        "; only loop-capable node types may close a loop"));
            }
        }
    }

    /**
     * Loop-capable nodes and everything reachable from them over main connections.
     */
    private Set<String> loopMembers(WorkflowConnections connections, Map<String, WorkflowNode> byName) {
        List<String> pending = new ArrayList<>();
        for (WorkflowNode node : byName.values()) {
            if (repository.getNodeType(NodeTypeNames.normalize(node.getType()))
                    .map(NodeTypeSchema::isLoopCapable).orElse(false)) {
                pending.add(node.getName());
            }
        }
        Set<String> members = new HashSet<>(pending);
        while (!pending.isEmpty()) {
            String current = pending.remove(pending.size() - 1);
            List<List<ConnectionTarget>> ports = connections.getOutputs(current).get(ConnectionTarget.MAIN);
            if (ports == null) {
                continue;
            }
            for (List<ConnectionTarget> port : ports) {
                for (ConnectionTarget target : port) {
                    if (byName.containsKey(target.node()) && members.add(target.node())) {
                        pending.add(target.node());
                    }
                }
            }
        }
        return members;
    }

    private void checkWorkflowPatterns(WorkflowDocument document, Map<String, WorkflowNode> byName,
                                       Map<String, NodeTypeSchema> schemas, ValidationReport.Builder report) {
        List<Connection> edges = document.getConnections().asList();

        int chainLength = longestChain(byName.keySet(), edges);
        if (chainLength > LONG_CHAIN_THRESHOLD) {
            report.add(ValidationIssue.warning(IssueCategory.TOPOLOGY, null, "connections",
                    "Long linear chain detected (" + chainLength + " nodes); consider breaking it into sub-workflows"));
        }

        Set<String> withTools = new HashSet<>();
        for (Connection edge : edges) {
            if (ConnectionTarget.AI_TOOL.equals(edge.sourceOutput())) {
                withTools.add(edge.sourceNode());
                withTools.add(edge.target().node());
            }
        }
        for (WorkflowNode node : byName.values()) {
            if (!node.isDisabled() && isAgent(node) && !withTools.contains(node.getName())) {
                report.add(ValidationIssue.warning(IssueCategory.EXECUTION, node.getName(), "connections",
                        "AI Agent has no tools connected; consider adding tools to enhance agent capabilities"));
            }
        }

        Set<String> reported = new HashSet<>();
        for (Connection edge : edges) {
            if (!ConnectionTarget.AI_TOOL.equals(edge.sourceOutput())) {
                continue;
            }
            WorkflowNode source = byName.get(edge.sourceNode());
            WorkflowNode target = byName.get(edge.target().node());
            if (source == null || target == null || target.isDisabled()) {
                continue;
            }
            // tools usually feed the agent, but accept either direction
            WorkflowNode tool = isAgent(target) ? source : target;
            NodeTypeSchema schema = schemas.get(tool.getName());
            if (schema != null && !schema.isAiTool() && !NodeTypeNames.isCorePackage(schema.getPackageName())
                    && reported.add(tool.getName())) {
                report.add(ValidationIssue.warning(IssueCategory.EXECUTION, tool.getName(), null,
                        "Community node '" + tool.getName() + "' is being used as an AI tool; ensure " +
                        COMMUNITY_TOOL_SETTING + "=true is set"));
            }
        }
    }

    /**
     * Number of nodes on the longest path of main connections, starting from nodes
     * without main input. Cycles are cut where they close.
     */
    private static int longestChain(Set<String> nodeNames, List<Connection> edges) {
        Map<String, List<String>> successors = new HashMap<>();
        Set<String> hasInput = new HashSet<>();
        for (Connection edge : edges) {
            String target = edge.target().node();
            if (ConnectionTarget.MAIN.equals(edge.sourceOutput()) && !edge.isSelfReference()
                    && nodeNames.contains(edge.sourceNode()) && nodeNames.contains(target)) {
                successors.computeIfAbsent(edge.sourceNode(), k -> new ArrayList<>()).add(target);
                hasInput.add(target);
            }
        }
        Map<String, Integer> memo = new HashMap<>();
        int longest = 0;
        for (String name : nodeNames) {
            if (!hasInput.contains(name)) {
                longest = Math.max(longest, chainFrom(name, successors, memo, new HashSet<>()));
            }
        }
        return longest;
    }

    private static int chainFrom(String name, Map<String, List<String>> successors, Map<String, Integer> memo,
                                 Set<String> onPath) {
        Integer known = memo.get(name);
        if (known != null) {
            return known;
        }
        if (!onPath.add(name)) {
            return 0;
        }
        int longest = 0;
        for (String next : successors.getOrDefault(name, List.of())) {
            longest = Math.max(longest, chainFrom(next, successors, memo, onPath));
        }
        onPath.remove(name);
        memo.put(name, longest + 1);
        return longest + 1;
    }

    private static boolean isAgent(WorkflowNode node) {
        return node.getType() != null && node.getType().toLowerCase(Locale.ROOT).contains("agent");
    }

    private void addSuggestions(WorkflowDocument document, ValidationReport.Builder report) {
        ValidationStatistics statistics = report.statistics();
        if (statistics.getEnabledNodes() > 0 && statistics.getTriggerNodes() == 0) {
            report.addSuggestion("Add a trigger node, for example a webhook or schedule trigger, so the workflow " +
                    "can start on its own");
        }
        if (statistics.getInvalidConnections() > 0) {
            report.addSuggestion("Fix invalid connections so every target names an existing node and a valid input index");
        }
        boolean unknownTypes = false;
        boolean errorHandling = false;
        for (WorkflowNode node : document.getNodes()) {
            errorHandling |= node.getOnError() != null;
            unknownTypes |= repository.getNodeType(NodeTypeNames.normalize(node.getType())).isEmpty()
                    && !isStickyNote(node);
        }
        if (unknownTypes) {
            report.addSuggestion("Check node type names against the catalog; documents use full names such as " +
                    "n8n-nodes-base.httpRequest");
        }
        if (document.getNodes().size() > 3 && !errorHandling) {
            report.addSuggestion("Consider setting onError on nodes that call external services");
        }
        for (Connection edge : document.getConnections().asList()) {
            if (ConnectionTarget.AI_TOOL.equals(edge.sourceOutput())) {
                report.addSuggestion("For community nodes used as AI tools, ensure " + COMMUNITY_TOOL_SETTING +
                        "=true is set");
                break;
            }
        }
    }

    private static Map<String, PropertySchema> topLevelProperties(NodeTypeSchema schema) {
        Map<String, PropertySchema> properties = new HashMap<>();
        if (schema != null) {
            for (PropertySchema property : schema.getProperties()) {
                if (property.isWellFormed()) {
                    properties.putIfAbsent(property.getName(), property);
                }
            }
        }
        return properties;
    }

    private static boolean declaresProperty(NodeTypeSchema schema, String name) {
        return schema != null && topLevelProperties(schema).containsKey(name);
    }

    private static boolean isStickyNote(WorkflowNode node) {
        return STICKY_NOTE.equals(NodeTypeNames.localName(node.getType()));
    }

    private static String describeOutputs(NodeTypeSchema schema, boolean errorOutput) {
        StringBuilder sb = new StringBuilder();
        sb.append("node type ").append(schema.getNodeType()).append(" has ").append(schema.getOutputCount())
                .append(schema.getOutputCount() == 1 ? " output" : " outputs");
        if (!schema.getOutputs().isEmpty()) {
            sb.append(" (").append(String.join(", ", schema.getOutputs())).append(")");
        }
        if (errorOutput) {
            sb.append(" plus an error output");
        }
        return sb.toString();
    }

    private static String didYouMean(List<String> suggestions) {
        return suggestions.isEmpty() ? "" : "; did you mean " + String.join(", ", suggestions) + "?";
    }

    private static ValidationIssue withSuggestions(ValidationIssue issue, List<String> suggestions) {
        return suggestions.isEmpty() ? issue : issue.withSuggestedValue(suggestions.get(0));
    }

    static String formatVersion(double version) {
        return version == Math.rint(version) ? String.valueOf((long) version) : String.valueOf(version);
    }
}
