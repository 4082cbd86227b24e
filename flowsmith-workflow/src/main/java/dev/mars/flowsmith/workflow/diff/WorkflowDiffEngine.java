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


package dev.mars.flowsmith.workflow.diff;

import dev.mars.flowsmith.config.FlowsmithConfiguration;
import dev.mars.flowsmith.core.exceptions.WorkflowFormatException;
import dev.mars.flowsmith.model.ConnectionTarget;
import dev.mars.flowsmith.model.ParameterTrees;
import dev.mars.flowsmith.model.WorkflowConnections;
import dev.mars.flowsmith.model.WorkflowDocument;
import dev.mars.flowsmith.model.WorkflowDocumentMapper;
import dev.mars.flowsmith.model.WorkflowNode;
import dev.mars.flowsmith.nodetype.NodeTypeNames;
import dev.mars.flowsmith.nodetype.NodeTypeRepository;
import dev.mars.flowsmith.nodetype.NodeTypeSchema;
import dev.mars.flowsmith.workflow.validation.IssueCategory;
import dev.mars.flowsmith.workflow.validation.ValidationIssue;
import dev.mars.flowsmith.workflow.validation.ValidationProfile;
import dev.mars.flowsmith.workflow.validation.ValidationReport;
import dev.mars.flowsmith.workflow.validation.WorkflowGraphValidator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Applies an ordered batch of {@link DiffOperation}s to a workflow document with
 * all-or-nothing semantics.
 *
 * <p>Operations run strictly in order against a private working copy, so each one is
 * checked against the state left by the operations before it. The first operation whose
 * precondition fails rejects the whole batch and the caller gets the original document
 * back. In validate-only mode the same checks run but the working copy is discarded.</p>
 *
 * <p>The engine keeps no state between calls and is safe to share.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class WorkflowDiffEngine {

    private static final Logger logger = Logger.getLogger(WorkflowDiffEngine.class.getName());

    static final Set<String> NODE_ATTRIBUTES = Set.of(
            "name", "type", "typeVersion", "position", "parameters", "credentials", "disabled",
            "onError", "continueOnFail", "retryOnFail", "maxTries", "waitBetweenTries",
            "alwaysOutputData", "executeOnce", "notes", "notesInFlow");

    private final NodeTypeRepository repository;
    private final WorkflowDocumentMapper mapper;
    private final int maxOperations;

    public WorkflowDiffEngine(NodeTypeRepository repository) {
        this(repository, FlowsmithConfiguration.defaults());
    }

    public WorkflowDiffEngine(NodeTypeRepository repository, FlowsmithConfiguration configuration) {
        this(repository, configuration, new WorkflowDocumentMapper());
    }

    public WorkflowDiffEngine(NodeTypeRepository repository, FlowsmithConfiguration configuration,
                              WorkflowDocumentMapper mapper) {
        this.repository = Objects.requireNonNull(repository, "Node type repository cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "Document mapper cannot be null");
        this.maxOperations = Objects.requireNonNull(configuration, "Configuration cannot be null").getDiffMaxOperations();
    }

    public DiffResult apply(WorkflowDocument document, List<? extends DiffOperation> operations) {
        return apply(document, operations, DiffOptions.defaults());
    }

    public DiffResult apply(WorkflowDocument document, List<? extends DiffOperation> operations, DiffOptions options) {
        Objects.requireNonNull(document, "Document cannot be null");
        Objects.requireNonNull(operations, "Operations cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        boolean validateOnly = options.isValidateOnly();

        if (maxOperations > 0 && operations.size() > maxOperations) {
            logger.info("Rejected diff batch for workflow '" + document.getName() + "': " + operations.size() +
                    " operations exceed the limit of " + maxOperations);
            ValidationReport report = ValidationReport.builder(ValidationProfile.RUNTIME)
                    .add(ValidationIssue.error(IssueCategory.STRUCTURE, null, "operations",
                            "Too many operations: " + operations.size() + " (limit " + maxOperations + ")"))
                    .build();
            return DiffResult.rejected(document, report, -1, validateOnly);
        }

        WorkingCopy working = new WorkingCopy(document);
        for (int i = 0; i < operations.size(); i++) {
            DiffOperation operation = operations.get(i);
            try {
                if (operation == null) {
                    throw new DiffOperationException(IssueCategory.STRUCTURE, "Operation cannot be null");
                }
                applyOperation(working, operation);
                logger.fine("Applied operation " + i + " (" + operation.type() + ") to workflow '" +
                        document.getName() + "'");
            } catch (DiffOperationException e) {
                String label = operation != null ? " (" + operation.type() + ")" : "";
                logger.info("Rejected diff batch for workflow '" + document.getName() + "': operation " + i +
                        label + " failed: " + e.getMessage());
                ValidationReport report = ValidationReport.builder(ValidationProfile.RUNTIME)
                        .add(ValidationIssue.error(e.getCategory(), e.getNodeName(), "operations[" + i + "]",
                                "Operation " + i + label + ": " + e.getMessage()))
                        .build();
                return DiffResult.rejected(document, report, i, validateOnly);
            }
        }

        ValidationReport report = ValidationReport.builder(ValidationProfile.RUNTIME).build();
        if (validateOnly) {
            logger.info("Validated " + operations.size() + " operations for workflow '" + document.getName() + "'");
            return DiffResult.applied(document, report, operations.size(), true);
        }

        WorkflowDocument result = working.toDocument();
        logger.info("Applied " + operations.size() + " operations to workflow '" + document.getName() + "'");
        return DiffResult.applied(result, report, operations.size(), false);
    }

    private void applyOperation(WorkingCopy working, DiffOperation operation) throws DiffOperationException {
        if (operation instanceof DiffOperation.AddNode op) {
            addNode(working, op);
        } else if (operation instanceof DiffOperation.RemoveNode op) {
            removeNode(working, op);
        } else if (operation instanceof DiffOperation.UpdateNode op) {
            updateNode(working, op);
        } else if (operation instanceof DiffOperation.MoveNode op) {
            WorkflowNode node = working.resolve(op.node());
            working.replace(node, node.toBuilder().position(op.position()).build());
        } else if (operation instanceof DiffOperation.EnableNode op) {
            WorkflowNode node = working.resolve(op.node());
            working.replace(node, node.toBuilder().disabled(false).build());
        } else if (operation instanceof DiffOperation.DisableNode op) {
            WorkflowNode node = working.resolve(op.node());
            working.replace(node, node.toBuilder().disabled(true).build());
        } else if (operation instanceof DiffOperation.AddConnection op) {
            addConnection(working, op);
        } else if (operation instanceof DiffOperation.RemoveConnection op) {
            removeConnection(working, op);
        } else if (operation instanceof DiffOperation.UpdateConnection op) {
            updateConnection(working, op);
        } else if (operation instanceof DiffOperation.UpdateSettings op) {
            working.settings.putAll(ParameterTrees.copyMap(op.settings()));
        } else if (operation instanceof DiffOperation.UpdateName op) {
            if (op.name() == null || op.name().isBlank()) {
                throw new DiffOperationException(IssueCategory.STRUCTURE, "Workflow name cannot be blank");
            }
            working.name = op.name();
        } else if (operation instanceof DiffOperation.AddTag op) {
            if (op.tag().isBlank()) {
                throw new DiffOperationException(IssueCategory.STRUCTURE, "Tag cannot be blank");
            }
            if (!working.tags.contains(op.tag())) {
                working.tags.add(op.tag());
            }
        } else if (operation instanceof DiffOperation.RemoveTag op) {
            if (!working.tags.remove(op.tag())) {
                throw new DiffOperationException(IssueCategory.STRUCTURE, "Tag '" + op.tag() + "' not found");
            }
        } else {
            throw new DiffOperationException(IssueCategory.STRUCTURE,
                    "Unsupported operation type: " + operation.getClass().getSimpleName());
        }
    }

    private void addNode(WorkingCopy working, DiffOperation.AddNode op) throws DiffOperationException {
        WorkflowNode node = op.node();
        if (node.getName().isBlank()) {
            throw new DiffOperationException(IssueCategory.STRUCTURE, "Node name cannot be blank");
        }
        if (working.findByName(node.getName()) != null) {
            throw new DiffOperationException(IssueCategory.STRUCTURE, node.getName(),
                    "Node with name '" + node.getName() + "' already exists");
        }
        if (node.getId() != null && working.findById(node.getId()) != null) {
            throw new DiffOperationException(IssueCategory.STRUCTURE, node.getName(),
                    "Node with id '" + node.getId() + "' already exists");
        }
        checkNodeType(node);

        WorkflowNode added = node.getId() != null ? node : node.toBuilder().id(UUID.randomUUID().toString()).build();
        working.nodes.add(added);
    }

    private void removeNode(WorkingCopy working, DiffOperation.RemoveNode op) throws DiffOperationException {
        WorkflowNode node = working.resolve(op.node());
        working.nodes.remove(node);
        working.removeConnectionsOf(node.getName());
    }

    private void updateNode(WorkingCopy working, DiffOperation.UpdateNode op) throws DiffOperationException {
        WorkflowNode node = working.resolve(op.node());
        if (op.changes().isEmpty()) {
            throw new DiffOperationException(IssueCategory.STRUCTURE, node.getName(),
                    "updateNode requires at least one change");
        }

        Map<String, Object> nodeMap = mapper.nodeToMap(node);
        for (Map.Entry<String, Object> change : op.changes().entrySet()) {
            String path = change.getKey();
            String attribute = path.split("\\.", 2)[0];
            if ("id".equals(attribute)) {
                throw new DiffOperationException(IssueCategory.STRUCTURE, node.getName(), "Node id cannot be changed");
            }
            if (!NODE_ATTRIBUTES.contains(attribute)) {
                throw new DiffOperationException(IssueCategory.STRUCTURE, node.getName(),
                        "Unknown node attribute '" + attribute + "' in change path '" + path + "'; valid attributes: " +
                        String.join(", ", new TreeSet<>(NODE_ATTRIBUTES)));
            }
            try {
                ParameterTrees.setPath(nodeMap, path, ParameterTrees.deepCopy(change.getValue()));
            } catch (IllegalArgumentException e) {
                throw new DiffOperationException(IssueCategory.STRUCTURE, node.getName(), e.getMessage());
            }
        }

        WorkflowNode updated;
        try {
            updated = mapper.nodeFromMap(nodeMap, "node");
        } catch (WorkflowFormatException e) {
            throw new DiffOperationException(IssueCategory.STRUCTURE, node.getName(),
                    "Invalid change to node '" + node.getName() + "': " + e.getMessage());
        }
        if (!updated.getType().equals(node.getType())) {
            checkNodeType(updated);
        }

        String oldName = node.getName();
        String newName = updated.getName();
        if (!newName.equals(oldName)) {
            if (newName.isBlank()) {
                throw new DiffOperationException(IssueCategory.STRUCTURE, oldName, "Node name cannot be blank");
            }
            if (working.findByName(newName) != null) {
                throw new DiffOperationException(IssueCategory.STRUCTURE, oldName,
                        "Cannot rename node '" + oldName + "': a node named '" + newName + "' already exists");
            }
            working.renameInConnections(oldName, newName);
        }
        working.replace(node, updated);
    }

    private void addConnection(WorkingCopy working, DiffOperation.AddConnection op) throws DiffOperationException {
        WorkflowNode source = working.resolve(op.source());
        WorkflowNode target = working.resolve(op.target());
        ConnectionTarget connectionTarget = new ConnectionTarget(target.getName(), op.targetInput(), op.targetIndex());
        checkConnection(working, source, op.sourceOutput(), op.sourceIndex(), connectionTarget);
        working.addConnection(source.getName(), op.sourceOutput(), op.sourceIndex(), connectionTarget);
    }

    private void removeConnection(WorkingCopy working, DiffOperation.RemoveConnection op) throws DiffOperationException {
        String source = working.endpointName(op.source());
        String target = working.endpointName(op.target());

        boolean removed = false;
        List<List<ConnectionTarget>> ports = working.ports(source, op.sourceOutput());
        for (int i = 0; i < ports.size(); i++) {
            if (op.sourceIndex() != null && op.sourceIndex() != i) {
                continue;
            }
            removed |= ports.get(i).removeIf(t -> t.node().equals(target) && t.type().equals(op.targetInput()));
        }
        if (!removed) {
            throw new DiffOperationException(IssueCategory.CONNECTION, source,
                    "Connection not found from '" + source + "' (" + op.sourceOutput() +
                    (op.sourceIndex() != null ? "[" + op.sourceIndex() + "]" : "") + ") to '" + target + "'");
        }
    }

    private void updateConnection(WorkingCopy working, DiffOperation.UpdateConnection op) throws DiffOperationException {
        String source = working.endpointName(op.source());
        String target = working.endpointName(op.target());
        if (op.changes().isEmpty()) {
            throw new DiffOperationException(IssueCategory.CONNECTION, source,
                    "updateConnection requires at least one change");
        }

        List<List<ConnectionTarget>> ports = working.ports(source, op.sourceOutput());
        int matchIndex = -1;
        ConnectionTarget match = null;
        for (int i = 0; i < ports.size(); i++) {
            for (ConnectionTarget candidate : ports.get(i)) {
                if (candidate.node().equals(target)) {
                    if (match != null) {
                        throw new DiffOperationException(IssueCategory.CONNECTION, source,
                                "Multiple connections from '" + source + "' to '" + target + "' on output '" +
                                op.sourceOutput() + "'; remove and add them explicitly");
                    }
                    match = candidate;
                    matchIndex = i;
                }
            }
        }
        if (match == null) {
            throw new DiffOperationException(IssueCategory.CONNECTION, source,
                    "Connection not found from '" + source + "' (" + op.sourceOutput() + ") to '" + target + "'");
        }
        ports.get(matchIndex).remove(match);

        DiffOperation.ConnectionChanges changes = op.changes();
        String output = changes.sourceOutput() != null ? changes.sourceOutput() : op.sourceOutput();
        int sourceIndex = changes.sourceIndex() != null ? changes.sourceIndex() : matchIndex;
        ConnectionTarget replacement = new ConnectionTarget(target,
                changes.targetInput() != null ? changes.targetInput() : match.type(),
                changes.targetIndex() != null ? changes.targetIndex() : match.index());

        WorkflowNode sourceNode = working.findByName(source);
        if (sourceNode == null) {
            throw new DiffOperationException(IssueCategory.CONNECTION, source,
                    "Connection source '" + source + "' does not exist");
        }
        checkConnection(working, sourceNode, output, sourceIndex, replacement);
        working.addConnection(source, output, sourceIndex, replacement);
    }

    private void checkConnection(WorkingCopy working, WorkflowNode source, String output, int sourceIndex,
                                 ConnectionTarget target) throws DiffOperationException {
        String name = source.getName();
        if (sourceIndex < 0) {
            throw new DiffOperationException(IssueCategory.CONNECTION, name,
                    "Source index must be a non-negative integer, got " + sourceIndex);
        }
        if (target.index() < 0) {
            throw new DiffOperationException(IssueCategory.CONNECTION, name,
                    "Target index must be a non-negative integer, got " + target.index());
        }

        if (ConnectionTarget.MAIN.equals(output)) {
            Optional<NodeTypeSchema> schema = repository.getNodeType(NodeTypeNames.normalize(source.getType()));
            if (schema.isPresent()) {
                boolean errorOutput = WorkflowGraphValidator.CONTINUE_ERROR_OUTPUT.equals(source.getOnError());
                int allowed = schema.get().getOutputCount() + (errorOutput ? 1 : 0);
                if (sourceIndex >= allowed) {
                    throw new DiffOperationException(IssueCategory.CONNECTION, name,
                            "Output index " + sourceIndex + " of node '" + name + "' is out of range: node type " +
                            schema.get().getNodeType() + " has " + allowed + (allowed == 1 ? " output" : " outputs"));
                }
            }
        }

        List<List<ConnectionTarget>> ports = working.ports(name, output);
        if (sourceIndex < ports.size() && ports.get(sourceIndex).contains(target)) {
            throw new DiffOperationException(IssueCategory.CONNECTION, name,
                    "Connection already exists from '" + name + "' (" + output + "[" + sourceIndex + "]) to '" +
                    target.node() + "'");
        }
    }

    private static void checkNodeType(WorkflowNode node) throws DiffOperationException {
        String type = node.getType();
        if (NodeTypeNames.isShortForm(type)) {
            throw new DiffOperationException(IssueCategory.STRUCTURE, node.getName(),
                    "Invalid node type '" + type + "': use the full form '" + NodeTypeNames.toDocumentForm(type) + "'");
        }
        if (!NodeTypeNames.hasPackagePrefix(type)) {
            throw new DiffOperationException(IssueCategory.STRUCTURE, node.getName(),
                    "Invalid node type '" + type + "': node types must include a package prefix, " +
                    "for example n8n-nodes-base.httpRequest");
        }
    }

    /**
     * Mutable state of one batch. Built from the caller's document and turned back into
     * an immutable document only when every operation succeeded.
     */
    private static final class WorkingCopy {
        private final WorkflowDocument original;
        private final List<WorkflowNode> nodes;
        private final Map<String, Map<String, List<List<ConnectionTarget>>>> connections;
        private final Map<String, Object> settings;
        private final List<String> tags;
        private String name;

        private WorkingCopy(WorkflowDocument document) {
            this.original = document;
            this.nodes = new ArrayList<>(document.getNodes());
            this.connections = document.getConnections().toMutableMap();
            this.settings = ParameterTrees.copyMap(document.getSettings());
            this.tags = new ArrayList<>(document.getTags());
            this.name = document.getName();
        }

        private WorkflowNode findByName(String nodeName) {
            for (WorkflowNode node : nodes) {
                if (node.getName().equals(nodeName)) {
                    return node;
                }
            }
            return null;
        }

        private WorkflowNode findById(String id) {
            for (WorkflowNode node : nodes) {
                if (id.equals(node.getId())) {
                    return node;
                }
            }
            return null;
        }

        /**
         * Looks a string up as a name and as an id; returns null when neither matches.
         */
        private WorkflowNode lookup(String reference) throws DiffOperationException {
            WorkflowNode byName = findByName(reference);
            WorkflowNode byId = findById(reference);
            if (byName != null && byId != null && byName != byId) {
                throw new DiffOperationException(IssueCategory.STRUCTURE, byName.getName(),
                        "Ambiguous node reference '" + reference + "': it is the id of node '" + byId.getName() +
                        "' and the name of another node");
            }
            return byName != null ? byName : byId;
        }

        private WorkflowNode resolve(String reference) throws DiffOperationException {
            WorkflowNode node = lookup(reference);
            if (node == null) {
                throw new DiffOperationException(IssueCategory.STRUCTURE,
                        "Node not found: '" + reference + "'; available nodes: " + nodeNames());
            }
            return node;
        }

        private WorkflowNode resolve(NodeReference reference) throws DiffOperationException {
            if (reference.id() == null || reference.name() == null) {
                return resolve(reference.id() != null ? reference.id() : reference.name());
            }
            WorkflowNode byId = findById(reference.id());
            WorkflowNode byName = findByName(reference.name());
            if (byId == null && byName == null) {
                throw new DiffOperationException(IssueCategory.STRUCTURE,
                        "Node not found: " + reference + "; available nodes: " + nodeNames());
            }
            if (byId != byName) {
                throw new DiffOperationException(IssueCategory.STRUCTURE,
                        "Ambiguous node reference: id '" + reference.id() + "' and name '" + reference.name() +
                        "' do not refer to the same node");
            }
            return byId;
        }

        /**
         * Name to use for a connection endpoint: the node's name when it exists, the raw
         * reference otherwise, so that dangling connections can still be addressed.
         */
        private String endpointName(String reference) throws DiffOperationException {
            WorkflowNode node = lookup(reference);
            return node != null ? node.getName() : reference;
        }

        private String nodeNames() {
            List<String> names = new ArrayList<>();
            for (WorkflowNode node : nodes) {
                names.add(node.getName());
            }
            return names.isEmpty() ? "(none)" : String.join(", ", names);
        }

        private void replace(WorkflowNode current, WorkflowNode replacement) {
            nodes.set(nodes.indexOf(current), replacement);
        }

        private List<List<ConnectionTarget>> ports(String source, String output) {
            Map<String, List<List<ConnectionTarget>>> outputs = connections.get(source);
            if (outputs == null || !outputs.containsKey(output)) {
                return new ArrayList<>();
            }
            return outputs.get(output);
        }

        private void addConnection(String source, String output, int sourceIndex, ConnectionTarget target) {
            List<List<ConnectionTarget>> ports = connections
                    .computeIfAbsent(source, k -> new LinkedHashMap<>())
                    .computeIfAbsent(output, k -> new ArrayList<>());
            while (ports.size() <= sourceIndex) {
                ports.add(new ArrayList<>());
            }
            ports.get(sourceIndex).add(target);
        }

        private void removeConnectionsOf(String nodeName) {
            connections.remove(nodeName);
            for (Map<String, List<List<ConnectionTarget>>> outputs : connections.values()) {
                for (List<List<ConnectionTarget>> ports : outputs.values()) {
                    for (List<ConnectionTarget> port : ports) {
                        port.removeIf(target -> target.node().equals(nodeName));
                    }
                }
            }
        }

        private void renameInConnections(String oldName, String newName) {
            Map<String, Map<String, List<List<ConnectionTarget>>>> renamed = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, List<List<ConnectionTarget>>>> entry : connections.entrySet()) {
                for (List<List<ConnectionTarget>> ports : entry.getValue().values()) {
                    for (List<ConnectionTarget> port : ports) {
                        port.replaceAll(target -> target.node().equals(oldName) ? target.withNode(newName) : target);
                    }
                }
                renamed.put(entry.getKey().equals(oldName) ? newName : entry.getKey(), entry.getValue());
            }
            connections.clear();
            connections.putAll(renamed);
        }

        private WorkflowDocument toDocument() {
            Iterator<Map.Entry<String, Map<String, List<List<ConnectionTarget>>>>> sources =
                    connections.entrySet().iterator();
            while (sources.hasNext()) {
                Map<String, List<List<ConnectionTarget>>> outputs = sources.next().getValue();
                outputs.values().forEach(WorkingCopy::trimTrailingEmptyPorts);
                outputs.values().removeIf(List::isEmpty);
                if (outputs.isEmpty()) {
                    sources.remove();
                }
            }

            return original.toBuilder()
                    .name(name)
                    .nodes(nodes)
                    .connections(WorkflowConnections.of(connections))
                    .settings(settings)
                    .tags(tags)
                    .build();
        }

        private static void trimTrailingEmptyPorts(List<List<ConnectionTarget>> ports) {
            while (!ports.isEmpty() && ports.get(ports.size() - 1).isEmpty()) {
                ports.remove(ports.size() - 1);
            }
        }
    }
}
