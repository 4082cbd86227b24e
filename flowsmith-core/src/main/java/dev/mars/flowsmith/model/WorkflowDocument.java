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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable workflow document: an ordered list of nodes, the connection graph between
 * them and opaque workflow-level settings. Documents are request-scoped values; every
 * mutation produces a new instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class WorkflowDocument {

    private final String id;
    private final String name;
    private final List<WorkflowNode> nodes;
    private final WorkflowConnections connections;
    private final Map<String, Object> settings;
    private final List<String> tags;
    private final boolean active;

    private WorkflowDocument(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "Workflow name cannot be null");
        this.nodes = List.copyOf(builder.nodes);
        this.connections = builder.connections != null ? builder.connections : WorkflowConnections.empty();
        this.settings = Collections.unmodifiableMap(ParameterTrees.copyMap(builder.settings));
        this.tags = List.copyOf(builder.tags);
        this.active = builder.active;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .nodes(nodes)
                .connections(connections)
                .settings(settings)
                .tags(tags)
                .active(active);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<WorkflowNode> getNodes() {
        return nodes;
    }

    public WorkflowConnections getConnections() {
        return connections;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    public List<String> getTags() {
        return tags;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Finds the first node with the given name. Names are expected to be unique, but
     * documents under validation may break that rule.
     */
    public Optional<WorkflowNode> findNodeByName(String nodeName) {
        return nodes.stream().filter(n -> n.getName().equals(nodeName)).findFirst();
    }

    public Optional<WorkflowNode> findNodeById(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return nodes.stream().filter(n -> nodeId.equals(n.getId())).findFirst();
    }

    public List<String> getNodeNames() {
        List<String> names = new ArrayList<>(nodes.size());
        for (WorkflowNode node : nodes) {
            names.add(node.getName());
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDocument that = (WorkflowDocument) o;
        return active == that.active &&
               Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(nodes, that.nodes) &&
               Objects.equals(connections, that.connections) &&
               Objects.equals(settings, that.settings) &&
               Objects.equals(tags, that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, nodes, connections, tags, active);
    }

    @Override
    public String toString() {
        return "WorkflowDocument{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", nodes=" + nodes.size() +
               ", connections=" + connections.asList().size() +
               ", tags=" + tags +
               '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private List<WorkflowNode> nodes = new ArrayList<>();
        private WorkflowConnections connections;
        private Map<String, ?> settings;
        private List<String> tags = new ArrayList<>();
        private boolean active;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder nodes(List<WorkflowNode> nodes) {
            this.nodes = new ArrayList<>(nodes);
            return this;
        }

        public Builder addNode(WorkflowNode node) {
            this.nodes.add(Objects.requireNonNull(node, "Node cannot be null"));
            return this;
        }

        public Builder connections(WorkflowConnections connections) {
            this.connections = connections;
            return this;
        }

        public Builder settings(Map<String, ?> settings) {
            this.settings = settings;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags);
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public WorkflowDocument build() {
            return new WorkflowDocument(this);
        }
    }
}
