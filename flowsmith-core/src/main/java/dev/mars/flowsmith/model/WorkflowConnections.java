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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable connection graph of a workflow document, keyed by source node name,
 * then output type ({@code main}, {@code error}, {@code ai_tool}, ...), then
 * output-port index. Each port holds an ordered list of targets.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class WorkflowConnections {

    private static final WorkflowConnections EMPTY = new WorkflowConnections(Map.of());

    private final Map<String, Map<String, List<List<ConnectionTarget>>>> bySource;

    private WorkflowConnections(Map<String, Map<String, List<List<ConnectionTarget>>>> source) {
        Map<String, Map<String, List<List<ConnectionTarget>>>> copy = new LinkedHashMap<>();
        source.forEach((node, outputs) -> {
            Map<String, List<List<ConnectionTarget>>> outputCopy = new LinkedHashMap<>();
            outputs.forEach((type, ports) -> {
                List<List<ConnectionTarget>> portCopy = new ArrayList<>();
                for (List<ConnectionTarget> port : ports) {
                    portCopy.add(port != null ? List.copyOf(port) : List.of());
                }
                outputCopy.put(type, Collections.unmodifiableList(portCopy));
            });
            copy.put(node, Collections.unmodifiableMap(outputCopy));
        });
        this.bySource = Collections.unmodifiableMap(copy);
    }

    public static WorkflowConnections empty() {
        return EMPTY;
    }

    public static WorkflowConnections of(Map<String, Map<String, List<List<ConnectionTarget>>>> connections) {
        Objects.requireNonNull(connections, "Connections cannot be null");
        return connections.isEmpty() ? EMPTY : new WorkflowConnections(connections);
    }

    public Set<String> getSourceNodes() {
        return bySource.keySet();
    }

    public Map<String, List<List<ConnectionTarget>>> getOutputs(String sourceNode) {
        return bySource.getOrDefault(sourceNode, Map.of());
    }

    /**
     * Flattens the graph into edges, in document order.
     */
    public List<Connection> asList() {
        List<Connection> result = new ArrayList<>();
        bySource.forEach((source, outputs) -> outputs.forEach((type, ports) -> {
            for (int i = 0; i < ports.size(); i++) {
                for (ConnectionTarget target : ports.get(i)) {
                    result.add(new Connection(source, type, i, target));
                }
            }
        }));
        return result;
    }

    public boolean hasEdges() {
        for (Map<String, List<List<ConnectionTarget>>> outputs : bySource.values()) {
            for (List<List<ConnectionTarget>> ports : outputs.values()) {
                for (List<ConnectionTarget> port : ports) {
                    if (!port.isEmpty()) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Returns a fully mutable copy of the nested structure.
     */
    public Map<String, Map<String, List<List<ConnectionTarget>>>> toMutableMap() {
        Map<String, Map<String, List<List<ConnectionTarget>>>> copy = new LinkedHashMap<>();
        bySource.forEach((node, outputs) -> {
            Map<String, List<List<ConnectionTarget>>> outputCopy = new LinkedHashMap<>();
            outputs.forEach((type, ports) -> {
                List<List<ConnectionTarget>> portCopy = new ArrayList<>();
                for (List<ConnectionTarget> port : ports) {
                    portCopy.add(new ArrayList<>(port));
                }
                outputCopy.put(type, portCopy);
            });
            copy.put(node, outputCopy);
        });
        return copy;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowConnections that = (WorkflowConnections) o;
        return Objects.equals(bySource, that.bySource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bySource);
    }

    @Override
    public String toString() {
        return "WorkflowConnections" + bySource;
    }

    public static class Builder {
        private final Map<String, Map<String, List<List<ConnectionTarget>>>> connections = new LinkedHashMap<>();

        public Builder add(String sourceNode, String sourceOutput, int sourceIndex, ConnectionTarget target) {
            if (sourceIndex < 0) {
                throw new IllegalArgumentException("Source index cannot be negative: " + sourceIndex);
            }
            List<List<ConnectionTarget>> ports = connections
                    .computeIfAbsent(sourceNode, k -> new LinkedHashMap<>())
                    .computeIfAbsent(sourceOutput, k -> new ArrayList<>());
            while (ports.size() <= sourceIndex) {
                ports.add(new ArrayList<>());
            }
            ports.get(sourceIndex).add(target);
            return this;
        }

        public Builder main(String sourceNode, String targetNode) {
            return add(sourceNode, ConnectionTarget.MAIN, 0, ConnectionTarget.main(targetNode));
        }

        public WorkflowConnections build() {
            return WorkflowConnections.of(connections);
        }
    }
}
