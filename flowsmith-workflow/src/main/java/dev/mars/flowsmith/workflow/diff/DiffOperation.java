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

import dev.mars.flowsmith.model.ConnectionTarget;
import dev.mars.flowsmith.model.ParameterTrees;
import dev.mars.flowsmith.model.Position;
import dev.mars.flowsmith.model.WorkflowNode;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * One typed mutation of a workflow document. Each variant carries only what its
 * precondition check and apply step need, plus an optional free-text description.
 *
 * <p>Connection endpoints are plain strings that may hold either a node name or a
 * node id; the engine resolves them against the document state at the point the
 * operation runs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public sealed interface DiffOperation {

    DiffOperationType type();

    String description();

    // Node operations

    record AddNode(WorkflowNode node, String description) implements DiffOperation {
        public AddNode {
            Objects.requireNonNull(node, "Node cannot be null");
        }

        public AddNode(WorkflowNode node) {
            this(node, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.ADD_NODE;
        }
    }

    record RemoveNode(NodeReference node, String description) implements DiffOperation {
        public RemoveNode {
            Objects.requireNonNull(node, "Node reference cannot be null");
        }

        public RemoveNode(NodeReference node) {
            this(node, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.REMOVE_NODE;
        }
    }

    /**
     * Changes keyed by dot path, for example {@code parameters.url} or {@code name}.
     */
    record UpdateNode(NodeReference node, Map<String, Object> changes, String description) implements DiffOperation {
        public UpdateNode {
            Objects.requireNonNull(node, "Node reference cannot be null");
            Objects.requireNonNull(changes, "Changes cannot be null");
            changes = Collections.unmodifiableMap(ParameterTrees.copyMap(changes));
        }

        public UpdateNode(NodeReference node, Map<String, Object> changes) {
            this(node, changes, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.UPDATE_NODE;
        }
    }

    record MoveNode(NodeReference node, Position position, String description) implements DiffOperation {
        public MoveNode {
            Objects.requireNonNull(node, "Node reference cannot be null");
            Objects.requireNonNull(position, "Position cannot be null");
        }

        public MoveNode(NodeReference node, Position position) {
            this(node, position, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.MOVE_NODE;
        }
    }

    record EnableNode(NodeReference node, String description) implements DiffOperation {
        public EnableNode {
            Objects.requireNonNull(node, "Node reference cannot be null");
        }

        public EnableNode(NodeReference node) {
            this(node, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.ENABLE_NODE;
        }
    }

    record DisableNode(NodeReference node, String description) implements DiffOperation {
        public DisableNode {
            Objects.requireNonNull(node, "Node reference cannot be null");
        }

        public DisableNode(NodeReference node) {
            this(node, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.DISABLE_NODE;
        }
    }

    // Connection operations

    record AddConnection(String source, String target, String sourceOutput, String targetInput,
                         int sourceIndex, int targetIndex, String description) implements DiffOperation {
        public AddConnection {
            Objects.requireNonNull(source, "Source cannot be null");
            Objects.requireNonNull(target, "Target cannot be null");
            sourceOutput = sourceOutput != null ? sourceOutput : ConnectionTarget.MAIN;
            targetInput = targetInput != null ? targetInput : ConnectionTarget.MAIN;
        }

        public AddConnection(String source, String target) {
            this(source, target, null, null, 0, 0, null);
        }

        public AddConnection(String source, String target, int sourceIndex) {
            this(source, target, null, null, sourceIndex, 0, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.ADD_CONNECTION;
        }
    }

    /**
     * A null {@code sourceIndex} matches the connection at any output index.
     */
    record RemoveConnection(String source, String target, String sourceOutput, String targetInput,
                            Integer sourceIndex, String description) implements DiffOperation {
        public RemoveConnection {
            Objects.requireNonNull(source, "Source cannot be null");
            Objects.requireNonNull(target, "Target cannot be null");
            sourceOutput = sourceOutput != null ? sourceOutput : ConnectionTarget.MAIN;
            targetInput = targetInput != null ? targetInput : ConnectionTarget.MAIN;
        }

        public RemoveConnection(String source, String target) {
            this(source, target, null, null, null, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.REMOVE_CONNECTION;
        }
    }

    /**
     * Replaces the single connection from {@code source} to {@code target} on
     * {@code sourceOutput} with one carrying the given changes.
     */
    record UpdateConnection(String source, String target, String sourceOutput, ConnectionChanges changes,
                            String description) implements DiffOperation {
        public UpdateConnection {
            Objects.requireNonNull(source, "Source cannot be null");
            Objects.requireNonNull(target, "Target cannot be null");
            Objects.requireNonNull(changes, "Changes cannot be null");
            sourceOutput = sourceOutput != null ? sourceOutput : ConnectionTarget.MAIN;
        }

        public UpdateConnection(String source, String target, ConnectionChanges changes) {
            this(source, target, null, changes, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.UPDATE_CONNECTION;
        }
    }

    /**
     * Fields of a connection to replace; null leaves the current value.
     */
    record ConnectionChanges(String sourceOutput, String targetInput, Integer sourceIndex, Integer targetIndex) {

        public boolean isEmpty() {
            return sourceOutput == null && targetInput == null && sourceIndex == null && targetIndex == null;
        }
    }

    // Metadata operations

    record UpdateSettings(Map<String, Object> settings, String description) implements DiffOperation {
        public UpdateSettings {
            Objects.requireNonNull(settings, "Settings cannot be null");
            settings = Collections.unmodifiableMap(ParameterTrees.copyMap(settings));
        }

        public UpdateSettings(Map<String, Object> settings) {
            this(settings, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.UPDATE_SETTINGS;
        }
    }

    record UpdateName(String name, String description) implements DiffOperation {
        public UpdateName(String name) {
            this(name, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.UPDATE_NAME;
        }
    }

    record AddTag(String tag, String description) implements DiffOperation {
        public AddTag {
            Objects.requireNonNull(tag, "Tag cannot be null");
        }

        public AddTag(String tag) {
            this(tag, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.ADD_TAG;
        }
    }

    record RemoveTag(String tag, String description) implements DiffOperation {
        public RemoveTag {
            Objects.requireNonNull(tag, "Tag cannot be null");
        }

        public RemoveTag(String tag) {
            this(tag, null);
        }

        @Override
        public DiffOperationType type() {
            return DiffOperationType.REMOVE_TAG;
        }
    }
}
