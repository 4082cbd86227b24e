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


package dev.mars.flowsmith.nodetype;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Capability schema of one node type, as served by a {@link NodeTypeRepository}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class NodeTypeSchema {

    private final String nodeType;
    private final String displayName;
    private final String description;
    private final String packageName;
    private final double latestVersion;
    private final boolean versioned;
    private final List<PropertySchema> properties;
    private final List<String> outputs;
    private final List<CredentialRequirement> credentials;
    private final boolean trigger;
    private final boolean webhook;
    private final boolean loopCapable;
    private final boolean aiTool;

    private NodeTypeSchema(Builder builder) {
        this.nodeType = NodeTypeNames.normalize(Objects.requireNonNull(builder.nodeType, "Node type cannot be null"));
        this.displayName = builder.displayName != null ? builder.displayName : nodeType;
        this.description = builder.description;
        this.packageName = builder.packageName != null ? builder.packageName : NodeTypeNames.packageOf(nodeType);
        this.latestVersion = builder.latestVersion;
        this.versioned = builder.versioned;
        this.properties = List.copyOf(builder.properties);
        this.outputs = List.copyOf(builder.outputs);
        this.credentials = List.copyOf(builder.credentials);
        this.trigger = builder.trigger;
        this.webhook = builder.webhook;
        this.loopCapable = builder.loopCapable;
        this.aiTool = builder.aiTool;
    }

    public static Builder builder(String nodeType) {
        return new Builder().nodeType(nodeType);
    }

    /**
     * Normalized (short form) type name, e.g. {@code nodes-base.httpRequest}.
     */
    public String getNodeType() {
        return nodeType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getPackageName() {
        return packageName;
    }

    public double getLatestVersion() {
        return latestVersion;
    }

    public boolean isVersioned() {
        return versioned;
    }

    public List<PropertySchema> getProperties() {
        return properties;
    }

    /**
     * Names of the main outputs. An empty list means a single unnamed output.
     */
    public List<String> getOutputs() {
        return outputs;
    }

    public int getOutputCount() {
        return Math.max(1, outputs.size());
    }

    public String getOutputName(int index) {
        return index >= 0 && index < outputs.size() ? outputs.get(index) : null;
    }

    public List<CredentialRequirement> getCredentials() {
        return credentials;
    }

    public boolean isTrigger() {
        return trigger;
    }

    public boolean isWebhook() {
        return webhook;
    }

    /**
     * Loop-capable types may feed one of their outputs back into themselves.
     */
    public boolean isLoopCapable() {
        return loopCapable;
    }

    /**
     * AI tool types are built to be attached to an agent through an {@code ai_tool} connection.
     */
    public boolean isAiTool() {
        return aiTool;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeTypeSchema that = (NodeTypeSchema) o;
        return Double.compare(that.latestVersion, latestVersion) == 0 &&
               versioned == that.versioned &&
               trigger == that.trigger &&
               webhook == that.webhook &&
               loopCapable == that.loopCapable &&
               aiTool == that.aiTool &&
               Objects.equals(nodeType, that.nodeType) &&
               Objects.equals(displayName, that.displayName) &&
               Objects.equals(packageName, that.packageName) &&
               Objects.equals(properties, that.properties) &&
               Objects.equals(outputs, that.outputs) &&
               Objects.equals(credentials, that.credentials);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeType, latestVersion);
    }

    @Override
    public String toString() {
        return "NodeTypeSchema{" +
               "nodeType='" + nodeType + '\'' +
               ", latestVersion=" + latestVersion +
               ", properties=" + properties.size() +
               ", outputs=" + outputs +
               ", trigger=" + trigger +
               ", loopCapable=" + loopCapable +
               '}';
    }

    public static class Builder {
        private String nodeType;
        private String displayName;
        private String description;
        private String packageName;
        private double latestVersion = 1;
        private boolean versioned;
        private List<PropertySchema> properties = new ArrayList<>();
        private List<String> outputs = new ArrayList<>();
        private List<CredentialRequirement> credentials = new ArrayList<>();
        private boolean trigger;
        private boolean webhook;
        private boolean loopCapable;
        private boolean aiTool;

        public Builder nodeType(String nodeType) {
            this.nodeType = nodeType;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder latestVersion(double latestVersion) {
            this.latestVersion = latestVersion;
            return this;
        }

        public Builder versioned(boolean versioned) {
            this.versioned = versioned;
            return this;
        }

        public Builder properties(List<PropertySchema> properties) {
            this.properties = new ArrayList<>(properties);
            return this;
        }

        public Builder property(PropertySchema property) {
            this.properties.add(property);
            return this;
        }

        public Builder outputs(List<String> outputs) {
            this.outputs = new ArrayList<>(outputs);
            return this;
        }

        public Builder credentials(List<CredentialRequirement> credentials) {
            this.credentials = new ArrayList<>(credentials);
            return this;
        }

        public Builder trigger(boolean trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder webhook(boolean webhook) {
            this.webhook = webhook;
            return this;
        }

        public Builder loopCapable(boolean loopCapable) {
            this.loopCapable = loopCapable;
            return this;
        }

        public Builder aiTool(boolean aiTool) {
            this.aiTool = aiTool;
            return this;
        }

        public NodeTypeSchema build() {
            return new NodeTypeSchema(this);
        }
    }
}
