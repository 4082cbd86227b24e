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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * A single node of a workflow document.
 *
 * <p>Execution-control attributes are kept exactly as supplied (for example
 * {@code onError} is a plain string) so that invalid values reach the validators
 * instead of failing while the document is decoded.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class WorkflowNode {

    private final String id;
    private final String name;
    private final String type;
    private final Double typeVersion;
    private final Position position;
    private final Map<String, Object> parameters;
    private final Map<String, Object> credentials;
    private final boolean disabled;
    private final String onError;
    private final Boolean continueOnFail;
    private final Boolean retryOnFail;
    private final Integer maxTries;
    private final Integer waitBetweenTries;
    private final Boolean alwaysOutputData;
    private final Boolean executeOnce;
    private final String notes;
    private final Boolean notesInFlow;

    private WorkflowNode(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "Node name cannot be null");
        this.type = Objects.requireNonNull(builder.type, "Node type cannot be null");
        this.typeVersion = builder.typeVersion;
        this.position = builder.position;
        this.parameters = Collections.unmodifiableMap(ParameterTrees.copyMap(builder.parameters));
        this.credentials = builder.credentials != null
                ? Collections.unmodifiableMap(ParameterTrees.copyMap(builder.credentials))
                : null;
        this.disabled = builder.disabled;
        this.onError = builder.onError;
        this.continueOnFail = builder.continueOnFail;
        this.retryOnFail = builder.retryOnFail;
        this.maxTries = builder.maxTries;
        this.waitBetweenTries = builder.waitBetweenTries;
        this.alwaysOutputData = builder.alwaysOutputData;
        this.executeOnce = builder.executeOnce;
        this.notes = builder.notes;
        this.notesInFlow = builder.notesInFlow;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .type(type)
                .typeVersion(typeVersion)
                .position(position)
                .parameters(parameters)
                .credentials(credentials)
                .disabled(disabled)
                .onError(onError)
                .continueOnFail(continueOnFail)
                .retryOnFail(retryOnFail)
                .maxTries(maxTries)
                .waitBetweenTries(waitBetweenTries)
                .alwaysOutputData(alwaysOutputData)
                .executeOnce(executeOnce)
                .notes(notes)
                .notesInFlow(notesInFlow);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public Double getTypeVersion() {
        return typeVersion;
    }

    public Position getPosition() {
        return position;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * Credential references keyed by credential type, or null when the node declares none.
     */
    public Map<String, Object> getCredentials() {
        return credentials;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public String getOnError() {
        return onError;
    }

    public Boolean getContinueOnFail() {
        return continueOnFail;
    }

    public Boolean getRetryOnFail() {
        return retryOnFail;
    }

    public Integer getMaxTries() {
        return maxTries;
    }

    public Integer getWaitBetweenTries() {
        return waitBetweenTries;
    }

    public Boolean getAlwaysOutputData() {
        return alwaysOutputData;
    }

    public Boolean getExecuteOnce() {
        return executeOnce;
    }

    public String getNotes() {
        return notes;
    }

    public Boolean getNotesInFlow() {
        return notesInFlow;
    }

    // Parameter trees may be cyclic, so they take part in equals() only.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return disabled == that.disabled &&
               Objects.equals(id, that.id) &&
               Objects.equals(name, that.name) &&
               Objects.equals(type, that.type) &&
               Objects.equals(typeVersion, that.typeVersion) &&
               Objects.equals(position, that.position) &&
               Objects.equals(parameters, that.parameters) &&
               Objects.equals(credentials, that.credentials) &&
               Objects.equals(onError, that.onError) &&
               Objects.equals(continueOnFail, that.continueOnFail) &&
               Objects.equals(retryOnFail, that.retryOnFail) &&
               Objects.equals(maxTries, that.maxTries) &&
               Objects.equals(waitBetweenTries, that.waitBetweenTries) &&
               Objects.equals(alwaysOutputData, that.alwaysOutputData) &&
               Objects.equals(executeOnce, that.executeOnce) &&
               Objects.equals(notes, that.notes) &&
               Objects.equals(notesInFlow, that.notesInFlow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, typeVersion, position, disabled, onError);
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", type='" + type + '\'' +
               ", typeVersion=" + typeVersion +
               ", disabled=" + disabled +
               '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private String type;
        private Double typeVersion;
        private Position position;
        private Map<String, ?> parameters;
        private Map<String, ?> credentials;
        private boolean disabled;
        private String onError;
        private Boolean continueOnFail;
        private Boolean retryOnFail;
        private Integer maxTries;
        private Integer waitBetweenTries;
        private Boolean alwaysOutputData;
        private Boolean executeOnce;
        private String notes;
        private Boolean notesInFlow;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder typeVersion(Double typeVersion) {
            this.typeVersion = typeVersion;
            return this;
        }

        public Builder typeVersion(double typeVersion) {
            this.typeVersion = typeVersion;
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder parameters(Map<String, ?> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder credentials(Map<String, ?> credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder disabled(boolean disabled) {
            this.disabled = disabled;
            return this;
        }

        public Builder onError(String onError) {
            this.onError = onError;
            return this;
        }

        public Builder continueOnFail(Boolean continueOnFail) {
            this.continueOnFail = continueOnFail;
            return this;
        }

        public Builder retryOnFail(Boolean retryOnFail) {
            this.retryOnFail = retryOnFail;
            return this;
        }

        public Builder maxTries(Integer maxTries) {
            this.maxTries = maxTries;
            return this;
        }

        public Builder waitBetweenTries(Integer waitBetweenTries) {
            this.waitBetweenTries = waitBetweenTries;
            return this;
        }

        public Builder alwaysOutputData(Boolean alwaysOutputData) {
            this.alwaysOutputData = alwaysOutputData;
            return this;
        }

        public Builder executeOnce(Boolean executeOnce) {
            this.executeOnce = executeOnce;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder notesInFlow(Boolean notesInFlow) {
            this.notesInFlow = notesInFlow;
            return this;
        }

        public WorkflowNode build() {
            return new WorkflowNode(this);
        }
    }
}
