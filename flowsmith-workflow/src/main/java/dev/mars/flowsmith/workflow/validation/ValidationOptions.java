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

import java.util.Objects;

/**
 * Options of a workflow validation pass.
 */
public final class ValidationOptions {

    private final ValidationProfile profile;
    private final boolean validateNodes;
    private final boolean validateConnections;
    private final boolean validateExpressions;

    private ValidationOptions(Builder builder) {
        this.profile = Objects.requireNonNull(builder.profile, "Profile cannot be null");
        this.validateNodes = builder.validateNodes;
        this.validateConnections = builder.validateConnections;
        this.validateExpressions = builder.validateExpressions;
    }

    public static ValidationOptions defaults() {
        return builder().build();
    }

    public static ValidationOptions forProfile(ValidationProfile profile) {
        return builder().profile(profile).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ValidationProfile getProfile() {
        return profile;
    }

    public boolean isValidateNodes() {
        return validateNodes;
    }

    public boolean isValidateConnections() {
        return validateConnections;
    }

    public boolean isValidateExpressions() {
        return validateExpressions;
    }

    @Override
    public String toString() {
        return "ValidationOptions{" +
               "profile=" + profile +
               ", validateNodes=" + validateNodes +
               ", validateConnections=" + validateConnections +
               ", validateExpressions=" + validateExpressions +
               '}';
    }

    public static class Builder {
        private ValidationProfile profile = ValidationProfile.RUNTIME;
        private boolean validateNodes = true;
        private boolean validateConnections = true;
        private boolean validateExpressions = true;

        public Builder profile(ValidationProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder validateNodes(boolean validateNodes) {
            this.validateNodes = validateNodes;
            return this;
        }

        public Builder validateConnections(boolean validateConnections) {
            this.validateConnections = validateConnections;
            return this;
        }

        public Builder validateExpressions(boolean validateExpressions) {
            this.validateExpressions = validateExpressions;
            return this;
        }

        public ValidationOptions build() {
            return new ValidationOptions(this);
        }
    }
}
