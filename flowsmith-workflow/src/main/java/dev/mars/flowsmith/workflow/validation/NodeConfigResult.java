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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating one node's configuration under a profile.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class NodeConfigResult {

    private final String nodeType;
    private final ValidationProfile profile;
    private final List<ValidationIssue> issues;
    private final List<String> visibleProperties;
    private final List<String> hiddenProperties;
    private final List<String> nextSteps;
    private final Map<String, Object> exampleConfig;

    NodeConfigResult(String nodeType, ValidationProfile profile, List<ValidationIssue> issues,
                     List<String> visibleProperties, List<String> hiddenProperties,
                     List<String> nextSteps, Map<String, Object> exampleConfig) {
        this.nodeType = nodeType;
        this.profile = profile;
        this.issues = List.copyOf(issues);
        this.visibleProperties = List.copyOf(visibleProperties);
        this.hiddenProperties = List.copyOf(hiddenProperties);
        this.nextSteps = List.copyOf(nextSteps);
        this.exampleConfig = exampleConfig != null ? Collections.unmodifiableMap(exampleConfig) : null;
    }

    public String getNodeType() {
        return nodeType;
    }

    public ValidationProfile getProfile() {
        return profile;
    }

    public boolean isValid() {
        return getErrors().isEmpty();
    }

    /**
     * All findings after the profile policy was applied, in the order they were found.
     */
    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public List<ValidationIssue> getErrors() {
        return filter(ValidationIssue.Severity.ERROR);
    }

    public List<ValidationIssue> getWarnings() {
        return filter(ValidationIssue.Severity.WARNING);
    }

    public List<String> getVisibleProperties() {
        return visibleProperties;
    }

    public List<String> getHiddenProperties() {
        return hiddenProperties;
    }

    /**
     * Next-step suggestions; only populated by profiles that include guidance.
     */
    public List<String> getNextSteps() {
        return nextSteps;
    }

    /**
     * Minimal working configuration built from the schema, or null when the profile
     * does not include guidance.
     */
    public Map<String, Object> getExampleConfig() {
        return exampleConfig;
    }

    private List<ValidationIssue> filter(ValidationIssue.Severity severity) {
        List<ValidationIssue> result = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            if (issue.getSeverity() == severity) {
                result.add(issue);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "NodeConfigResult{" +
               "nodeType='" + nodeType + '\'' +
               ", profile=" + profile +
               ", valid=" + isValid() +
               ", issues=" + issues.size() +
               '}';
    }
}
