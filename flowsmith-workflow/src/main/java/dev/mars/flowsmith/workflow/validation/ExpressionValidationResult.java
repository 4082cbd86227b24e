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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregated outcome of checking one expression string or a whole parameter tree.
 * Variable and node sets keep first-seen order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ExpressionValidationResult {

    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();
    private final Set<String> usedVariables = new LinkedHashSet<>();
    private final Set<String> referencedNodes = new LinkedHashSet<>();
    private int expressionCount;

    ExpressionValidationResult() {
    }

    void add(ValidationIssue issue) {
        if (issue.getSeverity() == ValidationIssue.Severity.ERROR) {
            errors.add(issue);
        } else {
            warnings.add(issue);
        }
    }

    void addVariable(String variable) {
        usedVariables.add(variable);
    }

    void addReferencedNode(String node) {
        referencedNodes.add(node);
    }

    void incrementExpressionCount() {
        expressionCount++;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationIssue> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<ValidationIssue> getIssues() {
        List<ValidationIssue> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }

    public Set<String> getUsedVariables() {
        return Collections.unmodifiableSet(usedVariables);
    }

    public Set<String> getReferencedNodes() {
        return Collections.unmodifiableSet(referencedNodes);
    }

    public int getExpressionCount() {
        return expressionCount;
    }

    @Override
    public String toString() {
        return "ExpressionValidationResult{" +
               "valid=" + isValid() +
               ", errors=" + errors.size() +
               ", warnings=" + warnings.size() +
               ", variables=" + usedVariables +
               ", nodes=" + referencedNodes +
               '}';
    }
}
