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
 * A single validation finding. Issues are immutable; the {@code with*} methods return
 * adjusted copies.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class ValidationIssue {

    public enum Severity {
        ERROR, WARNING, INFO
    }

    private final Severity severity;
    private final IssueCategory category;
    private final String nodeName;
    private final String fieldPath;
    private final String message;
    private final Object suggestedValue;

    public ValidationIssue(Severity severity, IssueCategory category, String nodeName, String fieldPath,
                           String message, Object suggestedValue) {
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
        this.category = Objects.requireNonNull(category, "Category cannot be null");
        this.nodeName = nodeName;
        this.fieldPath = fieldPath;
        this.message = Objects.requireNonNull(message, "Message cannot be null");
        this.suggestedValue = suggestedValue;
    }

    public static ValidationIssue error(IssueCategory category, String nodeName, String fieldPath, String message) {
        return new ValidationIssue(Severity.ERROR, category, nodeName, fieldPath, message, null);
    }

    public static ValidationIssue warning(IssueCategory category, String nodeName, String fieldPath, String message) {
        return new ValidationIssue(Severity.WARNING, category, nodeName, fieldPath, message, null);
    }

    public static ValidationIssue info(IssueCategory category, String nodeName, String fieldPath, String message) {
        return new ValidationIssue(Severity.INFO, category, nodeName, fieldPath, message, null);
    }

    public ValidationIssue withSuggestedValue(Object value) {
        return new ValidationIssue(severity, category, nodeName, fieldPath, message, value);
    }

    public ValidationIssue withSeverity(Severity newSeverity) {
        return newSeverity == severity ? this
                : new ValidationIssue(newSeverity, category, nodeName, fieldPath, message, suggestedValue);
    }

    /**
     * Sets the node name unless the issue already carries one.
     */
    public ValidationIssue withNodeName(String name) {
        return nodeName != null ? this
                : new ValidationIssue(severity, category, name, fieldPath, message, suggestedValue);
    }

    public Severity getSeverity() {
        return severity;
    }

    public IssueCategory getCategory() {
        return category;
    }

    public String getNodeName() {
        return nodeName;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Corrected value for auto-correctable issues, otherwise null.
     */
    public Object getSuggestedValue() {
        return suggestedValue;
    }

    public boolean isAutoCorrectable() {
        return suggestedValue != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationIssue that = (ValidationIssue) o;
        return severity == that.severity &&
               category == that.category &&
               Objects.equals(nodeName, that.nodeName) &&
               Objects.equals(fieldPath, that.fieldPath) &&
               Objects.equals(message, that.message) &&
               Objects.equals(suggestedValue, that.suggestedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, category, nodeName, fieldPath, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.name());

        if (nodeName != null) {
            sb.append(" (node '").append(nodeName).append("')");
        }

        if (fieldPath != null) {
            sb.append(" [").append(fieldPath).append("]");
        }

        sb.append(": ").append(message);

        if (suggestedValue != null) {
            sb.append(" (suggested: ").append(suggestedValue).append(")");
        }

        return sb.toString();
    }
}
