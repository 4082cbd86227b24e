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

package dev.mars.flowsmith.core.exceptions;

import java.util.List;

/**
 * Thrown when a workflow document, diff operation or node-type catalog has a
 * malformed shape: a missing required field, a missing type discriminator or a
 * value of the wrong kind. These are never coerced; the caller must fix the input.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class WorkflowFormatException extends FlowsmithException {

    private final String fieldPath;
    private final List<String> violations;

    public WorkflowFormatException(String message) {
        this(null, message, List.of(), null);
    }

    public WorkflowFormatException(String message, Throwable cause) {
        this(null, message, List.of(), cause);
    }

    public WorkflowFormatException(String fieldPath, String message) {
        this(fieldPath, message, List.of(), null);
    }

    public WorkflowFormatException(String fieldPath, String message, Throwable cause) {
        this(fieldPath, message, List.of(), cause);
    }

    public WorkflowFormatException(String fieldPath, String message, List<String> violations, Throwable cause) {
        super(message, cause);
        this.fieldPath = fieldPath;
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * Individual schema violations when the failure came from a structural schema check.
     */
    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        for (String violation : violations) {
            sb.append("\n  - ").append(violation);
        }

        return sb.toString();
    }
}
