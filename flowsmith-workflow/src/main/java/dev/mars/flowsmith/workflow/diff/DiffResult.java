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

import dev.mars.flowsmith.model.WorkflowDocument;
import dev.mars.flowsmith.workflow.validation.ValidationReport;

import java.util.Objects;

/**
 * Outcome of applying a diff batch.
 *
 * <p>On success {@link #getDocument()} is the transformed document, or the original one
 * in validate-only mode. On failure it is always the original, unmodified document and
 * {@link #getReport()} holds one error for the operation that was rejected, with a field
 * path of the form {@code operations[i]}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class DiffResult {

    private final boolean success;
    private final WorkflowDocument document;
    private final ValidationReport report;
    private final int operationsApplied;
    private final int failedOperationIndex;
    private final boolean validateOnly;

    private DiffResult(boolean success, WorkflowDocument document, ValidationReport report,
                       int operationsApplied, int failedOperationIndex, boolean validateOnly) {
        this.success = success;
        this.document = Objects.requireNonNull(document, "Document cannot be null");
        this.report = Objects.requireNonNull(report, "Report cannot be null");
        this.operationsApplied = operationsApplied;
        this.failedOperationIndex = failedOperationIndex;
        this.validateOnly = validateOnly;
    }

    static DiffResult applied(WorkflowDocument document, ValidationReport report, int operationsApplied,
                              boolean validateOnly) {
        return new DiffResult(true, document, report, operationsApplied, -1, validateOnly);
    }

    static DiffResult rejected(WorkflowDocument original, ValidationReport report, int failedOperationIndex,
                               boolean validateOnly) {
        return new DiffResult(false, original, report, 0, failedOperationIndex, validateOnly);
    }

    public boolean isSuccess() {
        return success;
    }

    public WorkflowDocument getDocument() {
        return document;
    }

    public ValidationReport getReport() {
        return report;
    }

    /**
     * Number of operations applied; zero for a rejected batch.
     */
    public int getOperationsApplied() {
        return operationsApplied;
    }

    /**
     * Index of the rejected operation, or -1 when the batch was accepted or rejected as a whole.
     */
    public int getFailedOperationIndex() {
        return failedOperationIndex;
    }

    public boolean isValidateOnly() {
        return validateOnly;
    }

    public String getMessage() {
        if (!success) {
            return report.getErrors().isEmpty() ? "Diff rejected" : report.getErrors().get(0).getMessage();
        }
        return validateOnly
                ? "Validation passed for " + operationsApplied + " operations"
                : "Applied " + operationsApplied + " operations";
    }

    @Override
    public String toString() {
        return "DiffResult{" +
                "success=" + success +
                ", operationsApplied=" + operationsApplied +
                ", failedOperationIndex=" + failedOperationIndex +
                ", validateOnly=" + validateOnly +
                ", errors=" + report.getErrorCount() +
                '}';
    }
}
