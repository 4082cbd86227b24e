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

import dev.mars.flowsmith.core.exceptions.FlowsmithException;
import dev.mars.flowsmith.workflow.validation.IssueCategory;

/**
 * Raised inside the diff engine when an operation's precondition does not hold
 * against the current in-batch state. The engine converts it into a rejected
 * {@link DiffResult}; it never escapes {@link WorkflowDiffEngine#apply}.
 */
public class DiffOperationException extends FlowsmithException {

    private final IssueCategory category;
    private final String nodeName;

    public DiffOperationException(IssueCategory category, String nodeName, String message) {
        super(message);
        this.category = category;
        this.nodeName = nodeName;
    }

    public DiffOperationException(IssueCategory category, String message) {
        this(category, null, message);
    }

    public IssueCategory getCategory() {
        return category;
    }

    public String getNodeName() {
        return nodeName;
    }
}
