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

import java.util.Set;

/**
 * What an expression may legitimately refer to.
 *
 * @param availableNodes names of the nodes in the workflow, or null to skip reference checks
 * @param currentNodeName the node whose parameters are being checked, may be null
 * @param hasInputData whether the node receives items from an incoming connection
 * @param inLoop whether the node runs inside a loop, where items are fed back by the loop node
 */
public record ExpressionContext(Set<String> availableNodes, String currentNodeName, boolean hasInputData,
                                boolean inLoop) {

    public ExpressionContext {
        availableNodes = availableNodes != null ? Set.copyOf(availableNodes) : null;
    }

    public ExpressionContext(Set<String> availableNodes, String currentNodeName, boolean hasInputData) {
        this(availableNodes, currentNodeName, hasInputData, false);
    }

    public ExpressionContext withInLoop(boolean loop) {
        return new ExpressionContext(availableNodes, currentNodeName, hasInputData, loop);
    }

    public static ExpressionContext of(Set<String> availableNodes) {
        return new ExpressionContext(availableNodes, null, true);
    }

    public static ExpressionContext unrestricted() {
        return new ExpressionContext(null, null, true);
    }
}
