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
 * Summary counters of one validation pass.
 */
public final class ValidationStatistics {

    private int totalNodes;
    private int enabledNodes;
    private int triggerNodes;
    private int validConnections;
    private int invalidConnections;
    private int expressionsValidated;

    void setTotalNodes(int totalNodes) {
        this.totalNodes = totalNodes;
    }

    void incrementEnabledNodes() {
        enabledNodes++;
    }

    void incrementTriggerNodes() {
        triggerNodes++;
    }

    void incrementValidConnections() {
        validConnections++;
    }

    void incrementInvalidConnections() {
        invalidConnections++;
    }

    void addExpressionsValidated(int count) {
        expressionsValidated += count;
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public int getEnabledNodes() {
        return enabledNodes;
    }

    public int getTriggerNodes() {
        return triggerNodes;
    }

    public int getValidConnections() {
        return validConnections;
    }

    public int getInvalidConnections() {
        return invalidConnections;
    }

    public int getExpressionsValidated() {
        return expressionsValidated;
    }

    ValidationStatistics copy() {
        ValidationStatistics copy = new ValidationStatistics();
        copy.totalNodes = totalNodes;
        copy.enabledNodes = enabledNodes;
        copy.triggerNodes = triggerNodes;
        copy.validConnections = validConnections;
        copy.invalidConnections = invalidConnections;
        copy.expressionsValidated = expressionsValidated;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationStatistics that = (ValidationStatistics) o;
        return totalNodes == that.totalNodes &&
               enabledNodes == that.enabledNodes &&
               triggerNodes == that.triggerNodes &&
               validConnections == that.validConnections &&
               invalidConnections == that.invalidConnections &&
               expressionsValidated == that.expressionsValidated;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalNodes, enabledNodes, triggerNodes, validConnections,
                invalidConnections, expressionsValidated);
    }

    @Override
    public String toString() {
        return "ValidationStatistics{" +
               "totalNodes=" + totalNodes +
               ", enabledNodes=" + enabledNodes +
               ", triggerNodes=" + triggerNodes +
               ", validConnections=" + validConnections +
               ", invalidConnections=" + invalidConnections +
               ", expressionsValidated=" + expressionsValidated +
               '}';
    }
}
