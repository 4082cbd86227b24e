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

/**
 * Rule categories. A {@link ValidationProfile} decides per category whether the rules
 * run and at which severity their findings are reported.
 */
public enum IssueCategory {
    /** Document shape: names, ids, node types, versions. */
    STRUCTURE,
    /** Connection endpoints, indices and output cardinality. */
    CONNECTION,
    /** Graph shape findings such as self-references and unconnected nodes. */
    TOPOLOGY,
    REQUIRED,
    TYPE,
    EXPRESSION,
    /** Execution-correctness rules: error policies, retries, node-specific behaviour. */
    EXECUTION,
    SECURITY,
    STYLE,
    /** Recoverable anomalies: malformed schema entries, cyclic or over-deep parameter trees. */
    ANOMALY
}
