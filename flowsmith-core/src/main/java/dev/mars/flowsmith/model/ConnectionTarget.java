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


package dev.mars.flowsmith.model;

import java.util.Objects;

/**
 * One endpoint of a connection: the node it leads to, the input type on that node
 * and the input index. The index is kept as given so that negative values can be
 * reported by the graph validator rather than rejected while decoding.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public record ConnectionTarget(String node, String type, int index) {

    public static final String MAIN = "main";
    public static final String AI_TOOL = "ai_tool";

    public ConnectionTarget {
        Objects.requireNonNull(node, "Target node cannot be null");
        type = type != null ? type : MAIN;
    }

    public static ConnectionTarget main(String node) {
        return new ConnectionTarget(node, MAIN, 0);
    }

    public ConnectionTarget withNode(String newNode) {
        return new ConnectionTarget(newNode, type, index);
    }
}
