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
 * A single flattened edge of the connection graph.
 */
public record Connection(String sourceNode, String sourceOutput, int sourceIndex, ConnectionTarget target) {

    public Connection {
        Objects.requireNonNull(sourceNode, "Source node cannot be null");
        Objects.requireNonNull(sourceOutput, "Source output cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
    }

    public boolean isSelfReference() {
        return sourceNode.equals(target.node());
    }

    @Override
    public String toString() {
        return sourceNode + "." + sourceOutput + "[" + sourceIndex + "] -> " +
               target.node() + "." + target.type() + "[" + target.index() + "]";
    }
}
