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

/**
 * Identifies a node by stable id, by current name, or by both. When both are given
 * they must designate the same node.
 */
public record NodeReference(String id, String name) {

    public NodeReference {
        if (id == null && name == null) {
            throw new IllegalArgumentException("Node reference needs an id or a name");
        }
    }

    public static NodeReference byId(String id) {
        return new NodeReference(id, null);
    }

    public static NodeReference byName(String name) {
        return new NodeReference(null, name);
    }

    @Override
    public String toString() {
        if (id != null && name != null) {
            return "'" + name + "' (id " + id + ")";
        }
        return id != null ? "id " + id : "'" + name + "'";
    }
}
