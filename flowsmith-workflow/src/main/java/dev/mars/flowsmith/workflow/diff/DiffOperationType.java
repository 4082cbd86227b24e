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

import java.util.Optional;

/**
 * Discriminator values of diff operations, as they appear in the {@code type} field.
 */
public enum DiffOperationType {
    ADD_NODE("addNode"),
    REMOVE_NODE("removeNode"),
    UPDATE_NODE("updateNode"),
    MOVE_NODE("moveNode"),
    ENABLE_NODE("enableNode"),
    DISABLE_NODE("disableNode"),
    ADD_CONNECTION("addConnection"),
    REMOVE_CONNECTION("removeConnection"),
    UPDATE_CONNECTION("updateConnection"),
    UPDATE_SETTINGS("updateSettings"),
    UPDATE_NAME("updateName"),
    ADD_TAG("addTag"),
    REMOVE_TAG("removeTag");

    private final String wireName;

    DiffOperationType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<DiffOperationType> fromWireName(String wireName) {
        for (DiffOperationType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
