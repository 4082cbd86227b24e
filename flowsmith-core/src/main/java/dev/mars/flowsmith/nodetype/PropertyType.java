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


package dev.mars.flowsmith.nodetype;

import java.util.Optional;

/**
 * Type tags a node property may declare. Tags outside this set are carried as plain
 * strings on {@link PropertySchema} and are not type-checked.
 */
public enum PropertyType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    OPTIONS("options"),
    MULTI_OPTIONS("multiOptions"),
    COLLECTION("collection"),
    FIXED_COLLECTION("fixedCollection"),
    JSON("json"),
    RESOURCE_LOCATOR("resourceLocator"),
    DATE_TIME("dateTime"),
    COLOR("color"),
    HIDDEN("hidden"),
    NOTICE("notice"),
    CREDENTIALS_SELECT("credentialsSelect"),
    FILTER("filter"),
    ASSIGNMENT_COLLECTION("assignmentCollection");

    private final String tag;

    PropertyType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static Optional<PropertyType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        for (PropertyType type : values()) {
            if (type.tag.equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Display-only properties never hold configuration.
     */
    public boolean isDisplayOnly() {
        return this == NOTICE || this == HIDDEN;
    }
}
