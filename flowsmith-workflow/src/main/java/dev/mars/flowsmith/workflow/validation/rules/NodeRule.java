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


package dev.mars.flowsmith.workflow.validation.rules;

import dev.mars.flowsmith.workflow.validation.ValidationIssue;

import java.util.List;
import java.util.Map;

/**
 * A behavioural rule that only makes sense for particular node types.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface NodeRule {

    /**
     * @param normalizedType short-form type name such as {@code nodes-base.code}
     */
    boolean appliesTo(String normalizedType);

    /**
     * Checks a node's parameters. Returned issues carry field paths relative to the
     * parameters; the caller attaches the node name and applies the validation profile.
     */
    List<ValidationIssue> check(Map<String, Object> parameters);

    static boolean isExpression(Object value) {
        return value instanceof String s && s.startsWith("=");
    }

    static String stringValue(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        return value instanceof String s ? s : null;
    }
}
