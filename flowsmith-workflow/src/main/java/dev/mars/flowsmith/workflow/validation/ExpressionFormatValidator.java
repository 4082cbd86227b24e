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

import dev.mars.flowsmith.model.ParameterTrees;
import dev.mars.flowsmith.nodetype.PropertySchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enforces the expression prefix convention: a value containing {@code {{ }}} is only
 * evaluated when it starts with {@code =}. Values of {@code resourceLocator} properties
 * must wrap expressions in {@code {__rl: true, value: "=...", mode: "expression"}}.
 *
 * <p>Keys starting with {@code __} are internal and are not traversed. Depth and cycle
 * anomalies of the walk are left to {@link ExpressionValidator}, which walks the same
 * tree and reports them once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ExpressionFormatValidator {

    public static final String EXPRESSION_PREFIX = "=";
    public static final Set<String> RESOURCE_LOCATOR_MODES = Set.of("id", "url", "expression", "name", "list");

    private static final String RL_MARKER = "__rl";

    private final ParameterTreeWalker walker;

    public ExpressionFormatValidator() {
        this(ParameterTreeWalker.DEFAULT_MAX_DEPTH);
    }

    public ExpressionFormatValidator(int maxDepth) {
        this.walker = new ParameterTreeWalker(maxDepth);
    }

    /**
     * Checks one value.
     *
     * @param resourceLocator whether the value belongs to a {@code resourceLocator} property
     */
    public List<ValidationIssue> validateValue(String fieldPath, Object value, boolean resourceLocator) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (resourceLocator) {
            checkResourceLocator(fieldPath, value, issues);
        } else if (isResourceLocatorWrapper(value)) {
            checkWrapper(fieldPath, (Map<?, ?>) value, issues);
        } else if (value instanceof String s) {
            checkPrefix(fieldPath, s, issues);
        }
        return issues;
    }

    /**
     * Checks every value of a node's parameters.
     *
     * @param propertiesByName top-level property schemas keyed by name, used to find
     *                         resource-locator parameters
     */
    public List<ValidationIssue> validateParameters(Map<String, Object> parameters,
                                                    Map<String, PropertySchema> propertiesByName) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (parameters == null) {
            return issues;
        }
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            String key = entry.getKey();
            if (key.startsWith("__")) {
                continue;
            }
            PropertySchema property = propertiesByName.get(key);
            if (property != null && property.isResourceLocator()) {
                checkResourceLocator(key, entry.getValue(), issues);
            } else {
                checkTree(key, entry.getValue(), issues);
            }
        }
        return issues;
    }

    private void checkTree(String rootPath, Object value, List<ValidationIssue> issues) {
        if (isResourceLocatorWrapper(value)) {
            checkWrapper(rootPath, (Map<?, ?>) value, issues);
            return;
        }
        walker.walk(value, rootPath, new ParameterTreeWalker.Visitor() {
            @Override
            public void visitValue(String path, String key, Object leaf) {
                if (leaf instanceof String s) {
                    checkPrefix(path, s, issues);
                }
            }

            @Override
            public boolean shouldVisit(String path, String key, Object child) {
                if (key != null && key.startsWith("__")) {
                    return false;
                }
                if (isResourceLocatorWrapper(child)) {
                    checkWrapper(path, (Map<?, ?>) child, issues);
                    return false;
                }
                return true;
            }
        });
    }

    private void checkPrefix(String path, String value, List<ValidationIssue> issues) {
        if (ExpressionValidator.containsExpression(value) && !value.startsWith(EXPRESSION_PREFIX)) {
            issues.add(ValidationIssue.error(IssueCategory.EXPRESSION, null, path,
                    "Expression is missing the '=' prefix and will be treated as literal text")
                    .withSuggestedValue(EXPRESSION_PREFIX + value));
        }
    }

    private void checkResourceLocator(String path, Object value, List<ValidationIssue> issues) {
        if (value instanceof String s) {
            if (ExpressionValidator.containsExpression(s)) {
                String expression = s.startsWith(EXPRESSION_PREFIX) ? s : EXPRESSION_PREFIX + s;
                issues.add(ValidationIssue.error(IssueCategory.EXPRESSION, null, path,
                        "Resource locator holds an expression as a plain string; use the structured " +
                        "form with mode 'expression'")
                        .withSuggestedValue(wrapper(expression, "expression")));
            }
        } else if (value instanceof Map<?, ?> map) {
            checkWrapper(path, map, issues);
        }
    }

    private void checkWrapper(String path, Map<?, ?> wrapper, List<ValidationIssue> issues) {
        Object mode = wrapper.get("mode");
        Object value = wrapper.get("value");

        if (!(mode instanceof String) || !RESOURCE_LOCATOR_MODES.contains(mode)) {
            issues.add(ValidationIssue.error(IssueCategory.EXPRESSION, null, ParameterTrees.childPath(path, "mode"),
                    "Invalid resource locator mode '" + mode + "'; expected one of id, url, expression, name, list"));
        }

        if (value instanceof String s && ExpressionValidator.containsExpression(s)) {
            if (!s.startsWith(EXPRESSION_PREFIX)) {
                issues.add(ValidationIssue.error(IssueCategory.EXPRESSION, null, ParameterTrees.childPath(path, "value"),
                        "Resource locator expression is missing the '=' prefix")
                        .withSuggestedValue(wrapper(EXPRESSION_PREFIX + s, "expression")));
            } else if (mode instanceof String m && RESOURCE_LOCATOR_MODES.contains(m) && !"expression".equals(m)) {
                issues.add(ValidationIssue.warning(IssueCategory.EXPRESSION, null, ParameterTrees.childPath(path, "mode"),
                        "Resource locator holds an expression but its mode is '" + mode + "'")
                        .withSuggestedValue(wrapper(s, "expression")));
            }
        }
    }

    private static boolean isResourceLocatorWrapper(Object value) {
        return value instanceof Map<?, ?> map && Boolean.TRUE.equals(map.get(RL_MARKER));
    }

    private static Map<String, Object> wrapper(String value, String mode) {
        Map<String, Object> wrapper = new LinkedHashMap<>();
        wrapper.put(RL_MARKER, true);
        wrapper.put("value", value);
        wrapper.put("mode", mode);
        return wrapper;
    }
}
