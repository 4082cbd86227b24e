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

import dev.mars.flowsmith.workflow.validation.IssueCategory;
import dev.mars.flowsmith.workflow.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Code node: the script must not be empty and must return its items.
 */
public class CodeNodeRule implements NodeRule {

    private static final Pattern RETURN_STATEMENT = Pattern.compile("\\breturn\\b");

    @Override
    public boolean appliesTo(String normalizedType) {
        return "nodes-base.code".equals(normalizedType);
    }

    @Override
    public List<ValidationIssue> check(Map<String, Object> parameters) {
        List<ValidationIssue> issues = new ArrayList<>();
        String language = NodeRule.stringValue(parameters, "language");
        String field = "python".equals(language) || "pythonNative".equals(language) ? "pythonCode" : "jsCode";
        Object value = parameters.get(field);

        if (NodeRule.isExpression(value)) {
            return issues;
        }
        if (!(value instanceof String code) || code.isBlank()) {
            issues.add(ValidationIssue.error(IssueCategory.EXECUTION, null, field, "Code cannot be empty"));
            return issues;
        }
        if (!RETURN_STATEMENT.matcher(code).find()) {
            issues.add(ValidationIssue.error(IssueCategory.EXECUTION, null, field,
                    "Code must return its output items, for example 'return items;'"));
        }
        return issues;
    }
}
