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

/**
 * Webhook trigger: a path is mandatory and is written without a leading slash.
 */
public class WebhookNodeRule implements NodeRule {

    @Override
    public boolean appliesTo(String normalizedType) {
        return "nodes-base.webhook".equals(normalizedType);
    }

    @Override
    public List<ValidationIssue> check(Map<String, Object> parameters) {
        List<ValidationIssue> issues = new ArrayList<>();
        Object value = parameters.get("path");
        if (NodeRule.isExpression(value)) {
            return issues;
        }
        if (!(value instanceof String path) || path.isBlank()) {
            issues.add(ValidationIssue.error(IssueCategory.EXECUTION, null, "path", "Webhook path is required"));
            return issues;
        }
        if (path.startsWith("/")) {
            issues.add(ValidationIssue.warning(IssueCategory.STYLE, null, "path",
                    "Webhook path should not start with '/'")
                    .withSuggestedValue(path.replaceFirst("^/+", "")));
        }
        if (path.chars().anyMatch(Character::isWhitespace)) {
            issues.add(ValidationIssue.warning(IssueCategory.EXECUTION, null, "path",
                    "Webhook path contains whitespace and will be URL-encoded"));
        }
        return issues;
    }
}
