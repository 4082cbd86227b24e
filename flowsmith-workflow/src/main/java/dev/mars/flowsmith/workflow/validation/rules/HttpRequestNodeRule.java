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
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * HTTP request node: literal URLs need an http(s) scheme, and body-carrying methods
 * are expected to send a body.
 */
public class HttpRequestNodeRule implements NodeRule {

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    @Override
    public boolean appliesTo(String normalizedType) {
        return "nodes-base.httpRequest".equals(normalizedType);
    }

    @Override
    public List<ValidationIssue> check(Map<String, Object> parameters) {
        List<ValidationIssue> issues = new ArrayList<>();

        String url = NodeRule.stringValue(parameters, "url");
        if (url != null && !url.isBlank() && !NodeRule.isExpression(url)) {
            String lower = url.trim().toLowerCase(Locale.ROOT);
            if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                ValidationIssue issue = ValidationIssue.error(IssueCategory.EXECUTION, null, "url",
                        "URL must start with http:// or https://");
                if (!lower.contains("://")) {
                    issue = issue.withSuggestedValue("https://" + url.trim());
                }
                issues.add(issue);
            }
        }

        String method = NodeRule.stringValue(parameters, "method");
        if (method != null && BODY_METHODS.contains(method.toUpperCase(Locale.ROOT))
                && !Boolean.TRUE.equals(parameters.get("sendBody"))) {
            issues.add(ValidationIssue.warning(IssueCategory.STYLE, null, "sendBody",
                    method.toUpperCase(Locale.ROOT) + " request does not send a body"));
        }
        return issues;
    }
}
