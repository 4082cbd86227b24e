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
import dev.mars.flowsmith.workflow.validation.ParameterTreeWalker;
import dev.mars.flowsmith.workflow.validation.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Applies to every node type: literal values in credential-like fields should live in
 * the credential store instead.
 */
public class HardcodedSecretRule implements NodeRule {

    private static final Pattern SECRET_KEY = Pattern.compile(
            "(?i).*(api[_-]?key|password|passwd|secret|token|access[_-]?key|private[_-]?key)$");
    private static final int MIN_SECRET_LENGTH = 8;

    private final ParameterTreeWalker walker;

    public HardcodedSecretRule(int maxDepth) {
        this.walker = new ParameterTreeWalker(maxDepth);
    }

    @Override
    public boolean appliesTo(String normalizedType) {
        return true;
    }

    @Override
    public List<ValidationIssue> check(Map<String, Object> parameters) {
        List<ValidationIssue> issues = new ArrayList<>();
        // anomalies are reported by the expression pass over the same tree
        walker.walk(parameters, "", (path, key, value) -> {
            if (key != null && value instanceof String s
                    && s.length() >= MIN_SECRET_LENGTH
                    && !s.startsWith("=") && !s.contains("{{")
                    && SECRET_KEY.matcher(key).matches()) {
                issues.add(ValidationIssue.warning(IssueCategory.SECURITY, null, path,
                        "Possible hardcoded secret in '" + key + "'; store it as a credential instead"));
            }
        });
        return issues;
    }
}
