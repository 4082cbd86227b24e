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
import java.util.Set;
import java.util.regex.Pattern;

/**
 * SQL database nodes: flags destructive statements and interpolated expressions in
 * hand-written queries.
 */
public class DatabaseQueryRule implements NodeRule {

    private static final Set<String> DATABASE_TYPES = Set.of("nodes-base.postgres", "nodes-base.mySql");

    private static final Pattern DELETE_STATEMENT = Pattern.compile("\\bDELETE\\s+FROM\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHERE_CLAUSE = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DESTRUCTIVE_DDL = Pattern.compile("\\b(DROP\\s+(TABLE|DATABASE|SCHEMA)|TRUNCATE)\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public boolean appliesTo(String normalizedType) {
        return DATABASE_TYPES.contains(normalizedType);
    }

    @Override
    public List<ValidationIssue> check(Map<String, Object> parameters) {
        List<ValidationIssue> issues = new ArrayList<>();
        String query = NodeRule.stringValue(parameters, "query");
        if (query == null || query.isBlank()) {
            return issues;
        }

        for (String statement : query.split(";")) {
            if (DELETE_STATEMENT.matcher(statement).find() && !WHERE_CLAUSE.matcher(statement).find()) {
                issues.add(ValidationIssue.warning(IssueCategory.SECURITY, null, "query",
                        "DELETE without a WHERE clause removes every row of the table"));
            }
            if (DESTRUCTIVE_DDL.matcher(statement).find()) {
                issues.add(ValidationIssue.warning(IssueCategory.SECURITY, null, "query",
                        "Query contains a destructive statement (DROP or TRUNCATE)"));
            }
        }

        if (query.contains("{{")) {
            issues.add(ValidationIssue.warning(IssueCategory.SECURITY, null, "query",
                    "Expressions interpolated into SQL can allow injection; use query parameters instead"));
        }
        return issues;
    }
}
