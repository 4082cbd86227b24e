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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks template expressions ({@code {{ ... }}}) embedded in parameter values.
 *
 * <p>Each string is scanned with a brace-depth state machine that reports unmatched
 * delimiters, nested expressions and empty expressions. The body of every complete
 * expression is then checked for back-references to nodes that do not exist, negative
 * {@code $items} indices, template-literal syntax, input variables used without input,
 * optional chaining and variables missing their {@code $} prefix. Whole parameter trees are walked
 * with {@link ParameterTreeWalker}, so every finding carries the dot/bracket path of the
 * value it came from.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ExpressionValidator {

    public static final String OPEN = "{{";
    public static final String CLOSE = "}}";

    private static final Pattern NODE_BRACKET_REFERENCE = Pattern.compile("\\$node\\[\\s*([\"'])(.*?)\\1\\s*]");
    private static final Pattern NODE_DOT_REFERENCE = Pattern.compile("\\$node\\.([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern NODE_CALL_REFERENCE = Pattern.compile("\\$\\(\\s*([\"'])(.*?)\\1\\s*\\)");
    private static final Pattern ITEMS_CALL = Pattern.compile(
            "\\$items\\(\\s*([\"'])(.*?)\\1\\s*(?:,\\s*(-?\\d+)\\s*)?(?:,\\s*(-?\\d+)\\s*)?\\)");
    private static final Pattern VARIABLE = Pattern.compile(
            "\\$(json|input|binary|node|items|env|vars|workflow|execution|parameter|prevNode|runIndex|itemIndex|now|today|position|jmespath)\\b");
    private static final Pattern INPUT_VARIABLE = Pattern.compile("\\$input\\b");
    private static final Pattern OPTIONAL_CHAINING = Pattern.compile("\\?\\.(?!\\d)");
    private static final Pattern STRING_LITERAL = Pattern.compile("([\"'])(?:\\\\.|(?!\\1).)*\\1");
    private static final Pattern MISSING_PREFIX = Pattern.compile(
            "(?<![$.\\w])(json|node|input|items|workflow|execution)(?=\\s*[.\\[])");
    private static final Pattern JSON_BRACKET_ACCESS = Pattern.compile("\\$json\\[\\s*([\"'])([A-Za-z_][A-Za-z0-9_]*)\\1\\s*]");

    private final ParameterTreeWalker walker;

    public ExpressionValidator() {
        this(ParameterTreeWalker.DEFAULT_MAX_DEPTH);
    }

    public ExpressionValidator(int maxDepth) {
        this.walker = new ParameterTreeWalker(maxDepth);
    }

    public static boolean containsExpression(String value) {
        return value != null && value.contains(OPEN);
    }

    /**
     * Validates one string value.
     */
    public ExpressionValidationResult validateExpression(String value, ExpressionContext context) {
        ExpressionValidationResult result = new ExpressionValidationResult();
        checkString(value, null, context, result);
        return result;
    }

    public ExpressionValidationResult validateParameters(Object parameters, ExpressionContext context) {
        return validateParameters(parameters, context, "");
    }

    /**
     * Validates every string in a parameter tree, unioning variable and node references.
     * Over-deep and circular structures are reported as warnings and never followed.
     */
    public ExpressionValidationResult validateParameters(Object parameters, ExpressionContext context, String rootPath) {
        ExpressionValidationResult result = new ExpressionValidationResult();
        List<ValidationIssue> anomalies = walker.walk(parameters, rootPath, (path, key, value) -> {
            if (value instanceof String s) {
                checkString(s, path, context, result);
            }
        });
        for (ValidationIssue anomaly : anomalies) {
            result.add(anomaly);
        }
        return result;
    }

    private void checkString(String value, String path, ExpressionContext context, ExpressionValidationResult result) {
        if (value == null || (!value.contains(OPEN) && !value.contains(CLOSE))) {
            return;
        }

        List<String> expressions = new ArrayList<>();
        int depth = 0;
        int start = -1;
        boolean nestedReported = false;
        boolean unmatchedCloseReported = false;
        int i = 0;
        while (i < value.length() - 1) {
            if (value.startsWith(OPEN, i)) {
                if (depth > 0 && !nestedReported) {
                    nestedReported = true;
                    result.add(error(path, "Nested expressions are not supported; expressions cannot contain '{{'"));
                }
                depth++;
                if (depth == 1) {
                    start = i + OPEN.length();
                }
                i += OPEN.length();
            } else if (value.startsWith(CLOSE, i)) {
                if (depth == 0) {
                    if (!unmatchedCloseReported) {
                        unmatchedCloseReported = true;
                        result.add(error(path, "Unmatched closing expression delimiter '}}'"));
                    }
                } else {
                    depth--;
                    if (depth == 0) {
                        String body = value.substring(start, i);
                        if (body.isBlank()) {
                            result.add(error(path, "Empty expression '{{ }}'"));
                        } else {
                            expressions.add(body);
                        }
                    }
                }
                i += CLOSE.length();
            } else {
                i++;
            }
        }
        if (depth > 0) {
            result.add(error(path, "Unmatched opening expression delimiter '{{'"));
        }

        for (String expression : expressions) {
            result.incrementExpressionCount();
            checkExpressionBody(expression, path, context, result);
        }
    }

    private void checkExpressionBody(String expression, String path, ExpressionContext context,
                                     ExpressionValidationResult result) {
        Matcher variables = VARIABLE.matcher(expression);
        while (variables.find()) {
            result.addVariable("$" + variables.group(1));
        }

        checkNodeReferences(NODE_BRACKET_REFERENCE.matcher(expression), 2, path, context, result);
        checkNodeReferences(NODE_DOT_REFERENCE.matcher(expression), 1, path, context, result);
        checkNodeReferences(NODE_CALL_REFERENCE.matcher(expression), 2, path, context, result);

        Matcher items = ITEMS_CALL.matcher(expression);
        while (items.find()) {
            String node = items.group(2);
            result.addReferencedNode(node);
            if (context.availableNodes() != null && !context.availableNodes().contains(node)) {
                result.add(error(path, "$items() references node '" + node + "' which does not exist"));
            }
            for (int group = 3; group <= 4; group++) {
                String index = items.group(group);
                if (index != null && index.startsWith("-")) {
                    result.add(error(path, "$items() index " + index + " for node '" + node + "' cannot be negative"));
                }
            }
        }

        if (expression.contains("${") && !expression.contains("`")) {
            result.add(error(path, "Template literal syntax '${...}' is not supported inside expressions; " +
                    "reference values directly, for example {{ $json.field }}"));
        }

        if (!context.hasInputData() && !context.inLoop() && expression.contains("$json")) {
            result.add(ValidationIssue.warning(IssueCategory.EXPRESSION, null, path,
                    "$json is used but the node has no input connection"));
        }

        if (!context.hasInputData() && INPUT_VARIABLE.matcher(expression).find()) {
            result.add(error(path, "$input is only available when the node has input data"));
        }

        if (OPTIONAL_CHAINING.matcher(expression).find()) {
            result.add(ValidationIssue.warning(IssueCategory.EXPRESSION, null, path,
                    "Optional chaining (?.) is not supported in expressions"));
        }

        Matcher missingPrefix = MISSING_PREFIX.matcher(STRING_LITERAL.matcher(expression).replaceAll("''"));
        if (missingPrefix.find()) {
            String variable = missingPrefix.group(1);
            result.add(ValidationIssue.warning(IssueCategory.EXPRESSION, null, path,
                    "Possible missing $ prefix for variable '" + variable + "'; use $" + variable +
                    " instead of " + variable));
        }

        Matcher bracketAccess = JSON_BRACKET_ACCESS.matcher(expression);
        while (bracketAccess.find()) {
            String field = bracketAccess.group(2);
            result.add(ValidationIssue.warning(IssueCategory.STYLE, null, path,
                    "Prefer dot notation $json." + field + " over bracket access"));
        }
    }

    private void checkNodeReferences(Matcher matcher, int nameGroup, String path, ExpressionContext context,
                                     ExpressionValidationResult result) {
        while (matcher.find()) {
            String node = matcher.group(nameGroup);
            result.addReferencedNode(node);
            if (context.availableNodes() != null && !context.availableNodes().contains(node)) {
                result.add(error(path, "Expression references node '" + node + "' which does not exist"));
            }
        }
    }

    private static ValidationIssue error(String path, String message) {
        return ValidationIssue.error(IssueCategory.EXPRESSION, null, path, message);
    }
}
