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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowsmith.model.ParameterTrees;
import dev.mars.flowsmith.nodetype.CollectionGroup;
import dev.mars.flowsmith.nodetype.NodeTypeSchema;
import dev.mars.flowsmith.nodetype.PropertySchema;
import dev.mars.flowsmith.nodetype.PropertyType;
import dev.mars.flowsmith.workflow.validation.rules.CodeNodeRule;
import dev.mars.flowsmith.workflow.validation.rules.DatabaseQueryRule;
import dev.mars.flowsmith.workflow.validation.rules.HardcodedSecretRule;
import dev.mars.flowsmith.workflow.validation.rules.HttpRequestNodeRule;
import dev.mars.flowsmith.workflow.validation.rules.NodeRule;
import dev.mars.flowsmith.workflow.validation.rules.WebhookNodeRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Validates the parameters of one node against its node-type schema.
 *
 * <p>Only properties that are visible for the current configuration take part: hidden
 * required properties are not reported as missing. Present values are type-checked
 * (values carrying the {@code =} expression prefix are skipped), nested collections are
 * checked recursively, and node-specific {@link NodeRule}s run last. Malformed schema
 * entries are reported as anomalies and skipped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class NodeConfigValidator {

    private static final Logger logger = Logger.getLogger(NodeConfigValidator.class.getName());

    private final PropertyVisibilityResolver visibilityResolver;
    private final List<NodeRule> rules;
    private final ObjectMapper objectMapper;

    public NodeConfigValidator() {
        this(ParameterTreeWalker.DEFAULT_MAX_DEPTH);
    }

    public NodeConfigValidator(int maxDepth) {
        this(new PropertyVisibilityResolver(), defaultRules(maxDepth), new ObjectMapper());
    }

    public NodeConfigValidator(PropertyVisibilityResolver visibilityResolver, List<NodeRule> rules,
                               ObjectMapper objectMapper) {
        this.visibilityResolver = Objects.requireNonNull(visibilityResolver, "Visibility resolver cannot be null");
        this.rules = List.copyOf(rules);
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
    }

    public static List<NodeRule> defaultRules(int maxDepth) {
        return List.of(
                new CodeNodeRule(),
                new WebhookNodeRule(),
                new HttpRequestNodeRule(),
                new DatabaseQueryRule(),
                new HardcodedSecretRule(maxDepth));
    }

    /**
     * Validates a configuration against the latest version of the node type.
     */
    public NodeConfigResult validate(NodeTypeSchema schema, Map<String, Object> parameters, ValidationProfile profile) {
        return validate(schema, parameters, schema.getLatestVersion(), profile);
    }

    public NodeConfigResult validate(NodeTypeSchema schema, Map<String, Object> parameters, Double typeVersion,
                                     ValidationProfile profile) {
        Objects.requireNonNull(schema, "Schema cannot be null");
        Objects.requireNonNull(profile, "Profile cannot be null");
        Map<String, Object> config = parameters != null ? parameters : Map.of();
        List<ValidationIssue> found = new ArrayList<>();

        List<PropertySchema> wellFormed = new ArrayList<>();
        List<PropertySchema> declared = schema.getProperties();
        for (int i = 0; i < declared.size(); i++) {
            PropertySchema property = declared.get(i);
            if (property.isWellFormed()) {
                wellFormed.add(property);
            } else {
                logger.warning("Skipping malformed property #" + i + " of node type " + schema.getNodeType() +
                        ": " + property);
                found.add(ValidationIssue.warning(IssueCategory.ANOMALY, null, null,
                        "Skipped malformed property definition #" + i + " of node type " + schema.getNodeType() +
                        " (missing name or type)"));
            }
        }

        Map<String, PropertySchema> visibleByName = new LinkedHashMap<>();
        Set<String> requiredNames = new LinkedHashSet<>();
        for (PropertySchema property : visibilityResolver.resolveVisible(wellFormed, config, typeVersion)) {
            if (property.getPropertyType().map(PropertyType::isDisplayOnly).orElse(false)) {
                continue;
            }
            visibleByName.putIfAbsent(property.getName(), property);
            if (property.isRequired()) {
                requiredNames.add(property.getName());
            }
        }

        Set<String> hiddenNames = new LinkedHashSet<>();
        for (PropertySchema property : wellFormed) {
            if (!visibleByName.containsKey(property.getName())) {
                hiddenNames.add(property.getName());
            }
        }

        List<String> missingRequired = checkRequired(requiredNames, visibleByName, config, found);

        for (Map.Entry<String, Object> entry : config.entrySet()) {
            PropertySchema property = visibleByName.get(entry.getKey());
            if (property != null) {
                checkValue(entry.getKey(), entry.getValue(), property, found);
            } else if (hiddenNames.contains(entry.getKey())) {
                found.add(ValidationIssue.warning(IssueCategory.STYLE, null, entry.getKey(),
                        "Property '" + entry.getKey() + "' is configured but not used with the current settings"));
            }
        }

        for (NodeRule rule : rules) {
            if (rule.appliesTo(schema.getNodeType())) {
                found.addAll(rule.check(config));
            }
        }

        List<ValidationIssue> issues = new ArrayList<>();
        for (ValidationIssue issue : found) {
            profile.apply(issue).ifPresent(issues::add);
        }

        List<String> nextSteps = new ArrayList<>();
        Map<String, Object> example = null;
        if (profile.includesGuidance()) {
            nextSteps = nextSteps(issues, missingRequired);
            example = exampleConfig(visibleByName, requiredNames, config);
        }

        return new NodeConfigResult(schema.getNodeType(), profile, issues,
                new ArrayList<>(visibleByName.keySet()), new ArrayList<>(hiddenNames), nextSteps, example);
    }

    private List<String> checkRequired(Set<String> requiredNames, Map<String, PropertySchema> visibleByName,
                                       Map<String, Object> config, List<ValidationIssue> found) {
        List<String> missing = new ArrayList<>();
        for (String name : requiredNames) {
            PropertySchema property = visibleByName.get(name);
            Object value = config.get(name);
            if (value == null) {
                missing.add(name);
                ValidationIssue issue = ValidationIssue.error(IssueCategory.REQUIRED, null, name,
                        "Required property '" + property.getDisplayName() + "' is missing");
                Object defaultValue = property.getDefaultValue();
                if (defaultValue != null && !"".equals(defaultValue)) {
                    issue = issue.withSuggestedValue(defaultValue);
                }
                found.add(issue);
            } else if (value instanceof String s && s.isBlank()
                    && PropertyType.STRING.getTag().equals(property.getType())) {
                missing.add(name);
                found.add(ValidationIssue.error(IssueCategory.REQUIRED, null, name,
                        "Required property '" + property.getDisplayName() + "' cannot be empty"));
            }
        }
        return missing;
    }

    private void checkValue(String path, Object value, PropertySchema property, List<ValidationIssue> found) {
        if (value == null || NodeRule.isExpression(value)) {
            return;
        }
        Optional<PropertyType> type = property.getPropertyType();
        if (type.isEmpty()) {
            return;
        }

        switch (type.get()) {
            case STRING:
                if (!(value instanceof String)) {
                    found.add(mismatch(path, property, "a string", value));
                }
                break;
            case NUMBER:
                if (!(value instanceof Number)) {
                    found.add(mismatch(path, property, "a number", value));
                }
                break;
            case BOOLEAN:
                if (!(value instanceof Boolean)) {
                    found.add(mismatch(path, property, "a boolean", value));
                }
                break;
            case OPTIONS:
                checkOption(path, value, property, found);
                break;
            case MULTI_OPTIONS:
                if (value instanceof List<?> list) {
                    for (int i = 0; i < list.size(); i++) {
                        checkOption(ParameterTrees.indexPath(path, i), list.get(i), property, found);
                    }
                } else {
                    found.add(mismatch(path, property, "a list", value));
                }
                break;
            case COLLECTION:
                if (value instanceof Map<?, ?> map) {
                    checkNested(path, map, property.getProperties(), found);
                } else {
                    found.add(mismatch(path, property, "an object", value));
                }
                break;
            case FIXED_COLLECTION:
                if (value instanceof Map<?, ?> map) {
                    checkFixedCollection(path, map, property, found);
                } else {
                    found.add(mismatch(path, property, "an object", value));
                }
                break;
            case JSON:
                if (value instanceof String s) {
                    try {
                        objectMapper.readTree(s);
                    } catch (JsonProcessingException e) {
                        found.add(ValidationIssue.error(IssueCategory.TYPE, null, path,
                                "Property '" + property.getDisplayName() + "' does not contain valid JSON: " +
                                e.getOriginalMessage()));
                    }
                } else if (!(value instanceof Map) && !(value instanceof List)) {
                    found.add(mismatch(path, property, "JSON", value));
                }
                break;
            case RESOURCE_LOCATOR:
                if (!(value instanceof String) && !(value instanceof Map)) {
                    found.add(mismatch(path, property, "a resource locator", value));
                }
                break;
            default:
                break;
        }
    }

    private void checkOption(String path, Object value, PropertySchema property, List<ValidationIssue> found) {
        List<Object> allowed = property.getOptionValues();
        if (allowed.isEmpty() || NodeRule.isExpression(value)) {
            return;
        }
        for (Object candidate : allowed) {
            if (PropertyVisibilityResolver.valuesEqual(value, candidate)) {
                return;
            }
        }
        ValidationIssue issue = ValidationIssue.error(IssueCategory.TYPE, null, path,
                "Invalid value '" + value + "' for '" + property.getDisplayName() + "'; valid options: " +
                joinValues(allowed));
        if (value instanceof String s) {
            for (Object candidate : allowed) {
                if (candidate instanceof String c && c.toLowerCase(Locale.ROOT).equals(s.toLowerCase(Locale.ROOT))) {
                    issue = issue.withSuggestedValue(c);
                    break;
                }
            }
        }
        found.add(issue);
    }

    private void checkNested(String path, Map<?, ?> values, List<PropertySchema> properties,
                             List<ValidationIssue> found) {
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String childPath = ParameterTrees.childPath(path, key);
            PropertySchema nested = findWellFormed(properties, key);
            if (nested == null) {
                found.add(ValidationIssue.warning(IssueCategory.STYLE, null, childPath,
                        "Unknown option '" + key + "'"));
            } else {
                checkValue(childPath, entry.getValue(), nested, found);
            }
        }
    }

    private void checkFixedCollection(String path, Map<?, ?> value, PropertySchema property,
                                      List<ValidationIssue> found) {
        for (Map.Entry<?, ?> entry : value.entrySet()) {
            String groupName = String.valueOf(entry.getKey());
            String groupPath = ParameterTrees.childPath(path, groupName);
            CollectionGroup group = null;
            for (CollectionGroup candidate : property.getGroups()) {
                if (candidate.name().equals(groupName)) {
                    group = candidate;
                    break;
                }
            }
            if (group == null) {
                found.add(ValidationIssue.warning(IssueCategory.STYLE, null, groupPath,
                        "Unknown group '" + groupName + "' in '" + property.getDisplayName() + "'"));
                continue;
            }

            Object groupValue = entry.getValue();
            if (groupValue instanceof List<?> items) {
                for (int i = 0; i < items.size(); i++) {
                    String itemPath = ParameterTrees.indexPath(groupPath, i);
                    if (items.get(i) instanceof Map<?, ?> item) {
                        checkGroupEntry(itemPath, item, group, found);
                    } else {
                        found.add(ValidationIssue.error(IssueCategory.TYPE, null, itemPath,
                                "Entries of group '" + groupName + "' must be objects"));
                    }
                }
            } else if (groupValue instanceof Map<?, ?> item) {
                checkGroupEntry(groupPath, item, group, found);
            } else if (groupValue != null && !NodeRule.isExpression(groupValue)) {
                found.add(ValidationIssue.error(IssueCategory.TYPE, null, groupPath,
                        "Group '" + groupName + "' must be an object or a list of objects"));
            }
        }
    }

    private void checkGroupEntry(String path, Map<?, ?> entry, CollectionGroup group, List<ValidationIssue> found) {
        for (PropertySchema value : group.values()) {
            if (value.isWellFormed() && value.isRequired() && entry.get(value.getName()) == null) {
                found.add(ValidationIssue.error(IssueCategory.REQUIRED, null,
                        ParameterTrees.childPath(path, value.getName()),
                        "Required field '" + value.getDisplayName() + "' is missing"));
            }
        }
        checkNested(path, entry, group.values(), found);
    }

    private PropertySchema findWellFormed(List<PropertySchema> properties, String name) {
        for (PropertySchema property : properties) {
            if (property.isWellFormed() && property.getName().equals(name)) {
                return property;
            }
        }
        return null;
    }

    private ValidationIssue mismatch(String path, PropertySchema property, String expected, Object value) {
        return ValidationIssue.error(IssueCategory.TYPE, null, path,
                "Property '" + property.getDisplayName() + "' expects " + expected + " but got " +
                describeType(value));
    }

    private static String describeType(Object value) {
        if (value instanceof String) return "a string";
        if (value instanceof Number) return "a number";
        if (value instanceof Boolean) return "a boolean";
        if (value instanceof List) return "a list";
        if (value instanceof Map) return "an object";
        return value.getClass().getSimpleName();
    }

    private static String joinValues(List<Object> values) {
        StringBuilder sb = new StringBuilder();
        for (Object value : values) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(value);
        }
        return sb.toString();
    }

    private List<String> nextSteps(List<ValidationIssue> issues, List<String> missingRequired) {
        List<String> steps = new ArrayList<>();
        if (!missingRequired.isEmpty()) {
            steps.add("Add the required properties: " + String.join(", ", missingRequired));
        }
        Set<String> typeProblems = new LinkedHashSet<>();
        boolean security = false;
        for (ValidationIssue issue : issues) {
            if (issue.getCategory() == IssueCategory.TYPE && issue.getFieldPath() != null) {
                typeProblems.add(issue.getFieldPath());
            }
            security |= issue.getCategory() == IssueCategory.SECURITY;
        }
        if (!typeProblems.isEmpty()) {
            steps.add("Correct the values of: " + String.join(", ", typeProblems));
        }
        if (security) {
            steps.add("Review the security warnings before activating the workflow");
        }
        if (issues.isEmpty()) {
            steps.add("Configuration is complete; connect the node and run a test execution");
        }
        return steps;
    }

    private Map<String, Object> exampleConfig(Map<String, PropertySchema> visibleByName, Set<String> requiredNames,
                                              Map<String, Object> config) {
        Map<String, Object> example = new LinkedHashMap<>();
        for (PropertySchema property : visibleByName.values()) {
            String name = property.getName();
            if (config.get(name) != null) {
                example.put(name, config.get(name));
            } else if (requiredNames.contains(name)) {
                example.put(name, placeholder(property));
            }
        }
        return example;
    }

    private Object placeholder(PropertySchema property) {
        if (property.getDefaultValue() != null && !"".equals(property.getDefaultValue())) {
            return property.getDefaultValue();
        }
        PropertyType type = property.getPropertyType().orElse(PropertyType.STRING);
        switch (type) {
            case NUMBER:
                return 0;
            case BOOLEAN:
                return false;
            case OPTIONS:
                return property.getOptionValues().isEmpty() ? "" : property.getOptionValues().get(0);
            case MULTI_OPTIONS:
                return List.of();
            case COLLECTION:
            case FIXED_COLLECTION:
                return Map.of();
            case JSON:
                return "{}";
            case RESOURCE_LOCATOR:
                Map<String, Object> locator = new LinkedHashMap<>();
                locator.put("__rl", true);
                locator.put("value", "");
                locator.put("mode", "id");
                return locator;
            default:
                return "<" + property.getName() + ">";
        }
    }
}
