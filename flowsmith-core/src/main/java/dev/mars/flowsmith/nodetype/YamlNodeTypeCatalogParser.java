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

import dev.mars.flowsmith.core.exceptions.WorkflowFormatException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * YAML implementation of {@link NodeTypeCatalogParser}.
 *
 * <pre>
 * nodeTypes:
 *   - nodeType: n8n-nodes-base.if
 *     version: 2
 *     outputs: ["true", "false"]
 *     properties:
 *       - name: conditions
 *         type: fixedCollection
 * </pre>
 *
 * Property entries that lack a name or type are kept as-is so the validators can
 * report and skip them; node-type entries without a type name are rejected.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class YamlNodeTypeCatalogParser implements NodeTypeCatalogParser {

    private static final Logger logger = Logger.getLogger(YamlNodeTypeCatalogParser.class.getName());

    private final Yaml yaml;

    public YamlNodeTypeCatalogParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    @Override
    public List<NodeTypeSchema> parse(Path catalogFile) throws WorkflowFormatException {
        try {
            String content = Files.readString(catalogFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowFormatException("Failed to read node type catalog: " + catalogFile, e);
        }
    }

    @Override
    public List<NodeTypeSchema> parseResource(String resourceName) throws WorkflowFormatException {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (input == null) {
                throw new WorkflowFormatException("Node type catalog not found on classpath: " + resourceName);
            }
            return parseFromString(new String(input.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new WorkflowFormatException("Failed to read node type catalog: " + resourceName, e);
        }
    }

    @Override
    public List<NodeTypeSchema> parseFromString(String content) throws WorkflowFormatException {
        Object data;
        try {
            data = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowFormatException("YAML parsing failed", e);
        }
        if (!(data instanceof Map<?, ?> root)) {
            throw new WorkflowFormatException("Empty or invalid YAML content");
        }
        if (!(root.get("nodeTypes") instanceof List<?> entries)) {
            throw new WorkflowFormatException("nodeTypes", "Catalog must contain a nodeTypes list");
        }

        List<NodeTypeSchema> schemas = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            String fieldPath = "nodeTypes[" + i + "]";
            if (!(entries.get(i) instanceof Map<?, ?> entry)) {
                throw new WorkflowFormatException(fieldPath, "Node type entry must be a mapping");
            }
            schemas.add(parseNodeType(asStringMap(entry), fieldPath));
        }
        logger.fine("Parsed " + schemas.size() + " node types from catalog");
        return schemas;
    }

    private NodeTypeSchema parseNodeType(Map<String, Object> data, String fieldPath) throws WorkflowFormatException {
        String nodeType = getStringValue(data, "nodeType");
        if (nodeType == null || nodeType.isBlank()) {
            throw new WorkflowFormatException(fieldPath + ".nodeType", "Node type name is required");
        }

        NodeTypeSchema.Builder builder = NodeTypeSchema.builder(nodeType)
                .displayName(getStringValue(data, "displayName"))
                .description(getStringValue(data, "description"))
                .packageName(getStringValue(data, "packageName"))
                .latestVersion(getDoubleValue(data, "version", 1))
                .versioned(getBooleanValue(data, "versioned", false))
                .trigger(getBooleanValue(data, "trigger", false))
                .webhook(getBooleanValue(data, "webhook", false))
                .loopCapable(getBooleanValue(data, "loopCapable", false))
                .aiTool(getBooleanValue(data, "aiTool", false));

        List<String> outputs = new ArrayList<>();
        for (Object output : getListValue(data, "outputs")) {
            outputs.add(String.valueOf(output));
        }
        builder.outputs(outputs);

        List<CredentialRequirement> credentials = new ArrayList<>();
        for (Object credential : getListValue(data, "credentials")) {
            if (credential instanceof Map<?, ?> credentialMap) {
                Map<String, Object> c = asStringMap(credentialMap);
                String name = getStringValue(c, "name");
                if (name == null) {
                    throw new WorkflowFormatException(fieldPath + ".credentials", "Credential entry requires a name");
                }
                credentials.add(new CredentialRequirement(name, getBooleanValue(c, "required", false)));
            } else if (credential != null) {
                credentials.add(new CredentialRequirement(credential.toString(), false));
            }
        }
        builder.credentials(credentials);
        builder.properties(parseProperties(getListValue(data, "properties")));

        return builder.build();
    }

    private List<PropertySchema> parseProperties(List<Object> entries) {
        List<PropertySchema> properties = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> map) {
                properties.add(parseProperty(asStringMap(map)));
            } else {
                // kept so that validators can report the malformed entry
                properties.add(PropertySchema.builder().build());
            }
        }
        return properties;
    }

    private PropertySchema parseProperty(Map<String, Object> data) {
        String type = getStringValue(data, "type");
        PropertySchema.Builder builder = PropertySchema.builder(getStringValue(data, "name"), type)
                .displayName(getStringValue(data, "displayName"))
                .description(getStringValue(data, "description"))
                .required(getBooleanValue(data, "required", false))
                .defaultValue(data.get("default"));

        if (data.get("typeOptions") instanceof Map<?, ?> typeOptions) {
            builder.multipleValues(Boolean.TRUE.equals(typeOptions.get("multipleValues")));
        }

        if (data.get("displayOptions") instanceof Map<?, ?> displayOptions) {
            Map<String, Object> options = asStringMap(displayOptions);
            builder.displayOptions(new DisplayOptions(
                    parseConditions(options.get("show")),
                    parseConditions(options.get("hide"))));
        }

        List<Object> options = getListValue(data, "options");
        if (PropertyType.COLLECTION.getTag().equals(type)) {
            builder.properties(parseProperties(options));
        } else if (PropertyType.FIXED_COLLECTION.getTag().equals(type)) {
            List<CollectionGroup> groups = new ArrayList<>();
            for (Object option : options) {
                if (option instanceof Map<?, ?> groupMap) {
                    Map<String, Object> group = asStringMap(groupMap);
                    String name = getStringValue(group, "name");
                    if (name != null) {
                        groups.add(new CollectionGroup(name, getStringValue(group, "displayName"),
                                parseProperties(getListValue(group, "values"))));
                    }
                }
            }
            builder.groups(groups);
        } else {
            List<PropertyOption> values = new ArrayList<>();
            for (Object option : options) {
                if (option instanceof Map<?, ?> optionMap) {
                    Map<String, Object> o = asStringMap(optionMap);
                    Object value = o.containsKey("value") ? o.get("value") : o.get("name");
                    values.add(new PropertyOption(getStringValue(o, "name"), value, getStringValue(o, "description")));
                } else if (option != null) {
                    values.add(PropertyOption.of(option.toString(), option));
                }
            }
            builder.options(values);
        }

        return builder.build();
    }

    private Map<String, List<Object>> parseConditions(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, List<Object>> conditions = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            Object allowed = entry.getValue();
            List<Object> values = new ArrayList<>();
            if (allowed instanceof List<?> list) {
                values.addAll(list);
            } else {
                values.add(allowed);
            }
            conditions.put(String.valueOf(entry.getKey()), values);
        }
        return conditions;
    }

    private Map<String, Object> asStringMap(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private String getStringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private List<Object> getListValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof List ? (List<Object>) value : List.of();
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private double getDoubleValue(Map<String, Object> data, String key, double defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                logger.warning("Invalid number for " + key + ": " + value + ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }
}
