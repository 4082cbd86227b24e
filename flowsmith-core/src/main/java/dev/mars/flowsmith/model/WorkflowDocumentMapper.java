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


package dev.mars.flowsmith.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import dev.mars.flowsmith.core.exceptions.WorkflowFormatException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Converts already-decoded structured values (maps, lists and scalars) or JSON text
 * into {@link WorkflowDocument} instances and back.
 *
 * <p>The document shape is checked against the bundled JSON schema
 * {@code schema/workflow-document.schema.json} before any typed value is built; any
 * violation is raised as a {@link WorkflowFormatException}. Parameter trees are not
 * part of that check because they may legitimately contain anything, cycles included.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class WorkflowDocumentMapper {

    private static final Logger logger = Logger.getLogger(WorkflowDocumentMapper.class.getName());
    private static final String SCHEMA_RESOURCE = "schema/workflow-document.schema.json";

    private final ObjectMapper objectMapper;
    private final JsonSchema documentSchema;

    public WorkflowDocumentMapper() {
        this(new ObjectMapper());
    }

    public WorkflowDocumentMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.documentSchema = loadSchema();
    }

    private static JsonSchema loadSchema() {
        try (InputStream input = WorkflowDocumentMapper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Workflow document schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(input);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load workflow document schema", e);
        }
    }

    public WorkflowDocument fromJson(String json) throws WorkflowFormatException {
        if (json == null || json.isBlank()) {
            throw new WorkflowFormatException("Empty workflow document");
        }
        try {
            Map<String, Object> raw = objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
            return fromMap(raw);
        } catch (JsonProcessingException e) {
            throw new WorkflowFormatException("Workflow document is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public WorkflowDocument fromMap(Map<String, ?> raw) throws WorkflowFormatException {
        if (raw == null) {
            throw new WorkflowFormatException("Workflow document cannot be null");
        }

        checkStructure(raw);

        WorkflowDocument.Builder builder = WorkflowDocument.builder()
                .id(raw.get("id") != null ? raw.get("id").toString() : null)
                .name((String) raw.get("name"))
                .active(Boolean.TRUE.equals(raw.get("active")));

        List<?> rawNodes = (List<?>) raw.get("nodes");
        for (int i = 0; i < rawNodes.size(); i++) {
            builder.addNode(nodeFromMap(asMap(rawNodes.get(i), "nodes[" + i + "]"), "nodes[" + i + "]"));
        }

        builder.connections(connectionsFromMap(asMap(raw.get("connections"), "connections")));

        if (raw.get("settings") instanceof Map<?, ?> settings) {
            builder.settings(asMap(settings, "settings"));
        }
        builder.tags(tagsFromList(raw.get("tags")));

        WorkflowDocument document = builder.build();
        logger.fine("Decoded workflow '" + document.getName() + "' with " + document.getNodes().size() + " nodes");
        return document;
    }

    /**
     * Builds a node from its map form. Only {@code name} and {@code type} are required;
     * a missing {@code id} is left null.
     */
    public WorkflowNode nodeFromMap(Map<String, Object> raw, String fieldPath) throws WorkflowFormatException {
        String name = requireString(raw, "name", fieldPath);
        String type = requireString(raw, "type", fieldPath);

        return WorkflowNode.builder()
                .id(optionalString(raw, "id", fieldPath))
                .name(name)
                .type(type)
                .typeVersion(optionalNumber(raw, "typeVersion", fieldPath))
                .position(positionFromValue(raw.get("position"), ParameterTrees.childPath(fieldPath, "position")))
                .parameters(raw.get("parameters") != null
                        ? asMap(raw.get("parameters"), ParameterTrees.childPath(fieldPath, "parameters"))
                        : Map.of())
                .credentials(raw.get("credentials") != null
                        ? asMap(raw.get("credentials"), ParameterTrees.childPath(fieldPath, "credentials"))
                        : null)
                .disabled(Boolean.TRUE.equals(optionalBoolean(raw, "disabled", fieldPath)))
                .onError(optionalString(raw, "onError", fieldPath))
                .continueOnFail(optionalBoolean(raw, "continueOnFail", fieldPath))
                .retryOnFail(optionalBoolean(raw, "retryOnFail", fieldPath))
                .maxTries(optionalInteger(raw, "maxTries", fieldPath))
                .waitBetweenTries(optionalInteger(raw, "waitBetweenTries", fieldPath))
                .alwaysOutputData(optionalBoolean(raw, "alwaysOutputData", fieldPath))
                .executeOnce(optionalBoolean(raw, "executeOnce", fieldPath))
                .notes(optionalString(raw, "notes", fieldPath))
                .notesInFlow(optionalBoolean(raw, "notesInFlow", fieldPath))
                .build();
    }

    public Position positionFromValue(Object value, String fieldPath) throws WorkflowFormatException {
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list && list.size() == 2
                && list.get(0) instanceof Number x && list.get(1) instanceof Number y) {
            return new Position(x.doubleValue(), y.doubleValue());
        }
        throw new WorkflowFormatException(fieldPath, "Position must be a pair of numbers [x, y]");
    }

    public WorkflowConnections connectionsFromMap(Map<String, Object> raw) throws WorkflowFormatException {
        if (raw == null || raw.isEmpty()) {
            return WorkflowConnections.empty();
        }
        Map<String, Map<String, List<List<ConnectionTarget>>>> connections = new LinkedHashMap<>();
        for (Map.Entry<String, Object> source : raw.entrySet()) {
            String sourcePath = "connections." + source.getKey();
            Map<String, List<List<ConnectionTarget>>> outputs = new LinkedHashMap<>();
            for (Map.Entry<String, Object> output : asMap(source.getValue(), sourcePath).entrySet()) {
                String outputPath = ParameterTrees.childPath(sourcePath, output.getKey());
                if (!(output.getValue() instanceof List<?> ports)) {
                    throw new WorkflowFormatException(outputPath, "Output must be a list of ports");
                }
                List<List<ConnectionTarget>> portList = new ArrayList<>();
                for (int i = 0; i < ports.size(); i++) {
                    portList.add(portFromValue(ports.get(i), ParameterTrees.indexPath(outputPath, i)));
                }
                outputs.put(output.getKey(), portList);
            }
            connections.put(source.getKey(), outputs);
        }
        return WorkflowConnections.of(connections);
    }

    private List<ConnectionTarget> portFromValue(Object value, String fieldPath) throws WorkflowFormatException {
        List<ConnectionTarget> targets = new ArrayList<>();
        if (value == null) {
            return targets;
        }
        if (!(value instanceof List<?> list)) {
            throw new WorkflowFormatException(fieldPath, "Port must be a list of connection targets");
        }
        for (int j = 0; j < list.size(); j++) {
            String targetPath = ParameterTrees.indexPath(fieldPath, j);
            Map<String, Object> target = asMap(list.get(j), targetPath);
            String node = requireString(target, "node", targetPath);
            String type = optionalString(target, "type", targetPath);
            Integer index = optionalInteger(target, "index", targetPath);
            targets.add(new ConnectionTarget(node, type, index != null ? index : 0));
        }
        return targets;
    }

    public Map<String, Object> toMap(WorkflowDocument document) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (document.getId() != null) {
            result.put("id", document.getId());
        }
        result.put("name", document.getName());
        List<Object> nodes = new ArrayList<>();
        for (WorkflowNode node : document.getNodes()) {
            nodes.add(nodeToMap(node));
        }
        result.put("nodes", nodes);
        result.put("connections", connectionsToMap(document.getConnections()));
        result.put("settings", ParameterTrees.copyMap(document.getSettings()));
        result.put("tags", new ArrayList<>(document.getTags()));
        result.put("active", document.isActive());
        return result;
    }

    public Map<String, Object> nodeToMap(WorkflowNode node) {
        Map<String, Object> result = new LinkedHashMap<>();
        putIfPresent(result, "id", node.getId());
        result.put("name", node.getName());
        result.put("type", node.getType());
        putIfPresent(result, "typeVersion", node.getTypeVersion());
        if (node.getPosition() != null) {
            result.put("position", List.of(node.getPosition().x(), node.getPosition().y()));
        }
        result.put("parameters", ParameterTrees.copyMap(node.getParameters()));
        if (node.getCredentials() != null) {
            result.put("credentials", ParameterTrees.copyMap(node.getCredentials()));
        }
        if (node.isDisabled()) {
            result.put("disabled", true);
        }
        putIfPresent(result, "onError", node.getOnError());
        putIfPresent(result, "continueOnFail", node.getContinueOnFail());
        putIfPresent(result, "retryOnFail", node.getRetryOnFail());
        putIfPresent(result, "maxTries", node.getMaxTries());
        putIfPresent(result, "waitBetweenTries", node.getWaitBetweenTries());
        putIfPresent(result, "alwaysOutputData", node.getAlwaysOutputData());
        putIfPresent(result, "executeOnce", node.getExecuteOnce());
        putIfPresent(result, "notes", node.getNotes());
        putIfPresent(result, "notesInFlow", node.getNotesInFlow());
        return result;
    }

    public Map<String, Object> connectionsToMap(WorkflowConnections connections) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String source : connections.getSourceNodes()) {
            Map<String, Object> outputs = new LinkedHashMap<>();
            connections.getOutputs(source).forEach((type, ports) -> {
                List<Object> portList = new ArrayList<>();
                for (List<ConnectionTarget> port : ports) {
                    List<Object> targets = new ArrayList<>();
                    for (ConnectionTarget target : port) {
                        Map<String, Object> t = new LinkedHashMap<>();
                        t.put("node", target.node());
                        t.put("type", target.type());
                        t.put("index", target.index());
                        targets.add(t);
                    }
                    portList.add(targets);
                }
                outputs.put(type, portList);
            });
            result.put(source, outputs);
        }
        return result;
    }

    public String toJson(WorkflowDocument document) throws WorkflowFormatException {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toMap(document));
        } catch (JsonProcessingException e) {
            throw new WorkflowFormatException("Failed to serialize workflow '" + document.getName() + "'", e);
        }
    }

    private void checkStructure(Map<String, ?> raw) throws WorkflowFormatException {
        JsonNode tree;
        try {
            tree = objectMapper.valueToTree(structuralView(raw));
        } catch (IllegalArgumentException e) {
            throw new WorkflowFormatException("Workflow document contains values that are not JSON compatible", e);
        }

        Set<ValidationMessage> messages = documentSchema.validate(tree);
        if (!messages.isEmpty()) {
            Set<String> violations = new TreeSet<>();
            for (ValidationMessage message : messages) {
                violations.add(message.getMessage());
            }
            throw new WorkflowFormatException(null, "Workflow document has an invalid structure",
                    new ArrayList<>(violations), null);
        }
    }

    // Parameter and credential trees are replaced by empty objects so that cyclic
    // caller data never reaches the JSON tree conversion.
    private Map<String, Object> structuralView(Map<String, ?> raw) {
        Map<String, Object> view = new LinkedHashMap<>(raw);
        if (raw.get("nodes") instanceof List<?> nodes) {
            List<Object> nodeViews = new ArrayList<>();
            for (Object node : nodes) {
                if (node instanceof Map<?, ?> nodeMap) {
                    Map<Object, Object> nodeView = new LinkedHashMap<>(nodeMap);
                    if (nodeMap.get("parameters") instanceof Map) {
                        nodeView.put("parameters", Map.of());
                    }
                    if (nodeMap.get("credentials") instanceof Map) {
                        nodeView.put("credentials", Map.of());
                    }
                    nodeViews.add(nodeView);
                } else {
                    nodeViews.add(node);
                }
            }
            view.put("nodes", nodeViews);
        }
        if (raw.get("settings") instanceof Map) {
            view.put("settings", Map.of());
        }
        return view;
    }

    private List<String> tagsFromList(Object value) {
        List<String> tags = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object tag : list) {
                if (tag instanceof Map<?, ?> tagMap) {
                    tags.add(String.valueOf(tagMap.get("name")));
                } else if (tag != null) {
                    tags.add(tag.toString());
                }
            }
        }
        return tags;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value, String fieldPath) throws WorkflowFormatException {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new WorkflowFormatException(fieldPath, "Expected an object but found " + value.getClass().getSimpleName());
        }
        return (Map<String, Object>) value;
    }

    private static String requireString(Map<String, Object> raw, String key, String fieldPath) throws WorkflowFormatException {
        String value = optionalString(raw, key, fieldPath);
        if (value == null || value.isBlank()) {
            throw new WorkflowFormatException(ParameterTrees.childPath(fieldPath, key), "Required field is missing");
        }
        return value;
    }

    private static String optionalString(Map<String, Object> raw, String key, String fieldPath) throws WorkflowFormatException {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new WorkflowFormatException(ParameterTrees.childPath(fieldPath, key), "Expected a string");
        }
        return s;
    }

    private static Boolean optionalBoolean(Map<String, Object> raw, String key, String fieldPath) throws WorkflowFormatException {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Boolean b)) {
            throw new WorkflowFormatException(ParameterTrees.childPath(fieldPath, key), "Expected a boolean");
        }
        return b;
    }

    private static Double optionalNumber(Map<String, Object> raw, String key, String fieldPath) throws WorkflowFormatException {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number n)) {
            throw new WorkflowFormatException(ParameterTrees.childPath(fieldPath, key), "Expected a number");
        }
        return n.doubleValue();
    }

    private static Integer optionalInteger(Map<String, Object> raw, String key, String fieldPath) throws WorkflowFormatException {
        Double value = optionalNumber(raw, key, fieldPath);
        if (value == null) {
            return null;
        }
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new WorkflowFormatException(ParameterTrees.childPath(fieldPath, key), "Expected an integer");
        }
        return value.intValue();
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
