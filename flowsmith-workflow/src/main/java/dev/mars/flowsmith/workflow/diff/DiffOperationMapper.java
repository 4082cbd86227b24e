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


package dev.mars.flowsmith.workflow.diff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowsmith.core.exceptions.WorkflowFormatException;
import dev.mars.flowsmith.model.Position;
import dev.mars.flowsmith.model.WorkflowDocumentMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes diff operations from structured values (maps and lists) or JSON text.
 *
 * <p>Every operation needs a {@code type} discriminator; node operations name their
 * node with {@code nodeId} and/or {@code nodeName}. Shape problems are reported as
 * {@link WorkflowFormatException} with a field path such as {@code operations[2].changes}
 * before anything is applied.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class DiffOperationMapper {

    private final ObjectMapper objectMapper;
    private final WorkflowDocumentMapper documentMapper;

    public DiffOperationMapper() {
        this(new ObjectMapper(), new WorkflowDocumentMapper());
    }

    public DiffOperationMapper(ObjectMapper objectMapper, WorkflowDocumentMapper documentMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        this.documentMapper = Objects.requireNonNull(documentMapper, "Document mapper cannot be null");
    }

    public List<DiffOperation> fromJson(String json) throws WorkflowFormatException {
        if (json == null || json.isBlank()) {
            throw new WorkflowFormatException("operations", "Operation list is empty");
        }
        try {
            return fromList(objectMapper.readValue(json, new TypeReference<List<Object>>() {}));
        } catch (JsonProcessingException e) {
            throw new WorkflowFormatException("operations",
                    "Operation list is not a valid JSON array: " + e.getOriginalMessage(), e);
        }
    }

    public List<DiffOperation> fromList(List<?> raw) throws WorkflowFormatException {
        if (raw == null) {
            throw new WorkflowFormatException("operations", "Operation list cannot be null");
        }
        List<DiffOperation> operations = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            String path = "operations[" + i + "]";
            operations.add(fromMap(asMap(raw.get(i), path), path));
        }
        return operations;
    }

    public DiffOperation fromMap(Map<String, Object> raw, String path) throws WorkflowFormatException {
        Object typeValue = raw.get("type");
        if (!(typeValue instanceof String wireName)) {
            throw new WorkflowFormatException(path + ".type", "Missing operation type discriminator");
        }
        DiffOperationType type = DiffOperationType.fromWireName(wireName)
                .orElseThrow(() -> new WorkflowFormatException(path + ".type", "Unknown operation type '" + wireName + "'"));
        String description = optionalString(raw, "description", path);

        switch (type) {
            case ADD_NODE:
                return new DiffOperation.AddNode(
                        documentMapper.nodeFromMap(asMap(raw.get("node"), path + ".node"), path + ".node"), description);
            case REMOVE_NODE:
                return new DiffOperation.RemoveNode(nodeReference(raw, path), description);
            case UPDATE_NODE:
                return new DiffOperation.UpdateNode(nodeReference(raw, path),
                        asMap(raw.get("changes"), path + ".changes"), description);
            case MOVE_NODE:
                Position position = documentMapper.positionFromValue(raw.get("position"), path + ".position");
                if (position == null) {
                    throw new WorkflowFormatException(path + ".position", "Missing required field");
                }
                return new DiffOperation.MoveNode(nodeReference(raw, path), position, description);
            case ENABLE_NODE:
                return new DiffOperation.EnableNode(nodeReference(raw, path), description);
            case DISABLE_NODE:
                return new DiffOperation.DisableNode(nodeReference(raw, path), description);
            case ADD_CONNECTION:
                return new DiffOperation.AddConnection(
                        requireString(raw, "source", path),
                        requireString(raw, "target", path),
                        optionalString(raw, "sourceOutput", path),
                        optionalString(raw, "targetInput", path),
                        optionalInteger(raw, "sourceIndex", path, 0),
                        optionalInteger(raw, "targetIndex", path, 0),
                        description);
            case REMOVE_CONNECTION:
                return new DiffOperation.RemoveConnection(
                        requireString(raw, "source", path),
                        requireString(raw, "target", path),
                        optionalString(raw, "sourceOutput", path),
                        optionalString(raw, "targetInput", path),
                        optionalInteger(raw, "sourceIndex", path),
                        description);
            case UPDATE_CONNECTION:
                Map<String, Object> changes = asMap(raw.get("changes"), path + ".changes");
                String changesPath = path + ".changes";
                return new DiffOperation.UpdateConnection(
                        requireString(raw, "source", path),
                        requireString(raw, "target", path),
                        optionalString(raw, "sourceOutput", path),
                        new DiffOperation.ConnectionChanges(
                                optionalString(changes, "sourceOutput", changesPath),
                                optionalString(changes, "targetInput", changesPath),
                                optionalInteger(changes, "sourceIndex", changesPath),
                                optionalInteger(changes, "targetIndex", changesPath)),
                        description);
            case UPDATE_SETTINGS:
                return new DiffOperation.UpdateSettings(asMap(raw.get("settings"), path + ".settings"), description);
            case UPDATE_NAME:
                return new DiffOperation.UpdateName(requireString(raw, "name", path), description);
            case ADD_TAG:
                return new DiffOperation.AddTag(requireString(raw, "tag", path), description);
            case REMOVE_TAG:
                return new DiffOperation.RemoveTag(requireString(raw, "tag", path), description);
            default:
                throw new WorkflowFormatException(path + ".type", "Unsupported operation type '" + wireName + "'");
        }
    }

    private NodeReference nodeReference(Map<String, Object> raw, String path) throws WorkflowFormatException {
        String id = optionalString(raw, "nodeId", path);
        String name = optionalString(raw, "nodeName", path);
        if (id == null && name == null) {
            throw new WorkflowFormatException(path, "Node operation requires nodeId or nodeName");
        }
        return new NodeReference(id, name);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String path) throws WorkflowFormatException {
        if (value == null) {
            throw new WorkflowFormatException(path, "Missing required field");
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new WorkflowFormatException(path, "Expected an object but found " + value.getClass().getSimpleName());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private static String requireString(Map<String, Object> raw, String key, String path) throws WorkflowFormatException {
        String value = optionalString(raw, key, path);
        if (value == null) {
            throw new WorkflowFormatException(path + "." + key, "Missing required field");
        }
        return value;
    }

    private static String optionalString(Map<String, Object> raw, String key, String path) throws WorkflowFormatException {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new WorkflowFormatException(path + "." + key, "Expected a string but found " + value);
        }
        return s;
    }

    private static Integer optionalInteger(Map<String, Object> raw, String key, String path) throws WorkflowFormatException {
        Object value = raw.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                return number.intValue();
            }
        }
        throw new WorkflowFormatException(path + "." + key, "Expected an integer but found " + value);
    }

    private static int optionalInteger(Map<String, Object> raw, String key, String path, int defaultValue)
            throws WorkflowFormatException {
        Integer value = optionalInteger(raw, key, path);
        return value != null ? value : defaultValue;
    }
}
