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

import java.nio.file.Path;
import java.util.List;

/**
 * Loads node-type schemas from a serialized catalog.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface NodeTypeCatalogParser {

    List<NodeTypeSchema> parse(Path catalogFile) throws WorkflowFormatException;

    List<NodeTypeSchema> parseFromString(String content) throws WorkflowFormatException;

    List<NodeTypeSchema> parseResource(String resourceName) throws WorkflowFormatException;
}
