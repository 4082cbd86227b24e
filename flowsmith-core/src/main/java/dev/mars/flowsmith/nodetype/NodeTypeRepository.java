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

import java.util.Optional;
import java.util.Set;

/**
 * Source of node-type schemas. Implementations are supplied by the host application;
 * the validators only ever read from it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface NodeTypeRepository {

    /**
     * Resolves a normalized type name such as {@code nodes-base.httpRequest}.
     *
     * @param normalizedTypeName the short-form type name
     * @return the schema, or empty when the catalog does not know the type
     */
    Optional<NodeTypeSchema> getNodeType(String normalizedTypeName);

    /**
     * All normalized type names currently known, used for "did you mean" suggestions.
     */
    Set<String> getNodeTypeNames();

    /**
     * Opaque token that changes whenever the catalog contents change.
     */
    String getCatalogVersion();
}
