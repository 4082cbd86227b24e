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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Thread-safe in-memory catalog. Every registration or removal bumps the catalog
 * version so that caches layered on top can notice the change.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class InMemoryNodeTypeRepository implements NodeTypeRepository {

    private static final Logger logger = Logger.getLogger(InMemoryNodeTypeRepository.class.getName());

    private final Map<String, NodeTypeSchema> nodeTypes = new ConcurrentHashMap<>();
    private final AtomicLong version = new AtomicLong();

    public InMemoryNodeTypeRepository() {
    }

    public InMemoryNodeTypeRepository(Collection<NodeTypeSchema> schemas) {
        registerAll(schemas);
    }

    public void register(NodeTypeSchema schema) {
        nodeTypes.put(schema.getNodeType(), schema);
        version.incrementAndGet();
        logger.fine("Registered node type " + schema.getNodeType());
    }

    public void registerAll(Collection<NodeTypeSchema> schemas) {
        for (NodeTypeSchema schema : schemas) {
            nodeTypes.put(schema.getNodeType(), schema);
        }
        version.incrementAndGet();
        logger.info("Registered " + schemas.size() + " node types, catalog version " + version.get());
    }

    public boolean remove(String nodeType) {
        boolean removed = nodeTypes.remove(NodeTypeNames.normalize(nodeType)) != null;
        if (removed) {
            version.incrementAndGet();
        }
        return removed;
    }

    @Override
    public Optional<NodeTypeSchema> getNodeType(String normalizedTypeName) {
        if (normalizedTypeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodeTypes.get(normalizedTypeName));
    }

    @Override
    public Set<String> getNodeTypeNames() {
        return Collections.unmodifiableSet(new TreeSet<>(nodeTypes.keySet()));
    }

    @Override
    public String getCatalogVersion() {
        return String.valueOf(version.get());
    }

    public int size() {
        return nodeTypes.size();
    }
}
