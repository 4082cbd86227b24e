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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Caches schema lookups of a delegate repository. The cache is bound to the delegate's
 * catalog version and is dropped as soon as that version changes, so a reloaded
 * catalog is never answered from stale entries. Misses are cached too.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class CachingNodeTypeRepository implements NodeTypeRepository {

    private static final Logger logger = Logger.getLogger(CachingNodeTypeRepository.class.getName());

    private final NodeTypeRepository delegate;
    private final Map<String, Optional<NodeTypeSchema>> cache = new ConcurrentHashMap<>();
    private volatile String cachedVersion;

    public CachingNodeTypeRepository(NodeTypeRepository delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate repository cannot be null");
    }

    @Override
    public Optional<NodeTypeSchema> getNodeType(String normalizedTypeName) {
        if (normalizedTypeName == null) {
            return Optional.empty();
        }
        synchronizeVersion();
        return cache.computeIfAbsent(normalizedTypeName, delegate::getNodeType);
    }

    @Override
    public Set<String> getNodeTypeNames() {
        return delegate.getNodeTypeNames();
    }

    @Override
    public String getCatalogVersion() {
        return delegate.getCatalogVersion();
    }

    public int getCacheSize() {
        return cache.size();
    }

    public void invalidate() {
        cache.clear();
        cachedVersion = null;
    }

    private void synchronizeVersion() {
        String current = delegate.getCatalogVersion();
        if (!Objects.equals(current, cachedVersion)) {
            synchronized (this) {
                if (!Objects.equals(current, cachedVersion)) {
                    if (cachedVersion != null) {
                        logger.fine("Catalog version changed from " + cachedVersion + " to " + current +
                                ", dropping " + cache.size() + " cached schemas");
                    }
                    cache.clear();
                    cachedVersion = current;
                }
            }
        }
    }
}
