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

import dev.mars.flowsmith.model.ParameterTrees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Depth-bounded traversal of a parameter tree built from maps, lists and scalars.
 *
 * <p>Containers deeper than the ceiling are not entered; the first such container
 * produces a single depth-exceeded warning per walk. A container that is already on the
 * current path (compared by identity) is a circular reference: it is reported each
 * time it is met and never entered.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ParameterTreeWalker {

    private static final Logger logger = Logger.getLogger(ParameterTreeWalker.class.getName());

    public static final int DEFAULT_MAX_DEPTH = 100;

    /**
     * Callback for the values met during a walk.
     */
    public interface Visitor {

        /**
         * Called for every scalar (including null) reached within the depth ceiling.
         */
        void visitValue(String path, String key, Object value);

        /**
         * Called before descending into an entry; returning false skips it entirely.
         */
        default boolean shouldVisit(String path, String key, Object value) {
            return true;
        }
    }

    private final int maxDepth;

    public ParameterTreeWalker() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ParameterTreeWalker(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max depth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Walks {@code root}, returning the anomalies met on the way as warnings.
     */
    public List<ValidationIssue> walk(Object root, String rootPath, Visitor visitor) {
        Walk walk = new Walk(visitor);
        walk.visit(root, rootPath == null ? "" : rootPath, null, 0);
        return walk.anomalies;
    }

    private final class Walk {
        private final Visitor visitor;
        private final Set<Object> ancestors = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<ValidationIssue> anomalies = new ArrayList<>();
        private boolean depthReported;

        private Walk(Visitor visitor) {
            this.visitor = visitor;
        }

        private void visit(Object value, String path, String key, int depth) {
            if (!(value instanceof Map) && !(value instanceof List)) {
                visitor.visitValue(path, key, value);
                return;
            }

            if (depth >= maxDepth) {
                if (!depthReported) {
                    depthReported = true;
                    logger.warning("Parameter tree exceeds maximum depth of " + maxDepth + " at " + describe(path));
                    anomalies.add(ValidationIssue.warning(IssueCategory.ANOMALY, null, path,
                            "Maximum nesting depth of " + maxDepth + " exceeded; deeper values were not validated"));
                }
                return;
            }

            if (!ancestors.add(value)) {
                logger.warning("Circular reference in parameter tree at " + describe(path));
                anomalies.add(ValidationIssue.warning(IssueCategory.ANOMALY, null, path,
                        "Circular reference detected; the structure was not traversed again"));
                return;
            }

            try {
                if (value instanceof Map<?, ?> map) {
                    for (Map.Entry<?, ?> entry : map.entrySet()) {
                        String childKey = String.valueOf(entry.getKey());
                        String childPath = ParameterTrees.childPath(path, childKey);
                        if (visitor.shouldVisit(childPath, childKey, entry.getValue())) {
                            visit(entry.getValue(), childPath, childKey, depth + 1);
                        }
                    }
                } else {
                    List<?> list = (List<?>) value;
                    for (int i = 0; i < list.size(); i++) {
                        String childPath = ParameterTrees.indexPath(path, i);
                        if (visitor.shouldVisit(childPath, key, list.get(i))) {
                            visit(list.get(i), childPath, key, depth + 1);
                        }
                    }
                }
            } finally {
                ancestors.remove(value);
            }
        }

        private String describe(String path) {
            return path == null || path.isEmpty() ? "<root>" : path;
        }
    }
}
