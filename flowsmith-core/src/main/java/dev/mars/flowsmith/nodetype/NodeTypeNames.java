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

import java.util.Set;

/**
 * Conversions between the full node-type names used inside workflow documents
 * ({@code n8n-nodes-base.httpRequest}) and the short normalized names used as catalog
 * keys ({@code nodes-base.httpRequest}).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class NodeTypeNames {

    public static final String BASE_FULL_PREFIX = "n8n-nodes-base.";
    public static final String BASE_SHORT_PREFIX = "nodes-base.";
    public static final String LANGCHAIN_FULL_PREFIX = "@n8n/n8n-nodes-langchain.";
    public static final String LANGCHAIN_SHORT_PREFIX = "nodes-langchain.";

    private static final Set<String> CORE_PACKAGES = Set.of(
            "n8n-nodes-base", "nodes-base", "@n8n/n8n-nodes-langchain", "nodes-langchain");

    private NodeTypeNames() {
    }

    /**
     * Converts a full type name to its catalog key. Names already in short form and
     * community package names are returned unchanged.
     */
    public static String normalize(String nodeType) {
        if (nodeType == null) {
            return null;
        }
        if (nodeType.startsWith(BASE_FULL_PREFIX)) {
            return BASE_SHORT_PREFIX + nodeType.substring(BASE_FULL_PREFIX.length());
        }
        if (nodeType.startsWith(LANGCHAIN_FULL_PREFIX)) {
            return LANGCHAIN_SHORT_PREFIX + nodeType.substring(LANGCHAIN_FULL_PREFIX.length());
        }
        return nodeType;
    }

    /**
     * Converts a catalog key back to the form expected inside workflow documents.
     */
    public static String toDocumentForm(String nodeType) {
        if (nodeType == null) {
            return null;
        }
        if (nodeType.startsWith(BASE_SHORT_PREFIX)) {
            return BASE_FULL_PREFIX + nodeType.substring(BASE_SHORT_PREFIX.length());
        }
        if (nodeType.startsWith(LANGCHAIN_SHORT_PREFIX)) {
            return LANGCHAIN_FULL_PREFIX + nodeType.substring(LANGCHAIN_SHORT_PREFIX.length());
        }
        return nodeType;
    }

    /**
     * True for catalog-style names that are not valid inside a workflow document.
     */
    public static boolean isShortForm(String nodeType) {
        return nodeType != null
                && (nodeType.startsWith(BASE_SHORT_PREFIX) || nodeType.startsWith(LANGCHAIN_SHORT_PREFIX));
    }

    public static boolean hasPackagePrefix(String nodeType) {
        if (nodeType == null) {
            return false;
        }
        int dot = nodeType.lastIndexOf('.');
        return dot > 0 && dot < nodeType.length() - 1;
    }

    /**
     * True for the two packages shipped with the platform, in full or short form.
     * Every other package is a community package.
     */
    public static boolean isCorePackage(String packageName) {
        return packageName != null && CORE_PACKAGES.contains(packageName);
    }

    public static String packageOf(String nodeType) {
        if (!hasPackagePrefix(nodeType)) {
            return null;
        }
        return nodeType.substring(0, nodeType.lastIndexOf('.'));
    }

    /**
     * Unqualified part of a type name, e.g. {@code httpRequest}.
     */
    public static String localName(String nodeType) {
        if (nodeType == null) {
            return null;
        }
        int dot = nodeType.lastIndexOf('.');
        return dot >= 0 ? nodeType.substring(dot + 1) : nodeType;
    }
}
