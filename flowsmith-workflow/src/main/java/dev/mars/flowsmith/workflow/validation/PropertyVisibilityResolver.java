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

import dev.mars.flowsmith.nodetype.DisplayOptions;
import dev.mars.flowsmith.nodetype.PropertySchema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a property currently applies, given its visibility condition and a
 * flat snapshot of the node's configuration.
 *
 * <p>A referenced sibling contributes its value only when it is present in the
 * configuration and is itself visible; a hidden or absent sibling never matches. A
 * chain that leads back to a property already being resolved is treated the same way.
 * The pseudo-field {@code @version} resolves to the node's type version. List-valued
 * configuration matches when any element is allowed, and numbers compare by value.</p>
 *
 * <p>The resolver is stateless and has no side effects.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class PropertyVisibilityResolver {

    /**
     * Evaluates a property in isolation: sibling values are taken at face value.
     */
    public boolean isVisible(PropertySchema property, Map<String, Object> config) {
        return isVisible(property, List.of(), config, null);
    }

    public boolean isVisible(PropertySchema property, List<PropertySchema> siblings,
                             Map<String, Object> config, Double typeVersion) {
        Objects.requireNonNull(property, "Property cannot be null");
        Context context = new Context(siblings, config != null ? config : Map.of(), typeVersion);
        Set<String> resolving = new HashSet<>();
        if (property.getName() != null) {
            resolving.add(property.getName());
        }
        return evaluate(property, context, resolving);
    }

    /**
     * Returns the well-formed properties of {@code properties} that are visible for the
     * given configuration, in declaration order.
     */
    public List<PropertySchema> resolveVisible(List<PropertySchema> properties, Map<String, Object> config,
                                               Double typeVersion) {
        List<PropertySchema> visible = new ArrayList<>();
        for (PropertySchema property : properties) {
            if (property.isWellFormed() && isVisible(property, properties, config, typeVersion)) {
                visible.add(property);
            }
        }
        return visible;
    }

    private boolean evaluate(PropertySchema property, Context context, Set<String> resolving) {
        DisplayOptions displayOptions = property.getDisplayOptions();
        if (displayOptions == null || displayOptions.isEmpty()) {
            return true;
        }

        for (Map.Entry<String, List<Object>> condition : displayOptions.getShow().entrySet()) {
            Optional<Object> value = resolveField(condition.getKey(), context, resolving);
            if (value.isEmpty() || !matches(value.get(), condition.getValue())) {
                return false;
            }
        }

        for (Map.Entry<String, List<Object>> condition : displayOptions.getHide().entrySet()) {
            Optional<Object> value = resolveField(condition.getKey(), context, resolving);
            if (value.isPresent() && matches(value.get(), condition.getValue())) {
                return false;
            }
        }

        return true;
    }

    private Optional<Object> resolveField(String field, Context context, Set<String> resolving) {
        if (DisplayOptions.VERSION_FIELD.equals(field)) {
            return Optional.ofNullable(context.typeVersion);
        }

        Object value = context.config.get(field);
        if (value == null) {
            return Optional.empty();
        }

        List<PropertySchema> definitions = context.definitionsOf(field);
        if (definitions.isEmpty()) {
            return Optional.of(value);
        }

        if (!resolving.add(field)) {
            return Optional.empty();
        }
        try {
            for (PropertySchema definition : definitions) {
                if (evaluate(definition, context, resolving)) {
                    return Optional.of(value);
                }
            }
            return Optional.empty();
        } finally {
            resolving.remove(field);
        }
    }

    private boolean matches(Object value, List<Object> allowed) {
        if (value instanceof List<?> values) {
            for (Object element : values) {
                if (matchesSingle(element, allowed)) {
                    return true;
                }
            }
            return false;
        }
        return matchesSingle(value, allowed);
    }

    private boolean matchesSingle(Object value, List<Object> allowed) {
        for (Object candidate : allowed) {
            if (valuesEqual(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (!Double.isFinite(x.doubleValue()) || !Double.isFinite(y.doubleValue())) {
                return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
            }
            return toBigDecimal(x).compareTo(toBigDecimal(y)) == 0;
        }
        return Objects.equals(a, b);
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }

    private static final class Context {
        private final List<PropertySchema> siblings;
        private final Map<String, Object> config;
        private final Double typeVersion;

        private Context(List<PropertySchema> siblings, Map<String, Object> config, Double typeVersion) {
            this.siblings = siblings != null ? siblings : List.of();
            this.config = config;
            this.typeVersion = typeVersion;
        }

        private List<PropertySchema> definitionsOf(String name) {
            List<PropertySchema> result = new ArrayList<>();
            for (PropertySchema sibling : siblings) {
                if (name.equals(sibling.getName())) {
                    result.add(sibling);
                }
            }
            return result;
        }
    }
}
