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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declaration of one configurable property of a node type.
 *
 * <p>Catalog entries are not trusted: {@code name} and {@code type} may be null on a
 * malformed entry, and validators skip such entries instead of failing.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class PropertySchema {

    private final String name;
    private final String displayName;
    private final String type;
    private final boolean required;
    private final Object defaultValue;
    private final String description;
    private final DisplayOptions displayOptions;
    private final List<PropertyOption> options;
    private final List<PropertySchema> properties;
    private final List<CollectionGroup> groups;
    private final boolean multipleValues;

    private PropertySchema(Builder builder) {
        this.name = builder.name;
        this.displayName = builder.displayName;
        this.type = builder.type;
        this.required = builder.required;
        this.defaultValue = builder.defaultValue;
        this.description = builder.description;
        this.displayOptions = builder.displayOptions;
        this.options = List.copyOf(builder.options);
        this.properties = List.copyOf(builder.properties);
        this.groups = List.copyOf(builder.groups);
        this.multipleValues = builder.multipleValues;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(String name, String type) {
        return new Builder().name(name).type(type);
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName != null ? displayName : name;
    }

    /**
     * Raw type tag as declared in the catalog.
     */
    public String getType() {
        return type;
    }

    public Optional<PropertyType> getPropertyType() {
        return PropertyType.fromTag(type);
    }

    public boolean isRequired() {
        return required;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    public DisplayOptions getDisplayOptions() {
        return displayOptions;
    }

    public List<PropertyOption> getOptions() {
        return options;
    }

    /**
     * Nested property schemas of a {@code collection} property.
     */
    public List<PropertySchema> getProperties() {
        return properties;
    }

    /**
     * Named groups of a {@code fixedCollection} property.
     */
    public List<CollectionGroup> getGroups() {
        return groups;
    }

    public boolean isMultipleValues() {
        return multipleValues;
    }

    public boolean isWellFormed() {
        return name != null && !name.isBlank() && type != null && !type.isBlank();
    }

    public boolean isResourceLocator() {
        return PropertyType.RESOURCE_LOCATOR.getTag().equals(type);
    }

    public List<Object> getOptionValues() {
        List<Object> values = new ArrayList<>(options.size());
        for (PropertyOption option : options) {
            values.add(option.value());
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertySchema that = (PropertySchema) o;
        return required == that.required &&
               multipleValues == that.multipleValues &&
               Objects.equals(name, that.name) &&
               Objects.equals(displayName, that.displayName) &&
               Objects.equals(type, that.type) &&
               Objects.equals(defaultValue, that.defaultValue) &&
               Objects.equals(description, that.description) &&
               Objects.equals(displayOptions, that.displayOptions) &&
               Objects.equals(options, that.options) &&
               Objects.equals(properties, that.properties) &&
               Objects.equals(groups, that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, required, displayOptions);
    }

    @Override
    public String toString() {
        return "PropertySchema{" +
               "name='" + name + '\'' +
               ", type='" + type + '\'' +
               ", required=" + required +
               (displayOptions != null ? ", displayOptions=" + displayOptions : "") +
               '}';
    }

    public static class Builder {
        private String name;
        private String displayName;
        private String type;
        private boolean required;
        private Object defaultValue;
        private String description;
        private DisplayOptions displayOptions;
        private List<PropertyOption> options = new ArrayList<>();
        private List<PropertySchema> properties = new ArrayList<>();
        private List<CollectionGroup> groups = new ArrayList<>();
        private boolean multipleValues;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder displayOptions(DisplayOptions displayOptions) {
            this.displayOptions = displayOptions;
            return this;
        }

        public Builder options(List<PropertyOption> options) {
            this.options = new ArrayList<>(options);
            return this;
        }

        public Builder option(String name, Object value) {
            this.options.add(PropertyOption.of(name, value));
            return this;
        }

        public Builder properties(List<PropertySchema> properties) {
            this.properties = new ArrayList<>(properties);
            return this;
        }

        public Builder groups(List<CollectionGroup> groups) {
            this.groups = new ArrayList<>(groups);
            return this;
        }

        public Builder multipleValues(boolean multipleValues) {
            this.multipleValues = multipleValues;
            return this;
        }

        public PropertySchema build() {
            return new PropertySchema(this);
        }
    }
}
