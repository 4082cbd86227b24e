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

package dev.mars.flowsmith.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the Flowsmith validation and diff engines.
 * Values are layered: built-in defaults, then the first readable
 * {@code flowsmith.properties} file, then {@code flowsmith.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class FlowsmithConfiguration {
    private static final Logger logger = Logger.getLogger(FlowsmithConfiguration.class.getName());

    public static final String VALIDATION_PROFILE = "flowsmith.validation.profile";
    public static final String EXPRESSION_MAX_DEPTH = "flowsmith.expression.max.depth";
    public static final String DIFF_MAX_OPERATIONS = "flowsmith.diff.max.operations";
    public static final String SCHEMA_CACHE_ENABLED = "flowsmith.schema.cache.enabled";
    public static final String METRICS_ENABLED = "flowsmith.metrics.enabled";

    private static final String DEFAULT_VALIDATION_PROFILE = "runtime";
    private static final int DEFAULT_EXPRESSION_MAX_DEPTH = 100;
    private static final int DEFAULT_DIFF_MAX_OPERATIONS = 100;

    private final Properties properties;

    public FlowsmithConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public FlowsmithConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Creates a configuration holding only the built-in defaults.
     */
    public static FlowsmithConfiguration defaults() {
        return new FlowsmithConfiguration(null);
    }

    // Validation
    public String getDefaultValidationProfile() {
        return getStringProperty(VALIDATION_PROFILE, DEFAULT_VALIDATION_PROFILE);
    }

    public int getExpressionMaxDepth() {
        int depth = getIntProperty(EXPRESSION_MAX_DEPTH, DEFAULT_EXPRESSION_MAX_DEPTH);
        if (depth < 1) {
            logger.warning("Expression max depth must be positive, got " + depth +
                    ". Using default: " + DEFAULT_EXPRESSION_MAX_DEPTH);
            return DEFAULT_EXPRESSION_MAX_DEPTH;
        }
        return depth;
    }

    // Diff
    /**
     * Maximum number of operations accepted in one diff batch; zero or less disables the limit.
     */
    public int getDiffMaxOperations() {
        return getIntProperty(DIFF_MAX_OPERATIONS, DEFAULT_DIFF_MAX_OPERATIONS);
    }

    // Catalog
    public boolean isSchemaCacheEnabled() {
        return getBooleanProperty(SCHEMA_CACHE_ENABLED, true);
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(VALIDATION_PROFILE, DEFAULT_VALIDATION_PROFILE);
        properties.setProperty(EXPRESSION_MAX_DEPTH, String.valueOf(DEFAULT_EXPRESSION_MAX_DEPTH));
        properties.setProperty(DIFF_MAX_OPERATIONS, String.valueOf(DEFAULT_DIFF_MAX_OPERATIONS));
        properties.setProperty(SCHEMA_CACHE_ENABLED, "true");
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "flowsmith.properties",
                "config/flowsmith.properties",
                System.getProperty("user.home") + "/.flowsmith/flowsmith.properties",
                "/etc/flowsmith/flowsmith.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("flowsmith.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("flowsmith."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FlowsmithConfiguration{" +
                "validationProfile='" + getDefaultValidationProfile() + '\'' +
                ", expressionMaxDepth=" + getExpressionMaxDepth() +
                ", diffMaxOperations=" + getDiffMaxOperations() +
                ", schemaCacheEnabled=" + isSchemaCacheEnabled() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
