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

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class FlowsmithConfigurationTest {

    @Test
    void testDefaults() {
        FlowsmithConfiguration config = FlowsmithConfiguration.defaults();

        assertEquals("runtime", config.getDefaultValidationProfile());
        assertEquals(100, config.getExpressionMaxDepth());
        assertEquals(100, config.getDiffMaxOperations());
        assertTrue(config.isSchemaCacheEnabled());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testPropertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(FlowsmithConfiguration.VALIDATION_PROFILE, "strict");
        properties.setProperty(FlowsmithConfiguration.EXPRESSION_MAX_DEPTH, "25");
        properties.setProperty(FlowsmithConfiguration.DIFF_MAX_OPERATIONS, "5");
        properties.setProperty(FlowsmithConfiguration.SCHEMA_CACHE_ENABLED, "false");

        FlowsmithConfiguration config = new FlowsmithConfiguration(properties);

        assertEquals("strict", config.getDefaultValidationProfile());
        assertEquals(25, config.getExpressionMaxDepth());
        assertEquals(5, config.getDiffMaxOperations());
        assertFalse(config.isSchemaCacheEnabled());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        Properties properties = new Properties();
        properties.setProperty(FlowsmithConfiguration.DIFF_MAX_OPERATIONS, "lots");

        FlowsmithConfiguration config = new FlowsmithConfiguration(properties);

        assertEquals(100, config.getDiffMaxOperations());
    }

    @Test
    void testNonPositiveDepthFallsBackToDefault() {
        Properties properties = new Properties();
        properties.setProperty(FlowsmithConfiguration.EXPRESSION_MAX_DEPTH, "0");

        assertEquals(100, new FlowsmithConfiguration(properties).getExpressionMaxDepth());
    }

    @Test
    void testSetProperty() {
        FlowsmithConfiguration config = FlowsmithConfiguration.defaults();
        config.setProperty(FlowsmithConfiguration.DIFF_MAX_OPERATIONS, "0");

        assertEquals(0, config.getDiffMaxOperations());
        assertEquals("0", config.getProperty(FlowsmithConfiguration.DIFF_MAX_OPERATIONS));
        assertEquals("fallback", config.getProperty("flowsmith.unknown", "fallback"));
    }
}
