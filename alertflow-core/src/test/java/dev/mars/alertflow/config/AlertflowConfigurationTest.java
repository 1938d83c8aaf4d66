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

package dev.mars.alertflow.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for AlertflowConfiguration.
 * Validates default values, explicit properties, system property overrides and type conversion.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-20
 * @version 1.0
 */
class AlertflowConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(AlertflowConfiguration.HISTORY_SIZE);
        System.clearProperty(AlertflowConfiguration.STRICT_ALIASES);
    }

    // ========== Default Configuration Tests ==========

    @Test
    void testDefaults() {
        AlertflowConfiguration config = AlertflowConfiguration.defaults();

        assertFalse(config.isStrictAliases());
        assertEquals(2, config.getSerializerIndent());
        assertEquals(120, config.getSerializerLineWidth());
        assertEquals(50, config.getHistorySize());
        assertEquals(500, config.getDescriptionMaxLength());
        assertEquals(Set.of("PROVIDER_NOT_INSTALLED"), config.getNonBlockingCategories());
        assertTrue(config.isMetricsEnabled());
    }

    // ========== Explicit Properties Tests ==========

    @Test
    void testExplicitPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(AlertflowConfiguration.STRICT_ALIASES, "true");
        props.setProperty(AlertflowConfiguration.HISTORY_SIZE, "5");
        props.setProperty(AlertflowConfiguration.NONBLOCKING_CATEGORIES, " metadata , provider_not_installed ");

        AlertflowConfiguration config = new AlertflowConfiguration(props);

        assertTrue(config.isStrictAliases());
        assertEquals(5, config.getHistorySize());
        assertEquals(Set.of("METADATA", "PROVIDER_NOT_INSTALLED"), config.getNonBlockingCategories());
    }

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        Properties props = new Properties();
        props.setProperty(AlertflowConfiguration.HISTORY_SIZE, "lots");
        props.setProperty(AlertflowConfiguration.SERIALIZER_INDENT, "40");

        AlertflowConfiguration config = new AlertflowConfiguration(props);

        assertEquals(50, config.getHistorySize());
        assertEquals(2, config.getSerializerIndent());
    }

    @Test
    void testBlankNonBlockingCategoriesMeansEverythingBlocks() {
        AlertflowConfiguration config = AlertflowConfiguration.defaults();
        config.setProperty(AlertflowConfiguration.NONBLOCKING_CATEGORIES, "");

        assertTrue(config.getNonBlockingCategories().isEmpty());
    }

    @Test
    void testNegativeHistorySizeClampedToZero() {
        AlertflowConfiguration config = AlertflowConfiguration.defaults();
        config.setProperty(AlertflowConfiguration.HISTORY_SIZE, "-3");

        assertEquals(0, config.getHistorySize());
    }

    // ========== System Property Tests ==========

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(AlertflowConfiguration.HISTORY_SIZE, "7");
        System.setProperty(AlertflowConfiguration.STRICT_ALIASES, "true");

        AlertflowConfiguration config = new AlertflowConfiguration();

        assertEquals(7, config.getHistorySize());
        assertTrue(config.isStrictAliases());
    }

    @Test
    void testGenericPropertyAccess() {
        AlertflowConfiguration config = AlertflowConfiguration.defaults();
        assertNull(config.getProperty("alertflow.unknown"));
        assertEquals("x", config.getProperty("alertflow.unknown", "x"));

        config.setProperty("alertflow.unknown", "y");
        assertEquals("y", config.getProperty("alertflow.unknown"));
        assertTrue(config.toString().contains("historySize=50"));
    }
}
