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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration management for the Alertflow workflow builder.
 * Properties are layered: built-in defaults, then the first {@code alertflow.properties}
 * found on disk or the classpath, then {@code alertflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class AlertflowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(AlertflowConfiguration.class);

    public static final String STRICT_ALIASES = "alertflow.parser.strict.aliases";
    public static final String SERIALIZER_INDENT = "alertflow.serializer.indent";
    public static final String SERIALIZER_LINE_WIDTH = "alertflow.serializer.line.width";
    public static final String HISTORY_SIZE = "alertflow.builder.history.size";
    public static final String DESCRIPTION_MAX_LENGTH = "alertflow.validation.description.max.length";
    public static final String NONBLOCKING_CATEGORIES = "alertflow.validation.nonblocking.categories";
    public static final String METRICS_ENABLED = "alertflow.monitoring.metrics.enabled";

    // Default configuration values
    private static final boolean DEFAULT_STRICT_ALIASES = false;
    private static final int DEFAULT_SERIALIZER_INDENT = 2;
    private static final int DEFAULT_SERIALIZER_LINE_WIDTH = 120;
    private static final int DEFAULT_HISTORY_SIZE = 50;
    private static final int DEFAULT_DESCRIPTION_MAX_LENGTH = 500;
    private static final String DEFAULT_NONBLOCKING_CATEGORIES = "PROVIDER_NOT_INSTALLED";

    private final Properties properties;

    public AlertflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public AlertflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Configuration holding only the built-in defaults, ignoring files and system properties.
     */
    public static AlertflowConfiguration defaults() {
        return new AlertflowConfiguration(null);
    }

    // Parser
    public boolean isStrictAliases() {
        return getBooleanProperty(STRICT_ALIASES, DEFAULT_STRICT_ALIASES);
    }

    // Serializer
    public int getSerializerIndent() {
        int indent = getIntProperty(SERIALIZER_INDENT, DEFAULT_SERIALIZER_INDENT);
        if (indent < 1 || indent > 10) {
            logger.warn("Serializer indent {} outside 1..10. Using default: {}", indent, DEFAULT_SERIALIZER_INDENT);
            return DEFAULT_SERIALIZER_INDENT;
        }
        return indent;
    }

    public int getSerializerLineWidth() {
        return getIntProperty(SERIALIZER_LINE_WIDTH, DEFAULT_SERIALIZER_LINE_WIDTH);
    }

    // Builder
    public int getHistorySize() {
        return Math.max(0, getIntProperty(HISTORY_SIZE, DEFAULT_HISTORY_SIZE));
    }

    // Validation
    public int getDescriptionMaxLength() {
        return getIntProperty(DESCRIPTION_MAX_LENGTH, DEFAULT_DESCRIPTION_MAX_LENGTH);
    }

    /**
     * Names of the violation categories that do not block deployment.
     */
    public Set<String> getNonBlockingCategories() {
        String value = getStringProperty(NONBLOCKING_CATEGORIES, DEFAULT_NONBLOCKING_CATEGORIES);
        if (value == null || value.isBlank()) {
            return Collections.emptySet();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(String::toUpperCase)
                .collect(Collectors.toCollection(LinkedHashSet::new));
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
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
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
        properties.setProperty(STRICT_ALIASES, String.valueOf(DEFAULT_STRICT_ALIASES));
        properties.setProperty(SERIALIZER_INDENT, String.valueOf(DEFAULT_SERIALIZER_INDENT));
        properties.setProperty(SERIALIZER_LINE_WIDTH, String.valueOf(DEFAULT_SERIALIZER_LINE_WIDTH));
        properties.setProperty(HISTORY_SIZE, String.valueOf(DEFAULT_HISTORY_SIZE));
        properties.setProperty(DESCRIPTION_MAX_LENGTH, String.valueOf(DEFAULT_DESCRIPTION_MAX_LENGTH));
        properties.setProperty(NONBLOCKING_CATEGORIES, DEFAULT_NONBLOCKING_CATEGORIES);
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "alertflow.properties",
                "config/alertflow.properties",
                System.getProperty("user.home") + "/.alertflow/alertflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("alertflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("alertflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "AlertflowConfiguration{" +
                "strictAliases=" + isStrictAliases() +
                ", serializerIndent=" + getSerializerIndent() +
                ", historySize=" + getHistorySize() +
                ", nonBlockingCategories=" + getNonBlockingCategories() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
