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

package dev.mars.alertflow.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.alertflow.exceptions.ProviderCatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Static list of the provider types a workflow may use, plus the installed configurations.
 * <p>
 * Loaded from a JSON document of the form
 * <pre>
 * {
 *   "providers": [ {"type": "slack", "can_notify": true, "notify_params": ["message"]} ],
 *   "installed": [ {"type": "slack", "name": "ops-slack"} ]
 * }
 * </pre>
 * The {@code mock} provider is always available and never needs installation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-17
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderCatalog {

    private static final Logger logger = LoggerFactory.getLogger(ProviderCatalog.class);

    public static final String MOCK_PROVIDER = "mock";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, ProviderDescriptor> providers;
    private final List<InstalledProvider> installed;

    @JsonCreator
    public ProviderCatalog(@JsonProperty("providers") List<ProviderDescriptor> providers,
                           @JsonProperty("installed") List<InstalledProvider> installed) {
        this.providers = new LinkedHashMap<>();
        if (providers != null) {
            for (ProviderDescriptor descriptor : providers) {
                if (this.providers.putIfAbsent(descriptor.getType(), descriptor) != null) {
                    logger.warn("Duplicate provider type '{}' in catalog, keeping the first entry",
                            descriptor.getType());
                }
            }
        }
        this.installed = installed != null ? List.copyOf(installed) : List.of();
    }

    public static ProviderCatalog empty() {
        return new ProviderCatalog(List.of(), List.of());
    }

    public static ProviderCatalog fromJson(String json) throws ProviderCatalogException {
        try {
            ProviderCatalog catalog = MAPPER.readValue(json, ProviderCatalog.class);
            logger.debug("Loaded provider catalog with {} providers and {} installations",
                    catalog.providers.size(), catalog.installed.size());
            return catalog;
        } catch (JsonProcessingException e) {
            throw new ProviderCatalogException("Failed to decode provider catalog: " + e.getOriginalMessage(), e);
        }
    }

    public static ProviderCatalog fromJson(InputStream input) throws ProviderCatalogException {
        try {
            return MAPPER.readValue(input, ProviderCatalog.class);
        } catch (IOException e) {
            throw new ProviderCatalogException("Failed to read provider catalog", e);
        }
    }

    public Optional<ProviderDescriptor> find(String type) {
        return Optional.ofNullable(type).map(providers::get);
    }

    public boolean isSupported(String type) {
        return MOCK_PROVIDER.equals(type) || providers.containsKey(type);
    }

    public boolean isInstalled(String type, String configName) {
        return installed.stream()
                .anyMatch(p -> p.type().equals(type) && p.name().equals(configName));
    }

    public List<ProviderDescriptor> getProviders() {
        return List.copyOf(providers.values());
    }

    public List<InstalledProvider> getInstalled() {
        return installed;
    }

    public List<ProviderDescriptor> getQueryProviders() {
        return providers.values().stream()
                .filter(ProviderDescriptor::isCanQuery)
                .collect(Collectors.toList());
    }

    public List<ProviderDescriptor> getNotifyProviders() {
        return providers.values().stream()
                .filter(ProviderDescriptor::isCanNotify)
                .collect(Collectors.toList());
    }

    /**
     * Checks the provider reference of a task.
     *
     * @return the reason the reference cannot run, or empty when it can
     */
    public Optional<String> checkInstallation(String type, String configName) {
        if (MOCK_PROVIDER.equals(type)) {
            return Optional.empty();
        }
        ProviderDescriptor descriptor = providers.get(type);
        if (descriptor == null) {
            return Optional.of("Provider type '" + type + "' is not supported");
        }
        if (!descriptor.needsInstallation()) {
            return Optional.empty();
        }
        if (configName == null || configName.isBlank()) {
            return Optional.of("No " + type + " provider selected");
        }
        if (!isInstalled(type, configName)) {
            return Optional.of("The '" + configName + "' " + type
                    + " provider is not installed. Please install it before executing this workflow.");
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "ProviderCatalog{providers=" + providers.keySet() + ", installed=" + installed.size() + '}';
    }
}
