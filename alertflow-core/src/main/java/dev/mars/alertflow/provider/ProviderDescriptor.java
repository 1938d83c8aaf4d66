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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog entry describing one provider type.
 * <p>
 * A provider that can be queried is offered as a step, one that can notify as an action.
 * The parameter lists name the {@code with} keys available for each role. A non-empty
 * {@code config} schema means the provider has to be installed before a workflow using
 * it can run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-17
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderDescriptor {

    private final String type;
    private final boolean canQuery;
    private final boolean canNotify;
    private final List<String> queryParams;
    private final List<String> notifyParams;
    private final Map<String, Object> config;

    @JsonCreator
    public ProviderDescriptor(
            @JsonProperty("type") String type,
            @JsonProperty("can_query") boolean canQuery,
            @JsonProperty("can_notify") boolean canNotify,
            @JsonProperty("query_params") List<String> queryParams,
            @JsonProperty("notify_params") List<String> notifyParams,
            @JsonProperty("config") Map<String, Object> config) {
        this.type = Objects.requireNonNull(type, "Provider type cannot be null");
        this.canQuery = canQuery;
        this.canNotify = canNotify;
        this.queryParams = queryParams != null ? List.copyOf(queryParams) : List.of();
        this.notifyParams = notifyParams != null ? List.copyOf(notifyParams) : List.of();
        this.config = config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>();
    }

    /**
     * Creates a provider that needs no installation.
     */
    public static ProviderDescriptor of(String type, boolean canQuery, boolean canNotify,
                                        List<String> queryParams, List<String> notifyParams) {
        return new ProviderDescriptor(type, canQuery, canNotify, queryParams, notifyParams, null);
    }

    public String getType() {
        return type;
    }

    public boolean isCanQuery() {
        return canQuery;
    }

    public boolean isCanNotify() {
        return canNotify;
    }

    public List<String> getQueryParams() {
        return queryParams;
    }

    public List<String> getNotifyParams() {
        return notifyParams;
    }

    public Map<String, Object> getConfig() {
        return Map.copyOf(config);
    }

    public boolean needsInstallation() {
        return !config.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderDescriptor that = (ProviderDescriptor) o;
        return canQuery == that.canQuery &&
               canNotify == that.canNotify &&
               type.equals(that.type) &&
               queryParams.equals(that.queryParams) &&
               notifyParams.equals(that.notifyParams) &&
               config.equals(that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, canQuery, canNotify, queryParams, notifyParams, config);
    }

    @Override
    public String toString() {
        return "ProviderDescriptor{" +
                "type='" + type + '\'' +
                ", canQuery=" + canQuery +
                ", canNotify=" + canNotify +
                ", needsInstallation=" + needsInstallation() +
                '}';
    }
}
