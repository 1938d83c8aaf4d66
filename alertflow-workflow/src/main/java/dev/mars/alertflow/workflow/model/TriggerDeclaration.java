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

package dev.mars.alertflow.workflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declaration of one workflow trigger.
 * <p>
 * Each trigger type uses a subset of the fields:
 * <ul>
 *   <li>{@link TriggerType#MANUAL}: none</li>
 *   <li>{@link TriggerType#INTERVAL}: {@code value}</li>
 *   <li>{@link TriggerType#ALERT}: {@code filters}</li>
 *   <li>{@link TriggerType#INCIDENT}: {@code events}</li>
 * </ul>
 * Instances are immutable; editing a trigger replaces its declaration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public final class TriggerDeclaration {

    public static final List<String> INCIDENT_EVENTS = List.of("created", "updated", "deleted");

    private final TriggerType type;

    // INTERVAL trigger field
    private final String value;

    // ALERT trigger field
    private final Map<String, String> filters;

    // INCIDENT trigger field
    private final List<String> events;

    private TriggerDeclaration(TriggerType type, String value, Map<String, String> filters, List<String> events) {
        this.type = Objects.requireNonNull(type, "Trigger type cannot be null");
        this.value = value;
        this.filters = filters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(filters))
                : Collections.emptyMap();
        this.events = events != null ? List.copyOf(events) : List.of();
    }

    /**
     * Creates a MANUAL trigger declaration.
     */
    public static TriggerDeclaration manual() {
        return new TriggerDeclaration(TriggerType.MANUAL, null, null, null);
    }

    /**
     * Creates an INTERVAL trigger declaration.
     *
     * @param value the interval, kept as written in the document
     */
    public static TriggerDeclaration interval(String value) {
        return new TriggerDeclaration(TriggerType.INTERVAL, value != null ? value : "", null, null);
    }

    /**
     * Creates an ALERT trigger declaration.
     *
     * @param filters ordered key to value filter mapping
     */
    public static TriggerDeclaration alert(Map<String, String> filters) {
        return new TriggerDeclaration(TriggerType.ALERT, null, filters, null);
    }

    /**
     * Creates an INCIDENT trigger declaration.
     */
    public static TriggerDeclaration incident(List<String> events) {
        return new TriggerDeclaration(TriggerType.INCIDENT, null, null, events);
    }

    /**
     * The declaration an editor inserts when a trigger node is first placed.
     */
    public static TriggerDeclaration defaultFor(TriggerType type) {
        switch (type) {
            case MANUAL:
                return manual();
            case INTERVAL:
                return interval("");
            case ALERT:
                return alert(Map.of("source", ""));
            case INCIDENT:
                return incident(List.of());
            default:
                throw new IllegalArgumentException("Unsupported trigger type: " + type);
        }
    }

    public TriggerType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public Map<String, String> getFilters() {
        return filters;
    }

    public List<String> getEvents() {
        return events;
    }

    /**
     * Value of this trigger in the workflow's global properties view.
     */
    public Object toPropertyValue() {
        switch (type) {
            case MANUAL:
                return "true";
            case INTERVAL:
                return value;
            case ALERT:
                return filters;
            case INCIDENT:
                return Map.of("events", events);
            default:
                throw new IllegalStateException("Unsupported trigger type: " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TriggerDeclaration that = (TriggerDeclaration) o;
        return type == that.type &&
               Objects.equals(value, that.value) &&
               filters.equals(that.filters) &&
               events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, filters, events);
    }

    @Override
    public String toString() {
        return "TriggerDeclaration{" +
                "type=" + type +
                (value != null ? ", value='" + value + '\'' : "") +
                (!filters.isEmpty() ? ", filters=" + filters : "") +
                (!events.isEmpty() ? ", events=" + events : "") +
                '}';
    }
}
