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

import java.util.Arrays;
import java.util.Optional;

/**
 * Types of triggers that can start a workflow.
 * <p>
 * The lower-case value doubles as the trigger's graph node id and as its key in the
 * workflow's global properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public enum TriggerType {

    /**
     * Started by an operator. Carries no payload.
     */
    MANUAL("manual"),

    /**
     * Periodic trigger. Carries the interval as a scalar.
     */
    INTERVAL("interval"),

    /**
     * Started by incoming alerts matching a filter mapping.
     */
    ALERT("alert"),

    /**
     * Started by incident lifecycle events ({@code created}, {@code updated}, {@code deleted}).
     */
    INCIDENT("incident");

    private final String value;

    TriggerType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<TriggerType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst();
    }
}
