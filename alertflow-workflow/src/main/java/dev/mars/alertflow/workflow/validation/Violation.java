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

package dev.mars.alertflow.workflow.validation;

import java.util.Objects;

/**
 * A single rule failure.
 *
 * @param key      id of the offending node, or a sentinel key for workflow-level rules
 *                 ({@code workflow_name}, {@code workflow_description}, {@code trigger_start},
 *                 {@code interval}, {@code alert}, {@code incident}, {@code trigger_end})
 * @param reason   human-readable reason
 * @param category failure class
 */
public record Violation(String key, String reason, ViolationCategory category) {

    public Violation {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(category, "category");
    }
}
