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

/**
 * Whether a task runs unconditionally in the main sequence or may be placed in a branch.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public enum TaskRole {

    /** Data-gathering task, always part of the top-level sequence. */
    STEP("step"),

    /** Notifying task, may live inside a condition branch or a loop. */
    ACTION("action");

    private final String prefix;

    TaskRole(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Node type name used in graph identifiers, e.g. {@code action-slack}.
     */
    public String typeName(String providerType) {
        return prefix + "-" + providerType;
    }
}
