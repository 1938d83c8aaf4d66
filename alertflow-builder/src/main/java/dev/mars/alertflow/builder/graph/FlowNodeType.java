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

package dev.mars.alertflow.builder.graph;

/**
 * Kinds of node in the derived editor graph.
 */
public enum FlowNodeType {

    /** Fixed anchor opening the trigger region. */
    TRIGGER_START,

    /** Fixed anchor closing the trigger region and opening the step sequence. */
    TRIGGER_END,

    TRIGGER,
    TASK,
    CONDITION,
    CONDITION_END,
    LOOP,
    LOOP_END,

    /** Stand-in for an empty branch or loop body. */
    PLACEHOLDER,

    /** Terminal node after the root sequence. */
    END;

    /**
     * Branch kinds may fan out to several targets.
     */
    public boolean isBranch() {
        return this == CONDITION || this == LOOP;
    }

    /**
     * Nodes the editor may delete.
     */
    public boolean isDeletable() {
        return this == TRIGGER || this == TASK || this == CONDITION || this == LOOP;
    }
}
