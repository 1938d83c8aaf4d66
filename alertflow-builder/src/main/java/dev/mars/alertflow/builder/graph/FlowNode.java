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

import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.TriggerType;

import java.util.Objects;

/**
 * Node of the derived editor graph.
 *
 * @param id          graph node id; step node id, trigger type value or a synthetic id
 * @param type        node kind
 * @param name        display name
 * @param typeName    model type name, e.g. {@code action-slack} or {@code interval}
 * @param step        a copy of the model node behind this graph node, or {@code null};
 *                    editing it has no effect on the workflow
 * @param triggerType trigger type of a {@link FlowNodeType#TRIGGER} node, or {@code null}
 * @param detached    true for nodes dropped onto the canvas but not part of the workflow
 */
public record FlowNode(String id, FlowNodeType type, String name, String typeName,
                       StepNode step, TriggerType triggerType, boolean detached) {

    public FlowNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
    }
}
