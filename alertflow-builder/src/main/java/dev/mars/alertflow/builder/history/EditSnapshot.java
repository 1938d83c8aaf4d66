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

package dev.mars.alertflow.builder.history;

import dev.mars.alertflow.builder.graph.FlowEdge;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.StepNode;

import java.util.List;
import java.util.Objects;

/**
 * Editor state captured before a mutation. Holds deep copies only.
 *
 * @param definition   copy of the edited definition
 * @param detached     copies of the nodes dropped onto the canvas
 * @param manualEdges  user drawn edges
 * @param selectedNode selected graph node id, or {@code null}
 */
public record EditSnapshot(Definition definition, List<StepNode> detached,
                           List<FlowEdge> manualEdges, String selectedNode) {

    public EditSnapshot {
        Objects.requireNonNull(definition, "definition");
        detached = List.copyOf(detached);
        manualEdges = List.copyOf(manualEdges);
    }

    public static EditSnapshot capture(Definition definition, List<StepNode> detached,
                                       List<FlowEdge> manualEdges, String selectedNode) {
        return new EditSnapshot(definition.copy(),
                detached.stream().map(StepNode::copy).toList(),
                manualEdges, selectedNode);
    }
}
