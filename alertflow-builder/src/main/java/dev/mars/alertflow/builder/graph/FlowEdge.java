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

import java.util.Objects;

/**
 * Directed edge of the derived editor graph.
 *
 * @param id     {@code e<source>-<target>}
 * @param source source node id
 * @param target target node id
 * @param label  {@code True}/{@code False} on the first edge of a condition branch, otherwise null
 * @param slot   the model position a node inserted on this edge takes, or null when nothing
 *               can be inserted here
 * @param manual true for edges drawn by the user rather than derived from the model
 */
public record FlowEdge(String id, String source, String target, String label, Slot slot, boolean manual) {

    public FlowEdge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public static FlowEdge derived(String source, String target, String label, Slot slot) {
        return new FlowEdge(edgeId(source, target), source, target, label, slot, false);
    }

    public static FlowEdge manual(String source, String target) {
        return new FlowEdge(edgeId(source, target), source, target, null, null, true);
    }

    public static String edgeId(String source, String target) {
        return "e" + source + "-" + target;
    }

    public boolean isInsertable() {
        return slot != null;
    }

    public boolean isTriggerRegion() {
        return slot != null && slot.branch() == Slot.Branch.TRIGGERS;
    }
}
