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

import java.util.List;
import java.util.Objects;

/**
 * Position of a step node inside a definition.
 *
 * @param node      the located node
 * @param container the live list holding the node
 * @param index     index of the node within {@code container}
 * @param parent    the condition or loop owning {@code container}, or {@code null} for the root sequence
 */
public record NodeLocation(StepNode node, List<StepNode> container, int index, StepNode parent) {

    public NodeLocation {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(container, "container");
    }

    public boolean isRoot() {
        return parent == null;
    }
}
