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

import java.util.UUID;

/**
 * A node of a workflow's step sequence.
 *
 * <h3>Permitted subtypes</h3>
 * <ul>
 *   <li>{@link Task}: a single provider invocation, tagged as step or action</li>
 *   <li>{@link Condition}: a guarded branch whose true branch holds actions</li>
 *   <li>{@link Loop}: a foreach container owning one nested sequence</li>
 * </ul>
 * Trigger declarations are not step nodes; they live on the {@link Definition}.
 * <p>
 * Nodes are mutable and owned by exactly one container. Ids are generated at creation and
 * survive {@link #copy()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public sealed interface StepNode permits Task, Condition, Loop {

    String getId();

    String getName();

    void setName(String name);

    NodeKind getKind();

    /**
     * Graph type name, e.g. {@code step-prometheus}, {@code condition-threshold} or {@code foreach}.
     */
    String getTypeName();

    /**
     * Deep copy keeping every node id.
     */
    StepNode copy();

    /**
     * Deep copy under freshly generated ids, children included.
     */
    StepNode duplicate();

    static String newId() {
        return UUID.randomUUID().toString();
    }
}
