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
 * Insertion position in the model that an edge stands for.
 *
 * @param ownerId id of the condition or loop owning the container, or {@code null} for the
 *                root sequence and the trigger region
 * @param branch  which container of the owner
 * @param index   position a new node takes in that container
 */
public record Slot(String ownerId, Branch branch, int index) {

    public enum Branch {
        ROOT,
        TRUE,
        FALSE,
        LOOP,
        TRIGGERS
    }

    public Slot {
        Objects.requireNonNull(branch, "branch");
    }
}
