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

package dev.mars.alertflow.workflow;

import dev.mars.alertflow.workflow.model.Definition;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns {@link Definition}s back into canonical workflow documents.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public interface WorkflowSerializer {

    /**
     * Serializes a definition. Never fails on a definition that passes graph validation.
     */
    String serialize(Definition definition);

    /**
     * Serializes a definition and writes it to {@code file}, replacing any existing content.
     */
    void serializeToFile(Definition definition, Path file) throws IOException;
}
