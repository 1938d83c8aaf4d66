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

import java.nio.file.Path;

/**
 * Turns textual workflow documents into {@link Definition}s.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public interface WorkflowParser {

    /**
     * Parses a workflow document.
     *
     * @throws MalformedDocumentException if the text is not a decodable mapping
     * @throws SemanticErrorException     if required workflow fields are absent or invalid
     */
    Definition parse(String text) throws WorkflowParseException;

    /**
     * Reads and parses a workflow file.
     */
    Definition parse(Path file) throws WorkflowParseException;

    /**
     * Parses a workflow document, keeping the non-fatal diagnostics.
     */
    ParsedWorkflow parseWithDiagnostics(String text) throws WorkflowParseException;
}
