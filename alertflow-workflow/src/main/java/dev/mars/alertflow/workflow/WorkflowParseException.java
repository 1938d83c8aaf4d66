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

import dev.mars.alertflow.exceptions.AlertflowException;

/**
 * Exception thrown when a workflow document cannot be turned into a definition.
 * See {@link MalformedDocumentException} and {@link SemanticErrorException} for the two
 * failure classes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowParseException extends AlertflowException {

    private final String workflowId;
    private final int lineNumber;
    private final String fieldPath;

    public WorkflowParseException(String message) {
        this(null, -1, null, message, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, -1, null, message, cause);
    }

    public WorkflowParseException(String workflowId, String fieldPath, String message) {
        this(workflowId, -1, fieldPath, message, null);
    }

    public WorkflowParseException(String workflowId, int lineNumber, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * The message without workflow, line and field prefixes.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (workflowId != null) {
            sb.append("Workflow '").append(workflowId).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
