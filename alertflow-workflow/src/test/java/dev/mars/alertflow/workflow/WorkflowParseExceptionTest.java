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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for WorkflowParseExceptionTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-20
 */

class WorkflowParseExceptionTest {

    @Test
    void testBasicConstructor() {
        String message = "Failed to parse workflow document";

        WorkflowParseException exception = new WorkflowParseException(message);

        assertEquals(message, exception.getMessage());
        assertNull(exception.getCause());
        assertNull(exception.getWorkflowId());
        assertEquals(-1, exception.getLineNumber());
        assertNull(exception.getFieldPath());
    }

    @Test
    void testConstructorWithCause() {
        RuntimeException cause = new RuntimeException("Invalid YAML syntax");

        WorkflowParseException exception = new WorkflowParseException("YAML parsing failed", cause);

        assertEquals("YAML parsing failed", exception.getMessage());
        assertEquals(cause, exception.getCause());
    }

    @Test
    void testMessagePrefixes() {
        WorkflowParseException exception =
                new WorkflowParseException("w1", 12, "actions[0].provider", "Provider is required", null);

        assertEquals("Workflow 'w1': Line 12: Field 'actions[0].provider': Provider is required",
                exception.getMessage());
        assertEquals("Provider is required", exception.getReason());
    }

    @Test
    void testFieldPathWithoutLine() {
        WorkflowParseException exception = new WorkflowParseException("w1", "id", "Workflow id is required");

        assertEquals("Workflow 'w1': Field 'id': Workflow id is required", exception.getMessage());
        assertEquals(-1, exception.getLineNumber());
    }

    @Test
    void testSubclassesShareTheHierarchy() {
        MalformedDocumentException malformed = new MalformedDocumentException(3, "YAML parsing failed: bad indent", null);
        SemanticErrorException semantic = new SemanticErrorException("Missing top-level key");

        assertInstanceOf(WorkflowParseException.class, malformed);
        assertInstanceOf(AlertflowException.class, semantic);
        assertEquals("Line 3: YAML parsing failed: bad indent", malformed.getMessage());
    }
}
