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

import java.util.Objects;

/**
 * Non-fatal finding recorded while parsing a workflow document.
 *
 * @param kind      what was found
 * @param fieldPath document path of the offending entry, e.g. {@code actions[2].if}
 * @param message   human-readable description
 */
public record ParseDiagnostic(Kind kind, String fieldPath, String message) {

    public enum Kind {
        /** An {@code if} reference matched no condition alias; the action stays unconditioned. */
        UNRESOLVED_ALIAS,
        /** A second condition declared an alias already in use; references keep the first. */
        DUPLICATE_ALIAS,
        /** A trigger type was declared twice; the first declaration is kept. */
        DUPLICATE_TRIGGER,
        /** An action carried both {@code if} and {@code condition}; the inline list was ignored. */
        IGNORED_CONDITION,
        /** An entry declared an id that is reserved or already used; a fresh id was generated. */
        REPLACED_ID
    }

    public ParseDiagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return kind + (fieldPath != null ? " [" + fieldPath + "]" : "") + ": " + message;
    }
}
