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

import java.util.List;
import java.util.Objects;

/**
 * A parsed definition together with the non-fatal diagnostics of the parse.
 */
public record ParsedWorkflow(Definition definition, List<ParseDiagnostic> diagnostics) {

    public ParsedWorkflow {
        Objects.requireNonNull(definition, "definition");
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public List<ParseDiagnostic> diagnostics(ParseDiagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
