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

package dev.mars.alertflow.builder;

import dev.mars.alertflow.workflow.validation.Violation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a builder store operation together with the validation state after it.
 *
 * @param applied    whether the store changed
 * @param rejection  why the operation was refused, or {@code null} when applied
 * @param message    human readable detail of the rejection, or {@code null}
 * @param violations validation map after the operation, keyed by node id or workflow sentinel key
 * @param canDeploy  whether the current graph may be deployed
 */
public record MutationResult(boolean applied, Rejection rejection, String message,
                             Map<String, Violation> violations, boolean canDeploy) {

    public MutationResult {
        violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    public static MutationResult applied(Map<String, Violation> violations, boolean canDeploy) {
        return new MutationResult(true, null, null, violations, canDeploy);
    }

    public static MutationResult rejected(Rejection rejection, String message,
                                          Map<String, Violation> violations, boolean canDeploy) {
        return new MutationResult(false, rejection, message, violations, canDeploy);
    }
}
