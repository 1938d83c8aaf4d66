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

package dev.mars.alertflow.workflow.validation;

/**
 * Classes of validation failure. Whether a category blocks deployment is configured through
 * {@code alertflow.validation.nonblocking.categories}.
 */
public enum ViolationCategory {

    /** Graph shape: containers, branches, ordering, connectivity. */
    STRUCTURE,

    /** Workflow-level metadata such as name and description. */
    METADATA,

    /** Trigger declarations and their payloads. */
    TRIGGER,

    /** A templated field references a variable that cannot resolve. */
    VARIABLE,

    /** A task references a provider that is unknown or not installed. */
    PROVIDER_NOT_INSTALLED
}
