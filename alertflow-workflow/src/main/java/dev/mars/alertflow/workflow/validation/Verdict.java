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

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating a node or a whole graph.
 *
 * <h3>Permitted subtypes</h3>
 * <ul>
 *   <li>{@link Valid}: no rule failed</li>
 *   <li>{@link Invalid}: carries the first violation found</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-10-28
 */
public sealed interface Verdict permits Verdict.Valid, Verdict.Invalid {

    Verdict VALID = new Valid();

    static Verdict valid() {
        return VALID;
    }

    static Verdict invalid(String key, String reason, ViolationCategory category) {
        return new Invalid(new Violation(key, reason, category));
    }

    boolean isValid();

    /**
     * The first violation, empty when valid.
     */
    Optional<Violation> violation();

    default Optional<String> reason() {
        return violation().map(Violation::reason);
    }

    record Valid() implements Verdict {
        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public Optional<Violation> violation() {
            return Optional.empty();
        }
    }

    record Invalid(Violation first) implements Verdict {
        public Invalid {
            Objects.requireNonNull(first, "first");
        }

        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public Optional<Violation> violation() {
            return Optional.of(first);
        }
    }
}
