/*
 * Guard.java
 *
 * This source file is part of the symrewrite open source project
 *
 * Copyright 2024-2026 the symrewrite project authors
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

package io.symrewrite.engine.rules;

import io.symrewrite.annotation.API;
import io.symrewrite.engine.matching.Substitution;

import javax.annotation.Nonnull;
import java.util.Set;

/**
 * A condition over the substitution produced by matching a rule's pattern. A rule only fires for substitutions its
 * guard accepts; a rejected substitution makes the rule engine move on to the next one.
 *
 * @see Guards
 */
@API(API.Status.STABLE)
public interface Guard {
    boolean test(@Nonnull Substitution substitution);

    /**
     * Get the names of the logic variables this guard reads. A rule can only be defined if its pattern binds all of
     * them.
     * @return the referenced variable names
     */
    @Nonnull
    Set<String> getReferencedVariables();
}
