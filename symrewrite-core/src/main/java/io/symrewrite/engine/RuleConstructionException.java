/*
 * RuleConstructionException.java
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

package io.symrewrite.engine;

import io.symrewrite.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Exception thrown when a rule or a pattern is malformed: a commutative pattern with more than one sequence variable,
 * a reference to an extractor that is not registered, or a guard or transformation referring to a logic variable the
 * pattern does not bind. Rules are validated when they are defined, so a rule that was successfully defined never
 * causes this exception while it is applied.
 */
@SuppressWarnings("serial")
@API(API.Status.STABLE)
public class RuleConstructionException extends RewriteCoreException {
    public RuleConstructionException(@Nonnull String msg, @Nullable Object ... keyValues) {
        super(msg, keyValues);
    }
}
