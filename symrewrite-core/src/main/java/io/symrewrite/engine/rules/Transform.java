/*
 * Transform.java
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
import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.matching.Substitution;

import javax.annotation.Nonnull;
import java.util.Set;

/**
 * Produces the replacement of a matched expression from the substitution of the match. A transform may produce no
 * result, in which case the rule engine treats the substitution like one rejected by the guard, or several results,
 * of which only the first one is used.
 *
 * @see Transforms
 */
@API(API.Status.STABLE)
public interface Transform {
    @Nonnull
    Iterable<Expression> apply(@Nonnull Substitution substitution);

    @Nonnull
    Set<String> getReferencedVariables();
}
