/*
 * MatchStrategy.java
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

package io.symrewrite.engine.matching;

import io.symrewrite.annotation.API;
import io.symrewrite.engine.expressions.Compound;

import javax.annotation.Nonnull;

/**
 * Strategy to match the children of a compound pattern against the children of a compound expression with the same
 * operator. Implementations enumerate alternatives lazily: the returned {@link Iterable} does no work until iterated,
 * and iteration explores the search space only as far as the consumer pulls.
 */
@API(API.Status.INTERNAL)
public interface MatchStrategy {
    @Nonnull
    Iterable<Substitution> match(@Nonnull Compound pattern,
                                 @Nonnull Compound expression,
                                 @Nonnull Substitution substitution,
                                 @Nonnull SemanticMatcher matcher);
}
