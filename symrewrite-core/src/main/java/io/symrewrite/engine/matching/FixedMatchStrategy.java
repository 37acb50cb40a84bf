/*
 * FixedMatchStrategy.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;

/**
 * Positional matching of children for non-commutative operators whose pattern contains no sequence variable. Arities
 * must agree.
 */
@API(API.Status.INTERNAL)
public class FixedMatchStrategy implements MatchStrategy {
    public static final FixedMatchStrategy INSTANCE = new FixedMatchStrategy();

    private FixedMatchStrategy() {
    }

    @Nonnull
    @Override
    public Iterable<Substitution> match(@Nonnull final Compound pattern,
                                        @Nonnull final Compound expression,
                                        @Nonnull final Substitution substitution,
                                        @Nonnull final SemanticMatcher matcher) {
        if (pattern.arity() != expression.arity()) {
            return ImmutableList.of();
        }
        return matcher.unifyAll(pattern.getChildren(), expression.getChildren(), substitution);
    }
}
