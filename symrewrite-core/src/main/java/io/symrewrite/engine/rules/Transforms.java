/*
 * Transforms.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Function;

/**
 * Factory methods for {@link Transform}s.
 */
@API(API.Status.EXPERIMENTAL)
public final class Transforms {
    private Transforms() {
        // prevent instantiation
    }

    @Nonnull
    public static Transform template(@Nonnull final Expression template) {
        return new TemplateTransform(template);
    }

    /**
     * Create a transform from a function that computes at most one result.
     * @param referencedVariables the names of the variables {@code function} reads
     * @param function function of the substitution, returning {@code Optional.empty()} if it cannot produce a result
     * @return a new transform
     */
    @Nonnull
    public static Transform of(@Nonnull final Collection<String> referencedVariables,
                               @Nonnull final Function<? super Substitution, Optional<? extends Expression>> function) {
        return new FunctionTransform(referencedVariables,
                substitution -> function.apply(substitution)
                        .<Iterable<Expression>>map(result -> ImmutableList.<Expression>of(result))
                        .orElse(ImmutableList.of()));
    }

    @Nonnull
    public static Transform ofMany(@Nonnull final Collection<String> referencedVariables,
                                   @Nonnull final Function<? super Substitution, ? extends Iterable<? extends Expression>> function) {
        return new FunctionTransform(referencedVariables, function);
    }
}
