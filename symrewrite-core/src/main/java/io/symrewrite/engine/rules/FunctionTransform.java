/*
 * FunctionTransform.java
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
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Set;
import java.util.function.Function;

/**
 * A transform computed by an arbitrary function of the substitution. A function returning {@code null} is treated
 * as producing no result.
 */
@API(API.Status.EXPERIMENTAL)
public class FunctionTransform implements Transform {
    @Nonnull
    private final Set<String> referencedVariables;
    @Nonnull
    private final Function<? super Substitution, ? extends Iterable<? extends Expression>> function;

    public FunctionTransform(@Nonnull final Collection<String> referencedVariables,
                             @Nonnull final Function<? super Substitution, ? extends Iterable<? extends Expression>> function) {
        this.referencedVariables = ImmutableSet.copyOf(referencedVariables);
        this.function = function;
    }

    @Nonnull
    @Override
    @SuppressWarnings("unchecked")
    public Iterable<Expression> apply(@Nonnull final Substitution substitution) {
        final Iterable<? extends Expression> results = function.apply(substitution);
        if (results == null) {
            return ImmutableList.of();
        }
        // safe as the iterable is only read from
        return (Iterable<Expression>)results;
    }

    @Nonnull
    @Override
    public Set<String> getReferencedVariables() {
        return referencedVariables;
    }

    @Override
    public String toString() {
        return "FunctionTransform" + referencedVariables;
    }
}
