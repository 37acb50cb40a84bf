/*
 * Variable.java
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

package io.symrewrite.engine.expressions;

import io.symrewrite.annotation.API;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * An atomic symbolic placeholder such as {@code a} or {@code x}. Unlike pattern logic variables, variables are part of
 * the expression being rewritten and survive into results.
 */
@API(API.Status.STABLE)
public class Variable implements Expression {
    @Nonnull
    private final String name;

    public Variable(@Nonnull final String name) {
        Preconditions.checkArgument(!name.isEmpty(), "variable name cannot be empty");
        this.name = name;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return ImmutableList.of();
    }

    @Nonnull
    @Override
    public Expression withChildren(@Nonnull final List<? extends Expression> newChildren) {
        Preconditions.checkArgument(newChildren.isEmpty(), "variable cannot have children");
        return this;
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Variable)o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
