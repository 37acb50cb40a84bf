/*
 * LogicVariable.java
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
import io.symrewrite.engine.expressions.Expression;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A plain logic variable, written {@code ?x}. Inside a pattern it binds to exactly one expression; inside a template it
 * is replaced by that expression.
 */
@API(API.Status.STABLE)
public class LogicVariable implements Expression {
    @Nonnull
    private final String name;

    public LogicVariable(@Nonnull final String name) {
        Preconditions.checkArgument(Patterns.isLogicVariableName(name), "logic variable name must start with '?'");
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
        Preconditions.checkArgument(newChildren.isEmpty(), "logic variable cannot have children");
        return this;
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public boolean isPatternElement() {
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
        return name.equals(((LogicVariable)o).name);
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
