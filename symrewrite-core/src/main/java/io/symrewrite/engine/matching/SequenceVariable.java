/*
 * SequenceVariable.java
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
 * A sequence variable binds to a run of children of a compound. A sequence variable written {@code ?&*} binds to zero
 * or more children, one written {@code ?&+} to one or more. Under a commutative operator the run is the unordered
 * remainder of the children not matched by the other pattern elements; otherwise it is a contiguous run.
 */
@API(API.Status.STABLE)
public class SequenceVariable implements Expression {
    @Nonnull
    private final String name;
    private final int minLength;

    public SequenceVariable(@Nonnull final String name, final int minLength) {
        Preconditions.checkArgument(Patterns.isLogicVariableName(name), "sequence variable name must start with '?'");
        Preconditions.checkArgument(minLength == 0 || minLength == 1, "minimum length of a sequence variable must be 0 or 1");
        this.name = name;
        this.minLength = minLength;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * The minimum number of expressions this variable binds to.
     * @return {@code 0} or {@code 1}
     */
    public int getMinLength() {
        return minLength;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return ImmutableList.of();
    }

    @Nonnull
    @Override
    public Expression withChildren(@Nonnull final List<? extends Expression> newChildren) {
        Preconditions.checkArgument(newChildren.isEmpty(), "sequence variable cannot have children");
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
        final SequenceVariable that = (SequenceVariable)o;
        return minLength == that.minLength && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + minLength;
    }

    @Override
    public String toString() {
        return name;
    }
}
