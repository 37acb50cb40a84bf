/*
 * Literal.java
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
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An atomic constant, such as a number or a matrix. The value is opaque to the engine apart from equality; extractors
 * and guards may inspect it.
 */
@API(API.Status.STABLE)
public class Literal implements Expression {
    @Nonnull
    private final Object value;

    public Literal(@Nonnull final Object value) {
        this.value = Objects.requireNonNull(value, "literal value cannot be null");
    }

    @Nonnull
    public Object getValue() {
        return value;
    }

    /**
     * Whether the value of this literal is a {@link Number}.
     * @return {@code true} if this is a numeric literal
     */
    public boolean isNumeric() {
        return value instanceof Number;
    }

    @Nullable
    public Number getNumericValue() {
        return isNumeric() ? (Number)value : null;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return ImmutableList.of();
    }

    @Nonnull
    @Override
    public Expression withChildren(@Nonnull final List<? extends Expression> newChildren) {
        Preconditions.checkArgument(newChildren.isEmpty(), "literal cannot have children");
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
        return Objects.deepEquals(value, ((Literal)o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(new Object[] {value});
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
