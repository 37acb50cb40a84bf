/*
 * Compound.java
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
 * An operator applied to an ordered list of children, e.g. {@code (+ 1 x)}. The compound carries the
 * {@link OperatorProperties} the construction phase resolved for its operator symbol.
 */
@API(API.Status.STABLE)
public class Compound implements Expression {
    @Nonnull
    private final String operator;
    @Nonnull
    private final List<Expression> children;
    @Nonnull
    private final OperatorProperties properties;

    // racy single-check idiom, see String.hashCode()
    private int hashCode;

    public Compound(@Nonnull final String operator,
                    @Nonnull final List<? extends Expression> children,
                    @Nonnull final OperatorProperties properties) {
        Preconditions.checkArgument(!operator.isEmpty(), "operator symbol cannot be empty");
        this.operator = operator;
        this.children = ImmutableList.copyOf(children);
        this.properties = properties;
    }

    @Nonnull
    public String getOperator() {
        return operator;
    }

    @Nonnull
    public OperatorProperties getProperties() {
        return properties;
    }

    @Nonnull
    public MatcherClass getMatcherClass() {
        return properties.getMatcherClass();
    }

    public boolean isCommutative() {
        return properties.isCommutative();
    }

    public int arity() {
        return children.size();
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return children;
    }

    @Nonnull
    @Override
    public Compound withChildren(@Nonnull final List<? extends Expression> newChildren) {
        if (newChildren.size() == children.size()) {
            boolean same = true;
            for (int i = 0; i < newChildren.size(); i++) {
                if (newChildren.get(i) != children.get(i)) {
                    same = false;
                    break;
                }
            }
            if (same) {
                return this;
            }
        }
        return new Compound(operator, newChildren, properties);
    }

    @Override
    public boolean isAtomic() {
        return false;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Compound that = (Compound)o;
        if (hashCode() != that.hashCode()) {
            return false;
        }
        return operator.equals(that.operator) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        int h = hashCode;
        if (h == 0) {
            h = 31 * operator.hashCode() + children.hashCode();
            hashCode = h;
        }
        return h;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append('(').append(operator);
        for (final Expression child : children) {
            sb.append(' ').append(child);
        }
        return sb.append(')').toString();
    }
}
