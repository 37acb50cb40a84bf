/*
 * ExpressionFactory.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Builds expressions whose compounds carry the properties an {@link OperatorRegistry} resolves for their operators.
 * Patterns and templates are built with the same factory, so that a pattern compound for {@code +} is commutative
 * exactly when concrete {@code +} compounds are.
 */
@API(API.Status.EXPERIMENTAL)
public class ExpressionFactory {
    @Nonnull
    private final OperatorRegistry operatorRegistry;

    public ExpressionFactory(@Nonnull final OperatorRegistry operatorRegistry) {
        this.operatorRegistry = operatorRegistry;
    }

    @Nonnull
    public OperatorRegistry getOperatorRegistry() {
        return operatorRegistry;
    }

    /**
     * Build a compound. Children that are not already expressions become {@link Literal}s.
     * @param operator the operator symbol
     * @param children the children
     * @return a new compound
     */
    @Nonnull
    public Compound op(@Nonnull final String operator, @Nonnull final Object... children) {
        final ImmutableList.Builder<Expression> builder = ImmutableList.builderWithExpectedSize(children.length);
        for (final Object child : children) {
            builder.add(toExpression(child));
        }
        return op(operator, builder.build());
    }

    @Nonnull
    public Compound op(@Nonnull final String operator, @Nonnull final List<? extends Expression> children) {
        return new Compound(operator, children, operatorRegistry.resolve(operator));
    }

    @Nonnull
    public static Literal lit(@Nonnull final Object value) {
        return new Literal(value);
    }

    @Nonnull
    public static Variable sym(@Nonnull final String name) {
        return new Variable(name);
    }

    @Nonnull
    public static Expression toExpression(@Nonnull final Object object) {
        if (object instanceof Expression) {
            return (Expression)object;
        }
        return new Literal(object);
    }
}
