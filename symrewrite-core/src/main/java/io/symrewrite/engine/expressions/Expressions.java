/*
 * Expressions.java
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
import java.util.Map;
import java.util.function.Predicate;

/**
 * Structural helpers over expression trees.
 */
@API(API.Status.EXPERIMENTAL)
public final class Expressions {
    private Expressions() {
        // prevent instantiation
    }

    /**
     * Replace every occurrence of a key of {@code replacements} in {@code expression} by its value. Occurrences are
     * found top-down and replacements are not searched again, so a replacement containing its own key does not recurse.
     * @param expression the expression to rewrite
     * @param replacements map from sub-expression to its replacement
     * @return the rewritten expression, sharing all untouched subtrees with {@code expression}
     */
    @Nonnull
    public static Expression substitute(@Nonnull final Expression expression,
                                        @Nonnull final Map<? extends Expression, ? extends Expression> replacements) {
        final Expression replacement = replacements.get(expression);
        if (replacement != null) {
            return replacement;
        }
        final List<Expression> children = expression.getChildren();
        if (children.isEmpty()) {
            return expression;
        }
        final ImmutableList.Builder<Expression> newChildren = ImmutableList.builderWithExpectedSize(children.size());
        for (final Expression child : children) {
            newChildren.add(substitute(child, replacements));
        }
        return expression.withChildren(newChildren.build());
    }

    /**
     * Count the nodes of an expression tree.
     * @param expression the root
     * @return the number of nodes
     */
    public static int size(@Nonnull final Expression expression) {
        int size = 1;
        for (final Expression child : expression.getChildren()) {
            size += size(child);
        }
        return size;
    }

    /**
     * Whether any node of the tree satisfies the given predicate.
     * @param expression the root
     * @param predicate the predicate
     * @return {@code true} if some node, including the root, satisfies {@code predicate}
     */
    public static boolean anyMatch(@Nonnull final Expression expression, @Nonnull final Predicate<? super Expression> predicate) {
        if (predicate.test(expression)) {
            return true;
        }
        for (final Expression child : expression.getChildren()) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    public static boolean contains(@Nonnull final Expression expression, @Nonnull final Expression subExpression) {
        return anyMatch(expression, subExpression::equals);
    }
}
