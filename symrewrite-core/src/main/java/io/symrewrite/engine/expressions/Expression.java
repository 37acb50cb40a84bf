/*
 * Expression.java
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

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A node of an immutable expression tree.
 *
 * <p>
 * Fully constructed expressions are built from {@link Literal}s, {@link Variable}s and {@link Compound}s. Patterns
 * additionally contain pattern elements (logic variables, sequence variables and extractor applications, see
 * {@link io.symrewrite.engine.matching}) which never survive into a rewritten result.
 * </p>
 *
 * <p>
 * Expressions are compared structurally: two compounds are equal if and only if their operator symbols are equal and
 * their children are pairwise equal, in order. Commutativity is never taken into account by {@code equals()}; that is
 * the matcher's job. Every transformation produces a new tree, sharing unchanged subtrees with the original.
 * </p>
 */
@API(API.Status.STABLE)
public interface Expression {
    /**
     * Return the children of this expression, in order. Atomic expressions have no children.
     * @return the (immutable) list of children
     */
    @Nonnull
    List<Expression> getChildren();

    /**
     * Return an expression of the same kind as this one with its children replaced. Implementations return
     * {@code this} if every new child is identical to the current one, so that unchanged subtrees are shared.
     * @param newChildren the new children
     * @return an expression with the given children
     */
    @Nonnull
    Expression withChildren(@Nonnull List<? extends Expression> newChildren);

    /**
     * Whether this node is a leaf of the tree (a literal, a variable, or a pattern variable).
     * @return {@code true} if this expression is atomic
     */
    boolean isAtomic();

    /**
     * Whether this node only makes sense inside a pattern, i.e. it is a logic variable, a sequence variable or an
     * extractor application.
     * @return {@code true} if this expression is a pattern element
     */
    default boolean isPatternElement() {
        return false;
    }

    /**
     * Whether this expression, including all of its descendants, is free of pattern elements.
     * @return {@code true} if no pattern element occurs in this tree
     */
    default boolean isGround() {
        if (isPatternElement()) {
            return false;
        }
        for (final Expression child : getChildren()) {
            if (!child.isGround()) {
                return false;
            }
        }
        return true;
    }
}
