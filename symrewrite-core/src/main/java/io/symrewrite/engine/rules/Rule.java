/*
 * Rule.java
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
import io.symrewrite.engine.expressions.Compound;
import io.symrewrite.engine.expressions.Expression;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * An immutable rewrite rule: a pattern, a guard over the substitutions the pattern produces, and a transform
 * computing the replacement. Rules are created by {@link RuleCompiler}, which validates the pattern and resolves its
 * extractors; a {@code Rule} instance is therefore always well-formed.
 */
@API(API.Status.STABLE)
public class Rule {
    @Nonnull
    private final String name;
    @Nonnull
    private final Expression pattern;
    @Nonnull
    private final Guard guard;
    @Nonnull
    private final Transform transform;

    Rule(@Nonnull final String name,
         @Nonnull final Expression pattern,
         @Nonnull final Guard guard,
         @Nonnull final Transform transform) {
        this.name = name;
        this.pattern = pattern;
        this.guard = guard;
        this.transform = transform;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Expression getPattern() {
        return pattern;
    }

    @Nonnull
    public Guard getGuard() {
        return guard;
    }

    @Nonnull
    public Transform getTransform() {
        return transform;
    }

    /**
     * Get the operator an expression must have at its root for this rule to possibly match.
     * @return the operator symbol of the pattern's root, or {@code Optional.empty()} if the pattern can match
     *         expressions with any root
     */
    @Nonnull
    public Optional<String> getRootOperator() {
        if (pattern instanceof Compound) {
            return Optional.of(((Compound)pattern).getOperator());
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name + ": " + pattern + " -> " + transform;
    }
}
