/*
 * TemplateTransform.java
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
import io.symrewrite.engine.RuleConstructionException;
import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.expressions.Expressions;
import io.symrewrite.engine.logging.LogMessageKeys;
import io.symrewrite.engine.matching.ExtractorApplication;
import io.symrewrite.engine.matching.LogicVariable;
import io.symrewrite.engine.matching.Patterns;
import io.symrewrite.engine.matching.SequenceVariable;
import io.symrewrite.engine.matching.Substitution;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Set;

/**
 * A transform that instantiates a template expression: logic variables are replaced by their bindings and sequence
 * variables are spliced into the enclosing compound as the runs they are bound to, keeping the surrounding children
 * in place. Subtrees of the template that contain no variable are shared, not copied.
 */
@API(API.Status.STABLE)
public class TemplateTransform implements Transform {
    @Nonnull
    private final Expression template;
    @Nonnull
    private final Set<String> referencedVariables;

    public TemplateTransform(@Nonnull final Expression template) {
        if (template instanceof SequenceVariable) {
            throw new RuleConstructionException("template cannot be a sequence variable",
                    LogMessageKeys.TEMPLATE, template);
        }
        if (Expressions.anyMatch(template, node -> node instanceof ExtractorApplication)) {
            throw new RuleConstructionException("template cannot contain extractor applications",
                    LogMessageKeys.TEMPLATE, template);
        }
        this.template = template;
        this.referencedVariables = ImmutableSet.copyOf(Patterns.variableNames(template));
    }

    @Nonnull
    public Expression getTemplate() {
        return template;
    }

    @Nonnull
    @Override
    public Iterable<Expression> apply(@Nonnull final Substitution substitution) {
        for (final String variable : referencedVariables) {
            if (!substitution.isBound(variable)) {
                return ImmutableList.of();
            }
        }
        return ImmutableList.of(instantiate(template, substitution));
    }

    @Nonnull
    @Override
    public Set<String> getReferencedVariables() {
        return referencedVariables;
    }

    @Nonnull
    static Expression instantiate(@Nonnull final Expression template, @Nonnull final Substitution substitution) {
        if (template instanceof LogicVariable) {
            return substitution.getBoundExpression(((LogicVariable)template).getName());
        }
        final List<Expression> children = template.getChildren();
        if (children.isEmpty() || template.isGround()) {
            return template;
        }
        final ImmutableList.Builder<Expression> newChildren = ImmutableList.builderWithExpectedSize(children.size());
        for (final Expression child : children) {
            if (child instanceof SequenceVariable) {
                newChildren.addAll(substitution.getBoundSequence(((SequenceVariable)child).getName()).getElements());
            } else {
                newChildren.add(instantiate(child, substitution));
            }
        }
        return template.withChildren(newChildren.build());
    }

    @Override
    public String toString() {
        return template.toString();
    }
}
