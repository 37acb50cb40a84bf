/*
 * RuleCompiler.java
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
import io.symrewrite.engine.expressions.Compound;
import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.expressions.MatcherClass;
import io.symrewrite.engine.logging.LogMessageKeys;
import io.symrewrite.engine.matching.Extractor;
import io.symrewrite.engine.matching.ExtractorApplication;
import io.symrewrite.engine.matching.ExtractorRegistry;
import io.symrewrite.engine.matching.Extractors;
import io.symrewrite.engine.matching.LogicVariable;
import io.symrewrite.engine.matching.Patterns;
import io.symrewrite.engine.matching.SequenceVariable;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Defines {@link Rule}s. Definition compiles the pattern and validates the rule as a whole:
 * <ul>
 *     <li>every extractor application is resolved against the {@link ExtractorRegistry}; unknown names are rejected,</li>
 *     <li>compounds of extractor-backed operators become extractor applications,</li>
 *     <li>a commutative compound may contain at most one sequence variable,</li>
 *     <li>a name must be used consistently as either a plain or a sequence variable of one minimum length,</li>
 *     <li>every variable the guard or the transform reads must be bound by the pattern, and a template must use each
 *     variable with the kind the pattern gives it.</li>
 * </ul>
 * Violations are reported by throwing {@link RuleConstructionException}.
 */
@API(API.Status.STABLE)
public class RuleCompiler {
    @Nonnull
    private final ExtractorRegistry extractorRegistry;

    public RuleCompiler() {
        this(Extractors.builtIns());
    }

    public RuleCompiler(@Nonnull final ExtractorRegistry extractorRegistry) {
        this.extractorRegistry = extractorRegistry;
    }

    @Nonnull
    public ExtractorRegistry getExtractorRegistry() {
        return extractorRegistry;
    }

    @Nonnull
    public Rule defineRule(@Nonnull final String name, @Nonnull final Expression pattern, @Nonnull final Expression template) {
        return defineRule(name, pattern, Transforms.template(template), Guards.always());
    }

    @Nonnull
    public Rule defineRule(@Nonnull final String name, @Nonnull final Expression pattern,
                           @Nonnull final Expression template, @Nonnull final Guard guard) {
        return defineRule(name, pattern, Transforms.template(template), guard);
    }

    @Nonnull
    public Rule defineRule(@Nonnull final String name, @Nonnull final Expression pattern, @Nonnull final Transform transform) {
        return defineRule(name, pattern, transform, Guards.always());
    }

    @Nonnull
    public Rule defineRule(@Nonnull final String name,
                           @Nonnull final Expression pattern,
                           @Nonnull final Transform transform,
                           @Nonnull final Guard guard) {
        final Expression compiledPattern = compilePattern(name, pattern);

        final Map<String, Expression> variableKinds = new HashMap<>();
        collectVariableKinds(name, compiledPattern, compiledPattern, variableKinds);

        checkReferencedVariables(name, compiledPattern, guard.getReferencedVariables(), variableKinds, "guard");
        checkReferencedVariables(name, compiledPattern, transform.getReferencedVariables(), variableKinds, "transform");
        if (transform instanceof TemplateTransform) {
            checkTemplateKinds(name, ((TemplateTransform)transform).getTemplate(), variableKinds);
        }
        return new Rule(name, compiledPattern, guard, transform);
    }

    @Nonnull
    private Expression compilePattern(@Nonnull final String ruleName, @Nonnull final Expression pattern) {
        if (pattern.isAtomic()) {
            return pattern;
        }
        final ImmutableList.Builder<Expression> compiledChildren = ImmutableList.builder();
        for (final Expression child : pattern.getChildren()) {
            compiledChildren.add(compilePattern(ruleName, child));
        }
        final List<Expression> children = compiledChildren.build();

        if (pattern instanceof ExtractorApplication) {
            final ExtractorApplication application = ((ExtractorApplication)pattern).withChildren(children);
            return application.isResolved() ? application : application.resolve(lookupExtractor(ruleName, application.getName()));
        }
        if (pattern instanceof Compound) {
            final Compound compound = (Compound)pattern;
            if (compound.getMatcherClass() == MatcherClass.EXTRACTOR_BACKED) {
                return new ExtractorApplication(compound.getOperator(), children,
                        lookupExtractor(ruleName, compound.getOperator()));
            }
            if (compound.getMatcherClass() == MatcherClass.COMMUTATIVE && Patterns.countSequenceVariables(compound) > 1) {
                throw new RuleConstructionException("commutative pattern contains more than one sequence variable",
                        LogMessageKeys.RULE_NAME, ruleName,
                        LogMessageKeys.PATTERN, compound);
            }
        }
        return pattern.withChildren(children);
    }

    @Nonnull
    private Extractor lookupExtractor(@Nonnull final String ruleName, @Nonnull final String extractorName) {
        return extractorRegistry.lookup(extractorName)
                .orElseThrow(() -> new RuleConstructionException("unknown extractor",
                        LogMessageKeys.RULE_NAME, ruleName,
                        LogMessageKeys.EXTRACTOR, extractorName));
    }

    private static void collectVariableKinds(@Nonnull final String ruleName,
                                             @Nonnull final Expression pattern,
                                             @Nonnull final Expression node,
                                             @Nonnull final Map<String, Expression> variableKinds) {
        if (node instanceof LogicVariable || node instanceof SequenceVariable) {
            final String variableName = Patterns.nameOf(node);
            final Expression previous = variableKinds.putIfAbsent(variableName, node);
            if (previous != null && !previous.equals(node)) {
                throw new RuleConstructionException("variable is used inconsistently in pattern",
                        LogMessageKeys.RULE_NAME, ruleName,
                        LogMessageKeys.VARIABLE, variableName,
                        LogMessageKeys.PATTERN, pattern);
            }
            return;
        }
        for (final Expression child : node.getChildren()) {
            collectVariableKinds(ruleName, pattern, child, variableKinds);
        }
    }

    private static void checkReferencedVariables(@Nonnull final String ruleName,
                                                 @Nonnull final Expression pattern,
                                                 @Nonnull final Set<String> referencedVariables,
                                                 @Nonnull final Map<String, Expression> variableKinds,
                                                 @Nonnull final String referrer) {
        for (final String variableName : referencedVariables) {
            if (!variableKinds.containsKey(variableName)) {
                throw new RuleConstructionException(referrer + " references variable not bound by pattern",
                        LogMessageKeys.RULE_NAME, ruleName,
                        LogMessageKeys.VARIABLE, variableName,
                        LogMessageKeys.PATTERN, pattern);
            }
        }
    }

    private static void checkTemplateKinds(@Nonnull final String ruleName,
                                           @Nonnull final Expression template,
                                           @Nonnull final Map<String, Expression> variableKinds) {
        if (template instanceof LogicVariable || template instanceof SequenceVariable) {
            final Expression bound = variableKinds.get(Patterns.nameOf(template));
            if (bound != null && bound.getClass() != template.getClass()) {
                throw new RuleConstructionException("template uses variable with a different kind than pattern",
                        LogMessageKeys.RULE_NAME, ruleName,
                        LogMessageKeys.VARIABLE, Patterns.nameOf(template),
                        LogMessageKeys.TEMPLATE, template);
            }
            return;
        }
        for (final Expression child : template.getChildren()) {
            checkTemplateKinds(ruleName, child, variableKinds);
        }
    }
}
