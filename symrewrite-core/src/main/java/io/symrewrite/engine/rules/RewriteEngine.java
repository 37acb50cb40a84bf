/*
 * RewriteEngine.java
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
import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.logging.KeyValueLogMessage;
import io.symrewrite.engine.logging.LogMessageKeys;
import io.symrewrite.engine.matching.ExtractorRegistry;
import io.symrewrite.engine.matching.SemanticMatcher;
import io.symrewrite.engine.matching.Substitution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.Optional;
import java.util.Set;

/**
 * Applies rules to expressions at the root, without descending into children.
 *
 * <p>
 * Applying a rule enumerates the substitutions under which its pattern matches, in the matcher's order, and returns
 * the first result the transform produces for a substitution the guard accepts. Failing to match, a rejecting guard
 * and a transform without result are all expected outcomes reported as {@code Optional.empty()}.
 * </p>
 */
@API(API.Status.STABLE)
public class RewriteEngine {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(RewriteEngine.class);

    @Nonnull
    private final SemanticMatcher matcher;

    public RewriteEngine() {
        this(new SemanticMatcher());
    }

    public RewriteEngine(@Nonnull final ExtractorRegistry extractorRegistry) {
        this(new SemanticMatcher(extractorRegistry));
    }

    public RewriteEngine(@Nonnull final SemanticMatcher matcher) {
        this.matcher = matcher;
    }

    @Nonnull
    public SemanticMatcher getMatcher() {
        return matcher;
    }

    @Nonnull
    public Iterable<Substitution> match(@Nonnull final Expression pattern, @Nonnull final Expression expression) {
        return matcher.match(pattern, expression);
    }

    @Nonnull
    public Optional<Expression> applyRule(@Nonnull final Rule rule, @Nonnull final Expression expression) {
        for (final Substitution substitution : matcher.match(rule.getPattern(), expression)) {
            // an extractor may leave variables of its arguments unbound
            if (!bindsAll(substitution, rule.getGuard().getReferencedVariables()) ||
                    !bindsAll(substitution, rule.getTransform().getReferencedVariables())) {
                continue;
            }
            if (!rule.getGuard().test(substitution)) {
                continue;
            }
            final Iterator<Expression> results = rule.getTransform().apply(substitution).iterator();
            if (results.hasNext()) {
                final Expression result = results.next();
                if (LOGGER.isTraceEnabled()) {
                    LOGGER.trace(KeyValueLogMessage.of("rule fired",
                            LogMessageKeys.RULE_NAME, rule.getName(),
                            LogMessageKeys.EXPRESSION, expression,
                            LogMessageKeys.RESULT, result));
                }
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    private static boolean bindsAll(@Nonnull final Substitution substitution, @Nonnull final Set<String> variables) {
        for (final String variable : variables) {
            if (!substitution.isBound(variable)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Apply the first rule of a rule set, in definition order, that succeeds on the expression.
     * @param ruleSet the rule set
     * @param expression the expression
     * @return the result of the first successful rule or {@code Optional.empty()} if no rule applies
     */
    @Nonnull
    public Optional<Expression> applyRules(@Nonnull final RuleSet ruleSet, @Nonnull final Expression expression) {
        final Iterator<Rule> candidates = ruleSet.getRulesMatching(expression);
        while (candidates.hasNext()) {
            final Optional<Expression> result = applyRule(candidates.next(), expression);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }
}
