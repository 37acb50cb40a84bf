/*
 * SemanticMatcher.java
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
import io.symrewrite.engine.RuleConstructionException;
import io.symrewrite.engine.expressions.Compound;
import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.expressions.MatcherClass;
import io.symrewrite.engine.logging.LogMessageKeys;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Matches patterns against expressions "up to meaning".
 *
 * <p>
 * Unifying a pattern with an expression produces every substitution under which the pattern denotes the expression,
 * as a lazy {@link Iterable}. Nothing is computed before iteration starts, alternatives are explored depth-first as
 * the consumer pulls, and the same iterable can be iterated again from the start. An empty iterable means that the
 * pattern does not match, which is not an error.
 * </p>
 *
 * <p>
 * Dispatch on the pattern:
 * </p>
 * <ul>
 *     <li>a {@link LogicVariable} binds to the expression,</li>
 *     <li>a {@link SequenceVariable} outside of a compound binds to the singleton run of the expression,</li>
 *     <li>an {@link ExtractorApplication}, or a compound whose operator is {@link MatcherClass#EXTRACTOR_BACKED},
 *     delegates to the extractor,</li>
 *     <li>any other compound requires a compound expression with the same operator and matches children using the
 *     {@link MatchStrategy} for its operator ({@link CommutativeMatchStrategy}, {@link SegmentationMatchStrategy} if
 *     the pattern has sequence variables, {@link FixedMatchStrategy} otherwise),</li>
 *     <li>everything else must be equal to the expression.</li>
 * </ul>
 *
 * <p>
 * This class is immutable and thread-safe.
 * </p>
 */
@API(API.Status.STABLE)
public class SemanticMatcher {
    @Nonnull
    private final ExtractorRegistry extractorRegistry;

    public SemanticMatcher() {
        this(Extractors.builtIns());
    }

    public SemanticMatcher(@Nonnull final ExtractorRegistry extractorRegistry) {
        this.extractorRegistry = extractorRegistry;
    }

    @Nonnull
    public ExtractorRegistry getExtractorRegistry() {
        return extractorRegistry;
    }

    /**
     * Match a pattern against an expression starting from the empty substitution.
     * @param pattern the pattern
     * @param expression the expression
     * @return lazy sequence of all substitutions under which {@code pattern} matches {@code expression}
     */
    @Nonnull
    public Iterable<Substitution> match(@Nonnull final Expression pattern, @Nonnull final Expression expression) {
        return unify(pattern, expression, Substitution.empty());
    }

    @Nonnull
    public Iterable<Substitution> unify(@Nonnull final Expression pattern,
                                        @Nonnull final Expression expression,
                                        @Nonnull final Substitution substitution) {
        if (pattern instanceof LogicVariable) {
            return of(substitution.bindVariable(((LogicVariable)pattern).getName(), expression));
        }
        if (pattern instanceof SequenceVariable) {
            return of(substitution.bindSequence(((SequenceVariable)pattern).getName(), ImmutableList.of(expression), true));
        }
        if (pattern instanceof ExtractorApplication) {
            final ExtractorApplication application = (ExtractorApplication)pattern;
            return resolveExtractor(application).extract(application, expression, substitution, this);
        }
        if (pattern instanceof Compound) {
            final Compound compoundPattern = (Compound)pattern;
            if (compoundPattern.getMatcherClass() == MatcherClass.EXTRACTOR_BACKED) {
                final ExtractorApplication application =
                        new ExtractorApplication(compoundPattern.getOperator(), compoundPattern.getChildren());
                return resolveExtractor(application).extract(application, expression, substitution, this);
            }
            if (!(expression instanceof Compound)) {
                return ImmutableList.of();
            }
            final Compound compoundExpression = (Compound)expression;
            if (!compoundPattern.getOperator().equals(compoundExpression.getOperator())) {
                return ImmutableList.of();
            }
            return strategyFor(compoundPattern).match(compoundPattern, compoundExpression, substitution, this);
        }
        return pattern.equals(expression) ? ImmutableList.of(substitution) : ImmutableList.of();
    }

    /**
     * Unify patterns with expressions position by position, threading the substitution from left to right.
     * @param patterns the patterns
     * @param expressions the expressions, one per pattern
     * @param substitution the substitution to extend
     * @return lazy sequence of substitutions under which every pattern matches its expression
     */
    @Nonnull
    public Iterable<Substitution> unifyAll(@Nonnull final List<? extends Expression> patterns,
                                           @Nonnull final List<? extends Expression> expressions,
                                           @Nonnull final Substitution substitution) {
        if (patterns.size() != expressions.size()) {
            return ImmutableList.of();
        }
        return unifyAll(patterns, expressions, 0, substitution);
    }

    @Nonnull
    private Iterable<Substitution> unifyAll(@Nonnull final List<? extends Expression> patterns,
                                            @Nonnull final List<? extends Expression> expressions,
                                            final int index,
                                            @Nonnull final Substitution substitution) {
        if (index == patterns.size()) {
            return ImmutableList.of(substitution);
        }
        return FluentIterable.from(unify(patterns.get(index), expressions.get(index), substitution))
                .transformAndConcat(extended -> unifyAll(patterns, expressions, index + 1, extended));
    }

    /**
     * Unify every pattern with the same expression, threading the substitution from left to right.
     * @param patterns the patterns
     * @param expression the expression
     * @param substitution the substitution to extend
     * @return lazy sequence of substitutions under which every pattern matches {@code expression}
     */
    @Nonnull
    public Iterable<Substitution> unifyEach(@Nonnull final List<? extends Expression> patterns,
                                            @Nonnull final Expression expression,
                                            @Nonnull final Substitution substitution) {
        Iterable<Substitution> result = ImmutableList.of(substitution);
        for (final Expression pattern : patterns) {
            result = FluentIterable.from(result).transformAndConcat(extended -> unify(pattern, expression, extended));
        }
        return result;
    }

    @Nonnull
    private Extractor resolveExtractor(@Nonnull final ExtractorApplication application) {
        final Extractor resolved = application.getExtractor();
        if (resolved != null) {
            return resolved;
        }
        return extractorRegistry.lookup(application.getName())
                .orElseThrow(() -> new RuleConstructionException("unknown extractor",
                        LogMessageKeys.EXTRACTOR, application.getName(),
                        LogMessageKeys.PATTERN, application));
    }

    @Nonnull
    static MatchStrategy strategyFor(@Nonnull final Compound pattern) {
        if (pattern.getMatcherClass() == MatcherClass.COMMUTATIVE) {
            return CommutativeMatchStrategy.INSTANCE;
        }
        if (Patterns.countSequenceVariables(pattern) > 0) {
            return SegmentationMatchStrategy.INSTANCE;
        }
        return FixedMatchStrategy.INSTANCE;
    }

    @Nonnull
    private static Iterable<Substitution> of(@Nonnull final Optional<Substitution> substitution) {
        return substitution.<Iterable<Substitution>>map(bound -> ImmutableList.of(bound)).orElse(ImmutableList.of());
    }
}
