/*
 * CommutativeMatchStrategy.java
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
import io.symrewrite.engine.combinatorics.ChooseK;
import io.symrewrite.engine.expressions.Compound;
import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.logging.LogMessageKeys;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;

/**
 * Multiset matching of children for commutative operators.
 *
 * <p>
 * Without a sequence variable the pattern must have as many children as the expression, and every bijection between
 * pattern children and expression children is tried. With one sequence variable, every subset of expression children
 * of the size of the fixed part of the pattern is tried (in lexicographic order of child positions); the complement of
 * the subset is bound to the sequence variable as an unordered run and the subset is matched to the fixed part
 * bijectively. A pattern with more than one sequence variable cannot be matched commutatively.
 * </p>
 *
 * <p>
 * The search is exponential in the number of children in the worst case. Rule patterns for commutative operators are
 * usually small, and alternatives are only explored as far as the consumer pulls.
 * </p>
 */
@API(API.Status.INTERNAL)
public class CommutativeMatchStrategy implements MatchStrategy {
    public static final CommutativeMatchStrategy INSTANCE = new CommutativeMatchStrategy();

    private CommutativeMatchStrategy() {
    }

    @Nonnull
    @Override
    public Iterable<Substitution> match(@Nonnull final Compound pattern,
                                        @Nonnull final Compound expression,
                                        @Nonnull final Substitution substitution,
                                        @Nonnull final SemanticMatcher matcher) {
        final ImmutableList.Builder<Expression> fixedBuilder = ImmutableList.builder();
        SequenceVariable sequenceVariable = null;
        for (final Expression child : pattern.getChildren()) {
            if (child instanceof SequenceVariable) {
                if (sequenceVariable != null) {
                    throw new RuleConstructionException("commutative pattern contains more than one sequence variable",
                            LogMessageKeys.PATTERN, pattern);
                }
                sequenceVariable = (SequenceVariable)child;
            } else {
                fixedBuilder.add(child);
            }
        }
        final List<Expression> fixedPatterns = fixedBuilder.build();
        final List<Expression> children = expression.getChildren();

        if (sequenceVariable == null) {
            if (fixedPatterns.size() != children.size()) {
                return ImmutableList.of();
            }
            return bijections(fixedPatterns, children, 0, new BitSet(children.size()), substitution, matcher);
        }

        if (children.size() < fixedPatterns.size() + sequenceVariable.getMinLength()) {
            return ImmutableList.of();
        }
        final SequenceVariable rest = sequenceVariable;
        return FluentIterable.from(ChooseK.chooseK(children, fixedPatterns.size()))
                .transformAndConcat(chosen -> matchChosen(fixedPatterns, rest, children, chosen, substitution, matcher));
    }

    @Nonnull
    private static Iterable<Substitution> matchChosen(@Nonnull final List<Expression> fixedPatterns,
                                                      @Nonnull final SequenceVariable sequenceVariable,
                                                      @Nonnull final List<Expression> children,
                                                      @Nonnull final List<Expression> chosen,
                                                      @Nonnull final Substitution substitution,
                                                      @Nonnull final SemanticMatcher matcher) {
        final List<Expression> complement = complement(children, chosen);
        final Optional<Substitution> bound = substitution.bindSequence(sequenceVariable.getName(), complement, false);
        if (!bound.isPresent()) {
            return ImmutableList.of();
        }
        return bijections(fixedPatterns, chosen, 0, new BitSet(chosen.size()), bound.get(), matcher);
    }

    /**
     * Compute the children not in {@code chosen}, in their original order. {@code chosen} is a subsequence of
     * {@code children} produced by {@link ChooseK}, so it can be skipped over by reference in a single pass.
     */
    @Nonnull
    private static List<Expression> complement(@Nonnull final List<Expression> children,
                                               @Nonnull final List<Expression> chosen) {
        final ImmutableList.Builder<Expression> builder = ImmutableList.builderWithExpectedSize(children.size() - chosen.size());
        int chosenIndex = 0;
        for (final Expression child : children) {
            if (chosenIndex < chosen.size() && chosen.get(chosenIndex) == child) {
                chosenIndex++;
            } else {
                builder.add(child);
            }
        }
        return builder.build();
    }

    @Nonnull
    private static Iterable<Substitution> bijections(@Nonnull final List<Expression> patterns,
                                                     @Nonnull final List<Expression> children,
                                                     final int patternIndex,
                                                     @Nonnull final BitSet used,
                                                     @Nonnull final Substitution substitution,
                                                     @Nonnull final SemanticMatcher matcher) {
        if (patternIndex == patterns.size()) {
            return ImmutableList.of(substitution);
        }
        final ImmutableList.Builder<Integer> unusedBuilder = ImmutableList.builder();
        for (int i = used.nextClearBit(0); i < children.size(); i = used.nextClearBit(i + 1)) {
            unusedBuilder.add(i);
        }
        final Expression pattern = patterns.get(patternIndex);
        return FluentIterable.from(unusedBuilder.build())
                .transformAndConcat(childIndex -> {
                    final BitSet nowUsed = (BitSet)used.clone();
                    nowUsed.set(childIndex);
                    return FluentIterable.from(matcher.unify(pattern, children.get(childIndex), substitution))
                            .transformAndConcat(extended -> bijections(patterns, children, patternIndex + 1, nowUsed, extended, matcher));
                });
    }
}
