/*
 * SegmentationMatchStrategy.java
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
import io.symrewrite.engine.expressions.Compound;
import io.symrewrite.engine.expressions.Expression;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Ordered segmentation matching for non-commutative operators whose pattern contains sequence variables.
 *
 * <p>
 * Pattern children are processed left to right. A fixed pattern child consumes exactly one expression child. A
 * sequence variable consumes a contiguous run whose length is at least its minimum and at most what is left over
 * after reserving one child for every later fixed pattern child and the minimum for every later sequence variable.
 * Shorter runs are tried first, so for {@code (f ?&*1 ?x ?&*2)} the first match binds {@code ?x} to the leftmost
 * child. A match is complete only once both child lists are exhausted.
 * </p>
 */
@API(API.Status.INTERNAL)
public class SegmentationMatchStrategy implements MatchStrategy {
    public static final SegmentationMatchStrategy INSTANCE = new SegmentationMatchStrategy();

    private SegmentationMatchStrategy() {
    }

    @Nonnull
    @Override
    public Iterable<Substitution> match(@Nonnull final Compound pattern,
                                        @Nonnull final Compound expression,
                                        @Nonnull final Substitution substitution,
                                        @Nonnull final SemanticMatcher matcher) {
        final List<Expression> patterns = pattern.getChildren();
        // reserved[i] is the least number of expression children pattern children i..n-1 need
        final int[] reserved = new int[patterns.size() + 1];
        for (int i = patterns.size() - 1; i >= 0; i--) {
            final Expression child = patterns.get(i);
            reserved[i] = reserved[i + 1] + (child instanceof SequenceVariable ? ((SequenceVariable)child).getMinLength() : 1);
        }
        if (reserved[0] > expression.arity()) {
            return ImmutableList.of();
        }
        return segment(patterns, expression.getChildren(), reserved, 0, 0, substitution, matcher);
    }

    @Nonnull
    private static Iterable<Substitution> segment(@Nonnull final List<Expression> patterns,
                                                  @Nonnull final List<Expression> children,
                                                  @Nonnull final int[] reserved,
                                                  final int patternIndex,
                                                  final int childIndex,
                                                  @Nonnull final Substitution substitution,
                                                  @Nonnull final SemanticMatcher matcher) {
        if (patternIndex == patterns.size()) {
            return childIndex == children.size() ? ImmutableList.of(substitution) : ImmutableList.of();
        }

        final Expression pattern = patterns.get(patternIndex);
        if (!(pattern instanceof SequenceVariable)) {
            if (childIndex >= children.size()) {
                return ImmutableList.of();
            }
            return FluentIterable.from(matcher.unify(pattern, children.get(childIndex), substitution))
                    .transformAndConcat(extended -> segment(patterns, children, reserved, patternIndex + 1, childIndex + 1, extended, matcher));
        }

        final SequenceVariable sequenceVariable = (SequenceVariable)pattern;
        final int remaining = children.size() - childIndex;
        final int maxLength = remaining - reserved[patternIndex + 1];
        final int minLength = patternIndex == patterns.size() - 1 ? remaining : sequenceVariable.getMinLength();
        if (maxLength < minLength || maxLength < sequenceVariable.getMinLength()) {
            return ImmutableList.of();
        }
        return FluentIterable.from(ContiguousSet.create(Range.closed(minLength, maxLength), DiscreteDomain.integers()))
                .transformAndConcat(length -> {
                    final Optional<Substitution> bound =
                            substitution.bindSequence(sequenceVariable.getName(), children.subList(childIndex, childIndex + length), true);
                    if (!bound.isPresent()) {
                        return ImmutableList.of();
                    }
                    return segment(patterns, children, reserved, patternIndex + 1, childIndex + length, bound.get(), matcher);
                });
    }
}
