/*
 * Extractor.java
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
import io.symrewrite.engine.expressions.Expression;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.function.Predicate;

/**
 * A named semantic predicate with its own matching relation. An extractor is used in a pattern in place of syntactic
 * structure: {@code (zero? ?x)} matches anything that is an additive zero, whatever its shape, and binds {@code ?x}
 * to it.
 *
 * <p>
 * Given the extractor application found in the pattern, the candidate expression and the substitution accumulated so
 * far, an extractor produces a lazy, possibly empty sequence of extended substitutions. Implementations must not
 * mutate anything and must return an {@link Iterable} that can be iterated more than once. An extractor need not
 * bind the variables of its arguments; a rule whose guard or transform needs such a variable does not fire on a
 * substitution that leaves it unbound.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface Extractor {
    @Nonnull
    Iterable<Substitution> extract(@Nonnull ExtractorApplication application,
                                   @Nonnull Expression candidate,
                                   @Nonnull Substitution substitution,
                                   @Nonnull SemanticMatcher matcher);

    /**
     * Create an extractor that accepts every candidate satisfying {@code predicate} and then unifies each of the
     * application's arguments with the candidate itself.
     * @param predicate predicate over the candidate expression
     * @return a new extractor
     */
    @Nonnull
    static Extractor ofPredicate(@Nonnull final Predicate<? super Expression> predicate) {
        return (application, candidate, substitution, matcher) -> {
            if (!predicate.test(candidate)) {
                return ImmutableList.of();
            }
            return matcher.unifyEach(application.getChildren(), candidate, substitution);
        };
    }
}
