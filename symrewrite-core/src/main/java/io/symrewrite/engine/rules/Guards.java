/*
 * Guards.java
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
import io.symrewrite.engine.expressions.Literal;
import io.symrewrite.engine.matching.Substitution;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Factory methods for {@link Guard}s.
 */
@API(API.Status.EXPERIMENTAL)
public final class Guards {
    @Nonnull
    private static final Guard ALWAYS = of(ImmutableSet.of(), substitution -> true);

    private Guards() {
        // prevent instantiation
    }

    @Nonnull
    public static Guard always() {
        return ALWAYS;
    }

    /**
     * Create a guard from a predicate over the substitution.
     * @param referencedVariables the names of the variables {@code predicate} reads
     * @param predicate the predicate
     * @return a new guard
     */
    @Nonnull
    public static Guard of(@Nonnull final Collection<String> referencedVariables,
                           @Nonnull final Predicate<? super Substitution> predicate) {
        return new PredicateGuard(ImmutableSet.copyOf(referencedVariables), predicate);
    }

    @Nonnull
    public static Guard isNumber(@Nonnull final String variable) {
        return of(ImmutableSet.of(variable),
                substitution -> numericValue(substitution.getExpression(variable)) != null);
    }

    @Nonnull
    public static Guard isLiteral(@Nonnull final String variable) {
        return of(ImmutableSet.of(variable), substitution -> substitution.getExpression(variable) instanceof Literal);
    }

    /**
     * Create a guard that holds if the expressions bound to two variables are in the given relation.
     * @param left the variable whose binding is the first argument of {@code relation}
     * @param right the variable whose binding is the second argument of {@code relation}
     * @param relation the relation
     * @return a new guard
     */
    @Nonnull
    public static Guard compare(@Nonnull final String left, @Nonnull final String right,
                                @Nonnull final BiPredicate<? super Expression, ? super Expression> relation) {
        return of(ImmutableSet.of(left, right), substitution -> {
            final Expression leftExpression = substitution.getExpression(left);
            final Expression rightExpression = substitution.getExpression(right);
            return leftExpression != null && rightExpression != null && relation.test(leftExpression, rightExpression);
        });
    }

    /**
     * Create a guard that holds if both variables are bound to numeric literals and the first one is greater.
     * @param left the variable expected to be bound to the greater number
     * @param right the variable expected to be bound to the smaller number
     * @return a new guard
     */
    @Nonnull
    public static Guard greaterThan(@Nonnull final String left, @Nonnull final String right) {
        return compare(left, right, (l, r) -> compareNumbers(l, r) > 0);
    }

    @Nonnull
    public static Guard lessThan(@Nonnull final String left, @Nonnull final String right) {
        return compare(left, right, (l, r) -> compareNumbers(l, r) < 0);
    }

    @Nonnull
    public static Guard and(@Nonnull final Guard... guards) {
        final ImmutableSet.Builder<String> variables = ImmutableSet.builder();
        for (final Guard guard : guards) {
            variables.addAll(guard.getReferencedVariables());
        }
        final Guard[] conjuncts = guards.clone();
        return of(variables.build(), substitution -> {
            for (final Guard conjunct : conjuncts) {
                if (!conjunct.test(substitution)) {
                    return false;
                }
            }
            return true;
        });
    }

    @Nonnull
    public static Guard not(@Nonnull final Guard guard) {
        return of(guard.getReferencedVariables(), substitution -> !guard.test(substitution));
    }

    //
    // Numbers of different classes are compared by value. Non-numeric or incomparable operands compare as 0 so
    // that neither greaterThan() nor lessThan() holds for them.
    //
    private static int compareNumbers(@Nonnull final Expression left, @Nonnull final Expression right) {
        final Number leftNumber = numericValue(left);
        final Number rightNumber = numericValue(right);
        if (leftNumber == null || rightNumber == null) {
            return 0;
        }
        final BigDecimal leftDecimal = toBigDecimal(leftNumber);
        final BigDecimal rightDecimal = toBigDecimal(rightNumber);
        if (leftDecimal == null || rightDecimal == null) {
            final double leftDouble = leftNumber.doubleValue();
            final double rightDouble = rightNumber.doubleValue();
            if (Double.isNaN(leftDouble) || Double.isNaN(rightDouble)) {
                return 0;
            }
            return Double.compare(leftDouble, rightDouble);
        }
        return leftDecimal.compareTo(rightDecimal);
    }

    @Nullable
    private static BigDecimal toBigDecimal(@Nonnull final Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal)number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger)number);
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        final double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value);
    }

    @Nullable
    private static Number numericValue(@Nullable final Expression expression) {
        if (expression instanceof Literal) {
            return ((Literal)expression).getNumericValue();
        }
        return null;
    }

    private static class PredicateGuard implements Guard {
        @Nonnull
        private final Set<String> referencedVariables;
        @Nonnull
        private final Predicate<? super Substitution> predicate;

        private PredicateGuard(@Nonnull final Set<String> referencedVariables,
                               @Nonnull final Predicate<? super Substitution> predicate) {
            this.referencedVariables = referencedVariables;
            this.predicate = predicate;
        }

        @Override
        public boolean test(@Nonnull final Substitution substitution) {
            return predicate.test(substitution);
        }

        @Nonnull
        @Override
        public Set<String> getReferencedVariables() {
            return referencedVariables;
        }

        @Override
        public String toString() {
            return "Guard" + referencedVariables;
        }
    }
}
