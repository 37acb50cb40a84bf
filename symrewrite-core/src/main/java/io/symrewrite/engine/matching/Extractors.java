/*
 * Extractors.java
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
import io.symrewrite.engine.expressions.Literal;
import io.symrewrite.engine.expressions.Variable;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Floats;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * The built-in extractors.
 *
 * <ul>
 *     <li>{@code zero?}: a numeric literal equal to zero, or a literal holding a matrix all of whose entries are zero</li>
 *     <li>{@code one?}: a numeric literal equal to one, or a literal holding a square identity matrix</li>
 *     <li>{@code number?}: any numeric literal</li>
 *     <li>{@code literal?}: any literal</li>
 *     <li>{@code variable?}: any symbolic variable</li>
 * </ul>
 *
 * <p>
 * Matrices are literals whose value is a {@link List} of rows or an array of rows, where a row is a {@code List} of
 * numbers or a numeric array (primitive or boxed).
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class Extractors {
    public static final String ZERO = "zero?";
    public static final String ONE = "one?";
    public static final String NUMBER = "number?";
    public static final String LITERAL = "literal?";
    public static final String VARIABLE = "variable?";

    @Nonnull
    private static final ExtractorTable BUILT_INS = ExtractorTable.builder()
            .register(ZERO, Extractor.ofPredicate(Extractors::isZero))
            .register(ONE, Extractor.ofPredicate(Extractors::isOne))
            .register(NUMBER, Extractor.ofPredicate(expression -> expression instanceof Literal && ((Literal)expression).isNumeric()))
            .register(LITERAL, Extractor.ofPredicate(expression -> expression instanceof Literal))
            .register(VARIABLE, Extractor.ofPredicate(expression -> expression instanceof Variable))
            .build();

    private Extractors() {
        // prevent instantiation
    }

    @Nonnull
    public static ExtractorTable builtIns() {
        return BUILT_INS;
    }

    public static boolean isZero(@Nonnull final Expression expression) {
        if (!(expression instanceof Literal)) {
            return false;
        }
        final Object value = ((Literal)expression).getValue();
        if (value instanceof Number) {
            return compareToInteger((Number)value, 0);
        }
        final List<?> rows = asList(value);
        if (rows == null || rows.isEmpty()) {
            return false;
        }
        for (final Object row : rows) {
            final List<?> entries = asList(row);
            if (entries == null) {
                // a vector
                if (!(row instanceof Number) || !compareToInteger((Number)row, 0)) {
                    return false;
                }
                continue;
            }
            for (final Object entry : entries) {
                if (!(entry instanceof Number) || !compareToInteger((Number)entry, 0)) {
                    return false;
                }
            }
        }
        return true;
    }

    public static boolean isOne(@Nonnull final Expression expression) {
        if (!(expression instanceof Literal)) {
            return false;
        }
        final Object value = ((Literal)expression).getValue();
        if (value instanceof Number) {
            return compareToInteger((Number)value, 1);
        }
        final List<?> rows = asList(value);
        if (rows == null || rows.isEmpty()) {
            return false;
        }
        for (int i = 0; i < rows.size(); i++) {
            final List<?> entries = asList(rows.get(i));
            if (entries == null || entries.size() != rows.size()) {
                return false;
            }
            for (int j = 0; j < entries.size(); j++) {
                final Object entry = entries.get(j);
                if (!(entry instanceof Number) || !compareToInteger((Number)entry, i == j ? 1 : 0)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean compareToInteger(@Nonnull final Number number, final int expected) {
        if (number instanceof BigDecimal) {
            return ((BigDecimal)number).compareTo(BigDecimal.valueOf(expected)) == 0;
        }
        if (number instanceof BigInteger) {
            return ((BigInteger)number).equals(BigInteger.valueOf(expected));
        }
        return number.doubleValue() == expected;
    }

    @Nullable
    private static List<?> asList(@Nullable final Object value) {
        if (value instanceof List<?>) {
            return (List<?>)value;
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[])value);
        }
        if (value instanceof double[]) {
            return Doubles.asList((double[])value);
        }
        if (value instanceof float[]) {
            return Floats.asList((float[])value);
        }
        if (value instanceof int[]) {
            return Ints.asList((int[])value);
        }
        if (value instanceof long[]) {
            return Longs.asList((long[])value);
        }
        return null;
    }
}
