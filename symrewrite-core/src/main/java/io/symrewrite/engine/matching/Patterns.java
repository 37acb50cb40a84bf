/*
 * Patterns.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Factory methods for pattern elements, plus some helpers to inspect patterns.
 *
 * <p>
 * Logic variable names start with {@code ?}. {@link #lvar(String)} decides the kind of variable from the name:
 * names starting with {@code ?&+} are sequence variables binding one or more expressions, other names starting with
 * {@code ?&} (like {@code ?&*} or {@code ?&*1}) are sequence variables binding zero or more expressions, and all other
 * names are plain logic variables.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class Patterns {
    private static final String SEQUENCE_PREFIX = "?&";
    private static final String NON_EMPTY_SEQUENCE_PREFIX = "?&+";

    private Patterns() {
        // prevent instantiation
    }

    @Nonnull
    public static Expression lvar(@Nonnull final String name) {
        if (name.startsWith(NON_EMPTY_SEQUENCE_PREFIX)) {
            return new SequenceVariable(name, 1);
        }
        if (name.startsWith(SEQUENCE_PREFIX)) {
            return new SequenceVariable(name, 0);
        }
        return new LogicVariable(name);
    }

    @Nonnull
    public static LogicVariable var(@Nonnull final String name) {
        return new LogicVariable(name);
    }

    @Nonnull
    public static SequenceVariable seq(@Nonnull final String name) {
        return new SequenceVariable(name, 0);
    }

    @Nonnull
    public static SequenceVariable seq1(@Nonnull final String name) {
        return new SequenceVariable(name, 1);
    }

    /**
     * Create an unresolved extractor application; the extractor is looked up by name when the pattern is compiled
     * into a rule, or when it is matched.
     * @param name the name the extractor is registered under
     * @param arguments argument patterns
     * @return a new extractor application
     */
    @Nonnull
    public static ExtractorApplication extract(@Nonnull final String name, @Nonnull final Expression... arguments) {
        return new ExtractorApplication(name, ImmutableList.copyOf(arguments));
    }

    @Nonnull
    public static ExtractorApplication extract(@Nonnull final String name, @Nonnull final Extractor extractor,
                                               @Nonnull final Expression... arguments) {
        return new ExtractorApplication(name, ImmutableList.copyOf(arguments), extractor);
    }

    public static boolean isLogicVariableName(@Nonnull final String name) {
        return name.length() > 1 && name.charAt(0) == '?';
    }

    @Nonnull
    public static String nameOf(@Nonnull final Expression patternVariable) {
        if (patternVariable instanceof LogicVariable) {
            return ((LogicVariable)patternVariable).getName();
        }
        if (patternVariable instanceof SequenceVariable) {
            return ((SequenceVariable)patternVariable).getName();
        }
        throw new IllegalArgumentException("not a pattern variable: " + patternVariable);
    }

    /**
     * Collect the names of all plain and sequence variables occurring in a pattern, in order of first occurrence.
     * @param pattern the pattern
     * @return the variable names
     */
    @Nonnull
    public static Set<String> variableNames(@Nonnull final Expression pattern) {
        final Set<String> names = new LinkedHashSet<>();
        collectVariableNames(pattern, names);
        return names;
    }

    private static void collectVariableNames(@Nonnull final Expression pattern, @Nonnull final Set<String> names) {
        if (pattern instanceof LogicVariable || pattern instanceof SequenceVariable) {
            names.add(nameOf(pattern));
            return;
        }
        for (final Expression child : pattern.getChildren()) {
            collectVariableNames(child, names);
        }
    }

    /**
     * Count the sequence variables among the direct children of a compound pattern.
     * @param pattern the compound pattern
     * @return the number of sequence variables
     */
    public static int countSequenceVariables(@Nonnull final Compound pattern) {
        int count = 0;
        for (final Expression child : pattern.getChildren()) {
            if (child instanceof SequenceVariable) {
                count++;
            }
        }
        return count;
    }
}
