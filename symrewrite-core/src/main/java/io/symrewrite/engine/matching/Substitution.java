/*
 * Substitution.java
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
import io.symrewrite.engine.RewriteCoreArgumentException;
import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.logging.LogMessageKeys;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable binding environment mapping logic variable names to expressions and sequence variable names to
 * {@link SequenceBinding}s.
 *
 * <p>
 * Binding never overwrites: binding a name that is already bound succeeds (and returns this substitution) only if the
 * new value is structurally equal to the existing one, and fails otherwise. All binding operations return a new
 * substitution and leave the receiver untouched, so one substitution can be extended along any number of alternative
 * branches of a search.
 * </p>
 */
@API(API.Status.STABLE)
public class Substitution {
    @Nonnull
    private static final Substitution EMPTY = new Substitution(ImmutableMap.of(), ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<String, Expression> variables;
    @Nonnull
    private final ImmutableMap<String, SequenceBinding> sequences;

    private Substitution(@Nonnull final ImmutableMap<String, Expression> variables,
                         @Nonnull final ImmutableMap<String, SequenceBinding> sequences) {
        this.variables = variables;
        this.sequences = sequences;
    }

    @Nonnull
    public static Substitution empty() {
        return EMPTY;
    }

    /**
     * Bind a plain logic variable.
     * @param name the variable name
     * @param value the expression to bind
     * @return the extended substitution, or {@code Optional.empty()} if {@code name} is already bound to something
     *         that is not equal to {@code value}
     */
    @Nonnull
    public Optional<Substitution> bindVariable(@Nonnull final String name, @Nonnull final Expression value) {
        if (sequences.containsKey(name)) {
            return Optional.empty();
        }
        final Expression existing = variables.get(name);
        if (existing != null) {
            return existing.equals(value) ? Optional.of(this) : Optional.empty();
        }
        return Optional.of(new Substitution(extend(variables, name, value), sequences));
    }

    @Nonnull
    public Optional<Substitution> bindSequence(@Nonnull final String name,
                                               @Nonnull final List<? extends Expression> run,
                                               final boolean ordered) {
        return bindSequence(name, new SequenceBinding(run, ordered));
    }

    @Nonnull
    public Optional<Substitution> bindSequence(@Nonnull final String name, @Nonnull final SequenceBinding binding) {
        if (variables.containsKey(name)) {
            return Optional.empty();
        }
        final SequenceBinding existing = sequences.get(name);
        if (existing != null) {
            return existing.isEquivalent(binding) ? Optional.of(this) : Optional.empty();
        }
        return Optional.of(new Substitution(variables, extend(sequences, name, binding)));
    }

    @Nonnull
    private static <V> ImmutableMap<String, V> extend(@Nonnull final ImmutableMap<String, V> map,
                                                      @Nonnull final String name,
                                                      @Nonnull final V value) {
        return ImmutableMap.<String, V>builderWithExpectedSize(map.size() + 1)
                .putAll(map)
                .put(name, value)
                .build();
    }

    public boolean isBound(@Nonnull final String name) {
        return variables.containsKey(name) || sequences.containsKey(name);
    }

    @Nullable
    public Expression getExpression(@Nonnull final String name) {
        return variables.get(name);
    }

    @Nonnull
    public Expression getBoundExpression(@Nonnull final String name) {
        final Expression expression = variables.get(name);
        if (expression == null) {
            throw new RewriteCoreArgumentException("logic variable is not bound",
                    LogMessageKeys.VARIABLE, name);
        }
        return expression;
    }

    @Nullable
    public SequenceBinding getSequence(@Nonnull final String name) {
        return sequences.get(name);
    }

    @Nonnull
    public SequenceBinding getBoundSequence(@Nonnull final String name) {
        final SequenceBinding binding = sequences.get(name);
        if (binding == null) {
            throw new RewriteCoreArgumentException("sequence variable is not bound",
                    LogMessageKeys.VARIABLE, name);
        }
        return binding;
    }

    @Nonnull
    public Map<String, Expression> getVariables() {
        return variables;
    }

    @Nonnull
    public Map<String, SequenceBinding> getSequences() {
        return sequences;
    }

    @Nonnull
    public Set<String> getBoundNames() {
        return ImmutableSet.<String>builder().addAll(variables.keySet()).addAll(sequences.keySet()).build();
    }

    public boolean isEmpty() {
        return variables.isEmpty() && sequences.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Substitution that = (Substitution)o;
        return variables.equals(that.variables) && sequences.equals(that.sequences);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variables, sequences);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (final Map.Entry<String, Expression> entry : variables.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append(" -> ").append(entry.getValue());
            first = false;
        }
        for (final Map.Entry<String, SequenceBinding> entry : sequences.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append(" -> ").append(entry.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }
}
