/*
 * SequenceBinding.java
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
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * The value bound to a sequence variable: a run of expressions. A run bound under a commutative operator is
 * <em>unordered</em>. Two bindings are {@linkplain #equals(Object) equal} if they have the same orderedness and
 * the same elements, compared as lists for ordered runs and as multisets for unordered ones.
 * {@link #isEquivalent(SequenceBinding)} is the looser relation used when a sequence variable is bound again: it
 * compares as multisets as soon as one of the two runs is unordered.
 */
@API(API.Status.STABLE)
public class SequenceBinding {
    @Nonnull
    private final List<Expression> elements;
    private final boolean ordered;

    public SequenceBinding(@Nonnull final List<? extends Expression> elements, final boolean ordered) {
        this.elements = ImmutableList.copyOf(elements);
        this.ordered = ordered;
    }

    @Nonnull
    public static SequenceBinding ordered(@Nonnull final List<? extends Expression> elements) {
        return new SequenceBinding(elements, true);
    }

    @Nonnull
    public static SequenceBinding unordered(@Nonnull final List<? extends Expression> elements) {
        return new SequenceBinding(elements, false);
    }

    @Nonnull
    public List<Expression> getElements() {
        return elements;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Whether this binding and another one denote the same run.
     * @param other the other binding
     * @return {@code true} if the runs are equal as lists (both ordered) or as multisets (otherwise)
     */
    public boolean isEquivalent(@Nonnull final SequenceBinding other) {
        if (elements.size() != other.elements.size()) {
            return false;
        }
        if (ordered && other.ordered) {
            return elements.equals(other.elements);
        }
        return HashMultiset.create(elements).equals(HashMultiset.create(other.elements));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SequenceBinding other = (SequenceBinding)o;
        if (ordered != other.ordered) {
            return false;
        }
        return ordered ? elements.equals(other.elements) : isEquivalent(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ordered, ordered ? elements.hashCode() : HashMultiset.create(elements).hashCode());
    }

    @Override
    public String toString() {
        return (ordered ? "" : "~") + elements;
    }
}
