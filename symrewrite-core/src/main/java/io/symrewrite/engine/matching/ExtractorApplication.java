/*
 * ExtractorApplication.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * The application of a named {@link Extractor} inside a pattern, e.g. {@code (zero? ?x)}. The arguments are patterns
 * themselves; what they are unified with is up to the extractor. An application is <em>resolved</em> once the
 * extractor registered under its name has been attached to it, which rule definition does for every application in a
 * pattern.
 */
@API(API.Status.STABLE)
public class ExtractorApplication implements Expression {
    @Nonnull
    private final String name;
    @Nonnull
    private final List<Expression> arguments;
    @Nullable
    private final Extractor extractor;

    public ExtractorApplication(@Nonnull final String name, @Nonnull final List<? extends Expression> arguments) {
        this(name, arguments, null);
    }

    public ExtractorApplication(@Nonnull final String name,
                                @Nonnull final List<? extends Expression> arguments,
                                @Nullable final Extractor extractor) {
        Preconditions.checkArgument(!name.isEmpty(), "extractor name cannot be empty");
        this.name = name;
        this.arguments = ImmutableList.copyOf(arguments);
        this.extractor = extractor;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nullable
    public Extractor getExtractor() {
        return extractor;
    }

    public boolean isResolved() {
        return extractor != null;
    }

    @Nonnull
    public ExtractorApplication resolve(@Nonnull final Extractor resolvedExtractor) {
        return new ExtractorApplication(name, arguments, resolvedExtractor);
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return arguments;
    }

    @Nonnull
    @Override
    public ExtractorApplication withChildren(@Nonnull final List<? extends Expression> newChildren) {
        if (newChildren.equals(arguments)) {
            return this;
        }
        return new ExtractorApplication(name, newChildren, extractor);
    }

    @Override
    public boolean isAtomic() {
        return false;
    }

    @Override
    public boolean isPatternElement() {
        return true;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ExtractorApplication that = (ExtractorApplication)o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append('(').append(name);
        for (final Expression argument : arguments) {
            sb.append(' ').append(argument);
        }
        return sb.append(')').toString();
    }
}
