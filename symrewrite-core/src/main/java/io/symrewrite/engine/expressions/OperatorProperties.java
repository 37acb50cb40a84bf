/*
 * OperatorProperties.java
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

package io.symrewrite.engine.expressions;

import io.symrewrite.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * The semantic properties the construction phase attaches to an operator symbol. The engine reads
 * {@link #isCommutative()} and {@link #getMatcherClass()}; the identity element and the execution handle are carried
 * along for downstream consumers such as the optimizer and the compiler and are never inspected here.
 */
@API(API.Status.STABLE)
public class OperatorProperties {
    @Nonnull
    private static final OperatorProperties FIXED = builder().build();

    private final boolean commutative;
    private final boolean associative;
    @Nullable
    private final Expression identity;
    @Nullable
    private final Object execHandle;
    @Nonnull
    private final MatcherClass matcherClass;

    private OperatorProperties(@Nonnull Builder builder) {
        this.commutative = builder.commutative;
        this.associative = builder.associative;
        this.identity = builder.identity;
        this.execHandle = builder.execHandle;
        this.matcherClass = builder.matcherClass != null
                            ? builder.matcherClass
                            : (builder.commutative ? MatcherClass.COMMUTATIVE : MatcherClass.FIXED);
    }

    /**
     * Properties of an operator nothing is known about: not commutative, not associative, matched positionally.
     * @return the default properties
     */
    @Nonnull
    public static OperatorProperties fixed() {
        return FIXED;
    }

    public boolean isCommutative() {
        return commutative;
    }

    public boolean isAssociative() {
        return associative;
    }

    @Nonnull
    public Optional<Expression> getIdentity() {
        return Optional.ofNullable(identity);
    }

    /**
     * Get the opaque handle the construction phase bound to this operator for numeric execution.
     * @return the execution handle or {@code null} if none was bound
     */
    @Nullable
    public Object getExecHandle() {
        return execHandle;
    }

    @Nonnull
    public MatcherClass getMatcherClass() {
        return matcherClass;
    }

    @Nonnull
    public Builder asBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final OperatorProperties that = (OperatorProperties)o;
        return commutative == that.commutative &&
               associative == that.associative &&
               Objects.equals(identity, that.identity) &&
               Objects.equals(execHandle, that.execHandle) &&
               matcherClass == that.matcherClass;
    }

    @Override
    public int hashCode() {
        return Objects.hash(commutative, associative, identity, execHandle, matcherClass);
    }

    @Override
    public String toString() {
        return "OperatorProperties{" +
               "commutative=" + commutative +
               ", associative=" + associative +
               ", identity=" + identity +
               ", matcherClass=" + matcherClass +
               '}';
    }

    /**
     * A builder for {@link OperatorProperties}. Unless set explicitly, the matcher class follows from
     * commutativity.
     */
    public static class Builder {
        private boolean commutative;
        private boolean associative;
        @Nullable
        private Expression identity;
        @Nullable
        private Object execHandle;
        @Nullable
        private MatcherClass matcherClass;

        public Builder() {
        }

        public Builder(@Nonnull OperatorProperties properties) {
            this.commutative = properties.commutative;
            this.associative = properties.associative;
            this.identity = properties.identity;
            this.execHandle = properties.execHandle;
            this.matcherClass = properties.matcherClass;
        }

        public Builder setCommutative(final boolean commutative) {
            this.commutative = commutative;
            return this;
        }

        public Builder setAssociative(final boolean associative) {
            this.associative = associative;
            return this;
        }

        public Builder setIdentity(@Nullable final Expression identity) {
            this.identity = identity;
            return this;
        }

        public Builder setExecHandle(@Nullable final Object execHandle) {
            this.execHandle = execHandle;
            return this;
        }

        public Builder setMatcherClass(@Nullable final MatcherClass matcherClass) {
            this.matcherClass = matcherClass;
            return this;
        }

        @Nonnull
        public OperatorProperties build() {
            return new OperatorProperties(this);
        }
    }
}
