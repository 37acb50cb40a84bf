/*
 * SymbolTable.java
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
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable table based {@link OperatorRegistry}. A table is built once at startup and handed to whoever constructs
 * expressions, which keeps tests free of process-wide registration state.
 */
@API(API.Status.EXPERIMENTAL)
public class SymbolTable implements OperatorRegistry {
    @Nonnull
    private static final SymbolTable EMPTY = builder().build();

    @Nonnull
    private final Map<String, OperatorProperties> operators;

    private SymbolTable(@Nonnull final Map<String, OperatorProperties> operators) {
        this.operators = ImmutableMap.copyOf(operators);
    }

    @Nonnull
    @Override
    public OperatorProperties resolve(@Nonnull final String symbol) {
        return operators.getOrDefault(symbol, OperatorProperties.fixed());
    }

    public boolean isDefined(@Nonnull final String symbol) {
        return operators.containsKey(symbol);
    }

    @Nonnull
    public Map<String, OperatorProperties> getOperators() {
        return operators;
    }

    @Nonnull
    public static SymbolTable empty() {
        return EMPTY;
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public Builder asBuilder() {
        return new Builder().addAll(operators);
    }

    /**
     * Builder for {@link SymbolTable}.
     */
    public static class Builder {
        @Nonnull
        private final Map<String, OperatorProperties> operators = new LinkedHashMap<>();

        public Builder define(@Nonnull final String symbol, @Nonnull final OperatorProperties properties) {
            operators.put(symbol, properties);
            return this;
        }

        /**
         * Define a commutative and associative operator with the given identity element, the way addition and
         * multiplication are usually set up.
         * @param symbol the operator symbol
         * @param identity the identity element
         * @return this builder
         */
        public Builder defineCommutative(@Nonnull final String symbol, @Nonnull final Expression identity) {
            return define(symbol, OperatorProperties.builder()
                    .setCommutative(true)
                    .setAssociative(true)
                    .setIdentity(identity)
                    .build());
        }

        public Builder addAll(@Nonnull final Map<String, OperatorProperties> additionalOperators) {
            operators.putAll(additionalOperators);
            return this;
        }

        @Nonnull
        public SymbolTable build() {
            return new SymbolTable(operators);
        }
    }
}
