/*
 * OperatorRegistry.java
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

/**
 * Resolves an operator symbol to the properties the construction phase assigned to it. The engine depends only on the
 * resolved {@link OperatorProperties}, never on how a particular registry arrives at them.
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface OperatorRegistry {
    /**
     * Resolve the properties of an operator symbol. Symbols the registry knows nothing about resolve to
     * {@link OperatorProperties#fixed()}.
     * @param symbol the operator symbol
     * @return the properties of the operator
     */
    @Nonnull
    OperatorProperties resolve(@Nonnull String symbol);
}
