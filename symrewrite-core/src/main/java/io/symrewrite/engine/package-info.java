/*
 * package-info.java
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

/**
 * A rule-based term-rewriting engine for symbolic expressions.
 *
 * <p>
 * Expressions ({@link io.symrewrite.engine.expressions}) are immutable trees whose compound nodes carry the semantic
 * properties of their operator. Rules ({@link io.symrewrite.engine.rules}) pair a pattern with an optional guard and a
 * transformation; patterns are matched "up to mathematical meaning" by the semantic matcher
 * ({@link io.symrewrite.engine.matching}), which understands commutative operators, variadic sequence variables and
 * named extractors. The normalizer ({@link io.symrewrite.engine.normalize}) drives rule application bottom-up until no
 * rule fires anywhere in a tree.
 * </p>
 *
 * <p>
 * Everything in the engine is purely functional over immutable data, so matching and normalization compose safely with
 * parallel and cached use.
 * </p>
 */
package io.symrewrite.engine;
