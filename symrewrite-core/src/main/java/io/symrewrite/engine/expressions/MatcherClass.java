/*
 * MatcherClass.java
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

/**
 * How the children of a compound pattern are matched against the children of a concrete compound.
 */
@API(API.Status.STABLE)
public enum MatcherClass {
    /**
     * Children are matched positionally; sequence variables, if present, are matched by segmentation.
     */
    FIXED,
    /**
     * Children are matched as a multiset; at most one sequence variable binds the unmatched remainder.
     */
    COMMUTATIVE,
    /**
     * The operator is implemented by an extractor registered under the operator's symbol.
     */
    EXTRACTOR_BACKED
}
