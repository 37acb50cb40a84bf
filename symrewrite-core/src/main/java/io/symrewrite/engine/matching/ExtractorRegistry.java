/*
 * ExtractorRegistry.java
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

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Resolves extractor names to {@link Extractor}s. Registries are constructed once and passed to the components that
 * need them; they are never mutated after construction.
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface ExtractorRegistry {
    @Nonnull
    Optional<Extractor> lookup(@Nonnull String name);

    /**
     * Get a registry containing the built-in extractors of {@link Extractors}.
     * @return the built-in registry
     */
    @Nonnull
    static ExtractorRegistry builtIns() {
        return Extractors.builtIns();
    }
}
