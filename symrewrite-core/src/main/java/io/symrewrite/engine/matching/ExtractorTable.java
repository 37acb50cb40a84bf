/*
 * ExtractorTable.java
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
import io.symrewrite.engine.logging.LogMessageKeys;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable {@link ExtractorRegistry} backed by a map from name to extractor.
 */
@API(API.Status.EXPERIMENTAL)
public class ExtractorTable implements ExtractorRegistry {
    @Nonnull
    private final Map<String, Extractor> extractors;

    private ExtractorTable(@Nonnull final Map<String, Extractor> extractors) {
        this.extractors = ImmutableMap.copyOf(extractors);
    }

    @Nonnull
    @Override
    public Optional<Extractor> lookup(@Nonnull final String name) {
        return Optional.ofNullable(extractors.get(name));
    }

    @Nonnull
    public Map<String, Extractor> getExtractors() {
        return extractors;
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public Builder asBuilder() {
        return new Builder().addAll(extractors);
    }

    /**
     * A builder for {@link ExtractorTable}. Registering the same name twice is an error.
     */
    public static class Builder {
        @Nonnull
        private final Map<String, Extractor> extractors = new LinkedHashMap<>();

        @Nonnull
        public Builder register(@Nonnull final String name, @Nonnull final Extractor extractor) {
            if (extractors.containsKey(name)) {
                throw new RewriteCoreArgumentException("extractor is already registered",
                        LogMessageKeys.EXTRACTOR, name);
            }
            extractors.put(name, extractor);
            return this;
        }

        @Nonnull
        public Builder addAll(@Nonnull final Map<String, Extractor> additionalExtractors) {
            additionalExtractors.forEach(this::register);
            return this;
        }

        @Nonnull
        public ExtractorTable build() {
            return new ExtractorTable(extractors);
        }
    }
}
