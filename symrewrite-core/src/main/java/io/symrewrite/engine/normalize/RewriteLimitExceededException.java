/*
 * RewriteLimitExceededException.java
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

package io.symrewrite.engine.normalize;

import io.symrewrite.annotation.API;
import io.symrewrite.engine.RewriteCoreException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Thrown when a normalization performs more rewrites than the configured maximum.
 *
 * @see NormalizerConfiguration#getMaxRewrites()
 */
@SuppressWarnings("serial")
@API(API.Status.STABLE)
public class RewriteLimitExceededException extends RewriteCoreException {
    public RewriteLimitExceededException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }
}
