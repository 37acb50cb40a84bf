/*
 * NormalizerConfiguration.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;

/**
 * A set of configuration options for the {@link Normalizer}.
 */
@API(API.Status.MAINTAINED)
public class NormalizerConfiguration {
    @Nonnull
    private static final NormalizerConfiguration DEFAULT_CONFIGURATION = builder().build();

    private final boolean useNormalFormCache;
    private final long maxRewrites;
    private final int parallelismThreshold;

    private NormalizerConfiguration(@Nonnull final Builder builder) {
        this.useNormalFormCache = builder.useNormalFormCache;
        this.maxRewrites = builder.maxRewrites;
        this.parallelismThreshold = builder.parallelismThreshold;
    }

    /**
     * Get whether nodes found to be in normal form are tagged, so that later normalization with the same rule set
     * skips them.
     * @return whether the normal-form cache is used
     */
    public boolean shouldUseNormalFormCache() {
        return useNormalFormCache;
    }

    /**
     * Get the maximum number of rewrites a single normalization may perform before it is aborted with a
     * {@link RewriteLimitExceededException}. Rule sets are not guaranteed to terminate, so this is the way for a
     * caller to bound the work.
     * @return the maximum number of rewrites, or {@code 0} if normalization is unbounded
     */
    public long getMaxRewrites() {
        return maxRewrites;
    }

    public boolean isRewriteLimited() {
        return maxRewrites > 0;
    }

    /**
     * Get the minimum number of children a compound must have for asynchronous normalization to normalize the children
     * in parallel rather than one after the other.
     * @return the parallelism threshold
     */
    public int getParallelismThreshold() {
        return parallelismThreshold;
    }

    @Nonnull
    public Builder asBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public static NormalizerConfiguration defaultConfiguration() {
        return DEFAULT_CONFIGURATION;
    }

    @Override
    public String toString() {
        return "NormalizerConfiguration{" +
               "useNormalFormCache=" + useNormalFormCache +
               ", maxRewrites=" + maxRewrites +
               ", parallelismThreshold=" + parallelismThreshold +
               '}';
    }

    /**
     * A builder for {@link NormalizerConfiguration}.
     */
    public static class Builder {
        private boolean useNormalFormCache = true;
        private long maxRewrites = 0L;
        private int parallelismThreshold = 2;

        public Builder() {
        }

        public Builder(@Nonnull final NormalizerConfiguration configuration) {
            this.useNormalFormCache = configuration.useNormalFormCache;
            this.maxRewrites = configuration.maxRewrites;
            this.parallelismThreshold = configuration.parallelismThreshold;
        }

        @Nonnull
        public Builder setUseNormalFormCache(final boolean useNormalFormCache) {
            this.useNormalFormCache = useNormalFormCache;
            return this;
        }

        /**
         * Set the maximum number of rewrites per normalization.
         * @param maxRewrites the limit, or {@code 0} for no limit
         * @return this builder
         */
        @Nonnull
        public Builder setMaxRewrites(final long maxRewrites) {
            Preconditions.checkArgument(maxRewrites >= 0, "maximum number of rewrites cannot be negative");
            this.maxRewrites = maxRewrites;
            return this;
        }

        @Nonnull
        public Builder setParallelismThreshold(final int parallelismThreshold) {
            Preconditions.checkArgument(parallelismThreshold >= 1, "parallelism threshold must be positive");
            this.parallelismThreshold = parallelismThreshold;
            return this;
        }

        @Nonnull
        public NormalizerConfiguration build() {
            return new NormalizerConfiguration(this);
        }
    }
}
