/*
 * RewritePipeline.java
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
import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.rules.RuleSet;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.function.Function;

/**
 * An ordered list of transformation stages applied one after the other. A stage either normalizes with a rule set,
 * rewrites the root with a rule set, or applies an arbitrary function. Optimizers are typically built this way, e.g.
 * constant folding with one rule set followed by identity removal with another.
 */
@API(API.Status.EXPERIMENTAL)
public class RewritePipeline {
    @Nonnull
    private final Normalizer normalizer;
    @Nonnull
    private final List<Stage> stages;

    private RewritePipeline(@Nonnull final Normalizer normalizer, @Nonnull final List<Stage> stages) {
        this.normalizer = normalizer;
        this.stages = ImmutableList.copyOf(stages);
    }

    @Nonnull
    public static Builder builder(@Nonnull final Normalizer normalizer) {
        return new Builder(normalizer);
    }

    @Nonnull
    public List<Stage> getStages() {
        return stages;
    }

    @Nonnull
    public Expression apply(@Nonnull final Expression expression) {
        Expression current = expression;
        for (final Stage stage : stages) {
            current = stage.apply(normalizer, current);
        }
        return current;
    }

    /**
     * A single stage of a pipeline.
     */
    @FunctionalInterface
    public interface Stage {
        @Nonnull
        Expression apply(@Nonnull Normalizer normalizer, @Nonnull Expression expression);
    }

    /**
     * A builder for {@link RewritePipeline}.
     */
    public static class Builder {
        @Nonnull
        private final Normalizer normalizer;
        @Nonnull
        private final ImmutableList.Builder<Stage> stages = ImmutableList.builder();

        private Builder(@Nonnull final Normalizer normalizer) {
            this.normalizer = normalizer;
        }

        @Nonnull
        public Builder normalize(@Nonnull final RuleSet ruleSet) {
            stages.add((n, expression) -> n.normalize(ruleSet, expression));
            return this;
        }

        @Nonnull
        public Builder transformOneLevel(@Nonnull final RuleSet ruleSet) {
            stages.add((n, expression) -> n.transformOneLevel(ruleSet, expression));
            return this;
        }

        @Nonnull
        public Builder map(@Nonnull final Function<? super Expression, ? extends Expression> function) {
            stages.add((n, expression) -> function.apply(expression));
            return this;
        }

        @Nonnull
        public Builder addStage(@Nonnull final Stage stage) {
            stages.add(stage);
            return this;
        }

        @Nonnull
        public RewritePipeline build() {
            return new RewritePipeline(normalizer, stages.build());
        }
    }
}
