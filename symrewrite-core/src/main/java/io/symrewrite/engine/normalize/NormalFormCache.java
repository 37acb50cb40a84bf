/*
 * NormalFormCache.java
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
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.MapMaker;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;

/**
 * Records which expression nodes are known to be in normal form with respect to which rule sets.
 *
 * <p>
 * Tags are keyed by the identity of the node, not by structural equality, and are held weakly so that they disappear
 * with the node. As expressions are immutable, a node's tag never goes stale: a rewrite anywhere below a node builds
 * new nodes up to the root, and those start out untagged. Rule sets are compared by identity as well and are also
 * held weakly, so a shared cache does not keep discarded rule sets alive.
 * </p>
 *
 * <p>
 * This class is thread-safe and can be shared by concurrent normalizations.
 * </p>
 */
@API(API.Status.INTERNAL)
public class NormalFormCache {
    @Nullable
    private final Cache<Expression, Set<RuleSet>> tags;

    private NormalFormCache(final boolean enabled) {
        this.tags = enabled ? CacheBuilder.newBuilder().weakKeys().build() : null;
    }

    @Nonnull
    public static NormalFormCache create() {
        return new NormalFormCache(true);
    }

    /**
     * Create a cache that never records anything.
     * @return a disabled cache
     */
    @Nonnull
    public static NormalFormCache disabled() {
        return new NormalFormCache(false);
    }

    public boolean isEnabled() {
        return tags != null;
    }

    public boolean isNormal(@Nonnull final Expression expression, @Nonnull final RuleSet ruleSet) {
        if (tags == null) {
            return false;
        }
        final Set<RuleSet> ruleSets = tags.getIfPresent(expression);
        return ruleSets != null && ruleSets.contains(ruleSet);
    }

    public void markNormal(@Nonnull final Expression expression, @Nonnull final RuleSet ruleSet) {
        if (tags == null) {
            return;
        }
        tags.asMap().computeIfAbsent(expression, ignored -> newRuleSetTags()).add(ruleSet);
    }

    /**
     * Remove all tags for one rule set.
     * @param ruleSet the rule set whose tags to drop
     */
    public void invalidate(@Nonnull final RuleSet ruleSet) {
        if (tags == null) {
            return;
        }
        for (final Set<RuleSet> ruleSets : tags.asMap().values()) {
            ruleSets.remove(ruleSet);
        }
    }

    public void invalidateAll() {
        if (tags != null) {
            tags.invalidateAll();
        }
    }

    public long size() {
        return tags == null ? 0L : tags.size();
    }

    @Nonnull
    private static Set<RuleSet> newRuleSetTags() {
        final ConcurrentMap<RuleSet, Boolean> ruleSets = new MapMaker().weakKeys().makeMap();
        return Collections.newSetFromMap(ruleSets);
    }
}
