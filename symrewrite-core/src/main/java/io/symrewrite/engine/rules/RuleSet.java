/*
 * RuleSet.java
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

package io.symrewrite.engine.rules;

import io.symrewrite.annotation.API;
import io.symrewrite.engine.expressions.Compound;
import io.symrewrite.engine.expressions.Expression;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Iterators;
import com.google.common.collect.Ordering;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * An ordered, immutable set of rules that supports quickly finding the rules that could match a given expression.
 *
 * <p>
 * Rules whose pattern has a compound root are indexed by the root's operator symbol; all other rules are candidates
 * for every expression. {@link #getRulesMatching(Expression)} merges both kinds of candidates back into definition
 * order, so that which rule fires first never depends on the index.
 * </p>
 *
 * <p>
 * Rule sets have identity semantics: two rule sets with the same rules are different rule sets. Normal-form tags are
 * recorded per rule set identity.
 * </p>
 */
@API(API.Status.STABLE)
public class RuleSet implements Iterable<Rule> {
    @Nonnull
    private final String name;
    @Nonnull
    private final List<Rule> rules;
    @Nonnull
    private final ImmutableListMultimap<String, Integer> ruleIndex;
    @Nonnull
    private final List<Integer> alwaysRules;

    private RuleSet(@Nonnull final String name, @Nonnull final List<Rule> rules) {
        this.name = name;
        this.rules = ImmutableList.copyOf(rules);
        final ImmutableListMultimap.Builder<String, Integer> ruleIndexBuilder = ImmutableListMultimap.builder();
        final ImmutableList.Builder<Integer> alwaysRulesBuilder = ImmutableList.builder();
        for (int i = 0; i < this.rules.size(); i++) {
            final Optional<String> root = this.rules.get(i).getRootOperator();
            if (root.isPresent()) {
                ruleIndexBuilder.put(root.get(), i);
            } else {
                alwaysRulesBuilder.add(i);
            }
        }
        this.ruleIndex = ruleIndexBuilder.build();
        this.alwaysRules = alwaysRulesBuilder.build();
    }

    @Nonnull
    public static RuleSet of(@Nonnull final String name, @Nonnull final Rule... rules) {
        return new RuleSet(name, ImmutableList.copyOf(rules));
    }

    @Nonnull
    public static RuleSet of(@Nonnull final String name, @Nonnull final List<Rule> rules) {
        return new RuleSet(name, rules);
    }

    @Nonnull
    public static Builder builder(@Nonnull final String name) {
        return new Builder(name);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public List<Rule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    @Nonnull
    @Override
    public Iterator<Rule> iterator() {
        return rules.iterator();
    }

    /**
     * Get the rules that could match the given expression, in definition order.
     * @param expression an expression
     * @return an iterator over the candidate rules
     */
    @Nonnull
    public Iterator<Rule> getRulesMatching(@Nonnull final Expression expression) {
        if (!(expression instanceof Compound)) {
            return Iterators.transform(alwaysRules.iterator(), rules::get);
        }
        final List<Integer> indexed = ruleIndex.get(((Compound)expression).getOperator());
        return Iterators.transform(
                Iterators.mergeSorted(ImmutableList.of(indexed.iterator(), alwaysRules.iterator()), Ordering.natural()),
                rules::get);
    }

    @Override
    public String toString() {
        return "RuleSet(" + name + ", " + rules.size() + " rules)";
    }

    /**
     * A builder for {@link RuleSet}.
     */
    public static class Builder {
        @Nonnull
        private final String name;
        @Nonnull
        private final ImmutableList.Builder<Rule> rules = ImmutableList.builder();

        private Builder(@Nonnull final String name) {
            this.name = name;
        }

        @Nonnull
        public Builder add(@Nonnull final Rule rule) {
            rules.add(rule);
            return this;
        }

        @Nonnull
        public Builder addAll(@Nonnull final Iterable<Rule> additionalRules) {
            rules.addAll(additionalRules);
            return this;
        }

        @Nonnull
        public RuleSet build() {
            return new RuleSet(name, rules.build());
        }
    }
}
