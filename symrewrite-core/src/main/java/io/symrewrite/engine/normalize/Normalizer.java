/*
 * Normalizer.java
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
import io.symrewrite.engine.logging.KeyValueLogMessage;
import io.symrewrite.engine.logging.LogMessageKeys;
import io.symrewrite.engine.rules.RewriteEngine;
import io.symrewrite.engine.rules.RuleSet;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rewrites expressions to normal form.
 *
 * <p>
 * Normalization is bottom-up: the children of a node are normalized first, then the rules of the rule set are tried
 * at the node in definition order and the first one that succeeds replaces the node. Every replacement starts a new
 * scan of the whole rule set, and its children are normalized before that, as a rule's result may contain
 * expressions that are not normal themselves. Once no rule applies the node is in normal form and is tagged in the
 * {@link NormalFormCache}, which lets later normalizations with the same rule set skip it.
 * </p>
 *
 * <p>
 * Normalization terminates only if the rule set does; a cyclic rule set makes it run forever unless the configuration
 * sets a maximum number of rewrites.
 * </p>
 *
 * <p>
 * A normalizer is thread-safe. {@link #normalizeAsync} normalizes sibling subtrees on an executor concurrently.
 * </p>
 */
@API(API.Status.STABLE)
public class Normalizer {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(Normalizer.class);

    @Nonnull
    private final RewriteEngine engine;
    @Nonnull
    private final NormalizerConfiguration configuration;
    @Nonnull
    private final NormalFormCache cache;

    public Normalizer() {
        this(new RewriteEngine());
    }

    public Normalizer(@Nonnull final RewriteEngine engine) {
        this(engine, NormalizerConfiguration.defaultConfiguration());
    }

    public Normalizer(@Nonnull final RewriteEngine engine, @Nonnull final NormalizerConfiguration configuration) {
        this(engine, configuration,
                configuration.shouldUseNormalFormCache() ? NormalFormCache.create() : NormalFormCache.disabled());
    }

    public Normalizer(@Nonnull final RewriteEngine engine,
                      @Nonnull final NormalizerConfiguration configuration,
                      @Nonnull final NormalFormCache cache) {
        this.engine = engine;
        this.configuration = configuration;
        this.cache = configuration.shouldUseNormalFormCache() ? cache : NormalFormCache.disabled();
    }

    @Nonnull
    public RewriteEngine getEngine() {
        return engine;
    }

    @Nonnull
    public NormalizerConfiguration getConfiguration() {
        return configuration;
    }

    @Nonnull
    public NormalFormCache getCache() {
        return cache;
    }

    /**
     * Normalize an expression with respect to a rule set.
     * @param ruleSet the rules to apply
     * @param expression the expression
     * @return an expression to which no rule of {@code ruleSet} applies at any node
     * @throws RewriteLimitExceededException if the configuration limits the number of rewrites and normalization
     *         needs more
     */
    @Nonnull
    public Expression normalize(@Nonnull final RuleSet ruleSet, @Nonnull final Expression expression) {
        final long startTime = System.nanoTime();
        final RewriteCounter counter = new RewriteCounter(ruleSet, expression);
        final Expression result = normalizeNode(ruleSet, expression, counter);
        logCompletion(ruleSet, expression, result, counter, startTime);
        return result;
    }

    /**
     * Rewrite an expression at its root until no rule of the rule set applies there. Children are neither normalized
     * first nor afterwards.
     * @param ruleSet the rules to apply
     * @param expression the expression
     * @return the rewritten expression, which no rule of {@code ruleSet} applies to at the root
     * @throws RewriteLimitExceededException if the configuration limits the number of rewrites and more are needed
     */
    @Nonnull
    public Expression transformOneLevel(@Nonnull final RuleSet ruleSet, @Nonnull final Expression expression) {
        final RewriteCounter counter = new RewriteCounter(ruleSet, expression);
        Expression current = expression;
        Optional<Expression> rewritten = engine.applyRules(ruleSet, current);
        while (rewritten.isPresent()) {
            counter.increment();
            current = rewritten.get();
            rewritten = engine.applyRules(ruleSet, current);
        }
        return current;
    }

    /**
     * Normalize an expression with respect to a rule set, normalizing the children of compounds with at least
     * {@link NormalizerConfiguration#getParallelismThreshold()} children in parallel on the given executor. The
     * result is the same as that of {@link #normalize(RuleSet, Expression)}.
     * @param ruleSet the rules to apply
     * @param expression the expression
     * @param executor executor to run the normalization of subtrees on
     * @return a future completing with the normal form of {@code expression}, or exceptionally with a
     *         {@link RewriteLimitExceededException} if the configured maximum number of rewrites is exceeded
     */
    @Nonnull
    public CompletableFuture<Expression> normalizeAsync(@Nonnull final RuleSet ruleSet,
                                                        @Nonnull final Expression expression,
                                                        @Nonnull final Executor executor) {
        final long startTime = System.nanoTime();
        final RewriteCounter counter = new RewriteCounter(ruleSet, expression);
        return CompletableFuture.supplyAsync(() -> normalizeNodeAsync(ruleSet, expression, executor, counter), executor)
                .thenCompose(future -> future)
                .thenApply(result -> {
                    logCompletion(ruleSet, expression, result, counter, startTime);
                    return result;
                });
    }

    @Nonnull
    private Expression normalizeNode(@Nonnull final RuleSet ruleSet,
                                     @Nonnull final Expression expression,
                                     @Nonnull final RewriteCounter counter) {
        if (cache.isNormal(expression, ruleSet)) {
            return expression;
        }
        Expression current = normalizeChildren(ruleSet, expression, counter);
        while (true) {
            final Optional<Expression> rewritten = engine.applyRules(ruleSet, current);
            if (!rewritten.isPresent()) {
                break;
            }
            counter.increment();
            final Expression next = rewritten.get();
            if (cache.isNormal(next, ruleSet)) {
                return next;
            }
            current = normalizeChildren(ruleSet, next, counter);
        }
        cache.markNormal(current, ruleSet);
        return current;
    }

    @Nonnull
    private Expression normalizeChildren(@Nonnull final RuleSet ruleSet,
                                         @Nonnull final Expression expression,
                                         @Nonnull final RewriteCounter counter) {
        final List<Expression> children = expression.getChildren();
        if (children.isEmpty()) {
            return expression;
        }
        final ImmutableList.Builder<Expression> normalizedChildren = ImmutableList.builderWithExpectedSize(children.size());
        for (final Expression child : children) {
            normalizedChildren.add(normalizeNode(ruleSet, child, counter));
        }
        return expression.withChildren(normalizedChildren.build());
    }

    @Nonnull
    private CompletableFuture<Expression> normalizeNodeAsync(@Nonnull final RuleSet ruleSet,
                                                             @Nonnull final Expression expression,
                                                             @Nonnull final Executor executor,
                                                             @Nonnull final RewriteCounter counter) {
        if (cache.isNormal(expression, ruleSet)) {
            return CompletableFuture.completedFuture(expression);
        }
        return normalizeChildrenAsync(ruleSet, expression, executor, counter)
                .thenCompose(current -> rewriteAsync(ruleSet, current, executor, counter));
    }

    @Nonnull
    private CompletableFuture<Expression> rewriteAsync(@Nonnull final RuleSet ruleSet,
                                                       @Nonnull final Expression current,
                                                       @Nonnull final Executor executor,
                                                       @Nonnull final RewriteCounter counter) {
        final Optional<Expression> rewritten = engine.applyRules(ruleSet, current);
        if (!rewritten.isPresent()) {
            cache.markNormal(current, ruleSet);
            return CompletableFuture.completedFuture(current);
        }
        counter.increment();
        final Expression next = rewritten.get();
        if (cache.isNormal(next, ruleSet)) {
            return CompletableFuture.completedFuture(next);
        }
        return normalizeChildrenAsync(ruleSet, next, executor, counter)
                .thenCompose(normalized -> rewriteAsync(ruleSet, normalized, executor, counter));
    }

    @Nonnull
    private CompletableFuture<Expression> normalizeChildrenAsync(@Nonnull final RuleSet ruleSet,
                                                                 @Nonnull final Expression expression,
                                                                 @Nonnull final Executor executor,
                                                                 @Nonnull final RewriteCounter counter) {
        final List<Expression> children = expression.getChildren();
        if (children.isEmpty()) {
            return CompletableFuture.completedFuture(expression);
        }

        if (children.size() < configuration.getParallelismThreshold()) {
            CompletableFuture<List<Expression>> chain = CompletableFuture.completedFuture(new ArrayList<>(children.size()));
            for (final Expression child : children) {
                chain = chain.thenCompose(normalizedSoFar ->
                        normalizeNodeAsync(ruleSet, child, executor, counter)
                                .thenApply(normalizedChild -> {
                                    normalizedSoFar.add(normalizedChild);
                                    return normalizedSoFar;
                                }));
            }
            return chain.thenApply(expression::withChildren);
        }

        final List<CompletableFuture<Expression>> futures = new ArrayList<>(children.size());
        for (final Expression child : children) {
            futures.add(CompletableFuture.supplyAsync(() -> normalizeNodeAsync(ruleSet, child, executor, counter), executor)
                    .thenCompose(future -> future));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    final ImmutableList.Builder<Expression> normalizedChildren = ImmutableList.builderWithExpectedSize(futures.size());
                    for (final CompletableFuture<Expression> future : futures) {
                        normalizedChildren.add(future.join());
                    }
                    return expression.withChildren(normalizedChildren.build());
                });
    }

    private void logCompletion(@Nonnull final RuleSet ruleSet,
                               @Nonnull final Expression expression,
                               @Nonnull final Expression result,
                               @Nonnull final RewriteCounter counter,
                               final long startTime) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("normalized expression",
                    LogMessageKeys.RULE_SET, ruleSet.getName(),
                    LogMessageKeys.EXPRESSION, expression,
                    LogMessageKeys.RESULT, result,
                    LogMessageKeys.REWRITE_COUNT, counter.getCount(),
                    LogMessageKeys.TIME_MILLIS, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime)));
        }
    }

    /**
     * Counts the rewrites of one normalization and enforces the configured limit. Shared by all subtrees of an
     * asynchronous normalization.
     */
    private class RewriteCounter {
        @Nonnull
        private final RuleSet ruleSet;
        @Nonnull
        private final Expression expression;
        @Nonnull
        private final AtomicLong count = new AtomicLong();

        RewriteCounter(@Nonnull final RuleSet ruleSet, @Nonnull final Expression expression) {
            this.ruleSet = ruleSet;
            this.expression = expression;
        }

        void increment() {
            final long current = count.incrementAndGet();
            if (configuration.isRewriteLimited() && current > configuration.getMaxRewrites()) {
                LOGGER.warn(KeyValueLogMessage.of("rewrite limit exceeded",
                        LogMessageKeys.RULE_SET, ruleSet.getName(),
                        LogMessageKeys.EXPRESSION, expression,
                        LogMessageKeys.REWRITE_LIMIT, configuration.getMaxRewrites()));
                throw new RewriteLimitExceededException("rewrite limit exceeded",
                        LogMessageKeys.RULE_SET, ruleSet.getName(),
                        LogMessageKeys.REWRITE_LIMIT, configuration.getMaxRewrites());
            }
        }

        long getCount() {
            return count.get();
        }
    }
}
