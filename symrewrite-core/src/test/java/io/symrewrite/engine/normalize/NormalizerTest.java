/*
 * NormalizerTest.java
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

import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.expressions.Expressions;
import io.symrewrite.engine.matching.Patterns;
import io.symrewrite.engine.rules.Guards;
import io.symrewrite.engine.rules.RewriteEngine;
import io.symrewrite.engine.rules.Rule;
import io.symrewrite.engine.rules.RuleCompiler;
import io.symrewrite.engine.rules.RuleSet;
import io.symrewrite.test.RandomSeedSource;
import io.symrewrite.test.Tags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.symrewrite.engine.TestExpressions.lit;
import static io.symrewrite.engine.TestExpressions.lvar;
import static io.symrewrite.engine.TestExpressions.op;
import static io.symrewrite.engine.TestExpressions.sym;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Normalizer}.
 */
class NormalizerTest {
    private final RuleCompiler compiler = new RuleCompiler();
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }

    @Test
    void removeAllZeros() {
        final Normalizer normalizer = new Normalizer();
        assertEquals(op("+", 1, 2, 3, 4),
                normalizer.normalize(ArithmeticRules.PLUS_IDENTITIES, op("+", 0, 1, 0, 2, 0, 3, 0, 4)));
    }

    @Test
    void collapseToIdentity() {
        final Normalizer normalizer = new Normalizer();
        assertEquals(lit(0), normalizer.normalize(ArithmeticRules.PLUS_IDENTITIES, op("+", 0, 0)));
        assertEquals(sym("x"), normalizer.normalize(ArithmeticRules.PLUS_IDENTITIES, op("+", 0, op("+", sym("x"), 0))));
        assertEquals(lit(0), normalizer.normalize(ArithmeticRules.ALL, op("*", op("+", 0, sym("x")), op("+", 0, 0))));
    }

    @Test
    void normalizesBottomUp() {
        final Normalizer normalizer = new Normalizer();
        assertEquals(op("f", sym("x"), op("g", 2)),
                normalizer.normalize(ArithmeticRules.ALL, op("f", op("+", 0, sym("x")), op("g", op("*", 1, op("+", 2))))));
    }

    @Test
    void sortsToFixpoint() {
        final Rule sort = compiler.defineRule("sort",
                op("°", lvar("?&*1"), lvar("?x"), lvar("?&*2"), lvar("?y"), lvar("?&*3")),
                op("°", lvar("?&*1"), lvar("?y"), lvar("?&*2"), lvar("?x"), lvar("?&*3")),
                Guards.greaterThan("?y", "?x"));
        final RuleSet ruleSet = RuleSet.of("sort", sort);
        final Normalizer normalizer = new Normalizer();
        assertEquals(op("°", 3, 2, 1), normalizer.normalize(ruleSet, op("°", 1, 2, 3)));

        final List<Object> values = new ArrayList<>(List.of(1, 2, 3, 4, 5, 6));
        Collections.shuffle(values, new Random(0x5ca1eL));
        assertEquals(op("°", 6, 5, 4, 3, 2, 1), normalizer.normalize(ruleSet, op("°", values.toArray())));
    }

    @Test
    void normalFormIsReturnedUnchanged() {
        final Normalizer normalizer = new Normalizer();
        final Expression normal = op("+", 1, op("*", sym("x"), 2));
        assertSame(normal, normalizer.normalize(ArithmeticRules.ALL, normal));
        assertSame(normal, new Normalizer(new RewriteEngine(),
                NormalizerConfiguration.builder().setUseNormalFormCache(false).build())
                .normalize(ArithmeticRules.ALL, normal));
    }

    @Test
    void rewrittenResultsAreNormalizedAgain() {
        final Rule wrap = compiler.defineRule("wrap", op("w", lvar("?x")), op("g", op("+", 0, lvar("?x"))));
        final RuleSet ruleSet = RuleSet.of("wrap", wrap, ArithmeticRules.REMOVE_ZERO, ArithmeticRules.REMOVE_UNARY_PLUS);
        assertEquals(op("g", 5), new Normalizer().normalize(ruleSet, op("w", 5)));
    }

    @Test
    void normalFormsAreTagged() {
        final Normalizer normalizer = new Normalizer();
        final Expression result = normalizer.normalize(ArithmeticRules.PLUS_IDENTITIES, op("f", op("+", 0, sym("x")), 2));
        final NormalFormCache cache = normalizer.getCache();
        assertTrue(cache.isEnabled());
        assertTrue(cache.isNormal(result, ArithmeticRules.PLUS_IDENTITIES));
        assertFalse(cache.isNormal(result, ArithmeticRules.ALL));
        assertFalse(cache.isNormal(op("f", sym("x"), 2), ArithmeticRules.PLUS_IDENTITIES));
        assertSame(result, normalizer.normalize(ArithmeticRules.PLUS_IDENTITIES, result));

        cache.invalidate(ArithmeticRules.PLUS_IDENTITIES);
        assertFalse(cache.isNormal(result, ArithmeticRules.PLUS_IDENTITIES));
        normalizer.normalize(ArithmeticRules.PLUS_IDENTITIES, result);
        assertTrue(cache.isNormal(result, ArithmeticRules.PLUS_IDENTITIES));
        cache.invalidateAll();
        assertFalse(cache.isNormal(result, ArithmeticRules.PLUS_IDENTITIES));
    }

    @Test
    void disabledCacheRecordsNothing() {
        final Normalizer normalizer = new Normalizer(new RewriteEngine(),
                NormalizerConfiguration.builder().setUseNormalFormCache(false).build());
        final Expression result = normalizer.normalize(ArithmeticRules.PLUS_IDENTITIES, op("+", 0, sym("x")));
        assertEquals(sym("x"), result);
        assertFalse(normalizer.getCache().isEnabled());
        assertFalse(normalizer.getCache().isNormal(result, ArithmeticRules.PLUS_IDENTITIES));
        assertEquals(0L, normalizer.getCache().size());
    }

    @Test
    void sharedCacheAcrossNormalizers() {
        final NormalFormCache cache = NormalFormCache.create();
        final Normalizer first = new Normalizer(new RewriteEngine(), NormalizerConfiguration.defaultConfiguration(), cache);
        final Expression result = first.normalize(ArithmeticRules.ALL, op("+", 0, sym("y")));
        final Normalizer second = new Normalizer(new RewriteEngine(), NormalizerConfiguration.defaultConfiguration(), cache);
        assertSame(cache, second.getCache());
        assertTrue(second.getCache().isNormal(result, ArithmeticRules.ALL));
    }

    @Test
    void cyclicRulesHitRewriteLimit() {
        final RuleSet cyclic = RuleSet.of("cyclic",
                compiler.defineRule("f-to-g", op("f", lvar("?x")), op("g", lvar("?x"))),
                compiler.defineRule("g-to-f", op("g", lvar("?x")), op("f", lvar("?x"))));
        final Normalizer normalizer = new Normalizer(new RewriteEngine(),
                NormalizerConfiguration.builder().setMaxRewrites(10).build());
        final RewriteLimitExceededException e = assertThrows(RewriteLimitExceededException.class,
                () -> normalizer.normalize(cyclic, op("f", 1)));
        assertEquals(10L, e.getLogInfo().get("rewrite_limit"));
        assertEquals("cyclic", e.getLogInfo().get("rule_set"));
    }

    @Test
    void rewriteLimitIsNotHitByTerminatingRules() {
        final Normalizer normalizer = new Normalizer(new RewriteEngine(),
                NormalizerConfiguration.builder().setMaxRewrites(4).build());
        assertEquals(op("+", 1, 2), normalizer.normalize(ArithmeticRules.PLUS_IDENTITIES, op("+", 0, 1, 0, 2, 0)));
        assertThrows(RewriteLimitExceededException.class,
                () -> normalizer.normalize(ArithmeticRules.PLUS_IDENTITIES, op("+", 0, 1, 0, 2, 0, 0, 0)));
    }

    @Test
    void transformOneLevelOnlyRewritesTheRoot() {
        final Rule unwrap = compiler.defineRule("unwrap", op("u", lvar("?x")), lvar("?x"));
        final RuleSet ruleSet = RuleSet.of("unwrap", unwrap, ArithmeticRules.REMOVE_ZERO, ArithmeticRules.REMOVE_UNARY_PLUS);
        final Normalizer normalizer = new Normalizer();
        assertEquals(op("g", op("+", 0, 1)), normalizer.transformOneLevel(ruleSet, op("g", op("+", 0, 1))));
        assertEquals(op("g", 1), normalizer.normalize(ruleSet, op("g", op("+", 0, 1))));
        assertEquals(lit(1), normalizer.transformOneLevel(ruleSet, op("u", op("u", op("+", 0, 1)))));
        assertEquals(op("f", op("u", 2)), normalizer.transformOneLevel(ruleSet, op("u", op("f", op("u", 2)))));
    }

    @Test
    void asyncMatchesSync() throws Exception {
        final Normalizer normalizer = new Normalizer();
        final Expression expression = op("f",
                op("+", 0, op("*", 1, sym("x"))),
                op("+", 0, 1, 0, 2, 0, 3, 0, 4),
                op("*", 2, op("+"), sym("y")));
        final Expression expected = new Normalizer().normalize(ArithmeticRules.ALL, expression);
        assertEquals(op("f", sym("x"), op("+", 1, 2, 3, 4), 0), expected);
        final Expression result = normalizer.normalizeAsync(ArithmeticRules.ALL, expression, executor).get(10, TimeUnit.SECONDS);
        assertEquals(expected, result);
        assertTrue(normalizer.getCache().isNormal(result, ArithmeticRules.ALL));
    }

    @Test
    void asyncSequentialBelowThreshold() throws Exception {
        final Normalizer normalizer = new Normalizer(new RewriteEngine(),
                NormalizerConfiguration.builder().setParallelismThreshold(100).build());
        assertEquals(op("f", 1, 2, 3),
                normalizer.normalizeAsync(ArithmeticRules.ALL, op("f", op("+", 1, 0), op("*", 2), op("+", 3)), executor)
                        .get(10, TimeUnit.SECONDS));
    }

    @Test
    void asyncRewriteLimit() {
        final RuleSet cyclic = RuleSet.of("cyclic",
                compiler.defineRule("f-to-g", op("f", lvar("?x")), op("g", lvar("?x"))),
                compiler.defineRule("g-to-f", op("g", lvar("?x")), op("f", lvar("?x"))));
        final Normalizer normalizer = new Normalizer(new RewriteEngine(),
                NormalizerConfiguration.builder().setMaxRewrites(50).build());
        final ExecutionException e = assertThrows(ExecutionException.class,
                () -> normalizer.normalizeAsync(cyclic, op("h", op("f", 1), op("g", 2), op("f", 3)), executor)
                        .get(10, TimeUnit.SECONDS));
        assertThat(e.getCause(), instanceOf(RewriteLimitExceededException.class));
    }

    @Tag(Tags.Randomized)
    @ParameterizedTest
    @RandomSeedSource({0x0fdbL, 0x5ca1eL, 123456L, 78910L, 1123581321345589L})
    void idempotence(long seed) {
        final Random random = new Random(seed);
        final Normalizer cached = new Normalizer();
        final Normalizer uncached = new Normalizer(new RewriteEngine(),
                NormalizerConfiguration.builder().setUseNormalFormCache(false).build());
        for (int i = 0; i < 25; i++) {
            final Expression expression = ArithmeticRules.randomExpression(random, 4);
            final Expression once = uncached.normalize(ArithmeticRules.ALL, expression);
            assertEquals(once, uncached.normalize(ArithmeticRules.ALL, once));
            assertEquals(once, cached.normalize(ArithmeticRules.ALL, expression));
            assertEquals(once, cached.normalize(ArithmeticRules.ALL, once));
            assertTrue(Expressions.size(once) <= Expressions.size(expression));
        }
    }

    @Tag(Tags.Randomized)
    @ParameterizedTest
    @RandomSeedSource({0x0fdbL, 0x5ca1eL, 123456L})
    void asyncIdempotence(long seed) throws Exception {
        final Random random = new Random(seed);
        final Normalizer normalizer = new Normalizer(new RewriteEngine(),
                NormalizerConfiguration.builder().setUseNormalFormCache(false).build());
        for (int i = 0; i < 10; i++) {
            final Expression expression = ArithmeticRules.randomExpression(random, 4);
            final Expression expected = normalizer.normalize(ArithmeticRules.ALL, expression);
            assertEquals(expected, normalizer.normalizeAsync(ArithmeticRules.ALL, expression, executor).get(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void extractorsInsideNestedPatterns() {
        final Rule factor = compiler.defineRule("drop-unit-factor",
                op("+", op("*", Patterns.extract("one?"), lvar("?x")), lvar("?&*")),
                op("+", lvar("?x"), lvar("?&*")));
        final RuleSet ruleSet = RuleSet.of("factor", factor);
        assertEquals(op("+", sym("x"), 5), new Normalizer().normalize(ruleSet, op("+", 5, op("*", sym("x"), 1))));
    }
}
