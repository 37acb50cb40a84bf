/*
 * RewritePipelineTest.java
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
import io.symrewrite.engine.rules.RuleCompiler;
import io.symrewrite.engine.rules.RuleSet;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static io.symrewrite.engine.TestExpressions.lit;
import static io.symrewrite.engine.TestExpressions.lvar;
import static io.symrewrite.engine.TestExpressions.op;
import static io.symrewrite.engine.TestExpressions.sym;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests for {@link RewritePipeline}.
 */
class RewritePipelineTest {

    @Test
    void stagesRunInOrder() {
        final RewritePipeline pipeline = RewritePipeline.builder(new Normalizer())
                .normalize(ArithmeticRules.ALL)
                .map(expression -> Expressions.substitute(expression, ImmutableMap.of(sym("x"), lit(0))))
                .normalize(ArithmeticRules.ALL)
                .build();
        assertEquals(3, pipeline.getStages().size());
        assertEquals(lit(0), pipeline.apply(op("+", sym("x"), op("*", sym("y"), sym("x")))));
        assertEquals(op("+", sym("y"), 2), pipeline.apply(op("+", sym("x"), op("*", 1, sym("y")), 2)));
    }

    @Test
    void oneLevelStage() {
        final RuleSet unwrap = RuleSet.of("unwrap",
                new RuleCompiler().defineRule("unwrap", op("u", lvar("?x")), lvar("?x")));
        final RewritePipeline pipeline = RewritePipeline.builder(new Normalizer())
                .transformOneLevel(unwrap)
                .build();
        assertEquals(op("f", op("u", 1)), pipeline.apply(op("u", op("u", op("f", op("u", 1))))));
    }

    @Test
    void customStageSeesNormalizer() {
        final Normalizer normalizer = new Normalizer();
        final RewritePipeline pipeline = RewritePipeline.builder(normalizer)
                .addStage((n, expression) -> {
                    assertSame(normalizer, n);
                    return n.normalize(ArithmeticRules.PLUS_IDENTITIES, expression);
                })
                .build();
        assertEquals(sym("z"), pipeline.apply(op("+", 0, sym("z"), 0)));
    }

    @Test
    void emptyPipelineIsIdentity() {
        final Expression expression = op("+", 0, 1);
        assertSame(expression, RewritePipeline.builder(new Normalizer()).build().apply(expression));
    }
}
