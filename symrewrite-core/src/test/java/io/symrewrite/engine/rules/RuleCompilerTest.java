/*
 * RuleCompilerTest.java
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

import io.symrewrite.engine.RuleConstructionException;
import io.symrewrite.engine.expressions.ExpressionFactory;
import io.symrewrite.engine.expressions.MatcherClass;
import io.symrewrite.engine.expressions.OperatorProperties;
import io.symrewrite.engine.matching.ExtractorApplication;
import io.symrewrite.engine.matching.LogicVariable;
import io.symrewrite.engine.matching.Patterns;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static io.symrewrite.engine.TestExpressions.SYMBOLS;
import static io.symrewrite.engine.TestExpressions.lit;
import static io.symrewrite.engine.TestExpressions.lvar;
import static io.symrewrite.engine.TestExpressions.op;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RuleCompiler}.
 */
class RuleCompilerTest {
    private final RuleCompiler compiler = new RuleCompiler();

    @Test
    void twoSequenceVariablesInCommutativePattern() {
        final RuleConstructionException e = assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("+", lvar("?&*1"), lvar("?&*2")), op("+", lvar("?&*1"))));
        assertEquals("bad", e.getLogInfo().get("rule"));
        assertThat(e.getMessage(), containsString("more than one sequence variable"));
    }

    @Test
    void twoSequenceVariablesInNestedCommutativePattern() {
        assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("f", op("*", lvar("?&*1"), 2, lvar("?&+2"))), lit(0)));
    }

    @Test
    void severalSequenceVariablesInFixedPattern() {
        final Rule rule = compiler.defineRule("ok", op("f", lvar("?&*1"), lvar("?x"), lvar("?&*2")), op("f", lvar("?x")));
        assertEquals(Optional.of("f"), rule.getRootOperator());
    }

    @Test
    void unknownExtractor() {
        final RuleConstructionException e = assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("+", Patterns.extract("nope?", lvar("?x")), lvar("?&*")), op("+", lvar("?&*"))));
        assertEquals("nope?", e.getLogInfo().get("extractor"));
    }

    @Test
    void extractorsAreResolved() {
        final Rule rule = compiler.defineRule("remove-zero",
                op("+", Patterns.extract("zero?", lvar("?x")), lvar("?&*")), op("+", lvar("?&*")));
        final ExtractorApplication application = (ExtractorApplication)rule.getPattern().getChildren().get(0);
        assertTrue(application.isResolved());
    }

    @Test
    void extractorBackedOperatorsBecomeApplications() {
        final ExpressionFactory factory = new ExpressionFactory(SYMBOLS.asBuilder()
                .define("zero?", OperatorProperties.builder().setMatcherClass(MatcherClass.EXTRACTOR_BACKED).build())
                .build());
        final Rule rule = compiler.defineRule("remove-zero",
                factory.op("+", factory.op("zero?", lvar("?x")), lvar("?&*")), factory.op("+", lvar("?&*")));
        assertThat(rule.getPattern().getChildren().get(0), instanceOf(ExtractorApplication.class));
    }

    @Test
    void guardReferencesUnboundVariable() {
        final RuleConstructionException e = assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("f", lvar("?x")), lvar("?x"), Guards.isNumber("?y")));
        assertEquals("?y", e.getLogInfo().get("variable"));
    }

    @Test
    void templateReferencesUnboundVariable() {
        assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("f", lvar("?x")), op("g", lvar("?x"), lvar("?z"))));
    }

    @Test
    void functionTransformReferencesUnboundVariable() {
        assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("f", lvar("?x")),
                        Transforms.of(ImmutableSet.of("?w"), substitution -> Optional.of(lit(1)))));
    }

    @Test
    void templateUsesVariableWithOtherKind() {
        assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("f", lvar("?&*")), op("g", new LogicVariable("?&*"))));
    }

    @Test
    void inconsistentVariableKindsInPattern() {
        assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("f", lvar("?x"), Patterns.seq("?x")), lit(0)));
        assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("f", Patterns.seq("?&a"), Patterns.seq1("?&a")), lit(0)));
    }

    @Test
    void templateWithExtractor() {
        assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", lvar("?x"), op("f", Patterns.extract("zero?", lvar("?x")))));
    }

    @Test
    void templateIsSequenceVariable() {
        assertThrows(RuleConstructionException.class,
                () -> compiler.defineRule("bad", op("f", lvar("?&*")), lvar("?&*")));
    }

    @Test
    void extractorArgumentsCountAsBound() {
        final Rule rule = compiler.defineRule("ok",
                op("+", Patterns.extract("zero?", lvar("?z")), lvar("?&*")), op("+", lvar("?z"), lvar("?&*")),
                Guards.isNumber("?z"));
        assertEquals("ok", rule.getName());
    }

    @Test
    void rootOperator() {
        assertEquals(Optional.of("+"), compiler.defineRule("r", op("+", 0, lvar("?x")), lvar("?x")).getRootOperator());
        assertFalse(compiler.defineRule("r", lvar("?x"), op("inc", lvar("?x"))).getRootOperator().isPresent());
        assertFalse(compiler.defineRule("r", Patterns.extract("zero?"), lit(0)).getRootOperator().isPresent());
    }
}
