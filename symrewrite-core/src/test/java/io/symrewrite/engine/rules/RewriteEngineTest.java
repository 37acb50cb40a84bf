/*
 * RewriteEngineTest.java
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

import io.symrewrite.engine.expressions.Expression;
import io.symrewrite.engine.expressions.Literal;
import io.symrewrite.engine.matching.ExtractorTable;
import io.symrewrite.engine.matching.Patterns;
import io.symrewrite.engine.matching.Substitution;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Optional;
import java.util.stream.Stream;

import static io.symrewrite.engine.TestExpressions.lit;
import static io.symrewrite.engine.TestExpressions.lvar;
import static io.symrewrite.engine.TestExpressions.op;
import static io.symrewrite.engine.TestExpressions.sym;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Tests for {@link RewriteEngine}.
 */
class RewriteEngineTest {
    private final RuleCompiler compiler = new RuleCompiler();
    private final RewriteEngine engine = new RewriteEngine();

    @Test
    void removeZeroWithPlainVariable() {
        final Rule rule = compiler.defineRule("remove-zero", op("+", 0, lvar("?x")), lvar("?x"));
        assertEquals(Optional.of(lit(2)), engine.applyRule(rule, op("+", 2, 0)));
        assertEquals(Optional.empty(), engine.applyRule(rule, op("+", 2, 1)));
    }

    @Test
    void removeZeroWithSequenceVariable() {
        final Rule rule = compiler.defineRule("remove-zero", op("+", 0, lvar("?&*")), op("+", lvar("?&*")));
        assertEquals(Optional.of(op("+", 1, 3)), engine.applyRule(rule, op("+", 1, 0, 3)));
        assertEquals(Optional.of(op("+")), engine.applyRule(rule, op("+", 0)));
        assertEquals(Optional.empty(), engine.applyRule(rule, op("+", 1, 3)));
    }

    @Test
    void swapOutOfOrderPair() {
        final Rule rule = compiler.defineRule("sort",
                op("°", lvar("?&*1"), lvar("?x"), lvar("?&*2"), lvar("?y"), lvar("?&*3")),
                op("°", lvar("?&*1"), lvar("?y"), lvar("?&*2"), lvar("?x"), lvar("?&*3")),
                Guards.greaterThan("?y", "?x"));
        assertEquals(Optional.of(op("°", 2, 1, 3)), engine.applyRule(rule, op("°", 1, 2, 3)));
        assertEquals(Optional.of(op("°", 3, 1, 2)), engine.applyRule(rule, op("°", 2, 1, 3)));
        assertEquals(Optional.empty(), engine.applyRule(rule, op("°", 3, 2, 1)));
    }

    @Test
    void removeZeroWithExtractor() {
        final Rule rule = compiler.defineRule("remove-zero",
                op("+", Patterns.extract("zero?", lvar("?x")), lvar("?&*")), op("+", lvar("?&*")));
        assertEquals(Optional.of(op("+", 1, 3)), engine.applyRule(rule, op("+", 1, 0, 3)));
        final Literal zeroMatrix = lit(new double[][] {{0.0, 0.0}, {0.0, 0.0}});
        assertEquals(Optional.of(op("+", 1, 3)), engine.applyRule(rule, op("+", 1, zeroMatrix, 3)));
        final Literal matrix = lit(new double[][] {{0.0, 1.0}, {0.0, 0.0}});
        assertEquals(Optional.empty(), engine.applyRule(rule, op("+", 1, matrix, 3)));
    }

    @Test
    void guardRejection() {
        final Rule rule = compiler.defineRule("inc", lvar("?x"), op("inc", lvar("?x")), Guards.isNumber("?x"));
        assertEquals(Optional.empty(), engine.applyRule(rule, sym("a")));
        assertEquals(Optional.of(op("inc", 5)), engine.applyRule(rule, lit(5)));
    }

    static Stream<Arguments> guardGatingCases() {
        return Stream.of(
                Arguments.of(lit(5)),
                Arguments.of(sym("a")),
                Arguments.of(op("f", 1)),
                Arguments.of(lit(-2.5)),
                Arguments.of(lit("text")));
    }

    @ParameterizedTest
    @MethodSource("guardGatingCases")
    void guardGating(Expression expression) {
        final Rule unguarded = compiler.defineRule("inc", lvar("?x"), op("inc", lvar("?x")));
        final Guard guard = Guards.isNumber("?x");
        final Rule guarded = compiler.defineRule("inc", lvar("?x"), op("inc", lvar("?x")), guard);
        final Optional<Expression> expected = engine.applyRule(unguarded, expression);
        final boolean accepted = guard.test(engine.match(unguarded.getPattern(), expression).iterator().next());
        assertEquals(accepted ? expected : Optional.empty(), engine.applyRule(guarded, expression));
    }

    @Test
    void guardBacktracksToNextSubstitution() {
        // the first match binds ?x to 1, which the guard rejects
        final Rule rule = compiler.defineRule("pick-big", op("+", lvar("?x"), lvar("?&*")), lvar("?x"),
                Guards.of(ImmutableSet.of("?x"),
                        substitution -> ((Literal)substitution.getBoundExpression("?x")).getNumericValue().intValue() > 5));
        assertEquals(Optional.of(lit(7)), engine.applyRule(rule, op("+", 1, 7, 3)));
    }

    @Test
    void transformWithoutResultBacktracks() {
        final Rule rule = compiler.defineRule("halve-even", op("+", lvar("?x"), lvar("?&*")),
                Transforms.of(ImmutableSet.of("?x"), substitution -> {
                    final int value = ((Literal)substitution.getBoundExpression("?x")).getNumericValue().intValue();
                    return value % 2 == 0 ? Optional.of(lit(value / 2)) : Optional.empty();
                }));
        assertEquals(Optional.of(lit(3)), engine.applyRule(rule, op("+", 1, 6, 3)));
        assertEquals(Optional.empty(), engine.applyRule(rule, op("+", 1, 3)));
    }

    @Test
    void firstResultOfTransformWins() {
        final Rule rule = compiler.defineRule("many", lvar("?x"),
                Transforms.ofMany(ImmutableSet.of("?x"), substitution -> ImmutableList.of(lit(1), lit(2))));
        assertEquals(Optional.of(lit(1)), engine.applyRule(rule, sym("a")));
    }

    @Test
    void templateSplicesSequenceIntoSurroundingChildren() {
        final Rule rule = compiler.defineRule("distribute",
                op("*", lvar("?a"), op("+", lvar("?&*"))),
                op("g", lvar("?a"), lvar("?&*"), lvar("?a")));
        assertEquals(Optional.of(op("g", sym("x"), 1, 2, sym("x"))),
                engine.applyRule(rule, op("*", sym("x"), op("+", 1, 2))));
    }

    @Test
    void applyRulesUsesDefinitionOrder() {
        final Rule specific = compiler.defineRule("specific", op("f", 1), lit("specific"));
        final Rule anything = compiler.defineRule("anything", lvar("?x"), lit("anything"), Guards.not(Guards.isLiteral("?x")));
        final Rule general = compiler.defineRule("general", op("f", lvar("?y")), lit("general"));
        final RuleSet ruleSet = RuleSet.of("ordered", specific, anything, general);

        assertEquals(Optional.of(lit("specific")), engine.applyRules(ruleSet, op("f", 1)));
        assertEquals(Optional.of(lit("anything")), engine.applyRules(ruleSet, op("f", 2)));
        assertEquals(Optional.of(lit("anything")), engine.applyRules(ruleSet, sym("s")));
        assertEquals(Optional.empty(), engine.applyRules(ruleSet, lit(3)));
    }

    @Test
    void applyRulesFallsThroughToLaterRules() {
        final Rule never = compiler.defineRule("never", op("f", lvar("?y")), lit("never"), Guards.isLiteral("?y"));
        final Rule general = compiler.defineRule("general", op("f", lvar("?y")), lit("general"));
        final RuleSet ruleSet = RuleSet.builder("fallthrough").add(never).add(general).build();
        assertEquals(Optional.of(lit("general")), engine.applyRules(ruleSet, op("f", sym("a"))));
        assertFalse(engine.applyRules(ruleSet, op("g", sym("a"))).isPresent());
    }

    @Test
    void extractorLeavingVariableUnboundIsNoMatch() {
        final ExtractorTable extractors = ExtractorTable.builder()
                .register("any?", (application, candidate, substitution, matcher) -> ImmutableList.of(substitution))
                .build();
        final Rule rule = new RuleCompiler(extractors).defineRule("unwrap-any",
                op("f", Patterns.extract("any?", lvar("?x"))), lvar("?x"));
        final RewriteEngine customEngine = new RewriteEngine(extractors);
        assertEquals(Optional.empty(), customEngine.applyRule(rule, op("f", sym("a"))));
        assertEquals(Optional.empty(), customEngine.applyRules(RuleSet.of("any", rule), op("f", sym("a"))));
    }

    @Test
    void substitutionWithUnboundVariableBacktracks() {
        final ExtractorTable extractors = ExtractorTable.builder()
                .register("literal-or-anything?", (application, candidate, substitution, matcher) ->
                        candidate instanceof Literal
                        ? matcher.unifyEach(application.getChildren(), candidate, substitution)
                        : ImmutableList.of(substitution))
                .build();
        final Rule rule = new RuleCompiler(extractors).defineRule("pick-literal",
                op("+", Patterns.extract("literal-or-anything?", lvar("?x")), lvar("?&*")),
                op("g", lvar("?x")), Guards.isLiteral("?x"));
        assertEquals(Optional.of(op("g", 5)), new RewriteEngine(extractors).applyRule(rule, op("+", sym("a"), 5)));
    }

    @Test
    void templateWithUnboundVariableHasNoResult() {
        final Transform transform = Transforms.template(op("g", lvar("?x"), lvar("?&*")));
        assertFalse(transform.apply(Substitution.empty()).iterator().hasNext());
        final Substitution partial = Substitution.empty().bindVariable("?x", lit(1)).orElseThrow();
        assertFalse(transform.apply(partial).iterator().hasNext());
        final Substitution complete = partial.bindSequence("?&*", ImmutableList.of(lit(2)), true).orElseThrow();
        assertEquals(ImmutableList.of(op("g", 1, 2)), ImmutableList.copyOf(transform.apply(complete)));
    }

    @Test
    void functionReturningNullHasNoResult() {
        final Rule rule = compiler.defineRule("null-result", lvar("?x"),
                Transforms.ofMany(ImmutableSet.of("?x"), substitution -> null));
        assertEquals(Optional.empty(), engine.applyRule(rule, sym("a")));
    }
}
