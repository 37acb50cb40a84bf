/*
 * ChooseKTest.java
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

package io.symrewrite.engine.combinatorics;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ChooseK}.
 */
class ChooseKTest {
    @Test
    void lexicographicOrder() {
        final Iterable<List<String>> combinations = ChooseK.chooseK(ImmutableList.of("a", "b", "c", "d"), 2);
        assertThat(ImmutableList.copyOf(combinations), contains(
                ImmutableList.of("a", "b"),
                ImmutableList.of("a", "c"),
                ImmutableList.of("a", "d"),
                ImmutableList.of("b", "c"),
                ImmutableList.of("b", "d"),
                ImmutableList.of("c", "d")));
    }

    @Test
    void chooseNone() {
        final List<List<String>> combinations = ImmutableList.copyOf(ChooseK.chooseK(ImmutableList.of("a", "b"), 0));
        assertThat(combinations, hasSize(1));
        assertThat(combinations.get(0), empty());
    }

    @Test
    void chooseNoneOfNothing() {
        final List<List<String>> combinations = ImmutableList.copyOf(ChooseK.chooseK(ImmutableList.<String>of(), 0));
        assertThat(combinations, hasSize(1));
    }

    @Test
    void chooseAll() {
        assertThat(ImmutableList.copyOf(ChooseK.chooseK(ImmutableList.of(1, 2, 3), 3)),
                contains(ImmutableList.of(1, 2, 3)));
    }

    @Test
    void duplicatesAreDistinct() {
        assertThat(ImmutableList.copyOf(ChooseK.chooseK(ImmutableList.of("x", "x"), 1)),
                contains(ImmutableList.of("x"), ImmutableList.of("x")));
    }

    @Test
    void restartable() {
        final Iterable<List<Integer>> combinations = ChooseK.chooseK(ImmutableList.of(1, 2, 3), 2);
        assertEquals(ImmutableList.copyOf(combinations), ImmutableList.copyOf(combinations));
    }

    @Test
    void invalidK() {
        assertThrows(IllegalArgumentException.class, () -> ChooseK.chooseK(ImmutableList.of(1, 2), 3));
        assertThrows(IllegalArgumentException.class, () -> ChooseK.chooseK(ImmutableList.of(1, 2), -1));
    }

    static Stream<Arguments> binomials() {
        return Stream.of(
                Arguments.of(5, 0, 1),
                Arguments.of(5, 1, 5),
                Arguments.of(5, 2, 10),
                Arguments.of(6, 3, 20),
                Arguments.of(7, 7, 1));
    }

    @ParameterizedTest(name = "{0} choose {1}")
    @MethodSource("binomials")
    void countsAndUniqueness(int n, int k, int expected) {
        final ImmutableList.Builder<Integer> elements = ImmutableList.builder();
        for (int i = 0; i < n; i++) {
            elements.add(i);
        }
        final Iterable<List<Integer>> combinations = ChooseK.chooseK(elements.build(), k);
        assertEquals(expected, Iterables.size(combinations));
        assertEquals(expected, ImmutableSet.copyOf(combinations).size());
        for (final List<Integer> combination : combinations) {
            assertThat(combination, hasSize(k));
        }
    }
}
