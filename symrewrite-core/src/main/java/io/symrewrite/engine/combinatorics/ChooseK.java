/*
 * ChooseK.java
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

import io.symrewrite.annotation.API;
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;

/**
 * Utility class to provide helpers related to enumeration of {@code n choose k}.
 *
 * <p>
 * Combinations are enumerated lazily and in lexicographic order of the positions of the chosen elements in the input,
 * that is, for {@code (a, b, c)} and {@code k = 2} the iteration order is {@code (a, b)}, {@code (a, c)},
 * {@code (b, c)}. The iterator only keeps the positions of the current combination, it never materializes all
 * combinations at once. Equal elements at different positions are treated as distinct.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class ChooseK {

    private ChooseK() {
        // prevent instantiation
    }

    /**
     * Create an {@link Iterable} of the choose-K sets of the given elements.
     * @param elements the elements to choose from
     * @param numberOfElementsToChoose number {@code k} of elements to choose
     * @param <T> type
     * @return a new {@link Iterable} whose iterators return every combination of {@code k} elements exactly once
     */
    @Nonnull
    public static <T> Iterable<List<T>> chooseK(@Nonnull final Collection<? extends T> elements, final int numberOfElementsToChoose) {
        Preconditions.checkArgument(numberOfElementsToChoose >= 0 && numberOfElementsToChoose <= elements.size(),
                "cannot choose %s out of %s elements", numberOfElementsToChoose, elements.size());
        final List<T> elementsAsList = ImmutableList.copyOf(elements);
        return () -> new ChooseKIterator<>(elementsAsList, numberOfElementsToChoose);
    }

    private static class ChooseKIterator<T> extends AbstractIterator<List<T>> {
        @Nonnull
        private final List<T> elements;
        private final int numberOfElementsToChoose;

        //
        // positions[i] is the index into elements bound at level i. Levels are strictly increasing so every
        // combination is produced exactly once. null means we have not produced the first combination yet.
        //
        @Nullable
        private int[] positions;

        private ChooseKIterator(@Nonnull final List<T> elements, final int numberOfElementsToChoose) {
            this.elements = elements;
            this.numberOfElementsToChoose = numberOfElementsToChoose;
        }

        @Nullable
        @Override
        protected List<T> computeNext() {
            if (positions == null) {
                positions = new int[numberOfElementsToChoose];
                for (int i = 0; i < numberOfElementsToChoose; i++) {
                    positions[i] = i;
                }
                return current();
            }

            //
            // Find the deepest level that can still be advanced. Level i can move at most to
            // n - k + i, otherwise the levels below it run out of elements.
            //
            int level = numberOfElementsToChoose - 1;
            while (level >= 0 && positions[level] == elements.size() - numberOfElementsToChoose + level) {
                level--;
            }
            if (level < 0) {
                return endOfData();
            }

            // advance that level and rebind all levels below it to the smallest positions possible
            positions[level]++;
            for (int i = level + 1; i < numberOfElementsToChoose; i++) {
                positions[i] = positions[i - 1] + 1;
            }
            return current();
        }

        @Nonnull
        private List<T> current() {
            final ImmutableList.Builder<T> resultBuilder = ImmutableList.builderWithExpectedSize(numberOfElementsToChoose);
            for (final int position : positions) {
                resultBuilder.add(elements.get(position));
            }
            return resultBuilder.build();
        }
    }
}
