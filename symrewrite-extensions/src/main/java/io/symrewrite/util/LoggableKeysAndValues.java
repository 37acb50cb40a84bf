/*
 * LoggableKeysAndValues.java
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

package io.symrewrite.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Something that carries structured key/value information meant to end up in a log line.
 * @param <T> the implementing type, returned from the fluent {@code addLogInfo} methods
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the log information as a map.
     *
     * @return a single map with all log information
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Add a key/value pair to the log information.
     *
     * @param description description of the log info pair
     * @param object value of the log info pair
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Add a flattened list of key/value pairs to the log information. Every even element is a key
     * and every odd element is the value of the key preceding it.
     *
     * @param keyValue flattened map of key-value pairs
     * @return this object
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object ... keyValue);

    /**
     * Export the log information to a flattened array, in the same format accepted by {@link #addLogInfo(Object...)}.
     *
     * @return a flattened map of key-value pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
