/*
 * LoggableExceptionTest.java
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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link LoggableException}.
 */
class LoggableExceptionTest {

    @Test
    void keysAndValuesFromConstructor() {
        final LoggableException e = new LoggableException("bad rule", "rule", "remove-zero", "variable", "?x");
        assertEquals("remove-zero", e.getLogInfo().get("rule"));
        assertEquals("?x", e.getLogInfo().get("variable"));
        assertArrayEquals(new Object[] {"rule", "remove-zero", "variable", "?x"}, e.exportLogInfo());
    }

    @Test
    void messageIncludesLogInfo() {
        final LoggableException e = new LoggableException("bad rule").addLogInfo("pattern", "(+ 0 ?x)");
        assertEquals("bad rule pattern=\"(+ 0 ?x)\"", e.getMessage());
    }

    @Test
    void emptyLogInfo() {
        final LoggableException e = new LoggableException("plain");
        assertTrue(e.getLogInfo().isEmpty());
        assertEquals(0, e.exportLogInfo().length);
        assertEquals("plain", e.getMessage());
    }

    @Test
    void unbalancedKeyValues() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd", "key"));
    }
}
