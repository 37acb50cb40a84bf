/*
 * API.java
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

package io.symrewrite.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * An annotation used on public types, fields, and methods to indicate their level of stability for consumers of the
 * rewrite engine, such as the equation solver, the optimizer, or the compiler.
 *
 * <p>
 * If a class or interface is annotated with {@code API}, all of its fields and methods are considered to have that same
 * level of stability by default. However, this may be changed by annotating a member explicitly.
 * </p>
 *
 * <p>
 * An API may have its stability status become more stable (see {@link Status}) at any time, including before the next
 * minor release. However, an API must not become less stable in the next minor release.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the API element.
     * @return the current stability status of the annotated element
     */
    Status value();

    /**
     * An enum of possible API stability statuses, arranged in increasing order of stability.
     */
    enum Status {
        /**
         * Should not to be used by external code. This API is {@code public} only because it is needed by another
         * package within the engine. May change at any time, without prior notice.
         */
        INTERNAL,

        /**
         * Deprecated code that should not be used in new code. May be removed in the next minor release.
         */
        DEPRECATED,

        /**
         * Used for new features under development where the API has not yet stabilized. May be used by collaborators
         * with caution, since it may change or be removed without notice.
         */
        EXPERIMENTAL,

        /**
         * Used by APIs that may change in the next minor release without prior notice.
         */
        UNSTABLE,

        /**
         * Used by APIs that are maintained and shall not change in a backwards-incompatible way before the next minor
         * release.
         */
        MAINTAINED,

        /**
         * Used for APIs that shall not be changed in a backwards-incompatible way or removed until the next major release.
         */
        STABLE
    }
}
