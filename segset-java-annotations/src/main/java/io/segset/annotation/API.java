/*
 * API.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
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

package io.segset.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how far callers outside segset can rely on a public element staying as it is.
 *
 * <p>
 * Members inherit the status of their enclosing type unless they carry their own. A status may be raised in any
 * release; lowering one waits for the next minor release.
 * </p>
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
public @interface API {
    /**
     * The status of the annotated element.
     * @return how stable the element is
     */
    Status value();

    /**
     * Stability levels, least stable first.
     */
    enum Status {
        /**
         * Public only so that other segset modules can reach it. Not for outside use.
         */
        INTERNAL,

        /**
         * Kept for existing callers and due for removal in the next minor release.
         */
        DEPRECATED,

        /**
         * Still being worked out. Can change or go away in any release.
         */
        EXPERIMENTAL,

        /**
         * Fixed within a minor release line.
         */
        UNSTABLE,

        /**
         * Fixed until the next major release.
         */
        STABLE
    }
}
