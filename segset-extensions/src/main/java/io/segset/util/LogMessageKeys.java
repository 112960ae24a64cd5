/*
 * LogMessageKeys.java
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

package io.segset.util;

import io.segset.annotation.API;

import java.util.Locale;

/**
 * Common {@link LoggableException} keys logged by the segset extensions library.
 * Keeping all of the keys in one place makes collisions easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // configuration
    SEGMENT_SIZE,
    LIST_THRESHOLD,

    // segments
    SEGMENT_KIND,
    OFFSET,
    RECORD_NUMBER,
    POSITION,
    COUNT,

    // encoding
    TAG,
    LENGTH,
    EXPECTED_LENGTH,
    ;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return logKey;
    }
}
