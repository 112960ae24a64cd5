/*
 * Tags.java
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

package io.segset.test;

/**
 * Names for JUnit {@link org.junit.jupiter.api.Tag}s. The build excludes {@link #RequiresFDB} by default, so
 * a plain {@code mvn test} needs no FoundationDB cluster.
 */
@SuppressWarnings("PMD.FieldNamingConventions")
public final class Tags {
    /**
     * The test opens a FoundationDB database through the default cluster file.
     */
    public static final String RequiresFDB = "RequiresFDB";

    private Tags() {
    }
}
