/*
 * SegmentRangeException.java
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

package io.segset.segment;

import io.segset.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Exception thrown when an offset falls outside the bounds of a segment or a record number is negative.
 * This always indicates a logic error in the caller, such as using a record set with the wrong {@link SegmentSize}.
 */
@API(API.Status.UNSTABLE)
@SuppressWarnings("serial")
public class SegmentRangeException extends SegmentException {
    public SegmentRangeException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }
}
