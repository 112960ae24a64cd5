/*
 * SegmentStorageException.java
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

package io.segset.record.storage;

import io.segset.annotation.API;
import io.segset.record.RecordCoreException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Exception thrown by a {@link SegmentStorageAdapter} when the underlying store fails. The record layer never
 * retries or translates these; they reach the caller unchanged.
 */
@API(API.Status.UNSTABLE)
@SuppressWarnings("serial")
public class SegmentStorageException extends RecordCoreException {
    public SegmentStorageException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public SegmentStorageException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
