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

package io.segset.record.logging;

import io.segset.annotation.API;

import javax.annotation.Nonnull;

/**
 * Common {@link KeyValueLogMessage} keys logged by the segset record layer core.
 * Keeping all of the keys in one place makes collisions easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // record sets
    SEGMENT_SIZE("segment_size"),
    RECORD_NUMBER("record_number"),
    UNIVERSE("universe"),
    // storage
    INDEX_VALUE("index_value"),
    SEGMENT_NUMBER("segment_number"),
    SUBSPACE("subspace"),
    OPERATION("operation"),
    ERROR_CODE("error_code"),
    // deferred update
    BUFFERED_UPDATES("buffered_updates"),
    MAX_BUFFERED_UPDATES("max_buffered_updates"),
    SEGMENT_COUNT("segment_count"),
    SEGMENTS_WRITTEN("segments_written"),
    SEGMENTS_DELETED("segments_deleted"),
    SEGMENTS_UNCHANGED("segments_unchanged"),
    RUN_COUNT("run_count"),
    RUN_INDEX("run_index"),
    TOTAL_MICROS("total_micros"),
    ROLLED_BACK("rolled_back");

    private final String logKey;

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
