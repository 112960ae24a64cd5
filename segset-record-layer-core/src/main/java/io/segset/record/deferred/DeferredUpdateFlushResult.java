/*
 * DeferredUpdateFlushResult.java
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

package io.segset.record.deferred;

import io.segset.annotation.API;

/**
 * What a flush of deferred updates did to the stored segments.
 */
@API(API.Status.UNSTABLE)
public class DeferredUpdateFlushResult {
    public static final DeferredUpdateFlushResult EMPTY = new DeferredUpdateFlushResult(0, 0, 0, 0);

    private final int segmentsRead;
    private final int segmentsWritten;
    private final int segmentsDeleted;
    private final int segmentsUnchanged;

    public DeferredUpdateFlushResult(int segmentsRead, int segmentsWritten, int segmentsDeleted, int segmentsUnchanged) {
        this.segmentsRead = segmentsRead;
        this.segmentsWritten = segmentsWritten;
        this.segmentsDeleted = segmentsDeleted;
        this.segmentsUnchanged = segmentsUnchanged;
    }

    /**
     * Get the number of segments read, which is the number of distinct segments the flush touched.
     * @return the number of segments read
     */
    public int getSegmentsRead() {
        return segmentsRead;
    }

    public int getSegmentsWritten() {
        return segmentsWritten;
    }

    public int getSegmentsDeleted() {
        return segmentsDeleted;
    }

    /**
     * Get the number of segments that the updates left as they were, which were therefore not written.
     * @return the number of unchanged segments
     */
    public int getSegmentsUnchanged() {
        return segmentsUnchanged;
    }

    @Override
    public String toString() {
        return "DeferredUpdateFlushResult{read=" + segmentsRead + ", written=" + segmentsWritten
               + ", deleted=" + segmentsDeleted + ", unchanged=" + segmentsUnchanged + "}";
    }
}
