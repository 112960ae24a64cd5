/*
 * AbstractSegment.java
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

import io.segset.bits.BitUtility;

import javax.annotation.Nonnull;
import java.util.Arrays;

/**
 * Shared state and behavior of the segment encodings.
 */
abstract class AbstractSegment implements Segment {
    @Nonnull
    protected final SegmentSize segmentSize;

    protected AbstractSegment(@Nonnull SegmentSize segmentSize) {
        this.segmentSize = segmentSize;
    }

    @Nonnull
    @Override
    public SegmentSize getSegmentSize() {
        return segmentSize;
    }

    @Override
    public int first() {
        return select(0);
    }

    @Override
    public int last() {
        return select(count() - 1);
    }

    @Nonnull
    @Override
    public byte[] toBitmapBytes() {
        byte[] bits = new byte[segmentSize.getBitmapBytes()];
        for (int offset : toOffsets()) {
            BitUtility.set(bits, offset);
        }
        return bits;
    }

    @Override
    public int hashCode() {
        return 31 * getKind().hashCode() + Arrays.hashCode(toOffsets());
    }
}
