/*
 * IntegerSegment.java
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

import com.google.common.base.Preconditions;
import io.segset.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A segment holding exactly one record.
 */
@API(API.Status.UNSTABLE)
public final class IntegerSegment extends AbstractSegment {
    private final int offset;

    /**
     * Create a segment holding the single given offset.
     * @param segmentSize the segment size
     * @param offset the offset of the record
     * @throws SegmentRangeException if the offset is out of range
     */
    public IntegerSegment(@Nonnull SegmentSize segmentSize, int offset) {
        super(segmentSize);
        segmentSize.checkOffset(offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }

    @Nonnull
    @Override
    public SegmentKind getKind() {
        return SegmentKind.INTEGER;
    }

    @Override
    public int count() {
        return 1;
    }

    @Override
    public boolean contains(int offset) {
        segmentSize.checkOffset(offset);
        return this.offset == offset;
    }

    @Nonnull
    @Override
    public Segment add(int offset) {
        segmentSize.checkOffset(offset);
        if (offset == this.offset) {
            return this;
        }
        int[] offsets = offset < this.offset ? new int[] {offset, this.offset} : new int[] {this.offset, offset};
        return Segments.fromSortedOffsets(segmentSize, offsets, offsets.length);
    }

    @Nullable
    @Override
    public Segment remove(int offset) {
        segmentSize.checkOffset(offset);
        return offset == this.offset ? null : this;
    }

    @Override
    public int first() {
        return offset;
    }

    @Override
    public int last() {
        return offset;
    }

    @Override
    public int ceiling(int offset) {
        return offset <= this.offset ? this.offset : NO_OFFSET;
    }

    @Override
    public int floor(int offset) {
        return offset >= this.offset ? this.offset : NO_OFFSET;
    }

    @Override
    public int rank(int offset) {
        return offset > this.offset ? 1 : 0;
    }

    @Override
    public int select(int position) {
        Preconditions.checkElementIndex(position, 1);
        return offset;
    }

    @Nonnull
    @Override
    public int[] toOffsets() {
        return new int[] {offset};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntegerSegment)) {
            return false;
        }
        IntegerSegment that = (IntegerSegment)o;
        return offset == that.offset && segmentSize.equals(that.segmentSize);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    @Override
    public String toString() {
        return "IntegerSegment{" + offset + "}";
    }
}
