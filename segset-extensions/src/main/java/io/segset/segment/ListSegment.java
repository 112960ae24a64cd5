/*
 * ListSegment.java
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
import com.google.common.base.Verify;
import io.segset.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * A segment holding between two and {@link SegmentSize#getListThreshold()} records as a sorted array of offsets.
 */
@API(API.Status.UNSTABLE)
public final class ListSegment extends AbstractSegment {
    @Nonnull
    private final int[] offsets;

    /**
     * Create a list segment. The array must be sorted and free of duplicates and is not copied.
     */
    ListSegment(@Nonnull SegmentSize segmentSize, @Nonnull int[] offsets) {
        super(segmentSize);
        Verify.verify(offsets.length >= 2 && offsets.length <= segmentSize.getListThreshold(),
                "list segment with %s offsets", offsets.length);
        this.offsets = offsets;
    }

    @Nonnull
    @Override
    public SegmentKind getKind() {
        return SegmentKind.LIST;
    }

    @Override
    public int count() {
        return offsets.length;
    }

    @Override
    public boolean contains(int offset) {
        segmentSize.checkOffset(offset);
        return Arrays.binarySearch(offsets, offset) >= 0;
    }

    @Nonnull
    @Override
    public Segment add(int offset) {
        segmentSize.checkOffset(offset);
        int index = Arrays.binarySearch(offsets, offset);
        if (index >= 0) {
            return this;
        }
        int insertAt = -(index + 1);
        int[] added = new int[offsets.length + 1];
        System.arraycopy(offsets, 0, added, 0, insertAt);
        added[insertAt] = offset;
        System.arraycopy(offsets, insertAt, added, insertAt + 1, offsets.length - insertAt);
        return Segments.fromSortedOffsets(segmentSize, added, added.length);
    }

    @Nullable
    @Override
    public Segment remove(int offset) {
        segmentSize.checkOffset(offset);
        int index = Arrays.binarySearch(offsets, offset);
        if (index < 0) {
            return this;
        }
        int[] removed = new int[offsets.length - 1];
        System.arraycopy(offsets, 0, removed, 0, index);
        System.arraycopy(offsets, index + 1, removed, index, offsets.length - index - 1);
        return Segments.fromSortedOffsets(segmentSize, removed, removed.length);
    }

    @Override
    public int ceiling(int offset) {
        int index = rank(Math.max(offset, 0));
        return index < offsets.length ? offsets[index] : NO_OFFSET;
    }

    @Override
    public int floor(int offset) {
        if (offset < 0) {
            return NO_OFFSET;
        }
        int index = rank(offset == Integer.MAX_VALUE ? offset : offset + 1) - 1;
        return index >= 0 ? offsets[index] : NO_OFFSET;
    }

    @Override
    public int rank(int offset) {
        int index = Arrays.binarySearch(offsets, offset);
        return index >= 0 ? index : -(index + 1);
    }

    @Override
    public int select(int position) {
        Preconditions.checkElementIndex(position, offsets.length);
        return offsets[position];
    }

    @Nonnull
    @Override
    public int[] toOffsets() {
        return Arrays.copyOf(offsets, offsets.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ListSegment)) {
            return false;
        }
        ListSegment that = (ListSegment)o;
        return Arrays.equals(offsets, that.offsets) && segmentSize.equals(that.segmentSize);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    @Override
    public String toString() {
        return "ListSegment" + Arrays.toString(offsets);
    }
}
