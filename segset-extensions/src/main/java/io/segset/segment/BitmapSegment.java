/*
 * BitmapSegment.java
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
import io.segset.bits.BitUtility;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * A segment holding more than {@link SegmentSize#getListThreshold()} records as a bit per offset.
 * The bit vector always has exactly {@link SegmentSize#getBitmapBytes()} bytes.
 */
@API(API.Status.UNSTABLE)
public final class BitmapSegment extends AbstractSegment {
    @Nonnull
    private final byte[] bits;
    private final int count;

    /**
     * Create a bitmap segment. The array is not copied and {@code count} must be its population.
     */
    BitmapSegment(@Nonnull SegmentSize segmentSize, @Nonnull byte[] bits, int count) {
        super(segmentSize);
        Verify.verify(bits.length == segmentSize.getBitmapBytes(), "bitmap has %s bytes", bits.length);
        Verify.verify(count > segmentSize.getListThreshold(), "bitmap segment with %s records", count);
        this.bits = bits;
        this.count = count;
    }

    @Nonnull
    @Override
    public SegmentKind getKind() {
        return SegmentKind.BITMAP;
    }

    @Override
    public int count() {
        return count;
    }

    /**
     * Whether every offset of the segment is present.
     * @return {@code true} if the segment is full
     */
    public boolean isFull() {
        return count == segmentSize.getRecordsPerSegment();
    }

    @Override
    public boolean contains(int offset) {
        segmentSize.checkOffset(offset);
        return BitUtility.get(bits, offset);
    }

    @Nonnull
    @Override
    public Segment add(int offset) {
        if (contains(offset)) {
            return this;
        }
        byte[] added = Arrays.copyOf(bits, bits.length);
        BitUtility.set(added, offset);
        return new BitmapSegment(segmentSize, added, count + 1);
    }

    @Nullable
    @Override
    public Segment remove(int offset) {
        if (!contains(offset)) {
            return this;
        }
        byte[] removed = Arrays.copyOf(bits, bits.length);
        BitUtility.clear(removed, offset);
        return Segments.fromBitmap(segmentSize, removed, count - 1);
    }

    @Override
    public int ceiling(int offset) {
        return BitUtility.nextSetBit(bits, Math.max(offset, 0));
    }

    @Override
    public int floor(int offset) {
        return BitUtility.previousSetBit(bits, offset);
    }

    @Override
    public int rank(int offset) {
        return BitUtility.cardinalityBefore(bits, Math.min(Math.max(offset, 0), segmentSize.getRecordsPerSegment()));
    }

    @Override
    public int select(int position) {
        Preconditions.checkElementIndex(position, count);
        return BitUtility.selectSetBit(bits, position);
    }

    @Override
    public int first() {
        return BitUtility.nextSetBit(bits, 0);
    }

    @Override
    public int last() {
        return BitUtility.previousSetBit(bits, segmentSize.getRecordsPerSegment() - 1);
    }

    @Nonnull
    @Override
    public int[] toOffsets() {
        int[] offsets = new int[count];
        int index = 0;
        for (int offset = BitUtility.nextSetBit(bits, 0); offset != BitUtility.NO_BIT; offset = BitUtility.nextSetBit(bits, offset + 1)) {
            offsets[index++] = offset;
        }
        return offsets;
    }

    @Nonnull
    @Override
    public byte[] toBitmapBytes() {
        return Arrays.copyOf(bits, bits.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitmapSegment)) {
            return false;
        }
        BitmapSegment that = (BitmapSegment)o;
        return count == that.count && Arrays.equals(bits, that.bits) && segmentSize.equals(that.segmentSize);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    @Override
    public String toString() {
        return "BitmapSegment{count=" + count + "}";
    }
}
