/*
 * Segments.java
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
import io.segset.bits.BitUtility;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * Construction of segments under the size policy, and set operations between segments.
 *
 * <p>
 * The size policy picks the encoding from the number of records alone:
 * </p>
 * <ul>
 *     <li>no records: no segment ({@code null})</li>
 *     <li>one record: {@link IntegerSegment}</li>
 *     <li>up to {@link SegmentSize#getListThreshold()} records: {@link ListSegment}</li>
 *     <li>more: {@link BitmapSegment}</li>
 * </ul>
 * <p>
 * The policy is applied after every operation, in both directions, so a bitmap that loses records down to the
 * threshold becomes a list again.
 * </p>
 *
 * <p>
 * Set operations accept {@code null} as the empty segment. When either operand is a bitmap they work on the bit
 * vectors, otherwise they merge the sorted offset arrays.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class Segments {
    private Segments() {
    }

    /**
     * Build a segment from offsets in any order, possibly with duplicates.
     * @param segmentSize the segment size
     * @param offsets the offsets
     * @return the segment holding the distinct offsets, or {@code null} if there are none
     * @throws SegmentRangeException if any offset is out of range
     */
    @Nullable
    public static Segment of(@Nonnull SegmentSize segmentSize, @Nonnull int... offsets) {
        for (int offset : offsets) {
            segmentSize.checkOffset(offset);
        }
        int[] sorted = Arrays.copyOf(offsets, offsets.length);
        Arrays.sort(sorted);
        int length = dedupe(sorted);
        return fromSortedOffsets(segmentSize, sorted, length);
    }

    /**
     * Build a segment from an ascending, duplicate-free prefix of an array. The array may be kept by the result.
     */
    @Nullable
    static Segment fromSortedOffsets(@Nonnull SegmentSize segmentSize, @Nonnull int[] offsets, int length) {
        if (length == 0) {
            return null;
        }
        if (length == 1) {
            return new IntegerSegment(segmentSize, offsets[0]);
        }
        if (length <= segmentSize.getListThreshold()) {
            return new ListSegment(segmentSize, length == offsets.length ? offsets : Arrays.copyOf(offsets, length));
        }
        byte[] bits = new byte[segmentSize.getBitmapBytes()];
        for (int i = 0; i < length; i++) {
            BitUtility.set(bits, offsets[i]);
        }
        return new BitmapSegment(segmentSize, bits, length);
    }

    /**
     * Build a segment from a bit vector. The array may be kept by the result.
     */
    @Nullable
    static Segment fromBitmap(@Nonnull SegmentSize segmentSize, @Nonnull byte[] bits, int count) {
        if (count > segmentSize.getListThreshold()) {
            return new BitmapSegment(segmentSize, bits, count);
        }
        int[] offsets = new int[count];
        int index = 0;
        for (int offset = BitUtility.nextSetBit(bits, 0); offset != BitUtility.NO_BIT; offset = BitUtility.nextSetBit(bits, offset + 1)) {
            offsets[index++] = offset;
        }
        return fromSortedOffsets(segmentSize, offsets, count);
    }

    /**
     * Build a segment from a bit vector of {@link SegmentSize#getBitmapBytes()} bytes.
     * @param segmentSize the segment size
     * @param bits the bit vector, which is copied
     * @return the segment holding the set bits, or {@code null} if no bit is set
     */
    @Nullable
    public static Segment fromBitmap(@Nonnull SegmentSize segmentSize, @Nonnull byte[] bits) {
        Preconditions.checkArgument(bits.length == segmentSize.getBitmapBytes(), "bitmap must have %s bytes", segmentSize.getBitmapBytes());
        byte[] copy = Arrays.copyOf(bits, bits.length);
        return fromBitmap(segmentSize, copy, BitUtility.cardinality(copy));
    }

    /**
     * Get the segment holding every offset below {@code limit}.
     * @param segmentSize the segment size
     * @param limit number of leading offsets, at most the segment size
     * @return the segment, or {@code null} if {@code limit} is zero
     */
    @Nullable
    public static Segment prefix(@Nonnull SegmentSize segmentSize, int limit) {
        Preconditions.checkArgument(limit >= 0 && limit <= segmentSize.getRecordsPerSegment(), "limit out of range: %s", limit);
        if (limit <= segmentSize.getListThreshold()) {
            int[] offsets = new int[limit];
            for (int i = 0; i < limit; i++) {
                offsets[i] = i;
            }
            return fromSortedOffsets(segmentSize, offsets, limit);
        }
        byte[] bits = new byte[segmentSize.getBitmapBytes()];
        BitUtility.setRange(bits, 0, limit);
        return new BitmapSegment(segmentSize, bits, limit);
    }

    /**
     * Get the segment holding every offset.
     * @param segmentSize the segment size
     * @return a full bitmap segment
     */
    @Nonnull
    public static Segment full(@Nonnull SegmentSize segmentSize) {
        return prefix(segmentSize, segmentSize.getRecordsPerSegment());
    }

    @Nullable
    public static Segment union(@Nullable Segment a, @Nullable Segment b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        SegmentSize segmentSize = commonSize(a, b);
        if (a.getKind() == SegmentKind.BITMAP || b.getKind() == SegmentKind.BITMAP) {
            byte[] bits = BitUtility.or(a.toBitmapBytes(), b.toBitmapBytes());
            return fromBitmap(segmentSize, bits, BitUtility.cardinality(bits));
        }
        int[] x = a.toOffsets();
        int[] y = b.toOffsets();
        int[] result = new int[x.length + y.length];
        int i = 0;
        int j = 0;
        int n = 0;
        while (i < x.length && j < y.length) {
            if (x[i] < y[j]) {
                result[n++] = x[i++];
            } else if (x[i] > y[j]) {
                result[n++] = y[j++];
            } else {
                result[n++] = x[i++];
                j++;
            }
        }
        while (i < x.length) {
            result[n++] = x[i++];
        }
        while (j < y.length) {
            result[n++] = y[j++];
        }
        return fromSortedOffsets(segmentSize, result, n);
    }

    @Nullable
    public static Segment intersection(@Nullable Segment a, @Nullable Segment b) {
        if (a == null || b == null) {
            return null;
        }
        SegmentSize segmentSize = commonSize(a, b);
        if (a.getKind() == SegmentKind.BITMAP && b.getKind() == SegmentKind.BITMAP) {
            byte[] bits = BitUtility.and(a.toBitmapBytes(), b.toBitmapBytes());
            return fromBitmap(segmentSize, bits, BitUtility.cardinality(bits));
        }
        if (a.getKind() == SegmentKind.BITMAP || b.getKind() == SegmentKind.BITMAP) {
            // probe the bitmap with the smaller side
            Segment bitmap = a.getKind() == SegmentKind.BITMAP ? a : b;
            int[] probe = (bitmap == a ? b : a).toOffsets();
            return filter(segmentSize, probe, bitmap, true);
        }
        int[] x = a.toOffsets();
        int[] y = b.toOffsets();
        int[] result = new int[Math.min(x.length, y.length)];
        int i = 0;
        int j = 0;
        int n = 0;
        while (i < x.length && j < y.length) {
            if (x[i] < y[j]) {
                i++;
            } else if (x[i] > y[j]) {
                j++;
            } else {
                result[n++] = x[i++];
                j++;
            }
        }
        return fromSortedOffsets(segmentSize, result, n);
    }

    @Nullable
    public static Segment difference(@Nullable Segment a, @Nullable Segment b) {
        if (a == null || b == null) {
            return a;
        }
        SegmentSize segmentSize = commonSize(a, b);
        if (a.getKind() == SegmentKind.BITMAP) {
            byte[] bits = BitUtility.andNot(a.toBitmapBytes(), b.toBitmapBytes());
            return fromBitmap(segmentSize, bits, BitUtility.cardinality(bits));
        }
        return filter(segmentSize, a.toOffsets(), b, false);
    }

    @Nullable
    public static Segment symmetricDifference(@Nullable Segment a, @Nullable Segment b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        SegmentSize segmentSize = commonSize(a, b);
        if (a.getKind() == SegmentKind.BITMAP || b.getKind() == SegmentKind.BITMAP) {
            byte[] bits = BitUtility.xor(a.toBitmapBytes(), b.toBitmapBytes());
            return fromBitmap(segmentSize, bits, BitUtility.cardinality(bits));
        }
        int[] x = a.toOffsets();
        int[] y = b.toOffsets();
        int[] result = new int[x.length + y.length];
        int i = 0;
        int j = 0;
        int n = 0;
        while (i < x.length && j < y.length) {
            if (x[i] < y[j]) {
                result[n++] = x[i++];
            } else if (x[i] > y[j]) {
                result[n++] = y[j++];
            } else {
                i++;
                j++;
            }
        }
        while (i < x.length) {
            result[n++] = x[i++];
        }
        while (j < y.length) {
            result[n++] = y[j++];
        }
        return fromSortedOffsets(segmentSize, result, n);
    }

    /**
     * Get the offsets below {@code limit} that are not in the given segment.
     * @param segment the segment to complement, or {@code null} for the empty segment
     * @param segmentSize the segment size
     * @param limit number of leading offsets that make up the universe of this segment
     * @return the complement, or {@code null} if it is empty
     */
    @Nullable
    public static Segment complement(@Nullable Segment segment, @Nonnull SegmentSize segmentSize, int limit) {
        Segment universe = prefix(segmentSize, limit);
        if (segment != null) {
            Preconditions.checkArgument(segment.getSegmentSize().equals(segmentSize), "segment sizes differ");
        }
        return difference(universe, segment);
    }

    /**
     * Add offsets to a segment.
     * @param segment the segment, or {@code null} for the empty segment
     * @param segmentSize the segment size
     * @param offsets the offsets to add, in any order
     * @return the resulting segment, or {@code null} if it is empty
     */
    @Nullable
    public static Segment addAll(@Nullable Segment segment, @Nonnull SegmentSize segmentSize, @Nonnull int... offsets) {
        return union(segment, of(segmentSize, offsets));
    }

    @Nullable
    public static Segment removeAll(@Nullable Segment segment, @Nonnull SegmentSize segmentSize, @Nonnull int... offsets) {
        return difference(segment, of(segmentSize, offsets));
    }

    @Nullable
    private static Segment filter(@Nonnull SegmentSize segmentSize, @Nonnull int[] offsets, @Nonnull Segment other, boolean keepContained) {
        int[] result = new int[offsets.length];
        int n = 0;
        for (int offset : offsets) {
            if (other.contains(offset) == keepContained) {
                result[n++] = offset;
            }
        }
        return fromSortedOffsets(segmentSize, result, n);
    }

    @Nonnull
    private static SegmentSize commonSize(@Nonnull Segment a, @Nonnull Segment b) {
        Preconditions.checkArgument(a.getSegmentSize().equals(b.getSegmentSize()),
                "segment sizes differ: %s != %s", a.getSegmentSize(), b.getSegmentSize());
        return a.getSegmentSize();
    }

    private static int dedupe(@Nonnull int[] sorted) {
        if (sorted.length == 0) {
            return 0;
        }
        int n = 1;
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] != sorted[n - 1]) {
                sorted[n++] = sorted[i];
            }
        }
        return n;
    }
}
