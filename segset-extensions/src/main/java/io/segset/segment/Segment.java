/*
 * Segment.java
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
 * The records of one segment that satisfy some condition, as offsets within the segment.
 *
 * <p>
 * Segments are immutable. Mutating operations return the resulting segment, re-encoded according to the size policy
 * of {@link Segments}: one record is an {@link IntegerSegment}, up to {@link SegmentSize#getListThreshold()} records
 * are a {@link ListSegment}, and anything larger is a {@link BitmapSegment}. A segment never holds zero records;
 * operations that would empty it return {@code null}. Because every content has exactly one encoding, two segments
 * are equal exactly when they hold the same offsets.
 * </p>
 *
 * <p>
 * Offsets passed to {@link #contains}, {@link #add} and {@link #remove} must lie in {@code [0, segmentSize)}, or a
 * {@link SegmentRangeException} is thrown.
 * </p>
 */
@API(API.Status.UNSTABLE)
public interface Segment {
    /**
     * Returned by the search methods when there is no matching offset.
     */
    int NO_OFFSET = -1;

    @Nonnull
    SegmentKind getKind();

    @Nonnull
    SegmentSize getSegmentSize();

    /**
     * Get the number of records in this segment.
     * @return the number of records, always at least one
     */
    int count();

    boolean contains(int offset);

    /**
     * Add an offset. Adding an offset that is already present returns this segment.
     * @param offset the offset to add
     * @return the segment with the offset added
     */
    @Nonnull
    Segment add(int offset);

    /**
     * Remove an offset. Removing an absent offset returns this segment.
     * @param offset the offset to remove
     * @return the segment without the offset, or {@code null} if no records remain
     */
    @Nullable
    Segment remove(int offset);

    int first();

    int last();

    /**
     * Get the smallest offset greater than or equal to the given one.
     * @param offset where to start looking; values at or past the segment size find nothing
     * @return the offset found or {@link #NO_OFFSET}
     */
    int ceiling(int offset);

    /**
     * Get the largest offset less than or equal to the given one.
     * @param offset where to start looking; negative values find nothing
     * @return the offset found or {@link #NO_OFFSET}
     */
    int floor(int offset);

    /**
     * Get the number of offsets in this segment that are less than the given one.
     * @param offset an offset in {@code [0, segmentSize]}
     * @return the number of smaller offsets
     */
    int rank(int offset);

    /**
     * Get the offset at a position in ascending order.
     * @param position a zero-based position less than {@link #count()}
     * @return the offset at that position
     * @throws IndexOutOfBoundsException if the position is out of range
     */
    int select(int position);

    /**
     * Get the offsets of this segment in ascending order.
     * @return a new array of offsets
     */
    @Nonnull
    int[] toOffsets();

    /**
     * Get this segment as a bit vector with one bit per offset, most significant bit first.
     * @return a new array of {@link SegmentSize#getBitmapBytes()} bytes
     */
    @Nonnull
    byte[] toBitmapBytes();
}
