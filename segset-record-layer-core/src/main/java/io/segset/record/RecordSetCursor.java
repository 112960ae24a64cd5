/*
 * RecordSetCursor.java
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

package io.segset.record;

import com.google.common.collect.ImmutableSortedMap;
import io.segset.annotation.API;
import io.segset.segment.Segment;
import io.segset.segment.SegmentSize;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.NavigableMap;

/**
 * A bidirectional cursor over the records of a {@link RecordSet} in ascending order.
 *
 * <p>
 * The cursor is either before the first record, on a record, or after the last record. It starts before the first
 * record. Each movement returns the record number it lands on, or {@code null} when it moves off either end.
 * </p>
 *
 * <p>
 * The cursor reads a snapshot of the segments taken when it was opened. Changes made to the record set afterwards are
 * not visible through it; open a new cursor to see them.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class RecordSetCursor {
    private enum Position {
        BEFORE_FIRST,
        ON_RECORD,
        AFTER_LAST
    }

    @Nonnull
    private final SegmentSize segmentSize;
    @Nonnull
    private final ImmutableSortedMap<Long, Segment> segments;
    @Nonnull
    private Position position = Position.BEFORE_FIRST;
    private long segmentNumber;
    private int offset;

    RecordSetCursor(@Nonnull SegmentSize segmentSize, @Nonnull NavigableMap<Long, Segment> segments) {
        this.segmentSize = segmentSize;
        this.segments = ImmutableSortedMap.copyOfSorted(segments);
    }

    /**
     * Move to the first record.
     * @return the first record number, or {@code null} if the set is empty
     */
    @Nullable
    public Long first() {
        Map.Entry<Long, Segment> entry = segments.firstEntry();
        if (entry == null) {
            return toAfterLast();
        }
        return moveTo(entry.getKey(), entry.getValue().first());
    }

    /**
     * Move to the last record.
     * @return the last record number, or {@code null} if the set is empty
     */
    @Nullable
    public Long last() {
        Map.Entry<Long, Segment> entry = segments.lastEntry();
        if (entry == null) {
            return toBeforeFirst();
        }
        return moveTo(entry.getKey(), entry.getValue().last());
    }

    /**
     * Move to the next record. Before the first record this is the same as {@link #first()}; after the last record
     * the cursor stays where it is.
     * @return the next record number, or {@code null} if there is none
     */
    @Nullable
    public Long next() {
        switch (position) {
            case BEFORE_FIRST:
                return first();
            case AFTER_LAST:
                return null;
            default:
                break;
        }
        Segment segment = segments.get(segmentNumber);
        int nextOffset = offset + 1 < segmentSize.getRecordsPerSegment() ? segment.ceiling(offset + 1) : Segment.NO_OFFSET;
        if (nextOffset != Segment.NO_OFFSET) {
            return moveTo(segmentNumber, nextOffset);
        }
        Map.Entry<Long, Segment> entry = segments.higherEntry(segmentNumber);
        if (entry == null) {
            return toAfterLast();
        }
        return moveTo(entry.getKey(), entry.getValue().first());
    }

    /**
     * Move to the previous record. After the last record this is the same as {@link #last()}; before the first
     * record the cursor stays where it is.
     * @return the previous record number, or {@code null} if there is none
     */
    @Nullable
    public Long prior() {
        switch (position) {
            case AFTER_LAST:
                return last();
            case BEFORE_FIRST:
                return null;
            default:
                break;
        }
        Segment segment = segments.get(segmentNumber);
        int priorOffset = segment.floor(offset - 1);
        if (priorOffset != Segment.NO_OFFSET) {
            return moveTo(segmentNumber, priorOffset);
        }
        Map.Entry<Long, Segment> entry = segments.lowerEntry(segmentNumber);
        if (entry == null) {
            return toBeforeFirst();
        }
        return moveTo(entry.getKey(), entry.getValue().last());
    }

    /**
     * Move to the given record if it is in the set, otherwise to the next greater record, otherwise after the last
     * record.
     * @param recordNumber the record number to seek
     * @return the record number the cursor is now on, or {@code null} if it is after the last record
     * @throws io.segset.segment.SegmentRangeException if the record number is negative
     */
    @Nullable
    public Long setAt(long recordNumber) {
        long targetSegment = segmentSize.segmentNumber(recordNumber);
        int targetOffset = segmentSize.offset(recordNumber);
        Segment segment = segments.get(targetSegment);
        if (segment != null) {
            int found = segment.ceiling(targetOffset);
            if (found != Segment.NO_OFFSET) {
                return moveTo(targetSegment, found);
            }
        }
        Map.Entry<Long, Segment> entry = segments.higherEntry(targetSegment);
        if (entry == null) {
            return toAfterLast();
        }
        return moveTo(entry.getKey(), entry.getValue().first());
    }

    /**
     * Get the record the cursor is on.
     * @return the current record number, or {@code null} if the cursor is before the first or after the last record
     */
    @Nullable
    public Long current() {
        return position == Position.ON_RECORD ? segmentSize.recordNumber(segmentNumber, offset) : null;
    }

    public boolean isBeforeFirst() {
        return position == Position.BEFORE_FIRST;
    }

    public boolean isAfterLast() {
        return position == Position.AFTER_LAST;
    }

    /**
     * Get the zero-based position of the current record within the snapshot.
     * @return the position, or {@code null} if the cursor is not on a record
     */
    @Nullable
    public Long getPosition() {
        if (position != Position.ON_RECORD) {
            return null;
        }
        long result = 0;
        for (Segment segment : segments.headMap(segmentNumber, false).values()) {
            result += segment.count();
        }
        return result + segments.get(segmentNumber).rank(offset);
    }

    /**
     * Get the number of records in the snapshot.
     * @return the number of records the cursor can visit
     */
    public long count() {
        long count = 0;
        for (Segment segment : segments.values()) {
            count += segment.count();
        }
        return count;
    }

    @Nonnull
    private Long moveTo(long newSegmentNumber, int newOffset) {
        position = Position.ON_RECORD;
        segmentNumber = newSegmentNumber;
        offset = newOffset;
        return segmentSize.recordNumber(newSegmentNumber, newOffset);
    }

    @Nullable
    private Long toBeforeFirst() {
        position = Position.BEFORE_FIRST;
        return null;
    }

    @Nullable
    private Long toAfterLast() {
        position = Position.AFTER_LAST;
        return null;
    }
}
