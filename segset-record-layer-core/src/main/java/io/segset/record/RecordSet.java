/*
 * RecordSet.java
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

import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import io.segset.annotation.API;
import io.segset.record.logging.LogMessageKeys;
import io.segset.segment.IntegerSegment;
import io.segset.segment.Segment;
import io.segset.segment.SegmentSize;
import io.segset.segment.Segments;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BinaryOperator;
import java.util.stream.LongStream;

/**
 * A set of record numbers, held as one {@link Segment} per non-empty segment of the record number space.
 *
 * <p>
 * Segments are kept in ascending segment number order and a segment with no records is never stored. Record sets are
 * mutable through {@link #addRecord}, {@link #removeRecord} and {@link #putSegment}, but the set operations
 * ({@link #union}, {@link #intersection}, {@link #difference}, {@link #symmetricDifference} and {@link #complement})
 * leave their operands alone and return a new record set. Segments are immutable, so a result may share segment
 * instances with its operands.
 * </p>
 *
 * <p>
 * A record set is not thread-safe. Callers that share one between threads must synchronize externally.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class RecordSet {
    @Nonnull
    private final SegmentSize segmentSize;
    @Nonnull
    private final TreeMap<Long, Segment> segments;

    public RecordSet(@Nonnull SegmentSize segmentSize) {
        this(segmentSize, new TreeMap<>());
    }

    private RecordSet(@Nonnull SegmentSize segmentSize, @Nonnull TreeMap<Long, Segment> segments) {
        this.segmentSize = segmentSize;
        this.segments = segments;
    }

    /**
     * Create a record set holding the given record numbers.
     * @param segmentSize the segment size
     * @param recordNumbers record numbers in any order
     * @return a new record set
     */
    @Nonnull
    public static RecordSet of(@Nonnull SegmentSize segmentSize, @Nonnull long... recordNumbers) {
        RecordSet recordSet = new RecordSet(segmentSize);
        for (long recordNumber : recordNumbers) {
            recordSet.addRecord(recordNumber);
        }
        return recordSet;
    }

    /**
     * Create a record set holding every record number below {@code universe}. This is the identity for
     * {@link #intersection} among record sets bounded by the same universe.
     * @param segmentSize the segment size
     * @param universe the number of records
     * @return a new record set
     */
    @Nonnull
    public static RecordSet full(@Nonnull SegmentSize segmentSize, long universe) {
        return new RecordSet(segmentSize).complement(universe);
    }

    @Nonnull
    public SegmentSize getSegmentSize() {
        return segmentSize;
    }

    /**
     * Add a record.
     * @param recordNumber the record number to add
     * @return {@code true} if the record was not already present
     * @throws io.segset.segment.SegmentRangeException if the record number is negative
     */
    public boolean addRecord(long recordNumber) {
        long segmentNumber = segmentSize.segmentNumber(recordNumber);
        int offset = segmentSize.offset(recordNumber);
        Segment current = segments.get(segmentNumber);
        Segment updated = current == null ? new IntegerSegment(segmentSize, offset) : current.add(offset);
        if (updated == current) {
            return false;
        }
        segments.put(segmentNumber, updated);
        return true;
    }

    /**
     * Remove a record.
     * @param recordNumber the record number to remove
     * @return {@code true} if the record was present
     * @throws io.segset.segment.SegmentRangeException if the record number is negative
     */
    public boolean removeRecord(long recordNumber) {
        long segmentNumber = segmentSize.segmentNumber(recordNumber);
        Segment current = segments.get(segmentNumber);
        if (current == null) {
            return false;
        }
        Segment updated = current.remove(segmentSize.offset(recordNumber));
        if (updated == current) {
            return false;
        }
        putSegment(segmentNumber, updated);
        return true;
    }

    public boolean contains(long recordNumber) {
        Segment segment = segments.get(segmentSize.segmentNumber(recordNumber));
        return segment != null && segment.contains(segmentSize.offset(recordNumber));
    }

    /**
     * Get the number of records in this set.
     * @return the number of records
     */
    public long count() {
        long count = 0;
        for (Segment segment : segments.values()) {
            count += segment.count();
        }
        return count;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int getSegmentCount() {
        return segments.size();
    }

    @Nullable
    public Segment getSegment(long segmentNumber) {
        return segments.get(segmentNumber);
    }

    /**
     * Replace the segment with the given number.
     * @param segmentNumber the segment number
     * @param segment the new segment, or {@code null} to remove the segment
     */
    public void putSegment(long segmentNumber, @Nullable Segment segment) {
        if (segmentNumber < 0) {
            throw new RecordCoreArgumentException("segment number must not be negative",
                    LogMessageKeys.SEGMENT_NUMBER, segmentNumber);
        }
        if (segment == null) {
            segments.remove(segmentNumber);
        } else {
            checkSegmentSize(segment.getSegmentSize());
            segments.put(segmentNumber, segment);
        }
    }

    /**
     * Get the segments of this set by segment number.
     * @return an unmodifiable ascending view of the segments
     */
    @Nonnull
    public NavigableMap<Long, Segment> getSegments() {
        return Collections.unmodifiableNavigableMap(segments);
    }

    /**
     * Get the record numbers of this set in ascending order.
     * @return a stream of record numbers
     */
    @Nonnull
    public LongStream recordNumbers() {
        return segments.entrySet().stream().flatMapToLong(entry -> {
            long base = entry.getKey() * segmentSize.getRecordsPerSegment();
            return Arrays.stream(entry.getValue().toOffsets()).asLongStream().map(offset -> base + offset);
        });
    }

    @Nonnull
    public RecordSet union(@Nonnull RecordSet other) {
        return combine(other, Segments::union, true, true);
    }

    @Nonnull
    public RecordSet intersection(@Nonnull RecordSet other) {
        return combine(other, Segments::intersection, false, false);
    }

    @Nonnull
    public RecordSet difference(@Nonnull RecordSet other) {
        return combine(other, Segments::difference, true, false);
    }

    @Nonnull
    public RecordSet symmetricDifference(@Nonnull RecordSet other) {
        return combine(other, Segments::symmetricDifference, true, true);
    }

    /**
     * Get the records below {@code universe} that are not in this set. Records of this set at or above the universe
     * do not appear in the result.
     * @param universe the number of records that exist
     * @return a new record set
     */
    @Nonnull
    public RecordSet complement(long universe) {
        if (universe < 0) {
            throw new RecordCoreArgumentException("universe must not be negative",
                    LogMessageKeys.UNIVERSE, universe);
        }
        int recordsPerSegment = segmentSize.getRecordsPerSegment();
        TreeMap<Long, Segment> result = new TreeMap<>();
        long segmentCount = segmentSize.segmentCount(universe);
        Segment full = Segments.full(segmentSize);
        for (long segmentNumber = 0; segmentNumber < segmentCount; segmentNumber++) {
            int limit = (int)Math.min(recordsPerSegment, universe - segmentNumber * recordsPerSegment);
            Segment existing = segments.get(segmentNumber);
            Segment complement;
            if (existing == null && limit == recordsPerSegment) {
                complement = full;
            } else {
                complement = Segments.complement(existing, segmentSize, limit);
            }
            if (complement != null) {
                result.put(segmentNumber, complement);
            }
        }
        return new RecordSet(segmentSize, result);
    }

    /**
     * Get the number of records in this set that are less than the given record number. If the record is in the
     * set, this is its zero-based position.
     * @param recordNumber a record number
     * @return the number of smaller records
     */
    public long getPositionOfRecordNumber(long recordNumber) {
        long segmentNumber = segmentSize.segmentNumber(recordNumber);
        long position = 0;
        for (Segment segment : segments.headMap(segmentNumber, false).values()) {
            position += segment.count();
        }
        Segment segment = segments.get(segmentNumber);
        if (segment != null) {
            position += segment.rank(segmentSize.offset(recordNumber));
        }
        return position;
    }

    /**
     * Get the record at a position in ascending order.
     * @param position a zero-based position, or a negative position counting back from the end so that {@code -1}
     * is the last record
     * @return the record number, or {@code null} if the position is outside the set
     */
    @Nullable
    public Long getRecordNumberAtPosition(long position) {
        long remaining = position < 0 ? count() + position : position;
        if (remaining < 0) {
            return null;
        }
        for (Map.Entry<Long, Segment> entry : segments.entrySet()) {
            Segment segment = entry.getValue();
            if (remaining < segment.count()) {
                return segmentSize.recordNumber(entry.getKey(), segment.select((int)remaining));
            }
            remaining -= segment.count();
        }
        return null;
    }

    /**
     * Open a cursor over a snapshot of this set.
     * @return a cursor positioned before the first record
     * @see RecordSetCursor
     */
    @Nonnull
    public RecordSetCursor cursor() {
        return new RecordSetCursor(segmentSize, segments);
    }

    @Nonnull
    public RecordSet copy() {
        return new RecordSet(segmentSize, new TreeMap<>(segments));
    }

    @Nonnull
    private RecordSet combine(@Nonnull RecordSet other, @Nonnull BinaryOperator<Segment> operator,
                              boolean keepLeftOnly, boolean keepRightOnly) {
        checkSegmentSize(other.segmentSize);
        TreeMap<Long, Segment> result = new TreeMap<>();
        PeekingIterator<Map.Entry<Long, Segment>> left = Iterators.peekingIterator(segments.entrySet().iterator());
        PeekingIterator<Map.Entry<Long, Segment>> right = Iterators.peekingIterator(other.segments.entrySet().iterator());
        while (left.hasNext() || right.hasNext()) {
            final int comparison;
            if (!right.hasNext()) {
                comparison = -1;
            } else if (!left.hasNext()) {
                comparison = 1;
            } else {
                comparison = Long.compare(left.peek().getKey(), right.peek().getKey());
            }
            if (comparison < 0) {
                Map.Entry<Long, Segment> entry = left.next();
                if (keepLeftOnly) {
                    result.put(entry.getKey(), entry.getValue());
                }
            } else if (comparison > 0) {
                Map.Entry<Long, Segment> entry = right.next();
                if (keepRightOnly) {
                    result.put(entry.getKey(), entry.getValue());
                }
            } else {
                long segmentNumber = left.peek().getKey();
                Segment combined = operator.apply(left.next().getValue(), right.next().getValue());
                if (combined != null) {
                    result.put(segmentNumber, combined);
                }
            }
        }
        return new RecordSet(segmentSize, result);
    }

    private void checkSegmentSize(@Nonnull SegmentSize otherSize) {
        if (!segmentSize.equals(otherSize)) {
            throw new RecordCoreArgumentException("segment sizes differ",
                    LogMessageKeys.SEGMENT_SIZE, segmentSize,
                    "other_segment_size", otherSize);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RecordSet that = (RecordSet)o;
        return segmentSize.equals(that.segmentSize) && segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segmentSize, segments);
    }

    @Override
    public String toString() {
        return "RecordSet" + segments;
    }
}
