/*
 * SegmentSize.java
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
import io.segset.bits.BitUtility;
import io.segset.util.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Width of the segments that divide the record number space, with the constants derived from it.
 *
 * <p>
 * A record number {@code r} belongs to segment {@code r / segmentSize} at offset {@code r % segmentSize}. A bitmap
 * segment takes {@code segmentSize / 8} bytes. Offsets are stored as {@value #OFFSET_BYTES}-byte big-endian integers,
 * which limits the segment size to {@value #MAX_SEGMENT_SIZE}. The list threshold is the largest number of records
 * kept as a list; by default it is the number of offsets that fit in the bytes of one bitmap, so a list never takes
 * more space than the bitmap it replaces.
 * </p>
 *
 * <p>
 * Instances are immutable and are passed to every segment and record set that uses them. Data written with one
 * segment size cannot be read with another.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class SegmentSize {
    public static final int OFFSET_BYTES = 2;
    public static final int MAX_SEGMENT_SIZE = 1 << (OFFSET_BYTES * 8);
    public static final int DEFAULT_SEGMENT_SIZE = 32000;

    /**
     * The default of 32000 records per segment, 4000 bytes per bitmap and lists of up to 2000 records.
     */
    public static final SegmentSize DEFAULT = newBuilder().build();

    private final int recordsPerSegment;
    private final int listThreshold;

    private SegmentSize(int recordsPerSegment, int listThreshold) {
        this.recordsPerSegment = recordsPerSegment;
        this.listThreshold = listThreshold;
    }

    /**
     * Create a segment size with the default list threshold.
     * @param recordsPerSegment number of records per segment
     * @return a new segment size
     */
    @Nonnull
    public static SegmentSize of(int recordsPerSegment) {
        return newBuilder().setRecordsPerSegment(recordsPerSegment).build();
    }

    @Nonnull
    public static SegmentSize of(int recordsPerSegment, int listThreshold) {
        return newBuilder().setRecordsPerSegment(recordsPerSegment).setListThreshold(listThreshold).build();
    }

    public int getRecordsPerSegment() {
        return recordsPerSegment;
    }

    /**
     * Get the largest number of records that a {@link ListSegment} holds.
     * @return the list threshold
     */
    public int getListThreshold() {
        return listThreshold;
    }

    public int getBitmapBytes() {
        return BitUtility.bytesForBits(recordsPerSegment);
    }

    public long segmentNumber(long recordNumber) {
        checkRecordNumber(recordNumber);
        return recordNumber / recordsPerSegment;
    }

    /**
     * Get the number of segments needed to hold the records below {@code recordCount}.
     * @param recordCount a number of records
     * @return the number of segments, counting a partly filled last segment
     * @throws SegmentRangeException if the count is negative
     */
    public long segmentCount(long recordCount) {
        checkRecordNumber(recordCount);
        return recordCount / recordsPerSegment + (recordCount % recordsPerSegment == 0 ? 0 : 1);
    }

    public int offset(long recordNumber) {
        checkRecordNumber(recordNumber);
        return (int)(recordNumber % recordsPerSegment);
    }

    public long recordNumber(long segmentNumber, int offset) {
        checkOffset(offset);
        if (segmentNumber < 0) {
            throw new SegmentRangeException("segment number must not be negative",
                    LogMessageKeys.RECORD_NUMBER, segmentNumber);
        }
        return segmentNumber * recordsPerSegment + offset;
    }

    /**
     * Check that the offset lies within a segment.
     * @param offset an offset within a segment
     * @throws SegmentRangeException if the offset is negative or not less than the segment size
     */
    public void checkOffset(int offset) {
        if (offset < 0 || offset >= recordsPerSegment) {
            throw new SegmentRangeException("offset outside segment",
                    LogMessageKeys.OFFSET, offset,
                    LogMessageKeys.SEGMENT_SIZE, recordsPerSegment);
        }
    }

    /**
     * Check that the record number is not negative.
     * @param recordNumber a record number
     * @throws SegmentRangeException if the record number is negative
     */
    public void checkRecordNumber(long recordNumber) {
        if (recordNumber < 0) {
            throw new SegmentRangeException("record number must not be negative",
                    LogMessageKeys.RECORD_NUMBER, recordNumber);
        }
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(recordsPerSegment, listThreshold);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SegmentSize that = (SegmentSize)o;
        return recordsPerSegment == that.recordsPerSegment && listThreshold == that.listThreshold;
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordsPerSegment, listThreshold);
    }

    @Override
    public String toString() {
        return "SegmentSize{" + recordsPerSegment + ", listThreshold=" + listThreshold + "}";
    }

    /**
     * Builder for {@link SegmentSize}.
     *
     * @see #newBuilder
     */
    public static class Builder {
        private int recordsPerSegment = DEFAULT_SEGMENT_SIZE;
        @Nullable
        private Integer listThreshold;

        protected Builder() {
        }

        protected Builder(int recordsPerSegment, int listThreshold) {
            this.recordsPerSegment = recordsPerSegment;
            this.listThreshold = listThreshold;
        }

        public int getRecordsPerSegment() {
            return recordsPerSegment;
        }

        /**
         * Set the number of records in each segment.
         * @param recordsPerSegment a positive multiple of 8 no larger than {@value #MAX_SEGMENT_SIZE}
         * @return this builder
         */
        public Builder setRecordsPerSegment(int recordsPerSegment) {
            if (recordsPerSegment <= 0 || recordsPerSegment % 8 != 0 || recordsPerSegment > MAX_SEGMENT_SIZE) {
                throw new IllegalArgumentException("records per segment must be a positive multiple of 8 no larger than " + MAX_SEGMENT_SIZE);
            }
            this.recordsPerSegment = recordsPerSegment;
            return this;
        }

        /**
         * Get the list threshold, which defaults to the number of offsets that fit in one bitmap.
         * @return the list threshold that {@link #build()} will use
         */
        public int getListThreshold() {
            return listThreshold == null ? (recordsPerSegment / 8) / OFFSET_BYTES : listThreshold;
        }

        /**
         * Set the largest number of records kept in a list before the segment becomes a bitmap.
         * @param listThreshold at least 1 and less than the number of records per segment
         * @return this builder
         */
        public Builder setListThreshold(int listThreshold) {
            if (listThreshold < 1) {
                throw new IllegalArgumentException("list threshold must be positive");
            }
            this.listThreshold = listThreshold;
            return this;
        }

        public SegmentSize build() {
            int threshold = Math.max(1, getListThreshold());
            if (threshold >= recordsPerSegment) {
                throw new IllegalArgumentException("list threshold must be less than records per segment");
            }
            return new SegmentSize(recordsPerSegment, threshold);
        }
    }
}
