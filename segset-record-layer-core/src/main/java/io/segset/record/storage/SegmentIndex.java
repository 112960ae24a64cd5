/*
 * SegmentIndex.java
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

package io.segset.record.storage;

import com.apple.foundationdb.tuple.Tuple;
import io.segset.annotation.API;
import io.segset.record.RecordCoreArgumentException;
import io.segset.record.RecordSet;
import io.segset.record.logging.KeyValueLogMessage;
import io.segset.record.logging.LogMessageKeys;
import io.segset.segment.IntegerSegment;
import io.segset.segment.Segment;
import io.segset.segment.SegmentCodec;
import io.segset.segment.SegmentSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Reads and writes the record sets of an index through a {@link SegmentStorageAdapter}.
 *
 * <p>
 * Each index value maps to a {@link RecordSet} stored as one encoded segment per non-empty segment. The single-record
 * updates here apply immediately, each in its own transaction, and are the counterpart of the batched updates of
 * {@link io.segset.record.deferred.DeferredUpdate}. They must not be called while the adapter has a transaction open.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class SegmentIndex {
    private static final Logger LOGGER = LoggerFactory.getLogger(SegmentIndex.class);

    @Nonnull
    private final SegmentStorageAdapter adapter;
    @Nonnull
    private final SegmentCodec codec;

    public SegmentIndex(@Nonnull SegmentStorageAdapter adapter, @Nonnull SegmentSize segmentSize) {
        this.adapter = adapter;
        this.codec = new SegmentCodec(segmentSize);
    }

    @Nonnull
    public SegmentStorageAdapter getAdapter() {
        return adapter;
    }

    @Nonnull
    public SegmentSize getSegmentSize() {
        return codec.getSegmentSize();
    }

    /**
     * Load the records of an index value.
     * @param indexValue the index value
     * @return a new record set, empty if nothing is stored for the value
     * @throws io.segset.segment.SegmentEncodingException if a stored segment cannot be decoded
     */
    @Nonnull
    public RecordSet load(@Nonnull Tuple indexValue) {
        RecordSet recordSet = new RecordSet(getSegmentSize());
        for (Map.Entry<Long, byte[]> entry : adapter.scan(indexValue).entrySet()) {
            recordSet.putSegment(entry.getKey(), codec.decode(entry.getValue()));
        }
        return recordSet;
    }

    /**
     * Load one segment of an index value.
     * @param indexValue the index value
     * @param segmentNumber the segment number
     * @return the segment, or {@code null} if none is stored
     */
    @Nullable
    public Segment loadSegment(@Nonnull Tuple indexValue, long segmentNumber) {
        byte[] data = adapter.get(indexValue, segmentNumber);
        return data == null ? null : codec.decode(data);
    }

    /**
     * Add one record to an index value and commit.
     * @param indexValue the index value
     * @param recordNumber the record number
     * @return {@code true} if the record was not already present
     */
    public boolean addRecord(@Nonnull Tuple indexValue, long recordNumber) {
        SegmentSize segmentSize = getSegmentSize();
        long segmentNumber = segmentSize.segmentNumber(recordNumber);
        int offset = segmentSize.offset(recordNumber);
        return adapter.runInTransaction(() -> {
            Segment current = loadSegment(indexValue, segmentNumber);
            Segment updated = current == null ? new IntegerSegment(segmentSize, offset) : current.add(offset);
            if (updated == current) {
                return false;
            }
            adapter.put(indexValue, segmentNumber, codec.encode(updated));
            return true;
        });
    }

    /**
     * Remove one record from an index value and commit.
     * @param indexValue the index value
     * @param recordNumber the record number
     * @return {@code true} if the record was present
     */
    public boolean removeRecord(@Nonnull Tuple indexValue, long recordNumber) {
        SegmentSize segmentSize = getSegmentSize();
        long segmentNumber = segmentSize.segmentNumber(recordNumber);
        int offset = segmentSize.offset(recordNumber);
        return adapter.runInTransaction(() -> {
            Segment current = loadSegment(indexValue, segmentNumber);
            if (current == null) {
                return false;
            }
            Segment updated = current.remove(offset);
            if (updated == current) {
                return false;
            }
            if (updated == null) {
                adapter.delete(indexValue, segmentNumber);
            } else {
                adapter.put(indexValue, segmentNumber, codec.encode(updated));
            }
            return true;
        });
    }

    /**
     * Replace the stored records of an index value and commit. Stored segments that the record set does not have are
     * deleted.
     * @param indexValue the index value
     * @param recordSet the records to store
     */
    public void write(@Nonnull Tuple indexValue, @Nonnull RecordSet recordSet) {
        if (!recordSet.getSegmentSize().equals(getSegmentSize())) {
            throw new RecordCoreArgumentException("segment sizes differ",
                    LogMessageKeys.SEGMENT_SIZE, getSegmentSize());
        }
        NavigableMap<Long, Segment> segments = recordSet.getSegments();
        adapter.runInTransaction(() -> {
            for (Long segmentNumber : adapter.scan(indexValue).keySet()) {
                if (!segments.containsKey(segmentNumber)) {
                    adapter.delete(indexValue, segmentNumber);
                }
            }
            for (Map.Entry<Long, Segment> entry : segments.entrySet()) {
                adapter.put(indexValue, entry.getKey(), codec.encode(entry.getValue()));
            }
            return null;
        });
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("wrote record set",
                    LogMessageKeys.INDEX_VALUE, indexValue,
                    LogMessageKeys.SEGMENT_COUNT, segments.size()));
        }
    }
}
