/*
 * DeferredUpdate.java
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

package io.segset.record.deferred;

import com.apple.foundationdb.tuple.Tuple;
import com.google.common.collect.ImmutableSortedSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.segset.annotation.API;
import io.segset.record.RecordCoreArgumentException;
import io.segset.record.logging.KeyValueLogMessage;
import io.segset.record.logging.LogMessageKeys;
import io.segset.record.provider.common.StoreTimer;
import io.segset.record.storage.SegmentStorageAdapter;
import io.segset.segment.Segment;
import io.segset.segment.SegmentCodec;
import io.segset.segment.SegmentSize;
import io.segset.segment.Segments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Buffers index updates in memory and writes them to storage in batches.
 *
 * <p>
 * Updating an index one record at a time costs a read and a write of the affected segment for every record. During a
 * bulk load, updates are instead buffered by index value and segment number. A {@link #flush} then visits each
 * affected segment once, in ascending order of index value and segment number: it reads the stored segment, applies
 * all the buffered changes to it, and writes it back. The result is the same as applying each update immediately.
 * </p>
 *
 * <p>
 * A flush runs in one transaction of the {@link SegmentStorageAdapter}. If it fails, the transaction is rolled back
 * and the buffer is left as it was, so the same flush can be tried again. Applying buffered changes to segments that
 * already have them changes nothing, so retrying after a flush that did commit is also safe. The buffer is cleared
 * only when a flush commits.
 * </p>
 *
 * <p>
 * The buffer holds at most {@link Config#getMaxBufferedUpdates()} updates. An update beyond that throws
 * {@link DeferredUpdateBufferExhaustedException} and is not buffered. The caller should then flush, or
 * {@link #drainSortedRun()} the buffer to a run to be merged later with {@link SegmentUpdateMerger}, and repeat the
 * update.
 * </p>
 *
 * <p>
 * Instances belong to a single load session and are not thread-safe.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class DeferredUpdate {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeferredUpdate.class);

    public static final int DEFAULT_MAX_BUFFERED_UPDATES = 1_000_000;
    public static final Config DEFAULT_CONFIG = new Config();

    @Nonnull
    private final Config config;
    @Nullable
    private final StoreTimer timer;
    @Nonnull
    private final TreeMap<SegmentKey, PendingUpdates> buffer = new TreeMap<>();
    private int bufferedUpdates;

    public DeferredUpdate(@Nonnull Config config, @Nullable StoreTimer timer) {
        this.config = config;
        this.timer = timer;
    }

    public DeferredUpdate(@Nonnull Config config) {
        this(config, null);
    }

    @Nonnull
    public Config getConfig() {
        return config;
    }

    /**
     * Buffer the addition of a record to an index value.
     * @param indexValue the index value
     * @param recordNumber the record number
     * @throws io.segset.segment.SegmentRangeException if the record number is negative
     * @throws DeferredUpdateBufferExhaustedException if the buffer is full
     */
    public void add(@Nonnull Tuple indexValue, long recordNumber) {
        buffer(indexValue, recordNumber, false);
    }

    /**
     * Buffer the removal of a record from an index value. A later {@link #add} of the same record cancels it, and it
     * cancels an earlier one.
     * @param indexValue the index value
     * @param recordNumber the record number
     * @throws io.segset.segment.SegmentRangeException if the record number is negative
     * @throws DeferredUpdateBufferExhaustedException if the buffer is full
     */
    public void remove(@Nonnull Tuple indexValue, long recordNumber) {
        buffer(indexValue, recordNumber, true);
    }

    private void buffer(@Nonnull Tuple indexValue, long recordNumber, boolean removal) {
        SegmentSize segmentSize = config.getSegmentSize();
        long segmentNumber = segmentSize.segmentNumber(recordNumber);
        int offset = segmentSize.offset(recordNumber);
        if (isFull()) {
            if (timer != null) {
                timer.increment(DeferredUpdateEvents.Counts.BUFFER_EXHAUSTED);
            }
            throw new DeferredUpdateBufferExhaustedException("deferred update buffer is full",
                    LogMessageKeys.BUFFERED_UPDATES, bufferedUpdates,
                    LogMessageKeys.MAX_BUFFERED_UPDATES, config.getMaxBufferedUpdates(),
                    LogMessageKeys.INDEX_VALUE, indexValue,
                    LogMessageKeys.RECORD_NUMBER, recordNumber);
        }
        buffer.computeIfAbsent(new SegmentKey(indexValue, segmentNumber), ignore -> new PendingUpdates()).add(offset, removal);
        bufferedUpdates++;
        if (timer != null) {
            timer.increment(DeferredUpdateEvents.Counts.OFFSET_BUFFERED);
        }
    }

    /**
     * Whether the record is at one of the configured deferred update points, where a caller loading records in
     * ascending order should flush.
     * @param recordNumber the record number just loaded
     * @return {@code true} if a flush is due after this record
     * @see ConfigBuilder#setDeferredUpdatePoints
     */
    public boolean isFlushPoint(long recordNumber) {
        return config.getDeferredUpdatePoints().contains(config.getSegmentSize().offset(recordNumber));
    }

    public boolean isFull() {
        return bufferedUpdates >= config.getMaxBufferedUpdates();
    }

    public boolean isEmpty() {
        return buffer.isEmpty();
    }

    /**
     * Get the number of updates buffered since the last flush or drain.
     * @return the number of buffered updates
     */
    public int getBufferedUpdateCount() {
        return bufferedUpdates;
    }

    /**
     * Get the number of distinct segments with buffered updates.
     * @return the number of segments a flush would read
     */
    public int getBufferedSegmentCount() {
        return buffer.size();
    }

    /**
     * Get the buffered updates as a sorted run without clearing the buffer.
     * @return the updates in ascending key order
     */
    @Nonnull
    public List<SegmentUpdate> getSortedRun() {
        SegmentSize segmentSize = config.getSegmentSize();
        List<SegmentUpdate> run = new ArrayList<>(buffer.size());
        for (Map.Entry<SegmentKey, PendingUpdates> entry : buffer.entrySet()) {
            run.add(entry.getValue().toUpdate(entry.getKey(), segmentSize));
        }
        return run;
    }

    /**
     * Remove the buffered updates as a sorted run, leaving the buffer empty.
     * @return the updates in ascending key order
     */
    @Nonnull
    public List<SegmentUpdate> drainSortedRun() {
        List<SegmentUpdate> run = getSortedRun();
        clear();
        return run;
    }

    /**
     * Write the buffered updates to storage and clear the buffer.
     * @param adapter the storage to write to, which must not have a transaction open
     * @return counts of what was done to the stored segments
     * @throws io.segset.record.storage.SegmentStorageException if storage fails, in which case the buffer is kept
     */
    @CanIgnoreReturnValue
    @Nonnull
    public DeferredUpdateFlushResult flush(@Nonnull SegmentStorageAdapter adapter) {
        if (buffer.isEmpty()) {
            return DeferredUpdateFlushResult.EMPTY;
        }
        DeferredUpdateFlushResult result = apply(adapter, config.getSegmentSize(), getSortedRun().iterator(), timer);
        clear();
        return result;
    }

    /**
     * Merge sorted runs and write them to storage in one transaction.
     * @param adapter the storage to write to, which must not have a transaction open
     * @param segmentSize the segment size of the stored segments
     * @param runs the runs, oldest first
     * @param timer the timer to record into, if any
     * @return counts of what was done to the stored segments
     * @see SegmentUpdateMerger
     */
    @CanIgnoreReturnValue
    @Nonnull
    public static DeferredUpdateFlushResult applyRuns(@Nonnull SegmentStorageAdapter adapter, @Nonnull SegmentSize segmentSize,
                                                      @Nonnull List<? extends List<SegmentUpdate>> runs, @Nullable StoreTimer timer) {
        final long startTime = System.nanoTime();
        List<Iterator<SegmentUpdate>> iterators = new ArrayList<>(runs.size());
        for (List<SegmentUpdate> run : runs) {
            iterators.add(run.iterator());
        }
        try {
            return apply(adapter, segmentSize, SegmentUpdateMerger.merge(iterators), timer);
        } finally {
            if (timer != null) {
                timer.recordSinceNanoTime(DeferredUpdateEvents.Events.MERGE_RUNS, startTime);
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("merged deferred update runs",
                        LogMessageKeys.RUN_COUNT, runs.size(),
                        LogMessageKeys.TOTAL_MICROS, (System.nanoTime() - startTime) / 1000L));
            }
        }
    }

    /**
     * Write a stream of updates to storage in one transaction. Each stored segment is read, updated and written
     * back, deleted if it has become empty, or left alone if the update did not change it.
     * @param adapter the storage to write to, which must not have a transaction open
     * @param segmentSize the segment size of the stored segments
     * @param updates updates in strictly ascending key order
     * @param timer the timer to record into, if any
     * @return counts of what was done to the stored segments
     */
    @CanIgnoreReturnValue
    @Nonnull
    public static DeferredUpdateFlushResult apply(@Nonnull SegmentStorageAdapter adapter, @Nonnull SegmentSize segmentSize,
                                                  @Nonnull Iterator<SegmentUpdate> updates, @Nullable StoreTimer timer) {
        final long startTime = System.nanoTime();
        final SegmentCodec codec = new SegmentCodec(segmentSize);
        final DeferredUpdateFlushResult result;
        try {
            result = adapter.runInTransaction(() -> applyInTransaction(adapter, codec, updates));
        } catch (RuntimeException e) {
            if (timer != null) {
                timer.increment(DeferredUpdateEvents.Counts.FLUSH_FAILED);
            }
            if (LOGGER.isWarnEnabled()) {
                LOGGER.warn(KeyValueLogMessage.of("deferred update flush failed",
                        LogMessageKeys.ROLLED_BACK, !adapter.isInTransaction(),
                        LogMessageKeys.TOTAL_MICROS, (System.nanoTime() - startTime) / 1000L), e);
            }
            throw e;
        }
        if (timer != null) {
            timer.recordSinceNanoTime(DeferredUpdateEvents.Events.FLUSH, startTime);
            timer.increment(DeferredUpdateEvents.Counts.SEGMENT_READ, result.getSegmentsRead());
            timer.increment(DeferredUpdateEvents.Counts.SEGMENT_WRITTEN, result.getSegmentsWritten());
            timer.increment(DeferredUpdateEvents.Counts.SEGMENT_DELETED, result.getSegmentsDeleted());
            timer.increment(DeferredUpdateEvents.Counts.SEGMENT_UNCHANGED, result.getSegmentsUnchanged());
        }
        if (LOGGER.isDebugEnabled()) {
            KeyValueLogMessage message = KeyValueLogMessage.build("flushed deferred updates",
                    LogMessageKeys.SEGMENT_COUNT, result.getSegmentsRead(),
                    LogMessageKeys.SEGMENTS_WRITTEN, result.getSegmentsWritten(),
                    LogMessageKeys.SEGMENTS_DELETED, result.getSegmentsDeleted(),
                    LogMessageKeys.SEGMENTS_UNCHANGED, result.getSegmentsUnchanged(),
                    LogMessageKeys.TOTAL_MICROS, (System.nanoTime() - startTime) / 1000L);
            if (timer != null) {
                message.addKeysAndValues(timer.getKeysAndValues());
            }
            LOGGER.debug(message.toString());
        }
        return result;
    }

    @Nonnull
    private static DeferredUpdateFlushResult applyInTransaction(@Nonnull SegmentStorageAdapter adapter, @Nonnull SegmentCodec codec,
                                                                @Nonnull Iterator<SegmentUpdate> updates) {
        int read = 0;
        int written = 0;
        int deleted = 0;
        int unchanged = 0;
        SegmentKey previous = null;
        while (updates.hasNext()) {
            SegmentUpdate update = updates.next();
            if (previous != null && previous.compareTo(update.getKey()) >= 0) {
                throw new RecordCoreArgumentException("updates are not in ascending order",
                        LogMessageKeys.INDEX_VALUE, update.getIndexValue(),
                        LogMessageKeys.SEGMENT_NUMBER, update.getSegmentNumber());
            }
            previous = update.getKey();
            byte[] stored = adapter.get(update.getIndexValue(), update.getSegmentNumber());
            read++;
            Segment current = stored == null ? null : codec.decode(stored);
            Segment updated = update.applyTo(current);
            if (updated == null) {
                if (current == null) {
                    unchanged++;
                } else {
                    adapter.delete(update.getIndexValue(), update.getSegmentNumber());
                    deleted++;
                }
            } else if (updated.equals(current)) {
                unchanged++;
            } else {
                adapter.put(update.getIndexValue(), update.getSegmentNumber(), codec.encode(updated));
                written++;
            }
        }
        return new DeferredUpdateFlushResult(read, written, deleted, unchanged);
    }

    /**
     * Discard all buffered updates.
     */
    public void clear() {
        buffer.clear();
        bufferedUpdates = 0;
    }

    /**
     * The changes buffered for one segment, in the order they were made.
     */
    private static final class PendingUpdates {
        private int[] operations = new int[4];
        private int size;

        void add(int offset, boolean removal) {
            if (size == operations.length) {
                operations = Arrays.copyOf(operations, size * 2);
            }
            operations[size++] = (offset << 1) | (removal ? 1 : 0);
        }

        @Nonnull
        SegmentUpdate toUpdate(@Nonnull SegmentKey key, @Nonnull SegmentSize segmentSize) {
            // the last change to each offset wins
            BitSet seen = new BitSet();
            int[] additions = new int[size];
            int[] removals = new int[size];
            int additionCount = 0;
            int removalCount = 0;
            for (int i = size - 1; i >= 0; i--) {
                int offset = operations[i] >>> 1;
                if (!seen.get(offset)) {
                    seen.set(offset);
                    if ((operations[i] & 1) != 0) {
                        removals[removalCount++] = offset;
                    } else {
                        additions[additionCount++] = offset;
                    }
                }
            }
            return new SegmentUpdate(key,
                    Segments.of(segmentSize, Arrays.copyOf(additions, additionCount)),
                    Segments.of(segmentSize, Arrays.copyOf(removals, removalCount)));
        }
    }

    /**
     * Configuration settings for a {@link DeferredUpdate}.
     */
    public static class Config {
        @Nonnull
        private final SegmentSize segmentSize;
        private final int maxBufferedUpdates;
        @Nullable
        private final Set<Integer> configuredUpdatePoints;
        @Nonnull
        private final Set<Integer> deferredUpdatePoints;

        protected Config() {
            this(SegmentSize.DEFAULT, DEFAULT_MAX_BUFFERED_UPDATES, null);
        }

        /**
         * Create a configuration.
         * @param segmentSize the segment size
         * @param maxBufferedUpdates the largest number of buffered updates
         * @param configuredUpdatePoints the deferred update points, or {@code null} for the last offset of each segment
         */
        protected Config(@Nonnull SegmentSize segmentSize, int maxBufferedUpdates, @Nullable Set<Integer> configuredUpdatePoints) {
            this.segmentSize = segmentSize;
            this.maxBufferedUpdates = maxBufferedUpdates;
            this.configuredUpdatePoints = configuredUpdatePoints;
            this.deferredUpdatePoints = configuredUpdatePoints == null
                                        ? ImmutableSortedSet.of(segmentSize.getRecordsPerSegment() - 1)
                                        : configuredUpdatePoints;
        }

        @Nonnull
        public SegmentSize getSegmentSize() {
            return segmentSize;
        }

        /**
         * Get the largest number of updates the buffer holds.
         * @return the maximum number of buffered updates
         */
        public int getMaxBufferedUpdates() {
            return maxBufferedUpdates;
        }

        /**
         * Get the segment offsets after which a flush is due.
         * @return the deferred update points
         */
        @Nonnull
        public Set<Integer> getDeferredUpdatePoints() {
            return deferredUpdatePoints;
        }

        @Nonnull
        public ConfigBuilder toBuilder() {
            return new ConfigBuilder(segmentSize, maxBufferedUpdates, configuredUpdatePoints);
        }

        @Override
        public String toString() {
            return "Config{" + segmentSize + ", maxBufferedUpdates=" + maxBufferedUpdates
                   + ", deferredUpdatePoints=" + deferredUpdatePoints + "}";
        }
    }

    /**
     * Builder for {@link Config}.
     *
     * @see #newConfigBuilder
     */
    public static class ConfigBuilder {
        @Nonnull
        private SegmentSize segmentSize = SegmentSize.DEFAULT;
        private int maxBufferedUpdates = DEFAULT_MAX_BUFFERED_UPDATES;
        @Nullable
        private Set<Integer> deferredUpdatePoints;

        protected ConfigBuilder() {
        }

        protected ConfigBuilder(@Nonnull SegmentSize segmentSize, int maxBufferedUpdates, @Nullable Set<Integer> deferredUpdatePoints) {
            this.segmentSize = segmentSize;
            this.maxBufferedUpdates = maxBufferedUpdates;
            this.deferredUpdatePoints = deferredUpdatePoints;
        }

        @Nonnull
        public SegmentSize getSegmentSize() {
            return segmentSize;
        }

        public ConfigBuilder setSegmentSize(@Nonnull SegmentSize segmentSize) {
            this.segmentSize = segmentSize;
            return this;
        }

        public int getMaxBufferedUpdates() {
            return maxBufferedUpdates;
        }

        /**
         * Set the largest number of updates the buffer holds before it rejects more.
         * @param maxBufferedUpdates a positive number of updates
         * @return this builder
         */
        public ConfigBuilder setMaxBufferedUpdates(int maxBufferedUpdates) {
            if (maxBufferedUpdates < 1) {
                throw new IllegalArgumentException("max buffered updates must be positive");
            }
            this.maxBufferedUpdates = maxBufferedUpdates;
            return this;
        }

        /**
         * Set the segment offsets after which a flush is due. By default this is the last offset of each segment, so
         * a load in record number order flushes once per segment.
         * @param offsets offsets within a segment
         * @return this builder
         */
        public ConfigBuilder setDeferredUpdatePoints(int... offsets) {
            ImmutableSortedSet.Builder<Integer> points = ImmutableSortedSet.naturalOrder();
            for (int offset : offsets) {
                points.add(offset);
            }
            this.deferredUpdatePoints = points.build();
            return this;
        }

        public Config build() {
            if (deferredUpdatePoints != null) {
                for (int offset : deferredUpdatePoints) {
                    segmentSize.checkOffset(offset);
                }
            }
            return new Config(segmentSize, maxBufferedUpdates, deferredUpdatePoints);
        }
    }

    public static ConfigBuilder newConfigBuilder() {
        return new ConfigBuilder();
    }
}
