/*
 * SegmentStorageAdapter.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.NavigableMap;
import java.util.function.Supplier;

/**
 * Persistence of encoded segments, keyed by index value and segment number.
 *
 * <p>
 * Index values are {@link Tuple}s, whose natural order is the order in which the deferred update pipeline writes
 * them. Writes happen between {@link #begin()} and {@link #commit()} or {@link #rollback()}, and only one transaction
 * may be open at a time. Reads are allowed in or out of a transaction; inside one they see its uncommitted writes.
 * An adapter need not apply writes in the order it receives them.
 * </p>
 *
 * <p>
 * Failures of the underlying store are reported as {@link SegmentStorageException}. If {@link #commit()} fails,
 * nothing written in the transaction is persisted and the transaction is no longer open.
 * </p>
 */
@API(API.Status.UNSTABLE)
public interface SegmentStorageAdapter {
    /**
     * Read an encoded segment.
     * @param indexValue the index value
     * @param segmentNumber the segment number
     * @return the stored bytes, or {@code null} if no segment is stored under the key
     */
    @Nullable
    byte[] get(@Nonnull Tuple indexValue, long segmentNumber);

    /**
     * Write an encoded segment, replacing any stored under the same key.
     * @param indexValue the index value
     * @param segmentNumber the segment number
     * @param data the encoded segment
     */
    void put(@Nonnull Tuple indexValue, long segmentNumber, @Nonnull byte[] data);

    /**
     * Delete an encoded segment. Deleting an absent segment does nothing.
     * @param indexValue the index value
     * @param segmentNumber the segment number
     */
    void delete(@Nonnull Tuple indexValue, long segmentNumber);

    /**
     * Read every segment stored for an index value.
     * @param indexValue the index value
     * @return the stored bytes by ascending segment number
     */
    @Nonnull
    NavigableMap<Long, byte[]> scan(@Nonnull Tuple indexValue);

    void begin();

    void commit();

    void rollback();

    boolean isInTransaction();

    /**
     * Run some work in a transaction of this adapter. The transaction is committed if the work completes. If the work
     * or the commit throws, the transaction is rolled back if it is still open and the original exception is
     * rethrown, with any failure of the rollback attached as suppressed.
     * @param work the work to run
     * @param <T> the type of the result of the work
     * @return the result of the work
     */
    default <T> T runInTransaction(@Nonnull Supplier<T> work) {
        begin();
        try {
            T result = work.get();
            commit();
            return result;
        } catch (RuntimeException e) {
            if (isInTransaction()) {
                try {
                    rollback();
                } catch (RuntimeException rollbackException) {
                    e.addSuppressed(rollbackException);
                }
            }
            throw e;
        }
    }
}
