/*
 * AbstractSegmentStorageAdapter.java
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
import io.segset.record.RecordCoreArgumentException;
import io.segset.record.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.NavigableMap;

/**
 * Implementations common to all concrete implementations of {@link SegmentStorageAdapter}: argument checks and
 * tracking of the transaction bracket. Subclasses supply the storage operations.
 */
public abstract class AbstractSegmentStorageAdapter implements SegmentStorageAdapter {
    private boolean inTransaction;

    @Nullable
    @Override
    public byte[] get(@Nonnull Tuple indexValue, long segmentNumber) {
        checkSegmentNumber(segmentNumber);
        return getInternal(indexValue, segmentNumber);
    }

    @Override
    public void put(@Nonnull Tuple indexValue, long segmentNumber, @Nonnull byte[] data) {
        checkSegmentNumber(segmentNumber);
        checkInTransaction("put");
        putInternal(indexValue, segmentNumber, data);
    }

    @Override
    public void delete(@Nonnull Tuple indexValue, long segmentNumber) {
        checkSegmentNumber(segmentNumber);
        checkInTransaction("delete");
        deleteInternal(indexValue, segmentNumber);
    }

    @Nonnull
    @Override
    public NavigableMap<Long, byte[]> scan(@Nonnull Tuple indexValue) {
        return scanInternal(indexValue);
    }

    @Override
    public void begin() {
        if (inTransaction) {
            throw new SegmentStorageException("transaction already open");
        }
        beginInternal();
        inTransaction = true;
    }

    @Override
    public void commit() {
        checkInTransaction("commit");
        // a failed commit still ends the transaction
        inTransaction = false;
        commitInternal();
    }

    @Override
    public void rollback() {
        checkInTransaction("rollback");
        inTransaction = false;
        rollbackInternal();
    }

    @Override
    public boolean isInTransaction() {
        return inTransaction;
    }

    @Nullable
    protected abstract byte[] getInternal(@Nonnull Tuple indexValue, long segmentNumber);

    protected abstract void putInternal(@Nonnull Tuple indexValue, long segmentNumber, @Nonnull byte[] data);

    protected abstract void deleteInternal(@Nonnull Tuple indexValue, long segmentNumber);

    @Nonnull
    protected abstract NavigableMap<Long, byte[]> scanInternal(@Nonnull Tuple indexValue);

    protected abstract void beginInternal();

    protected abstract void commitInternal();

    protected abstract void rollbackInternal();

    private void checkInTransaction(@Nonnull String operation) {
        if (!inTransaction) {
            throw new SegmentStorageException("no transaction open", LogMessageKeys.OPERATION, operation);
        }
    }

    private static void checkSegmentNumber(long segmentNumber) {
        if (segmentNumber < 0) {
            throw new RecordCoreArgumentException("segment number must not be negative",
                    LogMessageKeys.SEGMENT_NUMBER, segmentNumber);
        }
    }
}
