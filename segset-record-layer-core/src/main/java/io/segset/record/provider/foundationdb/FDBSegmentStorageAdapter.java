/*
 * FDBSegmentStorageAdapter.java
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

package io.segset.record.provider.foundationdb;

import com.apple.foundationdb.Database;
import com.apple.foundationdb.FDBException;
import com.apple.foundationdb.KeyValue;
import com.apple.foundationdb.ReadTransaction;
import com.apple.foundationdb.Transaction;
import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.Tuple;
import io.segset.annotation.API;
import io.segset.record.logging.LogMessageKeys;
import io.segset.record.storage.AbstractSegmentStorageAdapter;
import io.segset.record.storage.SegmentStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * A {@link io.segset.record.storage.SegmentStorageAdapter} that keeps segments in FoundationDB.
 *
 * <p>
 * Each segment is stored under the key {@code subspace + (indexValue..., segmentNumber)}, so that a range read of an
 * index value returns its segments in segment number order. A transaction of the adapter is a single FoundationDB
 * transaction, which limits how many segments one flush can write. Reads outside a transaction use a fresh read
 * transaction each.
 * </p>
 *
 * <p>
 * The adapter does not retry. Errors from FoundationDB are wrapped in {@link SegmentStorageException} with the
 * {@link FDBException} as cause, so the caller can check {@link FDBException#isRetryable()} and run the work again.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class FDBSegmentStorageAdapter extends AbstractSegmentStorageAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(FDBSegmentStorageAdapter.class);

    @Nonnull
    private final Database database;
    @Nonnull
    private final Subspace subspace;
    @Nullable
    private Transaction transaction;

    public FDBSegmentStorageAdapter(@Nonnull Database database, @Nonnull Subspace subspace) {
        this.database = database;
        this.subspace = subspace;
    }

    @Nonnull
    public Subspace getSubspace() {
        return subspace;
    }

    @Nonnull
    private byte[] segmentKey(@Nonnull Tuple indexValue, long segmentNumber) {
        return subspace.pack(indexValue.add(segmentNumber));
    }

    @Nullable
    @Override
    protected byte[] getInternal(@Nonnull Tuple indexValue, long segmentNumber) {
        final byte[] key = segmentKey(indexValue, segmentNumber);
        return read("get", tr -> tr.get(key).join());
    }

    @Override
    protected void putInternal(@Nonnull Tuple indexValue, long segmentNumber, @Nonnull byte[] data) {
        getTransaction().set(segmentKey(indexValue, segmentNumber), data);
    }

    @Override
    protected void deleteInternal(@Nonnull Tuple indexValue, long segmentNumber) {
        getTransaction().clear(segmentKey(indexValue, segmentNumber));
    }

    @Nonnull
    @Override
    protected NavigableMap<Long, byte[]> scanInternal(@Nonnull Tuple indexValue) {
        final Subspace indexSubspace = subspace.subspace(indexValue);
        List<KeyValue> keyValues = read("scan", tr -> tr.getRange(indexSubspace.range()).asList().join());
        NavigableMap<Long, byte[]> segments = new TreeMap<>();
        for (KeyValue keyValue : keyValues) {
            Tuple key = indexSubspace.unpack(keyValue.getKey());
            if (key.size() == 1) {
                segments.put(key.getLong(0), keyValue.getValue());
            }
        }
        return segments;
    }

    @Override
    protected void beginInternal() {
        transaction = database.createTransaction();
    }

    @Override
    protected void commitInternal() {
        Transaction tr = getTransaction();
        transaction = null;
        try {
            tr.commit().join();
        } catch (RuntimeException e) {
            throw wrapException("commit", e);
        } finally {
            tr.close();
        }
    }

    @Override
    protected void rollbackInternal() {
        Transaction tr = getTransaction();
        transaction = null;
        try {
            tr.cancel();
        } finally {
            tr.close();
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("rolled back segment transaction in {}", subspace);
        }
    }

    @Nonnull
    private Transaction getTransaction() {
        if (transaction == null) {
            throw new SegmentStorageException("no transaction open", LogMessageKeys.SUBSPACE, subspace);
        }
        return transaction;
    }

    private <T> T read(@Nonnull String operation, @Nonnull Function<ReadTransaction, T> reader) {
        try {
            if (transaction != null) {
                return reader.apply(transaction);
            } else {
                return database.read(reader);
            }
        } catch (RuntimeException e) {
            throw wrapException(operation, e);
        }
    }

    @Nonnull
    private SegmentStorageException wrapException(@Nonnull String operation, @Nonnull RuntimeException e) {
        Throwable cause = e;
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof SegmentStorageException) {
            return (SegmentStorageException)cause;
        }
        SegmentStorageException wrapped = new SegmentStorageException("FoundationDB operation failed", cause);
        wrapped.addLogInfo(LogMessageKeys.OPERATION, operation);
        wrapped.addLogInfo(LogMessageKeys.SUBSPACE, subspace);
        if (cause instanceof FDBException) {
            wrapped.addLogInfo(LogMessageKeys.ERROR_CODE, ((FDBException)cause).getCode());
        }
        return wrapped;
    }
}
