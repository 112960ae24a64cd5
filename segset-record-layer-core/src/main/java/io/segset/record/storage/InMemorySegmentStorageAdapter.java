/*
 * InMemorySegmentStorageAdapter.java
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
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;

/**
 * A {@link SegmentStorageAdapter} that keeps segments in sorted maps in memory.
 *
 * <p>
 * Writes made in a transaction are staged and become visible outside it only on commit; rollback discards them.
 * Stored arrays are copied on the way in and out. Not thread-safe.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class InMemorySegmentStorageAdapter extends AbstractSegmentStorageAdapter {
    private static final byte[] DELETED = new byte[0];

    @Nonnull
    private final TreeMap<Tuple, TreeMap<Long, byte[]>> committed = new TreeMap<>();
    @Nonnull
    private final TreeMap<Tuple, TreeMap<Long, byte[]>> pending = new TreeMap<>();

    @Nullable
    @Override
    protected byte[] getInternal(@Nonnull Tuple indexValue, long segmentNumber) {
        if (isInTransaction()) {
            TreeMap<Long, byte[]> staged = pending.get(indexValue);
            if (staged != null && staged.containsKey(segmentNumber)) {
                return copyOrNull(staged.get(segmentNumber));
            }
        }
        TreeMap<Long, byte[]> segments = committed.get(indexValue);
        return segments == null ? null : copyOrNull(segments.get(segmentNumber));
    }

    @Override
    protected void putInternal(@Nonnull Tuple indexValue, long segmentNumber, @Nonnull byte[] data) {
        pending.computeIfAbsent(indexValue, ignore -> new TreeMap<>()).put(segmentNumber, Arrays.copyOf(data, data.length));
    }

    @Override
    protected void deleteInternal(@Nonnull Tuple indexValue, long segmentNumber) {
        pending.computeIfAbsent(indexValue, ignore -> new TreeMap<>()).put(segmentNumber, DELETED);
    }

    @Nonnull
    @Override
    protected NavigableMap<Long, byte[]> scanInternal(@Nonnull Tuple indexValue) {
        TreeMap<Long, byte[]> result = new TreeMap<>();
        TreeMap<Long, byte[]> segments = committed.get(indexValue);
        if (segments != null) {
            result.putAll(segments);
        }
        if (isInTransaction()) {
            TreeMap<Long, byte[]> staged = pending.get(indexValue);
            if (staged != null) {
                applyStaged(result, staged);
            }
        }
        result.replaceAll((segmentNumber, data) -> Arrays.copyOf(data, data.length));
        return result;
    }

    @Override
    protected void beginInternal() {
        pending.clear();
    }

    @Override
    protected void commitInternal() {
        for (Map.Entry<Tuple, TreeMap<Long, byte[]>> entry : pending.entrySet()) {
            TreeMap<Long, byte[]> segments = committed.computeIfAbsent(entry.getKey(), ignore -> new TreeMap<>());
            applyStaged(segments, entry.getValue());
            if (segments.isEmpty()) {
                committed.remove(entry.getKey());
            }
        }
        pending.clear();
    }

    @Override
    protected void rollbackInternal() {
        pending.clear();
    }

    /**
     * Get the index values that have committed segments.
     * @return an unmodifiable ascending view of the index values
     */
    @Nonnull
    public NavigableSet<Tuple> getIndexValues() {
        return Collections.unmodifiableNavigableSet(committed.navigableKeySet());
    }

    /**
     * Get the number of committed segments over all index values.
     * @return the number of stored segments
     */
    public int getSegmentCount() {
        int count = 0;
        for (TreeMap<Long, byte[]> segments : committed.values()) {
            count += segments.size();
        }
        return count;
    }

    private static void applyStaged(@Nonnull TreeMap<Long, byte[]> target, @Nonnull TreeMap<Long, byte[]> staged) {
        for (Map.Entry<Long, byte[]> entry : staged.entrySet()) {
            if (entry.getValue() == DELETED) {
                target.remove(entry.getKey());
            } else {
                target.put(entry.getKey(), entry.getValue());
            }
        }
    }

    @Nullable
    private static byte[] copyOrNull(@Nullable byte[] data) {
        return data == null || data == DELETED ? null : Arrays.copyOf(data, data.length);
    }
}
