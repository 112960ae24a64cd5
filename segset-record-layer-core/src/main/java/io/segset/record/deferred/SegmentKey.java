/*
 * SegmentKey.java
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
import io.segset.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * The key of one segment of an index: an index value and a segment number. Keys order by index value, then by
 * segment number, which is the order in which updates are written.
 */
@API(API.Status.UNSTABLE)
public final class SegmentKey implements Comparable<SegmentKey> {
    @Nonnull
    private final Tuple indexValue;
    private final long segmentNumber;

    public SegmentKey(@Nonnull Tuple indexValue, long segmentNumber) {
        this.indexValue = indexValue;
        this.segmentNumber = segmentNumber;
    }

    @Nonnull
    public Tuple getIndexValue() {
        return indexValue;
    }

    public long getSegmentNumber() {
        return segmentNumber;
    }

    @Override
    public int compareTo(@Nonnull SegmentKey other) {
        int comparison = indexValue.compareTo(other.indexValue);
        return comparison != 0 ? comparison : Long.compare(segmentNumber, other.segmentNumber);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SegmentKey that = (SegmentKey)o;
        return segmentNumber == that.segmentNumber && indexValue.equals(that.indexValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indexValue, segmentNumber);
    }

    @Override
    public String toString() {
        return indexValue + "@" + segmentNumber;
    }
}
