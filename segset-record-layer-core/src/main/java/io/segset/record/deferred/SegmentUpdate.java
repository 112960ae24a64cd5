/*
 * SegmentUpdate.java
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
import io.segset.segment.Segment;
import io.segset.segment.Segments;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The pending changes to one segment: offsets to add and offsets to remove. The two never overlap.
 *
 * <p>
 * Applying an update is idempotent. Adding an offset that is present and removing one that is absent both leave a
 * segment unchanged, so applying the same update to its own result changes nothing.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class SegmentUpdate {
    @Nonnull
    private final SegmentKey key;
    @Nullable
    private final Segment additions;
    @Nullable
    private final Segment removals;

    public SegmentUpdate(@Nonnull SegmentKey key, @Nullable Segment additions, @Nullable Segment removals) {
        this.key = key;
        this.additions = additions;
        this.removals = Segments.difference(removals, additions);
    }

    @Nonnull
    public SegmentKey getKey() {
        return key;
    }

    @Nonnull
    public Tuple getIndexValue() {
        return key.getIndexValue();
    }

    public long getSegmentNumber() {
        return key.getSegmentNumber();
    }

    @Nullable
    public Segment getAdditions() {
        return additions;
    }

    @Nullable
    public Segment getRemovals() {
        return removals;
    }

    /**
     * Get the number of offsets this update changes.
     * @return the number of additions and removals
     */
    public int size() {
        return (additions == null ? 0 : additions.count()) + (removals == null ? 0 : removals.count());
    }

    /**
     * Combine this update with one made after it to the same segment. Where the two disagree about an offset, the
     * later update wins.
     * @param later the later update
     * @return an update with the effect of applying this update and then {@code later}
     */
    @Nonnull
    public SegmentUpdate then(@Nonnull SegmentUpdate later) {
        if (!key.equals(later.key)) {
            throw new IllegalArgumentException("updates are for different segments: " + key + " and " + later.key);
        }
        Segment combinedAdditions = Segments.union(Segments.difference(additions, later.removals), later.additions);
        Segment combinedRemovals = Segments.union(Segments.difference(removals, later.additions), later.removals);
        return new SegmentUpdate(key, combinedAdditions, combinedRemovals);
    }

    /**
     * Apply this update to a segment. Removals are applied first, then additions, and the result is encoded
     * according to the size policy of {@link Segments}.
     * @param current the current segment, or {@code null} if it is empty
     * @return the updated segment, or {@code null} if it is empty
     */
    @Nullable
    public Segment applyTo(@Nullable Segment current) {
        return Segments.union(Segments.difference(current, removals), additions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SegmentUpdate that = (SegmentUpdate)o;
        return key.equals(that.key) && Objects.equals(additions, that.additions) && Objects.equals(removals, that.removals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, additions, removals);
    }

    @Override
    public String toString() {
        return "SegmentUpdate{" + key + ", +" + additions + ", -" + removals + "}";
    }
}
