/*
 * SegmentUpdateMerger.java
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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import io.segset.annotation.API;
import io.segset.record.RecordCoreArgumentException;
import io.segset.record.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Merges sorted runs of {@link SegmentUpdate}s into a single sorted stream.
 *
 * <p>
 * A run is a sequence of updates in ascending key order with each key at most once, such as the result of
 * {@link DeferredUpdate#drainSortedRun()}. Runs are given oldest first. Updates to the same segment from several runs
 * are combined with {@link SegmentUpdate#then} in run order, so a later run wins where runs disagree.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class SegmentUpdateMerger {
    private SegmentUpdateMerger() {
    }

    /**
     * Merge sorted runs.
     * @param runs the runs, oldest first
     * @return an iterator over the merged updates in ascending key order
     */
    @Nonnull
    public static Iterator<SegmentUpdate> merge(@Nonnull List<? extends Iterator<SegmentUpdate>> runs) {
        return new MergingIterator(runs);
    }

    private static final class RunHead {
        private final int runIndex;
        @Nonnull
        private final PeekingIterator<SegmentUpdate> run;

        private RunHead(int runIndex, @Nonnull PeekingIterator<SegmentUpdate> run) {
            this.runIndex = runIndex;
            this.run = run;
        }
    }

    private static final class MergingIterator extends AbstractIterator<SegmentUpdate> {
        @Nonnull
        private final PriorityQueue<RunHead> heads;

        private MergingIterator(@Nonnull List<? extends Iterator<SegmentUpdate>> runs) {
            heads = new PriorityQueue<>(Math.max(1, runs.size()),
                    Comparator.<RunHead, SegmentKey>comparing(head -> head.run.peek().getKey())
                            .thenComparingInt(head -> head.runIndex));
            List<RunHead> initial = new ArrayList<>(runs.size());
            for (int i = 0; i < runs.size(); i++) {
                PeekingIterator<SegmentUpdate> run = Iterators.peekingIterator(runs.get(i));
                if (run.hasNext()) {
                    initial.add(new RunHead(i, run));
                }
            }
            heads.addAll(initial);
        }

        @Nullable
        @Override
        protected SegmentUpdate computeNext() {
            RunHead head = heads.poll();
            if (head == null) {
                return endOfData();
            }
            SegmentUpdate merged = advance(head);
            while (!heads.isEmpty() && heads.peek().run.peek().getKey().equals(merged.getKey())) {
                merged = merged.then(advance(heads.poll()));
            }
            return merged;
        }

        @Nonnull
        private SegmentUpdate advance(@Nonnull RunHead head) {
            SegmentUpdate update = head.run.next();
            if (head.run.hasNext()) {
                if (head.run.peek().getKey().compareTo(update.getKey()) <= 0) {
                    throw new RecordCoreArgumentException("run is not in ascending order",
                            LogMessageKeys.RUN_INDEX, head.runIndex,
                            LogMessageKeys.INDEX_VALUE, update.getIndexValue(),
                            LogMessageKeys.SEGMENT_NUMBER, update.getSegmentNumber());
                }
                heads.add(head);
            }
            return update;
        }
    }
}
