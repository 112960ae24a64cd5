/*
 * DeferredUpdateEvents.java
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

import io.segset.annotation.API;
import io.segset.record.provider.common.StoreTimer;

/**
 * {@link StoreTimer} events related to deferred update.
 */
@API(API.Status.EXPERIMENTAL)
@SuppressWarnings("PMD.MissingStaticMethodInNonInstantiatableClass")
public class DeferredUpdateEvents {
    private DeferredUpdateEvents() {
    }

    /**
     * Timed events.
     */
    public enum Events implements StoreTimer.Event {
        FLUSH("deferred update flush"),
        MERGE_RUNS("deferred update merge runs");

        private final String title;

        Events(String title) {
            this.title = title;
        }

        @Override
        public String title() {
            return title;
        }
    }

    /**
     * Counted events. Segment counts are recorded only once the flush that touched them has committed.
     */
    public enum Counts implements StoreTimer.Count {
        OFFSET_BUFFERED("deferred update offset buffered"),
        BUFFER_EXHAUSTED("deferred update buffer exhausted"),
        SEGMENT_READ("deferred update segment read"),
        SEGMENT_WRITTEN("deferred update segment written"),
        SEGMENT_DELETED("deferred update segment deleted"),
        SEGMENT_UNCHANGED("deferred update segment unchanged"),
        FLUSH_FAILED("deferred update flush failed");

        private final String title;

        Counts(String title) {
            this.title = title;
        }

        @Override
        public String title() {
            return title;
        }

        @Override
        public boolean isSize() {
            return false;
        }
    }
}
