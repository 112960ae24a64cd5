/*
 * package-info.java
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

/**
 * Deferred index updates for bulk loads.
 *
 * <p>
 * {@link io.segset.record.deferred.DeferredUpdate} buffers additions and removals of record numbers by index value and
 * segment, and flushes them to a {@link io.segset.record.storage.SegmentStorageAdapter} in ascending order so that
 * each affected segment is read and written once. Buffers too large for memory can be drained into sorted runs and
 * combined with {@link io.segset.record.deferred.SegmentUpdateMerger}.
 * </p>
 */
package io.segset.record.deferred;
