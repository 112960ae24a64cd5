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
 * Sets of record numbers stored as segments, with set algebra and cursors.
 *
 * <p>
 * A {@link io.segset.record.RecordSet} divides the record number space into fixed-size segments and keeps one
 * {@link io.segset.segment.Segment} for each segment that holds at least one record. Sets built with the same
 * {@link io.segset.segment.SegmentSize} can be combined with union, intersection and difference, and complemented
 * within a universe of record numbers. A {@link io.segset.record.RecordSetCursor} walks a set in either direction.
 * </p>
 */
package io.segset.record;
