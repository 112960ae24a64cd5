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
 * Segments: the records of one fixed-width slice of the record number space, in one of three encodings.
 *
 * <p>
 * {@link io.segset.segment.SegmentSize} fixes the width of a segment and the point at which a list of offsets becomes
 * a bitmap. {@link io.segset.segment.Segments} applies that policy and implements set operations between segments,
 * and {@link io.segset.segment.SegmentCodec} defines the stored form.
 * </p>
 */
package io.segset.segment;
