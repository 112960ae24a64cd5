/*
 * SegmentKind.java
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

package io.segset.segment;

import com.google.common.base.Verify;
import io.segset.annotation.API;
import io.segset.util.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * The three encodings of a segment, each with the tag byte that precedes its payload when stored.
 */
@API(API.Status.UNSTABLE)
public enum SegmentKind {
    /**
     * A single record. Implemented by {@link IntegerSegment}.
     */
    INTEGER((byte)0x01),

    /**
     * A sorted list of up to {@link SegmentSize#getListThreshold()} offsets. Implemented by {@link ListSegment}.
     */
    LIST((byte)0x02),

    /**
     * A bit per offset. Implemented by {@link BitmapSegment}.
     */
    BITMAP((byte)0x03);

    private final byte serialized;

    SegmentKind(final byte serialized) {
        this.serialized = serialized;
    }

    public byte getSerialized() {
        return serialized;
    }

    /**
     * Get the kind stored as the given tag byte.
     * @param serializedKind the tag byte
     * @return the corresponding {@link SegmentKind}
     * @throws SegmentEncodingException if the tag does not name a known kind
     */
    @Nonnull
    public static SegmentKind fromSerializedKind(byte serializedKind) {
        final SegmentKind kind;
        switch (serializedKind) {
            case 0x01:
                kind = SegmentKind.INTEGER;
                break;
            case 0x02:
                kind = SegmentKind.LIST;
                break;
            case 0x03:
                kind = SegmentKind.BITMAP;
                break;
            default:
                throw new SegmentEncodingException("unknown segment kind", LogMessageKeys.TAG, serializedKind);
        }
        Verify.verify(kind.getSerialized() == serializedKind);
        return kind;
    }
}
