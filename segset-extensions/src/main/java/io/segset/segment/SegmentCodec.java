/*
 * SegmentCodec.java
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

import com.google.common.base.Preconditions;
import io.segset.annotation.API;
import io.segset.bits.BitUtility;
import io.segset.util.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Arrays;

/**
 * Converts segments to and from their stored bytes.
 *
 * <p>
 * The payload of each encoding is:
 * </p>
 * <ul>
 *     <li>{@link IntegerSegment}: the offset as a {@value SegmentSize#OFFSET_BYTES}-byte big-endian integer</li>
 *     <li>{@link ListSegment}: the offsets in ascending order, each a {@value SegmentSize#OFFSET_BYTES}-byte
 *     big-endian integer, with no separators</li>
 *     <li>{@link BitmapSegment}: exactly {@link SegmentSize#getBitmapBytes()} bytes, one bit per offset, most
 *     significant bit first</li>
 * </ul>
 * <p>
 * A stored segment is the {@link SegmentKind} tag byte followed by the payload. The tag is needed because a list can
 * be as long as a bitmap when the list threshold is high relative to the segment size.
 * </p>
 *
 * <p>
 * Decoding checks the tag, the payload length and the order and range of list entries. A list must not exceed
 * {@link SegmentSize#getListThreshold()} entries and a bitmap must hold more records than that. Violations throw a
 * {@link SegmentEncodingException} carrying the bytes; nothing is corrected on the way in.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class SegmentCodec {
    private static final int TAG_BYTES = 1;

    @Nonnull
    private final SegmentSize segmentSize;

    public SegmentCodec(@Nonnull SegmentSize segmentSize) {
        this.segmentSize = segmentSize;
    }

    @Nonnull
    public SegmentSize getSegmentSize() {
        return segmentSize;
    }

    /**
     * Encode a segment with its tag.
     * @param segment the segment to encode
     * @return the tag byte followed by the payload
     */
    @Nonnull
    public byte[] encode(@Nonnull Segment segment) {
        byte[] payload = encodePayload(segment);
        byte[] data = new byte[TAG_BYTES + payload.length];
        data[0] = segment.getKind().getSerialized();
        System.arraycopy(payload, 0, data, TAG_BYTES, payload.length);
        return data;
    }

    /**
     * Encode the payload of a segment without its tag.
     * @param segment the segment to encode
     * @return the payload bytes
     */
    @Nonnull
    public byte[] encodePayload(@Nonnull Segment segment) {
        Preconditions.checkArgument(segment.getSegmentSize().equals(segmentSize),
                "segment size %s does not match codec size %s", segment.getSegmentSize(), segmentSize);
        if (segment.getKind() == SegmentKind.BITMAP) {
            return segment.toBitmapBytes();
        }
        int[] offsets = segment.toOffsets();
        byte[] payload = new byte[offsets.length * SegmentSize.OFFSET_BYTES];
        for (int i = 0; i < offsets.length; i++) {
            BitUtility.writeFixed(payload, i * SegmentSize.OFFSET_BYTES, SegmentSize.OFFSET_BYTES, offsets[i]);
        }
        return payload;
    }

    /**
     * Decode a tagged segment.
     * @param data the tag byte followed by the payload
     * @return the decoded segment
     * @throws SegmentEncodingException if the bytes are not a valid segment
     */
    @Nonnull
    public Segment decode(@Nonnull byte[] data) {
        if (data.length < TAG_BYTES) {
            throw new SegmentEncodingException("segment data is empty").setData(data);
        }
        final SegmentKind kind;
        try {
            kind = SegmentKind.fromSerializedKind(data[0]);
        } catch (SegmentEncodingException e) {
            throw e.setData(data);
        }
        byte[] payload = new byte[data.length - TAG_BYTES];
        System.arraycopy(data, TAG_BYTES, payload, 0, payload.length);
        try {
            return decodePayload(kind, payload);
        } catch (SegmentEncodingException e) {
            throw e.setData(data);
        }
    }

    /**
     * Decode a payload whose kind is known from elsewhere.
     * @param kind the encoding of the payload
     * @param payload the payload bytes
     * @return the decoded segment
     * @throws SegmentEncodingException if the bytes are not a valid payload of that kind
     */
    @Nonnull
    public Segment decodePayload(@Nonnull SegmentKind kind, @Nonnull byte[] payload) {
        switch (kind) {
            case INTEGER:
                checkLength(kind, payload, SegmentSize.OFFSET_BYTES);
                return new IntegerSegment(segmentSize, readOffset(payload, 0));
            case LIST:
                return decodeList(payload);
            case BITMAP:
                return decodeBitmap(payload);
            default:
                throw new SegmentEncodingException("unknown segment kind", LogMessageKeys.SEGMENT_KIND, kind);
        }
    }

    @Nonnull
    private Segment decodeList(@Nonnull byte[] payload) {
        if (payload.length % SegmentSize.OFFSET_BYTES != 0) {
            throw new SegmentEncodingException("list segment has partial offset",
                    LogMessageKeys.SEGMENT_KIND, SegmentKind.LIST,
                    LogMessageKeys.LENGTH, payload.length).setData(payload);
        }
        int count = payload.length / SegmentSize.OFFSET_BYTES;
        if (count < 2 || count > segmentSize.getListThreshold()) {
            throw new SegmentEncodingException("list segment has wrong number of offsets",
                    LogMessageKeys.COUNT, count,
                    LogMessageKeys.LIST_THRESHOLD, segmentSize.getListThreshold()).setData(payload);
        }
        int[] offsets = new int[count];
        for (int i = 0; i < count; i++) {
            offsets[i] = readOffset(payload, i * SegmentSize.OFFSET_BYTES);
            if (i > 0 && offsets[i] <= offsets[i - 1]) {
                throw new SegmentEncodingException("list segment offsets are not ascending",
                        LogMessageKeys.POSITION, i,
                        LogMessageKeys.OFFSET, offsets[i]).setData(payload);
            }
        }
        return new ListSegment(segmentSize, offsets);
    }

    @Nonnull
    private Segment decodeBitmap(@Nonnull byte[] payload) {
        checkLength(SegmentKind.BITMAP, payload, segmentSize.getBitmapBytes());
        int count = BitUtility.cardinality(payload);
        if (count <= segmentSize.getListThreshold()) {
            throw new SegmentEncodingException("bitmap segment does not exceed list threshold",
                    LogMessageKeys.COUNT, count,
                    LogMessageKeys.LIST_THRESHOLD, segmentSize.getListThreshold()).setData(payload);
        }
        return new BitmapSegment(segmentSize, Arrays.copyOf(payload, payload.length), count);
    }

    private int readOffset(@Nonnull byte[] payload, int pos) {
        int offset = (int)BitUtility.readFixed(payload, pos, SegmentSize.OFFSET_BYTES);
        if (offset >= segmentSize.getRecordsPerSegment()) {
            throw new SegmentEncodingException("offset outside segment",
                    LogMessageKeys.OFFSET, offset,
                    LogMessageKeys.SEGMENT_SIZE, segmentSize.getRecordsPerSegment()).setData(payload);
        }
        return offset;
    }

    private static void checkLength(@Nonnull SegmentKind kind, @Nonnull byte[] payload, int expectedLength) {
        if (payload.length != expectedLength) {
            throw new SegmentEncodingException("segment payload has wrong length",
                    LogMessageKeys.SEGMENT_KIND, kind,
                    LogMessageKeys.LENGTH, payload.length,
                    LogMessageKeys.EXPECTED_LENGTH, expectedLength).setData(payload);
        }
    }
}
