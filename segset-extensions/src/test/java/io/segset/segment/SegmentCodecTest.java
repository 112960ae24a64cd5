/*
 * SegmentCodecTest.java
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

import io.segset.test.RandomSeedSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SegmentCodec}.
 */
public class SegmentCodecTest {
    private static final SegmentSize SIZE = SegmentSize.of(64, 8);
    private static final SegmentCodec CODEC = new SegmentCodec(SIZE);

    @Test
    public void integerPayload() {
        Segment segment = new IntegerSegment(SIZE, 0x3f);
        assertArrayEquals(new byte[] {0x00, 0x3f}, CODEC.encodePayload(segment));
        assertArrayEquals(new byte[] {0x01, 0x00, 0x3f}, CODEC.encode(segment));
        assertEquals(segment, CODEC.decode(CODEC.encode(segment)));
    }

    @Test
    public void listPayload() {
        Segment segment = Segments.of(SIZE, 40, 3, 9);
        assertArrayEquals(new byte[] {0x00, 0x03, 0x00, 0x09, 0x00, 0x28}, CODEC.encodePayload(segment));
        assertEquals(SegmentKind.LIST, SegmentKind.fromSerializedKind(CODEC.encode(segment)[0]));
        assertEquals(segment, CODEC.decode(CODEC.encode(segment)));
    }

    @Test
    public void bitmapPayload() {
        Segment segment = Segments.of(SIZE, 3, 9, 10, 11, 12, 13, 14, 15, 40);
        byte[] payload = CODEC.encodePayload(segment);
        assertArrayEquals(new byte[] {0x10, 0x7f, 0x00, 0x00, 0x00, (byte)0x80, 0x00, 0x00}, payload);
        assertEquals(segment, CODEC.decodePayload(SegmentKind.BITMAP, payload));
        assertEquals(segment, CODEC.decode(CODEC.encode(segment)));
    }

    @Test
    public void defaultSizePayloadLengths() {
        SegmentCodec codec = new SegmentCodec(SegmentSize.DEFAULT);
        assertEquals(2, codec.encodePayload(new IntegerSegment(SegmentSize.DEFAULT, 31999)).length);
        assertEquals(4000, codec.encodePayload(Segments.full(SegmentSize.DEFAULT)).length);
        assertEquals(4001, codec.encode(Segments.full(SegmentSize.DEFAULT)).length);
    }

    @ParameterizedTest
    @RandomSeedSource({0xc0dec0deL, 5L, 7777L})
    public void roundTrip(long seed) {
        Random r = new Random(seed);
        for (int i = 0; i < 50; i++) {
            int[] offsets = new int[1 + r.nextInt(20)];
            for (int j = 0; j < offsets.length; j++) {
                offsets[j] = r.nextInt(64);
            }
            Segment segment = Segments.of(SIZE, offsets);
            assertNotNull(segment);
            Segment decoded = CODEC.decode(CODEC.encode(segment));
            assertEquals(segment, decoded);
            assertEquals(segment.getKind(), decoded.getKind());
        }
    }

    @Test
    public void bitmapAtListThresholdIsRejected() {
        byte[] data = new byte[9];
        data[0] = 0x03;
        data[1] = (byte)0xc0;
        SegmentEncodingException e = assertThrows(SegmentEncodingException.class, () -> CODEC.decode(data));
        assertArrayEquals(data, e.getData());

        // exactly the list threshold of 8
        byte[] payload = new byte[8];
        payload[0] = (byte)0xff;
        assertThrows(SegmentEncodingException.class, () -> CODEC.decodePayload(SegmentKind.BITMAP, payload));
        payload[1] = 0x01;
        Segment decoded = CODEC.decodePayload(SegmentKind.BITMAP, payload);
        assertEquals(SegmentKind.BITMAP, decoded.getKind());
        assertEquals(9, decoded.count());
        payload[1] = 0x00;
        assertEquals(9, decoded.count());
    }

    @Test
    public void malformed() {
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(new byte[0]));
        SegmentEncodingException unknownTag = assertThrows(SegmentEncodingException.class, () -> CODEC.decode(new byte[] {0x09, 0x00, 0x01}));
        assertArrayEquals(new byte[] {0x09, 0x00, 0x01}, unknownTag.getData());
        // integer of wrong length
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(new byte[] {0x01, 0x00}));
        // integer out of range
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(new byte[] {0x01, 0x00, 0x40}));
        // list with partial offset
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(new byte[] {0x02, 0x00, 0x01, 0x00}));
        // list of one
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(new byte[] {0x02, 0x00, 0x01}));
        // list out of order
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(new byte[] {0x02, 0x00, 0x05, 0x00, 0x01}));
        // list with duplicates
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(new byte[] {0x02, 0x00, 0x05, 0x00, 0x05}));
        // list longer than the threshold
        byte[] longList = new byte[1 + 9 * 2];
        longList[0] = 0x02;
        for (int i = 0; i < 9; i++) {
            longList[2 + 2 * i] = (byte)i;
        }
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(longList));
        // bitmap of wrong length
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(new byte[] {0x03, (byte)0xff}));
        // empty bitmap
        byte[] emptyBitmap = new byte[9];
        emptyBitmap[0] = 0x03;
        assertThrows(SegmentEncodingException.class, () -> CODEC.decode(emptyBitmap));
    }

    @Test
    public void wrongSize() {
        Segment segment = Segments.of(SegmentSize.of(128, 8), 1, 2);
        assertThrows(IllegalArgumentException.class, () -> CODEC.encode(segment));
    }
}
