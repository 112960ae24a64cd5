/*
 * SegmentTest.java
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
import java.util.TreeSet;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the {@link Segment} encodings and the size policy in {@link Segments}.
 */
public class SegmentTest {
    private static final SegmentSize SIZE = SegmentSize.of(64, 8);

    @Test
    public void singleRecordIsInteger() {
        Segment segment = new IntegerSegment(SIZE, 5);
        assertEquals(SegmentKind.INTEGER, segment.getKind());
        assertEquals(1, segment.count());
        assertTrue(segment.contains(5));
        assertFalse(segment.contains(6));
        assertSame(segment, segment.add(5));
        assertSame(segment, segment.remove(6));
        assertNull(segment.remove(5));
        assertEquals(SegmentKind.INTEGER, Segments.of(SIZE, 9, 9, 9).getKind());
    }

    @Test
    public void growsThroughEncodings() {
        Segment segment = new IntegerSegment(SIZE, 3);
        segment = segment.add(40);
        assertThat(segment, instanceOf(ListSegment.class));
        assertArrayEquals(new int[] {3, 40}, segment.toOffsets());
        for (int offset = 9; offset <= 14; offset++) {
            segment = segment.add(offset);
            assertEquals(SegmentKind.LIST, segment.getKind());
        }
        assertEquals(8, segment.count());
        segment = segment.add(15);
        assertEquals(SegmentKind.BITMAP, segment.getKind());
        assertEquals(9, segment.count());
        assertArrayEquals(new int[] {3, 9, 10, 11, 12, 13, 14, 15, 40}, segment.toOffsets());
    }

    @Test
    public void shrinksThroughEncodings() {
        Segment segment = Segments.of(SIZE, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertNotNull(segment);
        assertEquals(SegmentKind.BITMAP, segment.getKind());
        segment = segment.remove(9);
        assertEquals(SegmentKind.LIST, segment.getKind());
        assertEquals(Segments.of(SIZE, 1, 2, 3, 4, 5, 6, 7, 8), segment);
        for (int offset = 1; offset < 8; offset++) {
            segment = segment.remove(offset);
        }
        assertEquals(new IntegerSegment(SIZE, 8), segment);
        assertNull(segment.remove(8));
    }

    @Test
    public void listInsertKeepsOrder() {
        Segment segment = Segments.of(SIZE, 30, 10);
        segment = segment.add(20).add(0).add(20).add(63);
        assertArrayEquals(new int[] {0, 10, 20, 30, 63}, segment.toOffsets());
        assertSame(segment, segment.remove(31));
    }

    @Test
    public void offsetBoundary() {
        Segment segment = new IntegerSegment(SIZE, 0);
        assertEquals(2, segment.add(63).count());
        assertThrows(SegmentRangeException.class, () -> segment.add(64));
        assertThrows(SegmentRangeException.class, () -> segment.add(-1));
        assertThrows(SegmentRangeException.class, () -> new IntegerSegment(SIZE, 64));
        assertThrows(SegmentRangeException.class, () -> Segments.of(SIZE, 1, 64));
        Segment bitmap = Segments.full(SIZE);
        assertThrows(SegmentRangeException.class, () -> bitmap.contains(64));
        assertThrows(SegmentRangeException.class, () -> bitmap.remove(64));
    }

    @Test
    public void fullBitmap() {
        Segment full = Segments.full(SIZE);
        assertEquals(64, full.count());
        assertTrue(((BitmapSegment)full).isFull());
        for (int offset = 0; offset < 64; offset++) {
            assertSame(full, full.add(offset));
        }
        assertEquals(0, full.first());
        assertEquals(63, full.last());
        assertNull(Segments.prefix(SIZE, 0));
        assertEquals(Segments.of(SIZE, 0, 1, 2), Segments.prefix(SIZE, 3));
    }

    @ParameterizedTest
    @RandomSeedSource({0x5e9L, 31L, 0xdecafL})
    public void navigationMatchesTreeSet(long seed) {
        Random r = new Random(seed);
        int count = 1 + r.nextInt(30);
        TreeSet<Integer> expected = new TreeSet<>();
        Segment segment = null;
        for (int i = 0; i < count; i++) {
            int offset = r.nextInt(64);
            expected.add(offset);
            segment = segment == null ? new IntegerSegment(SIZE, offset) : segment.add(offset);
        }
        assertNotNull(segment);
        assertEquals(expected.size(), segment.count());
        assertEquals((int)expected.first(), segment.first());
        assertEquals((int)expected.last(), segment.last());
        int position = 0;
        for (int offset = 0; offset <= 64; offset++) {
            Integer ceiling = expected.ceiling(offset);
            Integer floor = expected.floor(offset);
            assertEquals(ceiling == null ? Segment.NO_OFFSET : ceiling, segment.ceiling(offset));
            assertEquals(floor == null ? Segment.NO_OFFSET : floor, segment.floor(offset));
            assertEquals(expected.headSet(offset).size(), segment.rank(offset));
        }
        for (int offset : expected) {
            assertEquals(offset, segment.select(position));
            position++;
        }
        Segment finalSegment = segment;
        assertThrows(IndexOutOfBoundsException.class, () -> finalSegment.select(finalSegment.count()));
        assertEquals(Segment.NO_OFFSET, segment.floor(-1));
    }

    @Test
    public void equalityIsByContent() {
        Segment a = Segments.of(SIZE, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13);
        Segment b = Segments.of(SIZE, 13, 12, 11, 10, 9, 8, 7, 6, 5, 4);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertFalse(a.equals(b.remove(4)));
        assertFalse(Segments.of(SIZE, 1, 2).equals(Segments.of(SegmentSize.of(64, 4), 1, 2)));
    }

    @Test
    public void bitmapBytes() {
        Segment segment = Segments.of(SIZE, 0, 9);
        byte[] bits = segment.toBitmapBytes();
        assertEquals(8, bits.length);
        assertEquals((byte)0x80, bits[0]);
        assertEquals((byte)0x40, bits[1]);
        assertEquals(segment, Segments.fromBitmap(SIZE, bits));
        assertNull(Segments.fromBitmap(SIZE, new byte[8]));
    }
}
