/*
 * RecordSetTest.java
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

package io.segset.record;

import io.segset.segment.SegmentKind;
import io.segset.segment.SegmentRangeException;
import io.segset.segment.SegmentSize;
import io.segset.segment.Segments;
import io.segset.test.RandomSeedSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;

import java.util.Random;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RecordSet}.
 */
public class RecordSetTest {
    private static final SegmentSize SIZE = SegmentSize.of(64, 8);
    private static final long UNIVERSE = 64 * 5 + 17;

    @Test
    public void addAndRemove() {
        RecordSet recordSet = new RecordSet(SIZE);
        assertTrue(recordSet.isEmpty());
        assertTrue(recordSet.addRecord(5));
        assertFalse(recordSet.addRecord(5));
        assertTrue(recordSet.addRecord(64 * 3 + 1));
        assertEquals(2, recordSet.count());
        assertEquals(2, recordSet.getSegmentCount());
        assertTrue(recordSet.contains(64 * 3 + 1));
        assertFalse(recordSet.contains(64 * 3));

        assertTrue(recordSet.removeRecord(5));
        assertFalse(recordSet.removeRecord(5));
        assertFalse(recordSet.removeRecord(1000));
        assertNull(recordSet.getSegment(0));
        assertEquals(1, recordSet.getSegmentCount());
        assertThat(recordSet.recordNumbers().boxed().collect(Collectors.toList()), contains(64L * 3 + 1));
    }

    @Test
    public void negativeRecordNumber() {
        RecordSet recordSet = new RecordSet(SIZE);
        assertThrows(SegmentRangeException.class, () -> recordSet.addRecord(-1));
        assertThrows(SegmentRangeException.class, () -> recordSet.contains(-1));
        assertThrows(RecordCoreArgumentException.class, () -> recordSet.putSegment(-1, Segments.of(SIZE, 1)));
    }

    @Test
    public void segmentKindsFollowCount() {
        RecordSet recordSet = RecordSet.of(SIZE, 3, 40, 3, 9, 10, 11, 12, 13, 14, 15);
        assertEquals(SegmentKind.BITMAP, recordSet.getSegment(0).getKind());
        assertEquals(9, recordSet.count());
        recordSet.removeRecord(40);
        assertEquals(SegmentKind.LIST, recordSet.getSegment(0).getKind());
        for (long recordNumber = 9; recordNumber <= 15; recordNumber++) {
            recordSet.removeRecord(recordNumber);
        }
        assertEquals(SegmentKind.INTEGER, recordSet.getSegment(0).getKind());
    }

    @Test
    public void setOperations() {
        RecordSet a = RecordSet.of(SIZE, 1, 2, 3, 100, 200);
        RecordSet b = RecordSet.of(SIZE, 3, 4, 200, 300);
        assertEquals(RecordSet.of(SIZE, 1, 2, 3, 4, 100, 200, 300), a.union(b));
        assertEquals(RecordSet.of(SIZE, 3, 200), a.intersection(b));
        assertEquals(RecordSet.of(SIZE, 1, 2, 100), a.difference(b));
        assertEquals(RecordSet.of(SIZE, 1, 2, 4, 100, 300), a.symmetricDifference(b));
        assertEquals(RecordSet.of(SIZE, 1, 2, 3, 100, 200), a);
    }

    @Test
    public void intersectionDropsEmptySegments() {
        RecordSet a = RecordSet.of(SIZE, 1, 65);
        RecordSet b = RecordSet.of(SIZE, 2, 65);
        RecordSet intersection = a.intersection(b);
        assertEquals(1, intersection.getSegmentCount());
        assertNull(intersection.getSegment(0));
    }

    @Test
    public void mismatchedSegmentSizes() {
        RecordSet a = RecordSet.of(SIZE, 1);
        RecordSet b = RecordSet.of(SegmentSize.of(128), 1);
        assertThrows(RecordCoreArgumentException.class, () -> a.union(b));
        assertThrows(RecordCoreArgumentException.class, () -> a.putSegment(0, Segments.of(SegmentSize.of(128), 1)));
    }

    @Test
    public void complement() {
        RecordSet recordSet = RecordSet.of(SIZE, 0, 5, 70, 400);
        RecordSet complement = recordSet.complement(130);
        assertEquals(127, complement.count());
        assertFalse(complement.contains(0));
        assertFalse(complement.contains(70));
        assertTrue(complement.contains(129));
        assertFalse(complement.contains(130));
        assertFalse(complement.contains(400));
        assertEquals(RecordSet.of(SIZE, 0, 5, 70), complement.complement(130));

        assertTrue(new RecordSet(SIZE).complement(0).isEmpty());
        assertThrows(RecordCoreArgumentException.class, () -> recordSet.complement(-1));
    }

    @Test
    public void complementSharesFullSegments() {
        RecordSet full = RecordSet.full(SIZE, 64 * 3);
        assertEquals(64 * 3, full.count());
        assertSame(full.getSegment(0), full.getSegment(2));
        full.addRecord(64 * 3 + 1);
        full.removeRecord(1);
        assertEquals(64, full.getSegment(2).count());
        assertEquals(63, full.getSegment(0).count());
    }

    @Test
    public void positions() {
        RecordSet recordSet = RecordSet.of(SIZE, 3, 10, 64, 200);
        assertEquals(0, recordSet.getPositionOfRecordNumber(3));
        assertEquals(1, recordSet.getPositionOfRecordNumber(4));
        assertEquals(2, recordSet.getPositionOfRecordNumber(64));
        assertEquals(4, recordSet.getPositionOfRecordNumber(1000));
        assertEquals(Long.valueOf(64), recordSet.getRecordNumberAtPosition(2));
        assertEquals(Long.valueOf(200), recordSet.getRecordNumberAtPosition(-1));
        assertEquals(Long.valueOf(3), recordSet.getRecordNumberAtPosition(-4));
        assertNull(recordSet.getRecordNumberAtPosition(4));
        assertNull(recordSet.getRecordNumberAtPosition(-5));
    }

    @Test
    public void getSegmentsIsUnmodifiable() {
        RecordSet recordSet = RecordSet.of(SIZE, 1);
        assertThrows(UnsupportedOperationException.class, () -> recordSet.getSegments().clear());
        RecordSet copy = recordSet.copy();
        copy.addRecord(2);
        assertEquals(1, recordSet.count());
        assertThat(new RecordSet(SIZE).getSegments().keySet(), is(empty()));
    }

    @ParameterizedTest
    @RandomSeedSource({0x5e65L, 42L, 0xcafeL})
    public void setLaws(long seed) {
        Random r = new Random(seed);
        RecordSet a = random(r);
        RecordSet b = random(r);
        RecordSet c = random(r);
        RecordSet empty = new RecordSet(SIZE);
        RecordSet full = RecordSet.full(SIZE, UNIVERSE);

        assertEquals(a.union(b), b.union(a));
        assertEquals(a.intersection(b), b.intersection(a));
        assertEquals(a.union(b).union(c), a.union(b.union(c)));
        assertEquals(a.intersection(b).intersection(c), a.intersection(b.intersection(c)));
        assertEquals(a.intersection(b.union(c)), a.intersection(b).union(a.intersection(c)));

        assertEquals(a, a.union(empty));
        assertEquals(a, a.intersection(full));
        assertEquals(a, a.union(a));
        assertTrue(a.difference(a).isEmpty());
        assertEquals(a.difference(b), a.intersection(b.complement(UNIVERSE)));
        assertEquals(a.union(b).difference(a.intersection(b)), a.symmetricDifference(b));

        assertEquals(a, a.complement(UNIVERSE).complement(UNIVERSE));
        assertTrue(a.intersection(a.complement(UNIVERSE)).isEmpty());
        assertEquals(full, a.union(a.complement(UNIVERSE)));
        assertEquals(a.union(b).complement(UNIVERSE), a.complement(UNIVERSE).intersection(b.complement(UNIVERSE)));
        assertEquals(a.intersection(b).complement(UNIVERSE), a.complement(UNIVERSE).union(b.complement(UNIVERSE)));

        TreeSet<Long> expected = toTreeSet(a);
        expected.addAll(toTreeSet(b));
        assertEquals(expected, toTreeSet(a.union(b)));
        assertEquals(expected.size(), a.union(b).count());
    }

    private static RecordSet random(Random r) {
        RecordSet recordSet = new RecordSet(SIZE);
        int count = r.nextInt(120);
        for (int i = 0; i < count; i++) {
            // cluster some records so that bitmaps appear
            long recordNumber = r.nextBoolean() ? r.nextInt((int)UNIVERSE) : 64 + r.nextInt(20);
            recordSet.addRecord(recordNumber);
        }
        return recordSet;
    }

    private static TreeSet<Long> toTreeSet(RecordSet recordSet) {
        TreeSet<Long> result = new TreeSet<>();
        recordSet.recordNumbers().forEach(result::add);
        return result;
    }
}
