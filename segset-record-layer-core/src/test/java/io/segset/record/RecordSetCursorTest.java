/*
 * RecordSetCursorTest.java
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

import io.segset.segment.SegmentRangeException;
import io.segset.segment.SegmentSize;
import io.segset.test.RandomSeedSource;
import io.segset.test.RandomizedTestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RecordSetCursor}.
 */
public class RecordSetCursorTest {
    private static final SegmentSize SIZE = SegmentSize.of(64, 8);

    @Test
    public void emptySet() {
        RecordSetCursor cursor = new RecordSet(SIZE).cursor();
        assertTrue(cursor.isBeforeFirst());
        assertNull(cursor.current());
        assertNull(cursor.first());
        assertTrue(cursor.isAfterLast());
        assertNull(cursor.last());
        assertTrue(cursor.isBeforeFirst());
        assertNull(cursor.next());
        assertNull(cursor.prior());
        assertNull(cursor.setAt(10));
        assertEquals(0, cursor.count());
    }

    @Test
    public void forwardAndBackward() {
        RecordSet recordSet = RecordSet.of(SIZE, 0, 63, 64, 200, 201);
        RecordSetCursor cursor = recordSet.cursor();
        List<Long> forward = new ArrayList<>();
        for (Long recordNumber = cursor.next(); recordNumber != null; recordNumber = cursor.next()) {
            forward.add(recordNumber);
        }
        assertThat(forward, contains(0L, 63L, 64L, 200L, 201L));
        assertTrue(cursor.isAfterLast());
        assertNull(cursor.next());

        List<Long> backward = new ArrayList<>();
        for (Long recordNumber = cursor.prior(); recordNumber != null; recordNumber = cursor.prior()) {
            backward.add(recordNumber);
        }
        assertThat(backward, contains(201L, 200L, 64L, 63L, 0L));
        assertTrue(cursor.isBeforeFirst());
        assertNull(cursor.prior());
    }

    @Test
    public void firstAndLast() {
        RecordSetCursor cursor = RecordSet.of(SIZE, 7, 300).cursor();
        assertEquals(Long.valueOf(300), cursor.last());
        assertEquals(Long.valueOf(300), cursor.current());
        assertEquals(Long.valueOf(1), cursor.getPosition());
        assertEquals(Long.valueOf(7), cursor.first());
        assertEquals(Long.valueOf(0), cursor.getPosition());
        assertNull(cursor.prior());
        assertNull(cursor.getPosition());
        assertEquals(Long.valueOf(7), cursor.next());
    }

    @Test
    public void setAt() {
        RecordSetCursor cursor = RecordSet.of(SIZE, 5, 10, 130).cursor();
        assertEquals(Long.valueOf(10), cursor.setAt(10));
        assertEquals(Long.valueOf(130), cursor.setAt(11));
        assertEquals(Long.valueOf(5), cursor.setAt(0));
        assertEquals(Long.valueOf(130), cursor.setAt(64));
        assertNull(cursor.setAt(131));
        assertTrue(cursor.isAfterLast());
        assertEquals(Long.valueOf(130), cursor.prior());
        assertThrows(SegmentRangeException.class, () -> cursor.setAt(-1));
    }

    @Test
    public void snapshot() {
        RecordSet recordSet = RecordSet.of(SIZE, 1, 2);
        RecordSetCursor cursor = recordSet.cursor();
        recordSet.addRecord(3);
        recordSet.removeRecord(1);
        assertEquals(Long.valueOf(1), cursor.next());
        assertEquals(Long.valueOf(2), cursor.next());
        assertNull(cursor.next());
        assertEquals(2, cursor.count());
        assertFalse(recordSet.contains(1));
    }

    @ParameterizedTest
    @RandomSeedSource({0x5e65L, 7L, 0xbeefL})
    public void visitsEveryRecordInOrder(long seed) {
        Random r = new Random(seed);
        RecordSet recordSet = new RecordSet(SIZE);
        for (long recordNumber : RandomizedTestUtils.randomRecordNumbers(r, 64 * 6, 300)) {
            recordSet.addRecord(recordNumber);
        }
        List<Long> expected = recordSet.recordNumbers().boxed().collect(Collectors.toList());

        RecordSetCursor cursor = recordSet.cursor();
        List<Long> actual = new ArrayList<>();
        long position = 0;
        for (Long recordNumber = cursor.first(); recordNumber != null; recordNumber = cursor.next()) {
            actual.add(recordNumber);
            assertEquals(Long.valueOf(position++), cursor.getPosition());
        }
        assertEquals(expected, actual);
        assertEquals(expected.size(), cursor.count());

        for (long recordNumber = 0; recordNumber < 64 * 6; recordNumber++) {
            Long found = cursor.setAt(recordNumber);
            final long target = recordNumber;
            Long ceiling = expected.stream().filter(value -> value >= target).findFirst().orElse(null);
            assertEquals(ceiling, found);
        }
    }
}
