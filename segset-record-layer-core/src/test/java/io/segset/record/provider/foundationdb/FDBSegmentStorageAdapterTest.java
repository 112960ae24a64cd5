/*
 * FDBSegmentStorageAdapterTest.java
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

package io.segset.record.provider.foundationdb;

import com.apple.foundationdb.Database;
import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.Tuple;
import io.segset.record.RecordSet;
import io.segset.record.deferred.DeferredUpdate;
import io.segset.record.storage.SegmentIndex;
import io.segset.record.storage.SegmentStorageException;
import io.segset.record.test.TestDatabaseExtension;
import io.segset.segment.SegmentSize;
import io.segset.test.Tags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FDBSegmentStorageAdapter}.
 */
@Tag(Tags.RequiresFDB)
public class FDBSegmentStorageAdapterTest {
    @RegisterExtension
    static final TestDatabaseExtension dbExtension = new TestDatabaseExtension();

    private static final SegmentSize SIZE = SegmentSize.of(64, 8);
    private static final Tuple RED = Tuple.from("red");

    private Database db;
    private Subspace subspace;
    private FDBSegmentStorageAdapter adapter;

    @BeforeEach
    public void setUp() {
        db = dbExtension.getDatabase();
        subspace = new Subspace(Tuple.from("segset-test", UUID.randomUUID()));
        adapter = new FDBSegmentStorageAdapter(db, subspace);
    }

    @AfterEach
    public void tearDown() {
        db.run(tr -> {
            tr.clear(adapter.getSubspace().range());
            return null;
        });
    }

    @Test
    public void commitAndRollback() {
        adapter.begin();
        adapter.put(RED, 0, new byte[] {1});
        adapter.put(RED, 2, new byte[] {2});
        assertArrayEquals(new byte[] {1}, adapter.get(RED, 0));
        adapter.commit();
        assertArrayEquals(new byte[] {2}, adapter.get(RED, 2));
        assertThat(adapter.scan(RED).keySet(), contains(0L, 2L));

        adapter.begin();
        adapter.delete(RED, 0);
        assertNull(adapter.get(RED, 0));
        adapter.rollback();
        assertArrayEquals(new byte[] {1}, adapter.get(RED, 0));
        assertTrue(adapter.scan(Tuple.from("blue")).isEmpty());
    }

    @Test
    public void keysAreIndexValueThenSegmentNumber() {
        adapter.runInTransaction(() -> {
            adapter.put(RED, 3, new byte[] {7});
            return null;
        });
        assertEquals(subspace, adapter.getSubspace());
        byte[] stored = db.read(tr -> tr.get(adapter.getSubspace().pack(RED.add(3L))).join());
        assertArrayEquals(new byte[] {7}, stored);
    }

    @Test
    public void scanDoesNotSeeLongerIndexValues() {
        adapter.runInTransaction(() -> {
            adapter.put(RED, 0, new byte[] {1});
            adapter.put(RED.add("shade"), 0, new byte[] {2});
            return null;
        });
        assertThat(adapter.scan(RED).keySet(), contains(0L));
    }

    @Test
    public void deferredUpdateRoundTrip() {
        DeferredUpdate deferred = new DeferredUpdate(DeferredUpdate.newConfigBuilder().setSegmentSize(SIZE).build());
        for (long recordNumber = 0; recordNumber < 200; recordNumber += 3) {
            deferred.add(RED, recordNumber);
        }
        deferred.flush(adapter);
        RecordSet loaded = new SegmentIndex(adapter, SIZE).load(RED);
        assertEquals(67, loaded.count());
        assertEquals(4, loaded.getSegmentCount());
    }

    @Test
    public void writesNeedTransaction() {
        assertThrows(SegmentStorageException.class, () -> adapter.put(RED, 0, new byte[] {1}));
    }
}
