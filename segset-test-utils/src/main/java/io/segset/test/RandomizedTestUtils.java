/*
 * RandomizedTestUtils.java
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

package io.segset.test;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Seeds and random data for randomized tests of record sets.
 */
public final class RandomizedTestUtils {
    private static final long DEFAULT_SEED = 0x5e65e7L;
    private static final String INCLUDE_RANDOM_PROPERTY = "tests.includeRandom";
    private static final String ITERATIONS_PROPERTY = "tests.iterations";

    private RandomizedTestUtils() {
    }

    /**
     * Get the seeds for a parameterized test. The given seeds come first, or {@value #DEFAULT_SEED} if there are
     * none. With {@code -Dtests.includeRandom=true}, {@code tests.iterations} freshly drawn seeds follow, so a
     * longer run can explore more cases while any failure still names the seed that produced it.
     *
     * @param fixedSeeds seeds to always include
     * @return the seeds
     */
    @Nonnull
    public static Stream<Long> randomSeeds(long... fixedSeeds) {
        LongStream seeds = fixedSeeds.length == 0 ? LongStream.of(DEFAULT_SEED) : LongStream.of(fixedSeeds);
        if (Boolean.getBoolean(INCLUDE_RANDOM_PROPERTY)) {
            Random random = ThreadLocalRandom.current();
            seeds = LongStream.concat(seeds, LongStream.generate(random::nextLong).limit(Integer.getInteger(ITERATIONS_PROPERTY, 0)));
        }
        return seeds.boxed();
    }

    /**
     * Draw up to {@code maxCount} distinct offsets below {@code limit}, in ascending order. About half of the
     * draws fall in a narrow band at the start of the range, so that dense runs appear next to sparse ones.
     *
     * @param random the source of randomness
     * @param limit the exclusive upper bound of the offsets
     * @param maxCount the number of draws
     * @return the distinct offsets drawn, ascending
     */
    @Nonnull
    public static int[] randomOffsets(@Nonnull Random random, int limit, int maxCount) {
        int count = random.nextInt(maxCount + 1);
        int band = Math.max(1, limit / 3);
        int[] offsets = new int[count];
        for (int i = 0; i < count; i++) {
            offsets[i] = random.nextBoolean() ? random.nextInt(limit) : random.nextInt(band);
        }
        return Arrays.stream(offsets).sorted().distinct().toArray();
    }

    /**
     * Draw up to {@code maxCount} distinct record numbers below {@code universe}, clustered as by
     * {@link #randomOffsets}.
     *
     * @param random the source of randomness
     * @param universe the exclusive upper bound of the record numbers
     * @param maxCount the number of draws
     * @return the distinct record numbers drawn, ascending
     */
    @Nonnull
    public static long[] randomRecordNumbers(@Nonnull Random random, int universe, int maxCount) {
        return Arrays.stream(randomOffsets(random, universe, maxCount)).asLongStream().toArray();
    }
}
