/*
 * BitUtility.java
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

package io.segset.bits;

import com.google.common.base.Preconditions;
import io.segset.annotation.API;

import javax.annotation.Nonnull;

/**
 * Static helpers for bit vectors stored in byte arrays and for fixed-width integers.
 *
 * <p>
 * Bit vectors are packed most-significant-bit first: bit {@code i} is stored in byte {@code i / 8} under the mask
 * {@code 0x80 >>> (i % 8)}. This is the layout of a persisted bitmap segment, so the helpers here operate on
 * those bytes directly. Fixed-width integers are unsigned and big-endian.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class BitUtility {
    /**
     * Return value of the search methods when no bit is found.
     */
    public static final int NO_BIT = -1;

    private BitUtility() {
    }

    /**
     * Number of bytes needed to hold the given number of bits.
     * @param bitCount number of bits
     * @return number of bytes, rounding up
     */
    public static int bytesForBits(int bitCount) {
        Preconditions.checkArgument(bitCount >= 0, "bit count must not be negative");
        return (bitCount + 7) >>> 3;
    }

    private static int mask(int index) {
        return 0x80 >>> (index & 7);
    }

    public static boolean get(@Nonnull byte[] bits, int index) {
        Preconditions.checkElementIndex(index, bits.length * 8);
        return (bits[index >>> 3] & mask(index)) != 0;
    }

    public static void set(@Nonnull byte[] bits, int index) {
        Preconditions.checkElementIndex(index, bits.length * 8);
        bits[index >>> 3] |= (byte)mask(index);
    }

    public static void clear(@Nonnull byte[] bits, int index) {
        Preconditions.checkElementIndex(index, bits.length * 8);
        bits[index >>> 3] &= (byte)~mask(index);
    }

    /**
     * Set every bit in {@code [fromIndex, toIndex)}.
     * @param bits the bit vector to modify
     * @param fromIndex first bit to set
     * @param toIndex one past the last bit to set
     */
    public static void setRange(@Nonnull byte[] bits, int fromIndex, int toIndex) {
        Preconditions.checkPositionIndexes(fromIndex, toIndex, bits.length * 8);
        int index = fromIndex;
        while (index < toIndex && (index & 7) != 0) {
            set(bits, index);
            index++;
        }
        while (index + 8 <= toIndex) {
            bits[index >>> 3] = (byte)0xff;
            index += 8;
        }
        while (index < toIndex) {
            set(bits, index);
            index++;
        }
    }

    /**
     * Population count of the whole vector.
     * @param bits the bit vector
     * @return the number of set bits
     */
    public static int cardinality(@Nonnull byte[] bits) {
        int count = 0;
        for (byte b : bits) {
            count += Integer.bitCount(b & 0xff);
        }
        return count;
    }

    /**
     * Number of set bits strictly before the given index.
     * @param bits the bit vector
     * @param index the exclusive upper bound, which may equal the vector length in bits
     * @return the number of set bits in {@code [0, index)}
     */
    public static int cardinalityBefore(@Nonnull byte[] bits, int index) {
        Preconditions.checkPositionIndex(index, bits.length * 8);
        int byteIndex = index >>> 3;
        int count = 0;
        for (int i = 0; i < byteIndex; i++) {
            count += Integer.bitCount(bits[i] & 0xff);
        }
        int remainder = index & 7;
        if (remainder != 0) {
            count += Integer.bitCount(bits[byteIndex] & (0xff << (8 - remainder)) & 0xff);
        }
        return count;
    }

    /**
     * Find the first set bit at or after {@code fromIndex}.
     * @param bits the bit vector
     * @param fromIndex the index to start from
     * @return the index of the bit or {@link #NO_BIT}
     */
    public static int nextSetBit(@Nonnull byte[] bits, int fromIndex) {
        Preconditions.checkArgument(fromIndex >= 0, "index must not be negative");
        int byteIndex = fromIndex >>> 3;
        if (byteIndex >= bits.length) {
            return NO_BIT;
        }
        int value = bits[byteIndex] & (0xff >>> (fromIndex & 7));
        while (true) {
            if (value != 0) {
                return (byteIndex << 3) + Integer.numberOfLeadingZeros(value) - 24;
            }
            byteIndex++;
            if (byteIndex >= bits.length) {
                return NO_BIT;
            }
            value = bits[byteIndex] & 0xff;
        }
    }

    /**
     * Find the last set bit at or before {@code fromIndex}. An index past the end of the vector searches from the end.
     * @param bits the bit vector
     * @param fromIndex the index to start from
     * @return the index of the bit or {@link #NO_BIT}
     */
    public static int previousSetBit(@Nonnull byte[] bits, int fromIndex) {
        if (fromIndex < 0 || bits.length == 0) {
            return NO_BIT;
        }
        int index = Math.min(fromIndex, bits.length * 8 - 1);
        int byteIndex = index >>> 3;
        int value = bits[byteIndex] & (0xff << (7 - (index & 7))) & 0xff;
        while (true) {
            if (value != 0) {
                return (byteIndex << 3) + 7 - Integer.numberOfTrailingZeros(value);
            }
            byteIndex--;
            if (byteIndex < 0) {
                return NO_BIT;
            }
            value = bits[byteIndex] & 0xff;
        }
    }

    /**
     * Find the set bit with the given zero-based position among all set bits.
     * @param bits the bit vector
     * @param position the rank of the bit to find
     * @return the index of the bit or {@link #NO_BIT} if fewer bits are set
     */
    public static int selectSetBit(@Nonnull byte[] bits, int position) {
        if (position < 0) {
            return NO_BIT;
        }
        int remaining = position;
        for (int i = 0; i < bits.length; i++) {
            int value = bits[i] & 0xff;
            int count = Integer.bitCount(value);
            if (remaining < count) {
                int index = i << 3;
                while (true) {
                    int next = nextSetBit(bits, index);
                    if (remaining == 0) {
                        return next;
                    }
                    remaining--;
                    index = next + 1;
                }
            }
            remaining -= count;
        }
        return NO_BIT;
    }

    @Nonnull
    public static byte[] and(@Nonnull byte[] a, @Nonnull byte[] b) {
        checkSameLength(a, b);
        byte[] result = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = (byte)(a[i] & b[i]);
        }
        return result;
    }

    @Nonnull
    public static byte[] or(@Nonnull byte[] a, @Nonnull byte[] b) {
        checkSameLength(a, b);
        byte[] result = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = (byte)(a[i] | b[i]);
        }
        return result;
    }

    @Nonnull
    public static byte[] andNot(@Nonnull byte[] a, @Nonnull byte[] b) {
        checkSameLength(a, b);
        byte[] result = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = (byte)(a[i] & ~b[i]);
        }
        return result;
    }

    @Nonnull
    public static byte[] xor(@Nonnull byte[] a, @Nonnull byte[] b) {
        checkSameLength(a, b);
        byte[] result = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = (byte)(a[i] ^ b[i]);
        }
        return result;
    }

    private static void checkSameLength(@Nonnull byte[] a, @Nonnull byte[] b) {
        Preconditions.checkArgument(a.length == b.length, "bit vectors differ in length: %s != %s", a.length, b.length);
    }

    /**
     * Write an unsigned big-endian integer of {@code width} bytes.
     * @param dest array to write into
     * @param pos position of the most significant byte
     * @param width number of bytes, between 1 and 8
     * @param value the value, which must fit in {@code width} bytes
     */
    public static void writeFixed(@Nonnull byte[] dest, int pos, int width, long value) {
        Preconditions.checkArgument(width >= 1 && width <= Long.BYTES, "width out of range: %s", width);
        Preconditions.checkPositionIndexes(pos, pos + width, dest.length);
        Preconditions.checkArgument(width == Long.BYTES || (value >>> (width * 8)) == 0,
                "value %s does not fit in %s bytes", value, width);
        long remaining = value;
        for (int i = pos + width - 1; i >= pos; i--) {
            dest[i] = (byte)remaining;
            remaining >>>= 8;
        }
    }

    /**
     * Read an unsigned big-endian integer of {@code width} bytes.
     * @param src array to read from
     * @param pos position of the most significant byte
     * @param width number of bytes, between 1 and 8
     * @return the value read
     */
    public static long readFixed(@Nonnull byte[] src, int pos, int width) {
        Preconditions.checkArgument(width >= 1 && width <= Long.BYTES, "width out of range: %s", width);
        Preconditions.checkPositionIndexes(pos, pos + width, src.length);
        long value = 0;
        for (int i = pos; i < pos + width; i++) {
            value = (value << 8) | (src[i] & 0xff);
        }
        return value;
    }
}
