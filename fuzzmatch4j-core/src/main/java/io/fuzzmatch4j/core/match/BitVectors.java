/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.match;

/** Word-array helpers for bit vectors wider than one {@code long}. Bit {@code i} lives in word {@code i >>> 6}. */
final class BitVectors {
    private BitVectors() {}

    static int words(int bits) {
        return (bits + Long.SIZE - 1) >>> 6;
    }

    /** All ones except the lowest {@code zeros} bits: {@code ~0 << zeros}. */
    static long[] onesShifted(int words, int zeros) {
        long[] v = new long[words];
        for (int k = 0; k < words; k++) {
            int lo = k * Long.SIZE;
            if (zeros >= lo + Long.SIZE) v[k] = 0L;
            else if (zeros <= lo) v[k] = ~0L;
            else v[k] = ~0L << (zeros - lo);
        }
        return v;
    }

    /** Word {@code k} of {@code v << 1}; the carry comes from the top bit of word {@code k - 1}. */
    static long shiftedWord(long[] v, int k) {
        return k == 0 ? v[0] << 1 : (v[k] << 1) | (v[k - 1] >>> 63);
    }

    static void clearBit(long[] v, int bit) {
        v[bit >>> 6] &= ~(1L << (bit & 63));
    }

    static boolean isClear(long[] v, int bit) {
        return (v[bit >>> 6] & (1L << (bit & 63))) == 0;
    }
}
