/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.distance;

/**
 * Column transition for end-anchored approximate search.
 *
 * <p>{@code column[j]} is the smallest edit distance between the first {@code j} pattern bytes and
 * any suffix of the text read so far. Entry 0 is always 0, so a match may start anywhere.
 */
public final class DistanceColumns {
    /** Ceiling that never saturates; used by the plain dynamic-programming scan. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private DistanceColumns() {}

    /** Column before any text byte: {@code [0, 1, ..., p]}. */
    public static int[] initial(int patternLength) {
        int[] column = new int[patternLength + 1];
        for (int j = 0; j <= patternLength; j++) column[j] = j;
        return column;
    }

    /**
     * Fills {@code next} from {@code prev} after reading {@code b}. Every entry is capped at
     * {@code ceiling}; values above the bound are indistinguishable for matching purposes.
     *
     * @param prev    column before {@code b}, length {@code pattern.length + 1}
     * @param next    output column, same length, must not alias {@code prev}
     * @param b       text byte
     * @param pattern pattern bytes
     * @param ceiling saturation value, {@link #UNBOUNDED} for none
     */
    public static void advance(int[] prev, int[] next, byte b, byte[] pattern, int ceiling) {
        next[0] = 0;
        for (int j = 1; j <= pattern.length; j++) {
            int deletion = prev[j] + 1;
            int insertion = next[j - 1] + 1;
            int substitution = prev[j - 1] + EditCost.of(b, pattern[j - 1]);
            int d = Math.min(Math.min(deletion, insertion), substitution);
            next[j] = Math.min(d, ceiling);
        }
    }
}
