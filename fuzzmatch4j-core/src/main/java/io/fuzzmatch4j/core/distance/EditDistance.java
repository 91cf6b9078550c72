/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.distance;

import java.util.Objects;

/**
 * Levenshtein distance between two whole byte sequences (insertion, deletion and substitution, each
 * of cost 1).
 */
public final class EditDistance {
    private EditDistance() {}

    /**
     * Exhaustive recursion over every alignment. Exponential; only meant for inputs of a handful of
     * bytes, where it is an independent check of the table-based variants.
     */
    public static int exhaustive(byte[] a, byte[] b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return exhaustive(a, b, 0, 0);
    }

    private static int exhaustive(byte[] a, byte[] b, int i, int j) {
        if (i == a.length) return b.length - j;
        if (j == b.length) return a.length - i;
        int deletion = exhaustive(a, b, i + 1, j) + 1;
        int insertion = exhaustive(a, b, i, j + 1) + 1;
        int substitution = exhaustive(a, b, i + 1, j + 1) + EditCost.of(a[i], b[j]);
        return Math.min(Math.min(deletion, insertion), substitution);
    }

    /** Wagner-Fischer over the full {@code (n+1) x (m+1)} table. */
    public static int wagnerFischer(byte[] a, byte[] b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        int[][] d = new int[a.length + 1][b.length + 1];
        for (int i = 1; i <= a.length; i++) d[i][0] = i;
        for (int j = 1; j <= b.length; j++) d[0][j] = j;
        for (int i = 1; i <= a.length; i++) {
            for (int j = 1; j <= b.length; j++) {
                d[i][j] = Math.min(
                        Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + EditCost.of(a[i - 1], b[j - 1]));
            }
        }
        return d[a.length][b.length];
    }

    /**
     * Wagner-Fischer keeping two rows sized by the shorter input. {@code O(n*m)} time,
     * {@code O(min(n, m))} space.
     */
    public static int twoRow(byte[] a, byte[] b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.length < b.length) {
            byte[] t = a;
            a = b;
            b = t;
        }
        int[] prev = new int[b.length + 1];
        int[] next = new int[b.length + 1];
        for (int j = 0; j <= b.length; j++) prev[j] = j;
        for (int i = 1; i <= a.length; i++) {
            next[0] = i;
            for (int j = 1; j <= b.length; j++) {
                next[j] = Math.min(
                        Math.min(prev[j] + 1, next[j - 1] + 1), prev[j - 1] + EditCost.of(a[i - 1], b[j - 1]));
            }
            int[] t = prev;
            prev = next;
            next = t;
        }
        return prev[b.length];
    }
}
