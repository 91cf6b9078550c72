/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.match;

import io.fuzzmatch4j.core.api.Bounds;
import io.fuzzmatch4j.core.api.Matcher;
import io.fuzzmatch4j.core.api.model.MatcherType;
import io.fuzzmatch4j.core.api.model.Occurrence;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Wu-Manber extension of the shift-or (bitap) search to edit distance.
 *
 * <h3>Bit convention</h3>
 * A <b>0</b> bit at position {@code i} means "the first {@code i + 1} pattern bytes are aligned with
 * a suffix of the text read so far". {@code charMask[b]} is all ones except at pattern positions
 * holding {@code b}. Level {@code j} tracks alignments with at most {@code j} edits and starts as
 * {@code ~0 << j}: the first {@code j} pattern bytes can always be inserted for free.
 *
 * <h3>Update per text byte</h3>
 * <pre>
 * L0'  = (L0 &lt;&lt; 1) | C[b]
 * Lj'  = ((Lj &lt;&lt; 1) | C[b])   match
 *      &amp; (L(j-1)' &lt;&lt; 1)       deletion from the pattern
 *      &amp; (L(j-1) &lt;&lt; 1)        substitution
 *      &amp; L(j-1)               insertion into the pattern
 * </pre>
 * A match ends here when bit {@code p - 1} of the last level is 0. Lower levels are subsets of
 * higher ones, so the distance is {@code clamp + 1} minus the number of levels with that bit clear.
 *
 * <h3>Width</h3>
 * Patterns of at most {@value #WORD_BITS} bytes run on a single {@code long} per level. Longer
 * patterns use arrays of words with a carry-propagating shift, so pattern length is unbounded;
 * cost grows with {@code ceil(p / 64)}.
 */
public final class WuManberMatcher implements Matcher {
    static final int WORD_BITS = Long.SIZE;
    private static final int ALPHABET = 256;

    @Override
    public MatcherType type() {
        return MatcherType.WU_MANBER;
    }

    @Override
    public List<Occurrence> find(byte[] text, byte[] pattern, int maxDistance) {
        Bounds.require(text, pattern);
        int clamp = Bounds.clamp(maxDistance, pattern.length);
        return pattern.length <= WORD_BITS ? scanWord(text, pattern, clamp) : scanWords(text, pattern, clamp);
    }

    private static List<Occurrence> scanWord(byte[] text, byte[] pattern, int clamp) {
        final int p = pattern.length;
        long[] charMasks = new long[ALPHABET];
        Arrays.fill(charMasks, ~0L);
        for (int i = 0; i < p; i++) charMasks[pattern[i] & 0xff] &= ~(1L << i);
        final long matchMask = 1L << (p - 1);

        long[] levels = new long[clamp + 1];
        // Java masks the shift distance, so ~0L << 64 would be ~0L
        for (int j = 0; j <= clamp; j++) levels[j] = j >= WORD_BITS ? 0L : ~0L << j;

        List<Occurrence> out = new ArrayList<>();
        for (int i = 0; i < text.length; i++) {
            final long mask = charMasks[text[i] & 0xff];
            long previous = levels[0];
            levels[0] = (levels[0] << 1) | mask;
            for (int j = 1; j <= clamp; j++) {
                long old = levels[j];
                levels[j] = ((old << 1) | mask) & (levels[j - 1] << 1) & (previous << 1) & previous;
                previous = old;
            }
            if ((levels[clamp] & matchMask) == 0) {
                int matching = 0;
                for (long level : levels) {
                    if ((level & matchMask) == 0) matching++;
                }
                out.add(new Occurrence(i, clamp + 1 - matching));
            }
        }
        return out;
    }

    private static List<Occurrence> scanWords(byte[] text, byte[] pattern, int clamp) {
        final int p = pattern.length;
        final int w = BitVectors.words(p);
        final int matchBit = p - 1;

        long[][] charMasks = new long[ALPHABET][];
        long[] ones = BitVectors.onesShifted(w, 0);
        for (int b = 0; b < ALPHABET; b++) charMasks[b] = ones.clone();
        for (int i = 0; i < p; i++) BitVectors.clearBit(charMasks[pattern[i] & 0xff], i);

        long[][] levels = new long[clamp + 1][];
        for (int j = 0; j <= clamp; j++) levels[j] = BitVectors.onesShifted(w, j);
        long[] previous = new long[w];
        long[] saved = new long[w];

        List<Occurrence> out = new ArrayList<>();
        for (int i = 0; i < text.length; i++) {
            final long[] mask = charMasks[text[i] & 0xff];

            // words are rewritten high to low so each shift still reads the old lower word
            long[] first = levels[0];
            System.arraycopy(first, 0, previous, 0, w);
            for (int k = w - 1; k >= 0; k--) first[k] = BitVectors.shiftedWord(first, k) | mask[k];

            for (int j = 1; j <= clamp; j++) {
                long[] level = levels[j];
                long[] below = levels[j - 1];
                System.arraycopy(level, 0, saved, 0, w);
                for (int k = w - 1; k >= 0; k--) {
                    level[k] = (BitVectors.shiftedWord(level, k) | mask[k])
                            & BitVectors.shiftedWord(below, k)
                            & BitVectors.shiftedWord(previous, k)
                            & previous[k];
                }
                long[] t = previous;
                previous = saved;
                saved = t;
            }

            if (BitVectors.isClear(levels[clamp], matchBit)) {
                int matching = 0;
                for (long[] level : levels) {
                    if (BitVectors.isClear(level, matchBit)) matching++;
                }
                out.add(new Occurrence(i, clamp + 1 - matching));
            }
        }
        return out;
    }
}
