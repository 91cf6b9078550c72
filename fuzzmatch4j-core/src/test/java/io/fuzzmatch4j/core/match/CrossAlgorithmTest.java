/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.match;

import static org.junit.jupiter.api.Assertions.*;

import io.fuzzmatch4j.core.api.Matcher;
import io.fuzzmatch4j.core.api.model.Occurrence;
import io.fuzzmatch4j.core.distance.EditDistance;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Randomized agreement checks. The dynamic-programming matcher is the reference; the automaton and
 * bit-parallel matchers must return exactly the same list.
 */
public class CrossAlgorithmTest {

    private final Matcher sellers = new SellersMatcher();
    private final Matcher ukkonen = new UkkonenMatcher(new AutomatonCache(32));
    private final Matcher wuManber = new WuManberMatcher();

    /** Random bytes drawn from the first {@code alphabet} values, optionally shifted into the high range. */
    private static byte[] randomBytes(Random random, int size, int alphabet, int offset) {
        byte[] out = new byte[size];
        for (int i = 0; i < size; i++) out[i] = (byte) (offset + random.nextInt(alphabet));
        return out;
    }

    /** Text with a few mutated copies of the pattern planted in random filler. */
    private static byte[] plantedText(Random random, byte[] pattern, int alphabet, int offset) {
        var out = new ByteArrayOutputStream();
        for (int copy = 0; copy < 3; copy++) {
            out.writeBytes(randomBytes(random, random.nextInt(20), alphabet, offset));
            byte[] mutated = pattern.clone();
            int edits = random.nextInt(3);
            for (int e = 0; e < edits; e++) {
                mutated[random.nextInt(mutated.length)] = (byte) (offset + random.nextInt(alphabet));
            }
            out.writeBytes(mutated);
        }
        out.writeBytes(randomBytes(random, random.nextInt(10), alphabet, offset));
        return out.toByteArray();
    }

    @Nested
    class Agreement {

        @Test
        public void smallAlphabets() {
            Random random = new Random(42); // fixed seed for reproducible tests
            for (int trial = 0; trial < 300; trial++) {
                int alphabet = 2 + random.nextInt(3);
                byte[] pattern = randomBytes(random, 1 + random.nextInt(7), alphabet, 'a');
                byte[] text = plantedText(random, pattern, alphabet, 'a');
                int k = random.nextInt(pattern.length + 2);
                assertAllAgree(text, pattern, k);
            }
        }

        @Test
        public void fullByteRange() {
            Random random = new Random(7);
            for (int trial = 0; trial < 100; trial++) {
                byte[] pattern = randomBytes(random, 1 + random.nextInt(6), 256, 0);
                byte[] text = plantedText(random, pattern, 256, 0);
                assertAllAgree(text, pattern, random.nextInt(3));
            }
        }

        @Test
        public void negativeAndOversizedDistances() {
            Random random = new Random(99);
            for (int trial = 0; trial < 50; trial++) {
                byte[] pattern = randomBytes(random, 1 + random.nextInt(4), 3, 'x');
                byte[] text = plantedText(random, pattern, 3, 'x');
                assertAllAgree(text, pattern, -1 - random.nextInt(5));
                assertAllAgree(text, pattern, pattern.length + random.nextInt(5));
            }
        }

        private void assertAllAgree(byte[] text, byte[] pattern, int k) {
            List<Occurrence> expected = sellers.find(text, pattern, k);
            String where = "pattern=" + Arrays.toString(pattern) + " k=" + k + " text=" + Arrays.toString(text);
            assertEquals(expected, ukkonen.find(text, pattern, k), "ukkonen " + where);
            assertEquals(expected, wuManber.find(text, pattern, k), "wu-manber " + where);
        }
    }

    @Nested
    class Oracles {

        @Test
        public void exactSearchFindsEverySubstringMatch() {
            Random random = new Random(3);
            for (int trial = 0; trial < 100; trial++) {
                byte[] pattern = randomBytes(random, 1 + random.nextInt(3), 2, 'a');
                byte[] text = randomBytes(random, random.nextInt(40), 2, 'a');

                List<Occurrence> expected = new ArrayList<>();
                for (int end = pattern.length - 1; end < text.length; end++) {
                    int start = end - pattern.length + 1;
                    if (Arrays.equals(text, start, end + 1, pattern, 0, pattern.length)) {
                        expected.add(new Occurrence(end, 0));
                    }
                }
                assertEquals(expected, sellers.find(text, pattern, 0));
                assertEquals(expected, ukkonen.find(text, pattern, 0));
                assertEquals(expected, wuManber.find(text, pattern, 0));
            }
        }

        @Test
        public void distanceIsBestSubstringEndingThere() {
            Random random = new Random(11);
            for (int trial = 0; trial < 60; trial++) {
                byte[] pattern = randomBytes(random, 1 + random.nextInt(4), 3, 'a');
                byte[] text = randomBytes(random, random.nextInt(12), 3, 'a');
                int k = random.nextInt(pattern.length + 1);

                List<Occurrence> expected = new ArrayList<>();
                for (int end = 0; end < text.length; end++) {
                    int best = pattern.length; // the empty substring
                    for (int start = 0; start <= end; start++) {
                        best = Math.min(best, EditDistance.twoRow(Arrays.copyOfRange(text, start, end + 1), pattern));
                    }
                    if (best <= k) expected.add(new Occurrence(end, best));
                }
                assertEquals(expected, sellers.find(text, pattern, k));
                assertEquals(expected, wuManber.find(text, pattern, k));
            }
        }
    }
}
