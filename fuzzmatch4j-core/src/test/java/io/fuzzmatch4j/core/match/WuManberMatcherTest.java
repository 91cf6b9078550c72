/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.match;

import static org.junit.jupiter.api.Assertions.*;

import io.fuzzmatch4j.core.api.model.Occurrence;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class WuManberMatcherTest {

    private final WuManberMatcher matcher = new WuManberMatcher();
    private final SellersMatcher reference = new SellersMatcher();

    private static byte[] repeat(char c, int n) {
        byte[] out = new byte[n];
        Arrays.fill(out, (byte) c);
        return out;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 63, 64, 65, 127, 128, 129, 200})
    public void exactMatchAtEveryWidth(int length) {
        Random random = new Random(length);
        byte[] pattern = new byte[length];
        for (int i = 0; i < length; i++) pattern[i] = (byte) ('a' + random.nextInt(4));
        byte[] text = new byte[length + 20];
        Arrays.fill(text, (byte) 'z');
        System.arraycopy(pattern, 0, text, 10, length);

        List<Occurrence> found = matcher.find(text, pattern, 0);
        assertEquals(List.of(new Occurrence(10 + length - 1, 0)), found);
    }

    @ParameterizedTest
    @ValueSource(ints = {63, 64, 65, 128, 130})
    public void agreesWithReferenceAcrossWordBoundary(int length) {
        Random random = new Random(31L * length);
        for (int trial = 0; trial < 20; trial++) {
            byte[] pattern = new byte[length];
            for (int i = 0; i < length; i++) pattern[i] = (byte) ('a' + random.nextInt(3));
            byte[] text = new byte[2 * length + 30];
            for (int i = 0; i < text.length; i++) text[i] = (byte) ('a' + random.nextInt(3));
            // plant a copy with a couple of substitutions
            int at = random.nextInt(text.length - length);
            System.arraycopy(pattern, 0, text, at, length);
            text[at + random.nextInt(length)] = 'q';
            text[at + random.nextInt(length)] = 'q';

            for (int k : new int[] {0, 1, 2, 5}) {
                assertEquals(reference.find(text, pattern, k), matcher.find(text, pattern, k), "length=" + length + " k=" + k);
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {64, 65})
    public void clampEqualToWordWidth(int length) {
        // level 64 starts with every low bit cleared; Java would otherwise wrap the shift
        byte[] pattern = repeat('a', length);
        byte[] text = repeat('b', 3);
        List<Occurrence> found = matcher.find(text, pattern, length);
        assertEquals(reference.find(text, pattern, length), found);
        assertEquals(List.of(
                new Occurrence(0, length), new Occurrence(1, length), new Occurrence(2, length)), found);
    }

    @ParameterizedTest
    @ValueSource(ints = {64, 65, 100})
    public void deletionsAcrossWordBoundary(int length) {
        byte[] pattern = new byte[length];
        for (int i = 0; i < length; i++) pattern[i] = (byte) ('a' + i % 26);
        // drop the bytes straddling bit 63/64 from the text copy
        byte[] text = new byte[length - 2];
        System.arraycopy(pattern, 0, text, 0, 62);
        System.arraycopy(pattern, 64, text, 62, length - 64);

        List<Occurrence> found = matcher.find(text, pattern, 2);
        assertEquals(reference.find(text, pattern, 2), found);
        assertTrue(found.contains(new Occurrence(text.length - 1, 2)));
    }
}
