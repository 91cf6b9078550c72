/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.api;

import java.util.Objects;

/** Input checks shared by every {@link Matcher}. */
public final class Bounds {
    private Bounds() {}

    /** Rejects null arguments and the empty pattern. */
    public static void require(byte[] text, byte[] pattern) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.length == 0) throw new EmptyPatternException();
    }

    /**
     * Effective distance bound. No substring can be further than {@code patternLength} edits from the
     * pattern, and a negative request is treated as an exact search.
     */
    public static int clamp(int maxDistance, int patternLength) {
        return Math.min(Math.max(maxDistance, 0), patternLength);
    }
}
