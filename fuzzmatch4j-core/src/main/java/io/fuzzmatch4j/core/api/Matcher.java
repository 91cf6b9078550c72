/*
 * Copyright (c) 2025 Fuzzmatch4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.fuzzmatch4j.core.api;

import io.fuzzmatch4j.core.api.model.MatcherType;
import io.fuzzmatch4j.core.api.model.Occurrence;
import java.util.List;

/**
 * Stateless approximate matcher. Returns every end offset in {@code text} at which some substring
 * is within {@code maxDistance} edits of {@code pattern}, together with the smallest such distance.
 *
 * <p>Implementations must agree with each other on every input. The effective bound is
 * {@code min(max(maxDistance, 0), pattern.length)}; see {@link Bounds#clamp(int, int)}.
 */
public interface Matcher {
    MatcherType type();

    /**
     * @param text        bytes to scan, may be empty
     * @param pattern     bytes to look for, must not be empty
     * @param maxDistance largest edit distance to report; negative values behave as 0
     * @return occurrences in ascending {@code endIndex} order, never null
     * @throws EmptyPatternException if {@code pattern} is empty
     */
    List<Occurrence> find(byte[] text, byte[] pattern, int maxDistance);
}
